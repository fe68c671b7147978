package quest.gekko.smm.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.DynamicUpdate;

import java.time.LocalDateTime;

/**
 * One daily crawl task per platform, named {@code <code>_follower_crawler}. The scheduler tick
 * and the task run write different columns of the same row concurrently, so updates only carry
 * the columns that changed.
 */
@Entity
@DynamicUpdate
@Table(name = "schedule_tasks")
@Getter @Setter
public class CrawlTask {
    public static final String NAME_SUFFIX = "_follower_crawler";

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "task_name", nullable = false, unique = true)
    String taskName;

    @Column(name = "platform_id", nullable = false)
    Long platformId;

    /** Local wall-clock time "HH:MM". */
    @Column(name = "schedule_time", nullable = false)
    String scheduleTime;

    @Column(name = "is_enabled", nullable = false)
    boolean enabled = true;

    @Column(name = "last_run_time")
    LocalDateTime lastRunTime;

    @Column(name = "next_run_time")
    LocalDateTime nextRunTime;

    @Column(name = "retry_count", nullable = false)
    int retryCount;

    @Column(name = "max_retry", nullable = false)
    int maxRetry = 3;

    @Column(nullable = false)
    TaskStatus status = TaskStatus.IDLE;

    @Column(name = "created_at", nullable = false)
    LocalDateTime createdAt = LocalDateTime.now();

    @Column(name = "updated_at", nullable = false)
    LocalDateTime updatedAt = LocalDateTime.now();

    public static String nameFor(String platformCode) {
        return platformCode + NAME_SUFFIX;
    }
}
