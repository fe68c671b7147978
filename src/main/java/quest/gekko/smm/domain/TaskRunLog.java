package quest.gekko.smm.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

@Entity
@Table(name = "task_logs")
@Getter @Setter
public class TaskRunLog {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "task_id", nullable = false)
    Long taskId;

    @Column(name = "start_time", nullable = false)
    LocalDateTime startTime;

    @Column(name = "end_time")
    LocalDateTime endTime;

    @Column(nullable = false)
    TaskStatus status = TaskStatus.RUNNING;

    @Column(name = "records_count", nullable = false)
    int recordsCount;

    @Column(name = "success_count", nullable = false)
    int successCount;

    @Column(name = "failed_count", nullable = false)
    int failedCount;

    @Column(name = "error_message")
    String errorMessage;

    @Column(name = "created_at", nullable = false)
    LocalDateTime createdAt = LocalDateTime.now();
}
