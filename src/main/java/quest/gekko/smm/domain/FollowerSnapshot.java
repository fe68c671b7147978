package quest.gekko.smm.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Immutable observation of an account's follower count. The identity tag is copied
 * from the account at write time and never rewritten afterwards.
 */
@Entity
@Table(name = "follower_records")
@Getter @Setter
public class FollowerSnapshot {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "user_id", nullable = false)
    Long accountId;

    @Column(name = "platform_id", nullable = false)
    Long platformId;

    @Column(name = "user_identity", nullable = false)
    String identityTag = Account.DEFAULT_IDENTITY_TAG;

    @Column(name = "follower_count", nullable = false)
    long followerCount;

    @Column(name = "record_time", nullable = false)
    LocalDateTime recordTime;

    @Column(nullable = false)
    SnapshotStatus status = SnapshotStatus.SUCCESS;

    @Column(name = "error_message")
    String errorMessage;

    @Column(name = "created_at", nullable = false)
    LocalDateTime createdAt = LocalDateTime.now();
}
