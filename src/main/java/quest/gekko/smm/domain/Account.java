package quest.gekko.smm.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * A monitored account, unique per platform and native id. The identity tag is a
 * user-assigned category ("0" when unset) stamped onto every snapshot.
 */
@Entity
@Table(name = "users", uniqueConstraints = @UniqueConstraint(columnNames = { "platform_id", "user_id" }))
@Getter @Setter
public class Account {
    public static final String DEFAULT_IDENTITY_TAG = "0";

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "platform_id", nullable = false)
    Long platformId;

    @Column(name = "user_id", nullable = false)
    String nativeId;

    @Column(name = "username")
    String displayName;

    @Column(name = "user_identity", nullable = false)
    String identityTag = DEFAULT_IDENTITY_TAG;

    String avatar;

    @Column(name = "is_active", nullable = false)
    boolean active = true;

    @Column(name = "created_at", nullable = false)
    LocalDateTime createdAt = LocalDateTime.now();

    @Column(name = "updated_at", nullable = false)
    LocalDateTime updatedAt = LocalDateTime.now();
}
