package quest.gekko.smm.repository;

import org.springframework.data.jpa.domain.Specification;
import quest.gekko.smm.domain.FollowerSnapshot;

import java.time.LocalDateTime;
import java.util.Collection;

/** Composable filters for follower snapshot queries; a null argument means "no filter". */
public final class SnapshotSpecifications {

    private SnapshotSpecifications() {}

    public static Specification<FollowerSnapshot> forAccount(Long accountId) {
        return (root, query, cb) -> accountId == null ? null : cb.equal(root.get("accountId"), accountId);
    }

    public static Specification<FollowerSnapshot> onPlatform(Long platformId) {
        return (root, query, cb) -> platformId == null ? null : cb.equal(root.get("platformId"), platformId);
    }

    public static Specification<FollowerSnapshot> onPlatforms(Collection<Long> platformIds) {
        return (root, query, cb) -> platformIds == null || platformIds.isEmpty()
                ? null
                : root.get("platformId").in(platformIds);
    }

    public static Specification<FollowerSnapshot> taggedAs(String identityTag) {
        return (root, query, cb) -> identityTag == null ? null : cb.equal(root.get("identityTag"), identityTag);
    }

    public static Specification<FollowerSnapshot> recordedFrom(LocalDateTime from) {
        return (root, query, cb) -> from == null
                ? null
                : cb.greaterThanOrEqualTo(root.<LocalDateTime>get("recordTime"), from);
    }

    public static Specification<FollowerSnapshot> recordedUntil(LocalDateTime to) {
        return (root, query, cb) -> to == null
                ? null
                : cb.lessThanOrEqualTo(root.<LocalDateTime>get("recordTime"), to);
    }
}
