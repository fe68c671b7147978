package quest.gekko.smm.service.crawler;

/**
 * Normalized result of a fetch. The extras (following, posts, verified, avatar) are
 * platform-dependent and may be null.
 */
public record AccountSnapshot(String nativeId,
                              String displayName,
                              long followerCount,
                              Long followingCount,
                              Long postCount,
                              Boolean verified,
                              String avatarUrl) {

    public AccountSnapshot {
        if (nativeId == null || nativeId.isBlank()) {
            throw new IllegalArgumentException("nativeId must not be blank");
        }
        if (followerCount < 0) {
            throw new IllegalArgumentException("followerCount must not be negative");
        }
        if (displayName == null) displayName = "";
    }
}
