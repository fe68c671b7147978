package quest.gekko.smm.service.credential;

import java.time.LocalDateTime;

/** Credential metadata; the token itself is never listed. */
public record StoredCredential(String platform, LocalDateTime createdAt, LocalDateTime updatedAt) {}
