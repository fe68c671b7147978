package quest.gekko.smm.service.core;

import lombok.Builder;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Filters for {@link MonitorStore#querySnapshots}. Null fields are ignored; a single
 * {@code platformId} takes precedence over {@code platformIds}.
 */
@Builder
public record SnapshotQuery(Long accountId,
                            Long platformId,
                            List<Long> platformIds,
                            String identityTag,
                            LocalDateTime from,
                            LocalDateTime to,
                            Integer limit) {

    public static final int DEFAULT_LIMIT = 100;

    public int effectiveLimit() {
        return limit == null || limit <= 0 ? DEFAULT_LIMIT : limit;
    }
}
