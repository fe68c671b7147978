package quest.gekko.smm.service.crawler;

import quest.gekko.smm.domain.FollowerSnapshot;

/** The stored snapshot of an ad-hoc crawl together with what the platform reported. */
public record CrawlOutcome(FollowerSnapshot snapshot, AccountSnapshot account) {
}
