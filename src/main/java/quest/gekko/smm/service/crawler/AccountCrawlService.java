package quest.gekko.smm.service.crawler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import quest.gekko.smm.domain.FollowerSnapshot;
import quest.gekko.smm.domain.Platform;
import quest.gekko.smm.service.core.MonitorStore;

import java.time.Clock;
import java.time.LocalDateTime;

/** One-off crawl of a single account outside any task. */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountCrawlService {

    private final CrawlerRegistry crawlerRegistry;
    private final MonitorStore store;
    private final Clock clock;

    public CrawlOutcome crawlAccount(String platformCode, String target, String credential) throws FetchException {
        Platform platform = store.findPlatformByCode(platformCode)
                .orElseThrow(() -> new IllegalArgumentException("Unknown platform: " + platformCode));
        PlatformCrawler crawler = crawlerRegistry.find(platformCode)
                .orElseThrow(() -> new IllegalArgumentException("No crawler for platform: " + platformCode));
        if (StringUtils.hasText(credential)) {
            crawler = crawler.withCredential(credential);
        }

        AccountSnapshot fetched = crawler.fetchAccount(target);
        FollowerSnapshot snapshot = store.recordObservation(platform, fetched, LocalDateTime.now(clock));
        log.info("Crawled {} account {}: {} followers (following {}, posts {}, verified {})", platformCode,
                fetched.nativeId(), fetched.followerCount(), fetched.followingCount(), fetched.postCount(), fetched.verified());
        return new CrawlOutcome(snapshot, fetched);
    }
}
