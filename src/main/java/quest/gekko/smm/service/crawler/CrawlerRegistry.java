package quest.gekko.smm.service.crawler;

import java.util.List;
import java.util.Optional;

/** Platform-code lookup over the available crawlers. */
public class CrawlerRegistry {

    private final List<PlatformCrawler> crawlers;

    public CrawlerRegistry(List<PlatformCrawler> crawlers) {
        this.crawlers = List.copyOf(crawlers);
    }

    public Optional<PlatformCrawler> find(String platformCode) {
        return crawlers.stream()
                .filter(c -> c.platformCode().equals(platformCode))
                .findFirst();
    }
}
