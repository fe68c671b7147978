package quest.gekko.smm.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import quest.gekko.smm.service.crawler.CrawlerRegistry;
import quest.gekko.smm.service.crawler.PlatformCrawler;

import java.util.List;

@Configuration
public class CrawlerConfig {

    @Bean
    public CrawlerRegistry crawlerRegistry(List<PlatformCrawler> crawlers) {
        return new CrawlerRegistry(crawlers);
    }

    /** Used for retry back-off and the inter-request delay. */
    @Bean
    public Sleeper crawlerSleeper() {
        return new ThreadWaitSleeper();
    }
}
