package quest.gekko.smm.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/** Platform lookups by code. The platform rows never change after seeding. */
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String PLATFORMS = "platforms";

    @Bean
    public CacheManager cacheManager() {
        final CaffeineCacheManager cacheManager = new CaffeineCacheManager(PLATFORMS);
        cacheManager.setAllowNullValues(false);
        cacheManager.setCaffeine(Caffeine.newBuilder()
                .maximumSize(16)
                .expireAfterAccess(Duration.ofHours(1)));
        return cacheManager;
    }
}
