package quest.gekko.smm.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the monitor, bound from the {@code monitor.*} namespace.
 */
@Data
@ConfigurationProperties(prefix = "monitor")
public class MonitorProperties {

    /** Directory holding the database files and logs. */
    private String dataDir = "data";

    private Credentials credentials = new Credentials();
    private Schedule schedule = new Schedule();
    private Http http = new Http();

    /** Per-platform settings keyed by platform code (weibo, xiaohongshu, douyin). */
    private Map<String, PlatformSettings> platforms = new LinkedHashMap<>();

    public PlatformSettings platform(String code) {
        PlatformSettings settings = platforms.get(code);
        return settings != null ? settings : new PlatformSettings();
    }

    @Data
    public static class Credentials {
        /** JDBC URL of the credential database, kept apart from the main store. */
        private String url = "jdbc:h2:file:./data/cookies";
    }

    @Data
    public static class Schedule {
        /** HH:MM used when seeding a task for the first time. */
        private String defaultTime = "23:59";
        private boolean autoStart = false;
        private Duration retryDelay = Duration.ofSeconds(60);
        private Duration stopTimeout = Duration.ofSeconds(5);
        private Duration tickInterval = Duration.ofSeconds(1);
        private int poolSize = 3;
        private int maxRetry = 3;
    }

    @Data
    public static class Http {
        private Duration timeout = Duration.ofSeconds(30);
        private int maxAttempts = 3;
        private DataSize maxInMemorySize = DataSize.ofMegabytes(4);
    }

    @Data
    public static class PlatformSettings {
        /** Fallback credential used when neither the caller nor the credential store supplies one. */
        private String credential = "";
        /** Targets crawled by the scheduled task in addition to registered accounts. */
        private List<String> targets = new ArrayList<>();
        /** Pause after every request to this platform. */
        private Duration delay = Duration.ofSeconds(2);
        /** Overrides the platform's public base URL. */
        private String baseUrl;
    }
}
