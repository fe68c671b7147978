package quest.gekko.smm.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import quest.gekko.smm.config.MonitorProperties;
import quest.gekko.smm.domain.Platform;
import quest.gekko.smm.service.scheduling.CrawlTaskScheduler;

import java.util.List;

/** Seeds the platform registry and one task per platform, then optionally starts the scheduler. */
@Slf4j
@Component
@RequiredArgsConstructor
public class MonitorInitializer implements ApplicationRunner {

    static final List<PlatformSeed> PLATFORMS = List.of(
            new PlatformSeed("微博", "weibo", "新浪微博"),
            new PlatformSeed("小红书", "xiaohongshu", "小红书"),
            new PlatformSeed("抖音", "douyin", "抖音短视频")
    );

    private final MonitorStore store;
    private final CrawlTaskScheduler scheduler;
    private final MonitorProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        MonitorProperties.Schedule schedule = properties.getSchedule();
        for (PlatformSeed seed : PLATFORMS) {
            Platform platform = store.ensurePlatform(seed.name(), seed.code(), seed.description());
            store.ensureTask(platform, schedule.getDefaultTime(), schedule.getMaxRetry());
        }
        log.info("Monitoring {} platform(s), data in {}", PLATFORMS.size(), properties.getDataDir());

        if (schedule.isAutoStart()) {
            scheduler.start();
        }
    }

    record PlatformSeed(String name, String code, String description) {}
}
