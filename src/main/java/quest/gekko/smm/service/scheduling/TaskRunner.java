package quest.gekko.smm.service.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import quest.gekko.smm.config.MonitorProperties;
import quest.gekko.smm.domain.Account;
import quest.gekko.smm.domain.CrawlTask;
import quest.gekko.smm.domain.Platform;
import quest.gekko.smm.domain.TaskStatus;
import quest.gekko.smm.service.core.MonitorStore;
import quest.gekko.smm.service.crawler.AccountSnapshot;
import quest.gekko.smm.service.crawler.CrawlerRegistry;
import quest.gekko.smm.service.crawler.FetchException;
import quest.gekko.smm.service.crawler.PlatformCrawler;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Executes one firing of a crawl task. Targets are fetched one after another on the calling
 * thread; a failed target is counted and skipped, while a fault of the whole batch feeds the
 * task's retry counter. At most one execution per task runs at a time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskRunner {

    private final MonitorStore store;
    private final CrawlerRegistry crawlerRegistry;
    private final MonitorProperties properties;
    private final Clock clock;

    private final ConcurrentMap<Long, ReentrantLock> taskLocks = new ConcurrentHashMap<>();

    public RunResult run(Long taskId, TriggerSource source) {
        CrawlTask task = store.findTask(taskId)
                .orElseThrow(() -> new TaskNotFoundException(String.valueOf(taskId)));
        if (!task.isEnabled() && source != TriggerSource.MANUAL) {
            log.info("Task {} is disabled, skipping {} run", task.getTaskName(), source);
            if (source == TriggerSource.RETRY) {
                // the retry chain ends here
                store.updateTaskStatus(taskId, TaskStatus.FAILED, null, null, null);
                task.setStatus(TaskStatus.FAILED);
            }
            return RunResult.skipped(task);
        }

        ReentrantLock lock = taskLocks.computeIfAbsent(taskId, id -> new ReentrantLock());
        if (!lock.tryLock()) {
            throw new TaskAlreadyRunningException(task.getTaskName());
        }
        try {
            return execute(task, source);
        } finally {
            lock.unlock();
        }
    }

    public boolean isRunning(Long taskId) {
        ReentrantLock lock = taskLocks.get(taskId);
        return lock != null && lock.isLocked();
    }

    private RunResult execute(CrawlTask task, TriggerSource source) {
        LocalDateTime start = LocalDateTime.now(clock);
        Long logId = store.openRunLog(task.getId(), start);
        store.updateTaskStatus(task.getId(), TaskStatus.RUNNING, null, null, null);
        log.info("Task {} started ({}, attempt {})", task.getTaskName(), source, task.getRetryCount() + 1);

        int attempted = 0;
        int succeeded = 0;
        int failed = 0;
        try {
            Platform platform = store.findPlatform(task.getPlatformId())
                    .orElseThrow(() -> new IllegalStateException("Unknown platform id " + task.getPlatformId()));
            PlatformCrawler crawler = crawlerRegistry.find(platform.getCode())
                    .orElseThrow(() -> new IllegalStateException("No crawler registered for platform " + platform.getCode()));

            List<String> targets = resolveTargets(platform);
            attempted = targets.size();
            if (targets.isEmpty()) {
                log.warn("Task {} has no targets configured or registered", task.getTaskName());
            }
            for (String target : targets) {
                AccountSnapshot fetched;
                try {
                    fetched = crawler.fetchAccount(target);
                } catch (FetchException e) {
                    failed++;
                    log.warn("Task {}: target {} failed ({}): {}", task.getTaskName(), target, e.getReason(), e.getMessage());
                    continue;
                } catch (RuntimeException e) {
                    // a crawler bug stays confined to its target
                    failed++;
                    log.error("Task {}: target {} failed unexpectedly", task.getTaskName(), target, e);
                    continue;
                }
                store.recordObservation(platform, fetched, LocalDateTime.now(clock));
                succeeded++;
                log.info("Task {}: {} has {} followers (following {}, posts {}, verified {})", task.getTaskName(),
                        target, fetched.followerCount(), fetched.followingCount(), fetched.postCount(), fetched.verified());
            }
        } catch (RuntimeException e) {
            return batchFault(task, logId, attempted, succeeded, failed, e);
        }

        TaskStatus status = TaskStatus.ofBatch(succeeded, failed);
        LocalDateTime end = LocalDateTime.now(clock);
        store.closeRunLog(logId, end, status, attempted, succeeded, failed, null);
        store.updateTaskStatus(task.getId(), status, end, null, 0);
        log.info("Task {} finished: {} ({} ok, {} failed of {})",
                task.getTaskName(), status.code(), succeeded, failed, attempted);
        return new RunResult(task.getId(), task.getTaskName(), logId, status,
                attempted, succeeded, failed, 0, false, false, null);
    }

    private RunResult batchFault(CrawlTask task, Long logId, int attempted, int succeeded, int failed, RuntimeException e) {
        LocalDateTime end = LocalDateTime.now(clock);
        String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        int retryCount = task.getRetryCount() + 1;
        boolean retry = retryCount <= task.getMaxRetry();
        TaskStatus status = retry ? TaskStatus.RETRYING : TaskStatus.FAILED;

        store.closeRunLog(logId, end, TaskStatus.FAILED, attempted, succeeded, failed, error);
        store.updateTaskStatus(task.getId(), status, end, null, retryCount);
        if (retry) {
            log.error("Task {} failed (retry {}/{}): {}", task.getTaskName(), retryCount, task.getMaxRetry(), error, e);
        } else {
            log.error("Task {} failed, retries exhausted after {} attempt(s): {}", task.getTaskName(), retryCount, error, e);
        }
        return new RunResult(task.getId(), task.getTaskName(), logId, status,
                attempted, succeeded, failed, retryCount, retry, false, error);
    }

    /** Configured targets first, then active registered accounts, without duplicates. */
    List<String> resolveTargets(Platform platform) {
        Set<String> targets = new LinkedHashSet<>();
        for (String target : properties.platform(platform.getCode()).getTargets()) {
            if (StringUtils.hasText(target)) {
                targets.add(target.trim());
            }
        }
        for (Account account : store.listActiveAccounts(platform.getId())) {
            targets.add(account.getNativeId());
        }
        return List.copyOf(targets);
    }
}
