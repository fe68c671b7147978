package quest.gekko.smm.service.scheduling;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Service;
import quest.gekko.smm.config.MonitorProperties;
import quest.gekko.smm.domain.CrawlTask;
import quest.gekko.smm.domain.TaskRunLog;
import quest.gekko.smm.domain.TaskStatus;
import quest.gekko.smm.service.core.MonitorStore;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.concurrent.ScheduledFuture;

/**
 * Runs every enabled task once a day at its local {@code HH:MM}. A tick checks the task
 * registry about once a second and hands due tasks to worker threads. Retries after a
 * whole-batch fault go to a separate executor that lives as long as the bean, so manual runs
 * get their retries while the loop is stopped; {@link #stop()} cancels whatever is queued.
 * The registry and the pending retries are guarded by {@code registryLock}.
 */
@Slf4j
@Service
public class CrawlTaskScheduler {

    static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    private final MonitorStore store;
    private final TaskRunner taskRunner;
    private final MonitorProperties properties;
    private final Clock clock;

    private final Object registryLock = new Object();
    private final Map<Long, Registration> registry = new LinkedHashMap<>();
    private final Map<Long, PendingRetry> pendingRetries = new HashMap<>();
    private final ThreadPoolTaskScheduler retryExecutor;
    private long retrySequence;
    private volatile ThreadPoolTaskScheduler executor;
    private ScheduledFuture<?> tickFuture;

    public CrawlTaskScheduler(MonitorStore store, TaskRunner taskRunner, MonitorProperties properties, Clock clock) {
        this.store = store;
        this.taskRunner = taskRunner;
        this.properties = properties;
        this.clock = clock;
        this.retryExecutor = newExecutor("crawl-retry-", properties.getSchedule().getPoolSize());
    }

    private static ThreadPoolTaskScheduler newExecutor(String threadNamePrefix, int poolSize) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix(threadNamePrefix);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setErrorHandler(t -> log.error("Unhandled error on scheduler thread", t));
        scheduler.initialize();
        return scheduler;
    }

    public boolean start() {
        synchronized (registryLock) {
            if (executor != null) {
                log.info("Scheduler already running");
                return false;
            }
            MonitorProperties.Schedule schedule = properties.getSchedule();
            // one thread for the tick, the rest for task runs
            ThreadPoolTaskScheduler scheduler = newExecutor("crawl-scheduler-", schedule.getPoolSize() + 1);
            scheduler.setAwaitTerminationMillis(schedule.getStopTimeout().toMillis());
            executor = scheduler;

            registerEnabledTasks();
            tickFuture = scheduler.scheduleWithFixedDelay(this::tick, schedule.getTickInterval());
            log.info("Scheduler started with {} task(s)", registry.size());
        }
        return true;
    }

    /**
     * Stops triggering and cancels queued retries, also those queued while the loop was not
     * running. A run already in progress is not interrupted; this waits for it up to the
     * configured stop timeout.
     *
     * @return whether the loop was running
     */
    public boolean stop() {
        ThreadPoolTaskScheduler scheduler;
        synchronized (registryLock) {
            pendingRetries.forEach((taskId, pending) -> {
                pending.future().cancel(false);
                store.updateTaskStatus(taskId, TaskStatus.FAILED, null, null, null);
                log.warn("Cancelled pending retry of task {}", taskId);
            });
            pendingRetries.clear();

            scheduler = executor;
            if (scheduler == null) {
                return false;
            }
            executor = null;
            if (tickFuture != null) {
                tickFuture.cancel(false);
                tickFuture = null;
            }
            registry.clear();
        }
        scheduler.shutdown();
        log.info("Scheduler stopped");
        return true;
    }

    @PreDestroy
    public void shutdown() {
        stop();
        retryExecutor.shutdown();
    }

    public boolean isRunning() {
        return executor != null;
    }

    /** Runs the task on the calling thread, ignoring its schedule and enabled flag. */
    public RunResult runNow(String taskName) {
        CrawlTask task = store.findTaskByName(taskName)
                .orElseThrow(() -> new TaskNotFoundException(taskName));
        log.info("Manual run of task {}", taskName);
        RunResult result = taskRunner.run(task.getId(), TriggerSource.MANUAL);
        if (result.retryRequested()) {
            scheduleRetry(task.getId(), taskName);
        }
        return result;
    }

    /** Runs every enabled task immediately, one after another. */
    public List<RunResult> runAll() {
        List<RunResult> results = new ArrayList<>();
        for (CrawlTask task : store.listEnabledTasks()) {
            try {
                results.add(runNow(task.getTaskName()));
            } catch (TaskAlreadyRunningException e) {
                log.warn("Skipping {}: {}", task.getTaskName(), e.getMessage());
            }
        }
        return results;
    }

    /**
     * Persists the new time (and enabled flag when given). While running, all enabled tasks
     * are re-registered under the registry lock, so no tick sees a half-updated schedule.
     */
    public CrawlTask updateTaskSchedule(String taskName, String scheduleTime, Boolean enabled) {
        String normalized = parseTime(scheduleTime).format(HH_MM);
        store.findTaskByName(taskName).orElseThrow(() -> new TaskNotFoundException(taskName));
        synchronized (registryLock) {
            CrawlTask updated = store.updateTaskSchedule(taskName, normalized, enabled);
            if (executor != null) {
                registry.clear();
                registerEnabledTasks();
            }
            return updated;
        }
    }

    public SchedulerStatus getStatus() {
        Set<Long> retrying;
        synchronized (registryLock) {
            retrying = new HashSet<>(pendingRetries.keySet());
        }
        List<SchedulerStatus.TaskView> tasks = store.listTasks().stream()
                .map(task -> new SchedulerStatus.TaskView(
                        task.getId(),
                        task.getTaskName(),
                        task.isEnabled(),
                        task.getScheduleTime(),
                        task.getStatus(),
                        task.getLastRunTime(),
                        task.getNextRunTime(),
                        task.getRetryCount(),
                        task.getMaxRetry(),
                        store.latestRunLog(task.getId()).map(TaskRunLog::getStatus).orElse(null),
                        retrying.contains(task.getId())))
                .toList();
        return new SchedulerStatus(isRunning(), tasks);
    }

    void tick() {
        try {
            LocalDateTime now = LocalDateTime.now(clock);
            List<Registration> due = new ArrayList<>();
            synchronized (registryLock) {
                ThreadPoolTaskScheduler scheduler = executor;
                if (scheduler == null) {
                    return;
                }
                for (Registration registration : registry.values()) {
                    if (!now.isBefore(registration.nextFire)) {
                        registration.nextFire = nextFire(registration.time, now);
                        due.add(registration);
                        scheduler.execute(() -> fire(registration.taskId, TriggerSource.SCHEDULED));
                    }
                }
            }
            for (Registration registration : due) {
                log.info("Task {} triggered, next run at {}", registration.taskName, registration.nextFire);
                store.updateTaskStatus(registration.taskId, null, null, registration.nextFire, null);
            }
        } catch (RuntimeException e) {
            log.error("Scheduler tick failed", e);
        }
    }

    private void fire(Long taskId, TriggerSource source) {
        try {
            RunResult result = taskRunner.run(taskId, source);
            if (result.retryRequested()) {
                scheduleRetry(taskId, result.taskName());
            }
        } catch (TaskAlreadyRunningException e) {
            log.warn("Skipping {} run: {}", source, e.getMessage());
        } catch (RuntimeException e) {
            log.error("{} run of task {} failed", source, taskId, e);
        }
    }

    private void scheduleRetry(Long taskId, String taskName) {
        Duration delay = properties.getSchedule().getRetryDelay();
        synchronized (registryLock) {
            long sequence = ++retrySequence;
            ScheduledFuture<?> future;
            try {
                future = retryExecutor.schedule(() -> {
                    synchronized (registryLock) {
                        PendingRetry pending = pendingRetries.get(taskId);
                        // cancelled by stop() or replaced by a newer retry
                        if (pending == null || pending.sequence() != sequence) {
                            return;
                        }
                        pendingRetries.remove(taskId);
                    }
                    fire(taskId, TriggerSource.RETRY);
                }, retryExecutor.getClock().instant().plus(delay));
            } catch (TaskRejectedException e) {
                store.updateTaskStatus(taskId, TaskStatus.FAILED, null, null, null);
                log.warn("Retry of task {} rejected during shutdown; task marked failed", taskName, e);
                return;
            }
            PendingRetry previous = pendingRetries.put(taskId, new PendingRetry(sequence, future));
            if (previous != null) {
                previous.future().cancel(false);
            }
            log.warn("Task {} will be retried in {} ms", taskName, delay.toMillis());
        }
    }

    // caller holds registryLock
    private void registerEnabledTasks() {
        LocalDateTime now = LocalDateTime.now(clock);
        for (CrawlTask task : store.listEnabledTasks()) {
            LocalTime time;
            try {
                time = parseTime(task.getScheduleTime());
            } catch (IllegalArgumentException e) {
                log.error("Task {} has an invalid schedule time '{}', not scheduled", task.getTaskName(), task.getScheduleTime());
                continue;
            }
            Registration registration = new Registration(task.getId(), task.getTaskName(), time, nextFire(time, now));
            registry.put(task.getId(), registration);
            store.updateTaskStatus(task.getId(), null, null, registration.nextFire, null);
            log.info("Registered task {} daily at {} (next {})", task.getTaskName(), task.getScheduleTime(), registration.nextFire);
        }
    }

    /** Registered task ids mapped to their next fire time. */
    Map<Long, LocalDateTime> registrations() {
        synchronized (registryLock) {
            Map<Long, LocalDateTime> copy = new LinkedHashMap<>();
            registry.forEach((id, registration) -> copy.put(id, registration.nextFire));
            return copy;
        }
    }

    boolean isRetryPending(Long taskId) {
        synchronized (registryLock) {
            return pendingRetries.containsKey(taskId);
        }
    }

    static LocalDateTime nextFire(LocalTime time, LocalDateTime now) {
        LocalDateTime candidate = now.toLocalDate().atTime(time);
        return candidate.isAfter(now) ? candidate : candidate.plusDays(1);
    }

    static LocalTime parseTime(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Schedule time is required (HH:MM)");
        }
        try {
            return LocalTime.parse(value.trim(), HH_MM);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid schedule time '" + value + "', expected HH:MM", e);
        }
    }

    private record PendingRetry(long sequence, ScheduledFuture<?> future) {}

    private static final class Registration {
        private final Long taskId;
        private final String taskName;
        private final LocalTime time;
        private LocalDateTime nextFire;

        private Registration(Long taskId, String taskName, LocalTime time, LocalDateTime nextFire) {
            this.taskId = taskId;
            this.taskName = taskName;
            this.time = time;
            this.nextFire = nextFire;
        }
    }
}
