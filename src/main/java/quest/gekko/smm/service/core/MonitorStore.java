package quest.gekko.smm.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import quest.gekko.smm.config.CacheConfig;
import quest.gekko.smm.domain.*;
import quest.gekko.smm.repository.*;
import quest.gekko.smm.service.crawler.AccountSnapshot;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static quest.gekko.smm.repository.SnapshotSpecifications.*;

/**
 * The only writer of platforms, accounts, snapshots, tasks and run logs.
 * Every public method runs in its own transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class MonitorStore {

    private final PlatformRepository platformRepository;
    private final AccountRepository accountRepository;
    private final FollowerSnapshotRepository snapshotRepository;
    private final CrawlTaskRepository taskRepository;
    private final TaskRunLogRepository runLogRepository;

    // ---- Platforms ----

    public List<Platform> listPlatforms() {
        return platformRepository.findAllByOrderByIdAsc();
    }

    @Cacheable(value = CacheConfig.PLATFORMS, key = "#code", unless = "#result == null")
    public Optional<Platform> findPlatformByCode(String code) {
        return platformRepository.findByCode(code);
    }

    public Optional<Platform> findPlatform(Long id) {
        return platformRepository.findById(id);
    }

    @Transactional
    public Platform ensurePlatform(String name, String code, String description) {
        return platformRepository.findByCode(code).orElseGet(() -> {
            Platform platform = new Platform();
            platform.setName(name);
            platform.setCode(code);
            platform.setDescription(description);
            log.info("Seeded platform {} ({})", code, name);
            return platformRepository.save(platform);
        });
    }

    // ---- Accounts ----

    public List<Account> listAccounts(Long platformId) {
        return platformId == null
                ? accountRepository.findAllByOrderByIdAsc()
                : accountRepository.findByPlatformIdOrderByIdAsc(platformId);
    }

    public List<Account> listActiveAccounts(Long platformId) {
        return accountRepository.findByPlatformIdAndActiveTrueOrderByIdAsc(platformId);
    }

    public Optional<Account> findAccount(Long accountId) {
        return accountRepository.findById(accountId);
    }

    public Optional<Account> findAccount(Long platformId, String nativeId) {
        return accountRepository.findByPlatformIdAndNativeId(platformId, nativeId);
    }

    @Transactional
    public Long upsertAccount(Long platformId, String nativeId, String displayName, String identityTag) {
        return upsertAccount(platformId, nativeId, displayName, identityTag, null).getId();
    }

    /**
     * Inserts the account if absent. An existing row only takes the non-blank values
     * supplied, so a blank name, tag or avatar never overwrites a stored one.
     */
    @Transactional
    public Account upsertAccount(Long platformId, String nativeId, String displayName,
                                 String identityTag, String avatar) {
        requirePlatform(platformId);
        if (!StringUtils.hasText(nativeId)) {
            throw new IllegalArgumentException("Native account id must not be blank");
        }
        LocalDateTime now = LocalDateTime.now();
        return accountRepository.findByPlatformIdAndNativeId(platformId, nativeId)
                .map(existing -> {
                    if (StringUtils.hasText(displayName)) existing.setDisplayName(displayName);
                    if (StringUtils.hasText(identityTag)) existing.setIdentityTag(identityTag);
                    if (StringUtils.hasText(avatar)) existing.setAvatar(avatar);
                    existing.setUpdatedAt(now);
                    return accountRepository.save(existing);
                })
                .orElseGet(() -> {
                    Account account = new Account();
                    account.setPlatformId(platformId);
                    account.setNativeId(nativeId);
                    account.setDisplayName(displayName != null ? displayName : "");
                    account.setIdentityTag(StringUtils.hasText(identityTag) ? identityTag : Account.DEFAULT_IDENTITY_TAG);
                    account.setAvatar(avatar != null ? avatar : "");
                    account.setCreatedAt(now);
                    account.setUpdatedAt(now);
                    Account saved = accountRepository.save(account);
                    log.info("Created account {} on platform {} (tag {})", nativeId, platformId, saved.getIdentityTag());
                    return saved;
                });
    }

    /** Operator registration: creates the account with the tag, or re-tags an existing one. */
    @Transactional
    public Account registerAccount(Long platformId, String nativeId, String identityTag) {
        return upsertAccount(platformId, nativeId, null, identityTag, null);
    }

    /** Updates only the identity tag and {@code updated_at}. */
    @Transactional
    public boolean setIdentityTag(Long platformId, String nativeId, String identityTag) {
        String tag = StringUtils.hasText(identityTag) ? identityTag : Account.DEFAULT_IDENTITY_TAG;
        int rows = accountRepository.updateIdentityTag(platformId, nativeId, tag, LocalDateTime.now());
        if (rows > 0) {
            log.info("Account {} on platform {} re-tagged as {}", nativeId, platformId, tag);
        }
        return rows > 0;
    }

    @Transactional
    public boolean setAccountActive(Long accountId, boolean active) {
        return accountRepository.findById(accountId)
                .map(account -> {
                    account.setActive(active);
                    account.setUpdatedAt(LocalDateTime.now());
                    log.info("Account {} {}", accountId, active ? "activated" : "deactivated");
                    return true;
                })
                .orElse(false);
    }

    /**
     * Deletes an account. With {@code deleteRecords=false} its snapshots are kept and
     * keep pointing at the removed account id.
     */
    @Transactional
    public boolean deleteAccount(Long accountId, boolean deleteRecords) {
        Optional<Account> account = accountRepository.findById(accountId);
        if (account.isEmpty()) {
            return false;
        }
        int removed = deleteRecords ? snapshotRepository.deleteByAccountId(accountId) : 0;
        accountRepository.delete(account.get());
        log.warn("Deleted account {} ({}), {} snapshot(s) removed{}", accountId, account.get().getNativeId(),
                removed, deleteRecords ? "" : ", remaining snapshots are orphaned");
        return true;
    }

    // ---- Snapshots ----

    /** Appends a snapshot. The account must already exist. */
    @Transactional
    public Long recordSnapshot(Long accountId, Long platformId, String identityTag, long followerCount,
                               LocalDateTime recordTime, SnapshotStatus status, String errorText) {
        if (followerCount < 0) {
            throw new IllegalArgumentException("Follower count must not be negative: " + followerCount);
        }
        if (!accountRepository.existsById(accountId)) {
            throw new IllegalArgumentException("Unknown account: " + accountId);
        }
        requirePlatform(platformId);

        FollowerSnapshot snapshot = new FollowerSnapshot();
        snapshot.setAccountId(accountId);
        snapshot.setPlatformId(platformId);
        snapshot.setIdentityTag(StringUtils.hasText(identityTag) ? identityTag : Account.DEFAULT_IDENTITY_TAG);
        snapshot.setFollowerCount(followerCount);
        snapshot.setRecordTime(recordTime);
        snapshot.setStatus(status != null ? status : SnapshotStatus.SUCCESS);
        snapshot.setErrorMessage(errorText != null ? errorText : "");
        return snapshotRepository.save(snapshot).getId();
    }

    /**
     * Upserts the fetched account (a blank name or tag keeps what is stored) and appends a
     * successful snapshot stamped with the account's current identity tag.
     */
    @Transactional
    public FollowerSnapshot recordObservation(Platform platform, AccountSnapshot fetched, LocalDateTime recordTime) {
        Account account = upsertAccount(platform.getId(), fetched.nativeId(), fetched.displayName(), null, fetched.avatarUrl());
        Long id = recordSnapshot(account.getId(), platform.getId(), account.getIdentityTag(),
                fetched.followerCount(), recordTime, SnapshotStatus.SUCCESS, "");
        return snapshotRepository.findById(id).orElseThrow();
    }

    /** Newest first: record time descending, then insertion order descending. */
    public List<FollowerSnapshot> querySnapshots(SnapshotQuery query) {
        Specification<FollowerSnapshot> spec = Specification.where(forAccount(query.accountId()))
                .and(query.platformId() != null ? onPlatform(query.platformId()) : onPlatforms(query.platformIds()))
                .and(taggedAs(query.identityTag()))
                .and(recordedFrom(query.from()))
                .and(recordedUntil(query.to()));
        Sort newestFirst = Sort.by(Sort.Order.desc("recordTime"), Sort.Order.desc("id"));
        return snapshotRepository.findAll(spec, PageRequest.of(0, query.effectiveLimit(), newestFirst)).getContent();
    }

    public Optional<Long> latestFollowerCount(Long accountId) {
        return snapshotRepository.findFirstByAccountIdOrderByRecordTimeDescIdDesc(accountId)
                .map(FollowerSnapshot::getFollowerCount);
    }

    @Transactional
    public boolean deleteSnapshot(Long snapshotId) {
        if (!snapshotRepository.existsById(snapshotId)) {
            return false;
        }
        snapshotRepository.deleteById(snapshotId);
        log.warn("Deleted snapshot {}", snapshotId);
        return true;
    }

    // ---- Tasks ----

    public List<CrawlTask> listTasks() {
        return taskRepository.findAllByOrderByIdAsc();
    }

    public List<CrawlTask> listEnabledTasks() {
        return taskRepository.findByEnabledTrueOrderByIdAsc();
    }

    public Optional<CrawlTask> findTask(Long taskId) {
        return taskRepository.findById(taskId);
    }

    public Optional<CrawlTask> findTaskByName(String taskName) {
        return taskRepository.findByTaskName(taskName);
    }

    @Transactional
    public CrawlTask ensureTask(Platform platform, String scheduleTime, int maxRetry) {
        String name = CrawlTask.nameFor(platform.getCode());
        return taskRepository.findByTaskName(name).orElseGet(() -> {
            CrawlTask task = new CrawlTask();
            task.setTaskName(name);
            task.setPlatformId(platform.getId());
            task.setScheduleTime(scheduleTime);
            task.setMaxRetry(maxRetry);
            log.info("Seeded task {} at {}", name, scheduleTime);
            return taskRepository.save(task);
        });
    }

    /** Null arguments leave the corresponding column untouched. */
    @Transactional
    public void updateTaskStatus(Long taskId, TaskStatus status, LocalDateTime lastRunTime,
                                 LocalDateTime nextRunTime, Integer retryCount) {
        CrawlTask task = taskRepository.findById(taskId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown task: " + taskId));
        if (status != null) task.setStatus(status);
        if (lastRunTime != null) task.setLastRunTime(lastRunTime);
        if (nextRunTime != null) task.setNextRunTime(nextRunTime);
        if (retryCount != null) task.setRetryCount(retryCount);
        task.setUpdatedAt(LocalDateTime.now());
    }

    @Transactional
    public CrawlTask updateTaskSchedule(String taskName, String scheduleTime, Boolean enabled) {
        CrawlTask task = taskRepository.findByTaskName(taskName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown task: " + taskName));
        task.setScheduleTime(scheduleTime);
        if (enabled != null) task.setEnabled(enabled);
        task.setUpdatedAt(LocalDateTime.now());
        log.info("Task {} scheduled at {} (enabled={})", taskName, scheduleTime, task.isEnabled());
        return task;
    }

    // ---- Run logs ----

    @Transactional
    public Long openRunLog(Long taskId, LocalDateTime startTime) {
        TaskRunLog runLog = new TaskRunLog();
        runLog.setTaskId(taskId);
        runLog.setStartTime(startTime);
        runLog.setStatus(TaskStatus.RUNNING);
        return runLogRepository.save(runLog).getId();
    }

    @Transactional
    public void closeRunLog(Long logId, LocalDateTime endTime, TaskStatus status,
                            int recordsCount, int successCount, int failedCount, String errorText) {
        TaskRunLog runLog = runLogRepository.findById(logId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown run log: " + logId));
        runLog.setEndTime(endTime);
        runLog.setStatus(status);
        runLog.setRecordsCount(recordsCount);
        runLog.setSuccessCount(successCount);
        runLog.setFailedCount(failedCount);
        if (errorText != null) runLog.setErrorMessage(errorText);
    }

    public List<TaskRunLog> listRunLogs(Long taskId, int limit) {
        PageRequest page = PageRequest.of(0, limit > 0 ? limit : 50);
        return taskId == null
                ? runLogRepository.findAllByOrderByStartTimeDescIdDesc(page)
                : runLogRepository.findByTaskIdOrderByStartTimeDescIdDesc(taskId, page);
    }

    public Optional<TaskRunLog> latestRunLog(Long taskId) {
        return runLogRepository.findFirstByTaskIdOrderByStartTimeDescIdDesc(taskId);
    }

    private void requirePlatform(Long platformId) {
        if (platformId == null || !platformRepository.existsById(platformId)) {
            throw new IllegalArgumentException("Unknown platform: " + platformId);
        }
    }
}
