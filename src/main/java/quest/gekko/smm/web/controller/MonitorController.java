package quest.gekko.smm.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import quest.gekko.smm.domain.*;
import quest.gekko.smm.service.core.MonitorStore;
import quest.gekko.smm.service.core.SnapshotQuery;
import quest.gekko.smm.service.crawler.AccountCrawlService;
import quest.gekko.smm.service.crawler.CrawlOutcome;
import quest.gekko.smm.service.crawler.FetchException;
import quest.gekko.smm.service.credential.CredentialStore;
import quest.gekko.smm.service.credential.StoredCredential;
import quest.gekko.smm.service.scheduling.CrawlTaskScheduler;
import quest.gekko.smm.service.scheduling.RunResult;
import quest.gekko.smm.service.scheduling.SchedulerStatus;
import quest.gekko.smm.web.dto.CrawlRequest;
import quest.gekko.smm.web.dto.IdentityTagRequest;
import quest.gekko.smm.web.dto.RegisterAccountRequest;
import quest.gekko.smm.web.dto.ScheduleUpdateRequest;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/** JSON commands and queries used by the dashboard and export tools. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class MonitorController {

    private final MonitorStore store;
    private final CrawlTaskScheduler scheduler;
    private final CredentialStore credentialStore;
    private final AccountCrawlService crawlService;

    // ---- Platforms & accounts ----

    @GetMapping("/platforms")
    public List<Platform> platforms() {
        return store.listPlatforms();
    }

    @GetMapping("/accounts")
    public List<Account> accounts(@RequestParam(required = false) Long platformId) {
        return store.listAccounts(platformId);
    }

    @PostMapping("/accounts")
    public Account registerAccount(@RequestBody RegisterAccountRequest request) {
        return store.registerAccount(request.platformId(), request.nativeId(), request.identityTag());
    }

    @PutMapping("/accounts/identity")
    public ResponseEntity<Map<String, Object>> setIdentityTag(@RequestBody IdentityTagRequest request) {
        boolean updated = store.setIdentityTag(request.platformId(), request.nativeId(), request.identityTag());
        return updated
                ? ResponseEntity.ok(Map.of("updated", true))
                : ResponseEntity.notFound().build();
    }

    @PutMapping("/accounts/{id}/active")
    public ResponseEntity<Map<String, Object>> setActive(@PathVariable Long id, @RequestParam boolean active) {
        return store.setAccountActive(id, active)
                ? ResponseEntity.ok(Map.of("active", active))
                : ResponseEntity.notFound().build();
    }

    @DeleteMapping("/accounts/{id}")
    public ResponseEntity<Void> deleteAccount(@PathVariable Long id,
                                              @RequestParam(defaultValue = "true") boolean deleteRecords) {
        return store.deleteAccount(id, deleteRecords)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @GetMapping("/accounts/{id}/latest")
    public ResponseEntity<Map<String, Object>> latestCount(@PathVariable Long id) {
        return store.latestFollowerCount(id)
                .map(count -> ResponseEntity.ok(Map.<String, Object>of("accountId", id, "followerCount", count)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    // ---- Snapshots ----

    @GetMapping("/snapshots")
    public List<FollowerSnapshot> snapshots(
            @RequestParam(required = false) Long accountId,
            @RequestParam(required = false) Long platformId,
            @RequestParam(required = false) List<Long> platformIds,
            @RequestParam(required = false) String identityTag,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to,
            @RequestParam(required = false) Integer limit) {
        return store.querySnapshots(SnapshotQuery.builder()
                .accountId(accountId)
                .platformId(platformId)
                .platformIds(platformIds)
                .identityTag(identityTag)
                .from(from)
                .to(to)
                .limit(limit)
                .build());
    }

    @DeleteMapping("/snapshots/{id}")
    public ResponseEntity<Void> deleteSnapshot(@PathVariable Long id) {
        return store.deleteSnapshot(id)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    // ---- Scheduler & tasks ----

    @GetMapping("/scheduler")
    public SchedulerStatus schedulerStatus() {
        return scheduler.getStatus();
    }

    @PostMapping("/scheduler/start")
    public SchedulerStatus start() {
        scheduler.start();
        return scheduler.getStatus();
    }

    @PostMapping("/scheduler/stop")
    public SchedulerStatus stop() {
        scheduler.stop();
        return scheduler.getStatus();
    }

    @GetMapping("/tasks")
    public List<CrawlTask> tasks() {
        return store.listTasks();
    }

    @PostMapping("/tasks/{name}/run")
    public RunResult runNow(@PathVariable String name) {
        return scheduler.runNow(name);
    }

    @PostMapping("/tasks/run-all")
    public List<RunResult> runAll() {
        return scheduler.runAll();
    }

    @PutMapping("/tasks/{name}/schedule")
    public CrawlTask updateSchedule(@PathVariable String name, @RequestBody ScheduleUpdateRequest request) {
        return scheduler.updateTaskSchedule(name, request.scheduleTime(), request.enabled());
    }

    @GetMapping("/tasks/logs")
    public List<TaskRunLog> runLogs(@RequestParam(required = false) Long taskId,
                                    @RequestParam(defaultValue = "50") int limit) {
        return store.listRunLogs(taskId, limit);
    }

    // ---- Credentials ----

    @GetMapping("/credentials")
    public List<StoredCredential> credentials() {
        return credentialStore.list();
    }

    @PutMapping(value = "/credentials/{platform}", consumes = "text/plain")
    public ResponseEntity<Map<String, Object>> saveCredential(@PathVariable String platform, @RequestBody String token) {
        return credentialStore.save(platform, token.trim())
                ? ResponseEntity.ok(Map.of("saved", true))
                : ResponseEntity.internalServerError().body(Map.of("saved", false));
    }

    @DeleteMapping("/credentials/{platform}")
    public ResponseEntity<Void> deleteCredential(@PathVariable String platform) {
        return credentialStore.delete(platform)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    // ---- Ad-hoc crawl ----

    @PostMapping("/crawl/{platform}")
    public CrawlOutcome crawl(@PathVariable String platform, @RequestBody CrawlRequest request) throws FetchException {
        return crawlService.crawlAccount(platform, request.target(), request.credential());
    }
}
