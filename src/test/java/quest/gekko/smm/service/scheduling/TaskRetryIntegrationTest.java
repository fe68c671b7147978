package quest.gekko.smm.service.scheduling;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.TestPropertySource;
import quest.gekko.smm.domain.CrawlTask;
import quest.gekko.smm.domain.TaskRunLog;
import quest.gekko.smm.domain.TaskStatus;
import quest.gekko.smm.service.core.MonitorStore;
import quest.gekko.smm.service.crawler.CrawlerRegistry;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Drives the retry loop end to end: a task without a crawler faults on every attempt. */
@SpringBootTest
@TestPropertySource(properties = {
        "monitor.schedule.retry-delay=100ms",
        "monitor.schedule.tick-interval=1h"
})
class TaskRetryIntegrationTest {

    @Autowired
    private CrawlTaskScheduler scheduler;
    @Autowired
    private MonitorStore store;
    @Autowired
    private JdbcTemplate jdbcTemplate;

    // no crawler for any platform
    @MockBean
    private CrawlerRegistry crawlerRegistry;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM task_logs");
        jdbcTemplate.update("UPDATE schedule_tasks SET retry_count = 0, status = 'idle'");
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    @Test
    void retriesUntilExhaustedThenFails() throws Exception {
        scheduler.start();

        RunResult first = scheduler.runNow("weibo_follower_crawler");
        assertEquals(TaskStatus.RETRYING, first.status());
        assertTrue(first.retryRequested());

        CrawlTask task = awaitFinalFailure("weibo_follower_crawler");

        assertEquals(4, task.getRetryCount());
        List<TaskRunLog> logs = store.listRunLogs(task.getId(), 10);
        assertThat(logs).hasSize(4).allSatisfy(log -> assertEquals(TaskStatus.FAILED, log.getStatus()));
        assertFalse(scheduler.getStatus().tasks().stream()
                .filter(view -> view.id().equals(task.getId()))
                .findFirst().orElseThrow().retryPending());
    }

    @Test
    void manualRunRetriesWithoutTheScheduleLoop() throws Exception {
        assertFalse(scheduler.isRunning());

        RunResult first = scheduler.runNow("weibo_follower_crawler");
        assertEquals(TaskStatus.RETRYING, first.status());

        CrawlTask task = awaitFinalFailure("weibo_follower_crawler");

        assertEquals(4, task.getRetryCount());
        assertThat(store.listRunLogs(task.getId(), 10)).hasSize(4);
        assertFalse(scheduler.isRunning());
    }

    private CrawlTask awaitFinalFailure(String taskName) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            CrawlTask task = store.findTaskByName(taskName).orElseThrow();
            if (task.getStatus() == TaskStatus.FAILED && task.getRetryCount() == 4) {
                return task;
            }
            Thread.sleep(50);
        }
        throw new AssertionError("Task " + taskName + " did not reach its final failure in time");
    }
}
