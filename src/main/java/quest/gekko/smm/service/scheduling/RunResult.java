package quest.gekko.smm.service.scheduling;

import quest.gekko.smm.domain.CrawlTask;
import quest.gekko.smm.domain.TaskStatus;

/**
 * Outcome of one task execution. {@code retryRequested} is set when a whole-batch fault
 * left retry budget; the scheduler then queues a delayed re-run.
 */
public record RunResult(Long taskId,
                        String taskName,
                        Long runLogId,
                        TaskStatus status,
                        int recordsCount,
                        int successCount,
                        int failedCount,
                        int retryCount,
                        boolean retryRequested,
                        boolean skipped,
                        String errorMessage) {

    static RunResult skipped(CrawlTask task) {
        return new RunResult(task.getId(), task.getTaskName(), null, task.getStatus(),
                0, 0, 0, task.getRetryCount(), false, true, null);
    }
}
