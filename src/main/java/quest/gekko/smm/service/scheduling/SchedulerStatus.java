package quest.gekko.smm.service.scheduling;

import quest.gekko.smm.domain.TaskStatus;

import java.time.LocalDateTime;
import java.util.List;

public record SchedulerStatus(boolean running, List<TaskView> tasks) {

    public record TaskView(Long id,
                           String name,
                           boolean enabled,
                           String scheduleTime,
                           TaskStatus status,
                           LocalDateTime lastRunTime,
                           LocalDateTime nextRunTime,
                           int retryCount,
                           int maxRetry,
                           TaskStatus lastRunLogStatus,
                           boolean retryPending) {}
}
