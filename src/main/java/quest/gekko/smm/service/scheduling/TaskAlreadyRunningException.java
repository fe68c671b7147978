package quest.gekko.smm.service.scheduling;

public class TaskAlreadyRunningException extends RuntimeException {
    public TaskAlreadyRunningException(String taskName) {
        super("Task is already running: " + taskName);
    }
}
