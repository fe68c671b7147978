package quest.gekko.smm.service.scheduling;

public class TaskNotFoundException extends RuntimeException {
    public TaskNotFoundException(String task) {
        super("Task not found: " + task);
    }
}
