package quest.gekko.smm.service.scheduling;

/** What started a task execution. Only manual runs execute a disabled task. */
public enum TriggerSource {
    SCHEDULED,
    MANUAL,
    RETRY
}
