package quest.gekko.smm.web.dto;

/** {@code enabled} is optional; null keeps the current flag. */
public record ScheduleUpdateRequest(String scheduleTime, Boolean enabled) {}
