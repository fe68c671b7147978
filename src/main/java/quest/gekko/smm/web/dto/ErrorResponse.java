package quest.gekko.smm.web.dto;

public record ErrorResponse(int status, String error, String message) {}
