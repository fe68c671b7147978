package quest.gekko.smm.web.dto;

public record RegisterAccountRequest(Long platformId, String nativeId, String identityTag) {}
