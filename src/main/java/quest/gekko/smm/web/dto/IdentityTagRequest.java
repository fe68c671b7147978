package quest.gekko.smm.web.dto;

public record IdentityTagRequest(Long platformId, String nativeId, String identityTag) {}
