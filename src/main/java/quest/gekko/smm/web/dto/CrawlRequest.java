package quest.gekko.smm.web.dto;

public record CrawlRequest(String target, String credential) {}
