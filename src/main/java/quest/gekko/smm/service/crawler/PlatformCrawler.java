package quest.gekko.smm.service.crawler;

public interface PlatformCrawler {
    /** Platform code this crawler serves ("weibo", "xiaohongshu", "douyin"). */
    String platformCode();

    /** Fetch one account by its platform-native identifier (or profile URL where supported). */
    AccountSnapshot fetchAccount(String target) throws FetchException;

    /** A crawler whose requests carry {@code token} ahead of any stored or configured credential. */
    PlatformCrawler withCredential(String token);
}
