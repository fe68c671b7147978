package quest.gekko.smm.service.crawler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponentsBuilder;
import quest.gekko.smm.config.MonitorProperties;
import quest.gekko.smm.service.credential.CredentialResolver;
import quest.gekko.smm.util.Counts;

import java.net.URI;
import java.util.List;
import java.util.OptionalLong;

/** Weibo profile API ({@code /ajax/profile/info?uid=}). Targets are numeric UIDs. */
@Slf4j
@Service
public class WeiboCrawler extends AbstractPlatformCrawler {

    public static final String CODE = "weibo";

    @Autowired
    public WeiboCrawler(CrawlerRequestExecutor executor, CredentialResolver credentials,
                        MonitorProperties properties, ObjectMapper objectMapper) {
        this(executor, credentials, properties, objectMapper, null);
    }

    private WeiboCrawler(CrawlerRequestExecutor executor, CredentialResolver credentials,
                         MonitorProperties properties, ObjectMapper objectMapper, String directToken) {
        super(executor, credentials, properties, objectMapper, directToken);
    }

    @Override
    public String platformCode() { return CODE; }

    @Override
    public PlatformCrawler withCredential(String token) {
        return new WeiboCrawler(executor, credentials, properties, objectMapper, token);
    }

    @Override
    protected String defaultBaseUrl() { return "https://weibo.com"; }

    @Override
    protected HttpHeaders browserHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.USER_AGENT, USER_AGENT);
        headers.set(HttpHeaders.REFERER, "https://weibo.com");
        headers.set(HttpHeaders.ACCEPT, "application/json, text/plain, */*");
        headers.set(HttpHeaders.ACCEPT_LANGUAGE, "zh-CN,zh;q=0.9,en;q=0.8");
        headers.set(HttpHeaders.CONNECTION, "keep-alive");
        return headers;
    }

    @Override
    public AccountSnapshot fetchAccount(String uid) throws FetchException {
        if (!StringUtils.hasText(uid)) {
            throw FetchException.parse("Weibo uid must not be blank");
        }
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl())
                .path("/ajax/profile/info")
                .queryParam("uid", uid.trim())
                .encode()
                .build()
                .toUri();

        JsonNode root = readJson(fetch(uri), uid);
        JsonNode user = root.path("data").path("user");
        if (!user.isObject() || user.isEmpty()) {
            if (root.has("ok") && root.path("ok").asInt(1) != 1) {
                throw new FetchException(FetchException.Reason.UPSTREAM_ERROR,
                        "Weibo rejected uid " + uid + ": " + root.path("msg").asText("ok=" + root.path("ok").asText()));
            }
            throw FetchException.parse("No user data for weibo uid " + uid);
        }

        OptionalLong followers = Counts.parse(user.path("followers_count"));
        if (followers.isEmpty()) {
            throw FetchException.parse("Missing followers_count for weibo uid " + uid);
        }
        String avatar = List.of("avatar_hd", "avatar_large", "profile_image_url").stream()
                .map(field -> text(user, field))
                .filter(StringUtils::hasText)
                .findFirst()
                .orElse(null);

        log.debug("Weibo {} has {} followers", uid, followers.getAsLong());
        return new AccountSnapshot(
                uid.trim(),
                text(user, "screen_name"),
                followers.getAsLong(),
                Counts.orNull(user.path("friends_count")),
                Counts.orNull(user.path("statuses_count")),
                user.path("verified").asBoolean(false),
                avatar);
    }
}
