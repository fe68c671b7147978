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
import java.util.OptionalLong;

/**
 * Douyin web profile API. Targets are {@code sec_user_id} values, which are also used as
 * the stored native id.
 */
@Slf4j
@Service
public class DouyinCrawler extends AbstractPlatformCrawler {

    public static final String CODE = "douyin";

    @Autowired
    public DouyinCrawler(CrawlerRequestExecutor executor, CredentialResolver credentials,
                         MonitorProperties properties, ObjectMapper objectMapper) {
        this(executor, credentials, properties, objectMapper, null);
    }

    private DouyinCrawler(CrawlerRequestExecutor executor, CredentialResolver credentials,
                          MonitorProperties properties, ObjectMapper objectMapper, String directToken) {
        super(executor, credentials, properties, objectMapper, directToken);
    }

    @Override
    public String platformCode() { return CODE; }

    @Override
    public PlatformCrawler withCredential(String token) {
        return new DouyinCrawler(executor, credentials, properties, objectMapper, token);
    }

    @Override
    protected String defaultBaseUrl() { return "https://www.douyin.com"; }

    @Override
    protected HttpHeaders browserHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.USER_AGENT, USER_AGENT);
        headers.set(HttpHeaders.REFERER, "https://www.douyin.com/");
        headers.set(HttpHeaders.ORIGIN, "https://www.douyin.com");
        headers.set(HttpHeaders.ACCEPT, "application/json, text/plain, */*");
        headers.set(HttpHeaders.ACCEPT_LANGUAGE, "zh-CN,zh;q=0.9,en;q=0.8");
        headers.set(HttpHeaders.CONNECTION, "keep-alive");
        headers.set("Sec-Fetch-Dest", "empty");
        headers.set("Sec-Fetch-Mode", "cors");
        headers.set("Sec-Fetch-Site", "same-site");
        return headers;
    }

    @Override
    public AccountSnapshot fetchAccount(String secUserId) throws FetchException {
        if (!StringUtils.hasText(secUserId)) {
            throw FetchException.parse("Douyin sec_user_id must not be blank");
        }
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl())
                .path("/aweme/v1/web/user/profile/other/")
                .queryParam("sec_user_id", secUserId.trim())
                .encode()
                .build()
                .toUri();

        JsonNode root = readJson(fetch(uri), secUserId);
        JsonNode user = root.path("user");
        if (root.path("status_code").asInt(-1) != 0 || !user.isObject() || user.isEmpty()) {
            throw new FetchException(FetchException.Reason.UPSTREAM_ERROR,
                    "Douyin error for " + secUserId + ": " + root.path("status_msg").asText("unknown error"));
        }

        OptionalLong followers = Counts.parse(user.path("follower_count"));
        if (followers.isEmpty()) {
            throw FetchException.parse("Missing follower_count for douyin user " + secUserId);
        }
        boolean verified = StringUtils.hasText(text(user, "custom_verify"))
                || StringUtils.hasText(text(user, "enterprise_verify_reason"));
        String avatar = firstText(user.path("avatar_thumb").path("url_list"));

        log.debug("Douyin {} has {} followers", secUserId, followers.getAsLong());
        return new AccountSnapshot(
                secUserId.trim(),
                text(user, "nickname"),
                followers.getAsLong(),
                Counts.orNull(user.path("following_count")),
                Counts.orNull(user.path("aweme_count")),
                verified,
                avatar);
    }

    private static String firstText(JsonNode array) {
        JsonNode value = array.path(0);
        return value.isTextual() ? value.asText() : null;
    }
}
