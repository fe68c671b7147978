package quest.gekko.smm.service.crawler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import quest.gekko.smm.config.MonitorProperties;
import quest.gekko.smm.service.credential.CredentialResolver;

import java.net.URI;
import java.time.Duration;

/**
 * Shared plumbing for the crawlers: credential resolution per request, browser-like
 * headers and JSON decoding.
 */
abstract class AbstractPlatformCrawler implements PlatformCrawler {

    static final String USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    protected final CrawlerRequestExecutor executor;
    protected final CredentialResolver credentials;
    protected final MonitorProperties properties;
    protected final ObjectMapper objectMapper;
    /** Caller-supplied token; tops the resolution chain when set. */
    protected final String directToken;

    protected AbstractPlatformCrawler(CrawlerRequestExecutor executor, CredentialResolver credentials,
                                      MonitorProperties properties, ObjectMapper objectMapper, String directToken) {
        this.executor = executor;
        this.credentials = credentials;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.directToken = directToken;
    }

    protected abstract String defaultBaseUrl();

    /** Headers the platform expects from a real browser, without the cookie. */
    protected abstract HttpHeaders browserHeaders();

    protected String baseUrl() {
        String configured = properties.platform(platformCode()).getBaseUrl();
        String base = StringUtils.hasText(configured) ? configured : defaultBaseUrl();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    protected Duration delay() {
        return properties.platform(platformCode()).getDelay();
    }

    protected String fetch(URI uri) throws FetchException {
        HttpHeaders headers = browserHeaders();
        String token = credentials.resolve(platformCode(), directToken);
        if (StringUtils.hasText(token)) {
            headers.set(HttpHeaders.COOKIE, token);
        }
        return executor.get(uri, headers, delay());
    }

    protected JsonNode readJson(String body, String target) throws FetchException {
        if (!StringUtils.hasText(body)) {
            throw FetchException.parse("Empty response for " + target);
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new FetchException(FetchException.Reason.PARSE, "Malformed JSON for " + target, e);
        }
    }

    protected static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isValueNode() && !value.isNull() ? value.asText() : null;
    }
}
