package quest.gekko.smm.service.crawler;

import com.fasterxml.jackson.core.JsonProcessingException;
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
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Xiaohongshu profile pages. The account is read from the page's embedded
 * {@code __INITIAL_STATE__}; when that fails, a cascade of text patterns is tried against the
 * raw HTML. First match wins and results are not cross-checked, so the cascade breaks
 * whenever the page markup changes; a page where nothing matches is a parse failure.
 */
@Slf4j
@Service
public class XiaohongshuCrawler extends AbstractPlatformCrawler {

    public static final String CODE = "xiaohongshu";

    private static final Pattern INITIAL_STATE =
            Pattern.compile("__INITIAL_STATE__\\s*=\\s*(\\{.+?})\\s*(?:;|</script>)", Pattern.DOTALL);
    private static final Pattern UNDEFINED = Pattern.compile("\\bundefined\\b");
    private static final Pattern OG_TITLE =
            Pattern.compile("<meta\\s+(?:name|property)=\"og:title\"\\s+content=\"([^\"]+)\"");
    private static final Pattern PROFILE_ID = Pattern.compile("user/profile/([a-f0-9]+)");

    // order matters, first match wins
    private static final List<Pattern> FOLLOWER_PATTERNS = List.of(
            Pattern.compile("(\\d+(?:\\.\\d+)?\\s*万?)\\s*粉丝"),
            Pattern.compile("粉丝\\s*(\\d+(?:\\.\\d+)?万?)"),
            Pattern.compile("(\\d+(?:\\.\\d+)?万?)粉丝"),
            Pattern.compile("fans[\"\\s:]+(\\d+(?:\\.\\d+)?万?)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("粉丝[\"\\s:]+(\\d+)"),
            Pattern.compile("(\\d+(?:\\.\\d+)?\\s*万)\\s*粉丝"),
            Pattern.compile("(\\d+)\\s*位粉丝"),
            Pattern.compile("(\\d+)\\s*个粉丝"),
            Pattern.compile("粉丝数[\"\\s:]+(\\d+(?:\\.\\d+)?万?)")
    );

    // candidate locations of the profile owner in the page state, tried in order
    private static final List<Function<JsonNode, Optional<StateUser>>> STATE_EXTRACTORS = List.of(
            state -> flatUser(state.path("user").path("userPageData").path("user")),
            state -> flatUser(state.path("user").path("user")),
            state -> flatUser(state.path("userPageData").path("user")),
            state -> flatUser(state.path("note").path("noteDetail").path("user")),
            state -> basicInfoUser(state.path("user").path("userPageData"))
    );

    @Autowired
    public XiaohongshuCrawler(CrawlerRequestExecutor executor, CredentialResolver credentials,
                              MonitorProperties properties, ObjectMapper objectMapper) {
        this(executor, credentials, properties, objectMapper, null);
    }

    private XiaohongshuCrawler(CrawlerRequestExecutor executor, CredentialResolver credentials,
                               MonitorProperties properties, ObjectMapper objectMapper, String directToken) {
        super(executor, credentials, properties, objectMapper, directToken);
    }

    @Override
    public String platformCode() { return CODE; }

    @Override
    public PlatformCrawler withCredential(String token) {
        return new XiaohongshuCrawler(executor, credentials, properties, objectMapper, token);
    }

    @Override
    protected String defaultBaseUrl() { return "https://www.xiaohongshu.com"; }

    @Override
    protected HttpHeaders browserHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.USER_AGENT, USER_AGENT);
        headers.set(HttpHeaders.REFERER, "https://www.xiaohongshu.com/");
        headers.set(HttpHeaders.ORIGIN, "https://www.xiaohongshu.com");
        headers.set(HttpHeaders.ACCEPT, "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8");
        headers.set(HttpHeaders.ACCEPT_LANGUAGE, "zh-CN,zh;q=0.9,en;q=0.8");
        headers.set(HttpHeaders.CONNECTION, "keep-alive");
        return headers;
    }

    /** @param target a profile URL or a bare user id */
    @Override
    public AccountSnapshot fetchAccount(String target) throws FetchException {
        if (!StringUtils.hasText(target)) {
            throw FetchException.parse("Xiaohongshu target must not be blank");
        }
        URI uri = profileUri(target.trim());
        String html = fetch(uri);
        if (!StringUtils.hasText(html)) {
            throw FetchException.parse("Empty page for " + target);
        }
        return parseProfile(html, target.trim(), uri.toString());
    }

    AccountSnapshot parseProfile(String html, String target, String profileUrl) throws FetchException {
        Optional<StateUser> stateUser = readState(html, target).flatMap(XiaohongshuCrawler::findUser);

        String nickname = stateUser.map(StateUser::nickname).orElseGet(() -> ogTitleNickname(html));
        OptionalLong followers = stateUser.map(StateUser::fans).filter(OptionalLong::isPresent).orElseGet(() -> matchFollowers(html));
        if (followers.isEmpty()) {
            throw FetchException.parse("No follower count found on xiaohongshu page for " + target);
        }

        String nativeId = stateUser.map(StateUser::userId).filter(StringUtils::hasText)
                .or(() -> profileId(profileUrl))
                .orElse(target);

        log.debug("Xiaohongshu {} has {} followers", nativeId, followers.getAsLong());
        return new AccountSnapshot(
                nativeId,
                nickname,
                followers.getAsLong(),
                stateUser.map(StateUser::follows).orElse(null),
                null,
                stateUser.map(StateUser::verified).orElse(null),
                stateUser.map(StateUser::avatar).orElse(null));
    }

    private URI profileUri(String target) throws FetchException {
        if (target.startsWith("http://") || target.startsWith("https://")) {
            try {
                return URI.create(target);
            } catch (IllegalArgumentException e) {
                throw new FetchException(FetchException.Reason.PARSE, "Malformed xiaohongshu profile URL: " + target, e);
            }
        }
        return UriComponentsBuilder.fromHttpUrl(baseUrl())
                .pathSegment("user", "profile", target)
                .encode()
                .build()
                .toUri();
    }

    private Optional<JsonNode> readState(String html, String target) {
        Matcher matcher = INITIAL_STATE.matcher(html);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String json = UNDEFINED.matcher(matcher.group(1)).replaceAll("null");
        try {
            return Optional.of(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable page state for {}, falling back to text patterns: {}", target, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static Optional<StateUser> findUser(JsonNode state) {
        for (Function<JsonNode, Optional<StateUser>> extractor : STATE_EXTRACTORS) {
            Optional<StateUser> user = extractor.apply(state);
            if (user.isPresent()) {
                return user;
            }
        }
        return Optional.empty();
    }

    private static Optional<StateUser> flatUser(JsonNode node) {
        String nickname = text(node, "nickname");
        if (!StringUtils.hasText(nickname)) {
            return Optional.empty();
        }
        String userId = Optional.ofNullable(text(node, "user_id")).orElse(text(node, "userId"));
        boolean verified = node.path("officialVerify").path("type").asInt(0) > 0;
        return Optional.of(new StateUser(nickname, userId, Counts.parse(node.path("fans")),
                Counts.orNull(node.path("follows")), verified, text(node, "image")));
    }

    private static Optional<StateUser> basicInfoUser(JsonNode pageData) {
        JsonNode basic = pageData.path("basicInfo");
        String nickname = text(basic, "nickname");
        if (!StringUtils.hasText(nickname)) {
            return Optional.empty();
        }
        OptionalLong fans = OptionalLong.empty();
        Long follows = null;
        for (JsonNode interaction : pageData.path("interactions")) {
            String type = interaction.path("type").asText();
            if ("fans".equals(type)) fans = Counts.parse(interaction.path("count"));
            if ("follows".equals(type)) follows = Counts.orNull(interaction.path("count"));
        }
        return Optional.of(new StateUser(nickname, null, fans, follows, null, text(basic, "images")));
    }

    static OptionalLong matchFollowers(String html) {
        for (Pattern pattern : FOLLOWER_PATTERNS) {
            Matcher matcher = pattern.matcher(html);
            if (matcher.find()) {
                OptionalLong count = Counts.parse(matcher.group(1));
                if (count.isPresent()) {
                    return count;
                }
            }
        }
        return OptionalLong.empty();
    }

    private static String ogTitleNickname(String html) {
        Matcher matcher = OG_TITLE.matcher(html);
        if (!matcher.find()) {
            return "";
        }
        String title = matcher.group(1);
        int suffix = title.indexOf(" - 小红书");
        return suffix >= 0 ? title.substring(0, suffix) : title;
    }

    private static Optional<String> profileId(String url) {
        Matcher matcher = PROFILE_ID.matcher(url);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    private record StateUser(String nickname, String userId, OptionalLong fans, Long follows,
                             Boolean verified, String avatar) {}
}
