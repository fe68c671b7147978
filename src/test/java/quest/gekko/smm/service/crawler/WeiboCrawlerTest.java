package quest.gekko.smm.service.crawler;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.reactive.function.client.WebClient;
import quest.gekko.smm.config.MonitorProperties;
import quest.gekko.smm.service.credential.CredentialResolver;
import quest.gekko.smm.service.credential.CredentialStore;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.lenient;

@ExtendWith(MockitoExtension.class)
class WeiboCrawlerTest {

    @Mock
    private CredentialStore credentialStore;

    private MockWebServer server;
    private RecordingSleeper sleeper;
    private WeiboCrawler crawler;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        sleeper = new RecordingSleeper();

        MonitorProperties properties = new MonitorProperties();
        MonitorProperties.PlatformSettings settings = new MonitorProperties.PlatformSettings();
        settings.setBaseUrl(server.url("/").toString());
        settings.setDelay(Duration.ZERO);
        properties.getPlatforms().put(WeiboCrawler.CODE, settings);

        lenient().when(credentialStore.get(WeiboCrawler.CODE)).thenReturn(Optional.of("SUB=stored"));
        CrawlerRequestExecutor executor = new CrawlerRequestExecutor(WebClient.builder().build(), properties, sleeper);
        crawler = new WeiboCrawler(executor, new CredentialResolver(credentialStore, properties), properties, new ObjectMapper());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void parsesProfile() throws Exception {
        server.enqueue(new MockResponse().setBody("""
                {"ok":1,"data":{"user":{"id":111,"screen_name":"Alice","followers_count":5000,
                 "friends_count":"1,200","statuses_count":87,"verified":true,
                 "avatar_hd":"https://img/alice.jpg"}}}
                """));

        AccountSnapshot snapshot = crawler.fetchAccount("111");

        assertEquals("111", snapshot.nativeId());
        assertEquals("Alice", snapshot.displayName());
        assertEquals(5000L, snapshot.followerCount());
        assertEquals(1200L, snapshot.followingCount());
        assertEquals(87L, snapshot.postCount());
        assertTrue(snapshot.verified());
        assertEquals("https://img/alice.jpg", snapshot.avatarUrl());

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("/ajax/profile/info?uid=111", request.getPath());
        assertEquals("SUB=stored", request.getHeader("Cookie"));
        assertThat(request.getHeader("User-Agent")).contains("Mozilla/5.0");
    }

    @Test
    void acceptsAbbreviatedFollowerCounts() throws Exception {
        server.enqueue(new MockResponse().setBody("""
                {"ok":1,"data":{"user":{"screen_name":"Bob","followers_count":"12.5万"}}}
                """));

        AccountSnapshot snapshot = crawler.fetchAccount("222");

        assertEquals(125_000L, snapshot.followerCount());
        assertNull(snapshot.followingCount());
        assertNull(snapshot.avatarUrl());
    }

    @Test
    void directTokenWinsOverStoredCredential() throws Exception {
        server.enqueue(new MockResponse().setBody("""
                {"ok":1,"data":{"user":{"screen_name":"Alice","followers_count":1}}}
                """));

        crawler.withCredential("SUB=direct").fetchAccount("111");

        assertEquals("SUB=direct", server.takeRequest(1, TimeUnit.SECONDS).getHeader("Cookie"));
    }

    @Test
    void upstreamErrorCodeIsReported() {
        server.enqueue(new MockResponse().setBody("{\"ok\":-100,\"msg\":\"login required\"}"));

        FetchException e = catchThrowableOfType(() -> crawler.fetchAccount("111"), FetchException.class);

        assertEquals(FetchException.Reason.UPSTREAM_ERROR, e.getReason());
        assertThat(e.getMessage()).contains("login required");
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void missingFollowerCountIsAParseFailure() {
        server.enqueue(new MockResponse().setBody("{\"ok\":1,\"data\":{\"user\":{\"screen_name\":\"Alice\"}}}"));

        FetchException e = catchThrowableOfType(() -> crawler.fetchAccount("111"), FetchException.class);

        assertEquals(FetchException.Reason.PARSE, e.getReason());
    }

    @Test
    void followerCountBeyondLongIsAParseFailure() {
        server.enqueue(new MockResponse().setBody(
                "{\"ok\":1,\"data\":{\"user\":{\"screen_name\":\"Alice\",\"followers_count\":99999999999999999999}}}"));

        FetchException e = catchThrowableOfType(() -> crawler.fetchAccount("111"), FetchException.class);

        assertEquals(FetchException.Reason.PARSE, e.getReason());
    }

    @Test
    void malformedJsonIsNotRetried() {
        server.enqueue(new MockResponse().setBody("<html>captcha</html>"));

        FetchException e = catchThrowableOfType(() -> crawler.fetchAccount("111"), FetchException.class);

        assertEquals(FetchException.Reason.PARSE, e.getReason());
        assertEquals(1, server.getRequestCount());
        assertThat(sleeper.sleeps).isEmpty();
    }

    @Test
    void blankUidIsRejectedWithoutARequest() {
        FetchException e = catchThrowableOfType(() -> crawler.fetchAccount("  "), FetchException.class);

        assertEquals(FetchException.Reason.PARSE, e.getReason());
        assertEquals(0, server.getRequestCount());
    }
}
