package quest.gekko.smm.service.crawler;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DouyinCrawlerTest {

    private static final String SEC_USER_ID = "MS4wLjABAAAAsec";

    @Mock
    private CredentialStore credentialStore;

    private MockWebServer server;
    private RecordingSleeper sleeper;
    private MonitorProperties.PlatformSettings settings;
    private DouyinCrawler crawler;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        sleeper = new RecordingSleeper();

        MonitorProperties properties = new MonitorProperties();
        settings = new MonitorProperties.PlatformSettings();
        settings.setBaseUrl(server.url("/").toString());
        settings.setDelay(Duration.ZERO);
        properties.getPlatforms().put(DouyinCrawler.CODE, settings);

        CrawlerRequestExecutor executor = new CrawlerRequestExecutor(WebClient.builder().build(), properties, sleeper);
        crawler = new DouyinCrawler(executor, new CredentialResolver(credentialStore, properties), properties, new ObjectMapper());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void parsesProfileAndKeysBySecUserId() throws Exception {
        when(credentialStore.get(DouyinCrawler.CODE)).thenReturn(Optional.empty());
        server.enqueue(new MockResponse().setBody("""
                {"status_code":0,"user":{"uid":"9876","nickname":"Carol","follower_count":321000,
                 "following_count":12,"aweme_count":45,"custom_verify":"Musician",
                 "avatar_thumb":{"url_list":["https://img/carol.jpeg","https://img/carol-2.jpeg"]}}}
                """));

        AccountSnapshot snapshot = crawler.fetchAccount(SEC_USER_ID);

        assertEquals(SEC_USER_ID, snapshot.nativeId());
        assertEquals("Carol", snapshot.displayName());
        assertEquals(321_000L, snapshot.followerCount());
        assertEquals(12L, snapshot.followingCount());
        assertEquals(45L, snapshot.postCount());
        assertTrue(snapshot.verified());
        assertEquals("https://img/carol.jpeg", snapshot.avatarUrl());

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("/aweme/v1/web/user/profile/other/?sec_user_id=" + SEC_USER_ID, request.getPath());
        assertEquals("https://www.douyin.com/", request.getHeader("Referer"));
    }

    @Test
    @DisplayName("Without any credential the request goes out bare and 403s exhaust the retries")
    void unauthenticatedForbiddenExhaustsRetries() {
        when(credentialStore.get(DouyinCrawler.CODE)).thenReturn(Optional.empty());
        for (int i = 0; i < 3; i++) server.enqueue(new MockResponse().setResponseCode(403));

        FetchException e = catchThrowableOfType(() -> crawler.fetchAccount(SEC_USER_ID), FetchException.class);

        assertEquals(FetchException.Reason.HTTP_STATUS, e.getReason());
        assertEquals(403, e.getHttpStatus());
        assertEquals(3, server.getRequestCount());
        assertThat(sleeper.sleeps).containsExactly(2_000L, 4_000L);
    }

    @Test
    void noCookieHeaderWithoutCredential() throws Exception {
        when(credentialStore.get(DouyinCrawler.CODE)).thenReturn(Optional.empty());
        server.enqueue(new MockResponse().setBody("{\"status_code\":0,\"user\":{\"nickname\":\"Carol\",\"follower_count\":1}}"));

        crawler.fetchAccount(SEC_USER_ID);

        assertNull(server.takeRequest(1, TimeUnit.SECONDS).getHeader("Cookie"));
    }

    @Test
    void configuredFallbackCredentialIsUsedWhenStoreIsEmpty() throws Exception {
        when(credentialStore.get(DouyinCrawler.CODE)).thenReturn(Optional.empty());
        settings.setCredential("ttwid=fallback");
        server.enqueue(new MockResponse().setBody("{\"status_code\":0,\"user\":{\"nickname\":\"Carol\",\"follower_count\":1}}"));

        AccountSnapshot snapshot = crawler.fetchAccount(SEC_USER_ID);

        assertEquals("ttwid=fallback", server.takeRequest(1, TimeUnit.SECONDS).getHeader("Cookie"));
        assertFalse(snapshot.verified());
    }

    @Test
    void nonZeroStatusCodeIsAnUpstreamError() {
        when(credentialStore.get(DouyinCrawler.CODE)).thenReturn(Optional.empty());
        server.enqueue(new MockResponse().setBody("{\"status_code\":8,\"status_msg\":\"user not found\"}"));

        FetchException e = catchThrowableOfType(() -> crawler.fetchAccount(SEC_USER_ID), FetchException.class);

        assertEquals(FetchException.Reason.UPSTREAM_ERROR, e.getReason());
        assertThat(e.getMessage()).contains("user not found");
    }

    @Test
    void missingFollowerCountIsAParseFailure() {
        when(credentialStore.get(DouyinCrawler.CODE)).thenReturn(Optional.empty());
        server.enqueue(new MockResponse().setBody("{\"status_code\":0,\"user\":{\"nickname\":\"Carol\"}}"));

        FetchException e = catchThrowableOfType(() -> crawler.fetchAccount(SEC_USER_ID), FetchException.class);

        assertEquals(FetchException.Reason.PARSE, e.getReason());
    }
}
