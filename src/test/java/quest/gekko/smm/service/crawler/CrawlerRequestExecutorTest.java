package quest.gekko.smm.service.crawler;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import quest.gekko.smm.config.MonitorProperties;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.junit.jupiter.api.Assertions.assertEquals;

class CrawlerRequestExecutorTest {

    private MockWebServer server;
    private RecordingSleeper sleeper;
    private MonitorProperties properties;
    private CrawlerRequestExecutor executor;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        sleeper = new RecordingSleeper();
        properties = new MonitorProperties();
        properties.getHttp().setTimeout(Duration.ofMillis(500));
        executor = new CrawlerRequestExecutor(WebClient.builder().build(), properties, sleeper);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private URI uri() {
        return server.url("/ajax/profile/info?uid=1").uri();
    }

    @Test
    void returnsBodyAndSendsHeaders() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"ok\":1}"));
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.COOKIE, "SUB=abc");

        String body = executor.get(uri(), headers, Duration.ZERO);

        assertEquals("{\"ok\":1}", body);
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("SUB=abc", request.getHeader("Cookie"));
        assertEquals("/ajax/profile/info?uid=1", request.getPath());
        assertThat(sleeper.sleeps).isEmpty();
    }

    @Test
    @DisplayName("403 backs off 2s x attempt and gives up after three attempts")
    void forbiddenIsRetriedWithGrowingBackOff() {
        for (int i = 0; i < 3; i++) server.enqueue(new MockResponse().setResponseCode(403));

        FetchException e = catchThrowableOfType(() -> executor.get(uri(), new HttpHeaders(), Duration.ZERO), FetchException.class);

        assertEquals(FetchException.Reason.HTTP_STATUS, e.getReason());
        assertEquals(403, e.getHttpStatus());
        assertEquals(3, server.getRequestCount());
        assertThat(sleeper.sleeps).containsExactly(2_000L, 4_000L);
    }

    @Test
    void rateLimitBacksOffFiveSecondsPerAttempt() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(429));
        server.enqueue(new MockResponse().setResponseCode(429));
        server.enqueue(new MockResponse().setBody("done"));

        assertEquals("done", executor.get(uri(), new HttpHeaders(), Duration.ZERO));
        assertThat(sleeper.sleeps).containsExactly(5_000L, 10_000L);
    }

    @Test
    void otherStatusesBackOffOneSecond() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(502));
        server.enqueue(new MockResponse().setBody("ok"));

        assertEquals("ok", executor.get(uri(), new HttpHeaders(), Duration.ZERO));
        assertThat(sleeper.sleeps).containsExactly(1_000L);
    }

    @Test
    @DisplayName("Inter-request delay follows every attempt, failed or not")
    void delayFollowsEveryAttempt() {
        for (int i = 0; i < 3; i++) server.enqueue(new MockResponse().setResponseCode(403));

        catchThrowableOfType(() -> executor.get(uri(), new HttpHeaders(), Duration.ofSeconds(3)), FetchException.class);

        assertThat(sleeper.sleeps).containsExactly(3_000L, 2_000L, 3_000L, 4_000L, 3_000L);
    }

    @Test
    void connectionFailuresAreRetriedAndReported() throws IOException {
        MockWebServer closed = new MockWebServer();
        closed.start();
        URI unreachable = closed.url("/ajax/profile/info?uid=1").uri();
        closed.shutdown();

        FetchException e = catchThrowableOfType(() -> executor.get(unreachable, new HttpHeaders(), Duration.ZERO), FetchException.class);

        assertEquals(FetchException.Reason.CONNECTION, e.getReason());
        assertThat(sleeper.sleeps).containsExactly(2_000L, 2_000L);
    }

    @Test
    void slowResponsesTimeOut() {
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setBody("late").setHeadersDelay(2, TimeUnit.SECONDS));
        }

        FetchException e = catchThrowableOfType(() -> executor.get(uri(), new HttpHeaders(), Duration.ZERO), FetchException.class);

        assertEquals(FetchException.Reason.TIMEOUT, e.getReason());
        assertThat(sleeper.sleeps).containsExactly(2_000L, 2_000L);
    }
}
