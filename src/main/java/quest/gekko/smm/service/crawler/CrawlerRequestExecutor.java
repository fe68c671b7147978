package quest.gekko.smm.service.crawler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import quest.gekko.smm.config.MonitorProperties;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Performs GET requests for the crawlers with bounded, status-aware retry. Every attempt,
 * successful or not, is followed by the platform's inter-request delay.
 */
@Slf4j
@Component
public class CrawlerRequestExecutor {

    private final WebClient http;
    private final MonitorProperties properties;
    private final Sleeper sleeper;

    public CrawlerRequestExecutor(WebClient http, MonitorProperties properties, Sleeper sleeper) {
        this.http = http;
        this.properties = properties;
        this.sleeper = sleeper;
    }

    public String get(URI uri, HttpHeaders headers, Duration delay) throws FetchException {
        RetryTemplate retryTemplate = RetryTemplate.builder()
                .maxAttempts(properties.getHttp().getMaxAttempts())
                .retryOn(UpstreamFailure.class)
                .customBackoff(new UpstreamBackOffPolicy(sleeper))
                .build();
        try {
            return retryTemplate.execute(ctx -> attempt(uri, headers, delay, ctx.getRetryCount() + 1));
        } catch (UpstreamFailure e) {
            log.warn("Giving up on {} after {} attempt(s): {}", uri.getPath(), properties.getHttp().getMaxAttempts(), e.getMessage());
            throw e.toFetchException();
        } catch (BackOffInterruptedException e) {
            throw new FetchException(FetchException.Reason.CONNECTION, "Interrupted while retrying " + uri.getPath(), e);
        }
    }

    private String attempt(URI uri, HttpHeaders headers, Duration delay, int attempt) {
        try {
            ResponseEntity<String> response = http.get()
                    .uri(uri)
                    .headers(h -> h.addAll(headers))
                    .retrieve()
                    .toEntity(String.class)
                    .timeout(properties.getHttp().getTimeout())
                    .block();
            return response == null || response.getBody() == null ? "" : response.getBody();
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            log.warn("Attempt {} for {} returned HTTP {}", attempt, uri.getPath(), status);
            throw new UpstreamFailure(FetchException.Reason.HTTP_STATUS, status, "HTTP " + status + " from " + uri.getHost(), e);
        } catch (RuntimeException e) {
            // WebClientRequestException, or the reactive timeout wrapped by block()
            FetchException.Reason reason = isTimeout(e) ? FetchException.Reason.TIMEOUT : FetchException.Reason.CONNECTION;
            log.warn("Attempt {} for {} failed ({}): {}", attempt, uri.getPath(), reason, e.getMessage());
            throw new UpstreamFailure(reason, null, reason + " calling " + uri.getHost() + ": " + e.getMessage(), e);
        } finally {
            pause(delay);
        }
    }

    private void pause(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            sleeper.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted during inter-request delay");
        }
    }

    private static boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException || t instanceof io.netty.handler.timeout.TimeoutException) {
                return true;
            }
        }
        return false;
    }
}
