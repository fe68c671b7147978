package quest.gekko.smm.service.crawler;

import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;

/**
 * Back-off chosen from the last failure: 403 waits 2s x attempt, 429 waits 5s x attempt,
 * any other status 1s, network errors 2s.
 */
class UpstreamBackOffPolicy implements BackOffPolicy {

    private final Sleeper sleeper;

    UpstreamBackOffPolicy(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    @Override
    public BackOffContext start(RetryContext context) {
        return new UpstreamBackOffContext(context);
    }

    @Override
    public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
        RetryContext retryContext = ((UpstreamBackOffContext) backOffContext).retryContext;
        long millis = backOffMillis(retryContext.getLastThrowable(), retryContext.getRetryCount());
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("Interrupted while backing off", e);
        }
    }

    static long backOffMillis(Throwable last, int attempt) {
        if (last instanceof UpstreamFailure failure && failure.httpStatus() != null) {
            return switch (failure.httpStatus()) {
                case 403 -> 2_000L * attempt;
                case 429 -> 5_000L * attempt;
                default -> 1_000L;
            };
        }
        return 2_000L;
    }

    private static final class UpstreamBackOffContext implements BackOffContext {
        private final transient RetryContext retryContext;

        private UpstreamBackOffContext(RetryContext retryContext) {
            this.retryContext = retryContext;
        }
    }
}
