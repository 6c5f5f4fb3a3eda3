package io.matchradar.dispatch.core.retry;

import io.matchradar.dispatch.core.error.ErrorClassifier;
import io.matchradar.dispatch.core.exception.ErrorKind;
import io.matchradar.dispatch.core.exception.ScrapeException;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;

import java.time.Duration;
import java.util.function.DoubleSupplier;
import java.util.function.Function;
import java.util.function.LongConsumer;

/**
 * Exponential back-off with proportional jitter. A retry-after hint carried by the
 * failure raises the delay to at least that value, still bounded by the policy cap.
 */
class JitteredBackOffPolicy implements BackOffPolicy {

    private final ErrorClassifier classifier;
    private final Function<ErrorKind, RetryPolicy> policyResolver;
    private final Sleeper sleeper;
    private final DoubleSupplier jitterSource;
    private final LongConsumer delayListener;

    JitteredBackOffPolicy(ErrorClassifier classifier,
                          Function<ErrorKind, RetryPolicy> policyResolver,
                          Sleeper sleeper,
                          DoubleSupplier jitterSource,
                          LongConsumer delayListener) {
        this.classifier = classifier;
        this.policyResolver = policyResolver;
        this.sleeper = sleeper;
        this.jitterSource = jitterSource;
        this.delayListener = delayListener;
    }

    @Override
    public BackOffContext start(RetryContext context) {
        return new AttemptContext(context);
    }

    @Override
    public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
        RetryContext context = ((AttemptContext) backOffContext).retryContext;
        long delay = delayFor(context.getLastThrowable(), context.getRetryCount());
        delayListener.accept(delay);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("Interrupted while waiting for the next attempt", e);
        }
    }

    long delayFor(Throwable error, int failedAttempt) {
        RetryPolicy policy = policyResolver.apply(classifier.classify(error));
        long delay = policy.delayMillis(failedAttempt, jitterSource.getAsDouble());
        if (error instanceof ScrapeException scrape && scrape.getRetryAfter() != null) {
            Duration retryAfter = scrape.getRetryAfter();
            delay = Math.min(Math.max(delay, retryAfter.toMillis()), policy.maxDelay().toMillis());
        }
        return delay;
    }

    private static final class AttemptContext implements BackOffContext {
        private final transient RetryContext retryContext;

        private AttemptContext(RetryContext retryContext) {
            this.retryContext = retryContext;
        }
    }
}
