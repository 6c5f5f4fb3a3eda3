package io.matchradar.dispatch.core.retry;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * How often and how patiently an operation is retried.
 *
 * @param maxAttempts    total attempts including the first one
 * @param baseDelay      delay before the second attempt
 * @param backoffFactor  multiplier applied per further attempt
 * @param jitterFactor   upper bound of the random extra delay, as a fraction of the delay
 * @param maxDelay       cap applied after jitter
 * @param retryCondition extra veto on retrying a given error, may be {@code null}
 */
public record RetryPolicy(
        int maxAttempts,
        Duration baseDelay,
        double backoffFactor,
        double jitterFactor,
        Duration maxDelay,
        Predicate<Throwable> retryCondition
) {
    public static final double DEFAULT_JITTER_FACTOR = 0.1;
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException("backoffFactor must be at least 1.0, got " + backoffFactor);
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be within [0, 1], got " + jitterFactor);
        }
        if (baseDelay == null) baseDelay = Duration.ZERO;
        if (maxDelay == null) maxDelay = DEFAULT_MAX_DELAY;
    }

    public static RetryPolicy of(int maxAttempts, Duration baseDelay, double backoffFactor) {
        return new RetryPolicy(maxAttempts, baseDelay, backoffFactor, DEFAULT_JITTER_FACTOR, DEFAULT_MAX_DELAY, null);
    }

    public static RetryPolicy noRetry() {
        return of(1, Duration.ZERO, 1.0);
    }

    public RetryPolicy withRetryCondition(Predicate<Throwable> condition) {
        return new RetryPolicy(maxAttempts, baseDelay, backoffFactor, jitterFactor, maxDelay, condition);
    }

    public RetryPolicy withJitterFactor(double factor) {
        return new RetryPolicy(maxAttempts, baseDelay, backoffFactor, factor, maxDelay, retryCondition);
    }

    public RetryPolicy withMaxDelay(Duration cap) {
        return new RetryPolicy(maxAttempts, baseDelay, backoffFactor, jitterFactor, cap, retryCondition);
    }

    /**
     * Delay after the given failed attempt.
     *
     * @param attempt 1-based number of the attempt that just failed
     * @param random  uniform sample in [0, 1) scaling the jitter
     */
    public long delayMillis(int attempt, double random) {
        double delay = baseDelay.toMillis() * Math.pow(backoffFactor, Math.max(0, attempt - 1));
        double jitter = delay * jitterFactor * random;
        return (long) Math.min(delay + jitter, maxDelay.toMillis());
    }
}
