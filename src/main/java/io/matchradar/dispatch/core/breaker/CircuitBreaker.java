package io.matchradar.dispatch.core.breaker;

import io.matchradar.dispatch.config.CircuitBreakerConfig;
import io.matchradar.dispatch.core.ScrapeOperation;
import io.matchradar.dispatch.core.exception.CircuitOpenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Trip switch for one operation class.
 *
 * <p>Counts consecutive failures and successes. Once {@code failureThreshold} consecutive
 * failures are seen the breaker opens and rejects calls with {@link CircuitOpenException}
 * without running them. The switch to {@link CircuitState#HALF_OPEN} is lazy: the first call
 * made at least {@code resetTimeout} after the last failure is let through as a trial call. While
 * that trial call runs every other caller is rejected. A successful trial call closes the breaker, a
 * failed one opens it again with a fresh timer.
 *
 * <p>State is guarded by a per-instance lock; the protected operation itself runs outside it.
 */
public class CircuitBreaker {

    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int successCount;
    private Instant lastFailureTime;
    private boolean trialInFlight;

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        this.name = name;
        this.config = config;
        this.clock = clock;
    }

    public <T> T execute(ScrapeOperation<T> operation) throws Exception {
        acquirePermission();

        T result;
        try {
            result = operation.execute();
        } catch (Exception | Error e) {
            onFailure();
            throw e;
        }

        onSuccess();
        return result;
    }

    private void acquirePermission() {
        lock.lock();
        try {
            if (state == CircuitState.CLOSED) {
                return;
            }

            Instant now = clock.instant();
            if (state == CircuitState.HALF_OPEN) {
                if (trialInFlight) {
                    throw new CircuitOpenException(name, now.plus(config.resetTimeout()));
                }
                trialInFlight = true;
                return;
            }

            Instant nextAttempt = nextAttemptTime();
            if (now.isBefore(nextAttempt)) {
                throw new CircuitOpenException(name, nextAttempt);
            }

            state = CircuitState.HALF_OPEN;
            trialInFlight = true;
            logger.info("Circuit breaker '{}' transitioning to HALF_OPEN", name);
        } finally {
            lock.unlock();
        }
    }

    private void onSuccess() {
        lock.lock();
        try {
            trialInFlight = false;
            if (state == CircuitState.HALF_OPEN) {
                state = CircuitState.CLOSED;
                failureCount = 0;
                successCount = 0;
                logger.info("Circuit breaker '{}' CLOSED after successful recovery", name);
            }
            failureCount = 0;
            successCount++;
        } finally {
            lock.unlock();
        }
    }

    private void onFailure() {
        lock.lock();
        try {
            Instant now = clock.instant();

            trialInFlight = false;
            failureCount++;
            successCount = 0;
            lastFailureTime = now;

            if (state == CircuitState.HALF_OPEN) {
                state = CircuitState.OPEN;
                logger.warn("Circuit breaker '{}' OPEN after failed recovery attempt", name);
            } else if (state == CircuitState.CLOSED && failureCount >= config.failureThreshold()) {
                state = CircuitState.OPEN;
                logger.warn("Circuit breaker '{}' OPEN after {} consecutive failures", name, failureCount);
            }
        } finally {
            lock.unlock();
        }
    }

    public CircuitState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public CircuitBreakerStats getStats() {
        lock.lock();
        try {
            return new CircuitBreakerStats(
                    name,
                    state,
                    failureCount,
                    successCount,
                    lastFailureTime,
                    state == CircuitState.OPEN ? nextAttemptTime() : null
            );
        } finally {
            lock.unlock();
        }
    }

    /**
     * Time left until an open breaker lets a trial call through; zero when not open.
     */
    public Duration remainingOpenTime() {
        lock.lock();
        try {
            if (state != CircuitState.OPEN) {
                return Duration.ZERO;
            }
            Duration remaining = Duration.between(clock.instant(), nextAttemptTime());
            return remaining.isNegative() ? Duration.ZERO : remaining;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forces the breaker open, as if the threshold had just been reached.
     */
    public void trip() {
        lock.lock();
        try {
            state = CircuitState.OPEN;
            trialInFlight = false;
            lastFailureTime = clock.instant();
            logger.warn("Circuit breaker '{}' tripped manually", name);
        } finally {
            lock.unlock();
        }
    }

    public void reset() {
        lock.lock();
        try {
            state = CircuitState.CLOSED;
            trialInFlight = false;
            failureCount = 0;
            successCount = 0;
            lastFailureTime = null;
            logger.info("Circuit breaker '{}' reset", name);
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    private Instant nextAttemptTime() {
        return lastFailureTime.plus(config.resetTimeout());
    }
}
