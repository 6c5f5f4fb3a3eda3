package io.matchradar.dispatch.core.breaker;

import io.matchradar.dispatch.config.CircuitBreakerConfig;
import io.matchradar.dispatch.core.exception.CircuitOpenException;
import io.matchradar.dispatch.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker breaker;
    private AtomicInteger invocations;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        breaker = new CircuitBreaker("flashscore",
                new CircuitBreakerConfig(3, Duration.ofSeconds(60), Duration.ofSeconds(10)), clock);
        invocations = new AtomicInteger();
    }

    @Test
    void shouldReportClosedStatsAfterConstruction() {
        CircuitBreakerStats stats = breaker.getStats();

        assertThat(stats.name()).isEqualTo("flashscore");
        assertThat(stats.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(stats.failureCount()).isZero();
        assertThat(stats.successCount()).isZero();
        assertThat(stats.nextAttemptTime()).isNull();
    }

    @Test
    void shouldOpenAfterThresholdAndRecoverAfterResetTimeout() throws Exception {
        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> breaker.execute(this::failing)).isInstanceOf(IOException.class);
        }
        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);

        assertThatThrownBy(() -> breaker.execute(this::succeeding))
                .isInstanceOf(CircuitOpenException.class);
        assertThat(invocations).hasValue(3);

        clock.advance(Duration.ofSeconds(61));
        String result = breaker.execute(this::succeeding);

        assertThat(result).isEqualTo("ok");
        CircuitBreakerStats stats = breaker.getStats();
        assertThat(stats.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(stats.failureCount()).isZero();
        assertThat(stats.successCount()).isEqualTo(1);
    }

    @Test
    void shouldReopenWithFreshTimerWhenHalfOpenCallFails() {
        breaker.trip();
        clock.advance(Duration.ofSeconds(60));

        assertThatThrownBy(() -> breaker.execute(this::failing)).isInstanceOf(IOException.class);

        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(breaker.getStats().nextAttemptTime()).isEqualTo(clock.instant().plusSeconds(60));
        assertThat(breaker.remainingOpenTime()).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void shouldRejectWithNextAttemptTimeWhileOpen() {
        breaker.trip();
        clock.advance(Duration.ofSeconds(20));

        assertThatThrownBy(() -> breaker.execute(this::succeeding))
                .isInstanceOfSatisfying(CircuitOpenException.class, e -> {
                    assertThat(e.getBreakerName()).isEqualTo("flashscore");
                    assertThat(e.getNextAttemptTime()).isEqualTo(clock.instant().plusSeconds(40));
                });
        assertThat(invocations).hasValue(0);
    }

    @Test
    void shouldResetConsecutiveCountOnSuccess() throws Exception {
        assertThatThrownBy(() -> breaker.execute(this::failing)).isInstanceOf(IOException.class);
        assertThatThrownBy(() -> breaker.execute(this::failing)).isInstanceOf(IOException.class);
        breaker.execute(this::succeeding);
        assertThatThrownBy(() -> breaker.execute(this::failing)).isInstanceOf(IOException.class);

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.getStats().failureCount()).isEqualTo(1);
    }

    @Test
    void shouldOpenOnConsecutiveFailuresHoweverFarApart() {
        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> breaker.execute(this::failing)).isInstanceOf(IOException.class);
            clock.advance(Duration.ofSeconds(30));
        }

        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(breaker.getStats().failureCount()).isEqualTo(3);
    }

    @Test
    void shouldAdmitSingleTrialCallWhileHalfOpen() throws Exception {
        breaker.trip();
        clock.advance(Duration.ofSeconds(61));

        CountDownLatch trialStarted = new CountDownLatch(1);
        CountDownLatch releaseTrial = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<String> trial = pool.submit(() -> breaker.execute(() -> {
                invocations.incrementAndGet();
                trialStarted.countDown();
                releaseTrial.await(5, TimeUnit.SECONDS);
                return "ok";
            }));
            assertThat(trialStarted.await(5, TimeUnit.SECONDS)).isTrue();

            for (int i = 0; i < 5; i++) {
                assertThatThrownBy(() -> breaker.execute(this::succeeding))
                        .isInstanceOfSatisfying(CircuitOpenException.class, e ->
                                assertThat(e.getNextAttemptTime()).isEqualTo(clock.instant().plusSeconds(60)));
            }
            assertThat(invocations).hasValue(1);
            assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);

            releaseTrial.countDown();
            assertThat(trial.get(5, TimeUnit.SECONDS)).isEqualTo("ok");
        } finally {
            pool.shutdownNow();
        }

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.execute(this::succeeding)).isEqualTo("ok");
        assertThat(invocations).hasValue(2);
    }

    @Test
    void shouldCloseAndClearCountersOnReset() {
        breaker.trip();

        breaker.reset();

        assertThat(breaker.getStats())
                .extracting(CircuitBreakerStats::state, CircuitBreakerStats::failureCount,
                        CircuitBreakerStats::lastFailureTime)
                .containsExactly(CircuitState.CLOSED, 0, null);
        assertThat(breaker.remainingOpenTime()).isZero();
    }

    private String failing() throws IOException {
        invocations.incrementAndGet();
        throw new IOException("ECONNREFUSED");
    }

    private String succeeding() {
        invocations.incrementAndGet();
        return "ok";
    }
}
