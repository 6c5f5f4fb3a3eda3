package io.matchradar.dispatch.core.scheduler;

import io.matchradar.dispatch.config.DispatchConfig;
import io.matchradar.dispatch.config.QueueConfig;
import io.matchradar.dispatch.config.SchedulerConfig;
import io.matchradar.dispatch.core.dto.ScheduleStats;
import io.matchradar.dispatch.core.dto.Task;
import io.matchradar.dispatch.core.dto.kafka.TickSkippedEvent;
import io.matchradar.dispatch.core.exception.UnknownCategoryException;
import io.matchradar.dispatch.core.queue.InMemoryTaskStore;
import io.matchradar.dispatch.core.queue.PriorityTaskQueue;
import io.matchradar.dispatch.core.service.TaskEventPublisher;
import io.matchradar.dispatch.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class DispatchSchedulerTest {

    private static final String LIVE = "live-match";

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private TaskEventPublisher eventPublisher;

    @Mock
    private ScheduledFuture<Object> future;

    private MutableClock clock;
    private PriorityTaskQueue queue;
    private double load;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        queue = new PriorityTaskQueue(new InMemoryTaskStore(), QueueConfig.defaults(), clock, List.of());
        load = 0.2;
    }

    private DispatchScheduler scheduler(boolean enabled) {
        var config = new DispatchConfig(null, null, null,
                new SchedulerConfig(enabled, 0.8, Duration.ofSeconds(5), Map.of(LIVE, Duration.ofSeconds(30))), null);
        return new DispatchScheduler(taskScheduler, queue, () -> load, eventPublisher, config, clock);
    }

    private void stubScheduling() {
        doReturn(future).when(taskScheduler)
                .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
    }

    @Test
    @DisplayName("Should register fixed rate timer")
    void shouldRegisterFixedRateTimer() {
        stubScheduling();
        DispatchScheduler scheduler = scheduler(false);

        String id = scheduler.scheduleRecurring(LIVE, Duration.ofMinutes(1), DefaultSchedules.payloadBuilder());

        assertThat(id).isNotBlank();
        verify(taskScheduler).scheduleAtFixedRate(any(Runnable.class),
                eq(clock.instant().plus(Duration.ofMinutes(1))), eq(Duration.ofMinutes(1)));
        assertThat(scheduler.getStats(LIVE)).map(ScheduleStats::scheduled).contains(true);
    }

    @Test
    @DisplayName("Should enqueue task on tick")
    void shouldEnqueueTaskOnTick() {
        stubScheduling();
        DispatchScheduler scheduler = scheduler(false);
        scheduler.scheduleRecurring(LIVE, Duration.ofMinutes(1), DefaultSchedules.payloadBuilder());

        ArgumentCaptor<Runnable> tick = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).scheduleAtFixedRate(tick.capture(), any(Instant.class), any(Duration.class));
        tick.getValue().run();

        Task task = queue.claimNext(LIVE).orElseThrow();
        assertThat(task.priority()).isEqualTo(100);
        assertThat(task.payload()).containsEntry("taskType", LIVE).containsEntry("dataType", "live");

        ScheduleStats stats = scheduler.getStats(LIVE).orElseThrow();
        assertThat(stats.totalRuns()).isEqualTo(1);
        assertThat(stats.successfulRuns()).isEqualTo(1);
        assertThat(stats.lastSuccess()).isEqualTo(clock.instant());
        assertThat(stats.getSuccessRate()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should skip tick when system load above threshold")
    void shouldSkipTickWhenSystemLoadAboveThreshold() {
        stubScheduling();
        DispatchScheduler scheduler = scheduler(false);
        scheduler.scheduleRecurring(LIVE, Duration.ofMinutes(1), DefaultSchedules.payloadBuilder());
        load = 0.95;

        boolean enqueued = scheduler.triggerNow(LIVE);

        assertThat(enqueued).isFalse();
        assertThat(queue.getQueueStats(LIVE).waiting()).isZero();
        ArgumentCaptor<TickSkippedEvent> event = ArgumentCaptor.forClass(TickSkippedEvent.class);
        verify(eventPublisher).publishTickSkipped(event.capture());
        assertThat(event.getValue().reason()).isEqualTo("system-load");
        assertThat(event.getValue().load()).isEqualTo(0.95);
        assertThat(scheduler.getStats(LIVE).orElseThrow().skippedRuns()).isEqualTo(1);
        assertThat(scheduler.getStats(LIVE).orElseThrow().totalRuns()).isZero();
    }

    @Test
    @DisplayName("Should skip tick while previous tick runs")
    void shouldSkipTickWhilePreviousTickRuns() {
        stubScheduling();
        DispatchScheduler scheduler = scheduler(false);
        AtomicBoolean nestedResult = new AtomicBoolean(true);
        scheduler.scheduleRecurring(LIVE, Duration.ofMinutes(1), (category, at) -> {
            nestedResult.set(scheduler.triggerNow(category));
            return Map.of();
        });

        assertThat(scheduler.triggerNow(LIVE)).isTrue();

        assertThat(nestedResult).isFalse();
        assertThat(queue.getQueueStats(LIVE).waiting()).isEqualTo(1);
        assertThat(scheduler.getStats(LIVE).orElseThrow().skippedRuns()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should count failed tick")
    void shouldCountFailedTick() {
        stubScheduling();
        DispatchScheduler scheduler = scheduler(false);
        scheduler.scheduleRecurring(LIVE, Duration.ofMinutes(1), (category, at) -> {
            throw new IllegalStateException("fixture feed unavailable");
        });

        assertThat(scheduler.triggerNow(LIVE)).isFalse();

        ScheduleStats stats = scheduler.getStats(LIVE).orElseThrow();
        assertThat(stats.failedRuns()).isEqualTo(1);
        assertThat(stats.running()).isFalse();
    }

    @Test
    @DisplayName("Should reject unknown category and invalid interval")
    void shouldRejectUnknownCategoryAndInvalidInterval() {
        DispatchScheduler scheduler = scheduler(false);

        assertThatThrownBy(() -> scheduler.scheduleRecurring("cricket", Duration.ofMinutes(1),
                DefaultSchedules.payloadBuilder())).isInstanceOf(UnknownCategoryException.class);
        assertThatThrownBy(() -> scheduler.scheduleRecurring(LIVE, Duration.ZERO,
                DefaultSchedules.payloadBuilder())).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(taskScheduler);
    }

    @Test
    @DisplayName("Should cancel timer")
    void shouldCancelTimer() {
        stubScheduling();
        DispatchScheduler scheduler = scheduler(false);
        scheduler.scheduleRecurring(LIVE, Duration.ofMinutes(1), DefaultSchedules.payloadBuilder());

        assertThat(scheduler.cancel(LIVE)).isTrue();

        verify(future).cancel(false);
        assertThat(scheduler.getStats(LIVE)).isEmpty();
        assertThat(scheduler.cancel(LIVE)).isFalse();
    }

    @Test
    @DisplayName("Should stop and restart timers without touching queue")
    void shouldStopAndRestartTimersWithoutTouchingQueue() {
        stubScheduling();
        DispatchScheduler scheduler = scheduler(false);
        scheduler.scheduleRecurring(LIVE, Duration.ofMinutes(1), DefaultSchedules.payloadBuilder());
        queue.addTask(LIVE, Map.of());

        scheduler.pauseAll();

        verify(future).cancel(false);
        assertThat(scheduler.isPaused()).isTrue();
        assertThat(scheduler.getStats(LIVE).orElseThrow().scheduled()).isFalse();
        assertThat(queue.getQueueStats(LIVE).waiting()).isEqualTo(1);

        scheduler.resumeAll();

        verify(taskScheduler, times(2)).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        assertThat(scheduler.getStats(LIVE).orElseThrow().scheduled()).isTrue();
    }

    @Test
    @DisplayName("Should reschedule on interval update")
    void shouldRescheduleOnIntervalUpdate() {
        stubScheduling();
        DispatchScheduler scheduler = scheduler(false);
        scheduler.scheduleRecurring(LIVE, Duration.ofMinutes(1), DefaultSchedules.payloadBuilder());

        scheduler.updateInterval(LIVE, Duration.ofMinutes(5));

        verify(future).cancel(false);
        verify(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), eq(Duration.ofMinutes(5)));
        assertThat(scheduler.getStats(LIVE).orElseThrow().interval()).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("Should start default schedules when enabled")
    void shouldStartDefaultSchedulesWhenEnabled() {
        stubScheduling();
        DispatchScheduler scheduler = scheduler(true);

        scheduler.startDefaultSchedules();

        assertThat(scheduler.getAllStats()).containsOnlyKeys(
                LIVE, "upcoming-fixture", "historical-data", "league-discovery");
        assertThat(scheduler.getStats(LIVE).orElseThrow().interval()).isEqualTo(Duration.ofSeconds(30));
        assertThat(scheduler.getStats("league-discovery").orElseThrow().interval()).isEqualTo(Duration.ofDays(7));
        verify(taskScheduler).scheduleAtFixedRate(any(Runnable.class),
                eq(clock.instant().plusSeconds(5)), eq(Duration.ofSeconds(30)));
    }

    @Test
    @DisplayName("Should not start schedules when disabled")
    void shouldNotStartSchedulesWhenDisabled() {
        DispatchScheduler scheduler = scheduler(false);

        scheduler.startDefaultSchedules();

        assertThat(scheduler.getAllStats()).isEmpty();
        verify(taskScheduler, never()).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
    }

    @Test
    @DisplayName("Should pause and resume single schedule")
    void shouldPauseAndResumeSingleSchedule() {
        stubScheduling();
        DispatchScheduler scheduler = scheduler(false);
        scheduler.scheduleRecurring(LIVE, Duration.ofMinutes(1), DefaultSchedules.payloadBuilder());
        scheduler.scheduleRecurring("historical-data", Duration.ofDays(1), DefaultSchedules.payloadBuilder());

        scheduler.pause(LIVE);

        assertThat(scheduler.isPaused(LIVE)).isTrue();
        assertThat(scheduler.isPaused("historical-data")).isFalse();
        ScheduleStats paused = scheduler.getStats(LIVE).orElseThrow();
        assertThat(paused.paused()).isTrue();
        assertThat(paused.scheduled()).isFalse();
        assertThat(paused.interval()).isEqualTo(Duration.ofMinutes(1));
        assertThat(scheduler.getStats("historical-data").orElseThrow().scheduled()).isTrue();

        scheduler.resume(LIVE);

        assertThat(scheduler.isPaused(LIVE)).isFalse();
        assertThat(scheduler.getStats(LIVE).orElseThrow().scheduled()).isTrue();
        verify(taskScheduler, times(2)).scheduleAtFixedRate(any(Runnable.class),
                any(Instant.class), eq(Duration.ofMinutes(1)));
    }

    @Test
    @DisplayName("Should keep schedule paused on its own across resume all")
    void shouldKeepSchedulePausedOnItsOwnAcrossResumeAll() {
        stubScheduling();
        DispatchScheduler scheduler = scheduler(false);
        scheduler.scheduleRecurring(LIVE, Duration.ofMinutes(1), DefaultSchedules.payloadBuilder());
        scheduler.pause(LIVE);

        scheduler.pauseAll();
        scheduler.resumeAll();

        assertThat(scheduler.isPaused(LIVE)).isTrue();
        assertThat(scheduler.getStats(LIVE).orElseThrow().scheduled()).isFalse();
        verify(taskScheduler, times(1)).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        assertThatThrownBy(() -> scheduler.pause("upcoming-fixture")).isInstanceOf(IllegalArgumentException.class);
    }
}
