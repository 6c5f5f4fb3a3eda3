package io.matchradar.dispatch.core.scheduler;

import io.matchradar.dispatch.config.DispatchConfig;
import io.matchradar.dispatch.config.SchedulerConfig;
import io.matchradar.dispatch.core.dto.ScheduleStats;
import io.matchradar.dispatch.core.dto.TaskCategory;
import io.matchradar.dispatch.core.dto.kafka.TickSkippedEvent;
import io.matchradar.dispatch.core.queue.PriorityTaskQueue;
import io.matchradar.dispatch.core.service.TaskEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Enqueues tasks on recurring timers, one timer per category.
 *
 * <p>Each tick samples the {@link SystemLoadProbe} first and is skipped when the load is
 * above the configured threshold or when the previous tick of the same category is still
 * running. Pausing cancels the timers only; queued tasks stay where they are. A schedule paused
 * on its own stays paused across {@link #resumeAll()} until {@link #resume(String)} is called.
 */
@Service
public class DispatchScheduler {

    private static final Logger logger = LoggerFactory.getLogger(DispatchScheduler.class);

    static final String SKIP_SYSTEM_LOAD = "system-load";
    static final String SKIP_ALREADY_RUNNING = "already-running";

    private final TaskScheduler taskScheduler;
    private final PriorityTaskQueue queue;
    private final SystemLoadProbe loadProbe;
    private final TaskEventPublisher eventPublisher;
    private final SchedulerConfig config;
    private final Clock clock;

    private final Map<String, ScheduleState> schedules = new ConcurrentHashMap<>();
    private volatile boolean paused;

    public DispatchScheduler(TaskScheduler taskScheduler,
                             PriorityTaskQueue queue,
                             SystemLoadProbe loadProbe,
                             TaskEventPublisher eventPublisher,
                             DispatchConfig dispatchConfig,
                             Clock clock) {
        this.taskScheduler = taskScheduler;
        this.queue = queue;
        this.loadProbe = loadProbe;
        this.eventPublisher = eventPublisher;
        this.config = dispatchConfig.scheduler();
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startDefaultSchedules() {
        if (!config.enabled()) {
            logger.info("Recurring schedules disabled");
            return;
        }

        for (String category : queue.getLanes()) {
            Duration interval = config.intervals().get(category);
            if (interval == null) {
                interval = TaskCategory.fromCode(category).map(DefaultSchedules::intervalFor).orElse(null);
            }
            if (interval == null) {
                logger.warn("No recurring interval configured for lane {}", category);
                continue;
            }
            scheduleRecurring(category, interval, DefaultSchedules.payloadBuilder(), config.initialDelay());
        }
    }

    public String scheduleRecurring(String category, Duration interval, PayloadBuilder payloadBuilder) {
        return scheduleRecurring(category, interval, payloadBuilder, interval);
    }

    /**
     * Registers a timer that enqueues one task of {@code category} per interval,
     * replacing any timer the category already has.
     *
     * @return the schedule id
     */
    public String scheduleRecurring(String category, Duration interval, PayloadBuilder payloadBuilder,
                                    Duration initialDelay) {
        queue.getLaneSettings(category);
        requirePositive(interval);

        cancel(category);

        ScheduleState state = new ScheduleState(UUID.randomUUID().toString(), category, interval, payloadBuilder);
        schedules.put(category, state);
        if (!paused) {
            start(state, initialDelay);
        }

        logger.info("Scheduled {} every {} (schedule {})", category, interval, state.id);
        return state.id;
    }

    public boolean cancel(String category) {
        ScheduleState state = schedules.remove(category);
        if (state == null) {
            return false;
        }

        state.detach();
        logger.info("Cancelled schedule for {}", category);
        return true;
    }

    public void updateInterval(String category, Duration interval) {
        requirePositive(interval);
        ScheduleState state = requireSchedule(category);

        state.detach();
        state.setInterval(interval);
        if (!paused && !state.isPaused()) {
            start(state, interval);
        }
        logger.info("Updated schedule for {} to every {}", category, interval);
    }

    /**
     * Stops the category's timer but keeps the schedule, its interval and its stats registered.
     */
    public void pause(String category) {
        ScheduleState state = requireSchedule(category);
        state.setPaused(true);
        state.detach();
        logger.info("Paused schedule for {}", category);
    }

    public void resume(String category) {
        ScheduleState state = requireSchedule(category);
        state.setPaused(false);
        state.detach();
        if (!paused) {
            start(state, state.interval());
        }
        logger.info("Resumed schedule for {}", category);
    }

    public boolean isPaused(String category) {
        return paused || requireSchedule(category).isPaused();
    }

    public void pauseAll() {
        paused = true;
        schedules.values().forEach(ScheduleState::detach);
        logger.info("Paused {} schedules", schedules.size());
    }

    public void resumeAll() {
        paused = false;
        for (ScheduleState state : schedules.values()) {
            state.detach();
            if (!state.isPaused()) {
                start(state, state.interval());
            }
        }
        logger.info("Resumed {} schedules", schedules.size());
    }

    public boolean isPaused() {
        return paused;
    }

    public Optional<ScheduleStats> getStats(String category) {
        return Optional.ofNullable(schedules.get(category)).map(ScheduleState::toStats);
    }

    public Map<String, ScheduleStats> getAllStats() {
        Map<String, ScheduleStats> stats = new LinkedHashMap<>();
        schedules.forEach((category, state) -> stats.put(category, state.toStats()));
        return stats;
    }

    /**
     * Runs one tick of the category's schedule now.
     *
     * @return {@code true} when a task was enqueued
     */
    public boolean triggerNow(String category) {
        ScheduleState state = requireSchedule(category);
        return runTick(state);
    }

    boolean runTick(ScheduleState state) {
        String category = state.category;
        Instant now = clock.instant();

        double load = sampleLoad();
        if (load > config.loadThreshold()) {
            state.recordSkip();
            logger.info("Skipping {} tick: system load {} above threshold {}",
                    category, String.format("%.2f", load), config.loadThreshold());
            eventPublisher.publishTickSkipped(
                    TickSkippedEvent.create(category, SKIP_SYSTEM_LOAD, load, config.loadThreshold(), now));
            return false;
        }

        if (!state.running.compareAndSet(false, true)) {
            state.recordSkip();
            logger.warn("Skipping {} tick: previous tick still running", category);
            eventPublisher.publishTickSkipped(
                    TickSkippedEvent.create(category, SKIP_ALREADY_RUNNING, load, config.loadThreshold(), now));
            return false;
        }

        long start = clock.millis();
        state.recordStart(now);
        try {
            String taskId = queue.addTask(category, state.payloadBuilder.build(category, now));
            long executionMs = clock.millis() - start;
            state.recordSuccess(now, executionMs);
            logger.debug("Tick enqueued task {} for {} in {}ms", taskId, category, executionMs);
            return true;
        } catch (Exception e) {
            state.recordFailure(clock.millis() - start);
            logger.error("Scheduled tick for {} failed: {}", category, e.getMessage(), e);
            return false;
        } finally {
            state.running.set(false);
        }
    }

    private void start(ScheduleState state, Duration initialDelay) {
        Instant firstRun = clock.instant().plus(initialDelay != null ? initialDelay : state.interval());
        state.attach(taskScheduler.scheduleAtFixedRate(() -> runTick(state), firstRun, state.interval()));
    }

    private double sampleLoad() {
        try {
            return loadProbe.currentLoad();
        } catch (RuntimeException e) {
            logger.error("Failed to sample system load, running tick anyway: {}", e.getMessage());
            return 0.0;
        }
    }

    private ScheduleState requireSchedule(String category) {
        ScheduleState state = schedules.get(category);
        if (state == null) {
            throw new IllegalArgumentException("No schedule for category " + category);
        }
        return state;
    }

    private static void requirePositive(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Interval must be positive, got " + interval);
        }
    }
}
