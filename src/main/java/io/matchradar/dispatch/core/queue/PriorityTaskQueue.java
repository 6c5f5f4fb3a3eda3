package io.matchradar.dispatch.core.queue;

import io.matchradar.dispatch.config.DispatchConfig;
import io.matchradar.dispatch.config.LaneConfig;
import io.matchradar.dispatch.config.QueueConfig;
import io.matchradar.dispatch.core.dto.QueueStats;
import io.matchradar.dispatch.core.dto.Task;
import io.matchradar.dispatch.core.dto.TaskCategory;
import io.matchradar.dispatch.core.dto.TaskOptions;
import io.matchradar.dispatch.core.dto.TaskOutcome;
import io.matchradar.dispatch.core.dto.TaskStatus;
import io.matchradar.dispatch.core.exception.IllegalTaskStateException;
import io.matchradar.dispatch.core.exception.TaskCancelledException;
import io.matchradar.dispatch.core.exception.TaskNotFoundException;
import io.matchradar.dispatch.core.exception.UnknownCategoryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-category priority queues of scraping tasks.
 *
 * <p>Every category is an independent lane: higher priority is claimed first, equal
 * priorities in submission order. Task records are persisted through {@link TaskStore};
 * the lane keeps the claim order in memory and is rebuilt from the store by {@link #restore()}.
 * Claims on one lane are serialized by the lane's lock, so a task is never handed to two workers.
 */
@Service
public class PriorityTaskQueue {

    private static final Logger logger = LoggerFactory.getLogger(PriorityTaskQueue.class);

    static final int FALLBACK_PRIORITY = 50;

    private final TaskStore store;
    private final Clock clock;
    private final Duration retention;
    private final List<TaskLifecycleListener> listeners;
    private final Map<String, TaskLane> lanes = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Autowired
    public PriorityTaskQueue(TaskStore store,
                             DispatchConfig dispatchConfig,
                             Clock clock,
                             ObjectProvider<TaskLifecycleListener> listeners) {
        this(store, dispatchConfig.queue(), clock, listeners.orderedStream().toList());
    }

    public PriorityTaskQueue(TaskStore store,
                             QueueConfig queueConfig,
                             Clock clock,
                             List<TaskLifecycleListener> listeners) {
        this.store = store;
        this.clock = clock;
        this.retention = queueConfig.retention();
        this.listeners = List.copyOf(listeners);
        registerConfiguredLanes(queueConfig);
    }

    public void registerLane(String category, int defaultPriority, int maxAttempts) {
        lanes.put(category, new TaskLane(new LaneSettings(category, defaultPriority, maxAttempts)));
        logger.info("Registered lane {} (priority {}, max attempts {})", category, defaultPriority, maxAttempts);
    }

    public Set<String> getLanes() {
        return Set.copyOf(lanes.keySet());
    }

    public LaneSettings getLaneSettings(String category) {
        return lane(category).settings();
    }

    public String addTask(String category, Map<String, Object> payload) {
        return addTask(category, payload, TaskOptions.defaults());
    }

    public String addTask(String category, Map<String, Object> payload, TaskOptions options) {
        TaskLane lane = lane(category);
        TaskOptions opts = options != null ? options : TaskOptions.defaults();
        LaneSettings settings = lane.settings();

        int priority = opts.priority() != null ? opts.priority() : settings.defaultPriority();
        int maxAttempts = opts.maxAttempts() != null ? opts.maxAttempts() : settings.maxAttempts();
        Instant now = clock.instant();

        Task task = Task.create(UUID.randomUUID().toString(), opts.target(), category, priority, maxAttempts,
                sequence.incrementAndGet(), now, payload);

        lane.lock().lock();
        try {
            if (opts.delay() != null && opts.delay().compareTo(Duration.ZERO) > 0) {
                task = task.delayedUntil(now, now.plus(opts.delay()), null);
                store.save(task);
                lane.delay(task);
            } else {
                store.save(task);
                lane.enqueue(task);
            }
        } finally {
            lane.lock().unlock();
        }

        logger.debug("Added task {} to {} with priority {}", task.id(), category, priority);
        return task.id();
    }

    /**
     * Claims the next task of the lane and marks it in progress.
     *
     * @return empty when the lane is paused or has nothing due
     */
    public Optional<Task> claimNext(String category) {
        TaskLane lane = lane(category);
        if (lane.isPaused()) {
            return Optional.empty();
        }

        lane.lock().lock();
        try {
            Instant now = clock.instant();
            promoteDue(lane, now);

            Task next = lane.poll();
            if (next == null) {
                return Optional.empty();
            }

            Task claimed = next.claimed(now);
            store.save(claimed);
            logger.debug("Claimed task {} from {} (attempt {}/{})",
                    claimed.id(), category, claimed.attemptCount(), claimed.maxAttempts());
            return Optional.of(claimed);
        } finally {
            lane.lock().unlock();
        }
    }

    /**
     * Applies a worker's outcome to an in-progress task. The status check and the write
     * happen under the lane lock, so of two reports racing for the same claim only the
     * first is applied.
     */
    public Task reportResult(String taskId, TaskOutcome outcome) {
        String category = store.findById(taskId)
                .map(Task::category)
                .orElseThrow(() -> new TaskNotFoundException(taskId));
        TaskLane lane = lane(category);
        Task updated;

        lane.lock().lock();
        try {
            Task task = store.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
            if (task.status() != TaskStatus.IN_PROGRESS) {
                throw new IllegalTaskStateException(taskId, task.status(), "reportResult");
            }

            Instant now = clock.instant();
            updated = switch (outcome.type()) {
                case COMPLETED -> task.completed(now);
                case FAILED -> task.failed(now, describe(outcome.error()));
                case RETRY_REQUESTED -> requeue(lane, task, outcome, now);
                case POSTPONED -> postpone(task, outcome, now);
            };
            store.save(updated);
            if (updated.status() == TaskStatus.PENDING) {
                lane.enqueue(updated);
            } else if (updated.status() == TaskStatus.RETRY_SCHEDULED) {
                lane.delay(updated);
            }
        } finally {
            lane.lock().unlock();
        }

        notifyListeners(updated);
        return updated;
    }

    public Optional<TaskStatus> getStatus(String taskId) {
        return store.findById(taskId).map(Task::status);
    }

    public Optional<Task> findTask(String taskId) {
        return store.findById(taskId);
    }

    public QueueStats getQueueStats(String category) {
        TaskLane lane = lane(category);

        lane.lock().lock();
        try {
            promoteDue(lane, clock.instant());
            return new QueueStats(
                    category,
                    lane.waitingCount(),
                    (int) store.countByCategoryAndStatus(category, TaskStatus.IN_PROGRESS),
                    (int) store.countByCategoryAndStatus(category, TaskStatus.COMPLETED),
                    (int) store.countByCategoryAndStatus(category, TaskStatus.FAILED),
                    lane.delayedCount(),
                    lane.isPaused()
            );
        } finally {
            lane.lock().unlock();
        }
    }

    /**
     * Puts up to {@code limit} failed tasks back in the lane with a fresh attempt budget,
     * oldest failure first.
     *
     * @return number of re-queued tasks
     */
    public int retryFailed(String category, int limit) {
        TaskLane lane = lane(category);
        Instant now = clock.instant();

        lane.lock().lock();
        try {
            List<Task> failed = store.findByCategoryAndStatus(category, TaskStatus.FAILED).stream()
                    .sorted(Comparator.comparing(Task::updatedAt).thenComparingLong(Task::sequence))
                    .limit(Math.max(0, limit))
                    .toList();

            for (Task task : failed) {
                Task reset = task.resetForRetry(now, sequence.incrementAndGet());
                store.save(reset);
                lane.enqueue(reset);
            }

            if (!failed.isEmpty()) {
                logger.info("Re-queued {} failed tasks in {}", failed.size(), category);
            }
            return failed.size();
        } finally {
            lane.lock().unlock();
        }
    }

    public int cleanup(String category) {
        return cleanup(category, retention);
    }

    /**
     * Deletes completed and failed tasks last updated before {@code now - gracePeriod}.
     *
     * @return number of deleted tasks
     */
    public int cleanup(String category, Duration gracePeriod) {
        TaskLane lane = lane(category);
        Instant cutoff = clock.instant().minus(gracePeriod);
        int removed = 0;

        lane.lock().lock();
        try {
            for (TaskStatus status : List.of(TaskStatus.COMPLETED, TaskStatus.FAILED)) {
                for (Task task : store.findByCategoryAndStatus(category, status)) {
                    Optional<Task> current = store.findById(task.id());
                    if (current.isPresent() && current.get().status().isTerminal()
                            && current.get().updatedAt().isBefore(cutoff)) {
                        store.delete(task.id());
                        removed++;
                    }
                }
            }
        } finally {
            lane.lock().unlock();
        }

        if (removed > 0) {
            logger.info("Cleaned up {} finished tasks from {}", removed, category);
        }
        return removed;
    }

    public void pause(String category) {
        lane(category).setPaused(true);
        logger.info("Paused lane {}", category);
    }

    public void resume(String category) {
        lane(category).setPaused(false);
        logger.info("Resumed lane {}", category);
    }

    public boolean isPaused(String category) {
        return lane(category).isPaused();
    }

    public void pauseAll() {
        lanes.values().forEach(lane -> lane.setPaused(true));
        logger.info("Paused all {} lanes", lanes.size());
    }

    public void resumeAll() {
        lanes.values().forEach(lane -> lane.setPaused(false));
        logger.info("Resumed all {} lanes", lanes.size());
    }

    /**
     * Rebuilds every lane from the store. Tasks left in progress by a previous process
     * go back to the lane, keeping their attempt count.
     */
    public void restore() {
        Instant now = clock.instant();
        int restored = 0;

        for (TaskLane lane : lanes.values()) {
            String category = lane.settings().category();
            lane.lock().lock();
            try {
                lane.clear();
                for (Task task : store.findByCategory(category)) {
                    sequence.accumulateAndGet(task.sequence(), Math::max);
                    switch (task.status()) {
                        case PENDING -> lane.enqueue(task);
                        case RETRY_SCHEDULED -> lane.delay(task);
                        case IN_PROGRESS -> {
                            Task stalled = task.requeued(now, "Stalled in previous run");
                            store.save(stalled);
                            lane.enqueue(stalled);
                            logger.warn("Re-queued stalled task {} in {}", task.id(), category);
                        }
                        case COMPLETED, FAILED -> {
                            continue;
                        }
                    }
                    restored++;
                }
            } finally {
                lane.lock().unlock();
            }
        }

        logger.info("Restored {} open tasks across {} lanes", restored, lanes.size());
    }

    private Task requeue(TaskLane lane, Task task, TaskOutcome outcome, Instant now) {
        if (isCancellation(outcome.error())) {
            return task.failed(now, describe(outcome.error()));
        }

        if (!task.hasAttemptsLeft()) {
            logger.warn("Task {} in {} exhausted {} attempts", task.id(), lane.settings().category(), task.maxAttempts());
            return task.failed(now, "Max attempts (" + task.maxAttempts() + ") exceeded: " + describe(outcome.error()));
        }

        String reason = outcome.error() != null ? describe(outcome.error()) : null;
        Duration delay = outcome.delay();
        if (delay != null && delay.compareTo(Duration.ZERO) > 0) {
            return task.delayedUntil(now, now.plus(delay), reason);
        }
        return task.requeued(now, reason);
    }

    private Task postpone(Task task, TaskOutcome outcome, Instant now) {
        Task released = task.released();
        String reason = outcome.error() != null ? describe(outcome.error()) : null;
        Duration delay = outcome.delay();
        if (delay != null && delay.compareTo(Duration.ZERO) > 0) {
            return released.delayedUntil(now, now.plus(delay), reason);
        }
        return released.requeued(now, reason);
    }

    private void promoteDue(TaskLane lane, Instant now) {
        for (Task task : lane.takeDue(now)) {
            Task ready = task.requeued(now, task.failureReason());
            store.save(ready);
            lane.enqueue(ready);
        }
    }

    private void notifyListeners(Task task) {
        if (!task.status().isTerminal()) {
            return;
        }

        for (TaskLifecycleListener listener : listeners) {
            try {
                if (task.status() == TaskStatus.COMPLETED) {
                    listener.taskCompleted(task);
                } else {
                    listener.taskFailed(task);
                }
            } catch (RuntimeException e) {
                logger.warn("Task listener {} failed for {}: {}",
                        listener.getClass().getSimpleName(), task.id(), e.getMessage());
            }
        }
    }

    private TaskLane lane(String category) {
        TaskLane lane = category != null ? lanes.get(category) : null;
        if (lane == null) {
            throw new UnknownCategoryException(category);
        }
        return lane;
    }

    private void registerConfiguredLanes(QueueConfig queueConfig) {
        if (queueConfig.lanes().isEmpty()) {
            for (TaskCategory category : TaskCategory.values()) {
                registerLane(category.code(), category.defaultPriority(), category.defaultMaxAttempts());
            }
            return;
        }

        queueConfig.lanes().forEach((name, lane) -> registerLane(name, priorityOf(name, lane), lane.maxAttempts()));
    }

    private static int priorityOf(String name, LaneConfig lane) {
        if (lane.defaultPriority() > 0) {
            return lane.defaultPriority();
        }
        return TaskCategory.fromCode(name).map(TaskCategory::defaultPriority).orElse(FALLBACK_PRIORITY);
    }

    private static boolean isCancellation(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof TaskCancelledException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }
}
