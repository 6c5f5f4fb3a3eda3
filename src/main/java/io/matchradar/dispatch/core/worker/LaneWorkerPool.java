package io.matchradar.dispatch.core.worker;

import io.matchradar.dispatch.config.DispatchConfig;
import io.matchradar.dispatch.config.LaneConfig;
import io.matchradar.dispatch.config.QueueConfig;
import io.matchradar.dispatch.core.dto.ErrorContext;
import io.matchradar.dispatch.core.dto.Task;
import io.matchradar.dispatch.core.dto.TaskOutcome;
import io.matchradar.dispatch.core.error.ErrorHandler;
import io.matchradar.dispatch.core.exception.CircuitOpenException;
import io.matchradar.dispatch.core.exception.ErrorKind;
import io.matchradar.dispatch.core.exception.ScrapeException;
import io.matchradar.dispatch.core.queue.PriorityTaskQueue;
import io.matchradar.dispatch.core.retry.RetryManager;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker threads that drain the lanes: claim a task, run it through the retry manager
 * and report the outcome. Each lane gets its own configurable number of workers.
 */
@Service
public class LaneWorkerPool {

    private static final Logger logger = LoggerFactory.getLogger(LaneWorkerPool.class);

    static final String OPERATION_PREFIX = "scrape:";
    private static final LaneConfig DEFAULT_LANE = new LaneConfig(0, 0, 0, null, null);

    private final PriorityTaskQueue queue;
    private final RetryManager retryManager;
    private final ErrorHandler errorHandler;
    private final ScrapeExecutor executor;
    private final QueueConfig queueConfig;
    private final Clock clock;

    private final List<Thread> workers = new ArrayList<>();
    private ExecutorService operationPool;
    private volatile boolean running;

    @Autowired
    public LaneWorkerPool(PriorityTaskQueue queue,
                          RetryManager retryManager,
                          ErrorHandler errorHandler,
                          ObjectProvider<ScrapeExecutor> executor,
                          DispatchConfig dispatchConfig,
                          Clock clock) {
        this(queue, retryManager, errorHandler, executor.getIfAvailable(), dispatchConfig.queue(), clock);
    }

    public LaneWorkerPool(PriorityTaskQueue queue,
                          RetryManager retryManager,
                          ErrorHandler errorHandler,
                          ScrapeExecutor executor,
                          QueueConfig queueConfig,
                          Clock clock) {
        this.queue = queue;
        this.retryManager = retryManager;
        this.errorHandler = errorHandler;
        this.executor = executor;
        this.queueConfig = queueConfig;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startOnReady() {
        if (executor == null) {
            logger.warn("No ScrapeExecutor available, lane workers not started");
            return;
        }
        start();
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        if (executor == null) {
            throw new IllegalStateException("Cannot start lane workers without a ScrapeExecutor");
        }

        running = true;
        operationPool = Executors.newCachedThreadPool(new CustomizableThreadFactory("scrape-op-"));

        for (String lane : queue.getLanes()) {
            LaneConfig config = laneConfig(lane);
            if (!config.isEnabled()) {
                logger.info("Lane {} disabled, no workers started", lane);
                continue;
            }

            for (int i = 0; i < config.concurrency(); i++) {
                Thread worker = new Thread(() -> workLoop(lane), "lane-" + lane + "-" + i);
                worker.setDaemon(true);
                workers.add(worker);
                worker.start();
            }
            logger.info("Started {} workers for lane {}", config.concurrency(), lane);
        }
    }

    @PreDestroy
    public synchronized void stop() {
        if (!running) {
            return;
        }

        running = false;
        workers.forEach(Thread::interrupt);
        for (Thread worker : workers) {
            try {
                worker.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        workers.clear();
        operationPool.shutdownNow();
        logger.info("Lane workers stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private void workLoop(String lane) {
        long idleMs = queueConfig.idlePollInterval().toMillis();

        while (running) {
            try {
                if (!processNext(lane)) {
                    Thread.sleep(idleMs);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                logger.error("Worker for lane {} failed, continuing: {}", lane, e.getMessage(), e);
            }
        }
    }

    /**
     * Claims and processes one task of the lane.
     *
     * @return {@code false} when nothing was claimable
     */
    boolean processNext(String lane) {
        Optional<Task> claimed = queue.claimNext(lane);
        if (claimed.isEmpty()) {
            return false;
        }

        Task task = claimed.get();
        Duration timeout = laneConfig(lane).timeout();
        AtomicInteger invocations = new AtomicInteger();

        try {
            retryManager.retry(OPERATION_PREFIX + lane, () -> {
                invocations.incrementAndGet();
                return executeWithTimeout(task, timeout);
            });
            queue.reportResult(task.id(), TaskOutcome.completed());
            logger.debug("Task {} in {} completed", task.id(), lane);
        } catch (CircuitOpenException e) {
            Duration wait = Duration.between(clock.instant(), e.getNextAttemptTime());
            Duration delay = wait.isNegative() ? Duration.ZERO : wait;
            if (invocations.get() == 0) {
                logger.info("Circuit {} open, task {} postponed by {}", e.getBreakerName(), task.id(), delay);
                queue.reportResult(task.id(), TaskOutcome.postponed(e, delay));
            } else {
                logger.info("Circuit {} opened while running task {}, retrying in {}", e.getBreakerName(), task.id(), delay);
                queue.reportResult(task.id(), TaskOutcome.retryRequested(e, delay));
            }
        } catch (RuntimeException e) {
            if (!running) {
                logger.info("Worker stopping, returning task {} to {}", task.id(), lane);
                queue.reportResult(task.id(), TaskOutcome.retryRequested(e, Duration.ZERO));
                return true;
            }
            errorHandler.handle(e, new ErrorContext("lane-worker", OPERATION_PREFIX + lane, Map.of(
                    "taskId", task.id(),
                    "target", String.valueOf(task.target()),
                    "attempt", task.attemptCount())));
            queue.reportResult(task.id(), TaskOutcome.failed(e));
        }
        return true;
    }

    private Object executeWithTimeout(Task task, Duration timeout) throws Exception {
        if (operationPool == null) {
            return executor.execute(task);
        }

        Future<Object> future = operationPool.submit(() -> executor.execute(task));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ScrapeException("Operation timed out after " + timeout.toMillis() + "ms", e, ErrorKind.NETWORK);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ScrapeException("Interrupted while running task " + task.id(), e, ErrorKind.SYSTEM, Boolean.FALSE, null);
        }
    }

    private LaneConfig laneConfig(String lane) {
        return queueConfig.lanes().getOrDefault(lane, DEFAULT_LANE);
    }
}
