package io.matchradar.dispatch.core.queue;

import io.matchradar.dispatch.core.dto.Task;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process index of one category's claimable tasks. Callers hold {@link #lock()}
 * around every read and write.
 */
class TaskLane {

    static final Comparator<Task> CLAIM_ORDER = Comparator
            .comparingInt(Task::priority).reversed()
            .thenComparingLong(Task::sequence);

    private final LaneSettings settings;
    private final ReentrantLock lock = new ReentrantLock();
    private final PriorityQueue<Task> pending = new PriorityQueue<>(CLAIM_ORDER);
    private final Map<String, Task> delayed = new HashMap<>();
    private volatile boolean paused;

    TaskLane(LaneSettings settings) {
        this.settings = settings;
    }

    LaneSettings settings() {
        return settings;
    }

    ReentrantLock lock() {
        return lock;
    }

    boolean isPaused() {
        return paused;
    }

    void setPaused(boolean paused) {
        this.paused = paused;
    }

    void enqueue(Task task) {
        pending.add(task);
    }

    void delay(Task task) {
        delayed.put(task.id(), task);
    }

    Task poll() {
        return pending.poll();
    }

    /**
     * Removes and returns delayed tasks whose time has come, in claim order.
     */
    List<Task> takeDue(Instant now) {
        List<Task> due = new ArrayList<>();
        Iterator<Task> iterator = delayed.values().iterator();
        while (iterator.hasNext()) {
            Task task = iterator.next();
            if (task.isDue(now)) {
                due.add(task);
                iterator.remove();
            }
        }
        due.sort(CLAIM_ORDER);
        return due;
    }

    int waitingCount() {
        return pending.size();
    }

    int delayedCount() {
        return delayed.size();
    }

    void clear() {
        pending.clear();
        delayed.clear();
    }
}
