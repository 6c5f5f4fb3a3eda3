package io.matchradar.dispatch.core.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
public class QueueMaintenanceService {

    private static final Logger logger = LoggerFactory.getLogger(QueueMaintenanceService.class);

    private final PriorityTaskQueue queue;

    public QueueMaintenanceService(PriorityTaskQueue queue) {
        this.queue = queue;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(0)
    public void restoreLanes() {
        try {
            queue.restore();
        } catch (Exception e) {
            logger.error("Failed to restore lanes from the task store", e);
        }
    }

    @Scheduled(
            fixedRateString = "#{@dispatchProps.cleanupIntervalMs}",
            initialDelayString = "#{@dispatchProps.cleanupIntervalMs}"
    )
    public void cleanupFinishedTasks() {
        int removed = 0;
        for (String lane : queue.getLanes()) {
            try {
                removed += queue.cleanup(lane);
            } catch (Exception e) {
                logger.error("Cleanup of lane {} failed: {}", lane, e.getMessage(), e);
            }
        }
        logger.debug("Cleanup pass removed {} tasks", removed);
    }
}
