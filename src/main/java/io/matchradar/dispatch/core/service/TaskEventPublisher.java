package io.matchradar.dispatch.core.service;

import io.matchradar.dispatch.config.KafkaProperties;
import io.matchradar.dispatch.core.dto.Task;
import io.matchradar.dispatch.core.dto.kafka.TaskCompletedEvent;
import io.matchradar.dispatch.core.dto.kafka.TaskFailedEvent;
import io.matchradar.dispatch.core.dto.kafka.TickSkippedEvent;
import io.matchradar.dispatch.core.queue.TaskLifecycleListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes task lifecycle events. Send failures are logged and never reach the caller.
 */
@Service
public class TaskEventPublisher implements TaskLifecycleListener {

    private static final Logger logger = LoggerFactory.getLogger(TaskEventPublisher.class);

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final KafkaProperties topics;

    public TaskEventPublisher(KafkaTemplate<String, Object> kafkaTemplate, KafkaProperties topics) {
        this.kafkaTemplate = kafkaTemplate;
        this.topics = topics;
    }

    @Override
    public void taskCompleted(Task task) {
        try {
            TaskCompletedEvent event = TaskCompletedEvent.create(task);

            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(topics.taskCompleted(), task.id(), event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.debug("Sent task completed event: {} to partition: {}",
                            task.id(), result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to send task completed event: {}", task.id(), ex);
                }
            });

        } catch (Exception e) {
            logger.error("Error publishing task completed event for task: {}", task.id(), e);
        }
    }

    @Override
    public void taskFailed(Task task) {
        try {
            TaskFailedEvent event = TaskFailedEvent.create(task);

            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(topics.taskFailed(), task.id(), event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Sent task failed event: {} ({} after {} attempts)",
                            task.id(), task.category(), task.attemptCount());
                } else {
                    logger.error("Failed to send task failed event: {}", task.id(), ex);
                }
            });

        } catch (Exception e) {
            logger.error("Error publishing task failed event for task: {}", task.id(), e);
        }
    }

    public void publishTickSkipped(TickSkippedEvent event) {
        try {
            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(topics.tickSkipped(), event.category(), event);

            future.whenComplete((result, ex) -> {
                if (ex != null) {
                    logger.error("Failed to send tick skipped event for {}", event.category(), ex);
                }
            });

        } catch (Exception e) {
            logger.error("Error publishing tick skipped event for category: {}", event.category(), e);
        }
    }
}
