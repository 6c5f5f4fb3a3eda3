package io.matchradar.dispatch.core.service;

import io.matchradar.dispatch.config.KafkaProperties;
import io.matchradar.dispatch.core.dto.Task;
import io.matchradar.dispatch.core.dto.kafka.TaskCompletedEvent;
import io.matchradar.dispatch.core.dto.kafka.TaskFailedEvent;
import io.matchradar.dispatch.core.dto.kafka.TickSkippedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TaskEventPublisherTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private TaskEventPublisher publisher;
    private Task task;

    @BeforeEach
    void setUp() {
        var topics = new KafkaProperties(
                "test-task-completed",
                "test-task-failed",
                "test-tick-skipped"
        );

        publisher = new TaskEventPublisher(kafkaTemplate, topics);
        task = Task.create("t-1", "https://www.flashscore.com/match/abc", "live-match", 100, 3, 1L, NOW, Map.of())
                .claimed(NOW);
    }

    @Test
    void shouldPublishTaskCompletedEvent() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(new CompletableFuture<>());

        publisher.taskCompleted(task.completed(NOW.plusSeconds(3)));

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq("test-task-completed"), eq("t-1"), captor.capture());
        assertThat(captor.getValue()).isInstanceOfSatisfying(TaskCompletedEvent.class, event -> {
            assertThat(event.category()).isEqualTo("live-match");
            assertThat(event.attempts()).isEqualTo(1);
            assertThat(event.completedAt()).isEqualTo(NOW.plusSeconds(3));
        });
    }

    @Test
    void shouldPublishTaskFailedEventWithReason() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(new CompletableFuture<>());

        publisher.taskFailed(task.failed(NOW, "RuntimeException: ECONNREFUSED"));

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq("test-task-failed"), eq("t-1"), captor.capture());
        assertThat(captor.getValue()).isInstanceOfSatisfying(TaskFailedEvent.class, event ->
                assertThat(event.failureReason()).isEqualTo("RuntimeException: ECONNREFUSED"));
    }

    @Test
    void shouldPublishTickSkippedKeyedByCategory() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(new CompletableFuture<>());
        TickSkippedEvent event = TickSkippedEvent.create("live-match", "system-load", 0.93, 0.8, NOW);

        publisher.publishTickSkipped(event);

        verify(kafkaTemplate).send("test-tick-skipped", "live-match", event);
    }

    @Test
    void shouldNotThrowWhenBrokerRejectsSend() {
        when(kafkaTemplate.send(anyString(), anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        assertThatCode(() -> publisher.taskFailed(task.failed(NOW, "boom"))).doesNotThrowAnyException();
    }

    @Test
    void shouldNotThrowWhenTemplateFails() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenThrow(new IllegalStateException("no producer"));

        assertThatCode(() -> publisher.taskCompleted(task.completed(NOW))).doesNotThrowAnyException();
    }
}
