package io.matchradar.dispatch.core.queue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QueueMaintenanceServiceTest {

    @Mock
    private PriorityTaskQueue queue;

    @InjectMocks
    private QueueMaintenanceService maintenanceService;

    @Test
    void shouldCleanupEveryLaneEvenWhenOneFails() {
        when(queue.getLanes()).thenReturn(new LinkedHashSet<>(List.of("live-match", "historical-data")));
        when(queue.cleanup("live-match")).thenThrow(new IllegalStateException("store down"));
        when(queue.cleanup("historical-data")).thenReturn(4);

        maintenanceService.cleanupFinishedTasks();

        verify(queue).cleanup("live-match");
        verify(queue).cleanup("historical-data");
    }

    @Test
    void shouldNotFailStartupWhenRestoreFails() {
        doThrow(new IllegalStateException("store down")).when(queue).restore();

        assertThatCode(() -> maintenanceService.restoreLanes()).doesNotThrowAnyException();
        verify(queue).restore();
    }
}
