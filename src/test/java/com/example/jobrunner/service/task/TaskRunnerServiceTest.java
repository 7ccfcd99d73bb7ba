package com.example.jobrunner.service.task;

import com.example.jobrunner.config.JobRunnerProperties;
import com.example.jobrunner.domain.entity.AutomatedTask;
import com.example.jobrunner.domain.enums.Recurrence;
import com.example.jobrunner.domain.enums.TaskStatus;
import com.example.jobrunner.domain.repository.AutomatedTaskRepository;
import com.example.jobrunner.dto.CreateTaskRequest;
import com.example.jobrunner.dto.TaskResponse;
import com.example.jobrunner.mapper.RunnerMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Pageable;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("TaskRunnerService Tests")
class TaskRunnerServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-14T08:00:00Z");

    @Mock
    private AutomatedTaskRepository taskRepository;

    @Mock
    private TaskExecutorService taskExecutorService;

    @Mock
    private RunnerMapper mapper;

    @Captor
    private ArgumentCaptor<Pageable> pageableCaptor;

    @Captor
    private ArgumentCaptor<AutomatedTask> taskCaptor;

    private JobRunnerProperties properties;
    private TaskRunnerService taskRunnerService;

    @BeforeEach
    void setUp() {
        properties = new JobRunnerProperties();
        taskRunnerService = new TaskRunnerService(taskRepository, taskExecutorService, mapper, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private AutomatedTask task(int priority) {
        return AutomatedTask.builder()
                .id(UUID.randomUUID())
                .taskType("memory_consolidation")
                .status(TaskStatus.SCHEDULED)
                .scheduledAt(NOW.minusSeconds(60))
                .priority(priority)
                .createdAt(NOW.minusSeconds(120))
                .build();
    }

    @Nested
    @DisplayName("runDueTasks Tests")
    class RunDueTasksTests {

        @Test
        @DisplayName("Should select at most one batch of scheduled tasks")
        void shouldCapBatchSize() {
            // Given
            when(taskRepository.findDueTasks(eq(TaskStatus.SCHEDULED), eq(NOW), any(Pageable.class))).thenReturn(List.of());

            // When
            var summary = taskRunnerService.runDueTasks();

            // Then
            verify(taskRepository).findDueTasks(eq(TaskStatus.SCHEDULED), eq(NOW), pageableCaptor.capture());
            assertThat(pageableCaptor.getValue().getPageSize()).isEqualTo(10);
            assertThat(pageableCaptor.getValue().getPageNumber()).isZero();
            assertThat(summary.getTotal()).isZero();
            assertThat(summary.isSuccess()).isTrue();
            verifyNoInteractions(taskExecutorService);
        }

        @Test
        @DisplayName("Should use the configured batch size")
        void shouldUseConfiguredBatchSize() {
            // Given
            properties.setTaskBatchSize(3);
            when(taskRepository.findDueTasks(eq(TaskStatus.SCHEDULED), eq(NOW), any(Pageable.class))).thenReturn(List.of());

            // When
            taskRunnerService.runDueTasks();

            // Then
            verify(taskRepository).findDueTasks(eq(TaskStatus.SCHEDULED), eq(NOW), pageableCaptor.capture());
            assertThat(pageableCaptor.getValue().getPageSize()).isEqualTo(3);
        }

        @Test
        @DisplayName("Should attempt every task in order even when one fails")
        void shouldIsolateFailures() {
            // Given
            var high = task(9);
            var middle = task(5);
            var low = task(1);
            var last = task(0);
            when(taskRepository.findDueTasks(eq(TaskStatus.SCHEDULED), eq(NOW), any(Pageable.class)))
                    .thenReturn(List.of(high, middle, low, last));
            when(taskExecutorService.executeTask(high)).thenReturn(TaskOutcome.EXECUTED);
            when(taskExecutorService.executeTask(middle)).thenThrow(new IllegalStateException("Cannot transition task"));
            when(taskExecutorService.executeTask(low)).thenReturn(TaskOutcome.FAILED);
            when(taskExecutorService.executeTask(last)).thenReturn(TaskOutcome.SKIPPED);

            // When
            var summary = taskRunnerService.runDueTasks();

            // Then
            assertThat(summary.getTotal()).isEqualTo(4);
            assertThat(summary.getExecuted()).isEqualTo(1);
            assertThat(summary.getFailed()).isEqualTo(2);
            assertThat(summary.getSkipped()).isEqualTo(1);
            assertThat(summary.getExecuted() + summary.getFailed() + summary.getSkipped()).isEqualTo(summary.getTotal());
            assertThat(summary.getTimestamp()).isEqualTo(NOW);

            var inOrder = inOrder(taskExecutorService);
            inOrder.verify(taskExecutorService).executeTask(high);
            inOrder.verify(taskExecutorService).executeTask(middle);
            inOrder.verify(taskExecutorService).executeTask(low);
            inOrder.verify(taskExecutorService).executeTask(last);
        }

        @Test
        @DisplayName("Should abort the pass on store failures")
        void shouldPropagateStoreFailures() {
            // Given
            var first = task(5);
            var second = task(4);
            when(taskRepository.findDueTasks(eq(TaskStatus.SCHEDULED), eq(NOW), any(Pageable.class))).thenReturn(List.of(first, second));
            when(taskExecutorService.executeTask(first)).thenThrow(new DataAccessResourceFailureException("connection lost"));

            // When / Then
            assertThatThrownBy(() -> taskRunnerService.runDueTasks()).isInstanceOf(DataAccessResourceFailureException.class);
            verify(taskExecutorService, never()).executeTask(second);
        }

        @Test
        @DisplayName("Should swallow errors in the scheduled scan")
        void shouldSwallowScheduledErrors() {
            // Given
            when(taskRepository.findDueTasks(any(), any(), any())).thenThrow(new DataAccessResourceFailureException("down"));

            // When / Then
            assertThatCode(() -> taskRunnerService.scheduledScan()).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Should not scan when scheduling is disabled")
        void shouldSkipDisabledScan() {
            // Given
            properties.setSchedulingEnabled(false);

            // When
            taskRunnerService.scheduledScan();

            // Then
            verifyNoInteractions(taskRepository, taskExecutorService);
        }
    }

    @Nested
    @DisplayName("enqueueTask Tests")
    class EnqueueTaskTests {

        @Test
        @DisplayName("Should enqueue a task with defaults")
        void shouldEnqueueWithDefaults() {
            // Given
            var request = CreateTaskRequest.builder().taskType("marketing_campaign").build();
            var response = TaskResponse.builder().taskType("marketing_campaign").build();
            when(taskRepository.save(any(AutomatedTask.class))).thenAnswer(inv -> inv.getArgument(0));
            when(mapper.toTaskResponse(any(AutomatedTask.class))).thenReturn(response);

            // When
            var result = taskRunnerService.enqueueTask(request);

            // Then
            assertThat(result).isSameAs(response);
            verify(taskRepository).save(taskCaptor.capture());
            var saved = taskCaptor.getValue();
            assertThat(saved.getStatus()).isEqualTo(TaskStatus.SCHEDULED);
            assertThat(saved.getScheduledAt()).isEqualTo(NOW);
            assertThat(saved.getPriority()).isZero();
            assertThat(saved.getRecurring()).isEqualTo(Recurrence.NONE);
            assertThat(saved.getTaskName()).isEqualTo("Marketing Campaign");
            assertThat(saved.getMetadata()).isEmpty();
        }

        @Test
        @DisplayName("Should keep requested schedule, priority, recurrence and metadata")
        void shouldKeepRequestedValues() {
            // Given
            var scheduledAt = NOW.plusSeconds(3600);
            var request = CreateTaskRequest.builder()
                    .taskType("learning_cycle")
                    .taskName("Weekly learning")
                    .priority(8)
                    .scheduledAt(scheduledAt)
                    .recurring(Recurrence.WEEKLY)
                    .metadata(Map.of("period", "7d"))
                    .build();
            when(taskRepository.save(any(AutomatedTask.class))).thenAnswer(inv -> inv.getArgument(0));

            // When
            taskRunnerService.enqueueTask(request);

            // Then
            verify(taskRepository).save(taskCaptor.capture());
            var saved = taskCaptor.getValue();
            assertThat(saved.getTaskType()).isEqualTo("learning_cycle");
            assertThat(saved.getTaskName()).isEqualTo("Weekly learning");
            assertThat(saved.getPriority()).isEqualTo(8);
            assertThat(saved.getScheduledAt()).isEqualTo(scheduledAt);
            assertThat(saved.getRecurring()).isEqualTo(Recurrence.WEEKLY);
            assertThat(saved.getMetadata()).containsEntry("period", "7d");
        }

        @Test
        @DisplayName("Should reject unknown task types")
        void shouldRejectUnknownType() {
            var request = CreateTaskRequest.builder().taskType("send_whatsapp").build();

            assertThatThrownBy(() -> taskRunnerService.enqueueTask(request))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("send_whatsapp");
            verify(taskRepository, never()).save(any());
        }
    }
}
