package com.example.jobrunner.service.cron;

import com.example.jobrunner.config.JobRunnerProperties;
import com.example.jobrunner.domain.entity.CronJob;
import com.example.jobrunner.domain.repository.CronExecutionRepository;
import com.example.jobrunner.domain.repository.CronJobRepository;
import com.example.jobrunner.dto.CronJobResponse;
import com.example.jobrunner.dto.CronJobRunResult;
import com.example.jobrunner.exception.CronJobNotFoundException;
import com.example.jobrunner.mapper.RunnerMapper;
import com.example.jobrunner.service.handler.JobFunctionRegistry;
import com.example.jobrunner.service.schedule.CronScheduleCalculator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("CronJobDispatcher Tests")
class CronJobDispatcherTest {

    private static final Instant NOW = Instant.parse("2024-03-14T08:00:00Z");

    @Mock
    private CronJobRepository cronJobRepository;

    @Mock
    private CronExecutionRepository executionRepository;

    @Mock
    private CronJobExecutor executor;

    @Mock
    private JobFunctionRegistry functionRegistry;

    @Mock
    private RunnerMapper mapper;

    private JobRunnerProperties properties;
    private CronJobDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        properties = new JobRunnerProperties();
        dispatcher = new CronJobDispatcher(cronJobRepository, executionRepository, executor, functionRegistry,
                new CronScheduleCalculator(properties), mapper, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private CronJob job(String name, long minutesOverdue) {
        return CronJob.builder()
                .id(UUID.randomUUID())
                .name(name)
                .functionName(name + "-fn")
                .scheduleExpression("0 * * * *")
                .nextExecution(NOW.minusSeconds(minutesOverdue * 60))
                .build();
    }

    private CronJobRunResult ok(CronJob job) {
        return CronJobRunResult.builder().success(true).jobId(job.getId()).jobName(job.getName()).build();
    }

    @Nested
    @DisplayName("runJob Tests")
    class RunJobTests {

        @Test
        @DisplayName("Should answer a job id that is not a UUID as not found")
        void shouldTreatMalformedIdAsNotFound() {
            // When
            var result = dispatcher.runJob("not-a-uuid", false, false);

            // Then
            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getError()).isEqualTo(CronJobRunResult.JOB_NOT_FOUND);
            assertThat(result.getMessage()).isEqualTo("Job not found: not-a-uuid");
            verifyNoInteractions(executor);
        }

        @Test
        @DisplayName("Should pass a well-formed job id to the executor")
        void shouldParseWellFormedId() {
            // Given
            var job = job("nightly", 5);
            when(executor.execute(job.getId(), true, false)).thenReturn(ok(job));

            // When
            var result = dispatcher.runJob(" " + job.getId() + " ", true, false);

            // Then
            assertThat(result.isSuccess()).isTrue();
            verify(executor).execute(job.getId(), true, false);
        }
    }

    @Nested
    @DisplayName("runDueJobs Tests")
    class RunDueJobsTests {

        @Test
        @DisplayName("Should run every due job in order and isolate failures")
        void shouldIsolateFailures() {
            // Given
            var first = job("first", 30);
            var second = job("second", 20);
            var third = job("third", 10);
            when(cronJobRepository.findDueJobs(NOW)).thenReturn(List.of(first, second, third));
            when(executor.execute(first.getId(), false, false)).thenReturn(ok(first));
            when(executor.execute(second.getId(), false, false)).thenThrow(new IllegalStateException("Execution already closed"));
            when(executor.execute(third.getId(), false, false)).thenReturn(ok(third));

            // When
            var summary = dispatcher.runDueJobs(false, false);

            // Then
            assertThat(summary.isSuccess()).isTrue();
            assertThat(summary.getTotalExecuted()).isEqualTo(3);
            assertThat(summary.getTotalSucceeded()).isEqualTo(2);
            assertThat(summary.getTotalFailed()).isEqualTo(1);
            assertThat(summary.getExecutedJobs())
                    .extracting(CronJobRunResult::getJobName)
                    .containsExactly("first", "second", "third");
            assertThat(summary.getExecutedJobs().get(1).getError()).isEqualTo("Execution already closed");

            var inOrder = inOrder(executor);
            inOrder.verify(executor).execute(first.getId(), false, false);
            inOrder.verify(executor).execute(second.getId(), false, false);
            inOrder.verify(executor).execute(third.getId(), false, false);
        }

        @Test
        @DisplayName("Should pass force and dry-run flags to every job")
        void shouldPassFlags() {
            // Given
            var only = job("only", 5);
            when(cronJobRepository.findDueJobs(NOW)).thenReturn(List.of(only));
            when(executor.execute(only.getId(), true, true)).thenReturn(ok(only));

            // When
            var summary = dispatcher.runDueJobs(true, true);

            // Then
            assertThat(summary.isDryRun()).isTrue();
            assertThat(summary.getTotalExecuted()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should return an empty summary when nothing is due")
        void shouldReturnEmptySummary() {
            // Given
            when(cronJobRepository.findDueJobs(NOW)).thenReturn(List.of());

            // When
            var summary = dispatcher.runDueJobs(false, false);

            // Then
            assertThat(summary.getExecutedJobs()).isEmpty();
            assertThat(summary.getTotalExecuted()).isZero();
            verifyNoInteractions(executor);
        }

        @Test
        @DisplayName("Should abort the pass on store failures")
        void shouldPropagateStoreFailures() {
            // Given
            var first = job("first", 30);
            var second = job("second", 20);
            when(cronJobRepository.findDueJobs(NOW)).thenReturn(List.of(first, second));
            when(executor.execute(first.getId(), false, false)).thenThrow(new DataAccessResourceFailureException("connection lost"));

            // When / Then
            assertThatThrownBy(() -> dispatcher.runDueJobs(false, false))
                    .isInstanceOf(DataAccessResourceFailureException.class);
            verify(executor, never()).execute(second.getId(), false, false);
        }
    }

    @Test
    @DisplayName("Should list due jobs without running them")
    void shouldListPendingJobs() {
        // Given
        var due = List.of(job("a", 10), job("b", 5));
        var responses = List.of(CronJobResponse.builder().name("a").build(), CronJobResponse.builder().name("b").build());
        when(cronJobRepository.findDueJobs(NOW)).thenReturn(due);
        when(mapper.toJobResponses(due)).thenReturn(responses);

        // When
        var pending = dispatcher.getPendingJobs();

        // Then
        assertThat(pending.isSuccess()).isTrue();
        assertThat(pending.getTotalPending()).isEqualTo(2);
        assertThat(pending.getPendingJobs()).isEqualTo(responses);
        assertThat(pending.getCurrentTime()).isEqualTo(NOW);
        verifyNoInteractions(executor);
    }

    @Test
    @DisplayName("Should reject execution history of an unknown job")
    void shouldRejectHistoryOfUnknownJob() {
        // Given
        var jobId = UUID.randomUUID();
        when(cronJobRepository.existsById(jobId)).thenReturn(false);

        // When / Then
        assertThatThrownBy(() -> dispatcher.getExecutions(jobId)).isInstanceOf(CronJobNotFoundException.class);
        verifyNoInteractions(executionRepository);
    }

    @Nested
    @DisplayName("Scheduled scan Tests")
    class ScheduledScanTests {

        @Test
        @DisplayName("Should do nothing when scheduling is disabled")
        void shouldSkipWhenDisabled() {
            // Given
            properties.setSchedulingEnabled(false);

            // When
            dispatcher.scheduledScan();

            // Then
            verifyNoInteractions(cronJobRepository, executor);
        }

        @Test
        @DisplayName("Should log and swallow errors of a scheduled pass")
        void shouldSwallowErrors() {
            // Given
            when(cronJobRepository.findDueJobs(NOW)).thenThrow(new DataAccessResourceFailureException("down"));

            // When / Then
            assertThatCode(() -> dispatcher.scheduledScan()).doesNotThrowAnyException();
            verify(executor, never()).execute(any(), anyBoolean(), anyBoolean());
        }
    }

    @Test
    @DisplayName("Should check every active job against the function registry")
    void shouldVerifyJobDefinitions() {
        // Given
        var orphan = job("orphan", 0);
        when(cronJobRepository.findByActiveTrue()).thenReturn(List.of(orphan));
        when(functionRegistry.hasFunction("orphan-fn")).thenReturn(false);

        // When / Then
        assertThatCode(() -> dispatcher.verifyJobDefinitions()).doesNotThrowAnyException();
        verify(functionRegistry).hasFunction("orphan-fn");
    }
}
