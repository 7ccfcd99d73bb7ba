package com.example.jobrunner.domain.entity;

import com.example.jobrunner.domain.converter.CronExecutionStatusConverter;
import com.example.jobrunner.domain.enums.CronExecutionStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One historical attempt to run a {@link CronJob}.
 * Created as RUNNING at claim time, terminal exactly once, immutable afterwards.
 */
@Entity
@Table(name = "cron_executions", indexes = {
        @Index(name = "idx_cron_exec_job_id", columnList = "job_id"),
        @Index(name = "idx_cron_exec_started_at", columnList = "started_at"),
        @Index(name = "idx_cron_exec_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CronExecution {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    @Convert(converter = CronExecutionStatusConverter.class)
    @Column(name = "status", nullable = false, length = 20)
    private CronExecutionStatus status;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "execution_time_ms")
    private Long executionTimeMs;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "result_data")
    private Map<String, Object> resultData;

    @Column(name = "error_details", columnDefinition = "TEXT")
    private String errorDetails;

    /**
     * Instance that executed this run
     */
    @Column(name = "executor_instance", length = 100)
    private String executorInstance;

    public void markSuccess(Map<String, Object> resultData, Instant completedAt, long executionTimeMs) {
        complete(CronExecutionStatus.SUCCESS, completedAt, executionTimeMs);
        this.resultData = resultData;
    }

    public void markFailed(String errorDetails, Instant completedAt, long executionTimeMs) {
        complete(CronExecutionStatus.FAILED, completedAt, executionTimeMs);
        this.errorDetails = errorDetails;
    }

    private void complete(CronExecutionStatus terminal, Instant completedAt, long executionTimeMs) {
        if (status != null && status.isTerminal()) {
            throw new IllegalStateException(String.format("Execution %s is already %s", id, status.getCode()));
        }
        this.status = terminal;
        this.completedAt = completedAt;
        this.executionTimeMs = executionTimeMs;
    }
}
