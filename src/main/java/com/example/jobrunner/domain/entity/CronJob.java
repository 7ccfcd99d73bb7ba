package com.example.jobrunner.domain.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A named, recurring unit of work driven by wall-clock time.
 * <p>
 * Unlike {@link AutomatedTask}, a cron job is mutated in place: every run
 * advances its counters and, on success, its next execution time.
 * Rows are created by configuration and never deleted by the runner.
 */
@Entity
@Table(name = "cron_jobs", indexes = {
        @Index(name = "idx_cron_job_active_next", columnList = "is_active, next_execution"),
        @Index(name = "idx_cron_job_name", columnList = "name")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CronJob {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    /**
     * Key of the job function that executes this job
     */
    @Column(name = "function_name", nullable = false, length = 200)
    private String functionName;

    /**
     * One of the supported recurrence descriptors, e.g. {@code 0 9 * * *}
     */
    @Column(name = "schedule_expression", nullable = false, length = 100)
    private String scheduleExpression;

    /**
     * Opaque parameters handed to the job function
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "parameters")
    @Builder.Default
    private Map<String, Object> parameters = new HashMap<>();

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "next_execution")
    private Instant nextExecution;

    @Column(name = "last_execution")
    private Instant lastExecution;

    @Column(name = "execution_count", nullable = false)
    @Builder.Default
    private long executionCount = 0;

    @Column(name = "failure_count", nullable = false)
    @Builder.Default
    private long failureCount = 0;

    // === Claim lease ===

    /**
     * Instance currently executing this job
     */
    @Column(name = "locked_by", length = 100)
    private String lockedBy;

    @Column(name = "locked_until")
    private Instant lockedUntil;

    // === Audit Fields ===

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        if (this.createdAt == null) {
            this.createdAt = now;
        }
        this.updatedAt = now;
        if (this.parameters == null) {
            this.parameters = new HashMap<>();
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // === Helper Methods ===

    /**
     * Check if the job is due at the given instant
     */
    public boolean isDue(Instant now) {
        return nextExecution != null && !nextExecution.isAfter(now);
    }

    /**
     * Apply a successful run: advance the schedule and count the execution
     */
    public void recordSuccess(Instant executedAt, Instant next) {
        this.lastExecution = executedAt;
        this.nextExecution = next;
        this.executionCount++;
        releaseClaim();
    }

    /**
     * Apply a failed run. The schedule is left untouched so the job stays overdue.
     */
    public void recordFailure() {
        this.failureCount++;
        releaseClaim();
    }

    public void releaseClaim() {
        this.lockedBy = null;
        this.lockedUntil = null;
    }

    /**
     * Parameters merged with the invocation metadata every job function receives
     */
    public Map<String, Object> buildInvocationInput() {
        var input = new HashMap<String, Object>();
        if (parameters != null) {
            input.putAll(parameters);
        }
        input.put("job_id", id != null ? id.toString() : null);
        input.put("job_name", name);
        input.put("scheduled_execution", true);
        return input;
    }
}
