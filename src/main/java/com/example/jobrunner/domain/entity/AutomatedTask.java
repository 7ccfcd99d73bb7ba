package com.example.jobrunner.domain.entity;

import com.example.jobrunner.domain.converter.RecurrenceConverter;
import com.example.jobrunner.domain.converter.TaskStatusConverter;
import com.example.jobrunner.domain.enums.Recurrence;
import com.example.jobrunner.domain.enums.TaskStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A unit of work selected by priority and FIFO order once its scheduled time has arrived.
 * <p>
 * History is append-only: a row moves forward through its status once,
 * and a completed recurring task spawns a new row rather than reopening.
 */
@Entity
@Table(name = "automated_tasks", indexes = {
        @Index(name = "idx_auto_task_status_scheduled", columnList = "status, scheduled_at"),
        @Index(name = "idx_auto_task_priority_created", columnList = "priority DESC, created_at ASC"),
        @Index(name = "idx_auto_task_parent", columnList = "parent_task_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AutomatedTask {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Code of the task type, resolved to a handler at dispatch time
     */
    @Column(name = "task_type", nullable = false, length = 50)
    private String taskType;

    @Column(name = "task_name", length = 200)
    private String taskName;

    @Convert(converter = TaskStatusConverter.class)
    @Column(name = "status", nullable = false, length = 20)
    private TaskStatus status;

    @Column(name = "scheduled_at", nullable = false)
    private Instant scheduledAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    /**
     * Higher values are more urgent
     */
    @Column(name = "priority", nullable = false)
    @Builder.Default
    private int priority = 0;

    @Convert(converter = RecurrenceConverter.class)
    @Column(name = "recurring", nullable = false, length = 20)
    @Builder.Default
    private Recurrence recurring = Recurrence.NONE;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata")
    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "result")
    private Map<String, Object> result;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    /**
     * Completed task this row recurs from, if any
     */
    @Column(name = "parent_task_id")
    private UUID parentTaskId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        if (this.status == null) {
            this.status = TaskStatus.SCHEDULED;
        }
        if (this.recurring == null) {
            this.recurring = Recurrence.NONE;
        }
        if (this.metadata == null) {
            this.metadata = new HashMap<>();
        }
    }

    // === State transitions ===

    public void markCompleted(Map<String, Object> result, Instant completedAt) {
        transitionTo(TaskStatus.COMPLETED);
        this.result = result;
        this.completedAt = completedAt;
    }

    public void markFailed(String errorMessage, Instant completedAt) {
        transitionTo(TaskStatus.FAILED);
        this.errorMessage = errorMessage;
        this.completedAt = completedAt;
    }

    private void transitionTo(TaskStatus target) {
        if (status == null || !status.canTransitionTo(target)) {
            throw new IllegalStateException(String.format("Cannot transition task %s from %s to %s", id, status, target));
        }
        this.status = target;
    }

    /**
     * Build the next scheduled occurrence of this task. The current row is not modified.
     */
    public AutomatedTask nextOccurrence(Instant scheduledAt) {
        return AutomatedTask.builder()
                .taskType(taskType)
                .taskName(taskName)
                .status(TaskStatus.SCHEDULED)
                .scheduledAt(scheduledAt)
                .priority(priority)
                .recurring(recurring)
                .metadata(metadata != null ? new HashMap<>(metadata) : new HashMap<>())
                .parentTaskId(id)
                .build();
    }
}
