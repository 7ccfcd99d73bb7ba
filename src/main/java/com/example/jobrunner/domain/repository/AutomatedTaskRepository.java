package com.example.jobrunner.domain.repository;

import com.example.jobrunner.domain.entity.AutomatedTask;
import com.example.jobrunner.domain.enums.TaskStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for AutomatedTask entity
 */
@Repository
public interface AutomatedTaskRepository extends JpaRepository<AutomatedTask, UUID> {

    /**
     * Find scheduled tasks whose time has arrived.
     * <p>
     * Orders by priority (descending) then creation time (ascending), so tasks
     * of equal priority run strictly FIFO. The page size caps the batch.
     */
    @Query("""
            SELECT t FROM AutomatedTask t
            WHERE t.status = :status
              AND t.scheduledAt <= :now
            ORDER BY t.priority DESC, t.createdAt ASC
            """)
    List<AutomatedTask> findDueTasks(@Param("status") TaskStatus status, @Param("now") Instant now, Pageable pageable);

    /**
     * Claim a task by moving it from {@code expected} to {@code target}.
     *
     * @return number of rows updated (1 if this caller won the claim, 0 otherwise)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE AutomatedTask t
            SET t.status = :target,
                t.startedAt = :now
            WHERE t.id = :taskId
              AND t.status = :expected
            """)
    int claimTask(
            @Param("taskId") UUID taskId,
            @Param("expected") TaskStatus expected,
            @Param("target") TaskStatus target,
            @Param("now") Instant now);

    long countByStatus(TaskStatus status);

    /**
     * Count scheduled tasks whose time has arrived
     */
    @Query("""
            SELECT COUNT(t) FROM AutomatedTask t
            WHERE t.status = :status
              AND t.scheduledAt <= :now
            """)
    long countDueTasks(@Param("status") TaskStatus status, @Param("now") Instant now);
}
