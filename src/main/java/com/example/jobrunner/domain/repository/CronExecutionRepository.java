package com.example.jobrunner.domain.repository;

import com.example.jobrunner.domain.entity.CronExecution;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for CronExecution entity
 */
@Repository
public interface CronExecutionRepository extends JpaRepository<CronExecution, UUID> {

    /**
     * Execution history of a job, newest first
     */
    List<CronExecution> findByJobIdOrderByStartedAtDesc(UUID jobId);
}
