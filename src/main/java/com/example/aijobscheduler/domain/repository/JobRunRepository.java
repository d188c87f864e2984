package com.example.aijobscheduler.domain.repository;

import com.example.aijobscheduler.domain.entity.JobRun;
import com.example.aijobscheduler.domain.enums.RunStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for JobRun entity
 */
@Repository
public interface JobRunRepository extends JpaRepository<JobRun, UUID> {

    Optional<JobRun> findFirstByJobIdAndStatusOrderByStartedAtDesc(UUID jobId, RunStatus status);

    boolean existsByJobIdAndStatus(UUID jobId, RunStatus status);

    Optional<JobRun> findFirstByJobIdOrderByStartedAtDesc(UUID jobId);

    List<JobRun> findByJobIdOrderByStartedAtDesc(UUID jobId);

    /**
     * Most recent runs across all jobs, newest first
     */
    @Query("""
            SELECT r FROM JobRun r
            ORDER BY r.startedAt DESC
            """)
    List<JobRun> findRecent(Pageable pageable);

    /**
     * Job ids with a run currently in flight, for a batch of jobs
     */
    @Query("""
            SELECT DISTINCT r.jobId FROM JobRun r
            WHERE r.jobId IN :jobIds
              AND r.status = com.example.aijobscheduler.domain.enums.RunStatus.RUNNING
            """)
    List<UUID> findRunningJobIds(@Param("jobIds") Collection<UUID> jobIds);

    /**
     * Runs still RUNNING although started before the threshold
     */
    @Query("""
            SELECT r FROM JobRun r
            WHERE r.status = com.example.aijobscheduler.domain.enums.RunStatus.RUNNING
              AND r.startedAt < :threshold
            """)
    List<JobRun> findStaleRuns(@Param("threshold") Instant threshold);

    /**
     * Record the terminal outcome of a run.
     * Only applies while the run is still RUNNING, so a run is finalized at most once.
     *
     * @return number of rows updated (1 if finalized, 0 if already terminal or deleted)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE JobRun r
            SET r.status = :status,
                r.completedAt = :completedAt,
                r.durationMs = :durationMs,
                r.outputContent = :outputContent,
                r.htmlOutputContent = :htmlOutputContent,
                r.logContent = :logContent,
                r.errorMessage = :errorMessage
            WHERE r.id = :runId
              AND r.status = com.example.aijobscheduler.domain.enums.RunStatus.RUNNING
            """)
    int finalizeRun(
            @Param("runId") UUID runId,
            @Param("status") RunStatus status,
            @Param("completedAt") Instant completedAt,
            @Param("durationMs") Long durationMs,
            @Param("outputContent") String outputContent,
            @Param("htmlOutputContent") String htmlOutputContent,
            @Param("logContent") String logContent,
            @Param("errorMessage") String errorMessage);

    /**
     * Store output written back by the worker while the run is in flight
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE JobRun r
            SET r.outputContent = :outputContent,
                r.htmlOutputContent = :htmlOutputContent
            WHERE r.id = :runId
              AND r.status = com.example.aijobscheduler.domain.enums.RunStatus.RUNNING
            """)
    int recordOutput(
            @Param("runId") UUID runId,
            @Param("outputContent") String outputContent,
            @Param("htmlOutputContent") String htmlOutputContent);

    long countByStatus(RunStatus status);

    @Modifying
    @Query("DELETE FROM JobRun r WHERE r.jobId = :jobId")
    int deleteByJobId(@Param("jobId") UUID jobId);

    /**
     * Delete completed runs (for retention cleanup)
     */
    @Modifying
    @Query("""
            DELETE FROM JobRun r
            WHERE r.completedAt IS NOT NULL
              AND r.completedAt < :cutoff
            """)
    int deleteCompletedBefore(@Param("cutoff") Instant cutoff);
}
