package com.example.aijobscheduler.service;

import com.example.aijobscheduler.config.JobSchedulerProperties;
import com.example.aijobscheduler.domain.entity.JobRun;
import com.example.aijobscheduler.domain.enums.RunStatus;
import com.example.aijobscheduler.domain.repository.JobRepository;
import com.example.aijobscheduler.domain.repository.JobRunRepository;
import com.example.aijobscheduler.exception.JobAlreadyRunningException;
import com.example.aijobscheduler.exception.JobNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Store operations for the run lifecycle: open, write back, finalize, reconcile and purge.
 * <p>
 * Each operation is its own transaction. A run is finalized with a conditional update,
 * so a terminal status is written at most once and never reverted.
 * <p>
 * Runs opened by this instance stay registered as supervised until their finalize call,
 * and stale-run reconciliation never touches a supervised run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobRunService {

    public static final String INTERRUPTED_MESSAGE = "Run interrupted: process stopped before completion";

    private final JobRepository jobRepository;
    private final JobRunRepository jobRunRepository;
    private final JobSchedulerProperties properties;

    private final Set<UUID> supervisedRunIds = ConcurrentHashMap.newKeySet();

    /**
     * Create the RUNNING record for a new run of a job.
     * <p>
     * Unless concurrent runs are allowed, the job row is locked for the duration of the
     * check so two triggers for the same job cannot both pass it.
     *
     * @throws JobNotFoundException       if the job does not exist
     * @throws JobAlreadyRunningException if concurrent runs are disallowed and a run is in flight
     */
    @Transactional
    public JobRun openRun(UUID jobId) {
        var allowConcurrent = properties.getExecution().isAllowConcurrentRuns();

        var job = (allowConcurrent ? jobRepository.findById(jobId) : jobRepository.findByIdForUpdate(jobId))
                .orElseThrow(() -> new JobNotFoundException(jobId));

        if (!allowConcurrent) {
            var running = jobRunRepository.findFirstByJobIdAndStatusOrderByStartedAtDesc(jobId, RunStatus.RUNNING);
            if (running.isPresent()) {
                throw new JobAlreadyRunningException(jobId, running.get().getId());
            }
        }

        var run = jobRunRepository.save(JobRun.start(job.getId(), Instant.now()));
        supervisedRunIds.add(run.getId());
        log.info("Opened run {} for job '{}'", run.getId(), job.getName());
        return run;
    }

    /**
     * Store output produced by a worker while its run is still in flight
     *
     * @return true if the run was still RUNNING and received the output
     */
    @Transactional
    public boolean recordOutput(UUID runId, String outputContent, String htmlOutputContent) {
        return jobRunRepository.recordOutput(runId, outputContent, htmlOutputContent) == 1;
    }

    /**
     * Persist the terminal state of a run that was completed in memory.
     *
     * @return false if the run was no longer RUNNING (already finalized, or deleted with its job)
     */
    @Transactional
    public boolean finalizeRun(JobRun run) {
        if (!run.getStatus().isTerminal()) {
            throw new IllegalArgumentException("Run " + run.getId() + " has not been completed");
        }

        try {
            var updated = jobRunRepository.finalizeRun(
                    run.getId(),
                    run.getStatus(),
                    run.getCompletedAt(),
                    run.getDurationMs(),
                    run.getOutputContent(),
                    run.getHtmlOutputContent(),
                    run.getLogContent(),
                    run.getErrorMessage());

            if (updated == 0) {
                log.warn("Run {} of job {} was not finalized: record is gone or no longer running", run.getId(), run.getJobId());
                return false;
            }
            return true;
        } finally {
            supervisedRunIds.remove(run.getId());
        }
    }

    /**
     * Whether a supervisor of this instance still owns the run
     */
    public boolean isSupervised(UUID runId) {
        return supervisedRunIds.contains(runId);
    }

    @Transactional(readOnly = true)
    public Optional<JobRun> findRun(UUID runId) {
        return jobRunRepository.findById(runId);
    }

    @Transactional(readOnly = true)
    public List<JobRun> findRecentRuns(int limit) {
        return jobRunRepository.findRecent(PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public Optional<JobRun> findLatestRun(UUID jobId) {
        return jobRunRepository.findFirstByJobIdOrderByStartedAtDesc(jobId);
    }

    @Transactional(readOnly = true)
    public boolean isRunning(UUID jobId) {
        return jobRunRepository.existsByJobIdAndStatus(jobId, RunStatus.RUNNING);
    }

    @Transactional(readOnly = true)
    public Set<UUID> findRunningJobIds(Collection<UUID> jobIds) {
        if (jobIds.isEmpty()) {
            return Set.of();
        }
        return new HashSet<>(jobRunRepository.findRunningJobIds(jobIds));
    }

    /**
     * Mark runs left RUNNING longer than {@code maxAge} as failed.
     * These are runs whose supervisor died, typically because the application stopped.
     * Runs still supervised here, including manual runs waiting in the dispatch queue, are skipped.
     *
     * @return the runs that were marked failed
     */
    @Transactional
    public List<JobRun> reconcileStaleRuns(Duration maxAge) {
        var now = Instant.now();
        var staleRuns = jobRunRepository.findStaleRuns(now.minus(maxAge));

        return staleRuns.stream()
                .filter(run -> !isSupervised(run.getId()))
                .filter(run -> jobRunRepository.finalizeRun(
                        run.getId(),
                        RunStatus.FAILED,
                        now,
                        now.toEpochMilli() - run.getStartedAt().toEpochMilli(),
                        run.getOutputContent(),
                        run.getHtmlOutputContent(),
                        run.getLogContent(),
                        INTERRUPTED_MESSAGE) == 1)
                .toList();
    }

    /**
     * Delete completed runs older than the retention period
     *
     * @return number of runs deleted
     */
    @Transactional
    public int purgeOldRuns(int retentionDays) {
        var cutoff = Instant.now().minus(Duration.ofDays(retentionDays));
        return jobRunRepository.deleteCompletedBefore(cutoff);
    }
}
