package com.example.aijobscheduler.service.executor;

import com.example.aijobscheduler.config.JobSchedulerProperties;
import com.example.aijobscheduler.config.MetricsConfig;
import com.example.aijobscheduler.domain.entity.Job;
import com.example.aijobscheduler.domain.entity.JobRun;
import com.example.aijobscheduler.domain.enums.ExecutionOutcome;
import com.example.aijobscheduler.domain.enums.RunStatus;
import com.example.aijobscheduler.domain.repository.JobRepository;
import com.example.aijobscheduler.exception.ExecutionTimeoutException;
import com.example.aijobscheduler.exception.JobAlreadyRunningException;
import com.example.aijobscheduler.exception.JobNotFoundException;
import com.example.aijobscheduler.service.JobRunService;
import com.example.aijobscheduler.service.notification.NotificationService;
import com.example.aijobscheduler.service.notification.RunNotification;
import com.example.aijobscheduler.service.render.MarkdownRenderer;
import com.example.aijobscheduler.service.worker.WorkerInvocation;
import com.example.aijobscheduler.service.worker.WorkerRequest;
import com.example.aijobscheduler.service.worker.WorkerResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Supervises one execution of a job from run creation to notification.
 * <p>
 * Flow:
 * 1. Open a RUNNING run (rejected if the job is gone or already running)
 * 2. Launch the worker with the configured time budget
 * 3. Recover output: run record or direct return, then result file, then stdout
 * 4. Finalize the run exactly once and notify, even when the job is gone
 * <p>
 * Nothing thrown by the worker, the store or a channel escapes {@link #execute(UUID)}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobExecutionSupervisor {

    private final JobRepository jobRepository;
    private final JobRunService jobRunService;
    private final WorkerInvocation workerInvocation;
    private final ResultArtifactLocator resultArtifactLocator;
    private final MarkdownRenderer markdownRenderer;
    private final NotificationService notificationService;
    private final MetricsConfig metricsConfig;
    private final JobSchedulerProperties properties;

    /**
     * Run a job end to end. Never throws.
     */
    public ExecutionReport execute(UUID jobId) {
        JobRun run;
        try {
            run = jobRunService.openRun(jobId);
        } catch (JobNotFoundException e) {
            log.warn("Job {} not found, skipping execution", jobId);
            metricsConfig.recordOutcome(ExecutionOutcome.JOB_NOT_FOUND);
            return ExecutionReport.jobNotFound(jobId);
        } catch (JobAlreadyRunningException e) {
            log.warn("Job {} already has run {} in progress, skipping trigger", jobId, e.getRunningRunId());
            metricsConfig.recordOutcome(ExecutionOutcome.ALREADY_RUNNING);
            return ExecutionReport.alreadyRunning(jobId, e.getRunningRunId());
        } catch (Exception e) {
            log.error("Failed to open run for job {}: {}", jobId, e.getMessage(), e);
            metricsConfig.recordOutcome(ExecutionOutcome.FAILED);
            return ExecutionReport.builder()
                    .jobId(jobId)
                    .outcome(ExecutionOutcome.FAILED)
                    .errorMessage(describe(e))
                    .build();
        }

        return runToCompletion(run);
    }

    /**
     * Drive an already opened run to a terminal state. Never throws.
     */
    public ExecutionReport runToCompletion(JobRun run) {
        var sample = metricsConfig.startExecutionTimer();
        Job job = null;

        ExecutionOutcome outcome;
        try {
            job = jobRepository.findById(run.getJobId()).orElse(null);
            if (job == null) {
                log.warn("Job {} was deleted before run {} could start", run.getJobId(), run.getId());
                run.complete(RunStatus.FAILED, Instant.now(), "Job was deleted before execution started");
                outcome = ExecutionOutcome.FAILED;
            } else {
                outcome = invokeWorker(job, run);
            }
        } catch (Exception e) {
            log.error("Supervision of run {} of job {} failed: {}", run.getId(), run.getJobId(), e.getMessage(), e);
            if (run.isRunning()) {
                run.complete(RunStatus.FAILED, Instant.now(), describe(e));
            }
            outcome = ExecutionOutcome.FAILED;
        }

        var settled = persist(run);
        if (settled != run) {
            outcome = settled.getStatus() == RunStatus.SUCCESS ? ExecutionOutcome.SUCCEEDED : ExecutionOutcome.FAILED;
        }
        notifyCompleted(job, settled);

        metricsConfig.recordExecution(sample, outcome);
        return ExecutionReport.builder()
                .jobId(run.getJobId())
                .runId(run.getId())
                .outcome(outcome)
                .errorMessage(settled.getErrorMessage())
                .build();
    }

    /**
     * Fail an opened run that could not be handed to a supervisor thread
     */
    public ExecutionReport abandon(JobRun run, String reason) {
        log.warn("Abandoning run {} of job {}: {}", run.getId(), run.getJobId(), reason);
        run.complete(RunStatus.FAILED, Instant.now(), reason);
        var settled = persist(run);
        notifyCompleted(findJobQuietly(run.getJobId()), settled);
        metricsConfig.recordOutcome(ExecutionOutcome.FAILED);
        return ExecutionReport.builder()
                .jobId(run.getJobId())
                .runId(run.getId())
                .outcome(ExecutionOutcome.FAILED)
                .errorMessage(settled.getErrorMessage())
                .build();
    }

    /**
     * Write the terminal state of a completed run.
     *
     * @return the run as it should be reported: the stored record if another writer finalized
     * it first, otherwise {@code run} itself
     */
    private JobRun persist(JobRun run) {
        try {
            if (jobRunService.finalizeRun(run)) {
                return run;
            }
            var stored = jobRunService.findRun(run.getId())
                    .filter(existing -> existing.getStatus().isTerminal());
            if (stored.isPresent()) {
                log.warn("Run {} was already finalized as {}, reporting the stored outcome",
                        run.getId(), stored.get().getStatus().getCode());
                return stored.get();
            }
        } catch (Exception e) {
            log.error("Failed to persist outcome of run {}: {}", run.getId(), e.getMessage(), e);
        }
        return run;
    }

    private Job findJobQuietly(UUID jobId) {
        try {
            return jobRepository.findById(jobId).orElse(null);
        } catch (Exception e) {
            log.error("Failed to load job {}: {}", jobId, e.getMessage(), e);
            return null;
        }
    }

    private ExecutionOutcome invokeWorker(Job job, JobRun run) {
        var timeout = properties.getExecution().getTimeout();
        var request = WorkerRequest.builder()
                .jobId(job.getId())
                .runId(run.getId())
                .jobName(job.getName())
                .slug(job.getSlug())
                .prompt(job.getPromptContent())
                .build();

        log.info("Starting execution of job '{}' (run {})", job.getName(), run.getId());

        try {
            var result = workerInvocation.invoke(request, timeout);
            run.setLogContent(result.combinedLog());

            if (result.isSuccess()) {
                recoverOutput(job, run, result);
                run.complete(RunStatus.SUCCESS, Instant.now(), null);
                log.info("Job '{}' completed successfully (run {}, {} ms)", job.getName(), run.getId(), run.getDurationMs());
                return ExecutionOutcome.SUCCEEDED;
            }

            run.setOutputContent(result.getStdout());
            var error = "Worker exited with code " + result.getExitCode()
                    + (result.getErrorDetail() != null ? ": " + result.getErrorDetail() : "");
            run.complete(RunStatus.FAILED, Instant.now(), error);
            log.error("Job '{}' failed (run {}): {}", job.getName(), run.getId(), error);
            return ExecutionOutcome.FAILED;
        } catch (ExecutionTimeoutException e) {
            run.complete(RunStatus.FAILED, Instant.now(), "Job execution timed out after " + humanize(timeout));
            log.error("Job '{}' timed out (run {})", job.getName(), run.getId());
            return ExecutionOutcome.TIMED_OUT;
        } catch (Exception e) {
            run.complete(RunStatus.FAILED, Instant.now(), describe(e));
            log.error("Job '{}' failed with exception (run {}): {}", job.getName(), run.getId(), e.getMessage(), e);
            return ExecutionOutcome.FAILED;
        }
    }

    private void recoverOutput(Job job, JobRun run, WorkerResult result) {
        var stored = jobRunService.findRun(run.getId()).orElse(null);

        String output = result.getOutput();
        if (isBlank(output) && stored != null) {
            output = stored.getOutputContent();
        }
        String html = stored != null ? stored.getHtmlOutputContent() : null;

        if (isBlank(output)) {
            output = resultArtifactLocator.findRecentArtifact(job.getSlug(), run.getStartedAt()).orElse(null);
            html = null;
        }
        if (isBlank(output)) {
            log.warn("No output recorded for run {}, using stdout as fallback", run.getId());
            output = result.getStdout();
            html = null;
        }

        if (html == null && !isBlank(output)) {
            try {
                html = markdownRenderer.toHtmlDocument(output);
            } catch (RuntimeException e) {
                log.warn("Failed to convert output of run {} to HTML: {}", run.getId(), e.getMessage());
            }
        }

        run.setOutputContent(output);
        run.setHtmlOutputContent(html);
    }

    /**
     * {@code job} is null when it was deleted or could not be loaded; the run is still reported.
     */
    private void notifyCompleted(Job job, JobRun run) {
        try {
            notificationService.notifyRunCompleted(RunNotification.builder()
                    .jobId(run.getJobId())
                    .jobName(job != null ? job.getName() : "Job " + run.getJobId())
                    .runId(run.getId())
                    .status(run.getStatus())
                    .outputContent(run.getOutputContent())
                    .htmlOutputContent(run.getHtmlOutputContent())
                    .errorMessage(run.getErrorMessage())
                    .recipients(job != null ? new ArrayList<>(job.getRecipients()) : List.of())
                    .completedAt(run.getCompletedAt())
                    .build());
        } catch (Exception e) {
            log.error("Failed to dispatch notifications for run {}: {}", run.getId(), e.getMessage(), e);
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * PT1H becomes "1 hour", PT90M becomes "90 minutes", PT45S becomes "45 seconds"
     */
    static String humanize(Duration duration) {
        var seconds = duration.getSeconds();
        if (seconds > 0 && seconds % 3600 == 0) {
            return plural(seconds / 3600, "hour");
        }
        if (seconds > 0 && seconds % 60 == 0) {
            return plural(seconds / 60, "minute");
        }
        if (seconds > 0) {
            return plural(seconds, "second");
        }
        return duration.toMillis() + " ms";
    }

    private static String plural(long amount, String unit) {
        return amount + " " + unit + (amount == 1 ? "" : "s");
    }
}
