package com.example.aijobscheduler.service.executor;

import com.example.aijobscheduler.config.JobSchedulerProperties;
import com.example.aijobscheduler.service.JobRunService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Housekeeping for the run history.
 * <p>
 * Runs can be left RUNNING forever if the application stops mid-run; those older than the
 * execution budget plus a grace minute are marked failed. Also purges old completed runs
 * when a retention period is configured.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StaleRunReconciler {

    static final Duration GRACE_PERIOD = Duration.ofMinutes(1);

    private final JobRunService jobRunService;
    private final JobSchedulerProperties properties;

    /**
     * Mark orphaned RUNNING runs as failed
     *
     * @return number of runs reconciled
     */
    @Scheduled(fixedDelayString = "${ai-jobs.execution.stale-run-check-interval-ms:300000}",
            initialDelayString = "${ai-jobs.execution.stale-run-check-interval-ms:300000}")
    public int reconcileStaleRuns() {
        return reconcile(properties.getExecution().getTimeout().plus(GRACE_PERIOD));
    }

    /**
     * Mark every RUNNING run that no supervisor of this instance owns as failed
     */
    public int reconcileAfterRestart() {
        return reconcile(Duration.ZERO);
    }

    private int reconcile(Duration maxAge) {
        try {
            var reconciled = jobRunService.reconcileStaleRuns(maxAge);

            if (reconciled.isEmpty()) {
                log.debug("No stale runs found");
                return 0;
            }

            reconciled.forEach(run -> log.warn("Marked stale run {} of job {} (started {}) as failed",
                    run.getId(), run.getJobId(), run.getStartedAt()));
            return reconciled.size();
        } catch (Exception e) {
            log.error("Error reconciling stale runs: {}", e.getMessage(), e);
            return 0;
        }
    }

    /**
     * Delete completed runs past the retention period, if one is configured
     */
    @Scheduled(cron = "${ai-jobs.execution.purge-cron:0 30 3 * * *}")
    public int purgeOldRuns() {
        var retentionDays = properties.getExecution().getRunRetentionDays();
        if (retentionDays <= 0) {
            return 0;
        }

        try {
            var deleted = jobRunService.purgeOldRuns(retentionDays);
            log.info("Purged {} runs older than {} days", deleted, retentionDays);
            return deleted;
        } catch (Exception e) {
            log.error("Error purging old runs: {}", e.getMessage(), e);
            return 0;
        }
    }
}
