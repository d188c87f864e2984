package com.example.aijobscheduler.service.executor;

import com.example.aijobscheduler.config.MetricsConfig;
import com.example.aijobscheduler.domain.entity.JobRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Hands triggers to the bounded supervisor pool.
 * <p>
 * Called from cron timer threads and request threads; every method returns immediately
 * and never throws.
 */
@Slf4j
@Service
public class JobExecutionDispatcher {

    private final JobExecutionSupervisor supervisor;
    private final TaskExecutor jobDispatchExecutor;
    private final MetricsConfig metricsConfig;

    public JobExecutionDispatcher(JobExecutionSupervisor supervisor,
                                  @Qualifier("jobDispatchExecutor") TaskExecutor jobDispatchExecutor,
                                  MetricsConfig metricsConfig) {
        this.supervisor = supervisor;
        this.jobDispatchExecutor = jobDispatchExecutor;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Queue a cron trigger for a job.
     *
     * @return false if the queue was full and the trigger was dropped
     */
    public boolean dispatch(UUID jobId) {
        try {
            jobDispatchExecutor.execute(() -> supervisor.execute(jobId));
            log.debug("Queued trigger for job {}", jobId);
            return true;
        } catch (TaskRejectedException e) {
            log.warn("Execution queue full, dropping trigger for job {}", jobId);
            metricsConfig.recordDroppedTrigger();
            return false;
        }
    }

    /**
     * Supervise an already opened run asynchronously (manual triggers).
     * If the queue is full the run is failed instead of being left RUNNING.
     */
    public CompletableFuture<ExecutionReport> dispatchRun(JobRun run) {
        try {
            return CompletableFuture.supplyAsync(() -> supervisor.runToCompletion(run), jobDispatchExecutor);
        } catch (TaskRejectedException e) {
            metricsConfig.recordDroppedTrigger();
            return CompletableFuture.completedFuture(supervisor.abandon(run, "Execution queue is full, run was not started"));
        }
    }
}
