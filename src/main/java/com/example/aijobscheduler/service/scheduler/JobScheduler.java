package com.example.aijobscheduler.service.scheduler;

import com.example.aijobscheduler.config.JobSchedulerProperties;
import com.example.aijobscheduler.cron.CronExpressionEvaluator;
import com.example.aijobscheduler.domain.entity.Job;
import com.example.aijobscheduler.exception.SchedulerAlreadyRunningException;
import com.example.aijobscheduler.service.executor.JobExecutionDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;

/**
 * Keeps one cron timer armed per enabled job.
 * <p>
 * The timer map is private and every method that touches it is synchronized, so at most
 * one timer exists per job id no matter how add, update and remove calls interleave.
 * A firing timer only hands the job id to the dispatcher; it never runs the job itself
 * and never sees an exception. Ticks missed while stopped or busy are not backfilled.
 */
@Slf4j
@Service
public class JobScheduler {

    private final JobExecutionDispatcher dispatcher;
    private final CronExpressionEvaluator cronEvaluator;
    private final JobSchedulerProperties properties;

    private final Map<UUID, ScheduledFuture<?>> timers = new HashMap<>();
    private ThreadPoolTaskScheduler taskScheduler;

    public JobScheduler(JobExecutionDispatcher dispatcher, CronExpressionEvaluator cronEvaluator, JobSchedulerProperties properties) {
        this.dispatcher = dispatcher;
        this.cronEvaluator = cronEvaluator;
        this.properties = properties;
    }

    /**
     * Start firing and arm a timer for every enabled job given
     *
     * @throws SchedulerAlreadyRunningException if already started
     */
    public synchronized void start(Collection<Job> jobs) {
        if (taskScheduler != null) {
            throw new SchedulerAlreadyRunningException();
        }

        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getScheduler().getPoolSize());
        scheduler.setThreadNamePrefix("job-timer-");
        scheduler.setErrorHandler(t -> log.error("Unexpected error in job timer: {}", t.getMessage(), t));
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        this.taskScheduler = scheduler;

        var armed = 0;
        for (var job : jobs) {
            if (arm(job)) {
                armed++;
            }
        }
        log.info("Scheduler started with {} of {} jobs armed", armed, jobs.size());
    }

    /**
     * Cancel every timer and stop firing. Runs already dispatched continue.
     */
    public synchronized void stop() {
        if (taskScheduler == null) {
            log.info("Scheduler is not running, nothing to stop");
            return;
        }

        timers.values().forEach(timer -> timer.cancel(false));
        var cancelled = timers.size();
        timers.clear();
        taskScheduler.shutdown();
        taskScheduler = null;
        log.info("Scheduler stopped, {} timers cancelled", cancelled);
    }

    /**
     * Arm a timer for the job, replacing any existing one.
     * Disabled jobs are ignored; while stopped this is a no-op and the job is armed at the next start.
     */
    public synchronized void addJob(Job job) {
        if (!job.isEnabled()) {
            log.info("Job {} is disabled, not adding to scheduler", job.getId());
            return;
        }
        if (taskScheduler == null) {
            log.info("Scheduler is not running, job {} will be armed on start", job.getId());
            return;
        }
        arm(job);
    }

    /**
     * Cancel the job's timer if it has one
     */
    public synchronized void removeJob(UUID jobId) {
        var timer = timers.remove(jobId);
        if (timer == null) {
            log.debug("No timer armed for job {}", jobId);
            return;
        }
        timer.cancel(false);
        log.info("Removed job {} from scheduler", jobId);
    }

    /**
     * Re-arm after a change to the job's cron expression, enabled flag or name
     */
    public synchronized void updateJob(Job job) {
        removeJob(job.getId());
        addJob(job);
    }

    public synchronized SchedulerStatus status() {
        return new SchedulerStatus(taskScheduler != null, timers.size());
    }

    public synchronized boolean isArmed(UUID jobId) {
        return timers.containsKey(jobId);
    }

    private boolean arm(Job job) {
        if (!job.isEnabled()) {
            return false;
        }

        var jobId = job.getId();
        var existing = timers.remove(jobId);
        if (existing != null) {
            existing.cancel(false);
        }

        try {
            var trigger = new CronTrigger(cronEvaluator.toSpringCron(job.getCronExpression()), cronEvaluator.getZone());
            var timer = taskScheduler.schedule(() -> fire(jobId), trigger);
            if (timer == null) {
                log.warn("Cron expression '{}' of job {} never fires, not armed", job.getCronExpression(), jobId);
                return false;
            }
            timers.put(jobId, timer);
            log.info("Armed job '{}' ({}) with cron '{}'", job.getName(), jobId, job.getCronExpression());
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to arm job {} with cron '{}': {}", jobId, job.getCronExpression(), e.getMessage());
            return false;
        }
    }

    private void fire(UUID jobId) {
        try {
            log.debug("Cron fired for job {}", jobId);
            dispatcher.dispatch(jobId);
        } catch (Exception e) {
            log.error("Failed to dispatch job {}: {}", jobId, e.getMessage(), e);
        }
    }
}
