package com.example.aijobscheduler.service.scheduler;

import com.example.aijobscheduler.config.JobSchedulerProperties;
import com.example.aijobscheduler.domain.repository.JobRepository;
import com.example.aijobscheduler.service.executor.StaleRunReconciler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the scheduler once the application is ready and stops it on shutdown.
 * Runs orphaned by a previous shutdown are reconciled before any timer is armed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchedulerLifecycle {

    private final JobScheduler jobScheduler;
    private final JobRepository jobRepository;
    private final StaleRunReconciler staleRunReconciler;
    private final JobSchedulerProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        var reconciled = staleRunReconciler.reconcileAfterRestart();
        if (reconciled > 0) {
            log.warn("Reconciled {} runs interrupted by a previous shutdown", reconciled);
        }

        if (!properties.getScheduler().isAutoStart()) {
            log.info("Scheduler auto-start disabled (ai-jobs.scheduler.auto-start=false)");
            return;
        }

        var jobs = jobRepository.findByEnabledTrue();
        log.info("Starting scheduler with {} enabled jobs", jobs.size());
        jobScheduler.start(jobs);
    }

    @EventListener(ContextClosedEvent.class)
    public void onShutdown() {
        jobScheduler.stop();
    }
}
