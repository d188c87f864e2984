package com.example.aijobscheduler.config;

import com.example.aijobscheduler.domain.enums.ExecutionOutcome;
import com.example.aijobscheduler.domain.enums.RunStatus;
import com.example.aijobscheduler.domain.repository.JobRepository;
import com.example.aijobscheduler.domain.repository.JobRunRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.EnumMap;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for monitoring job scheduling and execution.
 * <p>
 * Exposes Prometheus metrics for:
 * - Runs by status and enabled job count
 * - Run outcomes and execution time
 * - Dropped triggers
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final JobRepository jobRepository;
    private final JobRunRepository jobRunRepository;

    private final EnumMap<RunStatus, AtomicLong> runCounts = new EnumMap<>(RunStatus.class);
    private final AtomicLong enabledJobs = new AtomicLong(0);

    @PostConstruct
    public void initializeMetrics() {
        for (var status : RunStatus.values()) {
            var count = new AtomicLong(0);
            runCounts.put(status, count);

            Gauge.builder("ai_jobs_runs", count, AtomicLong::get)
                    .tag("status", status.getCode())
                    .description("Number of job runs by status")
                    .register(meterRegistry);
        }

        Gauge.builder("ai_jobs_enabled", enabledJobs, AtomicLong::get)
                .description("Number of enabled jobs")
                .register(meterRegistry);
    }

    /**
     * Periodically update gauge metrics from database
     */
    @Scheduled(fixedDelayString = "${ai-jobs.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        for (var status : RunStatus.values()) {
            runCounts.get(status).set(jobRunRepository.countByStatus(status));
        }
        enabledJobs.set(jobRepository.countByEnabledTrue());
    }

    public Timer.Sample startExecutionTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordExecution(Timer.Sample sample, ExecutionOutcome outcome) {
        sample.stop(Timer.builder("ai_jobs_execution_time")
                .tag("success", String.valueOf(outcome == ExecutionOutcome.SUCCEEDED))
                .description("Job run execution time")
                .register(meterRegistry));
        recordOutcome(outcome);
    }

    public void recordOutcome(ExecutionOutcome outcome) {
        meterRegistry.counter("ai_jobs_runs_total",
                "outcome", outcome.name().toLowerCase(Locale.ROOT)
        ).increment();
    }

    public void recordDroppedTrigger() {
        meterRegistry.counter("ai_jobs_triggers_dropped").increment();
    }

    public void recordNotificationFailure(String channel) {
        meterRegistry.counter("ai_jobs_notification_failures", "channel", channel).increment();
    }
}
