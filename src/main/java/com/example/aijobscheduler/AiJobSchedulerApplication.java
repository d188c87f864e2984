package com.example.aijobscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * AI Job Scheduler Application
 * <p>
 * Runs named AI prompts on cron schedules and keeps a history of every run.
 * <p>
 * Features:
 * - Cron evaluation with human-readable descriptions
 * - One armed timer per enabled job, with a bounded execution queue
 * - Supervised runs with a time budget and output recovery
 * - Email, Pushover and Slack notifications
 * - Reconciliation of runs interrupted by a restart
 */
@EnableScheduling
@SpringBootApplication
public class AiJobSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AiJobSchedulerApplication.class, args);
    }
}
