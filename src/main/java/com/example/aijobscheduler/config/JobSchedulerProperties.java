package com.example.aijobscheduler.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the AI job scheduler.
 * Loaded from application.yml under {@code ai-jobs}.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "ai-jobs")
public class JobSchedulerProperties {

    @Valid
    private Scheduler scheduler = new Scheduler();

    @Valid
    private Execution execution = new Execution();

    @Valid
    private Worker worker = new Worker();

    @Valid
    private Notifications notifications = new Notifications();

    @Data
    public static class Scheduler {

        /**
         * Time zone cron expressions are evaluated in. Blank means the system default.
         */
        private String zone;

        /**
         * Threads firing cron timers. Firing only hands off to the dispatcher, so one is enough.
         */
        @Min(1)
        private int poolSize = 1;

        /**
         * Arm timers for enabled jobs once the application is ready
         */
        private boolean autoStart = true;

        public ZoneId getZoneId() {
            return zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone);
        }
    }

    @Data
    public static class Execution {

        /**
         * Budget for a single run, from launch to worker exit
         */
        @NotNull
        private Duration timeout = Duration.ofHours(1);

        /**
         * When false a trigger for a job that already has a running run is rejected
         */
        private boolean allowConcurrentRuns = false;

        /**
         * Number of threads supervising runs
         */
        @Min(1)
        private int workerPoolSize = 4;

        /**
         * Triggers waiting for a free supervisor thread before new ones are dropped
         */
        @Min(1)
        private int queueCapacity = 100;

        /**
         * Interval for marking orphaned running runs as failed
         */
        @Min(1000)
        private long staleRunCheckIntervalMs = 300000;

        /**
         * Completed runs older than this are purged. 0 keeps history forever.
         */
        @Min(0)
        private int runRetentionDays = 0;
    }

    @Data
    public static class Worker {

        @NotNull
        private WorkerMode mode = WorkerMode.IN_PROCESS;

        @Valid
        private Process process = new Process();

        @Valid
        private ResultArtifacts resultArtifacts = new ResultArtifacts();
    }

    public enum WorkerMode {
        IN_PROCESS,
        PROCESS
    }

    @Data
    public static class Process {

        /**
         * Worker command line. {jobId}, {runId} and {slug} are substituted per run.
         */
        private List<String> command = new ArrayList<>();

        /**
         * Working directory of the worker process. Blank means the current directory.
         */
        private String workingDirectory;
    }

    @Data
    public static class ResultArtifacts {

        /**
         * Directory scanned for "* {slug} *.md" result files. Blank disables the fallback.
         */
        private String directory;

        /**
         * How far before the run start a result file may have been modified
         */
        @NotNull
        private Duration window = Duration.ofMinutes(10);
    }

    @Data
    public static class Notifications {

        @Valid
        private Email email = new Email();
    }

    @Data
    public static class Email {

        private boolean enabled = false;

        @NotBlank
        private String from = "ai-jobs@localhost";

        /**
         * Always added to a job's recipients on create and update
         */
        private String defaultRecipient;
    }
}
