package com.example.aijobscheduler.domain.entity;

import com.example.aijobscheduler.domain.enums.RunStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One execution attempt of a job.
 * <p>
 * {@code completedAt} is null exactly while the run is RUNNING.
 */
@Entity
@Table(name = "job_runs", indexes = {
        @Index(name = "idx_job_run_job_id", columnList = "job_id"),
        @Index(name = "idx_job_run_started_at", columnList = "started_at"),
        @Index(name = "idx_job_run_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobRun {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Reference to the job
     */
    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private RunStatus status;

    /**
     * Markdown produced by the worker
     */
    @Column(name = "output_content", columnDefinition = "TEXT")
    private String outputContent;

    /**
     * HTML rendering of the output
     */
    @Column(name = "html_output_content", columnDefinition = "TEXT")
    private String htmlOutputContent;

    /**
     * Worker stderr followed by stdout
     */
    @Column(name = "log_content", columnDefinition = "TEXT")
    private String logContent;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "duration_ms")
    private Long durationMs;

    public static JobRun start(UUID jobId, Instant startedAt) {
        return JobRun.builder()
                .jobId(jobId)
                .status(RunStatus.RUNNING)
                .startedAt(startedAt)
                .build();
    }

    public boolean isRunning() {
        return status == RunStatus.RUNNING;
    }

    /**
     * Move a running run to a terminal status
     *
     * @throws IllegalStateException if the run is already terminal or the target status is RUNNING
     */
    public void complete(RunStatus terminalStatus, Instant completedAt, String errorMessage) {
        if (!terminalStatus.isTerminal()) {
            throw new IllegalStateException("Cannot complete run with non-terminal status " + terminalStatus);
        }
        if (!isRunning()) {
            throw new IllegalStateException("Run " + id + " is already " + status.getCode());
        }
        this.status = terminalStatus;
        this.completedAt = completedAt;
        this.errorMessage = errorMessage;
        calculateDuration();
    }

    /**
     * Calculate duration if not set
     */
    public void calculateDuration() {
        if (startedAt != null && completedAt != null) {
            this.durationMs = completedAt.toEpochMilli() - startedAt.toEpochMilli();
        }
    }
}
