package com.example.aijobscheduler.service.executor;

import com.example.aijobscheduler.domain.enums.ExecutionOutcome;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * What happened to one execution attempt. {@code runId} is null when no run was created.
 */
@Value
@Builder
public class ExecutionReport {
    UUID jobId;
    UUID runId;
    ExecutionOutcome outcome;
    String errorMessage;

    public static ExecutionReport jobNotFound(UUID jobId) {
        return ExecutionReport.builder()
                .jobId(jobId)
                .outcome(ExecutionOutcome.JOB_NOT_FOUND)
                .errorMessage("Job not found: " + jobId)
                .build();
    }

    public static ExecutionReport alreadyRunning(UUID jobId, UUID runningRunId) {
        return ExecutionReport.builder()
                .jobId(jobId)
                .outcome(ExecutionOutcome.ALREADY_RUNNING)
                .errorMessage("Job already has run " + runningRunId + " in progress")
                .build();
    }
}
