package com.example.aijobscheduler.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Thrown when a trigger arrives for a job that still has a run in progress
 * and concurrent runs are not allowed.
 */
@Getter
public class JobAlreadyRunningException extends RuntimeException {

    private final UUID jobId;
    private final UUID runningRunId;

    public JobAlreadyRunningException(UUID jobId, UUID runningRunId) {
        super(String.format("Job %s is already running (run %s)", jobId, runningRunId));
        this.jobId = jobId;
        this.runningRunId = runningRunId;
    }
}
