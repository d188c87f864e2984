package com.example.aijobscheduler.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Exception for a worker invocation that could not produce a result
 */
@Getter
public class WorkerExecutionException extends RuntimeException {

    private final UUID jobId;

    public WorkerExecutionException(UUID jobId, String message) {
        super(String.format("Job %s execution failed: %s", jobId, message));
        this.jobId = jobId;
    }

    public WorkerExecutionException(UUID jobId, String message, Throwable cause) {
        super(String.format("Job %s execution failed: %s", jobId, message), cause);
        this.jobId = jobId;
    }

    public WorkerExecutionException(String message) {
        super(message);
        this.jobId = null;
    }

    public WorkerExecutionException(String message, Throwable cause) {
        super(message, cause);
        this.jobId = null;
    }
}
