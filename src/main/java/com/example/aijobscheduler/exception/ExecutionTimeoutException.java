package com.example.aijobscheduler.exception;

import lombok.Getter;

import java.time.Duration;
import java.util.UUID;

/**
 * Exception for a worker that did not finish within its wall-clock budget
 */
@Getter
public class ExecutionTimeoutException extends RuntimeException {

    private final UUID jobId;
    private final Duration timeout;

    public ExecutionTimeoutException(UUID jobId, Duration timeout) {
        super(String.format("Job %s exceeded execution budget of %s", jobId, timeout));
        this.jobId = jobId;
        this.timeout = timeout;
    }
}
