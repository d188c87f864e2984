package com.example.aijobscheduler.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Exception for job run not found
 */
@Getter
public class JobRunNotFoundException extends RuntimeException {

    private final String runId;

    public JobRunNotFoundException(UUID runId) {
        super("Job run not found: " + runId);
        this.runId = String.valueOf(runId);
    }
}
