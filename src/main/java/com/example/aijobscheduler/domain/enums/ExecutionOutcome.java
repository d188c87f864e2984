package com.example.aijobscheduler.domain.enums;

/**
 * Result of one supervised execution attempt, as reported to the caller and metrics.
 * JOB_NOT_FOUND and ALREADY_RUNNING never create a run record.
 */
public enum ExecutionOutcome {
    SUCCEEDED,
    FAILED,
    TIMED_OUT,
    JOB_NOT_FOUND,
    ALREADY_RUNNING;

    public boolean createdRun() {
        return this == SUCCEEDED || this == FAILED || this == TIMED_OUT;
    }
}
