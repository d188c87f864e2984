package com.example.aijobscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lifecycle of a single job run.
 * A run is created RUNNING and moves exactly once to SUCCESS or FAILED.
 */
@Getter
@RequiredArgsConstructor
public enum RunStatus {

    /**
     * Worker launched, no terminal outcome recorded yet
     */
    RUNNING("running", "Running"),

    /**
     * Worker exited cleanly; output recovered when available
     */
    SUCCESS("success", "Success"),

    /**
     * Worker failed, timed out, could not be launched, or was interrupted by a restart
     */
    FAILED("failed", "Failed");

    private final String code;
    private final String displayName;

    /**
     * Find RunStatus by its code value
     */
    public static RunStatus fromCode(String code) {
        for (var status : values()) {
            if (status.getCode().equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown run status code: " + code);
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
