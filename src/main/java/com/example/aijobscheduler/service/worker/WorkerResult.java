package com.example.aijobscheduler.service.worker;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a worker that ran to completion within its budget.
 */
@Value
@Builder
public class WorkerResult {

    int exitCode;

    @Builder.Default
    String stdout = "";

    @Builder.Default
    String stderr = "";

    /**
     * Output returned directly by the worker, if any
     */
    String output;

    /**
     * Short reason for a non-zero exit, if the worker knows one
     */
    String errorDetail;

    public boolean isSuccess() {
        return exitCode == 0;
    }

    /**
     * stderr followed by stdout
     */
    public String combinedLog() {
        return stderr + "\n" + stdout;
    }

    public static WorkerResult success(String output, String log) {
        return WorkerResult.builder()
                .exitCode(0)
                .stdout(log)
                .output(output)
                .build();
    }

    public static WorkerResult failure(int exitCode, String errorDetail, String stderr) {
        return WorkerResult.builder()
                .exitCode(exitCode)
                .stderr(stderr)
                .errorDetail(errorDetail)
                .build();
    }
}
