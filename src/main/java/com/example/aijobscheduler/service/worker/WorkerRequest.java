package com.example.aijobscheduler.service.worker;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Everything a worker needs to run one job run
 */
@Value
@Builder
public class WorkerRequest {
    UUID jobId;
    UUID runId;
    String jobName;
    String slug;
    String prompt;
}
