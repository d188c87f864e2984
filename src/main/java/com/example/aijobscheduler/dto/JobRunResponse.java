package com.example.aijobscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for a job run
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobRunResponse {
    private UUID id;
    private UUID jobId;
    private String jobName;
    private String status;
    private String outputContent;
    private String htmlOutputContent;
    private String logContent;
    private Instant startedAt;
    private Instant completedAt;
    private String errorMessage;
    private Long durationMs;
}
