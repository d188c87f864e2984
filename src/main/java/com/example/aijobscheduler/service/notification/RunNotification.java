package com.example.aijobscheduler.service.notification;

import com.example.aijobscheduler.domain.enums.RunStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Snapshot of a finished run handed to notification channels.
 * Taken before notifying so channels never read the store.
 */
@Value
@Builder
public class RunNotification {
    UUID jobId;
    String jobName;
    UUID runId;
    RunStatus status;
    String outputContent;
    String htmlOutputContent;
    String errorMessage;
    @Builder.Default
    List<String> recipients = List.of();
    Instant completedAt;

    public boolean isSuccess() {
        return status == RunStatus.SUCCESS;
    }
}
