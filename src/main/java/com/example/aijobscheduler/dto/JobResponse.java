package com.example.aijobscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Response DTO for job details
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobResponse {
    private UUID id;
    private String name;
    private String slug;
    private String promptContent;
    private String cronExpression;
    private boolean enabled;
    private List<String> recipients;

    /**
     * Whether a run of this job is currently in flight
     */
    private boolean running;

    /**
     * Next scheduled fire time, null when disabled
     */
    private ZonedDateTime nextRunAt;

    private Instant createdAt;
    private Instant updatedAt;
}
