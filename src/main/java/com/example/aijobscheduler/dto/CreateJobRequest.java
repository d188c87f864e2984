package com.example.aijobscheduler.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request DTO for creating a new job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateJobRequest {

    @NotBlank(message = "Job name is required")
    @Size(min = 3, max = 100, message = "Job name must be between 3 and 100 characters")
    private String name;

    @NotBlank(message = "Prompt content is required")
    @Size(min = 10, message = "Prompt content must be at least 10 characters")
    private String promptContent;

    /**
     * 5-field cron expression, validated by the service
     */
    @NotBlank(message = "Cron expression is required")
    private String cronExpression;

    @Builder.Default
    private boolean enabled = true;

    /**
     * Addresses that receive the output of successful runs
     */
    @Builder.Default
    private List<@Email(message = "Recipient must be a valid email address") String> recipients = new ArrayList<>();
}
