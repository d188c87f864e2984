package com.example.aijobscheduler.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Partial update of a job. Null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateJobRequest {

    @Size(min = 3, max = 100, message = "Job name must be between 3 and 100 characters")
    private String name;

    @Size(min = 10, message = "Prompt content must be at least 10 characters")
    private String promptContent;

    private String cronExpression;

    private Boolean enabled;

    private List<@Email(message = "Recipient must be a valid email address") String> recipients;
}
