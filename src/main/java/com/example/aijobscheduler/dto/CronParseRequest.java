package com.example.aijobscheduler.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CronParseRequest {

    @NotBlank(message = "Cron expression is required")
    private String cronExpression;
}
