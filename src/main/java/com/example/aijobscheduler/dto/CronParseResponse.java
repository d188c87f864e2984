package com.example.aijobscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Description and upcoming fire times of a cron expression
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CronParseResponse {
    private String cronExpression;
    private String description;

    /**
     * Next 5 fire times formatted as yyyy-MM-dd HH:mm:ss in the scheduler zone
     */
    private List<String> nextRuns;
}
