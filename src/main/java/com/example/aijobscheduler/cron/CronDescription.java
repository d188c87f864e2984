package com.example.aijobscheduler.cron;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;
import java.util.List;

/**
 * A validated cron expression together with its human-readable description
 * and the upcoming fire times computed from it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CronDescription {

    private String expression;
    private String description;
    private List<ZonedDateTime> nextRuns;
}
