package com.example.aijobscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulerStatusResponse {
    private boolean schedulerRunning;
    private int armedJobsCount;
    private long activeJobsCount;
    private long totalJobsCount;
}
