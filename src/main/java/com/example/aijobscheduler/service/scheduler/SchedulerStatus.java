package com.example.aijobscheduler.service.scheduler;

import lombok.Value;

/**
 * Point-in-time view of the scheduler
 */
@Value
public class SchedulerStatus {
    boolean running;
    int armedCount;
}
