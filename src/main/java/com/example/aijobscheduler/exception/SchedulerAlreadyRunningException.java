package com.example.aijobscheduler.exception;

/**
 * Thrown by {@code JobScheduler.start} when the scheduler was already started
 */
public class SchedulerAlreadyRunningException extends IllegalStateException {

    public SchedulerAlreadyRunningException() {
        super("Scheduler is already running");
    }
}
