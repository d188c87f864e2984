package com.example.aijobscheduler.service.notification;

/**
 * A destination for run completion notices.
 * <p>
 * Implementations decide on their own whether a notice applies to them
 * (e.g. email only on success) and skip silently otherwise.
 */
public interface NotificationChannel {

    /**
     * Short channel name used in logs and metrics
     */
    String name();

    /**
     * @throws com.example.aijobscheduler.exception.NotificationException if delivery fails
     */
    void send(RunNotification notification);
}
