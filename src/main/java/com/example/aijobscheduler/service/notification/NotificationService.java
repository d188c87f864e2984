package com.example.aijobscheduler.service.notification;

import com.example.aijobscheduler.config.MetricsConfig;
import com.example.aijobscheduler.exception.NotificationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Fans a run completion notice out to every configured channel.
 * <p>
 * Delivery is best-effort: a failing channel is logged and counted,
 * and never affects other channels or the run record.
 */
@Slf4j
@Service
public class NotificationService {

    private final List<NotificationChannel> channels;
    private final MetricsConfig metricsConfig;

    public NotificationService(List<NotificationChannel> channels, MetricsConfig metricsConfig) {
        this.channels = channels;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Runs asynchronously so a slow mail server does not hold a supervisor thread.
     */
    @Async
    public void notifyRunCompleted(RunNotification notification) {
        log.debug("Notifying {} channels about run {} of job '{}' ({})",
                channels.size(), notification.getRunId(), notification.getJobName(), notification.getStatus().getCode());

        for (var channel : channels) {
            try {
                channel.send(notification);
            } catch (NotificationException e) {
                log.warn("Notification via {} failed for run {}: {}", channel.name(), notification.getRunId(), e.getMessage());
                metricsConfig.recordNotificationFailure(channel.name());
            } catch (Exception e) {
                log.error("Unexpected error notifying via {} for run {}: {}", channel.name(), notification.getRunId(), e.getMessage(), e);
                metricsConfig.recordNotificationFailure(channel.name());
            }
        }
    }
}
