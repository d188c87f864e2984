package com.example.aijobscheduler.service.notification;

import com.example.aijobscheduler.config.PushoverProperties;
import com.example.aijobscheduler.exception.NotificationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;

/**
 * Push notification for every finished run, successful or not.
 * Failures are sent at high priority with an alert sound.
 */
@Slf4j
@Component
public class PushoverNotificationChannel implements NotificationChannel {

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final WebClient webClient;
    private final PushoverProperties properties;

    public PushoverNotificationChannel(@Qualifier("pushoverWebClient") WebClient webClient, PushoverProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    @Override
    public String name() {
        return "pushover";
    }

    @Override
    public void send(RunNotification notification) {
        if (!properties.isEnabled()) {
            return;
        }
        if (!properties.hasCredentials()) {
            log.warn("Pushover credentials not configured. Set pushover.user-key and pushover.app-token to enable notifications.");
            return;
        }

        var form = buildForm(notification);

        try {
            log.info("Sending Pushover notification ({}) for run {}", notification.getStatus().getCode(), notification.getRunId());
            webClient.post()
                    .uri(properties.getApiUrl())
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(BodyInserters.fromFormData(form))
                    .retrieve()
                    .toBodilessEntity()
                    .block(REQUEST_TIMEOUT);
        } catch (WebClientResponseException e) {
            throw new NotificationException(name(), e.getStatusCode().value(), e.getResponseBodyAsString());
        } catch (RuntimeException e) {
            throw new NotificationException(name(), e);
        }
    }

    LinkedMultiValueMap<String, String> buildForm(RunNotification notification) {
        var form = new LinkedMultiValueMap<String, String>();
        form.add("token", properties.getAppToken());
        form.add("user", properties.getUserKey());
        form.add("title", titleFor(notification));
        form.add("message", messageFor(notification));
        form.add("priority", notification.isSuccess() ? "0" : "1");
        form.add("sound", notification.isSuccess() ? "pushover" : "siren");
        return form;
    }

    static String titleFor(RunNotification notification) {
        return notification.isSuccess()
                ? "✅ " + notification.getJobName() + " - Success"
                : "❌ " + notification.getJobName() + " - Failed";
    }

    static String messageFor(RunNotification notification) {
        if (notification.isSuccess()) {
            var message = "Job completed successfully!\n\nResults saved to database.";
            if (!notification.getRecipients().isEmpty()) {
                message += "\nEmail sent to: " + String.join(", ", notification.getRecipients());
            }
            return message;
        }
        var error = notification.getErrorMessage() != null ? notification.getErrorMessage() : "Unknown error";
        return "Job failed to complete.\n\nError: " + error
                + "\n\nPlease check the run log for detailed error information.";
    }
}
