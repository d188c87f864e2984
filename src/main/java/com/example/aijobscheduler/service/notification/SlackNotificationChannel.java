package com.example.aijobscheduler.service.notification;

import com.example.aijobscheduler.config.SlackProperties;
import com.example.aijobscheduler.exception.NotificationException;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Posts run outcomes to a Slack channel through an incoming webhook.
 */
@Slf4j
@Component
public class SlackNotificationChannel implements NotificationChannel {

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z").withZone(ZoneId.systemDefault());

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:ai-job-scheduler}")
    private String applicationName = "ai-job-scheduler";

    @Autowired
    public SlackNotificationChannel(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackNotificationChannel(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    @Override
    public String name() {
        return "slack";
    }

    @Override
    public void send(RunNotification notification) {
        if (!slackProperties.isEnabled() || slackProperties.getWebhookUrl() == null || slackProperties.getWebhookUrl().isBlank()) {
            log.debug("Slack notifications disabled or webhook URL not configured, skipping run {}", notification.getRunId());
            return;
        }

        try {
            var response = slack.send(slackProperties.getWebhookUrl(), buildPayload(notification));
            if (response.getCode() != 200) {
                throw new NotificationException(name(), response.getCode(), response.getBody());
            }
            log.info("Slack notification sent for run {}", notification.getRunId());
        } catch (IOException e) {
            throw new NotificationException(name(), e);
        }
    }

    Payload buildPayload(RunNotification notification) {
        var success = notification.isSuccess();
        var runId = notification.getRunId().toString();

        var fields = new ArrayList<Field>();
        fields.add(Field.builder()
                .title("Run ID")
                .value(runId)
                .valueShortEnough(true)
                .build());
        fields.add(Field.builder()
                .title("Status")
                .value(notification.getStatus().getDisplayName())
                .valueShortEnough(true)
                .build());
        if (notification.getCompletedAt() != null) {
            fields.add(Field.builder()
                    .title("Completed At")
                    .value(DATE_FORMATTER.format(notification.getCompletedAt()))
                    .valueShortEnough(true)
                    .build());
        }
        if (!success) {
            var error = notification.getErrorMessage() != null ? notification.getErrorMessage() : "Unknown error";
            fields.add(Field.builder()
                    .title("Error")
                    .value("```" + truncate(error, 400) + "```")
                    .valueShortEnough(false)
                    .build());
        }

        var attachment = Attachment.builder()
                .color(success ? "good" : "danger")
                .title(notification.getJobName())
                .fields(fields)
                .footer(applicationName)
                .ts(String.valueOf(Instant.now().getEpochSecond()));
        if (slackProperties.getDashboardBaseUrl() != null && !slackProperties.getDashboardBaseUrl().isBlank()) {
            attachment.titleLink(slackProperties.getDashboardBaseUrl() + "/api/job-runs/" + runId);
        }

        return Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(success ? ":white_check_mark:" : ":rotating_light:")
                .text(success
                        ? ":white_check_mark: *" + notification.getJobName() + " - Success*"
                        : ":rotating_light: *" + notification.getJobName() + " - Failed*")
                .attachments(List.of(attachment.build()))
                .build();
    }

    private String truncate(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
