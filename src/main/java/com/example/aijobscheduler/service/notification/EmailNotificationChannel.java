package com.example.aijobscheduler.service.notification;

import com.example.aijobscheduler.config.JobSchedulerProperties;
import com.example.aijobscheduler.exception.NotificationException;
import jakarta.mail.MessagingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Emails the output of a successful run to each of the job's recipients.
 * Failed runs are not emailed.
 */
@Slf4j
@Component
public class EmailNotificationChannel implements NotificationChannel {

    private static final DateTimeFormatter SUBJECT_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private final ObjectProvider<JavaMailSender> mailSenderProvider;
    private final JobSchedulerProperties properties;
    private final Clock clock;

    @Autowired
    public EmailNotificationChannel(ObjectProvider<JavaMailSender> mailSenderProvider, JobSchedulerProperties properties) {
        this(mailSenderProvider, properties, Clock.system(properties.getScheduler().getZoneId()));
    }

    EmailNotificationChannel(ObjectProvider<JavaMailSender> mailSenderProvider, JobSchedulerProperties properties, Clock clock) {
        this.mailSenderProvider = mailSenderProvider;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "email";
    }

    @Override
    public void send(RunNotification notification) {
        var email = properties.getNotifications().getEmail();
        if (!email.isEnabled()) {
            log.debug("Email notifications disabled, skipping run {}", notification.getRunId());
            return;
        }
        if (!notification.isSuccess() || notification.getRecipients().isEmpty()) {
            return;
        }

        var mailSender = mailSenderProvider.getIfAvailable();
        if (mailSender == null) {
            log.warn("Email enabled but no mail server configured (spring.mail.host). Run {} was not emailed.", notification.getRunId());
            return;
        }

        var subject = notification.getJobName() + " - " + LocalDate.now(clock).format(SUBJECT_DATE);
        var html = notification.getHtmlOutputContent() != null;
        var body = html ? notification.getHtmlOutputContent() : nullToEmpty(notification.getOutputContent());

        NotificationException firstFailure = null;
        for (var recipient : notification.getRecipients()) {
            try {
                var message = mailSender.createMimeMessage();
                var helper = new MimeMessageHelper(message, false, StandardCharsets.UTF_8.name());
                helper.setFrom(email.getFrom());
                helper.setTo(recipient);
                helper.setSubject(subject);
                helper.setText(body, html);
                mailSender.send(message);
                log.info("Email sent to {} for run {}", recipient, notification.getRunId());
            } catch (MessagingException | MailException e) {
                log.error("Error sending email to {} for run {}: {}", recipient, notification.getRunId(), e.getMessage());
                if (firstFailure == null) {
                    firstFailure = new NotificationException(name(), e);
                }
            }
        }

        if (firstFailure != null) {
            throw firstFailure;
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
