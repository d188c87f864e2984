package com.example.aijobscheduler.service.notification;

import com.example.aijobscheduler.config.MetricsConfig;
import com.example.aijobscheduler.domain.enums.RunStatus;
import com.example.aijobscheduler.exception.NotificationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("NotificationService Tests")
class NotificationServiceTest {

    @Mock
    private NotificationChannel email;

    @Mock
    private NotificationChannel pushover;

    @Mock
    private NotificationChannel slack;

    @Mock
    private MetricsConfig metricsConfig;

    private NotificationService notificationService;
    private RunNotification notification;

    @BeforeEach
    void setUp() {
        notificationService = new NotificationService(List.of(email, pushover, slack), metricsConfig);
        notification = RunNotification.builder()
                .jobId(UUID.randomUUID())
                .jobName("Daily digest")
                .runId(UUID.randomUUID())
                .status(RunStatus.SUCCESS)
                .outputContent("# Digest")
                .completedAt(Instant.now())
                .build();
    }

    @Test
    @DisplayName("Should deliver to every channel")
    void shouldDeliverToEveryChannel() {
        notificationService.notifyRunCompleted(notification);

        verify(email).send(notification);
        verify(pushover).send(notification);
        verify(slack).send(notification);
        verifyNoInteractions(metricsConfig);
    }

    @Test
    @DisplayName("A failing channel should not stop the others")
    void failingChannelShouldNotStopOthers() {
        // Given
        when(email.name()).thenReturn("email");
        when(pushover.name()).thenReturn("pushover");
        doThrow(new NotificationException("email", "SMTP refused")).when(email).send(any());
        doThrow(new IllegalStateException("unexpected")).when(pushover).send(any());

        // When
        notificationService.notifyRunCompleted(notification);

        // Then
        verify(slack).send(notification);
        verify(metricsConfig).recordNotificationFailure("email");
        verify(metricsConfig).recordNotificationFailure("pushover");
    }
}
