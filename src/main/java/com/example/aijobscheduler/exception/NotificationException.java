package com.example.aijobscheduler.exception;

import lombok.Getter;

/**
 * Exception for a notification channel that failed to deliver.
 * Only ever logged; never changes the outcome of a run.
 */
@Getter
public class NotificationException extends RuntimeException {

    private final String channel;
    private final Integer httpStatusCode;

    public NotificationException(String channel, String message) {
        super(String.format("%s notification failed: %s", channel, message));
        this.channel = channel;
        this.httpStatusCode = null;
    }

    public NotificationException(String channel, int httpStatusCode, String responseBody) {
        super(String.format("%s notification failed with HTTP %d: %s", channel, httpStatusCode, responseBody));
        this.channel = channel;
        this.httpStatusCode = httpStatusCode;
    }

    public NotificationException(String channel, Throwable cause) {
        super(String.format("%s notification failed: %s", channel, cause.getMessage()), cause);
        this.channel = channel;
        this.httpStatusCode = null;
    }
}
