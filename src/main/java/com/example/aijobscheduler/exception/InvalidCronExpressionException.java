package com.example.aijobscheduler.exception;

import lombok.Getter;

/**
 * Exception for a malformed cron expression.
 * Raised synchronously, never stored on a job or run.
 */
@Getter
public class InvalidCronExpressionException extends RuntimeException {

    private final String expression;
    private final String reason;

    public InvalidCronExpressionException(String expression, String reason) {
        super(String.format("Invalid cron expression '%s': %s", expression, reason));
        this.expression = expression;
        this.reason = reason;
    }

    public InvalidCronExpressionException(String expression, String reason, Throwable cause) {
        super(String.format("Invalid cron expression '%s': %s", expression, reason), cause);
        this.expression = expression;
        this.reason = reason;
    }
}
