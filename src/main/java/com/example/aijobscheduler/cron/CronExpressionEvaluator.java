package com.example.aijobscheduler.cron;

import com.example.aijobscheduler.config.JobSchedulerProperties;
import com.example.aijobscheduler.exception.InvalidCronExpressionException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses, validates and evaluates 5-field cron expressions
 * (minute, hour, day-of-month, month, day-of-week).
 * <p>
 * Fire-time evaluation is delegated to Spring's {@link CronExpression}; this class only
 * enforces the 5-field form and the restricted field syntax ({@code *}, numbers, ranges,
 * lists and steps). It holds no mutable state and is safe to call from request threads.
 */
@Component
public class CronExpressionEvaluator {

    public static final int FIELD_COUNT = 5;
    public static final int DEFAULT_PREVIEW_COUNT = 5;

    private static final String[] FIELD_NAMES = {"minute", "hour", "day-of-month", "month", "day-of-week"};
    private static final Pattern FIELD_SYNTAX = Pattern.compile("[\\d*,/-]+");

    private final Clock clock;

    @Autowired
    public CronExpressionEvaluator(JobSchedulerProperties properties) {
        this(Clock.system(properties.getScheduler().getZoneId()));
    }

    public CronExpressionEvaluator(Clock clock) {
        this.clock = clock;
    }

    public ZoneId getZone() {
        return clock.getZone();
    }

    public ZonedDateTime now() {
        return ZonedDateTime.now(clock);
    }

    /**
     * Validate an expression.
     *
     * @throws InvalidCronExpressionException if the expression is empty, does not have exactly
     *                                        five fields, or any field is malformed
     */
    public void validate(String expression) {
        var cron = toSpringExpression(expression);
        if (cron.next(now()) == null) {
            throw new InvalidCronExpressionException(expression, "expression never fires");
        }
    }

    /**
     * Compute the next {@code count} fire times strictly after {@code from}, in increasing order.
     */
    public List<ZonedDateTime> nextFireTimes(String expression, ZonedDateTime from, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative: " + count);
        }
        var cron = toSpringExpression(expression);
        var result = new ArrayList<ZonedDateTime>(count);
        var cursor = from;
        for (var i = 0; i < count; i++) {
            var next = cron.next(cursor);
            if (next == null) {
                break;
            }
            result.add(next);
            cursor = next;
        }
        return result;
    }

    /**
     * Human-readable description, "Every minute" for an all-wildcard expression.
     */
    public String describe(String expression) {
        toSpringExpression(expression);
        return CronDescriber.describe(splitFields(expression));
    }

    /**
     * Validate, describe and preview the next {@value #DEFAULT_PREVIEW_COUNT} fire times from now.
     */
    public CronDescription parse(String expression) {
        validate(expression);
        return CronDescription.builder()
                .expression(expression.trim())
                .description(describe(expression))
                .nextRuns(nextFireTimes(expression, now(), DEFAULT_PREVIEW_COUNT))
                .build();
    }

    /**
     * The 6-field Spring form of a validated 5-field expression, with seconds pinned to 0.
     */
    public String toSpringCron(String expression) {
        return "0 " + String.join(" ", splitFields(expression));
    }

    private CronExpression toSpringExpression(String expression) {
        var fields = splitFields(expression);
        for (var i = 0; i < FIELD_COUNT; i++) {
            if (!FIELD_SYNTAX.matcher(fields[i]).matches()) {
                throw new InvalidCronExpressionException(expression,
                        String.format("invalid characters in %s field '%s'", FIELD_NAMES[i], fields[i]));
            }
        }

        try {
            return CronExpression.parse("0 " + String.join(" ", fields));
        } catch (IllegalArgumentException e) {
            throw new InvalidCronExpressionException(expression, e.getMessage(), e);
        }
    }

    private static String[] splitFields(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidCronExpressionException(expression, "expression is empty");
        }
        var fields = expression.trim().split("\\s+");
        if (fields.length != FIELD_COUNT) {
            throw new InvalidCronExpressionException(expression,
                    String.format("expected %d fields (minute hour day-of-month month day-of-week) but found %d",
                            FIELD_COUNT, fields.length));
        }
        return fields;
    }
}
