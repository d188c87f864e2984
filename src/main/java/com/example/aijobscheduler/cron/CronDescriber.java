package com.example.aijobscheduler.cron;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Renders the five fields of a cron expression as crontab.guru style text,
 * e.g. {@code "30 14 * * 1-5"} becomes "at minute 30, at 2:00 PM, from Monday to Friday".
 * <p>
 * Only describes syntax: steps are rendered as "every N units" without simulating them.
 * Callers are expected to have validated the fields already.
 */
final class CronDescriber {

    private static final Map<String, String> MONTH_NAMES = Map.ofEntries(
            Map.entry("1", "January"), Map.entry("2", "February"), Map.entry("3", "March"),
            Map.entry("4", "April"), Map.entry("5", "May"), Map.entry("6", "June"),
            Map.entry("7", "July"), Map.entry("8", "August"), Map.entry("9", "September"),
            Map.entry("10", "October"), Map.entry("11", "November"), Map.entry("12", "December"));

    // 7 is Sunday as well; kept for expressions written for crons that accept it
    private static final Map<String, String> DAY_NAMES = Map.of(
            "0", "Sunday", "1", "Monday", "2", "Tuesday", "3", "Wednesday",
            "4", "Thursday", "5", "Friday", "6", "Saturday", "7", "Sunday");

    private CronDescriber() {
    }

    static String describe(String[] fields) {
        var parts = new ArrayList<String>();
        addIfPresent(parts, describeMinute(fields[0]));
        addIfPresent(parts, describeHour(fields[1]));
        addIfPresent(parts, describeDayOfMonth(fields[2]));
        addIfPresent(parts, describeMonth(fields[3]));
        addIfPresent(parts, describeDayOfWeek(fields[4]));

        if (parts.isEmpty()) {
            return "Every minute";
        }
        return String.join(", ", parts);
    }

    static String describeMinute(String minute) {
        if (isWildcard(minute)) {
            return null;
        } else if (isStep(minute)) {
            return "every " + stepOf(minute) + " minutes";
        } else if (isList(minute)) {
            return "at minutes " + String.join(", ", listOf(minute));
        } else if (isRange(minute)) {
            var range = rangeOf(minute);
            return "minutes " + range[0] + " through " + range[1];
        }
        return "at minute " + minute;
    }

    static String describeHour(String hour) {
        if (isWildcard(hour)) {
            return "every hour";
        } else if (isStep(hour)) {
            return "every " + stepOf(hour) + " hours";
        } else if (isList(hour)) {
            return "at " + joinMapped(hour, CronDescriber::hourToken);
        } else if (isRange(hour)) {
            var range = rangeOf(hour);
            return "from " + toTwelveHourClock(range[0]) + " to " + toTwelveHourClock(range[1]);
        }
        return "at " + toTwelveHourClock(hour);
    }

    static String describeDayOfMonth(String day) {
        if (isWildcard(day)) {
            return null;
        } else if (isStep(day)) {
            return "every " + stepOf(day) + " days";
        } else if (isList(day)) {
            return "on days " + String.join(", ", listOf(day)) + " of the month";
        } else if (isRange(day)) {
            var range = rangeOf(day);
            return "from day " + range[0] + " to " + range[1] + " of the month";
        }
        return "on day " + day + " of the month";
    }

    static String describeMonth(String month) {
        if (isWildcard(month)) {
            return null;
        } else if (isStep(month)) {
            return "every " + stepOf(month) + " months";
        } else if (isList(month)) {
            return "in " + joinMapped(month, token -> namedToken(token, MONTH_NAMES));
        } else if (isRange(month)) {
            var range = rangeOf(month);
            return "from " + nameOf(range[0], MONTH_NAMES) + " to " + nameOf(range[1], MONTH_NAMES);
        }
        return "in " + nameOf(month, MONTH_NAMES);
    }

    static String describeDayOfWeek(String weekday) {
        if (isWildcard(weekday)) {
            return null;
        } else if (isStep(weekday)) {
            return "every " + stepOf(weekday) + " weekdays";
        } else if (isList(weekday)) {
            return "on " + joinMapped(weekday, token -> namedToken(token, DAY_NAMES));
        } else if (isRange(weekday)) {
            var range = rangeOf(weekday);
            return "from " + nameOf(range[0], DAY_NAMES) + " to " + nameOf(range[1], DAY_NAMES);
        }
        return "on " + nameOf(weekday, DAY_NAMES);
    }

    /**
     * 0 becomes "12:00 AM", 12 becomes "12:00 PM", 13 becomes "1:00 PM".
     */
    static String toTwelveHourClock(String hour) {
        var h = Integer.parseInt(hour);
        var amPm = h < 12 ? "AM" : "PM";
        var h12 = h % 12 == 0 ? 12 : h % 12;
        return h12 + ":00 " + amPm;
    }

    private static String hourToken(String token) {
        if (isRange(token)) {
            var range = rangeOf(token);
            return toTwelveHourClock(range[0]) + " to " + toTwelveHourClock(range[1]);
        }
        return toTwelveHourClock(token);
    }

    private static String namedToken(String token, Map<String, String> names) {
        if (isRange(token)) {
            var range = rangeOf(token);
            return nameOf(range[0], names) + " to " + nameOf(range[1], names);
        }
        return nameOf(token, names);
    }

    private static String nameOf(String value, Map<String, String> names) {
        return names.getOrDefault(stripLeadingZeros(value), value);
    }

    private static String stripLeadingZeros(String value) {
        var stripped = value.replaceFirst("^0+(?=\\d)", "");
        return stripped.isEmpty() ? value : stripped;
    }

    private static String joinMapped(String field, Function<String, String> mapper) {
        return listOf(field).stream().map(mapper).collect(Collectors.joining(", "));
    }

    private static void addIfPresent(List<String> parts, String part) {
        if (part != null) {
            parts.add(part);
        }
    }

    private static boolean isWildcard(String field) {
        return "*".equals(field);
    }

    private static boolean isStep(String field) {
        return field.contains("/");
    }

    private static boolean isList(String field) {
        return field.contains(",");
    }

    private static boolean isRange(String field) {
        return field.contains("-");
    }

    private static String stepOf(String field) {
        return field.substring(field.indexOf('/') + 1);
    }

    private static List<String> listOf(String field) {
        return Arrays.asList(field.split(","));
    }

    private static String[] rangeOf(String field) {
        return field.split("-", 2);
    }
}
