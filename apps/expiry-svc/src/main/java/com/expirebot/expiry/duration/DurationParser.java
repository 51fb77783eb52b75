package com.expirebot.expiry.duration;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses compact durations such as {@code 24h}, {@code 3d} or {@code 1d2h30m} into milliseconds.
 * Segments must appear in the order d, h, m, s; each is optional but at least one is required.
 */
public final class DurationParser {

    private static final Pattern DURATION = Pattern.compile(
            "^(?:(?<days>\\d+)d)?\\s*(?:(?<hours>\\d+)h)?\\s*(?:(?<minutes>\\d+)m)?\\s*(?:(?<seconds>\\d+)s)?$");

    private static final long SECOND_MS = 1000L;
    private static final long MINUTE_MS = 60 * SECOND_MS;
    private static final long HOUR_MS = 60 * MINUTE_MS;
    private static final long DAY_MS = 24 * HOUR_MS;

    private DurationParser() {
    }

    public static long parseMillis(String input) {
        if (input == null) {
            throw new InvalidDurationFormatException(null);
        }
        Matcher matcher = DURATION.matcher(input.strip());
        if (!matcher.matches()) {
            throw new InvalidDurationFormatException(input);
        }
        String days = matcher.group("days");
        String hours = matcher.group("hours");
        String minutes = matcher.group("minutes");
        String seconds = matcher.group("seconds");
        if (days == null && hours == null && minutes == null && seconds == null) {
            throw new InvalidDurationFormatException(input);
        }
        try {
            long total = 0;
            total = Math.addExact(total, segment(days, DAY_MS));
            total = Math.addExact(total, segment(hours, HOUR_MS));
            total = Math.addExact(total, segment(minutes, MINUTE_MS));
            total = Math.addExact(total, segment(seconds, SECOND_MS));
            return total;
        } catch (ArithmeticException | NumberFormatException ex) {
            throw new InvalidDurationFormatException(input, ex);
        }
    }

    /**
     * Renders milliseconds in the same compact form the parser accepts, dropping zero segments.
     */
    public static String format(long millis) {
        if (millis < 0) {
            throw new IllegalArgumentException("millis must not be negative");
        }
        long remaining = millis;
        long days = remaining / DAY_MS;
        remaining %= DAY_MS;
        long hours = remaining / HOUR_MS;
        remaining %= HOUR_MS;
        long minutes = remaining / MINUTE_MS;
        remaining %= MINUTE_MS;
        long seconds = remaining / SECOND_MS;

        StringBuilder out = new StringBuilder();
        if (days > 0) out.append(days).append('d');
        if (hours > 0) out.append(hours).append('h');
        if (minutes > 0) out.append(minutes).append('m');
        if (seconds > 0) out.append(seconds).append('s');
        return out.length() == 0 ? "0s" : out.toString();
    }

    private static long segment(String digits, long unitMs) {
        if (digits == null) {
            return 0L;
        }
        return Math.multiplyExact(Long.parseLong(digits), unitMs);
    }
}
