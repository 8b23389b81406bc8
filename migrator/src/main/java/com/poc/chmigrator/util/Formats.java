package com.poc.chmigrator.util;

import java.time.Duration;
import java.util.Locale;

/**
 * Human-readable numbers and durations for logs and notifications.
 */
public final class Formats {

    private Formats() {
        // Utility class - prevent instantiation
    }

    /**
     * {@code 1234567 -> "1,234,567"}.
     */
    public static String number(long value) {
        return String.format(Locale.ROOT, "%,d", value);
    }

    /**
     * {@code 45s}, {@code 3m 12s} or {@code 1h 2m 3s}; {@code N/A} for negative durations.
     */
    public static String duration(Duration duration) {
        if (duration == null || duration.isNegative()) {
            return "N/A";
        }
        long seconds = duration.getSeconds();
        if (seconds < 60) {
            return seconds + "s";
        }
        if (seconds < 3600) {
            return (seconds / 60) + "m " + (seconds % 60) + "s";
        }
        return (seconds / 3600) + "h " + ((seconds % 3600) / 60) + "m " + (seconds % 60) + "s";
    }
}
