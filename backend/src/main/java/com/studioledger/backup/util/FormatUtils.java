package com.studioledger.backup.util;

import java.time.Duration;
import java.util.Locale;

/**
 * Utility class for formatting values in log lines and error summaries.
 */
public final class FormatUtils {

    private static final String[] BYTE_UNITS = {"B", "KB", "MB", "GB", "TB"};

    private FormatUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Format bytes into human-readable format (e.g., "1.50 GB").
     *
     * @param bytes Number of bytes
     * @return Formatted string like "1.50 GB", or "0 B" if zero or negative
     */
    public static String formatBytes(long bytes) {
        if (bytes <= 0) {
            return "0 B";
        }
        int unitIndex = 0;
        double size = bytes;
        while (size >= 1024 && unitIndex < BYTE_UNITS.length - 1) {
            size /= 1024;
            unitIndex++;
        }
        return String.format(Locale.ROOT, "%.2f %s", size, BYTE_UNITS[unitIndex]);
    }

    /**
     * Format a duration as seconds with one decimal (e.g., "12.3s").
     */
    public static String formatDuration(Duration duration) {
        return String.format(Locale.ROOT, "%.1fs", duration.toMillis() / 1000.0);
    }

    /**
     * Keep at most the last {@code maxChars} characters of a process output.
     */
    public static String tail(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        String trimmed = text.strip();
        return trimmed.length() <= maxChars ? trimmed : "..." + trimmed.substring(trimmed.length() - maxChars);
    }
}
