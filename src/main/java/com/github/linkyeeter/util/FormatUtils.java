package com.github.linkyeeter.util;

import lombok.experimental.UtilityClass;

import java.security.SecureRandom;
import java.util.Locale;

/**
 * Utility class for sizes, bitrates and generated names.
 */
@UtilityClass
public class FormatUtils {

    private static final String ALPHANUMERIC =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

    private static final SecureRandom RANDOM = new SecureRandom();

    /**
     * Convert a byte count to whole decimal megabytes, rounding down.
     */
    public static long toWholeMegabytes(long bytes) {
        return bytes / MediaConstants.BYTES_PER_MB;
    }

    /**
     * Format bytes to human-readable size string.
     *
     * @param bytes Size in bytes
     * @return Formatted string like "1.23 GB", "456.78 MB", or "789 B"
     */
    public static String formatSize(long bytes) {
        if (bytes >= 1_000_000_000) {
            return String.format(Locale.ROOT, "%.2f GB", bytes / 1_000_000_000.0);
        } else if (bytes >= 1_000_000) {
            return String.format(Locale.ROOT, "%.2f MB", bytes / 1_000_000.0);
        } else if (bytes >= 1_000) {
            return String.format(Locale.ROOT, "%.2f KB", bytes / 1_000.0);
        } else {
            return String.format(Locale.ROOT, "%d B", bytes);
        }
    }

    /**
     * Format a bitrate for logs, or "unconstrained" when absent.
     */
    public static String formatBitrate(Long kbps) {
        return kbps != null ? kbps + " kbps" : "unconstrained";
    }

    public static String formatPercentage(double value) {
        return String.format(Locale.ROOT, "%.1f%%", value);
    }

    /**
     * Random alphanumeric string, used for output file names.
     */
    public static String randomAlphanumeric(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("length must not be negative: " + length);
        }
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHANUMERIC.charAt(RANDOM.nextInt(ALPHANUMERIC.length())));
        }
        return sb.toString();
    }
}
