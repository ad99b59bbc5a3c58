package com.autotrader.util;

/**
 * Allocation-light number formatting for log lines and exit descriptions.
 */
public final class FormatUtils {

    private FormatUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Formats a value with 2 decimal places without String.format.
     *
     * @param value the double value to format
     * @return string representation (e.g., "3.14", "-2.50")
     */
    public static String formatDouble(double value) {
        StringBuilder sb = new StringBuilder(16);
        appendDouble(sb, value);
        return sb.toString();
    }

    /**
     * Appends a value with 2 decimal places.
     *
     * @param sb StringBuilder to append to
     * @param value double value to format and append
     */
    public static void appendDouble(StringBuilder sb, double value) {
        long scaled = Math.round(value * 100);
        if (scaled < 0) {
            sb.append('-');
            scaled = -scaled;
        }
        sb.append(scaled / 100);
        sb.append('.');
        long frac = scaled % 100;
        if (frac < 10) sb.append('0');
        sb.append(frac);
    }
}
