package com.edabot.output;

import java.util.Locale;

/**
 * Number formatting for the Markdown report. Never throws; anything that is
 * not a finite number renders as {@link #NOT_AVAILABLE}.
 */
public final class ReportFormat {
    public static final String NOT_AVAILABLE = "N/A";

    private ReportFormat() {
    }

    public static String fixed(double value, int decimals) {
        if (!Double.isFinite(value) || decimals < 0) {
            return NOT_AVAILABLE;
        }
        return String.format(Locale.US, "%." + decimals + "f", value);
    }

    public static String fixed(Object value, int decimals) {
        if (value instanceof Number) {
            return fixed(((Number) value).doubleValue(), decimals);
        }
        return NOT_AVAILABLE;
    }

    static String text(String value) {
        String trimmed = value == null ? "" : value.trim();
        return trimmed.isEmpty() ? NOT_AVAILABLE : trimmed.replace("|", "\\|");
    }
}
