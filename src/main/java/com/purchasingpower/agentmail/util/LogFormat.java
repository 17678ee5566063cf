package com.purchasingpower.agentmail.util;

/**
 * Formatting helpers for log lines that carry mail bodies or model output.
 */
public final class LogFormat {

    private LogFormat() {
    }

    /**
     * Truncate large strings for logging (to avoid log spam)
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }

    /**
     * Single-line preview of a mail body.
     */
    public static String preview(String text) {
        if (text == null) {
            return "(null)";
        }
        return truncate(text.replaceAll("\\s+", " ").trim(), 120);
    }
}
