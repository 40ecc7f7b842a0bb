package com.autonomous.crew.support;

import java.util.regex.Pattern;

public final class TextUtils {

    public static final int MAX_ERROR_LENGTH = 500;

    // CSI sequences only
    private static final Pattern SIMPLE_ANSI = Pattern.compile("\u001b\\[[0-9;]*[a-zA-Z]");

    private static final Pattern FULL_ANSI = Pattern.compile(
        "\u001b\\[[0-9;?]*[ -/]*[@-~]"          // CSI, including private modes
            + "|\u001b\\][^\u0007\u001b]*(?:\u0007|\u001b\\\\)"  // OSC
            + "|\u001b[()][0-9A-Za-z]"             // charset selection
            + "|\u001b[=>78]"
            + "|\r");

    private TextUtils() {
    }

    public static String stripAnsiSimple(String text) {
        return text == null ? "" : SIMPLE_ANSI.matcher(text).replaceAll("");
    }

    public static String stripAnsi(String text) {
        return text == null ? "" : FULL_ANSI.matcher(text).replaceAll("");
    }

    public static String truncate(String text, int max) {
        if (text == null || text.length() <= max) {
            return text;
        }
        return text.substring(0, max);
    }

    public static String truncateError(String text) {
        return truncate(text, MAX_ERROR_LENGTH);
    }

    public static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }

    public static String firstLine(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.strip();
        int newline = trimmed.indexOf('\n');
        return (newline < 0 ? trimmed : trimmed.substring(0, newline)).strip();
    }
}
