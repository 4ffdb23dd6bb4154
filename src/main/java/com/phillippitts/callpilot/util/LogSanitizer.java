package com.phillippitts.callpilot.util;

/** Utility for privacy-safe logging of phone numbers and free text. */
public final class LogSanitizer {

    private static final int VISIBLE_DIGITS = 4;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Masks all but the last four digits of a phone number, e.g. {@code +15551234567} becomes
     * {@code ***4567}. Returns "" for null and {@code ***} when there are four digits or fewer.
     */
    public static String maskPhone(String phone) {
        if (phone == null) {
            return "";
        }
        String digits = phone.replaceAll("\\D", "");
        if (digits.length() <= VISIBLE_DIGITS) {
            return "***";
        }
        return "***" + digits.substring(digits.length() - VISIBLE_DIGITS);
    }
}
