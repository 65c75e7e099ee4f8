package com.faqchat.util;

public final class TextTruncator {

    public static final String ELLIPSIS = "...";

    private TextTruncator() {
    }

    /**
     * Truncate to at most {@code maxLength} code points, appending {@link #ELLIPSIS} when cut.
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return null;
        }
        if (text.codePointCount(0, text.length()) <= maxLength) {
            return text;
        }
        int end = text.offsetByCodePoints(0, maxLength);
        return text.substring(0, end) + ELLIPSIS;
    }
}
