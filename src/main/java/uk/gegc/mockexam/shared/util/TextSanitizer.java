package uk.gegc.mockexam.shared.util;

import java.util.regex.Pattern;

/**
 * Whitespace normalisation for text lifted out of model output.
 */
public final class TextSanitizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextSanitizer() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Collapses every run of whitespace to a single space and trims the result.
     */
    public static String sanitize(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /**
     * Sanitizes and, when longer than {@code maxLength}, cuts at the last word boundary and appends "...".
     */
    public static String sanitize(String text, int maxLength) {
        String sanitized = sanitize(text);
        if (maxLength <= 0 || sanitized.length() <= maxLength) {
            return sanitized;
        }
        String cut = sanitized.substring(0, maxLength);
        int lastSpace = cut.lastIndexOf(' ');
        if (lastSpace > 0) {
            cut = cut.substring(0, lastSpace);
        }
        return cut + "...";
    }
}
