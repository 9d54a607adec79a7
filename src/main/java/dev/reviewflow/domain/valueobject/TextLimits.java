package dev.reviewflow.domain.valueobject;

/**
 * Maximum lengths of the text columns in the review schema. Inputs are checked
 * against these before anything is written.
 */
public final class TextLimits {
    public static final int WORKSPACE_ID = 64;
    public static final int IDENTIFIER = 128;
    public static final int NAME = 200;
    public static final int DESCRIPTION = 2000;
    public static final int LONG_TEXT = 4000;
    public static final int ACTIVITY_DETAIL = 1000;

    private TextLimits() {
    }

    public static boolean exceeds(String value, int max) {
        return value != null && value.length() > max;
    }

    public static String requireWithin(String field, String value, int max) {
        if (exceeds(value, max)) {
            throw new IllegalArgumentException("%s must be at most %d characters".formatted(field, max));
        }
        return value;
    }

    /** Cuts {@code value} to {@code max} characters, marking the cut with "...". */
    public static String truncate(String value, int max) {
        if (!exceeds(value, max)) return value;
        return value.substring(0, max - 3) + "...";
    }
}
