package de.bsommerfeld.traderelay.core.util;

/**
 * Length limits for everything that ends up in a chat message.
 */
public final class TextBounds {

    /** Upper bound for a relayed trade event message. */
    public static final int EVENT_MESSAGE_MAX = 500;

    /** Upper bound for a query answer; Discord rejects content above 2000. */
    public static final int QUERY_ANSWER_MAX = 1900;

    private TextBounds() {
    }

    /**
     * Cuts {@code text} to at most {@code max} UTF-16 units. A surrogate pair
     * straddling the cut is dropped as a whole so no half emoji is sent.
     * {@code null} becomes the empty string.
     */
    public static String truncate(String text, int max) {
        if (text == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        if (text.length() <= max) {
            return text;
        }
        int end = max;
        if (Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }
}
