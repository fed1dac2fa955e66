package net.bibrecords.util;

/**
 * Title helpers used when presenting publications.
 */
public final class PublicationTextUtils {

    private static final int SHORT_TITLE_LIMIT = 64;
    private static final int TRUNCATE_SEARCH_START = 40;
    private static final int TRUNCATE_SEARCH_END = 62;
    private static final int HARD_TRUNCATE_LENGTH = 61;
    private static final String ELLIPSIS = "...";

    private PublicationTextUtils() {
        // Utility class - no instantiation
    }

    /**
     * Tests whether a title already ends with a sentence mark, so styles do not append another period.
     */
    public static boolean endsWithPunctuation(String title) {
        if (title == null || title.isEmpty()) {
            return false;
        }
        char last = title.charAt(title.length() - 1);
        return last == '.' || last == '!' || last == '?';
    }

    /**
     * Shortens long titles for listings.
     *
     * <p>Titles under 64 characters are returned unchanged. Longer ones are cut at the last space
     * between index 40 and 61, or hard at 61 characters when there is none, and get "..." appended.
     *
     * <p><strong>Example:</strong>
     * <pre>
     * Input:  "On the Electrodynamics of Moving Bodies and Related Questions of Relativity"
     * Output: "On the Electrodynamics of Moving Bodies and Related Questions..."
     * </pre>
     */
    public static String shortTitle(String title) {
        if (title == null) {
            return "";
        }
        if (title.length() < SHORT_TITLE_LIMIT) {
            return title;
        }

        int index = title.lastIndexOf(' ', TRUNCATE_SEARCH_END - 1);
        if (index < TRUNCATE_SEARCH_START) {
            return title.substring(0, HARD_TRUNCATE_LENGTH) + ELLIPSIS;
        }
        return title.substring(0, index) + ELLIPSIS;
    }
}
