package net.bibrecords.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Canonicalizes the free-text keywords field of a publication.
 *
 * <p>Keywords may be separated by commas, semicolons or "and". They are stored lowercase,
 * trimmed, and joined by ", ".
 *
 * <p><strong>Example:</strong>
 * <pre>
 * Input:  "Deep Learning; Vision and  Robotics"
 * Output: "deep learning, vision, robotics"
 * </pre>
 */
public final class KeywordNormalizer {

    private KeywordNormalizer() {
        // Utility class - no instantiation
    }

    public static String normalize(String keywords) {
        if (keywords == null) {
            return "";
        }

        String separated = keywords.replace(";", ",")
            .replace(", and ", ", ")
            .replace(",and ", ", ")
            .replace(" and ", ", ");

        List<String> normalized = new ArrayList<>();
        for (String keyword : separated.split(",", -1)) {
            normalized.add(keyword.trim().toLowerCase(Locale.ROOT));
        }
        return String.join(", ", normalized);
    }
}
