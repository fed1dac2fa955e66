package net.bibrecords.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Single source of truth for turning a freeform authors field into canonical author names.
 *
 * <p>The raw field separates authors with commas, semicolons or the word "and". Each author
 * is reduced to "Initial. Initial. Lastname" form:
 * <ul>
 *   <li>Concatenated initials after the surname are expanded ("Gauss CF" becomes "C. F. Gauss")</li>
 *   <li>Given names are abbreviated, hyphenated ones per part ("Jean-Paul" becomes "J.-P.")</li>
 *   <li>Suffixes (Jr., III, ...), the "Dr." prefix and nobiliary particles (van, von, ...) are kept</li>
 * </ul>
 *
 * <p>A field wrapped in braces is an escaped literal and is kept as one opaque name.
 * Blank entries produced by repeated separators are dropped and the remaining entries re-indexed.
 *
 * <p><strong>Example:</strong>
 * <pre>
 * Input:  "Carl Friedrich Gauss; Jean-Paul Sartre and Mueller T"
 * Output: ["C. F. Gauss", "J.-P. Sartre", "T. Mueller"]
 * </pre>
 *
 * @see CiteKeyGenerator
 */
public final class AuthorNameNormalizer {

    private static final Set<String> SUFFIXES = Set.of(
        "I", "II", "III", "IV", "V", "VI", "VII", "VIII", "Jr.", "Sr."
    );
    private static final Set<String> PREFIXES = Set.of("Dr.");
    private static final Set<String> PREPOSITIONS = Set.of("van", "von", "der", "de", "den");

    /** Longest trailing word still treated as a run of initials ("Gauss CFW"). */
    private static final int MAX_TRAILING_INITIALS = 3;

    private static final String AUTHOR_SEPARATOR = ",";
    private static final String BIBTEX_SEPARATOR = " and ";

    private AuthorNameNormalizer() {
        // Utility class - no instantiation
    }

    /**
     * Parses a raw authors field.
     *
     * <p>Never fails on malformed input: every heuristic that does not match leaves the
     * words as they are. A blank field yields an empty result; callers that need at least one
     * author reject such records before relying on the output.
     *
     * @param rawAuthors authors field as entered by a user or loaded from storage
     * @return canonical author views of the field
     * @throws IllegalArgumentException if {@code rawAuthors} is null
     */
    public static NormalizedAuthors normalize(String rawAuthors) {
        if (rawAuthors == null) {
            throw new IllegalArgumentException("rawAuthors cannot be null");
        }

        String trimmed = rawAuthors.trim();
        if (isEscapedLiteral(trimmed)) {
            String literal = trimmed.substring(1, trimmed.length() - 1);
            return new NormalizedAuthors(List.of(literal), List.of(), null, trimmed, true);
        }

        List<String> displayNames = new ArrayList<>();
        List<String> simplifiedNames = new ArrayList<>();

        for (String token : normalizeSeparators(rawAuthors).split(AUTHOR_SEPARATOR, -1)) {
            String author = token.trim();
            if (author.isEmpty()) {
                continue;
            }

            List<String> names = abbreviate(expandTrailingInitials(splitWords(author)));
            displayNames.add(String.join(" ", names));
            simplifiedNames.addAll(simplifiedVariants(names));
        }

        return new NormalizedAuthors(
            Collections.unmodifiableList(displayNames),
            Collections.unmodifiableList(simplifiedNames),
            String.join(BIBTEX_SEPARATOR, displayNames),
            joinForDisplay(displayNames),
            false
        );
    }

    /**
     * Lowercases a name and folds the German umlauts and sharp s to ASCII.
     *
     * <pre>
     * simplifyName("Müller")  // "mueller"
     * simplifyName("C. Gauß") // "c. gauss"
     * </pre>
     */
    public static String simplifyName(String name) {
        if (name == null) {
            return null;
        }
        return name.toLowerCase(Locale.ROOT)
            .replace("ä", "ae")
            .replace("ö", "oe")
            .replace("ü", "ue")
            .replace("ß", "ss");
    }

    /**
     * Joins display names the way they are shown to readers:
     * "A", "A and B", "A, B, and C".
     *
     * @return the joined names, or an empty string when there are none
     */
    public static String joinForDisplay(List<String> displayNames) {
        if (displayNames.size() > 2) {
            return String.join(", ", displayNames.subList(0, displayNames.size() - 1))
                + ", and " + displayNames.get(displayNames.size() - 1);
        }
        if (displayNames.size() == 2) {
            return displayNames.get(0) + " and " + displayNames.get(1);
        }
        return displayNames.isEmpty() ? "" : displayNames.get(0);
    }

    /**
     * Returns the surname used for citation keys: the last space-separated word of a display name.
     */
    public static String surnameOf(String displayName) {
        if (displayName == null) {
            return null;
        }
        int lastSpace = displayName.lastIndexOf(' ');
        return lastSpace < 0 ? displayName : displayName.substring(lastSpace + 1);
    }

    static String normalizeSeparators(String rawAuthors) {
        return rawAuthors.replace(";", ",")
            .replace(", and ", ", ")
            .replace(",and ", ", ")
            .replace(" and ", ", ");
    }

    private static boolean isEscapedLiteral(String trimmed) {
        return trimmed.length() >= 2 && trimmed.charAt(0) == '{' && trimmed.charAt(trimmed.length() - 1) == '}';
    }

    private static List<String> splitWords(String author) {
        // Single-space split keeps empty words from doubled spaces in place
        return new ArrayList<>(Arrays.asList(author.split(" ", -1)));
    }

    /** Turns ["Gauss", "CF"] into ["C.", "F.", "Gauss"]. */
    private static List<String> expandTrailingInitials(List<String> names) {
        String last = names.get(names.size() - 1);
        if (last.length() > MAX_TRAILING_INITIALS || SUFFIXES.contains(last) || !isUppercaseAscii(last)) {
            return names;
        }

        List<String> expanded = new ArrayList<>(names.size() + last.length());
        for (char initial : last.toCharArray()) {
            expanded.add(initial + ".");
        }
        expanded.addAll(names.subList(0, names.size() - 1));
        return expanded;
    }

    private static List<String> abbreviate(List<String> names) {
        int suffixCount = 0;
        for (int i = names.size() - 1; i >= 0 && SUFFIXES.contains(names.get(i)); i--) {
            suffixCount++;
        }

        // Surname and suffixes stay as written
        int abbreviable = Math.max(0, names.size() - 1 - suffixCount);
        for (int j = 0; j < abbreviable; j++) {
            String name = names.get(j);
            if (j == 0 && PREFIXES.contains(name)) {
                continue;
            }
            if (j > 0 && PREPOSITIONS.contains(name)) {
                continue;
            }
            if (name.length() > 2 || (!name.isEmpty() && !name.endsWith("."))) {
                names.set(j, abbreviateWord(name));
            }
        }
        return names;
    }

    private static String abbreviateWord(String name) {
        int dash = name.indexOf('-');
        if (dash >= 0 && dash + 1 < name.length()) {
            return name.charAt(0) + ".-" + name.charAt(dash + 1) + ".";
        }
        return name.charAt(0) + ".";
    }

    private static List<String> simplifiedVariants(List<String> names) {
        if (names.size() == 1) {
            return List.of(simplifyName(names.get(0)));
        }

        String lastName = names.get(names.size() - 1);
        List<String> variants = new ArrayList<>();
        for (String givenPart : names.get(0).split("-", -1)) {
            variants.add(simplifyName(givenPart + " " + lastName));
        }
        return variants;
    }

    private static boolean isUppercaseAscii(String word) {
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (c < 'A' || c > 'Z') {
                return false;
            }
        }
        return true;
    }

    /**
     * Canonical author views of one authors field.
     *
     * @param authorsList       display names in input order, e.g. "C. F. Gauss"
     * @param authorsListSimple folded names for lookup; one per hyphen part of the first given name
     * @param authorsBibtex     display names joined by " and ", or null for an escaped literal
     * @param displayString     authors field rewritten for display; the trimmed braced field for an escaped literal
     * @param escaped           whether the field was a brace-wrapped literal
     */
    public record NormalizedAuthors(List<String> authorsList,
                                    List<String> authorsListSimple,
                                    String authorsBibtex,
                                    String displayString,
                                    boolean escaped) {

        public boolean isEmpty() {
            return authorsList.isEmpty();
        }

        /** Surname of the first author, or null when there are no authors. */
        public String firstAuthorSurname() {
            return isEmpty() ? null : surnameOf(authorsList.get(0));
        }
    }
}
