package net.bibrecords.util;

import java.util.List;
import java.util.Objects;
import net.bibrecords.exception.InvalidRecordStateException;
import net.bibrecords.exception.KeyGenerationExhaustedException;

/**
 * Derives BibTeX citation keys of the form {@code <Surname><Year><letter>}.
 *
 * <p>The letter disambiguates publications of the same year whose first authors share a surname.
 * It counts the siblings that precede the record in (month ascending, id ascending) order, so the
 * caller must supply siblings in exactly that order. Display listings use the reverse order
 * (year, month and id descending); the two orders are kept apart because changing the key order
 * would change keys that were already handed out.
 *
 * <p><strong>Example:</strong>
 * <pre>
 * Smith, January 2020          -> Smith2020a
 * Smith, March 2020 (id 7)     -> Smith2020b
 * Smith, March 2020 (id 9)     -> Smith2020c
 * </pre>
 *
 * @see AuthorNameNormalizer#surnameOf(String)
 */
public final class CiteKeyGenerator {

    private static final char FIRST_LETTER = 'a';
    private static final char LAST_LETTER = 'z';

    private CiteKeyGenerator() {
        // Utility class - no instantiation
    }

    /**
     * Generates the citation key for a record.
     *
     * @param surname         first-author surname of the record
     * @param year            publication year, rendered empty when absent
     * @param orderedSiblings same-year candidates in key order; may contain the record itself
     * @param selfId          persisted id of the record, or null when it has not been stored yet
     * @return citation key such as {@code Gauss1809a}
     * @throws InvalidRecordStateException     when the surname is null or empty
     * @throws KeyGenerationExhaustedException when more than 26 earlier siblings share the surname
     */
    public static String generate(String surname, Integer year, List<Candidate> orderedSiblings, Long selfId) {
        if (surname == null || surname.isEmpty()) {
            throw new InvalidRecordStateException("Cannot generate a citation key without a first-author surname");
        }

        char letter = FIRST_LETTER;
        if (orderedSiblings != null) {
            for (Candidate sibling : orderedSiblings) {
                // Self is matched by persisted id only; unsaved records scan every sibling
                if (selfId != null && Objects.equals(selfId, sibling.id())) {
                    break;
                }
                if (surname.equals(sibling.firstAuthorSurname())) {
                    if (letter == LAST_LETTER) {
                        throw new KeyGenerationExhaustedException(surname, year);
                    }
                    letter++;
                }
            }
        }

        return surname + (year != null ? year.toString() : "") + letter;
    }

    /**
     * A stored publication competing for the same key prefix.
     *
     * @param id                 persisted id (insertion order)
     * @param firstAuthorSurname surname of its normalized first author, null when it has no authors
     */
    public record Candidate(Long id, String firstAuthorSurname) {
    }
}
