package net.bibrecords.util;

import net.bibrecords.model.Publication;

/**
 * Derives the normalized views of a publication from its raw fields.
 *
 * <p>Runs whenever a record is constructed from user input and whenever it is loaded from storage,
 * so the derived author lists are never persisted on their own. Applying it to an already processed
 * record leaves keywords and abbreviated authors unchanged.
 */
public final class PublicationPostProcessor {

    private PublicationPostProcessor() {
        // Utility class - no instantiation
    }

    /**
     * Normalizes keywords and authors in place.
     *
     * @param publication record whose raw fields have been populated
     * @return the same record, for chaining
     */
    public static Publication postProcess(Publication publication) {
        if (publication == null) {
            throw new IllegalArgumentException("Publication cannot be null");
        }

        publication.setKeywords(KeywordNormalizer.normalize(publication.getKeywords()));
        String authors = publication.getAuthors() != null ? publication.getAuthors() : "";
        publication.applyNormalizedAuthors(AuthorNameNormalizer.normalize(authors));
        return publication;
    }
}
