package net.bibrecords.support.citation;

import net.bibrecords.model.Publication;

/**
 * Renders a publication in one citation format.
 */
public interface CitationStyle {

    /** Name the style is registered and looked up under, case-insensitive. */
    String name();

    /**
     * @param publication post-processed record
     * @return the formatted citation
     */
    String format(Publication publication);
}
