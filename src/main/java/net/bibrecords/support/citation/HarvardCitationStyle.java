package net.bibrecords.support.citation;

import net.bibrecords.model.Publication;
import net.bibrecords.util.AuthorNameNormalizer;
import org.springframework.stereotype.Component;

/**
 * Author-date reference: {@code Authors (Year). Title. Venue, volume(number), pages.}
 */
@Component
public class HarvardCitationStyle implements CitationStyle {

    public static final String NAME = "harvard";

    private static final String NO_DATE = "n.d.";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String format(Publication publication) {
        StringBuilder citation = new StringBuilder();
        citation.append(AuthorNameNormalizer.joinForDisplay(publication.getAuthorsList()));
        citation.append(" (").append(publication.getYear() != null ? publication.getYear() : NO_DATE).append("). ");

        citation.append(publication.getTitle());
        if (!publication.isTitleEndsWithPunctuation()) {
            citation.append('.');
        }

        String venue = publication.journalOrBookTitle();
        if (venue != null && !venue.isEmpty()) {
            citation.append(' ').append(venue);
            if (publication.getVolume() != null) {
                citation.append(", ").append(publication.getVolume());
                if (publication.getNumber() != null) {
                    citation.append('(').append(publication.getNumber()).append(')');
                }
            }
            if (publication.getPages() != null && !publication.getPages().isEmpty()) {
                citation.append(", ").append(publication.getPages());
            }
            citation.append('.');
        }
        return citation.toString();
    }
}
