package net.bibrecords.service;

import java.util.Set;
import net.bibrecords.exception.UnknownCitationStyleException;
import net.bibrecords.model.Publication;
import net.bibrecords.support.citation.CitationStyle;
import net.bibrecords.support.citation.CitationStyleRegistry;
import org.springframework.stereotype.Service;

/**
 * Formats publications in any registered citation style.
 *
 * <p>The style is resolved on every call, so styles registered after a publication was loaded are
 * available to it as well.
 */
@Service
public class PublicationFormatter {

    private final CitationStyleRegistry citationStyleRegistry;

    public PublicationFormatter(CitationStyleRegistry citationStyleRegistry) {
        this.citationStyleRegistry = citationStyleRegistry;
    }

    /**
     * @throws UnknownCitationStyleException when no style is registered under {@code styleName}
     */
    public String format(Publication publication, String styleName) {
        if (publication == null) {
            throw new IllegalArgumentException("Publication cannot be null");
        }
        CitationStyle style = citationStyleRegistry.find(styleName)
            .orElseThrow(() -> new UnknownCitationStyleException(styleName));
        return style.format(publication);
    }

    public Set<String> availableStyles() {
        return citationStyleRegistry.names();
    }
}
