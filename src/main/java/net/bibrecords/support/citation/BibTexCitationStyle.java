package net.bibrecords.support.citation;

import java.util.LinkedHashMap;
import java.util.Map;
import net.bibrecords.model.Publication;
import org.springframework.stereotype.Component;

/**
 * Exports a publication as a BibTeX entry.
 *
 * <p><strong>Example:</strong>
 * <pre>
 * &#64;article{Gauss1809a,
 *   author = {C. F. Gauss},
 *   title = {Theoria motus},
 *   year = {1809},
 * }
 * </pre>
 *
 * Empty fields are left out. Brace-escaped authors are exported with their braces so BibTeX keeps
 * the name intact.
 */
@Component
public class BibTexCitationStyle implements CitationStyle {

    public static final String NAME = "bibtex";

    private static final String NEWLINE = "\n";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String format(Publication publication) {
        String type = publication.getType() != null && !publication.getType().isBlank()
            ? publication.getType()
            : Publication.DEFAULT_TYPE;
        String citekey = publication.getCitekey() != null ? publication.getCitekey() : "";

        StringBuilder entry = new StringBuilder();
        entry.append('@').append(type).append('{').append(citekey).append(',').append(NEWLINE);
        for (Map.Entry<String, String> field : fields(publication).entrySet()) {
            if (field.getValue() == null || field.getValue().isEmpty()) {
                continue;
            }
            entry.append("  ").append(field.getKey()).append(" = {").append(field.getValue()).append("},").append(NEWLINE);
        }
        entry.append('}').append(NEWLINE);
        return entry.toString();
    }

    private static Map<String, String> fields(Publication publication) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("author", publication.isAuthorsEscaped() ? publication.getAuthors() : publication.getAuthorsBibtex());
        fields.put("title", publication.getTitle());
        fields.put("journal", publication.getJournal());
        fields.put("booktitle", publication.getBookTitle());
        fields.put("publisher", publication.getPublisher());
        fields.put("institution", publication.getInstitution());
        fields.put("year", toText(publication.getYear()));
        fields.put("month", publication.monthBibtex());
        fields.put("volume", toText(publication.getVolume()));
        fields.put("number", toText(publication.getNumber()));
        fields.put("edition", publication.getEdition());
        fields.put("address", publication.getLocation());
        fields.put("series", publication.getSeries());
        fields.put("pages", publication.getPages());
        fields.put("note", publication.getNote());
        fields.put("keywords", publication.getKeywords());
        fields.put("url", publication.getUrl());
        fields.put("doi", publication.getDoi());
        fields.put("isbn", publication.getIsbn());
        fields.put("issn", publication.getIssn());
        return fields;
    }

    private static String toText(Integer value) {
        return value != null ? value.toString() : null;
    }
}
