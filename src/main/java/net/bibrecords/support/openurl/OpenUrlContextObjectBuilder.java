package net.bibrecords.support.openurl;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import net.bibrecords.config.BibRecordsProperties;
import net.bibrecords.model.Publication;
import org.springframework.stereotype.Component;

/**
 * Builds Z39.88-2004 (OpenURL / COinS) context objects so reference managers can pick up publications
 * embedded in pages.
 *
 * <p>Publications with a book title but no journal are described in book format, all others in
 * journal format. The referrer id is derived from the configured site domain.
 */
@Component
public class OpenUrlContextObjectBuilder {

    private static final String CONTEXT_VERSION = "ctx_ver=Z39.88-2004";
    private static final String BOOK_FORMAT = "rft_val_fmt=info:ofi/fmt:kev:mtx:book";
    private static final String JOURNAL_FORMAT = "rft_val_fmt=info:ofi/fmt:kev:mtx:journal";

    private final BibRecordsProperties properties;

    public OpenUrlContextObjectBuilder(BibRecordsProperties properties) {
        this.properties = properties;
    }

    /**
     * @param publication post-processed record
     * @return the {@code &}-joined key/value pairs of the context object
     */
    public String build(Publication publication) {
        List<String> contextObject = new ArrayList<>();
        contextObject.add(CONTEXT_VERSION);

        String domain = properties.getSiteDomain();
        String referrer = "rfr_id=info:sid/" + domain + ":" + referrerLabel(domain);

        if (hasText(publication.getBookTitle()) && !hasText(publication.getJournal())) {
            contextObject.add(BOOK_FORMAT);
            contextObject.add(referrer);
            contextObject.add("rft_id=" + encode(publication.getDoi()));
            contextObject.add("rft.btitle=" + encode(publication.getTitle()));
            if (hasText(publication.getPublisher())) {
                contextObject.add("rft.pub=" + encode(publication.getPublisher()));
            }
        } else {
            contextObject.add(JOURNAL_FORMAT);
            contextObject.add(referrer);
            contextObject.add("rft_id=" + encode(publication.getDoi()));
            contextObject.add("rft.atitle=" + encode(publication.getTitle()));
            if (hasText(publication.getJournal())) {
                contextObject.add("rft.jtitle=" + encode(publication.getJournal()));
            }
            if (isSet(publication.getVolume())) {
                contextObject.add("rft.volume=" + publication.getVolume());
            }
            if (hasText(publication.getPages())) {
                contextObject.add("rft.pages=" + encode(publication.getPages()));
            }
            if (isSet(publication.getNumber())) {
                contextObject.add("rft.issue=" + publication.getNumber());
            }
        }

        String year = publication.getYear() != null ? publication.getYear().toString() : "";
        if (isSet(publication.getMonth())) {
            contextObject.add("rft.date=" + year + "-" + publication.getMonth() + "-1");
        } else {
            contextObject.add("rft.date=" + year);
        }

        for (String author : publication.getAuthorsList()) {
            contextObject.add("rft.au=" + encode(author));
        }

        if (hasText(publication.getIsbn())) {
            contextObject.add("rft.isbn=" + encode(publication.getIsbn()));
        }
        if (hasText(publication.getIssn())) {
            contextObject.add("rft.issn=" + encode(publication.getIssn()));
        }

        return String.join("&", contextObject);
    }

    /**
     * Picks the label naming the site: "www.example.org" gives "example", "example.org" gives "example".
     */
    static String referrerLabel(String domain) {
        String[] labels = domain.split("\\.", -1);
        if (labels.length > 2) {
            return labels[labels.length - 2];
        }
        if (labels.length > 1) {
            return labels[0];
        }
        return "";
    }

    private static String encode(String value) {
        return URLEncoder.encode(value != null ? value : "", StandardCharsets.UTF_8);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }

    // Zero counts as unset, like an empty field
    private static boolean isSet(Integer value) {
        return value != null && value != 0;
    }
}
