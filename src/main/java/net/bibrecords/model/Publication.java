/**
 * Publication record as stored in the {@code publications} table
 *
 * Features:
 * - Holds the bibliographic fields entered by users (title, authors, venue, identifiers)
 * - Carries the author views derived from the raw authors field on every construction and load
 * - Exposes the presentation helpers used by citation styles and COinS export
 */
package net.bibrecords.model;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import net.bibrecords.util.AuthorNameNormalizer.NormalizedAuthors;
import net.bibrecords.util.PublicationTextUtils;

@Getter
@Setter
public class Publication {

    private static final String[] MONTH_ABBREVIATIONS = {
        "Jan", "Feb", "Mar", "Apr", "May", "Jun", "Jul", "Aug", "Sep", "Oct", "Nov", "Dec"
    };
    private static final String[] MONTH_NAMES = {
        "January", "February", "March", "April", "May", "June",
        "July", "August", "September", "October", "November", "December"
    };

    public static final String DEFAULT_TYPE = "article";

    private Long id;
    private String type = DEFAULT_TYPE;
    private String citekey;
    private String title = "";
    private String authors = "";
    private Integer year;
    private Integer month;
    private String journal = "";
    private String bookTitle = "";
    private String publisher = "";
    private String institution = "";
    private Integer volume;
    private Integer number;
    private String edition = "";
    private String location = "";
    private String series = "";
    private String pages = "";
    private String note = "";
    private String keywords = "";
    private String url = "";
    private LocalDate urldate;
    private String code = "";
    private String doi = "";
    private boolean external;
    private String abstractText = "";
    private String isbn = "";
    private String issn = "";

    // Derived on construction and load, never persisted
    @Setter(AccessLevel.NONE)
    private transient NormalizedAuthors normalizedAuthors;

    /**
     * Attaches the author views derived from {@link #getAuthors()} and rewrites the authors field
     * into its display form.
     */
    public void applyNormalizedAuthors(NormalizedAuthors normalized) {
        this.normalizedAuthors = normalized;
        this.authors = normalized.displayString();
    }

    /** Whether the current title already ends with a sentence mark. */
    public boolean isTitleEndsWithPunctuation() {
        return PublicationTextUtils.endsWithPunctuation(title);
    }

    public List<String> getAuthorsList() {
        return normalizedAuthors != null ? normalizedAuthors.authorsList() : List.of();
    }

    public List<String> getAuthorsListSimple() {
        return normalizedAuthors != null ? normalizedAuthors.authorsListSimple() : List.of();
    }

    /** Authors joined by "and"; null for brace-escaped authors. */
    public String getAuthorsBibtex() {
        return normalizedAuthors != null ? normalizedAuthors.authorsBibtex() : null;
    }

    public boolean isAuthorsEscaped() {
        return normalizedAuthors != null && normalizedAuthors.escaped();
    }

    public String firstAuthor() {
        List<String> authorsList = getAuthorsList();
        return authorsList.isEmpty() ? null : authorsList.get(0);
    }

    /** Surname of the first author as used in citation keys. */
    public String firstAuthorSurname() {
        return normalizedAuthors != null ? normalizedAuthors.firstAuthorSurname() : null;
    }

    public String monthBibtex() {
        return isValidMonth() ? MONTH_ABBREVIATIONS[month - 1] : "";
    }

    public String monthLong() {
        return isValidMonth() ? MONTH_NAMES[month - 1] : "";
    }

    public String journalOrBookTitle() {
        return journal != null && !journal.isEmpty() ? journal : bookTitle;
    }

    public String shortTitle() {
        return PublicationTextUtils.shortTitle(title);
    }

    /**
     * Pairs each author with a lookup token ("C. F. Gauss" -> "c.+f.+gauss").
     */
    public List<EscapedValue> authorsEscaped() {
        List<EscapedValue> escaped = new ArrayList<>();
        for (String author : getAuthorsList()) {
            escaped.add(new EscapedValue(author, author.toLowerCase(Locale.ROOT).replace(' ', '+')));
        }
        return escaped;
    }

    /**
     * Pairs each keyword with its URL-encoded form.
     */
    public List<EscapedValue> keywordsEscaped() {
        List<EscapedValue> escaped = new ArrayList<>();
        for (String keyword : (keywords != null ? keywords : "").split(",", -1)) {
            String trimmed = keyword.trim();
            escaped.add(new EscapedValue(trimmed, URLEncoder.encode(trimmed, StandardCharsets.UTF_8)));
        }
        return escaped;
    }

    @Override
    public String toString() {
        return shortTitle();
    }

    private boolean isValidMonth() {
        return month != null && month >= 1 && month <= 12;
    }

    /**
     * A display value and its escaped counterpart for links.
     */
    public record EscapedValue(String value, String escaped) {
    }
}
