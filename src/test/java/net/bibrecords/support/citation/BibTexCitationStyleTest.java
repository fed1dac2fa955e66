package net.bibrecords.support.citation;

import net.bibrecords.model.Publication;
import org.junit.jupiter.api.Test;

import static net.bibrecords.testutil.PublicationTestData.aPublication;
import static org.assertj.core.api.Assertions.assertThat;

class BibTexCitationStyleTest {

    private final BibTexCitationStyle style = new BibTexCitationStyle();

    @Test
    void format_shouldEmitNonEmptyFieldsInFixedOrder() {
        Publication publication = aPublication()
            .citekey("Gauss1809a")
            .title("Theoria motus")
            .authors("Gauss CF and Alice Smith")
            .year(1809)
            .month(6)
            .journal("Perthes")
            .volume(3)
            .pages("1--20")
            .buildProcessed();

        assertThat(style.format(publication)).isEqualTo("""
            @article{Gauss1809a,
              author = {C. F. Gauss and A. Smith},
              title = {Theoria motus},
              journal = {Perthes},
              year = {1809},
              month = {Jun},
              volume = {3},
              pages = {1--20},
            }
            """);
    }

    @Test
    void format_shouldKeepBracesAroundEscapedAuthors() {
        Publication publication = aPublication()
            .type("techreport")
            .citekey("Group2021a")
            .title("Annual Report")
            .authors("{Special Group}")
            .year(2021)
            .buildProcessed();

        assertThat(style.format(publication)).contains("@techreport{Group2021a,\n")
            .contains("  author = {{Special Group}},\n");
    }

    @Test
    void format_shouldFallBackToArticle_When_TypeBlank() {
        Publication publication = aPublication().type(" ").citekey("Smith2020a").buildProcessed();

        assertThat(style.format(publication)).startsWith("@article{Smith2020a,\n").endsWith("}\n");
    }
}
