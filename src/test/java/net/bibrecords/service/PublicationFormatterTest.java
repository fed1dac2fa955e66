package net.bibrecords.service;

import net.bibrecords.exception.UnknownCitationStyleException;
import net.bibrecords.model.Publication;
import net.bibrecords.support.citation.BibTexCitationStyle;
import net.bibrecords.support.citation.CitationStyle;
import net.bibrecords.support.citation.CitationStyleRegistry;
import net.bibrecords.support.citation.HarvardCitationStyle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static net.bibrecords.testutil.PublicationTestData.aPublication;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PublicationFormatterTest {

    private CitationStyleRegistry registry;
    private PublicationFormatter formatter;

    @BeforeEach
    void setUp() {
        registry = new CitationStyleRegistry(List.of(new BibTexCitationStyle(), new HarvardCitationStyle()));
        formatter = new PublicationFormatter(registry);
    }

    @Test
    void format_shouldDelegateToNamedStyle() {
        Publication publication = aPublication().authors("Alice Smith").title("Notes").year(2020).buildProcessed();

        assertThat(formatter.format(publication, "harvard")).isEqualTo("A. Smith (2020). Notes.");
        assertThat(formatter.format(publication, "BIBTEX")).startsWith("@article{");
    }

    @Test
    void format_shouldSeeStylesRegisteredAfterLoading() {
        Publication publication = aPublication().authors("Alice Smith").buildProcessed();
        registry.register(new CitationStyle() {
            @Override
            public String name() {
                return "surname";
            }

            @Override
            public String format(Publication p) {
                return p.firstAuthorSurname();
            }
        });

        assertThat(formatter.format(publication, "surname")).isEqualTo("Smith");
        assertThat(formatter.availableStyles()).containsExactly("bibtex", "harvard", "surname");
    }

    @Test
    void format_shouldThrow_When_StyleUnknown() {
        Publication publication = aPublication().buildProcessed();

        assertThatThrownBy(() -> formatter.format(publication, "chicago"))
            .isInstanceOf(UnknownCitationStyleException.class)
            .hasMessageContaining("chicago");
    }
}
