package net.bibrecords.support.citation;

import net.bibrecords.model.Publication;
import org.junit.jupiter.api.Test;

import static net.bibrecords.testutil.PublicationTestData.aPublication;
import static org.assertj.core.api.Assertions.assertThat;

class HarvardCitationStyleTest {

    private final HarvardCitationStyle style = new HarvardCitationStyle();

    @Test
    void format_shouldRenderJournalArticle() {
        Publication publication = aPublication()
            .title("Deep residual learning")
            .authors("Alice Smith, Bob Jones, Carol Lee")
            .year(2016)
            .journal("Vision Letters")
            .volume(12)
            .number(4)
            .pages("77-89")
            .buildProcessed();

        assertThat(style.format(publication))
            .isEqualTo("A. Smith, B. Jones, and C. Lee (2016). Deep residual learning. Vision Letters, 12(4), 77-89.");
    }

    @Test
    void format_shouldNotDoublePunctuation_When_TitleEndsWithQuestionMark() {
        Publication publication = aPublication()
            .title("Is P equal to NP?")
            .authors("Alice Smith")
            .year(null)
            .buildProcessed();

        assertThat(style.format(publication)).isEqualTo("A. Smith (n.d.). Is P equal to NP?");
    }

    @Test
    void format_shouldUseBookTitle_When_JournalMissing() {
        Publication publication = aPublication()
            .title("A chapter")
            .authors("Alice Smith and Bob Jones")
            .year(2001)
            .bookTitle("Collected Works")
            .buildProcessed();

        assertThat(style.format(publication)).isEqualTo("A. Smith and B. Jones (2001). A chapter. Collected Works.");
    }

    @Test
    void format_shouldFollowCurrentTitle_When_TitleEditedAfterProcessing() {
        Publication publication = aPublication()
            .title("A study")
            .authors("Alice Smith")
            .year(2020)
            .buildProcessed();

        publication.setTitle("Why?");

        assertThat(style.format(publication)).isEqualTo("A. Smith (2020). Why?");

        publication.setTitle("Why not");

        assertThat(style.format(publication)).isEqualTo("A. Smith (2020). Why not.");
    }
}
