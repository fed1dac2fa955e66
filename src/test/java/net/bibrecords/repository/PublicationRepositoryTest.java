package net.bibrecords.repository;

import net.bibrecords.model.Publication;
import net.bibrecords.testutil.BaseRepositoryTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static net.bibrecords.testutil.PublicationTestData.aPublication;
import static net.bibrecords.testutil.PublicationTestData.article;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PublicationRepositoryTest extends BaseRepositoryTest {

    private PublicationRepository repository;

    @BeforeEach
    void setUp() {
        repository = new PublicationRepository(jdbcTemplate);
    }

    @Test
    void insert_shouldStoreAllColumnsAndPostProcessOnLoad() {
        Publication publication = aPublication()
            .citekey("Gauss1809a")
            .title("Theoria motus")
            .authors("Gauss CF")
            .year(1809)
            .month(6)
            .journal("Perthes")
            .volume(3)
            .number(2)
            .pages("1-20")
            .keywords("Orbits; Astronomy")
            .doi("10.1000/xyz")
            .build();
        publication.setUrldate(LocalDate.of(2024, 5, 17));
        publication.setExternal(true);

        long id = repository.insert(publication);

        Publication loaded = repository.findById(id).orElseThrow();
        assertThat(loaded.getId()).isEqualTo(id);
        assertThat(loaded.getCitekey()).isEqualTo("Gauss1809a");
        assertThat(loaded.getAuthors()).isEqualTo("C. F. Gauss");
        assertThat(loaded.getAuthorsList()).containsExactly("C. F. Gauss");
        assertThat(loaded.getKeywords()).isEqualTo("orbits, astronomy");
        assertThat(loaded.getYear()).isEqualTo(1809);
        assertThat(loaded.getMonth()).isEqualTo(6);
        assertThat(loaded.getVolume()).isEqualTo(3);
        assertThat(loaded.getNumber()).isEqualTo(2);
        assertThat(loaded.getUrldate()).isEqualTo(LocalDate.of(2024, 5, 17));
        assertThat(loaded.isExternal()).isTrue();
        assertThat(loaded.getDoi()).isEqualTo("10.1000/xyz");
    }

    @Test
    void insert_shouldKeepNullableNumbersNull() {
        long id = repository.insert(aPublication().citekey("Smitha").year(null).build());

        Publication loaded = repository.findById(id).orElseThrow();
        assertThat(loaded.getYear()).isNull();
        assertThat(loaded.getMonth()).isNull();
        assertThat(loaded.getVolume()).isNull();
        assertThat(loaded.getUrldate()).isNull();
    }

    @Test
    void insert_shouldThrowDuplicateKey_When_CitekeyTaken() {
        repository.insert(aPublication().citekey("Smith2020a").build());

        assertThatThrownBy(() -> repository.insert(aPublication().citekey("Smith2020a").build()))
            .isInstanceOf(DuplicateKeyException.class);
        assertThat(countRows("publications")).isEqualTo(1);
    }

    @Test
    void update_shouldOverwriteRow_When_IdExists() {
        long id = repository.insert(aPublication().citekey("Smith2020a").title("Draft").build());
        Publication publication = repository.findById(id).orElseThrow();
        publication.setTitle("Final");

        boolean updated = repository.update(publication);

        assertThat(updated).isTrue();
        assertThat(recordExists("publications", "id = ? AND title = ?", id, "Final")).isTrue();
    }

    @Test
    void update_shouldReturnFalse_When_IdUnknown() {
        Publication publication = aPublication().id(4711L).citekey("Smith2020a").build();

        assertThat(repository.update(publication)).isFalse();
    }

    @Test
    void findByCitekey_shouldReturnEmpty_When_BlankOrUnknown() {
        repository.insert(aPublication().citekey("Smith2020a").build());

        assertThat(repository.findByCitekey("Smith2020a")).isPresent();
        assertThat(repository.findByCitekey("Smith2020b")).isEmpty();
        assertThat(repository.findByCitekey(" ")).isEmpty();
        assertThat(repository.findByCitekey(null)).isEmpty();
    }

    @Test
    void findAllInDisplayOrder_shouldSortNewestFirstWithUnknownDatesFirst() {
        long old = repository.insert(withKey(article("Alice Smith", 2019, 5), "k1"));
        long newJanuary = repository.insert(withKey(article("Alice Smith", 2020, 1), "k2"));
        long newMarch = repository.insert(withKey(article("Alice Smith", 2020, 3), "k3"));
        long newMarchLater = repository.insert(withKey(article("Alice Smith", 2020, 3), "k4"));
        long noMonth = repository.insert(withKey(article("Alice Smith", 2020, null), "k5"));
        long noYear = repository.insert(withKey(article("Alice Smith", null, null), "k6"));

        List<Long> ids = repository.findAllInDisplayOrder().stream().map(Publication::getId).toList();

        assertThat(ids).containsExactly(noYear, noMonth, newMarchLater, newMarch, newJanuary, old);
    }

    @Test
    void findCiteKeyCandidates_shouldOrderByMonthThenIdWithUnknownMonthLast() {
        long noMonth = repository.insert(withKey(article("Alice Smith", 2020, null), "k1"));
        long march = repository.insert(withKey(article("Alice Smith", 2020, 3), "k2"));
        long january = repository.insert(withKey(article("Bob Jones and Alice Smith", 2020, 1), "k3"));
        long marchLater = repository.insert(withKey(article("Alice Smith", 2020, 3), "k4"));
        repository.insert(withKey(article("Alice Smith", 2021, 1), "k5"));
        repository.insert(withKey(article("Bob Jones", 2020, 1), "k6"));

        List<Long> ids = repository.findCiteKeyCandidates(2020, "Smith").stream()
            .map(Publication::getId)
            .toList();

        assertThat(ids).containsExactly(january, march, marchLater, noMonth);
    }

    @Test
    void findCiteKeyCandidates_shouldMatchCaseInsensitively() {
        long id = repository.insert(withKey(article("alice SMITH", 2020, 1), "k1"));

        Optional<Publication> match = repository.findCiteKeyCandidates(2020, "Smith").stream().findFirst();

        assertThat(match).map(Publication::getId).contains(id);
    }

    @Test
    void findCiteKeyCandidates_shouldMatchNullYear_When_YearUnknown() {
        long undated = repository.insert(withKey(article("Alice Smith", null, null), "k1"));
        repository.insert(withKey(article("Alice Smith", 2020, null), "k2"));

        List<Long> ids = repository.findCiteKeyCandidates(null, "Smith").stream().map(Publication::getId).toList();

        assertThat(ids).containsExactly(undated);
    }

    @Test
    void findCiteKeyCandidates_shouldTreatLikeWildcardsLiterally() {
        long literal = repository.insert(withKey(article("Alice O_Neil", 2020, null), "k1"));
        repository.insert(withKey(article("Alice OxNeil", 2020, null), "k2"));

        List<Long> ids = repository.findCiteKeyCandidates(2020, "O_Neil").stream().map(Publication::getId).toList();

        assertThat(ids).containsExactly(literal);
    }

    private static Publication withKey(Publication publication, String citekey) {
        publication.setCitekey(citekey);
        return publication;
    }
}
