package net.bibrecords.service;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import net.bibrecords.exception.InvalidRecordStateException;
import net.bibrecords.model.Publication;
import net.bibrecords.repository.PublicationRepository;
import net.bibrecords.util.CiteKeyGenerator;
import org.springframework.stereotype.Service;

/**
 * Computes citation keys for publications against the stored siblings.
 *
 * <p>This is a read-then-decide operation. Callers that persist the result must serialize it per
 * surname and year, see {@link PublicationService}.
 */
@Service
@Slf4j
public class CiteKeyService {

    private final PublicationRepository publicationRepository;

    public CiteKeyService(PublicationRepository publicationRepository) {
        this.publicationRepository = publicationRepository;
    }

    /**
     * Generates the key the publication would get right now.
     *
     * @param publication post-processed record; its id, when present, marks its own position among the siblings
     * @return citation key such as {@code Smith2020b}
     * @throws InvalidRecordStateException when the record has no authors or its first author has no surname
     */
    public String generateFor(Publication publication) {
        String firstAuthor = publication.firstAuthor();
        if (firstAuthor == null) {
            throw new InvalidRecordStateException(
                "Publication '" + publication.shortTitle() + "' has no authors to derive a citation key from");
        }
        String surname = publication.firstAuthorSurname();
        if (surname == null || surname.isEmpty()) {
            // A trailing empty word, e.g. from "Gauss  CF", leaves nothing after the last space
            throw new InvalidRecordStateException(
                "First author '" + firstAuthor + "' of publication '" + publication.shortTitle()
                    + "' has no surname to derive a citation key from");
        }

        List<CiteKeyGenerator.Candidate> candidates = publicationRepository
            .findCiteKeyCandidates(publication.getYear(), surname)
            .stream()
            .map(sibling -> new CiteKeyGenerator.Candidate(sibling.getId(), sibling.firstAuthorSurname()))
            .toList();

        String citekey = CiteKeyGenerator.generate(surname, publication.getYear(), candidates, publication.getId());
        log.debug("Generated citation key '{}' for publication id={} from {} candidate(s)",
            citekey, publication.getId(), candidates.size());
        return citekey;
    }
}
