package net.bibrecords.service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import net.bibrecords.config.BibRecordsProperties;
import net.bibrecords.exception.InvalidRecordStateException;
import net.bibrecords.model.Publication;
import net.bibrecords.repository.PublicationRepository;
import net.bibrecords.support.retry.CiteKeyConflictException;
import net.bibrecords.support.retry.CiteKeyRetrySupport;
import net.bibrecords.util.PublicationPostProcessor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Central write path for publications.
 *
 * <p>Before a record is stored it is post-processed, its text fields are trimmed, and it gets a
 * citation key when none was supplied. Key assignment scans the stored siblings and then inserts,
 * so it runs under an in-process lock per surname and year that is held until the transaction
 * commits. Writers in other processes are caught by the unique constraint on {@code citekey}; such
 * a conflict rolls the attempt back and the scan is repeated with bounded backoff.
 */
@Service
@Slf4j
public class PublicationService {

    private static final int CITEKEY_LOCK_STRIPES = 64;

    private final PublicationRepository publicationRepository;
    private final CiteKeyService citeKeyService;
    private final TransactionTemplate transactionTemplate;
    private final CiteKeyRetrySupport.RetryConfig retryConfig;
    private final ReentrantLock[] citekeyLocks = new ReentrantLock[CITEKEY_LOCK_STRIPES];

    public PublicationService(PublicationRepository publicationRepository,
                              CiteKeyService citeKeyService,
                              PlatformTransactionManager transactionManager,
                              BibRecordsProperties properties) {
        this.publicationRepository = publicationRepository;
        this.citeKeyService = citeKeyService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.retryConfig = new CiteKeyRetrySupport.RetryConfig(
            log,
            properties.getCitekeyMaxAttempts(),
            properties.getCitekeyBaseBackoffMillis()
        );
        for (int i = 0; i < CITEKEY_LOCK_STRIPES; i++) {
            citekeyLocks[i] = new ReentrantLock();
        }
    }

    /**
     * Finalizes and stores a new publication.
     *
     * @param publication record built from raw field values; its id must be unset
     * @return id and citation key of the stored record
     * @throws InvalidRecordStateException when title or authors are missing
     * @throws CiteKeyConflictException    when a supplied key is taken, or generated keys kept colliding
     */
    public SaveResult create(Publication publication) {
        if (publication == null) {
            throw new IllegalArgumentException("Publication cannot be null");
        }
        if (publication.getId() != null) {
            throw new IllegalArgumentException("New publication must not have an id but had " + publication.getId());
        }
        finalizeRecord(publication);

        Long id;
        if (hasCitekey(publication)) {
            id = transactionTemplate.execute(status -> insertTranslatingConflict(publication));
        } else {
            id = assignCitekeyAndStore(publication, "create publication",
                () -> insertTranslatingConflict(publication));
        }
        publication.setId(id);

        log.info("Created publication: id={}, citekey='{}', title='{}'", id, publication.getCitekey(), publication.shortTitle());
        return SaveResult.builder()
            .id(id)
            .citekey(publication.getCitekey())
            .isNew(true)
            .build();
    }

    /**
     * Finalizes and overwrites a stored publication. A blank citation key is regenerated, with the
     * record's own position among its siblings taken into account.
     *
     * @throws IllegalArgumentException when no publication with the record's id exists
     */
    public SaveResult update(Publication publication) {
        if (publication == null || publication.getId() == null) {
            throw new IllegalArgumentException("Publication to update must have an id");
        }
        finalizeRecord(publication);

        Boolean found;
        if (hasCitekey(publication)) {
            found = transactionTemplate.execute(status -> updateTranslatingConflict(publication));
        } else {
            found = assignCitekeyAndStore(publication, "update publication",
                () -> updateTranslatingConflict(publication));
        }
        if (!Boolean.TRUE.equals(found)) {
            throw new IllegalArgumentException("No publication with id " + publication.getId());
        }

        log.info("Updated publication: id={}, citekey='{}'", publication.getId(), publication.getCitekey());
        return SaveResult.builder()
            .id(publication.getId())
            .citekey(publication.getCitekey())
            .isNew(false)
            .build();
    }

    public Optional<Publication> findById(long id) {
        return publicationRepository.findById(id);
    }

    public Optional<Publication> findByCitekey(String citekey) {
        return publicationRepository.findByCitekey(citekey);
    }

    /** Lists publications newest first. */
    public List<Publication> listPublications() {
        return publicationRepository.findAllInDisplayOrder();
    }

    /**
     * Trims the free-text fields, post-processes the record and checks the fields the write path relies on.
     */
    void finalizeRecord(Publication publication) {
        publication.setTitle(trim(publication.getTitle()));
        publication.setJournal(trim(publication.getJournal()));
        publication.setBookTitle(trim(publication.getBookTitle()));
        publication.setPublisher(trim(publication.getPublisher()));
        publication.setInstitution(trim(publication.getInstitution()));
        PublicationPostProcessor.postProcess(publication);

        if (publication.getTitle().isEmpty()) {
            throw new InvalidRecordStateException("Publication title is required");
        }
        if (publication.getAuthorsList().isEmpty()) {
            throw new InvalidRecordStateException(
                "Publication '" + publication.shortTitle() + "' needs at least one author");
        }
    }

    private <T> T assignCitekeyAndStore(Publication publication, String operationLabel, Supplier<T> store) {
        String surname = publication.firstAuthorSurname();
        ReentrantLock lock = citekeyLockFor(surname, publication.getYear());

        try {
            return CiteKeyRetrySupport.execute(retryConfig, operationLabel, () -> {
                lock.lock();
                try {
                    return transactionTemplate.execute(status -> {
                        publication.setCitekey(citeKeyService.generateFor(publication));
                        return store.get();
                    });
                } finally {
                    lock.unlock();
                }
            });
        } catch (RuntimeException exception) {
            publication.setCitekey(null);
            throw exception;
        }
    }

    private long insertTranslatingConflict(Publication publication) {
        try {
            return publicationRepository.insert(publication);
        } catch (DuplicateKeyException exception) {
            throw new CiteKeyConflictException(publication.getCitekey(), exception);
        }
    }

    private boolean updateTranslatingConflict(Publication publication) {
        try {
            return publicationRepository.update(publication);
        } catch (DuplicateKeyException exception) {
            throw new CiteKeyConflictException(publication.getCitekey(), exception);
        }
    }

    // Same surname and year always map to the same stripe
    ReentrantLock citekeyLockFor(String surname, Integer year) {
        String key = surname + ":" + year;
        return citekeyLocks[Math.floorMod(key.hashCode(), CITEKEY_LOCK_STRIPES)];
    }

    private static boolean hasCitekey(Publication publication) {
        return publication.getCitekey() != null && !publication.getCitekey().isBlank();
    }

    private static String trim(String value) {
        return value != null ? value.trim() : "";
    }

    @Value
    @Builder
    public static class SaveResult {
        long id;
        String citekey;
        boolean isNew;
    }
}
