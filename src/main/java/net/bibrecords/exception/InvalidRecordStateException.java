package net.bibrecords.exception;

/**
 * A publication record lacks data an operation depends on, e.g. a citation key is requested
 * for a record without authors.
 * RETRYABLE: No (the record must be corrected first)
 */
public class InvalidRecordStateException extends IllegalStateException {

    public InvalidRecordStateException(String message) {
        super(message);
    }
}
