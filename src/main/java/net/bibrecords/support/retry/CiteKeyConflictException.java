package net.bibrecords.support.retry;

/**
 * Signals that a generated citation key collided with a stored one so callers can apply bounded retry.
 */
public class CiteKeyConflictException extends IllegalStateException {

    private static final String DEFAULT_MESSAGE = "Citation key already taken";

    private final String citekey;

    public CiteKeyConflictException(String citekey, Throwable cause) {
        super(DEFAULT_MESSAGE + " (citekey=" + citekey + ")", cause);
        this.citekey = citekey;
    }

    public String getCitekey() {
        return citekey;
    }
}
