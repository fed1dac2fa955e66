package net.bibrecords.exception;

/**
 * Every disambiguation letter from 'a' to 'z' is taken for a surname and year.
 * RETRYABLE: No (needs operator attention; keys are never wrapped or extended)
 */
public class KeyGenerationExhaustedException extends IllegalStateException {

    private final String surname;
    private final Integer year;

    public KeyGenerationExhaustedException(String surname, Integer year) {
        super("Citation key letters exhausted for surname '" + surname + "' and year " + year);
        this.surname = surname;
        this.year = year;
    }

    public String getSurname() {
        return surname;
    }

    public Integer getYear() {
        return year;
    }
}
