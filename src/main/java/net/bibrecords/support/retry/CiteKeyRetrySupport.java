package net.bibrecords.support.retry;

import java.util.function.Supplier;
import org.slf4j.Logger;

/**
 * Repeats a citation key assignment after it lost a race against another writer.
 *
 * <p>The assignment is expected to rescan the stored siblings on every run, so a repeat picks up the
 * winner's record and settles on the next free letter. Attempt {@code n} is delayed by
 * {@code n * backoffStepMillis}.
 */
public final class CiteKeyRetrySupport {

    /**
     * @param logger            receives one warning per repeated attempt
     * @param maxAttempts       total runs including the first, at least 1
     * @param backoffStepMillis delay added per failed attempt; values below 1 count as 1
     */
    public record RetryConfig(Logger logger, int maxAttempts, long backoffStepMillis) {
    }

    private CiteKeyRetrySupport() {
    }

    /**
     * Runs {@code assignment} until it stores without a {@link CiteKeyConflictException}.
     *
     * @return the assignment's result from the first run without a conflict
     * @throws CiteKeyConflictException the conflict of the final run when every attempt collided
     */
    public static <T> T execute(RetryConfig config, String operationLabel, Supplier<T> assignment) {
        if (config.maxAttempts() < 1) {
            throw new IllegalArgumentException(
                "maxAttempts must be at least 1 for '" + operationLabel + "' but was " + config.maxAttempts());
        }

        int attempt = 1;
        while (true) {
            try {
                return assignment.get();
            } catch (CiteKeyConflictException conflict) {
                if (attempt >= config.maxAttempts()) {
                    throw conflict;
                }
                long delay = Math.max(1L, config.backoffStepMillis()) * attempt;
                config.logger().warn("{} collided on citation key '{}', rescanning in {}ms (attempt {} of {})",
                    operationLabel, conflict.getCitekey(), delay, attempt, config.maxAttempts());
                pause(delay);
                attempt++;
            }
        }
    }

    private static void pause(long delayMillis) {
        try {
            Thread.sleep(delayMillis);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted before repeating citation key assignment", interrupted);
        }
    }
}
