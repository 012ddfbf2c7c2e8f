package com.williamcallahan.skillcatalog.support;

import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retry utility for transient failures of single external lookups.
 *
 * <p>Provides exponential backoff retry for operations that may fail transiently.
 * Only retries when the supplied classifier reports the failure as transient.
 * Batch paths do not use this; they degrade to stale data instead.</p>
 */
public final class RetrySupport {

    private static final Logger log = LoggerFactory.getLogger(RetrySupport.class);

    /** Default maximum retry attempts. */
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    /** Default initial backoff duration. */
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofMillis(500);
    /** Default backoff multiplier. */
    public static final double DEFAULT_MULTIPLIER = 2.0;
    /** Maximum backoff duration to prevent excessive waits. */
    public static final Duration MAX_BACKOFF = Duration.ofSeconds(30);

    private RetrySupport() {}

    /**
     * Executes a supplier with the default attempt budget.
     *
     * @param operation the operation to execute
     * @param operationName name for logging purposes
     * @param isTransient classifies failures worth retrying
     * @param <T> return type
     * @return the result of the operation
     * @throws RuntimeException if all retries are exhausted or a non-transient error occurs
     */
    public static <T> T executeWithRetry(
            Supplier<T> operation, String operationName, Predicate<RuntimeException> isTransient) {
        return executeWithRetry(operation, operationName, isTransient, DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_BACKOFF);
    }

    /**
     * Executes a supplier with configurable retry for transient failures.
     *
     * @param operation the operation to execute
     * @param operationName name for logging purposes
     * @param isTransient classifies failures worth retrying
     * @param maxAttempts maximum number of attempts
     * @param initialBackoff initial backoff duration
     * @param <T> return type
     * @return the result of the operation
     * @throws RuntimeException if all retries are exhausted or a non-transient error occurs
     */
    public static <T> T executeWithRetry(
            Supplier<T> operation,
            String operationName,
            Predicate<RuntimeException> isTransient,
            int maxAttempts,
            Duration initialBackoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        RuntimeException lastException = null;
        Duration currentBackoff = initialBackoff;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return operation.get();
            } catch (RuntimeException exception) {
                lastException = exception;

                if (!isTransient.test(exception)) {
                    log.debug("{} failed with non-transient error on attempt {}/{}, not retrying",
                        operationName, attempt, maxAttempts);
                    throw exception;
                }

                if (attempt < maxAttempts) {
                    log.warn("{} failed with transient error on attempt {}/{}, retrying in {}ms",
                        operationName, attempt, maxAttempts, currentBackoff.toMillis());
                    sleep(currentBackoff);
                    long nextBackoffMillis = (long) (currentBackoff.toMillis() * DEFAULT_MULTIPLIER);
                    currentBackoff = Duration.ofMillis(Math.min(nextBackoffMillis, MAX_BACKOFF.toMillis()));
                } else {
                    log.error("{} failed after {} attempts, giving up", operationName, maxAttempts);
                }
            }
        }

        throw lastException;
    }

    private static void sleep(Duration backoff) {
        if (backoff.isZero() || backoff.isNegative()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Retry interrupted", interrupted);
        }
    }
}
