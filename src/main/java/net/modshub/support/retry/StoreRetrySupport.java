package net.modshub.support.retry;

import java.util.function.Supplier;
import org.slf4j.Logger;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

/**
 * Executes store calls with bounded retry and linear backoff on transient failures.
 *
 * <p>Only safe for idempotent calls: plain reads, upserts, and conditional writes whose
 * replay observes the first attempt's effect instead of repeating it.
 */
public final class StoreRetrySupport {

    /**
     * Bundles the retry parameters that are constant per store:
     * the logger, maximum attempts, and base backoff interval.
     */
    public record RetryConfig(Logger logger, int maxAttempts, long baseBackoffMillis) {

        public RetryConfig {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1 but was " + maxAttempts);
            }
        }

        /** Single attempt; failures surface on the first error. */
        public static RetryConfig noRetry(Logger logger) {
            return new RetryConfig(logger, 1, 0L);
        }
    }

    private StoreRetrySupport() {
    }

    /**
     * Executes the action, retrying on {@link TransientDataAccessException} and
     * {@link RecoverableDataAccessException}; every other exception propagates
     * immediately. Backoff is {@code baseBackoffMillis * attempt}.
     */
    public static <T> T execute(RetryConfig config,
                                String operationLabel,
                                Supplier<T> action) {
        int maxAttempts = config.maxAttempts();
        RuntimeException lastException = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (TransientDataAccessException | RecoverableDataAccessException exception) {
                lastException = exception;
                if (attempt < maxAttempts) {
                    long backoff = Math.max(config.baseBackoffMillis(), 1L) * attempt;
                    config.logger().warn(
                        "Transient store failure during {} (attempt {}/{}). Retrying in {}ms: {}",
                        operationLabel,
                        attempt,
                        maxAttempts,
                        backoff,
                        exception.getMessage()
                    );
                    sleepUnchecked(backoff);
                }
            }
        }
        config.logger().error("Store operation {} failed after {} attempts", operationLabel, maxAttempts);
        throw lastException;
    }

    /**
     * Void variant of {@link #execute(RetryConfig, String, Supplier)}.
     */
    public static void run(RetryConfig config, String operationLabel, Runnable action) {
        execute(config, operationLabel, () -> {
            action.run();
            return null;
        });
    }

    private static void sleepUnchecked(long durationMillis) {
        try {
            Thread.sleep(durationMillis);
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting to retry store operation", interruptedException);
        }
    }
}
