package de.ovgu.commitminer.util;

import org.apache.log4j.Logger;

import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff.  Whether a failure is worth another attempt is decided by a classification
 * predicate; a hook can repair state (e.g. remove a stale lock file) before the next attempt.
 */
public class RetryPolicy {
    private static final Logger LOG = Logger.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final long initialDelayMillis;
    private final double backoffMultiplier;

    public RetryPolicy(int maxAttempts, long initialDelayMillis, double backoffMultiplier) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Number of attempts must be at least 1, got " + maxAttempts);
        }
        if (initialDelayMillis < 0) {
            throw new IllegalArgumentException("Delay must not be negative, got " + initialDelayMillis);
        }
        this.maxAttempts = maxAttempts;
        this.initialDelayMillis = initialDelayMillis;
        this.backoffMultiplier = Math.max(backoffMultiplier, 1.0);
    }

    /**
     * A policy that tries exactly once.
     */
    public static RetryPolicy noRetries() {
        return new RetryPolicy(1, 0, 1.0);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public <T> T call(String description, Supplier<T> action, Predicate<RuntimeException> isRetryable) {
        return call(description, action, isRetryable, e -> {
        });
    }

    /**
     * Run the action until it succeeds, fails with a non-retryable exception, or the attempts are used up.  In the
     * latter two cases, the last exception is rethrown.
     *
     * @param description For log messages
     * @param action      The operation to attempt
     * @param isRetryable Decides whether a failure may be retried
     * @param beforeRetry Called with the failure before each further attempt
     */
    public <T> T call(String description, Supplier<T> action, Predicate<RuntimeException> isRetryable,
                      Consumer<RuntimeException> beforeRetry) {
        long delay = initialDelayMillis;
        for (int attempt = 1; ; attempt++) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                if (attempt >= maxAttempts || !isRetryable.test(e)) {
                    throw e;
                }
                LOG.warn("Attempt " + attempt + "/" + maxAttempts + " of " + description + " failed: " + e.getMessage()
                        + ". Retrying in " + delay + " ms.");
                beforeRetry.accept(e);
                if (!sleep(delay)) {
                    throw e;
                }
                delay = Math.round(delay * backoffMultiplier);
            }
        }
    }

    public void run(String description, Runnable action, Predicate<RuntimeException> isRetryable,
                    Consumer<RuntimeException> beforeRetry) {
        call(description, () -> {
            action.run();
            return null;
        }, isRetryable, beforeRetry);
    }

    private static boolean sleep(long millis) {
        if (millis <= 0) return true;
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
