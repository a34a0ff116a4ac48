package com.nftgateway.common.retry;

import java.time.Duration;

/**
 * Exponential backoff parameters.
 *
 * @param maxRetries total number of invocations allowed, including the first one
 * @param baseDelay  delay before the second attempt, doubled for every further attempt
 * @param maxJitter  upper bound (exclusive) of the random delay added to each wait
 */
public record RetryPolicy(int maxRetries, Duration baseDelay, Duration maxJitter) {

    public static final RetryPolicy DEFAULT =
        new RetryPolicy(3, Duration.ofMillis(1000), Duration.ofMillis(1000));

    public static final int MAX_RETRIES_LIMIT = 20;

    /** Ceiling for a single backoff wait, jitter excluded. */
    public static final Duration MAX_BACKOFF = Duration.ofHours(1);

    public RetryPolicy {
        if (maxRetries < 1 || maxRetries > MAX_RETRIES_LIMIT) {
            throw new IllegalArgumentException(
                "maxRetries must be between 1 and " + MAX_RETRIES_LIMIT + ", was " + maxRetries);
        }
        if (baseDelay.isNegative() || maxJitter.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        if (baseDelay.compareTo(MAX_BACKOFF) > 0 || maxJitter.compareTo(MAX_BACKOFF) > 0) {
            throw new IllegalArgumentException("delays must not exceed " + MAX_BACKOFF);
        }
    }

    /**
     * {@code min(baseDelay * 2^(attempt-1), MAX_BACKOFF) + jitter} for the wait that follows a
     * failed {@code attempt}.
     */
    public Duration delayFor(int attempt, long jitterMillis) {
        long base = baseDelay.toMillis();
        long cap = MAX_BACKOFF.toMillis();
        int shift = attempt - 1;
        long backoff;
        if (base == 0) {
            backoff = 0;
        } else if (shift >= Long.numberOfLeadingZeros(base) - 1) {
            backoff = cap;
        } else {
            backoff = Math.min(cap, base << shift);
        }
        return Duration.ofMillis(backoff + jitterMillis);
    }
}
