package io.github.drompincen.opsledger.runtime.retry;

/**
 * Capped exponential backoff: {@code initialMs * factor^(attempt - 1)}, never above {@code maxMs}.
 *
 * @param initialMs delay before the first retry
 * @param maxMs     upper bound for any delay
 * @param factor    growth per attempt
 */
public record RetryBackoff(long initialMs, long maxMs, double factor) {

    public RetryBackoff {
        if (initialMs < 0 || maxMs < 0) throw new IllegalArgumentException("backoff delays must not be negative");
        if (factor < 1.0) throw new IllegalArgumentException("backoff factor must be >= 1");
    }

    public static RetryBackoff doubling(long initialMs, long maxMs) {
        return new RetryBackoff(initialMs, maxMs, 2.0);
    }

    /**
     * @param attempt 1-based number of the retry being scheduled
     */
    public long delayMs(int attempt) {
        double base = initialMs * Math.pow(factor, Math.max(attempt - 1, 0));
        return Math.min(maxMs, Math.round(base));
    }
}
