package com.walletwatch.common;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Exponential backoff with jitter for outbound HTTP retries.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.baseDelayMs = baseDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay before retry number {@code attempt} (zero-based): baseDelay * 2^attempt, then jitter.
     */
    public long delayMs(int attempt) {
        long exponential = attempt <= 0 ? baseDelayMs : baseDelayMs * (1L << Math.min(attempt, 20));
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (exponential * jitter));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Runs the call up to {@link #getMaxAttempts()} times, sleeping between attempts. Rethrows the last failure.
     */
    public <T> T execute(Supplier<T> call) {
        return execute(call, e -> true);
    }

    /**
     * Like {@link #execute(Supplier)} but rethrows immediately when {@code retryable} rejects the failure.
     */
    public <T> T execute(Supplier<T> call, Predicate<RuntimeException> retryable) {
        RuntimeException last = null;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            if (attempt > 0) {
                sleep(delayMs(attempt - 1));
            }
            try {
                return call.get();
            } catch (RuntimeException e) {
                if (!retryable.test(e)) {
                    throw e;
                }
                last = e;
            }
        }
        throw last;
    }

    /** Single attempt, no delay. */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(0L, 0.0, 1);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(Math.max(0L, millis));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during retry backoff", e);
        }
    }
}
