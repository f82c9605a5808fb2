package com.chambua.standings.queue;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Bounded exponential backoff: {@code min(base * 2^(n-1), max) * (1 + jitterRatio * jitter)} where the
 * jitter source yields values in {@code [0, 1)}.
 */
public final class RetryPolicy {

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitterRatio;
    private final DoubleSupplier jitter;

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double jitterRatio, DoubleSupplier jitter) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (jitterRatio < 0) throw new IllegalArgumentException("jitterRatio must be >= 0");
        this.maxAttempts = maxAttempts;
        this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
        this.jitterRatio = jitterRatio;
        this.jitter = Objects.requireNonNull(jitter, "jitter");
    }

    public static RetryPolicy withRandomJitter(int maxAttempts, Duration baseDelay, Duration maxDelay, double jitterRatio) {
        return new RetryPolicy(maxAttempts, baseDelay, maxDelay, jitterRatio, () -> ThreadLocalRandom.current().nextDouble());
    }

    public static RetryPolicy withoutJitter(int maxAttempts, Duration baseDelay, Duration maxDelay) {
        return new RetryPolicy(maxAttempts, baseDelay, maxDelay, 0.0, () -> 0.0);
    }

    /** True when a job that has failed {@code attemptsSoFar} times may run again. */
    public boolean shouldRetry(int attemptsSoFar) {
        return attemptsSoFar < maxAttempts;
    }

    /**
     * Delay before the next run of a job that has failed {@code attempt} times (1-based).
     */
    public Duration delayFor(int attempt) {
        int n = Math.max(1, attempt);
        long base = baseDelay.toMillis();
        long cap = maxDelay.toMillis();
        int shift = n - 1;
        long exp = (shift >= 62 || base > (Long.MAX_VALUE >> shift)) ? Long.MAX_VALUE : base << shift;
        long capped = Math.min(exp, cap);
        double factor = 1.0 + jitterRatio * clamp(jitter.getAsDouble());
        return Duration.ofMillis(Math.round(capped * factor));
    }

    private static double clamp(double v) {
        if (v < 0) return 0;
        return Math.min(v, 1.0);
    }

    public int getMaxAttempts() { return maxAttempts; }
    public Duration getBaseDelay() { return baseDelay; }
    public Duration getMaxDelay() { return maxDelay; }
    public double getJitterRatio() { return jitterRatio; }
}
