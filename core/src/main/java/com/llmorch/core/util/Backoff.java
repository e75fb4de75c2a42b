package com.llmorch.core.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded exponential back-off with optional jitter for requeueing failed reconciles.
 * <p>
 * <b>Formula:</b> {@code t = min(max, base * 2^attempt + uniform(0, jitterMax))}
 * </p>
 * <p>
 * The jitter is added before the cap, so the result never exceeds {@code max}.
 * </p>
 */
public final class Backoff {
    public static final Duration DEFAULT_BASE = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX = Duration.ofSeconds(60);

    private Backoff() {
    }

    /**
     * Computes the delay before retry number {@code attempt}.
     *
     * @param attempt   retry attempt number (0-based)
     * @param base      delay of the first retry
     * @param max       upper bound of the result
     * @param jitterMax largest random addition
     * @return the delay, within {@code [min(base, max), max]}
     */
    public static Duration next(int attempt, Duration base, Duration max, Duration jitterMax) {
        long baseMs = base.toMillis();
        // Exponent capped to stay clear of overflow
        long expMs = baseMs * (1L << Math.min(Math.max(attempt, 0), 20));
        long jitterMs = jitterMax.isZero() ? 0 : ThreadLocalRandom.current().nextLong(jitterMax.toMillis() + 1);
        return Duration.ofMillis(Math.min(max.toMillis(), expMs + jitterMs));
    }

    /**
     * Deterministic variant with base 1 s and cap 60 s.
     */
    public static Duration next(int attempt) {
        return next(attempt, DEFAULT_BASE, DEFAULT_MAX, Duration.ZERO);
    }
}
