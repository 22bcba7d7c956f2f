package com.qnet.core.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Jittered exponential backoff calculator for probe retries.
 * <p>
 * <b>Formula:</b> {@code t = min(max, base * 2^attempt) + uniform(0, jitterMax)}
 * </p>
 * <p>
 * Jitter keeps retries for many nodes that failed in the same cycle from
 * hitting the network at the same instant.
 * </p>
 */
public final class JitterBackoff {
    private JitterBackoff() {
    }

    /**
     * Computes the next backoff delay with jitter.
     *
     * @param attempt   Retry attempt number (0-based)
     * @param base      Base delay
     * @param max       Maximum delay (cap)
     * @param jitterMax Maximum jitter to add
     * @return Computed delay (base * 2^attempt + jitter, capped at max before jitter)
     */
    public static Duration next(int attempt, Duration base, Duration max, Duration jitterMax) {
        long baseMs = base.toMillis();
        long expMs = baseMs * (1L << Math.min(Math.max(attempt, 0), 20)); // Cap exponent to avoid overflow

        long cappedMs = Math.min(expMs, max.toMillis());

        long jitterMs = jitterMax.isZero() || jitterMax.isNegative()
            ? 0
            : ThreadLocalRandom.current().nextLong(jitterMax.toMillis() + 1);

        return Duration.ofMillis(cappedMs + jitterMs);
    }

    /**
     * Default probe retry schedule: base 200ms, cap 2s, jitter up to 100ms.
     *
     * @param attempt Retry attempt number (0-based)
     * @return Computed delay
     */
    public static Duration next(int attempt) {
        return next(
                attempt,
                Duration.ofMillis(200),
                Duration.ofSeconds(2),
                Duration.ofMillis(100)
        );
    }
}
