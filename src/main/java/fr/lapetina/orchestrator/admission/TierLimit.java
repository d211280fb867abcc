package fr.lapetina.orchestrator.admission;

import java.util.Objects;

/**
 * Limit applied to one tier under one rule.
 *
 * @param windowMs    length of the window
 * @param maxRequests requests allowed per window
 * @param burst       token bucket capacity, or {@code null} to use {@code maxRequests}
 * @param algorithm   how the limit is enforced
 */
public record TierLimit(
        long windowMs,
        int maxRequests,
        Integer burst,
        RateLimitAlgorithm algorithm
) {
    public TierLimit {
        if (windowMs <= 0) {
            throw new IllegalArgumentException("Window must be positive: " + windowMs);
        }
        if (maxRequests < 0) {
            throw new IllegalArgumentException("maxRequests must not be negative: " + maxRequests);
        }
        Objects.requireNonNull(algorithm, "Algorithm is required");
    }

    public static TierLimit of(long windowMs, int maxRequests, RateLimitAlgorithm algorithm) {
        return new TierLimit(windowMs, maxRequests, null, algorithm);
    }

    public static TierLimit slidingWindow(long windowMs, int maxRequests) {
        return of(windowMs, maxRequests, RateLimitAlgorithm.SLIDING_WINDOW);
    }
}
