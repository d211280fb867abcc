package fr.lapetina.orchestrator.admission;

import java.util.Locale;

/**
 * The closed set of rate-limiting algorithms.
 */
public enum RateLimitAlgorithm {
    /** Counts requests whose timestamps fall within the trailing window */
    SLIDING_WINDOW,

    /** Continuously refilled bucket, one token per request, allows bursts up to capacity */
    TOKEN_BUCKET,

    /** Counter draining at a constant rate, smooths bursts */
    LEAKY_BUCKET,

    /** Sliding window whose limit shrinks under system load and with rule priority */
    ADAPTIVE;

    /**
     * Resolves an algorithm from {@code sliding_window}, {@code sliding-window} or {@code SLIDING_WINDOW}.
     */
    public static RateLimitAlgorithm fromName(String name) {
        if (name == null || name.isBlank()) {
            return SLIDING_WINDOW;
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
