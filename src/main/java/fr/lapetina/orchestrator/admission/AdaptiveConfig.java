package fr.lapetina.orchestrator.admission;

/**
 * How adaptive rules react to system load.
 *
 * @param enabled          when false, adaptive rules behave like sliding windows divided by rule priority
 * @param loadThreshold    load above which limits shrink
 * @param adaptationFactor multiplier applied to limits while overloaded
 * @param recoveryTimeMs   time for the multiplier to climb back to 1 after load subsides
 * @param minLimit         adaptive limits never drop below this
 */
public record AdaptiveConfig(
        boolean enabled,
        double loadThreshold,
        double adaptationFactor,
        long recoveryTimeMs,
        int minLimit
) {
    public static final AdaptiveConfig DEFAULT = new AdaptiveConfig(true, 0.8, 0.5, 300_000, 10);

    public AdaptiveConfig {
        if (adaptationFactor <= 0 || adaptationFactor > 1) {
            throw new IllegalArgumentException("Adaptation factor must be in (0, 1]: " + adaptationFactor);
        }
        if (recoveryTimeMs < 0 || minLimit < 0) {
            throw new IllegalArgumentException("Recovery time and minimum limit must not be negative");
        }
    }
}
