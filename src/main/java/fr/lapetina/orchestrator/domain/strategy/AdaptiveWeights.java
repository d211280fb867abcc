package fr.lapetina.orchestrator.domain.strategy;

/**
 * Weights of the four adaptive score components.
 */
public record AdaptiveWeights(
        double latency,
        double cost,
        double successRate,
        double capacity
) {
    public static final AdaptiveWeights DEFAULT = new AdaptiveWeights(0.3, 0.2, 0.3, 0.2);

    public AdaptiveWeights {
        if (latency < 0 || cost < 0 || successRate < 0 || capacity < 0) {
            throw new IllegalArgumentException("Adaptive weights must not be negative");
        }
    }
}
