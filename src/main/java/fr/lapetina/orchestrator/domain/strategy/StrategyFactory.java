package fr.lapetina.orchestrator.domain.strategy;

import java.util.Map;

/**
 * Creates selection strategies. Supports runtime strategy switching without restart.
 */
public final class StrategyFactory {

    private StrategyFactory() {
        // Utility class
    }

    /**
     * Creates a strategy.
     *
     * @param type            strategy to create
     * @param weightOverrides per-instance weights for weighted round-robin
     * @param adaptiveWeights component weights for the adaptive strategy
     */
    public static SelectionStrategy create(
            SelectionStrategyType type,
            Map<String, Integer> weightOverrides,
            AdaptiveWeights adaptiveWeights
    ) {
        return switch (type) {
            case ROUND_ROBIN -> new RoundRobinStrategy();
            case WEIGHTED_ROUND_ROBIN -> new WeightedRoundRobinStrategy(weightOverrides);
            case LEAST_CONNECTIONS -> new LeastConnectionsStrategy();
            case LEAST_RESPONSE_TIME -> new LeastResponseTimeStrategy();
            case COST_OPTIMIZED -> new CostOptimizedStrategy();
            case ADAPTIVE -> new AdaptiveStrategy(adaptiveWeights != null ? adaptiveWeights : AdaptiveWeights.DEFAULT);
        };
    }

    /**
     * Creates a strategy with default weights.
     */
    public static SelectionStrategy create(SelectionStrategyType type) {
        return create(type, Map.of(), AdaptiveWeights.DEFAULT);
    }

    /**
     * Creates a strategy by configuration name.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static SelectionStrategy create(String name) {
        return create(SelectionStrategyType.fromName(name));
    }
}
