package fr.lapetina.orchestrator.domain.strategy;

import fr.lapetina.orchestrator.domain.model.AiInstance;
import fr.lapetina.orchestrator.domain.model.RequestContext;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Smooth weighted round-robin.
 *
 * An instance with weight 2 receives twice as many requests as one with weight 1,
 * interleaved rather than in bursts. The weight is the configured override for the
 * instance id, else its static priority. Instances with weight 0 are skipped.
 */
public final class WeightedRoundRobinStrategy implements SelectionStrategy {

    private final Map<String, Integer> weightOverrides;
    private final Map<String, Integer> currentWeights = new HashMap<>();

    public WeightedRoundRobinStrategy() {
        this(Map.of());
    }

    public WeightedRoundRobinStrategy(Map<String, Integer> weightOverrides) {
        this.weightOverrides = weightOverrides != null ? Map.copyOf(weightOverrides) : Map.of();
    }

    @Override
    public SelectionStrategyType getType() {
        return SelectionStrategyType.WEIGHTED_ROUND_ROBIN;
    }

    @Override
    public synchronized Optional<AiInstance> select(List<AiInstance> candidates, RequestContext context) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        AiInstance best = null;
        int bestWeight = Integer.MIN_VALUE;
        int total = 0;

        for (AiInstance instance : candidates) {
            int weight = weightOf(instance);
            if (weight <= 0) {
                continue;
            }
            total += weight;
            int current = currentWeights.merge(instance.getId(), weight, Integer::sum);
            // strict > keeps the lowest id on ties
            if (current > bestWeight) {
                bestWeight = current;
                best = instance;
            }
        }

        if (best == null) {
            return Optional.empty();
        }
        currentWeights.merge(best.getId(), -total, Integer::sum);
        return Optional.of(best);
    }

    int weightOf(AiInstance instance) {
        return weightOverrides.getOrDefault(instance.getId(), instance.getPriority());
    }

    @Override
    public synchronized void reset() {
        currentWeights.clear();
    }
}
