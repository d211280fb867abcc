package fr.lapetina.orchestrator.domain.strategy;

import fr.lapetina.orchestrator.domain.model.AiInstance;
import fr.lapetina.orchestrator.domain.model.RequestContext;

/**
 * Scores and estimates shared by the selector and the adaptive strategy.
 */
public final class InstanceScoring {

    /** Latency at which the latency score reaches zero. */
    public static final double LATENCY_REFERENCE_MS = 5000.0;

    /** Cost per unit at which the cost score reaches zero. */
    public static final double COST_REFERENCE_PER_UNIT = 0.0001;

    private InstanceScoring() {
        // Utility class
    }

    public static double latencyScore(AiInstance instance) {
        return Math.max(0.0, 1.0 - instance.getAverageLatencyMs() / LATENCY_REFERENCE_MS);
    }

    public static double costScore(AiInstance instance) {
        return Math.max(0.0, 1.0 - instance.getCostPerUnit() / COST_REFERENCE_PER_UNIT);
    }

    public static double capacityScore(AiInstance instance) {
        return Math.max(0.0, 1.0 - instance.getLoadRatio());
    }

    /**
     * Adaptive score: weighted components, scaled by the instance's static priority
     * and by how well it fits the request.
     */
    public static double adaptiveScore(AiInstance instance, RequestContext context, AdaptiveWeights weights) {
        double base = weights.latency() * latencyScore(instance)
                + weights.cost() * costScore(instance)
                + weights.successRate() * instance.getSuccessRate()
                + weights.capacity() * capacityScore(instance);
        double priorityFactor = instance.getPriority() / 10.0;
        return base * priorityFactor * contextMultiplier(instance, context);
    }

    /**
     * How well the instance fits the request's priority and budgets.
     */
    public static double contextMultiplier(AiInstance instance, RequestContext context) {
        double multiplier = 1.0;
        int instancePriority = instance.getPriority();

        switch (context.priority()) {
            case CRITICAL -> multiplier *= instancePriority >= 8 ? 1.5 : 0.5;
            case HIGH -> multiplier *= instancePriority >= 6 ? 1.2 : 0.8;
            case LOW -> multiplier *= instancePriority <= 4 ? 1.3 : 1.0;
            case NORMAL -> {
                // neutral
            }
        }

        if (context.maxLatencyMs() != null && instance.getAverageLatencyMs() > context.maxLatencyMs()) {
            multiplier *= 0.3;
        }
        if (context.costBudget() != null && estimateCost(instance, context) > context.costBudget()) {
            multiplier *= 0.2;
        }
        return multiplier;
    }

    /**
     * Expected latency, inflated by current load and request size.
     */
    public static double estimateLatency(AiInstance instance, RequestContext context) {
        double loadFactor = 1.0 + instance.getLoadRatio() * 0.5;
        double sizeFactor = Math.max(1.0, context.expectedUnits() / 1000.0);
        return instance.getAverageLatencyMs() * loadFactor * sizeFactor;
    }

    public static double estimateCost(AiInstance instance, RequestContext context) {
        return instance.getCostPerUnit() * context.expectedUnits();
    }
}
