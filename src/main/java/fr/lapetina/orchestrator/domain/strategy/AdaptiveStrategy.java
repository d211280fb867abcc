package fr.lapetina.orchestrator.domain.strategy;

import fr.lapetina.orchestrator.domain.model.AiInstance;
import fr.lapetina.orchestrator.domain.model.RequestContext;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Selects the instance with the highest adaptive score.
 *
 * @see InstanceScoring#adaptiveScore(AiInstance, RequestContext, AdaptiveWeights)
 */
public final class AdaptiveStrategy implements SelectionStrategy {

    private final AdaptiveWeights weights;

    public AdaptiveStrategy() {
        this(AdaptiveWeights.DEFAULT);
    }

    public AdaptiveStrategy(AdaptiveWeights weights) {
        this.weights = Objects.requireNonNull(weights, "Weights are required");
    }

    @Override
    public SelectionStrategyType getType() {
        return SelectionStrategyType.ADAPTIVE;
    }

    @Override
    public Optional<AiInstance> select(List<AiInstance> candidates, RequestContext context) {
        AiInstance selected = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (AiInstance instance : candidates) {
            double score = InstanceScoring.adaptiveScore(instance, context, weights);
            if (score > bestScore) {
                bestScore = score;
                selected = instance;
            }
        }
        return Optional.ofNullable(selected);
    }

    public AdaptiveWeights getWeights() {
        return weights;
    }
}
