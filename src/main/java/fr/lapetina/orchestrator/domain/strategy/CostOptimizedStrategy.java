package fr.lapetina.orchestrator.domain.strategy;

import fr.lapetina.orchestrator.domain.model.AiInstance;
import fr.lapetina.orchestrator.domain.model.RequestContext;

import java.util.List;
import java.util.Optional;

/**
 * Selects the instance with the lowest estimated cost for the request.
 */
public final class CostOptimizedStrategy implements SelectionStrategy {

    @Override
    public SelectionStrategyType getType() {
        return SelectionStrategyType.COST_OPTIMIZED;
    }

    @Override
    public Optional<AiInstance> select(List<AiInstance> candidates, RequestContext context) {
        AiInstance selected = null;
        double best = Double.MAX_VALUE;
        for (AiInstance instance : candidates) {
            double cost = InstanceScoring.estimateCost(instance, context);
            if (cost < best) {
                best = cost;
                selected = instance;
            }
        }
        return Optional.ofNullable(selected);
    }
}
