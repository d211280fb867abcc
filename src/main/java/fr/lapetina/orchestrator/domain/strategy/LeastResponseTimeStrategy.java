package fr.lapetina.orchestrator.domain.strategy;

import fr.lapetina.orchestrator.domain.model.AiInstance;
import fr.lapetina.orchestrator.domain.model.RequestContext;

import java.util.List;
import java.util.Optional;

/**
 * Selects the instance with the lowest rolling average latency.
 */
public final class LeastResponseTimeStrategy implements SelectionStrategy {

    @Override
    public SelectionStrategyType getType() {
        return SelectionStrategyType.LEAST_RESPONSE_TIME;
    }

    @Override
    public Optional<AiInstance> select(List<AiInstance> candidates, RequestContext context) {
        AiInstance selected = null;
        double best = Double.MAX_VALUE;
        for (AiInstance instance : candidates) {
            if (instance.getAverageLatencyMs() < best) {
                best = instance.getAverageLatencyMs();
                selected = instance;
            }
        }
        return Optional.ofNullable(selected);
    }
}
