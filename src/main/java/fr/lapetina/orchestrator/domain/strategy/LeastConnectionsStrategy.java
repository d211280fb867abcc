package fr.lapetina.orchestrator.domain.strategy;

import fr.lapetina.orchestrator.domain.model.AiInstance;
import fr.lapetina.orchestrator.domain.model.RequestContext;

import java.util.List;
import java.util.Optional;

/**
 * Selects the instance with the lowest utilization.
 *
 * Utilization is load over capacity, so instances of different sizes compare fairly;
 * ties go to the lower absolute load, then to the lowest id.
 */
public final class LeastConnectionsStrategy implements SelectionStrategy {

    @Override
    public SelectionStrategyType getType() {
        return SelectionStrategyType.LEAST_CONNECTIONS;
    }

    @Override
    public Optional<AiInstance> select(List<AiInstance> candidates, RequestContext context) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        AiInstance selected = null;
        int minLoad = Integer.MAX_VALUE;
        double minRatio = Double.MAX_VALUE;

        for (AiInstance instance : candidates) {
            int load = instance.getCurrentLoad();
            double ratio = instance.getLoadRatio();
            if (ratio < minRatio || (ratio == minRatio && load < minLoad)) {
                minRatio = ratio;
                minLoad = load;
                selected = instance;
            }
        }

        return Optional.ofNullable(selected);
    }
}
