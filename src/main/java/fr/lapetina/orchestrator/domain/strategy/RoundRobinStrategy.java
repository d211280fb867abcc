package fr.lapetina.orchestrator.domain.strategy;

import fr.lapetina.orchestrator.domain.model.AiInstance;
import fr.lapetina.orchestrator.domain.model.RequestContext;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Cycles through the compatible instances in id order.
 *
 * Thread-safe via atomic counter.
 */
public final class RoundRobinStrategy implements SelectionStrategy {

    private final AtomicInteger counter = new AtomicInteger(0);

    @Override
    public SelectionStrategyType getType() {
        return SelectionStrategyType.ROUND_ROBIN;
    }

    @Override
    public Optional<AiInstance> select(List<AiInstance> candidates, RequestContext context) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        int index = Math.floorMod(counter.getAndIncrement(), candidates.size());
        return Optional.of(candidates.get(index));
    }

    @Override
    public void reset() {
        counter.set(0);
    }
}
