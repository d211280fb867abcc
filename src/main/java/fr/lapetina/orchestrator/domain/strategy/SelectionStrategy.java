package fr.lapetina.orchestrator.domain.strategy;

import fr.lapetina.orchestrator.domain.model.AiInstance;
import fr.lapetina.orchestrator.domain.model.RequestContext;

import java.util.List;
import java.util.Optional;

/**
 * Picks one instance among compatible candidates.
 *
 * Implementations must be thread-safe: the queue and the HTTP API select concurrently.
 */
public interface SelectionStrategy {

    /**
     * Returns the type of this strategy for configuration and metrics.
     */
    SelectionStrategyType getType();

    /**
     * Selects an instance for the request.
     *
     * @param candidates instances already known to be selectable for the request's model,
     *                   ordered by ascending id
     * @param context    the request
     * @return selected instance, or empty if candidates is empty
     */
    Optional<AiInstance> select(List<AiInstance> candidates, RequestContext context);

    /**
     * Resets any internal rotation state. Called when instances are reloaded.
     */
    default void reset() {
        // Default no-op
    }
}
