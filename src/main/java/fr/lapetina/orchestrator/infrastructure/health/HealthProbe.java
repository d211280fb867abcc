package fr.lapetina.orchestrator.infrastructure.health;

import fr.lapetina.orchestrator.domain.model.AiInstance;

import java.util.concurrent.CompletableFuture;

/**
 * Checks whether an instance is reachable and serving.
 */
@FunctionalInterface
public interface HealthProbe {

    /**
     * @return a future completing with true when healthy; false or an exceptional
     *         completion both count as a failed check
     */
    CompletableFuture<Boolean> probe(AiInstance instance);
}
