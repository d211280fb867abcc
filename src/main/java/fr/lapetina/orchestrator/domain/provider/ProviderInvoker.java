package fr.lapetina.orchestrator.domain.provider;

import fr.lapetina.orchestrator.domain.model.AiInstance;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * The capability that actually talks to a provider.
 * Implementations must not block the calling thread.
 */
@FunctionalInterface
public interface ProviderInvoker {

    /**
     * Invokes {@code model} on {@code instance}.
     *
     * @return a future completing with the result, or exceptionally on failure
     */
    CompletableFuture<ProviderResult> invoke(AiInstance instance, String model, Map<String, Object> payload);
}
