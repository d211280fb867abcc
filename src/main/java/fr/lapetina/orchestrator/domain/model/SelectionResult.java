package fr.lapetina.orchestrator.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of instance selection.
 *
 * @param instance           the chosen instance
 * @param estimatedLatencyMs expected latency for the request
 * @param estimatedCost      expected cost for the request
 * @param confidence         in [0, 1]
 * @param fallbacks          up to two other compatible instances, best adaptive score first
 * @param reason             human-readable explanation
 */
public record SelectionResult(
        AiInstance instance,
        double estimatedLatencyMs,
        double estimatedCost,
        double confidence,
        List<AiInstance> fallbacks,
        String reason
) {
    public SelectionResult {
        Objects.requireNonNull(instance, "Instance is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be in [0, 1]: " + confidence);
        }
        fallbacks = fallbacks != null ? List.copyOf(fallbacks) : List.of();
    }
}
