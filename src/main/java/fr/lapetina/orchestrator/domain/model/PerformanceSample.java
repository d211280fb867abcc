package fr.lapetina.orchestrator.domain.model;

import java.time.Instant;

/**
 * One recorded provider call outcome.
 */
public record PerformanceSample(
        Instant timestamp,
        long latencyMs,
        boolean success,
        double cost
) {
}
