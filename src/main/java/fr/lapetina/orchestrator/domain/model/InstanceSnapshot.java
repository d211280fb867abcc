package fr.lapetina.orchestrator.domain.model;

import java.time.Instant;
import java.util.Set;

/**
 * Point-in-time view of an {@link AiInstance}, safe to serialize.
 */
public record InstanceSnapshot(
        String id,
        String provider,
        String baseUrl,
        Set<String> models,
        InstanceStatus status,
        int priority,
        int currentLoad,
        int maxConcurrent,
        int queueSize,
        double averageLatencyMs,
        double successRate,
        double costPerUnit,
        double unitsPerSecond,
        int consecutiveFailures,
        double uptime,
        Instant lastHealthCheck,
        String region
) {
}
