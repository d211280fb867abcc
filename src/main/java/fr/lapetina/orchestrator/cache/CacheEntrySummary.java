package fr.lapetina.orchestrator.cache;

import java.time.Instant;

/**
 * Read-only description of a cache entry, without its value.
 */
public record CacheEntrySummary(
        String key,
        int hits,
        double cost,
        long units,
        long sizeBytes,
        QualityRating quality,
        Instant createdAt,
        Instant expiresAt,
        String service,
        String operation,
        String model
) {
}
