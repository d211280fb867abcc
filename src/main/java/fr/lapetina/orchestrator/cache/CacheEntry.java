package fr.lapetina.orchestrator.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * A cached value with its accounting. The hit count is guarded by the owning cache.
 */
final class CacheEntry {

    final String key;
    final Object value;
    final Instant createdAt;
    final Duration ttl;
    final double cost;
    final long units;
    final long sizeBytes;
    final QualityRating quality;
    final CacheOptions options;
    int hits;

    CacheEntry(String key, Object value, Instant createdAt, Duration ttl, double cost, long units,
               long sizeBytes, QualityRating quality, CacheOptions options) {
        this.key = key;
        this.value = value;
        this.createdAt = createdAt;
        this.ttl = ttl;
        this.cost = cost;
        this.units = units;
        this.sizeBytes = sizeBytes;
        this.quality = quality;
        this.options = options;
    }

    Instant expiresAt() {
        return createdAt.plus(ttl);
    }

    boolean isExpired(Instant now) {
        return now.isAfter(expiresAt());
    }

    /**
     * Hits per byte; entries with the lowest value go first under size pressure.
     */
    double valueDensity() {
        return (double) hits / Math.max(1, sizeBytes);
    }

    CacheEntrySummary summarize() {
        return new CacheEntrySummary(key, hits, cost, units, sizeBytes, quality, createdAt, expiresAt(),
                options.service(), options.operation(), options.model());
    }
}
