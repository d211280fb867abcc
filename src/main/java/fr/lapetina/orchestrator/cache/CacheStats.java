package fr.lapetina.orchestrator.cache;

import java.time.Instant;

/**
 * Cache counters. {@code costSaved} is the cost of every entry times its hits.
 */
public record CacheStats(
        int entries,
        long totalSizeBytes,
        long hits,
        long misses,
        double hitRate,
        double costSaved,
        long unitsSaved,
        Instant oldestEntry,
        Instant newestEntry
) {
}
