package fr.lapetina.orchestrator.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.orchestrator.domain.provider.CostBearing;
import fr.lapetina.orchestrator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.orchestrator.infrastructure.scheduling.TickScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Fingerprint-keyed cache of provider results with per-entry TTL and cost accounting.
 *
 * <p>Bounded by entry count and by total serialized size. When the entry bound is reached a
 * fixed share of the least-hit, oldest entries is evicted; when the size bound would be exceeded
 * entries with the fewest hits per byte are evicted until the cache is back under its size target.
 * Expired entries are dropped on read and by a periodic sweep.
 *
 * <p>All operations are synchronized on the cache; values are never computed under the lock.
 */
public final class ResponseCache {

    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

    private static final Comparator<CacheEntry> ENTRY_EVICTION_ORDER = Comparator
            .comparingInt((CacheEntry entry) -> entry.hits)
            .thenComparing(entry -> entry.createdAt);

    private static final Comparator<CacheEntry> SIZE_EVICTION_ORDER = Comparator
            .comparingDouble(CacheEntry::valueDensity)
            .thenComparing(entry -> entry.createdAt);

    private final Map<String, CacheEntry> entries = new HashMap<>();
    private final Settings settings;
    private final ObjectMapper objectMapper;
    private final MetricsRegistry metrics;
    private final Clock clock;

    private long totalSize;
    private long hits;
    private long misses;

    public ResponseCache(Settings settings, ObjectMapper objectMapper, MetricsRegistry metrics, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "Settings are required");
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Schedules the expiry sweep.
     */
    public TickScheduler.Registration start(TickScheduler scheduler) {
        return scheduler.schedule("cache-cleanup", settings.cleanupInterval(), () -> {
            purgeExpired();
            logStats();
        });
    }

    /**
     * Returns the cached value, counting a hit, or empty on miss or expiry.
     */
    public synchronized Optional<Object> get(String key) {
        CacheEntry entry = entries.get(key);
        Instant now = clock.instant();
        if (entry == null) {
            misses++;
            count("miss");
            return Optional.empty();
        }
        if (entry.isExpired(now)) {
            removeEntry(key);
            misses++;
            count("expired");
            return Optional.empty();
        }
        entry.hits++;
        hits++;
        count("hit");
        return Optional.of(entry.value);
    }

    /**
     * Typed variant of {@link #get(String)}; a value of another type counts as a miss.
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        return get(key).filter(type::isInstance).map(type::cast);
    }

    /**
     * Stores a value. Null values and values larger than the whole cache are not stored.
     */
    public void set(String key, Object value, CacheOptions options) {
        if (value == null) {
            log.debug("Null value not cached: key={}", key);
            return;
        }
        CacheOptions effective = options != null ? options : CacheOptions.defaults();
        long size = estimateSize(value);
        Duration ttl = resolveTtl(effective);
        double cost = 0.0;
        long units = 0;
        if (value instanceof CostBearing bearing) {
            cost = bearing.cost();
            units = bearing.unitsConsumed();
        }

        if (size > settings.maxSizeBytes()) {
            log.warn("Value larger than cache, not cached: key={}, sizeBytes={}, maxSizeBytes={}",
                    key, size, settings.maxSizeBytes());
            return;
        }

        synchronized (this) {
            removeEntry(key);
            if (entries.size() >= settings.maxEntries()) {
                evictByCount();
            }
            if (totalSize + size > settings.maxSizeBytes()) {
                evictBySize(size);
            }
            CacheEntry entry = new CacheEntry(key, value, clock.instant(), ttl, cost, units, size,
                    QualityRating.rate(value), effective);
            entries.put(key, entry);
            totalSize += size;
        }
        log.debug("Cached: key={}, sizeBytes={}, ttl={}, cost={}", key, size, ttl, cost);
    }

    /**
     * Returns the cached value for {@code key}, or runs {@code operation} and caches its result.
     * With {@code forceRefresh} the lookup is skipped and the entry overwritten.
     */
    @SuppressWarnings("unchecked")
    public <T> T wrap(String key, Supplier<T> operation, CacheOptions options) {
        CacheOptions effective = options != null ? options : CacheOptions.defaults();
        if (!effective.forceRefresh()) {
            Optional<Object> cached = get(key);
            if (cached.isPresent()) {
                return (T) cached.get();
            }
        }
        T value = operation.get();
        set(key, value, effective);
        return value;
    }

    /**
     * Asynchronous {@link #wrap}: the result is cached once the future completes successfully.
     * Failures are never cached.
     */
    @SuppressWarnings("unchecked")
    public <T> CompletableFuture<T> wrapAsync(String key, Supplier<CompletableFuture<T>> operation, CacheOptions options) {
        CacheOptions effective = options != null ? options : CacheOptions.defaults();
        if (!effective.forceRefresh()) {
            Optional<Object> cached = get(key);
            if (cached.isPresent()) {
                return CompletableFuture.completedFuture((T) cached.get());
            }
        }
        return operation.get().thenApply(value -> {
            set(key, value, effective);
            return value;
        });
    }

    public synchronized boolean delete(String key) {
        return removeEntry(key) != null;
    }

    /**
     * Whether a live entry exists. Does not count as a hit or miss.
     */
    public synchronized boolean contains(String key) {
        CacheEntry entry = entries.get(key);
        return entry != null && !entry.isExpired(clock.instant());
    }

    public synchronized void clear() {
        int count = entries.size();
        entries.clear();
        totalSize = 0;
        log.info("Cache cleared: entries={}", count);
    }

    /**
     * Removes all expired entries.
     *
     * @return number of entries removed
     */
    public synchronized int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        Iterator<CacheEntry> it = entries.values().iterator();
        while (it.hasNext()) {
            CacheEntry entry = it.next();
            if (entry.isExpired(now)) {
                it.remove();
                totalSize -= entry.sizeBytes;
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Expired cache entries purged: count={}", removed);
        }
        return removed;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized CacheStats getStats() {
        double costSaved = 0.0;
        long unitsSaved = 0;
        Instant oldest = null;
        Instant newest = null;
        for (CacheEntry entry : entries.values()) {
            costSaved += entry.cost * entry.hits;
            unitsSaved += entry.units * entry.hits;
            if (oldest == null || entry.createdAt.isBefore(oldest)) {
                oldest = entry.createdAt;
            }
            if (newest == null || entry.createdAt.isAfter(newest)) {
                newest = entry.createdAt;
            }
        }
        long lookups = hits + misses;
        return new CacheStats(entries.size(), totalSize, hits, misses,
                lookups == 0 ? 0.0 : (double) hits / lookups, costSaved, unitsSaved, oldest, newest);
    }

    /**
     * Entries with the most hits, most hit first.
     */
    public synchronized List<CacheEntrySummary> topHits(int limit) {
        return entries.values().stream()
                .sorted(Comparator.comparingInt((CacheEntry entry) -> entry.hits).reversed()
                        .thenComparing(entry -> entry.key))
                .limit(limit)
                .map(CacheEntry::summarize)
                .toList();
    }

    /**
     * Entries that cost the most to produce, most expensive first.
     */
    public synchronized List<CacheEntrySummary> mostExpensive(int limit) {
        return entries.values().stream()
                .sorted(Comparator.comparingDouble((CacheEntry entry) -> entry.cost).reversed()
                        .thenComparing(entry -> entry.key))
                .limit(limit)
                .map(CacheEntry::summarize)
                .toList();
    }

    /**
     * Restores hit and miss counters from a snapshot.
     */
    public synchronized void restoreCounters(long restoredHits, long restoredMisses) {
        this.hits = restoredHits;
        this.misses = restoredMisses;
    }

    private void logStats() {
        CacheStats stats = getStats();
        log.info("Cache stats: entries={}, sizeBytes={}, hitRate={}, costSaved={}, unitsSaved={}",
                stats.entries(), stats.totalSizeBytes(), String.format("%.3f", stats.hitRate()),
                stats.costSaved(), stats.unitsSaved());
    }

    private void evictByCount() {
        int toEvict = (int) Math.ceil(settings.maxEntries() * settings.entryEvictionRatio());
        List<CacheEntry> victims = new ArrayList<>(entries.values());
        victims.sort(ENTRY_EVICTION_ORDER);
        int evicted = 0;
        for (CacheEntry victim : victims) {
            if (evicted >= toEvict) {
                break;
            }
            removeEntry(victim.key);
            evicted++;
        }
        count("evicted", evicted);
        log.debug("Cache entries evicted for count: evicted={}, remaining={}", evicted, entries.size());
    }

    /**
     * Evicts until the incoming entry fits under the size target, or the cache is empty.
     */
    private void evictBySize(long incomingSize) {
        long target = (long) (settings.maxSizeBytes() * settings.sizeTargetRatio());
        List<CacheEntry> victims = new ArrayList<>(entries.values());
        victims.sort(SIZE_EVICTION_ORDER);
        int evicted = 0;
        for (CacheEntry victim : victims) {
            if (totalSize + incomingSize <= target) {
                break;
            }
            removeEntry(victim.key);
            evicted++;
        }
        count("evicted", evicted);
        log.debug("Cache entries evicted for size: evicted={}, totalSize={}", evicted, totalSize);
    }

    private CacheEntry removeEntry(String key) {
        CacheEntry removed = entries.remove(key);
        if (removed != null) {
            totalSize -= removed.sizeBytes;
        }
        return removed;
    }

    private Duration resolveTtl(CacheOptions options) {
        if (options.ttl() != null) {
            return options.ttl();
        }
        if (options.contentType() != null) {
            Integer seconds = settings.ttlSecondsByContentType().get(options.contentType());
            if (seconds != null) {
                return Duration.ofSeconds(seconds);
            }
        }
        return settings.defaultTtl();
    }

    long estimateSize(Object value) {
        if (objectMapper != null) {
            try {
                return objectMapper.writeValueAsBytes(value).length;
            } catch (JsonProcessingException e) {
                log.debug("Value not serializable, sizing from toString: type={}", value.getClass().getName());
            }
        }
        return String.valueOf(value).getBytes(StandardCharsets.UTF_8).length;
    }

    private void count(String result) {
        count(result, 1);
    }

    private void count(String result, int amount) {
        if (metrics != null && amount > 0) {
            metrics.incrementCache(result, amount);
        }
    }

    /**
     * Cache bounds and lifetimes.
     *
     * @param defaultTtl              TTL when neither the call nor its content type sets one
     * @param ttlSecondsByContentType TTL per content type
     * @param maxEntries              entry bound
     * @param maxSizeBytes            total serialized size bound
     * @param entryEvictionRatio      share of {@code maxEntries} evicted when the entry bound is hit
     * @param sizeTargetRatio         share of {@code maxSizeBytes} to shrink to under size pressure
     * @param cleanupInterval         expiry sweep period
     */
    public record Settings(
            Duration defaultTtl,
            Map<String, Integer> ttlSecondsByContentType,
            int maxEntries,
            long maxSizeBytes,
            double entryEvictionRatio,
            double sizeTargetRatio,
            Duration cleanupInterval
    ) {
        public static final Settings DEFAULT = new Settings(
                Duration.ofHours(1),
                Map.of(
                        "chat", 3600,
                        "embeddings", 86_400,
                        "transcription", 86_400,
                        "image_generation", 604_800,
                        "analysis", 3600
                ),
                10_000,
                100L * 1024 * 1024,
                0.1,
                0.8,
                Duration.ofMinutes(5)
        );

        public Settings {
            if (maxEntries < 1 || maxSizeBytes < 1) {
                throw new IllegalArgumentException("Cache bounds must be positive");
            }
            if (entryEvictionRatio <= 0 || entryEvictionRatio > 1 || sizeTargetRatio <= 0 || sizeTargetRatio > 1) {
                throw new IllegalArgumentException("Eviction ratios must be in (0, 1]");
            }
            ttlSecondsByContentType = ttlSecondsByContentType != null ? Map.copyOf(ttlSecondsByContentType) : Map.of();
        }
    }
}
