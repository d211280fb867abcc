package fr.lapetina.orchestrator.queue;

import fr.lapetina.orchestrator.domain.model.RequestContext;
import fr.lapetina.orchestrator.domain.model.RequestPriority;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * What to enqueue. Unset limits take the queue defaults.
 *
 * @param kind              task kind
 * @param payload           provider request body
 * @param priority          queue ordering
 * @param requesterIdentity who submitted the task
 * @param sessionId         optional session correlation id
 * @param maxRetries        retries after the first run, or null for the queue default
 * @param timeout           per-attempt timeout, or null for the queue default
 * @param delay             earliest start relative to submission, or null
 * @param dependencies      ids of tasks that must have completed
 * @param requiredModel     model to run, or null for the kind's default
 * @param expectedUnits     expected tokens or units
 * @param retryable         whether failures may be retried at all
 * @param tags              free-form labels
 * @param cacheKey          explicit cache key, or null to derive one from the content
 * @param cacheable         whether the result may be served from and stored in the cache
 */
public record TaskSpec(
        TaskKind kind,
        Map<String, Object> payload,
        RequestPriority priority,
        String requesterIdentity,
        String sessionId,
        Integer maxRetries,
        Duration timeout,
        Duration delay,
        Set<String> dependencies,
        String requiredModel,
        long expectedUnits,
        boolean retryable,
        Set<String> tags,
        String cacheKey,
        boolean cacheable
) {
    public TaskSpec {
        Objects.requireNonNull(kind, "Task kind is required");
        payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
        if (priority == null) {
            priority = RequestPriority.NORMAL;
        }
        if (requesterIdentity == null || requesterIdentity.isBlank()) {
            requesterIdentity = RequestContext.ANONYMOUS;
        }
        if (maxRetries != null && maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }
        dependencies = dependencies != null ? Set.copyOf(dependencies) : Set.of();
        tags = tags != null ? Set.copyOf(tags) : Set.of();
    }

    public static Builder builder(TaskKind kind) {
        return new Builder(kind);
    }

    public static final class Builder {
        private final TaskKind kind;
        private Map<String, Object> payload;
        private RequestPriority priority = RequestPriority.NORMAL;
        private String requesterIdentity;
        private String sessionId;
        private Integer maxRetries;
        private Duration timeout;
        private Duration delay;
        private Set<String> dependencies;
        private String requiredModel;
        private long expectedUnits = 1000;
        private boolean retryable = true;
        private Set<String> tags;
        private String cacheKey;
        private boolean cacheable;

        private Builder(TaskKind kind) {
            this.kind = kind;
            this.cacheable = kind != null && kind.isCacheableByDefault();
        }

        public Builder payload(Map<String, Object> payload) {
            this.payload = payload;
            return this;
        }

        public Builder priority(RequestPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder requesterIdentity(String requesterIdentity) {
            this.requesterIdentity = requesterIdentity;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder maxRetries(Integer maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder delay(Duration delay) {
            this.delay = delay;
            return this;
        }

        public Builder dependencies(Set<String> dependencies) {
            this.dependencies = dependencies;
            return this;
        }

        public Builder requiredModel(String requiredModel) {
            this.requiredModel = requiredModel;
            return this;
        }

        public Builder expectedUnits(long expectedUnits) {
            this.expectedUnits = expectedUnits;
            return this;
        }

        public Builder retryable(boolean retryable) {
            this.retryable = retryable;
            return this;
        }

        public Builder tags(Set<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder cacheKey(String cacheKey) {
            this.cacheKey = cacheKey;
            return this;
        }

        public Builder cacheable(boolean cacheable) {
            this.cacheable = cacheable;
            return this;
        }

        public TaskSpec build() {
            return new TaskSpec(kind, payload, priority, requesterIdentity, sessionId, maxRetries, timeout,
                    delay, dependencies, requiredModel, expectedUnits, retryable, tags, cacheKey, cacheable);
        }
    }
}
