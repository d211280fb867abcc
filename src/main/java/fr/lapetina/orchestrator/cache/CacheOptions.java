package fr.lapetina.orchestrator.cache;

import java.time.Duration;

/**
 * Per-call cache options.
 *
 * @param ttl          explicit time to live, or {@code null} to derive it from the content type
 * @param forceRefresh skip the lookup and overwrite the entry
 * @param contentType  selects the TTL when none is given ({@code chat}, {@code embeddings}, ...)
 * @param service      label for statistics
 * @param operation    label for statistics
 * @param model        label for statistics
 */
public record CacheOptions(
        Duration ttl,
        boolean forceRefresh,
        String contentType,
        String service,
        String operation,
        String model
) {
    private static final CacheOptions DEFAULTS = new CacheOptions(null, false, null, null, null, null);

    public static CacheOptions defaults() {
        return DEFAULTS;
    }

    public static CacheOptions ttl(Duration ttl) {
        return builder().ttl(ttl).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration ttl;
        private boolean forceRefresh;
        private String contentType;
        private String service;
        private String operation;
        private String model;

        public Builder ttl(Duration ttl) {
            this.ttl = ttl;
            return this;
        }

        public Builder forceRefresh(boolean forceRefresh) {
            this.forceRefresh = forceRefresh;
            return this;
        }

        public Builder contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder service(String service) {
            this.service = service;
            return this;
        }

        public Builder operation(String operation) {
            this.operation = operation;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public CacheOptions build() {
            return new CacheOptions(ttl, forceRefresh, contentType, service, operation, model);
        }
    }
}
