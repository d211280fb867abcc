package fr.lapetina.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import fr.lapetina.orchestrator.domain.model.RequestPriority;
import fr.lapetina.orchestrator.queue.TaskKind;
import fr.lapetina.orchestrator.queue.TaskSpec;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * Task submission body.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TaskRequest {

    private String kind;
    private Map<String, Object> payload;
    private String priority;
    private String identity;
    private String tier;
    private Options options;

    public String getKind() { return kind; }
    public void setKind(String kind) { this.kind = kind; }

    public Map<String, Object> getPayload() { return payload; }
    public void setPayload(Map<String, Object> payload) { this.payload = payload; }

    public String getPriority() { return priority; }
    public void setPriority(String priority) { this.priority = priority; }

    public String getIdentity() { return identity; }
    public void setIdentity(String identity) { this.identity = identity; }

    public String getTier() { return tier; }
    public void setTier(String tier) { this.tier = tier; }

    public Options getOptions() { return options; }
    public void setOptions(Options options) { this.options = options; }

    /**
     * Converts to a task specification.
     *
     * @param fallbackIdentity used when the body names no identity, typically the client address
     * @throws IllegalArgumentException if the kind or priority is unknown
     */
    public TaskSpec toTaskSpec(String fallbackIdentity) {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("Missing 'kind' field");
        }
        TaskSpec.Builder builder = TaskSpec.builder(TaskKind.fromName(kind))
                .payload(payload)
                .priority(RequestPriority.fromName(priority))
                .requesterIdentity(identity != null ? identity : fallbackIdentity);

        if (options != null) {
            builder.sessionId(options.getSessionId())
                    .maxRetries(options.getMaxRetries())
                    .dependencies(options.getDependencies())
                    .requiredModel(options.getModel())
                    .tags(options.getTags())
                    .cacheKey(options.getCacheKey());
            if (options.getTimeoutMs() != null) {
                builder.timeout(Duration.ofMillis(options.getTimeoutMs()));
            }
            if (options.getDelayMs() != null) {
                builder.delay(Duration.ofMillis(options.getDelayMs()));
            }
            if (options.getExpectedUnits() != null) {
                builder.expectedUnits(options.getExpectedUnits());
            }
            if (options.getRetryable() != null) {
                builder.retryable(options.getRetryable());
            }
            if (options.getCacheable() != null) {
                builder.cacheable(options.getCacheable());
            }
        }
        return builder.build();
    }

    /**
     * Optional execution settings; absent fields keep the queue defaults.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Options {
        private String sessionId;
        private Integer maxRetries;
        private Long timeoutMs;
        private Long delayMs;
        private Set<String> dependencies;
        private String model;
        private Long expectedUnits;
        private Boolean retryable;
        private Set<String> tags;
        private String cacheKey;
        private Boolean cacheable;
        private String endpoint;

        public String getSessionId() { return sessionId; }
        public void setSessionId(String sessionId) { this.sessionId = sessionId; }

        public Integer getMaxRetries() { return maxRetries; }
        public void setMaxRetries(Integer maxRetries) { this.maxRetries = maxRetries; }

        public Long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(Long timeoutMs) { this.timeoutMs = timeoutMs; }

        public Long getDelayMs() { return delayMs; }
        public void setDelayMs(Long delayMs) { this.delayMs = delayMs; }

        public Set<String> getDependencies() { return dependencies; }
        public void setDependencies(Set<String> dependencies) { this.dependencies = dependencies; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public Long getExpectedUnits() { return expectedUnits; }
        public void setExpectedUnits(Long expectedUnits) { this.expectedUnits = expectedUnits; }

        public Boolean getRetryable() { return retryable; }
        public void setRetryable(Boolean retryable) { this.retryable = retryable; }

        public Set<String> getTags() { return tags; }
        public void setTags(Set<String> tags) { this.tags = tags; }

        public String getCacheKey() { return cacheKey; }
        public void setCacheKey(String cacheKey) { this.cacheKey = cacheKey; }

        public Boolean getCacheable() { return cacheable; }
        public void setCacheable(Boolean cacheable) { this.cacheable = cacheable; }

        /**
         * Endpoint checked by admission control instead of the kind's default.
         */
        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }
    }
}
