package fr.lapetina.orchestrator.domain.model;

import java.util.Objects;

/**
 * What a caller needs from a provider instance for one request.
 * Immutable and thread-safe.
 *
 * @param model             model the instance must support
 * @param priority          request priority, drives the adaptive context multiplier
 * @param expectedUnits     expected tokens or units consumed
 * @param maxLatencyMs      latency budget, or {@code null} for none
 * @param costBudget        cost budget, or {@code null} for none
 * @param retryable         whether a failed call may be retried
 * @param requesterIdentity who asked; {@code "anonymous"} when absent
 * @param sessionId         optional session correlation id
 */
public record RequestContext(
        String model,
        RequestPriority priority,
        long expectedUnits,
        Long maxLatencyMs,
        Double costBudget,
        boolean retryable,
        String requesterIdentity,
        String sessionId
) {
    public static final String ANONYMOUS = "anonymous";

    public RequestContext {
        Objects.requireNonNull(model, "Model is required");
        if (priority == null) {
            priority = RequestPriority.NORMAL;
        }
        if (expectedUnits < 0) {
            throw new IllegalArgumentException("Expected units must not be negative: " + expectedUnits);
        }
        if (requesterIdentity == null || requesterIdentity.isBlank()) {
            requesterIdentity = ANONYMOUS;
        }
    }

    /**
     * Creates a context with default priority and no budgets.
     */
    public static RequestContext forModel(String model, long expectedUnits) {
        return builder().model(model).expectedUnits(expectedUnits).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String model;
        private RequestPriority priority = RequestPriority.NORMAL;
        private long expectedUnits = 1000;
        private Long maxLatencyMs;
        private Double costBudget;
        private boolean retryable = true;
        private String requesterIdentity;
        private String sessionId;

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder priority(RequestPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder expectedUnits(long expectedUnits) {
            this.expectedUnits = expectedUnits;
            return this;
        }

        public Builder maxLatencyMs(Long maxLatencyMs) {
            this.maxLatencyMs = maxLatencyMs;
            return this;
        }

        public Builder costBudget(Double costBudget) {
            this.costBudget = costBudget;
            return this;
        }

        public Builder retryable(boolean retryable) {
            this.retryable = retryable;
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

        public RequestContext build() {
            return new RequestContext(model, priority, expectedUnits, maxLatencyMs, costBudget,
                    retryable, requesterIdentity, sessionId);
        }
    }
}
