package fr.lapetina.orchestrator.domain.model;

import java.net.URI;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A provider endpoint able to serve one or more models.
 * Thread-safe: the queue, the health checker and the HTTP API read and update it concurrently.
 *
 * <p>Load never leaves {@code [0, maxConcurrent]}.
 */
public final class AiInstance {

    /** Weight of a new observation in the rolling latency and success averages. */
    public static final double EMA_ALPHA = 0.1;

    private final String id;
    private final ProviderFamily provider;
    private final URI baseUrl;
    private final Set<String> models;
    private final int priority;
    private final int maxConcurrent;
    private final QuotaLimits quota;
    private final String region;
    private final Set<String> capabilities;
    private final Set<String> supportedFormats;

    // Mutable state - thread-safe
    private final AtomicReference<InstanceStatus> status;
    private final AtomicInteger currentLoad = new AtomicInteger(0);
    private final AtomicInteger queueSize = new AtomicInteger(0);
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicLong healthChecks = new AtomicLong(0);
    private final AtomicLong healthyChecks = new AtomicLong(0);
    private volatile double averageLatencyMs;
    private volatile double successRate;
    private volatile double costPerUnit;
    private volatile double unitsPerSecond;
    private volatile Instant lastHealthCheck;

    private AiInstance(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Instance ID is required");
        this.provider = Objects.requireNonNull(builder.provider, "Provider is required");
        this.baseUrl = Objects.requireNonNull(builder.baseUrl, "Base URL is required");
        if (builder.maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be positive: " + builder.maxConcurrent);
        }
        if (builder.priority < 1 || builder.priority > 10) {
            throw new IllegalArgumentException("Priority must be in [1, 10]: " + builder.priority);
        }
        this.models = Collections.unmodifiableSet(new LinkedHashSet<>(builder.models));
        this.priority = builder.priority;
        this.maxConcurrent = builder.maxConcurrent;
        this.quota = builder.quota;
        this.region = builder.region;
        this.capabilities = Collections.unmodifiableSet(new LinkedHashSet<>(builder.capabilities));
        this.supportedFormats = Collections.unmodifiableSet(new LinkedHashSet<>(builder.supportedFormats));
        this.status = new AtomicReference<>(builder.initialStatus);
        this.averageLatencyMs = builder.averageLatencyMs;
        this.successRate = builder.successRate;
        this.costPerUnit = builder.costPerUnit;
        this.unitsPerSecond = builder.unitsPerSecond;
    }

    public String getId() {
        return id;
    }

    public ProviderFamily getProvider() {
        return provider;
    }

    public URI getBaseUrl() {
        return baseUrl;
    }

    public Set<String> getModels() {
        return models;
    }

    public boolean supportsModel(String model) {
        return models.contains(model);
    }

    public int getPriority() {
        return priority;
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public QuotaLimits getQuota() {
        return quota;
    }

    public String getRegion() {
        return region;
    }

    public Set<String> getCapabilities() {
        return capabilities;
    }

    public Set<String> getSupportedFormats() {
        return supportedFormats;
    }

    public InstanceStatus getStatus() {
        return status.get();
    }

    /**
     * Sets the status and returns the previous one.
     */
    public InstanceStatus setStatus(InstanceStatus newStatus) {
        return status.getAndSet(Objects.requireNonNull(newStatus));
    }

    /**
     * Sets the status only if it currently equals {@code expected}.
     */
    public boolean compareAndSetStatus(InstanceStatus expected, InstanceStatus newStatus) {
        return status.compareAndSet(expected, newStatus);
    }

    public boolean isActive() {
        return status.get() == InstanceStatus.ACTIVE;
    }

    public int getCurrentLoad() {
        return currentLoad.get();
    }

    public double getLoadRatio() {
        return (double) currentLoad.get() / maxConcurrent;
    }

    public boolean hasCapacity() {
        return currentLoad.get() < maxConcurrent;
    }

    /**
     * Attempts to take one request slot.
     * @return true if a slot was taken, false if at capacity
     */
    public boolean tryAcquireSlot() {
        while (true) {
            int current = currentLoad.get();
            if (current >= maxConcurrent) {
                return false;
            }
            if (currentLoad.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    /**
     * Gives back one request slot. Never drops below zero.
     */
    public void releaseSlot() {
        adjustLoad(-1);
    }

    /**
     * Applies a load delta, clamped to {@code [0, maxConcurrent]}.
     *
     * @return the new load
     */
    public int adjustLoad(int delta) {
        return currentLoad.updateAndGet(current ->
                Math.max(0, Math.min(maxConcurrent, current + delta)));
    }

    public int getQueueSize() {
        return queueSize.get();
    }

    public void setQueueSize(int size) {
        queueSize.set(Math.max(0, size));
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    /**
     * @return the failure count after incrementing
     */
    public int recordFailure() {
        return consecutiveFailures.incrementAndGet();
    }

    public void resetFailures() {
        consecutiveFailures.set(0);
    }

    public double getAverageLatencyMs() {
        return averageLatencyMs;
    }

    public double getSuccessRate() {
        return successRate;
    }

    public double getCostPerUnit() {
        return costPerUnit;
    }

    public void setCostPerUnit(double costPerUnit) {
        this.costPerUnit = costPerUnit;
    }

    public double getUnitsPerSecond() {
        return unitsPerSecond;
    }

    /**
     * Folds one call outcome into the rolling averages.
     */
    public synchronized void applyOutcome(long latencyMs, boolean success) {
        averageLatencyMs = averageLatencyMs * (1 - EMA_ALPHA) + latencyMs * EMA_ALPHA;
        successRate = successRate * (1 - EMA_ALPHA) + (success ? 1.0 : 0.0) * EMA_ALPHA;
    }

    /**
     * Folds a health probe latency into the rolling latency average.
     */
    public synchronized void applyProbeLatency(long latencyMs) {
        averageLatencyMs = averageLatencyMs * (1 - EMA_ALPHA) + latencyMs * EMA_ALPHA;
    }

    /**
     * Updates the observed throughput from a completed call.
     */
    public synchronized void applyThroughput(long units, long latencyMs) {
        if (units <= 0 || latencyMs <= 0) {
            return;
        }
        double observed = units * 1000.0 / latencyMs;
        unitsPerSecond = unitsPerSecond == 0 ? observed
                : unitsPerSecond * (1 - EMA_ALPHA) + observed * EMA_ALPHA;
    }

    public Instant getLastHealthCheck() {
        return lastHealthCheck;
    }

    /**
     * Records a health check result and updates the uptime ratio.
     */
    public void recordHealthCheck(Instant at, boolean healthy) {
        this.lastHealthCheck = at;
        healthChecks.incrementAndGet();
        if (healthy) {
            healthyChecks.incrementAndGet();
        }
    }

    /**
     * Fraction of health checks that passed, 1.0 before the first check.
     */
    public double getUptime() {
        long total = healthChecks.get();
        return total == 0 ? 1.0 : (double) healthyChecks.get() / total;
    }

    /**
     * Whether this instance may receive a request for {@code model}.
     */
    public boolean isSelectable(String model, int failoverThreshold) {
        return isActive()
                && supportsModel(model)
                && hasCapacity()
                && quota.isUsable()
                && consecutiveFailures.get() < failoverThreshold;
    }

    /**
     * Returns an immutable view of the current state.
     */
    public InstanceSnapshot snapshot() {
        return new InstanceSnapshot(
                id,
                provider.configName(),
                baseUrl.toString(),
                models,
                status.get(),
                priority,
                currentLoad.get(),
                maxConcurrent,
                queueSize.get(),
                averageLatencyMs,
                successRate,
                costPerUnit,
                unitsPerSecond,
                consecutiveFailures.get(),
                getUptime(),
                lastHealthCheck,
                region
        );
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AiInstance that = (AiInstance) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "AiInstance{" +
                "id='" + id + '\'' +
                ", provider=" + provider +
                ", status=" + status.get() +
                ", load=" + currentLoad.get() +
                "/" + maxConcurrent +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private ProviderFamily provider = ProviderFamily.LOCAL;
        private URI baseUrl;
        private final Set<String> models = new LinkedHashSet<>();
        private int priority = 5;
        private int maxConcurrent = 10;
        private QuotaLimits quota = QuotaLimits.UNLIMITED;
        private String region;
        private final Set<String> capabilities = new LinkedHashSet<>();
        private final Set<String> supportedFormats = new LinkedHashSet<>();
        private InstanceStatus initialStatus = InstanceStatus.ACTIVE;
        private double averageLatencyMs = 1000;
        private double successRate = 1.0;
        private double costPerUnit;
        private double unitsPerSecond;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder provider(ProviderFamily provider) {
            this.provider = provider;
            return this;
        }

        public Builder baseUrl(String url) {
            this.baseUrl = URI.create(url);
            return this;
        }

        public Builder baseUrl(URI url) {
            this.baseUrl = url;
            return this;
        }

        public Builder addModel(String model) {
            this.models.add(model);
            return this;
        }

        public Builder models(Set<String> models) {
            if (models != null) {
                this.models.addAll(models);
            }
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder maxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
            return this;
        }

        public Builder quota(QuotaLimits quota) {
            this.quota = quota != null ? quota : QuotaLimits.UNLIMITED;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder capabilities(Set<String> capabilities) {
            if (capabilities != null) {
                this.capabilities.addAll(capabilities);
            }
            return this;
        }

        public Builder supportedFormats(Set<String> formats) {
            if (formats != null) {
                this.supportedFormats.addAll(formats);
            }
            return this;
        }

        public Builder initialStatus(InstanceStatus status) {
            this.initialStatus = status;
            return this;
        }

        public Builder averageLatencyMs(double averageLatencyMs) {
            this.averageLatencyMs = averageLatencyMs;
            return this;
        }

        public Builder successRate(double successRate) {
            this.successRate = successRate;
            return this;
        }

        public Builder costPerUnit(double costPerUnit) {
            this.costPerUnit = costPerUnit;
            return this;
        }

        public Builder unitsPerSecond(double unitsPerSecond) {
            this.unitsPerSecond = unitsPerSecond;
            return this;
        }

        public AiInstance build() {
            return new AiInstance(this);
        }
    }
}
