package fr.lapetina.orchestrator.infrastructure.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Root configuration object for the orchestrator.
 * Designed to be populated from YAML; every value has a default.
 */
public class OrchestratorConfig {

    private ServerConfig server = new ServerConfig();
    private List<InstanceConfig> instances = new ArrayList<>();
    private SelectionConfig selection = new SelectionConfig();
    private HealthCheckConfig healthCheck = new HealthCheckConfig();
    private HttpConfig http = new HttpConfig();
    private RateLimitConfig rateLimit = new RateLimitConfig();
    private CacheConfig cache = new CacheConfig();
    private QueueConfig queue = new QueueConfig();
    private PersistenceConfig persistence = new PersistenceConfig();
    private MetricsConfig metrics = new MetricsConfig();

    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public List<InstanceConfig> getInstances() { return instances; }
    public void setInstances(List<InstanceConfig> instances) { this.instances = instances; }

    public SelectionConfig getSelection() { return selection; }
    public void setSelection(SelectionConfig selection) { this.selection = selection; }

    public HealthCheckConfig getHealthCheck() { return healthCheck; }
    public void setHealthCheck(HealthCheckConfig healthCheck) { this.healthCheck = healthCheck; }

    public HttpConfig getHttp() { return http; }
    public void setHttp(HttpConfig http) { this.http = http; }

    public RateLimitConfig getRateLimit() { return rateLimit; }
    public void setRateLimit(RateLimitConfig rateLimit) { this.rateLimit = rateLimit; }

    public CacheConfig getCache() { return cache; }
    public void setCache(CacheConfig cache) { this.cache = cache; }

    public QueueConfig getQueue() { return queue; }
    public void setQueue(QueueConfig queue) { this.queue = queue; }

    public PersistenceConfig getPersistence() { return persistence; }
    public void setPersistence(PersistenceConfig persistence) { this.persistence = persistence; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Admin HTTP server.
     */
    public static class ServerConfig {
        private boolean enabled = true;
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }
    }

    /**
     * One provider instance.
     */
    public static class InstanceConfig {
        private String id;
        private String provider = "local";
        private String url;
        private Set<String> models = new LinkedHashSet<>();
        private int priority = 5;
        private int maxConcurrent = 10;
        private double costPerUnit = 0.0;
        private double averageLatencyMs = 1000;
        private int requestsPerMinute = Integer.MAX_VALUE;
        private long unitsPerMinute = Long.MAX_VALUE;
        private long dailyLimit = Long.MAX_VALUE;
        private String region;
        private Set<String> capabilities = new LinkedHashSet<>();
        private Set<String> supportedFormats = new LinkedHashSet<>();
        private boolean enabled = true;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public Set<String> getModels() { return models; }
        public void setModels(Set<String> models) { this.models = models; }

        public int getPriority() { return priority; }
        public void setPriority(int priority) { this.priority = priority; }

        public int getMaxConcurrent() { return maxConcurrent; }
        public void setMaxConcurrent(int maxConcurrent) { this.maxConcurrent = maxConcurrent; }

        public double getCostPerUnit() { return costPerUnit; }
        public void setCostPerUnit(double costPerUnit) { this.costPerUnit = costPerUnit; }

        public double getAverageLatencyMs() { return averageLatencyMs; }
        public void setAverageLatencyMs(double averageLatencyMs) { this.averageLatencyMs = averageLatencyMs; }

        public int getRequestsPerMinute() { return requestsPerMinute; }
        public void setRequestsPerMinute(int requestsPerMinute) { this.requestsPerMinute = requestsPerMinute; }

        public long getUnitsPerMinute() { return unitsPerMinute; }
        public void setUnitsPerMinute(long unitsPerMinute) { this.unitsPerMinute = unitsPerMinute; }

        public long getDailyLimit() { return dailyLimit; }
        public void setDailyLimit(long dailyLimit) { this.dailyLimit = dailyLimit; }

        public String getRegion() { return region; }
        public void setRegion(String region) { this.region = region; }

        public Set<String> getCapabilities() { return capabilities; }
        public void setCapabilities(Set<String> capabilities) { this.capabilities = capabilities; }

        public Set<String> getSupportedFormats() { return supportedFormats; }
        public void setSupportedFormats(Set<String> supportedFormats) { this.supportedFormats = supportedFormats; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    /**
     * Instance selection.
     */
    public static class SelectionConfig {
        private String strategy = "adaptive";
        private int failoverThreshold = 3;
        private Map<String, Integer> weights = new LinkedHashMap<>();
        private AdaptiveWeightsConfig adaptiveWeights = new AdaptiveWeightsConfig();

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }

        public int getFailoverThreshold() { return failoverThreshold; }
        public void setFailoverThreshold(int failoverThreshold) { this.failoverThreshold = failoverThreshold; }

        /**
         * Per-instance weights for weighted round-robin, overriding instance priority.
         */
        public Map<String, Integer> getWeights() { return weights; }
        public void setWeights(Map<String, Integer> weights) { this.weights = weights; }

        public AdaptiveWeightsConfig getAdaptiveWeights() { return adaptiveWeights; }
        public void setAdaptiveWeights(AdaptiveWeightsConfig adaptiveWeights) { this.adaptiveWeights = adaptiveWeights; }
    }

    /**
     * Component weights of the adaptive score.
     */
    public static class AdaptiveWeightsConfig {
        private double latency = 0.3;
        private double cost = 0.2;
        private double successRate = 0.3;
        private double capacity = 0.2;

        public double getLatency() { return latency; }
        public void setLatency(double latency) { this.latency = latency; }

        public double getCost() { return cost; }
        public void setCost(double cost) { this.cost = cost; }

        public double getSuccessRate() { return successRate; }
        public void setSuccessRate(double successRate) { this.successRate = successRate; }

        public double getCapacity() { return capacity; }
        public void setCapacity(double capacity) { this.capacity = capacity; }
    }

    /**
     * Periodic instance probing.
     */
    public static class HealthCheckConfig {
        private boolean enabled = true;
        private long intervalMs = 30000;
        private long timeoutMs = 5000;
        private String path = "/health";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
    }

    /**
     * Outbound HTTP calls to providers.
     */
    public static class HttpConfig {
        private long connectTimeoutMs = 10000;
        private long requestTimeoutMs = 60000;
        private String invokePath = "/v1/invoke";
        private int circuitBreakerFailureThreshold = 5;
        private long circuitBreakerRecoveryMs = 30000;

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public String getInvokePath() { return invokePath; }
        public void setInvokePath(String invokePath) { this.invokePath = invokePath; }

        public int getCircuitBreakerFailureThreshold() { return circuitBreakerFailureThreshold; }
        public void setCircuitBreakerFailureThreshold(int threshold) { this.circuitBreakerFailureThreshold = threshold; }

        public long getCircuitBreakerRecoveryMs() { return circuitBreakerRecoveryMs; }
        public void setCircuitBreakerRecoveryMs(long ms) { this.circuitBreakerRecoveryMs = ms; }
    }

    /**
     * Admission control.
     */
    public static class RateLimitConfig {
        private List<RuleConfig> rules = new ArrayList<>();
        private AdaptiveLimitConfig adaptive = new AdaptiveLimitConfig();
        private int blockAfterConsecutiveDenials = 3;
        private long staleStateTtlMs = 86_400_000;
        private long cleanupIntervalMs = 3_600_000;
        private int maxTrackedIdentities = 1000;
        private long loadRefreshIntervalMs = 30000;
        private long outcomeWindowMs = 300_000;

        public List<RuleConfig> getRules() { return rules; }
        public void setRules(List<RuleConfig> rules) { this.rules = rules; }

        public AdaptiveLimitConfig getAdaptive() { return adaptive; }
        public void setAdaptive(AdaptiveLimitConfig adaptive) { this.adaptive = adaptive; }

        public int getBlockAfterConsecutiveDenials() { return blockAfterConsecutiveDenials; }
        public void setBlockAfterConsecutiveDenials(int count) { this.blockAfterConsecutiveDenials = count; }

        public long getStaleStateTtlMs() { return staleStateTtlMs; }
        public void setStaleStateTtlMs(long staleStateTtlMs) { this.staleStateTtlMs = staleStateTtlMs; }

        public long getCleanupIntervalMs() { return cleanupIntervalMs; }
        public void setCleanupIntervalMs(long cleanupIntervalMs) { this.cleanupIntervalMs = cleanupIntervalMs; }

        public int getMaxTrackedIdentities() { return maxTrackedIdentities; }
        public void setMaxTrackedIdentities(int maxTrackedIdentities) { this.maxTrackedIdentities = maxTrackedIdentities; }

        public long getLoadRefreshIntervalMs() { return loadRefreshIntervalMs; }
        public void setLoadRefreshIntervalMs(long ms) { this.loadRefreshIntervalMs = ms; }

        public long getOutcomeWindowMs() { return outcomeWindowMs; }
        public void setOutcomeWindowMs(long outcomeWindowMs) { this.outcomeWindowMs = outcomeWindowMs; }
    }

    /**
     * One rate-limit rule. {@code limits} is keyed by tier name.
     */
    public static class RuleConfig {
        private String id;
        private String name;
        private String pattern;
        private int priority = 10;
        private boolean enabled = true;
        private Map<String, TierLimitConfig> limits = new LinkedHashMap<>();
        private String description;
        private double costPerRequest;
        private boolean computeIntensive;
        private String model;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getPattern() { return pattern; }
        public void setPattern(String pattern) { this.pattern = pattern; }

        public int getPriority() { return priority; }
        public void setPriority(int priority) { this.priority = priority; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Map<String, TierLimitConfig> getLimits() { return limits; }
        public void setLimits(Map<String, TierLimitConfig> limits) { this.limits = limits; }

        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }

        public double getCostPerRequest() { return costPerRequest; }
        public void setCostPerRequest(double costPerRequest) { this.costPerRequest = costPerRequest; }

        public boolean isComputeIntensive() { return computeIntensive; }
        public void setComputeIntensive(boolean computeIntensive) { this.computeIntensive = computeIntensive; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
    }

    /**
     * Limit of one tier under one rule.
     */
    public static class TierLimitConfig {
        private long windowMs = 60000;
        private int maxRequests = 60;
        private Integer burst;
        private String algorithm = "sliding_window";

        public long getWindowMs() { return windowMs; }
        public void setWindowMs(long windowMs) { this.windowMs = windowMs; }

        public int getMaxRequests() { return maxRequests; }
        public void setMaxRequests(int maxRequests) { this.maxRequests = maxRequests; }

        public Integer getBurst() { return burst; }
        public void setBurst(Integer burst) { this.burst = burst; }

        public String getAlgorithm() { return algorithm; }
        public void setAlgorithm(String algorithm) { this.algorithm = algorithm; }
    }

    /**
     * Load-driven limit shrinking for adaptive rules.
     */
    public static class AdaptiveLimitConfig {
        private boolean enabled = true;
        private double loadThreshold = 0.8;
        private double adaptationFactor = 0.5;
        private long recoveryTimeMs = 300000;
        private int minLimit = 10;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public double getLoadThreshold() { return loadThreshold; }
        public void setLoadThreshold(double loadThreshold) { this.loadThreshold = loadThreshold; }

        public double getAdaptationFactor() { return adaptationFactor; }
        public void setAdaptationFactor(double adaptationFactor) { this.adaptationFactor = adaptationFactor; }

        public long getRecoveryTimeMs() { return recoveryTimeMs; }
        public void setRecoveryTimeMs(long recoveryTimeMs) { this.recoveryTimeMs = recoveryTimeMs; }

        public int getMinLimit() { return minLimit; }
        public void setMinLimit(int minLimit) { this.minLimit = minLimit; }
    }

    /**
     * Response cache.
     */
    public static class CacheConfig {
        private boolean enabled = true;
        private long defaultTtlSeconds = 3600;
        private Map<String, Integer> ttlSeconds = new LinkedHashMap<>(Map.of(
                "chat", 3600,
                "embeddings", 86400,
                "transcription", 86400,
                "image_generation", 604800,
                "analysis", 3600));
        private int maxEntries = 10000;
        private long maxSizeBytes = 100L * 1024 * 1024;
        private double entryEvictionRatio = 0.1;
        private double sizeTargetRatio = 0.8;
        private long cleanupIntervalMs = 300000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getDefaultTtlSeconds() { return defaultTtlSeconds; }
        public void setDefaultTtlSeconds(long defaultTtlSeconds) { this.defaultTtlSeconds = defaultTtlSeconds; }

        /**
         * TTL in seconds keyed by content type.
         */
        public Map<String, Integer> getTtlSeconds() { return ttlSeconds; }
        public void setTtlSeconds(Map<String, Integer> ttlSeconds) { this.ttlSeconds = ttlSeconds; }

        public int getMaxEntries() { return maxEntries; }
        public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }

        public long getMaxSizeBytes() { return maxSizeBytes; }
        public void setMaxSizeBytes(long maxSizeBytes) { this.maxSizeBytes = maxSizeBytes; }

        public double getEntryEvictionRatio() { return entryEvictionRatio; }
        public void setEntryEvictionRatio(double entryEvictionRatio) { this.entryEvictionRatio = entryEvictionRatio; }

        public double getSizeTargetRatio() { return sizeTargetRatio; }
        public void setSizeTargetRatio(double sizeTargetRatio) { this.sizeTargetRatio = sizeTargetRatio; }

        public long getCleanupIntervalMs() { return cleanupIntervalMs; }
        public void setCleanupIntervalMs(long cleanupIntervalMs) { this.cleanupIntervalMs = cleanupIntervalMs; }
    }

    /**
     * Task queue and its workers. An empty worker list gets the default workers.
     */
    public static class QueueConfig {
        private int maxConcurrent = 5;
        private int maxQueueSize = 1000;
        private long defaultTimeoutMs = 300000;
        private int defaultMaxRetries = 3;
        private long retryBaseDelayMs = 1000;
        private long retryMaxDelayMs = 60000;
        private boolean deadLetterEnabled = true;
        private long tickIntervalMs = 1000;
        private Map<String, Integer> priorityWeights = new LinkedHashMap<>();
        private List<WorkerConfig> workers = new ArrayList<>();

        public int getMaxConcurrent() { return maxConcurrent; }
        public void setMaxConcurrent(int maxConcurrent) { this.maxConcurrent = maxConcurrent; }

        public int getMaxQueueSize() { return maxQueueSize; }
        public void setMaxQueueSize(int maxQueueSize) { this.maxQueueSize = maxQueueSize; }

        public long getDefaultTimeoutMs() { return defaultTimeoutMs; }
        public void setDefaultTimeoutMs(long defaultTimeoutMs) { this.defaultTimeoutMs = defaultTimeoutMs; }

        public int getDefaultMaxRetries() { return defaultMaxRetries; }
        public void setDefaultMaxRetries(int defaultMaxRetries) { this.defaultMaxRetries = defaultMaxRetries; }

        public long getRetryBaseDelayMs() { return retryBaseDelayMs; }
        public void setRetryBaseDelayMs(long retryBaseDelayMs) { this.retryBaseDelayMs = retryBaseDelayMs; }

        public long getRetryMaxDelayMs() { return retryMaxDelayMs; }
        public void setRetryMaxDelayMs(long retryMaxDelayMs) { this.retryMaxDelayMs = retryMaxDelayMs; }

        public boolean isDeadLetterEnabled() { return deadLetterEnabled; }
        public void setDeadLetterEnabled(boolean deadLetterEnabled) { this.deadLetterEnabled = deadLetterEnabled; }

        public long getTickIntervalMs() { return tickIntervalMs; }
        public void setTickIntervalMs(long tickIntervalMs) { this.tickIntervalMs = tickIntervalMs; }

        /**
         * Dispatch weight keyed by priority name.
         */
        public Map<String, Integer> getPriorityWeights() { return priorityWeights; }
        public void setPriorityWeights(Map<String, Integer> priorityWeights) { this.priorityWeights = priorityWeights; }

        public List<WorkerConfig> getWorkers() { return workers; }
        public void setWorkers(List<WorkerConfig> workers) { this.workers = workers; }
    }

    /**
     * One worker. An empty kind list, or {@code *}, accepts every kind.
     */
    public static class WorkerConfig {
        private String id;
        private String name;
        private List<String> kinds = new ArrayList<>();
        private int maxConcurrent = 1;

        public WorkerConfig() {
        }

        public WorkerConfig(String id, String name, List<String> kinds, int maxConcurrent) {
            this.id = id;
            this.name = name;
            this.kinds = new ArrayList<>(kinds);
            this.maxConcurrent = maxConcurrent;
        }

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public List<String> getKinds() { return kinds; }
        public void setKinds(List<String> kinds) { this.kinds = kinds; }

        public int getMaxConcurrent() { return maxConcurrent; }
        public void setMaxConcurrent(int maxConcurrent) { this.maxConcurrent = maxConcurrent; }

        public static List<WorkerConfig> defaults() {
            return List.of(
                    new WorkerConfig("chat-worker", "Chat worker", List.of("chat"), 3),
                    new WorkerConfig("image-worker", "Image worker", List.of("image_generation"), 1),
                    new WorkerConfig("analysis-worker", "Analysis worker",
                            List.of("analysis", "embeddings", "transcription"), 2),
                    new WorkerConfig("custom-worker", "Custom worker", List.of("*"), 1)
            );
        }
    }

    /**
     * Snapshot persistence.
     */
    public static class PersistenceConfig {
        private boolean enabled = true;
        private String path = "data/orchestrator-snapshot.json";
        private long saveIntervalMs = 60000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }

        public long getSaveIntervalMs() { return saveIntervalMs; }
        public void setSaveIntervalMs(long saveIntervalMs) { this.saveIntervalMs = saveIntervalMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "orchestrator";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
