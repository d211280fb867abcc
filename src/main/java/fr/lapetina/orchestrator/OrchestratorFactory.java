package fr.lapetina.orchestrator;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.orchestrator.admission.AdaptiveConfig;
import fr.lapetina.orchestrator.admission.AdmissionController;
import fr.lapetina.orchestrator.admission.ContentValidator;
import fr.lapetina.orchestrator.admission.RateLimitAlgorithm;
import fr.lapetina.orchestrator.admission.RateLimitRule;
import fr.lapetina.orchestrator.admission.SystemLoadMonitor;
import fr.lapetina.orchestrator.admission.TierLimit;
import fr.lapetina.orchestrator.admission.UserTier;
import fr.lapetina.orchestrator.cache.Fingerprinter;
import fr.lapetina.orchestrator.cache.ResponseCache;
import fr.lapetina.orchestrator.domain.model.AiInstance;
import fr.lapetina.orchestrator.domain.model.InstanceStatus;
import fr.lapetina.orchestrator.domain.model.ProviderFamily;
import fr.lapetina.orchestrator.domain.model.QuotaLimits;
import fr.lapetina.orchestrator.domain.model.RequestPriority;
import fr.lapetina.orchestrator.domain.provider.ProviderInvoker;
import fr.lapetina.orchestrator.domain.strategy.AdaptiveWeights;
import fr.lapetina.orchestrator.domain.strategy.SelectionStrategy;
import fr.lapetina.orchestrator.domain.strategy.SelectionStrategyType;
import fr.lapetina.orchestrator.domain.strategy.StrategyFactory;
import fr.lapetina.orchestrator.infrastructure.config.ConfigLoader;
import fr.lapetina.orchestrator.infrastructure.config.OrchestratorConfig;
import fr.lapetina.orchestrator.infrastructure.health.HealthProbe;
import fr.lapetina.orchestrator.infrastructure.health.InstanceHealthChecker;
import fr.lapetina.orchestrator.infrastructure.health.InstanceRegistry;
import fr.lapetina.orchestrator.infrastructure.http.HttpHealthProbe;
import fr.lapetina.orchestrator.infrastructure.http.HttpProviderInvoker;
import fr.lapetina.orchestrator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.orchestrator.infrastructure.metrics.OutcomeWindow;
import fr.lapetina.orchestrator.infrastructure.persistence.JsonFileSnapshotStore;
import fr.lapetina.orchestrator.infrastructure.persistence.SnapshotStore;
import fr.lapetina.orchestrator.infrastructure.scheduling.ExecutorTickScheduler;
import fr.lapetina.orchestrator.infrastructure.scheduling.TickScheduler;
import fr.lapetina.orchestrator.queue.ProviderTaskHandler;
import fr.lapetina.orchestrator.queue.TaskKind;
import fr.lapetina.orchestrator.queue.TaskQueue;
import fr.lapetina.orchestrator.queue.Worker;
import fr.lapetina.orchestrator.selection.InstanceSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Creates a fully-wired orchestrator from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (OrchestratorFactory factory = OrchestratorFactory.create("config.yaml").start()) {
 *     OrchestrationService service = factory.getService();
 *     // use service...
 * }
 * }</pre>
 */
public class OrchestratorFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorFactory.class);

    private final ConfigLoader configLoader;
    private final OrchestratorConfig config;
    private final Clock clock;
    private final TickScheduler scheduler;
    private final ObjectMapper objectMapper;
    private final MetricsRegistry metricsRegistry;
    private final InstanceRegistry instanceRegistry;
    private final InstanceSelector selector;
    private final HttpProviderInvoker httpInvoker;
    private final InstanceHealthChecker healthChecker;
    private final SystemLoadMonitor loadMonitor;
    private final AdmissionController admissionController;
    private final ResponseCache cache;
    private final TaskQueue taskQueue;
    private final SnapshotStore snapshotStore;
    private final OrchestrationService service;
    private final List<TickScheduler.Registration> registrations = new CopyOnWriteArrayList<>();

    protected OrchestratorFactory(String configPath, Overrides overrides) {
        log.info("Initializing OrchestratorFactory from config: {}", configPath);
        Overrides effective = overrides != null ? overrides : Overrides.NONE;

        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();

        this.clock = effective.clock() != null ? effective.clock() : Clock.systemUTC();
        this.scheduler = effective.scheduler() != null ? effective.scheduler() : new ExecutorTickScheduler();
        this.objectMapper = createObjectMapper();
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        this.instanceRegistry = new InstanceRegistry();
        instanceRegistry.addListener(this::onRegistryEvent);

        OrchestratorConfig.RateLimitConfig rateLimit = config.getRateLimit();
        OutcomeWindow outcomeWindow = new OutcomeWindow(clock, Duration.ofMillis(rateLimit.getOutcomeWindowMs()));

        SelectionStrategy strategy = createStrategy(config.getSelection());
        log.info("Using selection strategy: {}", strategy.getType().getConfigName());
        this.selector = new InstanceSelector(
                instanceRegistry,
                strategy,
                outcomeWindow,
                metricsRegistry,
                clock,
                config.getSelection().getFailoverThreshold(),
                toAdaptiveWeights(config.getSelection().getAdaptiveWeights())
        );

        HttpClient httpClient = null;
        if (effective.invoker() == null || effective.probe() == null) {
            httpClient = HttpClient.newBuilder()
                    .connectTimeout(Duration.ofMillis(config.getHttp().getConnectTimeoutMs()))
                    .version(HttpClient.Version.HTTP_1_1)
                    .build();
        }
        this.httpInvoker = effective.invoker() == null ? createInvoker(httpClient) : null;
        ProviderInvoker invoker = effective.invoker() != null ? effective.invoker() : httpInvoker;
        HealthProbe probe = effective.probe() != null
                ? effective.probe()
                : new HttpHealthProbe(httpClient, config.getHealthCheck().getPath(),
                        Duration.ofMillis(config.getHealthCheck().getTimeoutMs()));

        this.healthChecker = new InstanceHealthChecker(
                instanceRegistry,
                probe,
                clock,
                Duration.ofMillis(config.getHealthCheck().getIntervalMs()),
                Duration.ofMillis(config.getHealthCheck().getTimeoutMs()),
                config.getSelection().getFailoverThreshold()
        );

        this.loadMonitor = new SystemLoadMonitor(outcomeWindow, clock, toAdaptiveConfig(rateLimit.getAdaptive()),
                Duration.ofMillis(rateLimit.getLoadRefreshIntervalMs()));
        this.admissionController = new AdmissionController(
                toRules(rateLimit.getRules()),
                loadMonitor,
                metricsRegistry,
                clock,
                effective.contentValidator(),
                new AdmissionController.Settings(
                        rateLimit.getBlockAfterConsecutiveDenials(),
                        Duration.ofMillis(rateLimit.getStaleStateTtlMs()),
                        Duration.ofMillis(rateLimit.getCleanupIntervalMs()),
                        rateLimit.getMaxTrackedIdentities()
                )
        );

        this.cache = new ResponseCache(toCacheSettings(config.getCache()), objectMapper, metricsRegistry, clock);
        Fingerprinter fingerprinter = new Fingerprinter(objectMapper);
        ProviderTaskHandler providerHandler = new ProviderTaskHandler(
                selector,
                config.getCache().isEnabled() ? cache : null,
                invoker,
                fingerprinter,
                clock
        );

        this.taskQueue = new TaskQueue(toQueueSettings(config.getQueue()), metricsRegistry, clock);
        List<OrchestratorConfig.WorkerConfig> workers = config.getQueue().getWorkers().isEmpty()
                ? OrchestratorConfig.WorkerConfig.defaults()
                : config.getQueue().getWorkers();
        for (OrchestratorConfig.WorkerConfig workerConfig : workers) {
            taskQueue.addWorker(new Worker(
                    workerConfig.getId(),
                    workerConfig.getName(),
                    toKinds(workerConfig.getKinds()),
                    workerConfig.getMaxConcurrent(),
                    providerHandler
            ));
        }

        this.snapshotStore = config.getPersistence().isEnabled()
                ? new JsonFileSnapshotStore(Path.of(config.getPersistence().getPath()), objectMapper)
                : null;

        this.service = new OrchestrationService(
                instanceRegistry,
                selector,
                admissionController,
                cache,
                fingerprinter,
                taskQueue,
                providerHandler,
                snapshotStore,
                clock
        );

        loadInstances(config.getInstances());
        registerGauges();
        configLoader.addListener(this::onConfigChanged);

        log.info("OrchestratorFactory initialized with {} instances, {} rules, {} workers",
                instanceRegistry.size(), admissionController.getRules().size(), taskQueue.getWorkers().size());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static OrchestratorFactory create(String configPath) {
        return new OrchestratorFactory(configPath, null);
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static OrchestratorFactory create() {
        return create("config.yaml");
    }

    /**
     * Restores the last snapshot, then starts every periodic job.
     */
    public OrchestratorFactory start() {
        service.restoreSnapshot();

        if (config.getHealthCheck().isEnabled()) {
            healthChecker.start(scheduler);
        }
        registrations.add(loadMonitor.start(scheduler));
        registrations.add(admissionController.start(scheduler));
        registrations.add(cache.start(scheduler));
        if (snapshotStore != null) {
            registrations.add(scheduler.schedule("snapshot",
                    Duration.ofMillis(config.getPersistence().getSaveIntervalMs()), service::saveSnapshot));
        }
        taskQueue.start(scheduler);
        configLoader.startWatching();
        log.info("Orchestrator started");
        return this;
    }

    public OrchestrationService getService() {
        return service;
    }

    public InstanceRegistry getInstanceRegistry() {
        return instanceRegistry;
    }

    public InstanceHealthChecker getHealthChecker() {
        return healthChecker;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public OrchestratorConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    public TickScheduler getScheduler() {
        return scheduler;
    }

    public Clock getClock() {
        return clock;
    }

    static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    private HttpProviderInvoker createInvoker(HttpClient httpClient) {
        OrchestratorConfig.HttpConfig http = config.getHttp();
        return new HttpProviderInvoker(
                httpClient,
                objectMapper,
                clock,
                http.getInvokePath(),
                Duration.ofMillis(http.getRequestTimeoutMs()),
                http.getCircuitBreakerFailureThreshold(),
                Duration.ofMillis(http.getCircuitBreakerRecoveryMs())
        );
    }

    private void loadInstances(List<OrchestratorConfig.InstanceConfig> instanceConfigs) {
        List<AiInstance> instances = new ArrayList<>();
        for (OrchestratorConfig.InstanceConfig instanceConfig : instanceConfigs) {
            if (!instanceConfig.isEnabled()) {
                log.info("Skipping disabled instance: {}", instanceConfig.getId());
                continue;
            }
            instances.add(toInstance(instanceConfig));
        }
        instanceRegistry.replaceAll(instances);
    }

    static AiInstance toInstance(OrchestratorConfig.InstanceConfig instanceConfig) {
        return AiInstance.builder()
                .id(instanceConfig.getId())
                .provider(ProviderFamily.fromName(instanceConfig.getProvider()))
                .baseUrl(instanceConfig.getUrl())
                .models(instanceConfig.getModels())
                .priority(instanceConfig.getPriority())
                .maxConcurrent(instanceConfig.getMaxConcurrent())
                .costPerUnit(instanceConfig.getCostPerUnit())
                .averageLatencyMs(instanceConfig.getAverageLatencyMs())
                .quota(new QuotaLimits(instanceConfig.getRequestsPerMinute(),
                        instanceConfig.getUnitsPerMinute(), instanceConfig.getDailyLimit()))
                .region(instanceConfig.getRegion())
                .capabilities(instanceConfig.getCapabilities())
                .supportedFormats(instanceConfig.getSupportedFormats())
                .build();
    }

    static SelectionStrategy createStrategy(OrchestratorConfig.SelectionConfig selection) {
        return StrategyFactory.create(
                SelectionStrategyType.fromName(selection.getStrategy()),
                selection.getWeights(),
                toAdaptiveWeights(selection.getAdaptiveWeights())
        );
    }

    static AdaptiveWeights toAdaptiveWeights(OrchestratorConfig.AdaptiveWeightsConfig weights) {
        return new AdaptiveWeights(weights.getLatency(), weights.getCost(), weights.getSuccessRate(), weights.getCapacity());
    }

    static AdaptiveConfig toAdaptiveConfig(OrchestratorConfig.AdaptiveLimitConfig adaptive) {
        return new AdaptiveConfig(
                adaptive.isEnabled(),
                adaptive.getLoadThreshold(),
                adaptive.getAdaptationFactor(),
                adaptive.getRecoveryTimeMs(),
                adaptive.getMinLimit()
        );
    }

    static List<RateLimitRule> toRules(List<OrchestratorConfig.RuleConfig> ruleConfigs) {
        List<RateLimitRule> rules = new ArrayList<>();
        for (OrchestratorConfig.RuleConfig ruleConfig : ruleConfigs) {
            Map<UserTier, TierLimit> limits = new EnumMap<>(UserTier.class);
            ruleConfig.getLimits().forEach((tierName, limit) -> limits.put(
                    UserTier.fromName(tierName),
                    new TierLimit(limit.getWindowMs(), limit.getMaxRequests(), limit.getBurst(),
                            RateLimitAlgorithm.fromName(limit.getAlgorithm()))));
            rules.add(new RateLimitRule(
                    ruleConfig.getId(),
                    ruleConfig.getName(),
                    ruleConfig.getPattern(),
                    limits,
                    ruleConfig.getPriority(),
                    ruleConfig.isEnabled(),
                    new RateLimitRule.RuleMetadata(ruleConfig.getDescription(), ruleConfig.getCostPerRequest(),
                            ruleConfig.isComputeIntensive(), ruleConfig.getModel())
            ));
        }
        return rules;
    }

    static ResponseCache.Settings toCacheSettings(OrchestratorConfig.CacheConfig cacheConfig) {
        return new ResponseCache.Settings(
                Duration.ofSeconds(cacheConfig.getDefaultTtlSeconds()),
                cacheConfig.getTtlSeconds(),
                cacheConfig.getMaxEntries(),
                cacheConfig.getMaxSizeBytes(),
                cacheConfig.getEntryEvictionRatio(),
                cacheConfig.getSizeTargetRatio(),
                Duration.ofMillis(cacheConfig.getCleanupIntervalMs())
        );
    }

    static TaskQueue.Settings toQueueSettings(OrchestratorConfig.QueueConfig queueConfig) {
        Map<RequestPriority, Integer> weights = new EnumMap<>(RequestPriority.class);
        queueConfig.getPriorityWeights().forEach((name, weight) -> weights.put(RequestPriority.fromName(name), weight));
        return new TaskQueue.Settings(
                queueConfig.getMaxConcurrent(),
                queueConfig.getMaxQueueSize(),
                Duration.ofMillis(queueConfig.getDefaultTimeoutMs()),
                queueConfig.getDefaultMaxRetries(),
                Duration.ofMillis(queueConfig.getRetryBaseDelayMs()),
                Duration.ofMillis(queueConfig.getRetryMaxDelayMs()),
                queueConfig.isDeadLetterEnabled(),
                weights,
                Duration.ofMillis(queueConfig.getTickIntervalMs())
        );
    }

    static Set<TaskKind> toKinds(List<String> names) {
        if (names == null || names.isEmpty() || names.contains("*")) {
            return Set.of();
        }
        Set<TaskKind> kinds = EnumSet.noneOf(TaskKind.class);
        for (String name : names) {
            kinds.add(TaskKind.fromName(name));
        }
        return kinds;
    }

    private void registerGauges() {
        metricsRegistry.registerGauge("queue_depth", "Tasks waiting to run", taskQueue::depth);
        metricsRegistry.registerGauge("system_load", "Load driving adaptive rate limits", loadMonitor::getSystemLoad);
        metricsRegistry.registerGauge("cache_entries", "Entries in the response cache", cache::size);
    }

    private void onRegistryEvent(InstanceRegistry.RegistryEvent event) {
        String instanceId = event.instance().getId();
        switch (event.type()) {
            case ADDED -> metricsRegistry.registerInstanceGauges(
                    instanceId,
                    () -> instanceRegistry.get(instanceId).map(AiInstance::getCurrentLoad).orElse(0),
                    () -> instanceRegistry.get(instanceId).map(instance -> statusValue(instance.getStatus())).orElse(0));
            case REMOVED -> {
                metricsRegistry.removeInstanceMeters(instanceId);
                if (httpInvoker != null) {
                    httpInvoker.removeCircuitBreaker(instanceId);
                }
            }
            case UPDATED, STATUS_CHANGED -> {
                // gauges look the instance up by id
            }
        }
    }

    private static int statusValue(InstanceStatus status) {
        return switch (status) {
            case INACTIVE -> 0;
            case MAINTENANCE -> 1;
            case OVERLOADED -> 2;
            case ACTIVE -> 3;
        };
    }

    private void onConfigChanged(OrchestratorConfig oldConfig, OrchestratorConfig newConfig) {
        if (oldConfig == null) {
            return;
        }
        log.info("Configuration changed, applying updates...");

        loadInstances(newConfig.getInstances());

        if (!oldConfig.getSelection().getStrategy().equals(newConfig.getSelection().getStrategy())) {
            selector.setStrategy(createStrategy(newConfig.getSelection()));
        }

        List<RateLimitRule> newRules = toRules(newConfig.getRateLimit().getRules());
        Set<String> newRuleIds = new HashSet<>();
        for (RateLimitRule rule : newRules) {
            newRuleIds.add(rule.id());
            admissionController.addRule(rule);
        }
        for (RateLimitRule existing : admissionController.getRules()) {
            if (!newRuleIds.contains(existing.id())) {
                admissionController.removeRule(existing.id());
            }
        }
        admissionController.updateAdaptiveConfig(toAdaptiveConfig(newConfig.getRateLimit().getAdaptive()));

        log.info("Configuration updates applied");
    }

    @Override
    public void close() {
        log.info("Shutting down OrchestratorFactory...");

        try {
            taskQueue.stop();
            registrations.forEach(TickScheduler.Registration::cancel);
        } catch (Exception e) {
            log.warn("Error stopping periodic jobs", e);
        }

        try {
            healthChecker.close();
        } catch (Exception e) {
            log.warn("Error closing health checker", e);
        }

        service.saveSnapshot();

        try {
            scheduler.close();
        } catch (Exception e) {
            log.warn("Error closing scheduler", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        log.info("OrchestratorFactory shut down");
    }

    /**
     * Collaborators replacing the ones built from configuration; null fields keep the default.
     *
     * @param clock            time source
     * @param scheduler        drives periodic jobs
     * @param invoker          provider calls
     * @param probe            health checks
     * @param contentValidator content check before admission, none by default
     */
    public record Overrides(
            Clock clock,
            TickScheduler scheduler,
            ProviderInvoker invoker,
            HealthProbe probe,
            ContentValidator contentValidator
    ) {
        public static final Overrides NONE = new Overrides(null, null, null, null, null);
    }
}
