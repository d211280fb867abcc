package fr.lapetina.orchestrator.infrastructure.metrics;

import fr.lapetina.orchestrator.domain.model.ErrorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Task counters and execution timers per kind
 * - Admission decisions per rule and tier
 * - Cache hit, miss and eviction counters
 * - Selection latency and failures
 * - Queue, load and per-instance gauges
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;
    private final JvmGcMetrics gcMetrics;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> taskCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> taskTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> admissionCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> cacheCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> selectionTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> selectionFailures = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> providerCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        this.gcMetrics = new JvmGcMetrics();
        gcMetrics.bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("orchestrator");
    }

    /**
     * Counts a task reaching a lifecycle state.
     */
    public void incrementTaskCount(String kind, String status) {
        String key = kind + ":" + status;
        taskCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_tasks_total")
                        .description("Tasks by kind and lifecycle state")
                        .tag("kind", kind)
                        .tag("status", status)
                        .register(registry)
        ).increment();
    }

    /**
     * Records how long a task attempt ran.
     */
    public void recordTaskDuration(String kind, Duration duration) {
        taskTimers.computeIfAbsent(kind, k ->
                Timer.builder(prefix + "_task_execution")
                        .description("Task execution time")
                        .tag("kind", kind)
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(duration);
    }

    /**
     * Counts an admission decision.
     */
    public void incrementAdmission(String ruleId, String tier, boolean allowed) {
        String outcome = allowed ? "allowed" : "denied";
        String key = ruleId + ":" + tier + ":" + outcome;
        admissionCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_admissions_total")
                        .description("Admission decisions")
                        .tag("rule", ruleId)
                        .tag("tier", tier)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Counts a cache lookup or eviction; {@code result} is hit, miss, expired or evicted.
     */
    public void incrementCache(String result, int amount) {
        cacheCounters.computeIfAbsent(result, k ->
                Counter.builder(prefix + "_cache_operations_total")
                        .description("Response cache operations")
                        .tag("result", result)
                        .register(registry)
        ).increment(amount);
    }

    /**
     * Records the time spent selecting an instance.
     */
    public void recordSelectionLatency(String strategy, Duration latency) {
        selectionTimers.computeIfAbsent(strategy, k ->
                Timer.builder(prefix + "_selection_latency")
                        .description("Instance selection latency")
                        .tag("strategy", strategy)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Counts a selection that found no compatible instance.
     */
    public void incrementSelectionFailure(String model) {
        selectionFailures.computeIfAbsent(model, k ->
                Counter.builder(prefix + "_selection_failures_total")
                        .description("Selections without a compatible instance")
                        .tag("model", model)
                        .register(registry)
        ).increment();
    }

    /**
     * Counts a provider call outcome.
     */
    public void incrementProviderCall(String instanceId, boolean success) {
        String outcome = success ? "success" : "failure";
        String key = instanceId + ":" + outcome;
        providerCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_provider_calls_total")
                        .description("Provider calls by instance and outcome")
                        .tag("instance", instanceId)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Increments error counter.
     */
    public void incrementErrorCount(ErrorType errorType) {
        errorCounters.computeIfAbsent(errorType.name(), k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of errors")
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Registers a global gauge such as queue depth or system load.
     */
    public void registerGauge(String name, String description, Supplier<Number> valueSupplier) {
        Gauge.builder(prefix + "_" + name, valueSupplier)
                .description(description)
                .register(registry);
    }

    /**
     * Registers load and status gauges for an instance.
     */
    public void registerInstanceGauges(String instanceId, Supplier<Number> load, Supplier<Number> status) {
        Gauge.builder(prefix + "_instance_load", load)
                .description("Concurrent requests per instance")
                .tag("instance", instanceId)
                .register(registry);
        Gauge.builder(prefix + "_instance_status", status)
                .description("Instance status (0=INACTIVE, 1=MAINTENANCE, 2=OVERLOADED, 3=ACTIVE)")
                .tag("instance", instanceId)
                .register(registry);
    }

    /**
     * Removes every meter tagged with the instance id.
     */
    public void removeInstanceMeters(String instanceId) {
        List<Meter> meters = new ArrayList<>(registry.find(prefix + "_instance_load").tag("instance", instanceId).meters());
        meters.addAll(registry.find(prefix + "_instance_status").tag("instance", instanceId).meters());
        meters.forEach(registry::remove);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        gcMetrics.close();
        registry.close();
    }
}
