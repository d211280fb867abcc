package fr.lapetina.orchestrator.selection;

import fr.lapetina.orchestrator.domain.exception.NoCompatibleInstanceException;
import fr.lapetina.orchestrator.domain.model.AiInstance;
import fr.lapetina.orchestrator.domain.model.InstanceStatus;
import fr.lapetina.orchestrator.domain.model.PerformanceSample;
import fr.lapetina.orchestrator.domain.model.RequestContext;
import fr.lapetina.orchestrator.domain.model.SelectionResult;
import fr.lapetina.orchestrator.domain.strategy.AdaptiveWeights;
import fr.lapetina.orchestrator.domain.strategy.InstanceScoring;
import fr.lapetina.orchestrator.domain.strategy.SelectionStrategy;
import fr.lapetina.orchestrator.infrastructure.health.InstanceRegistry;
import fr.lapetina.orchestrator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.orchestrator.infrastructure.metrics.OutcomeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Chooses the instance for a request and learns from call outcomes.
 *
 * Only instances that are active, support the model, have spare capacity, a usable quota
 * and fewer consecutive failures than the failover threshold are considered.
 */
public final class InstanceSelector {

    private static final Logger log = LoggerFactory.getLogger(InstanceSelector.class);

    static final int HISTORY_CAPACITY = 100;
    static final int ROLLING_WINDOW = 10;
    static final int STATS_HISTORY = 20;
    private static final int MAX_FALLBACKS = 2;

    private final InstanceRegistry registry;
    private final OutcomeWindow outcomeWindow;
    private final MetricsRegistry metrics;
    private final Clock clock;
    private final int failoverThreshold;
    private final AdaptiveWeights adaptiveWeights;
    private final PerformanceHistory history = new PerformanceHistory(HISTORY_CAPACITY);
    private final AtomicReference<SelectionStrategy> strategy;

    public InstanceSelector(
            InstanceRegistry registry,
            SelectionStrategy strategy,
            OutcomeWindow outcomeWindow,
            MetricsRegistry metrics,
            Clock clock,
            int failoverThreshold,
            AdaptiveWeights adaptiveWeights
    ) {
        this.registry = Objects.requireNonNull(registry, "Registry is required");
        this.strategy = new AtomicReference<>(Objects.requireNonNull(strategy, "Strategy is required"));
        this.outcomeWindow = outcomeWindow;
        this.metrics = metrics;
        this.clock = clock;
        this.failoverThreshold = failoverThreshold;
        this.adaptiveWeights = adaptiveWeights != null ? adaptiveWeights : AdaptiveWeights.DEFAULT;

        registry.addListener(event -> {
            if (event.type() == InstanceRegistry.RegistryEvent.Type.REMOVED) {
                history.remove(event.instance().getId());
            }
        });
    }

    /**
     * Selects an instance for the request.
     *
     * @throws NoCompatibleInstanceException if no instance can serve the model right now
     */
    public SelectionResult select(RequestContext context) {
        long startNanos = System.nanoTime();
        SelectionStrategy current = strategy.get();

        List<AiInstance> candidates = registry.getSelectable(context.model(), failoverThreshold);
        AiInstance chosen = current.select(candidates, context).orElse(null);
        if (chosen == null) {
            log.warn("No compatible instance: model={}, registered={}", context.model(), registry.size());
            if (metrics != null) {
                metrics.incrementSelectionFailure(context.model());
            }
            throw new NoCompatibleInstanceException(context.model());
        }

        List<AiInstance> fallbacks = candidates.stream()
                .filter(candidate -> !candidate.equals(chosen))
                .sorted(Comparator.comparingDouble(
                                (AiInstance candidate) -> InstanceScoring.adaptiveScore(candidate, context, adaptiveWeights))
                        .reversed()
                        .thenComparing(AiInstance::getId))
                .limit(MAX_FALLBACKS)
                .toList();

        double estimatedLatency = InstanceScoring.estimateLatency(chosen, context);
        double estimatedCost = InstanceScoring.estimateCost(chosen, context);
        double confidence = confidence(chosen);
        String reason = String.format("strategy=%s, candidates=%d, estimatedLatencyMs=%.0f, estimatedCost=%.6f",
                current.getType().getConfigName(), candidates.size(), estimatedLatency, estimatedCost);

        if (metrics != null) {
            metrics.recordSelectionLatency(current.getType().getConfigName(), Duration.ofNanos(System.nanoTime() - startNanos));
        }
        log.debug("Instance selected: instanceId={}, model={}, priority={}, confidence={}, fallbacks={}",
                chosen.getId(), context.model(), context.priority(), confidence, fallbacks.size());

        return new SelectionResult(chosen, estimatedLatency, estimatedCost, confidence, fallbacks, reason);
    }

    /**
     * Records the outcome of a provider call: rolling averages, failure count,
     * history and the system load window.
     */
    public void recordOutcome(String instanceId, long latencyMs, boolean success, double cost) {
        if (outcomeWindow != null) {
            outcomeWindow.record(latencyMs, success, cost);
        }

        Optional<AiInstance> found = registry.get(instanceId);
        if (found.isEmpty()) {
            log.debug("Outcome for unknown instance ignored: instanceId={}", instanceId);
            return;
        }
        AiInstance instance = found.get();

        instance.applyOutcome(latencyMs, success);
        history.append(instanceId, new PerformanceSample(clock.instant(), latencyMs, success, cost));

        if (success) {
            instance.resetFailures();
        } else {
            int failures = instance.recordFailure();
            if (failures >= failoverThreshold && instance.getStatus() == InstanceStatus.ACTIVE) {
                log.warn("Instance deactivated after consecutive failures: instanceId={}, failures={}",
                        instanceId, failures);
                registry.updateStatus(instanceId, InstanceStatus.INACTIVE);
            }
        }

        if (metrics != null) {
            metrics.incrementProviderCall(instanceId, success);
        }
        log.debug("Outcome recorded: instanceId={}, latencyMs={}, success={}, cost={}, averageLatencyMs={}, successRate={}",
                instanceId, latencyMs, success, cost, instance.getAverageLatencyMs(), instance.getSuccessRate());
    }

    /**
     * Applies a load delta to an instance, clamped to its capacity.
     */
    public void updateLoad(String instanceId, int delta) {
        registry.get(instanceId).ifPresent(instance -> instance.adjustLoad(delta));
    }

    /**
     * Takes one slot on the instance.
     *
     * @return false if the instance is unknown or full
     */
    public boolean acquire(String instanceId) {
        return registry.get(instanceId).map(AiInstance::tryAcquireSlot).orElse(false);
    }

    public void release(String instanceId) {
        registry.get(instanceId).ifPresent(AiInstance::releaseSlot);
    }

    /**
     * How likely the instance is to serve the request well, in [0, 1].
     */
    public double confidence(AiInstance instance) {
        double confidence = instance.getSuccessRate() * Math.max(0.5, 1.0 - instance.getLoadRatio());

        int failures = instance.getConsecutiveFailures();
        if (failures > 0) {
            confidence *= Math.max(0.3, 1.0 - failures / 10.0);
        }

        if (history.size(instance.getId()) >= ROLLING_WINDOW) {
            List<PerformanceSample> recent = history.recent(instance.getId(), ROLLING_WINDOW);
            double rolling = recent.stream().filter(PerformanceSample::success).count() / (double) recent.size();
            confidence = (confidence + rolling) / 2.0;
        }

        return Math.max(0.0, Math.min(1.0, confidence));
    }

    public Optional<InstanceStats> getInstanceStats(String instanceId) {
        return registry.get(instanceId).map(this::statsOf);
    }

    public List<InstanceStats> getAllInstanceStats() {
        return registry.getAll().stream().map(this::statsOf).toList();
    }

    private InstanceStats statsOf(AiInstance instance) {
        RequestContext neutral = RequestContext.forModel("*", 1000);
        return new InstanceStats(
                instance.snapshot(),
                history.recent(instance.getId(), STATS_HISTORY),
                InstanceScoring.adaptiveScore(instance, neutral, adaptiveWeights)
        );
    }

    public SelectionStrategy getStrategy() {
        return strategy.get();
    }

    /**
     * Switches the selection strategy at runtime.
     */
    public void setStrategy(SelectionStrategy newStrategy) {
        SelectionStrategy old = strategy.getAndSet(Objects.requireNonNull(newStrategy));
        log.info("Selection strategy changed: {} -> {}", old.getType(), newStrategy.getType());
    }

    public int getFailoverThreshold() {
        return failoverThreshold;
    }

    public InstanceRegistry getRegistry() {
        return registry;
    }
}
