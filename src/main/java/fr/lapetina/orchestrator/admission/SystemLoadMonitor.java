package fr.lapetina.orchestrator.admission;

import fr.lapetina.orchestrator.infrastructure.metrics.OutcomeWindow;
import fr.lapetina.orchestrator.infrastructure.scheduling.TickScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Derives a system load figure in [0, 1] from recent provider outcomes and turns it
 * into the factor applied to adaptive rate limits.
 *
 * <p>Load is the mean of the error rate, the average latency relative to 5 s and the total
 * cost relative to 10, each capped at 1. While load exceeds the threshold the factor equals
 * the adaptation factor; once load subsides the factor climbs linearly back to 1 over the
 * recovery time.
 */
public final class SystemLoadMonitor {

    private static final Logger log = LoggerFactory.getLogger(SystemLoadMonitor.class);

    static final double LATENCY_REFERENCE_MS = 5000.0;
    static final double COST_REFERENCE = 10.0;

    private final OutcomeWindow window;
    private final Clock clock;
    private final Duration refreshInterval;

    private volatile AdaptiveConfig config;
    private volatile double systemLoad;
    private volatile Double simulatedLoad;
    private volatile long lastOverloadMs = Long.MIN_VALUE;

    public SystemLoadMonitor(OutcomeWindow window, Clock clock, AdaptiveConfig config, Duration refreshInterval) {
        this.window = window;
        this.clock = clock;
        this.config = Objects.requireNonNull(config, "Adaptive config is required");
        this.refreshInterval = refreshInterval;
    }

    public SystemLoadMonitor(OutcomeWindow window, Clock clock, AdaptiveConfig config) {
        this(window, clock, config, Duration.ofSeconds(30));
    }

    public TickScheduler.Registration start(TickScheduler scheduler) {
        return scheduler.schedule("system-load", refreshInterval, this::refresh);
    }

    /**
     * Recomputes the load from the outcome window, or applies the simulated value when set.
     */
    public void refresh() {
        double load;
        Double simulated = simulatedLoad;
        if (simulated != null) {
            load = simulated;
        } else {
            OutcomeWindow.Summary summary = window.summarize();
            double latencyComponent = Math.min(1.0, summary.averageLatencyMs() / LATENCY_REFERENCE_MS);
            double costComponent = Math.min(1.0, summary.totalCost() / COST_REFERENCE);
            load = (summary.errorRate() + latencyComponent + costComponent) / 3.0;
        }
        setLoad(load);
        log.debug("System load refreshed: load={}, simulated={}", load, simulated != null);
    }

    private void setLoad(double load) {
        double previous = systemLoad;
        systemLoad = load;
        if (load > config.loadThreshold()) {
            lastOverloadMs = clock.millis();
            if (previous <= config.loadThreshold()) {
                log.warn("System overloaded, adaptive limits reduced: load={}, threshold={}, factor={}",
                        load, config.loadThreshold(), config.adaptationFactor());
            }
        } else if (previous > config.loadThreshold()) {
            log.info("System load back under threshold, limits recovering: load={}", load);
        }
    }

    /**
     * Factor to multiply adaptive limits by, in [adaptationFactor, 1].
     */
    public double loadFactor() {
        AdaptiveConfig current = config;
        if (!current.enabled()) {
            return 1.0;
        }
        long now = clock.millis();
        if (systemLoad > current.loadThreshold()) {
            lastOverloadMs = now;
            return current.adaptationFactor();
        }
        long overloadedAt = lastOverloadMs;
        if (overloadedAt == Long.MIN_VALUE || current.recoveryTimeMs() == 0) {
            return 1.0;
        }
        long elapsed = now - overloadedAt;
        if (elapsed >= current.recoveryTimeMs()) {
            return 1.0;
        }
        double progress = (double) elapsed / current.recoveryTimeMs();
        return current.adaptationFactor() + (1.0 - current.adaptationFactor()) * progress;
    }

    /**
     * Forces the load to a fixed value until {@link #clearSimulatedLoad()} is called.
     */
    public void simulateLoad(double load) {
        if (load < 0.0 || load > 1.0) {
            throw new IllegalArgumentException("Load must be in [0, 1]: " + load);
        }
        simulatedLoad = load;
        log.info("Simulated system load set: load={}", load);
        refresh();
    }

    public void clearSimulatedLoad() {
        simulatedLoad = null;
        refresh();
    }

    /**
     * Restores a load value from a snapshot.
     */
    public void restore(double load) {
        setLoad(Math.max(0.0, Math.min(1.0, load)));
    }

    public double getSystemLoad() {
        return systemLoad;
    }

    public AdaptiveConfig getConfig() {
        return config;
    }

    public void updateConfig(AdaptiveConfig newConfig) {
        this.config = Objects.requireNonNull(newConfig);
        log.info("Adaptive config updated: {}", newConfig);
    }
}
