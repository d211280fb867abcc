package fr.lapetina.orchestrator.infrastructure.health;

import fr.lapetina.orchestrator.domain.model.AiInstance;
import fr.lapetina.orchestrator.domain.model.InstanceStatus;
import fr.lapetina.orchestrator.infrastructure.scheduling.TickScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic health checker for provider instances.
 *
 * A failed probe increments the instance's consecutive failures and deactivates it at the
 * failover threshold. A passing probe resets the failures, folds the probe latency into the
 * average and reactivates an {@code INACTIVE} instance. {@code MAINTENANCE} instances are not probed.
 */
public final class InstanceHealthChecker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InstanceHealthChecker.class);

    private final InstanceRegistry registry;
    private final HealthProbe probe;
    private final Clock clock;
    private final Duration checkInterval;
    private final Duration probeTimeout;
    private final int failoverThreshold;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile TickScheduler.Registration registration;

    public InstanceHealthChecker(
            InstanceRegistry registry,
            HealthProbe probe,
            Clock clock,
            Duration checkInterval,
            Duration probeTimeout,
            int failoverThreshold
    ) {
        this.registry = registry;
        this.probe = probe;
        this.clock = clock;
        this.checkInterval = checkInterval;
        this.probeTimeout = probeTimeout;
        this.failoverThreshold = failoverThreshold;
    }

    /**
     * Starts the periodic sweep on the given scheduler.
     */
    public void start(TickScheduler scheduler) {
        if (running.compareAndSet(false, true)) {
            registration = scheduler.schedule("health-check", checkInterval, this::checkAllInstances);
            log.info("Health checker started with interval: {}", checkInterval);
        }
    }

    /**
     * Probes every instance not under maintenance.
     */
    public void checkAllInstances() {
        var instances = registry.getAll();
        log.debug("Starting health check cycle: instanceCount={}", instances.size());

        for (AiInstance instance : instances) {
            if (instance.getStatus() != InstanceStatus.MAINTENANCE) {
                checkInstance(instance);
            }
        }
    }

    /**
     * Probes a single instance.
     */
    public CompletableFuture<Void> checkInstance(AiInstance instance) {
        log.debug("Health check started: instanceId={}, status={}, consecutiveFailures={}",
                instance.getId(), instance.getStatus(), instance.getConsecutiveFailures());

        long start = clock.millis();
        CompletableFuture<Boolean> result;
        try {
            result = probe.probe(instance).orTimeout(probeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (Exception e) {
            result = CompletableFuture.failedFuture(e);
        }

        return result.handle((healthy, ex) -> {
            long latency = clock.millis() - start;
            if (ex == null && Boolean.TRUE.equals(healthy)) {
                handleSuccess(instance, latency);
            } else {
                handleFailure(instance, ex);
            }
            return null;
        });
    }

    private void handleSuccess(AiInstance instance, long latencyMs) {
        instance.recordHealthCheck(clock.instant(), true);
        instance.resetFailures();
        instance.applyProbeLatency(latencyMs);
        log.debug("Health check passed: instanceId={}, latencyMs={}", instance.getId(), latencyMs);

        if (instance.getStatus() == InstanceStatus.INACTIVE) {
            log.info("Instance recovered: instanceId={}", instance.getId());
            registry.updateStatus(instance.getId(), InstanceStatus.ACTIVE);
        }
    }

    private void handleFailure(AiInstance instance, Throwable ex) {
        instance.recordHealthCheck(clock.instant(), false);
        int failures = instance.recordFailure();

        if (ex != null) {
            log.warn("Health check failed: instanceId={}, consecutiveFailures={}, error={}",
                    instance.getId(), failures, ex.getMessage());
        } else {
            log.warn("Health check returned unhealthy: instanceId={}, consecutiveFailures={}",
                    instance.getId(), failures);
        }

        if (failures >= failoverThreshold && instance.getStatus() != InstanceStatus.MAINTENANCE) {
            registry.updateStatus(instance.getId(), InstanceStatus.INACTIVE);
        }
    }

    /**
     * Probes one instance immediately.
     */
    public void forceCheck(String instanceId) {
        registry.get(instanceId).ifPresent(this::checkInstance);
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            TickScheduler.Registration current = registration;
            if (current != null) {
                current.cancel();
            }
            log.info("Health checker stopped");
        }
    }
}
