package fr.lapetina.orchestrator.infrastructure.health;

import fr.lapetina.orchestrator.domain.model.AiInstance;
import fr.lapetina.orchestrator.domain.model.InstanceStatus;
import fr.lapetina.orchestrator.support.ManualTickScheduler;
import fr.lapetina.orchestrator.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;

class InstanceHealthCheckerTest {

    private InstanceRegistry registry;
    private Set<String> unhealthy;
    private Set<String> probed;
    private InstanceHealthChecker checker;

    @BeforeEach
    void setUp() {
        registry = new InstanceRegistry();
        unhealthy = ConcurrentHashMap.newKeySet();
        probed = new HashSet<>();
        HealthProbe probe = instance -> {
            probed.add(instance.getId());
            return CompletableFuture.completedFuture(!unhealthy.contains(instance.getId()));
        };
        checker = new InstanceHealthChecker(registry, probe, new MutableClock(),
                Duration.ofSeconds(30), Duration.ofSeconds(5), 3);

        registry.register(AiInstance.builder().id("a").baseUrl("http://localhost:1").addModel("gpt-4").build());
        registry.register(AiInstance.builder().id("b").baseUrl("http://localhost:2").addModel("gpt-4").build());
    }

    @Test
    @DisplayName("should deactivate an instance after threshold failed probes")
    void shouldDeactivateAfterThresholdFailures() {
        unhealthy.add("a");

        checker.checkAllInstances();
        checker.checkAllInstances();
        assertThat(registry.get("a").orElseThrow().getStatus()).isEqualTo(InstanceStatus.ACTIVE);

        checker.checkAllInstances();

        AiInstance a = registry.get("a").orElseThrow();
        assertThat(a.getStatus()).isEqualTo(InstanceStatus.INACTIVE);
        assertThat(a.getConsecutiveFailures()).isEqualTo(3);
        assertThat(a.getUptime()).isZero();
        assertThat(registry.get("b").orElseThrow().getStatus()).isEqualTo(InstanceStatus.ACTIVE);
    }

    @Test
    @DisplayName("should reactivate an inactive instance on a passing probe")
    void shouldReactivateOnPassingProbe() {
        unhealthy.add("a");
        for (int i = 0; i < 3; i++) {
            checker.checkAllInstances();
        }
        unhealthy.clear();

        checker.checkAllInstances();

        AiInstance a = registry.get("a").orElseThrow();
        assertThat(a.getStatus()).isEqualTo(InstanceStatus.ACTIVE);
        assertThat(a.getConsecutiveFailures()).isZero();
        assertThat(a.getUptime()).isEqualTo(0.25);
    }

    @Test
    @DisplayName("should skip instances under maintenance")
    void shouldSkipMaintenance() {
        registry.updateStatus("b", InstanceStatus.MAINTENANCE);

        checker.checkAllInstances();

        assertThat(probed).containsExactly("a");
    }

    @Test
    @DisplayName("should count a failing probe future as a failed check")
    void shouldCountExceptionalProbeAsFailure() {
        InstanceHealthChecker failing = new InstanceHealthChecker(registry,
                instance -> CompletableFuture.failedFuture(new IllegalStateException("connection refused")),
                new MutableClock(), Duration.ofSeconds(30), Duration.ofSeconds(5), 1);

        failing.checkInstance(registry.get("a").orElseThrow()).join();

        assertThat(registry.get("a").orElseThrow().getStatus()).isEqualTo(InstanceStatus.INACTIVE);
    }

    @Test
    @DisplayName("should schedule and cancel its periodic sweep")
    void shouldScheduleAndCancel() {
        ManualTickScheduler scheduler = new ManualTickScheduler();

        checker.start(scheduler);
        assertThat(scheduler.isScheduled("health-check")).isTrue();
        scheduler.run("health-check");
        assertThat(probed).containsExactlyInAnyOrder("a", "b");

        checker.close();
        assertThat(scheduler.isScheduled("health-check")).isFalse();
    }
}
