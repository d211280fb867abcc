package fr.lapetina.orchestrator.domain.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AiInstanceTest {

    private AiInstance instance;

    @BeforeEach
    void setUp() {
        instance = AiInstance.builder()
                .id("test-instance")
                .provider(ProviderFamily.OPENAI)
                .baseUrl("http://localhost:8001")
                .models(Set.of("gpt-4", "gpt-3.5-turbo"))
                .maxConcurrent(3)
                .priority(7)
                .averageLatencyMs(1000)
                .costPerUnit(0.00003)
                .build();
    }

    @Test
    @DisplayName("should create instance with builder")
    void shouldCreateInstanceWithBuilder() {
        assertThat(instance.getId()).isEqualTo("test-instance");
        assertThat(instance.getProvider()).isEqualTo(ProviderFamily.OPENAI);
        assertThat(instance.getBaseUrl().toString()).isEqualTo("http://localhost:8001");
        assertThat(instance.getModels()).containsExactlyInAnyOrder("gpt-4", "gpt-3.5-turbo");
        assertThat(instance.getMaxConcurrent()).isEqualTo(3);
        assertThat(instance.getPriority()).isEqualTo(7);
        assertThat(instance.getStatus()).isEqualTo(InstanceStatus.ACTIVE);
        assertThat(instance.getSuccessRate()).isEqualTo(1.0);
        assertThat(instance.getQuota()).isEqualTo(QuotaLimits.UNLIMITED);
    }

    @Test
    @DisplayName("should reject out-of-range priority and capacity")
    void shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> AiInstance.builder().id("x").baseUrl("http://x").priority(11).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AiInstance.builder().id("x").baseUrl("http://x").maxConcurrent(0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should enforce max concurrent requests")
    void shouldEnforceMaxConcurrentRequests() {
        assertThat(instance.tryAcquireSlot()).isTrue();
        assertThat(instance.tryAcquireSlot()).isTrue();
        assertThat(instance.tryAcquireSlot()).isTrue();

        assertThat(instance.tryAcquireSlot()).isFalse();
        assertThat(instance.hasCapacity()).isFalse();

        instance.releaseSlot();

        assertThat(instance.tryAcquireSlot()).isTrue();
    }

    @Test
    @DisplayName("should clamp load adjustments to capacity")
    void shouldClampLoadAdjustments() {
        assertThat(instance.adjustLoad(10)).isEqualTo(3);
        assertThat(instance.adjustLoad(-10)).isZero();

        instance.releaseSlot();
        assertThat(instance.getCurrentLoad()).isZero();
    }

    @Test
    @DisplayName("should be thread-safe for concurrent slot operations")
    void shouldBeThreadSafeForSlotOperations() throws InterruptedException {
        int threads = 10;
        int iterations = 1000;
        CountDownLatch latch = new CountDownLatch(threads);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        AtomicInteger successfulAcquisitions = new AtomicInteger(0);

        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                try {
                    for (int i = 0; i < iterations; i++) {
                        if (instance.tryAcquireSlot()) {
                            successfulAcquisitions.incrementAndGet();
                            Thread.yield();
                            instance.releaseSlot();
                        }
                    }
                } finally {
                    latch.countDown();
                }
            });
        }

        latch.await();
        executor.shutdown();

        assertThat(instance.getCurrentLoad()).isZero();
        assertThat(successfulAcquisitions.get()).isPositive();
    }

    @Test
    @DisplayName("should fold outcomes into rolling averages")
    void shouldFoldOutcomesIntoRollingAverages() {
        instance.applyOutcome(2000, false);

        assertThat(instance.getAverageLatencyMs()).isCloseTo(1100.0, within(1e-9));
        assertThat(instance.getSuccessRate()).isCloseTo(0.9, within(1e-9));

        instance.applyOutcome(1100, true);

        assertThat(instance.getAverageLatencyMs()).isCloseTo(1100.0, within(1e-9));
        assertThat(instance.getSuccessRate()).isCloseTo(0.91, within(1e-9));
    }

    @Test
    @DisplayName("should track throughput from completed calls")
    void shouldTrackThroughput() {
        instance.applyThroughput(500, 1000);
        assertThat(instance.getUnitsPerSecond()).isCloseTo(500.0, within(1e-9));

        instance.applyThroughput(1000, 1000);
        assertThat(instance.getUnitsPerSecond()).isCloseTo(550.0, within(1e-9));

        instance.applyThroughput(0, 1000);
        assertThat(instance.getUnitsPerSecond()).isCloseTo(550.0, within(1e-9));
    }

    @Test
    @DisplayName("should compute uptime from health checks")
    void shouldComputeUptime() {
        assertThat(instance.getUptime()).isEqualTo(1.0);

        Instant now = Instant.parse("2024-01-01T00:00:00Z");
        instance.recordHealthCheck(now, true);
        instance.recordHealthCheck(now, true);
        instance.recordHealthCheck(now, true);
        instance.recordHealthCheck(now, false);

        assertThat(instance.getUptime()).isEqualTo(0.75);
        assertThat(instance.getLastHealthCheck()).isEqualTo(now);
    }

    @Test
    @DisplayName("should determine selectability correctly")
    void shouldDetermineSelectability() {
        assertThat(instance.isSelectable("gpt-4", 3)).isTrue();
        assertThat(instance.isSelectable("claude-3", 3)).isFalse();

        instance.recordFailure();
        instance.recordFailure();
        assertThat(instance.isSelectable("gpt-4", 3)).isTrue();
        instance.recordFailure();
        assertThat(instance.isSelectable("gpt-4", 3)).isFalse();

        instance.resetFailures();
        instance.setStatus(InstanceStatus.MAINTENANCE);
        assertThat(instance.isSelectable("gpt-4", 3)).isFalse();
    }

    @Test
    @DisplayName("should not select an instance with an exhausted quota")
    void shouldNotSelectWithExhaustedQuota() {
        AiInstance noQuota = AiInstance.builder()
                .id("no-quota")
                .baseUrl("http://localhost:8002")
                .addModel("gpt-4")
                .quota(new QuotaLimits(0, 1000, 1000))
                .build();

        assertThat(noQuota.isSelectable("gpt-4", 3)).isFalse();
    }

    @Test
    @DisplayName("should have correct equality based on ID")
    void shouldHaveCorrectEquality() {
        AiInstance sameId = AiInstance.builder()
                .id("test-instance")
                .baseUrl("http://different:8001")
                .build();

        AiInstance differentId = AiInstance.builder()
                .id("other-instance")
                .baseUrl("http://localhost:8001")
                .build();

        assertThat(instance).isEqualTo(sameId);
        assertThat(instance).isNotEqualTo(differentId);
        assertThat(instance.hashCode()).isEqualTo(sameId.hashCode());
    }
}
