package fr.lapetina.orchestrator.domain.strategy;

import fr.lapetina.orchestrator.domain.model.AiInstance;
import fr.lapetina.orchestrator.domain.model.RequestContext;
import fr.lapetina.orchestrator.domain.model.RequestPriority;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SelectionStrategyTest {

    private AiInstance fast;
    private AiInstance slow;
    private AiInstance cheap;
    private List<AiInstance> candidates;
    private RequestContext context;

    @BeforeEach
    void setUp() {
        fast = AiInstance.builder()
                .id("a-fast")
                .baseUrl("http://localhost:8001")
                .models(Set.of("gpt-4"))
                .priority(8)
                .maxConcurrent(10)
                .averageLatencyMs(500)
                .costPerUnit(0.00002)
                .build();
        slow = AiInstance.builder()
                .id("b-slow")
                .baseUrl("http://localhost:8002")
                .models(Set.of("gpt-4"))
                .priority(5)
                .maxConcurrent(4)
                .averageLatencyMs(3000)
                .costPerUnit(0.00008)
                .build();
        cheap = AiInstance.builder()
                .id("c-cheap")
                .baseUrl("http://localhost:8003")
                .models(Set.of("gpt-4"))
                .priority(5)
                .maxConcurrent(10)
                .averageLatencyMs(300)
                .costPerUnit(0.00001)
                .build();
        candidates = List.of(fast, slow, cheap);
        context = RequestContext.forModel("gpt-4", 1000);
    }

    private String selectId(SelectionStrategy strategy, List<AiInstance> from, RequestContext ctx) {
        return strategy.select(from, ctx).map(AiInstance::getId).orElse("none");
    }

    @Nested
    @DisplayName("RoundRobinStrategy")
    class RoundRobinTests {

        private RoundRobinStrategy strategy;

        @BeforeEach
        void setUp() {
            strategy = new RoundRobinStrategy();
        }

        @Test
        @DisplayName("should cycle through candidates in order")
        void shouldCycleThroughCandidates() {
            List<String> selections = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                selections.add(selectId(strategy, candidates, context));
            }

            assertThat(selections).containsExactly("a-fast", "b-slow", "c-cheap", "a-fast");
        }

        @Test
        @DisplayName("should restart from the first candidate after reset")
        void shouldRestartAfterReset() {
            strategy.select(candidates, context);
            strategy.select(candidates, context);

            strategy.reset();

            assertThat(selectId(strategy, candidates, context)).isEqualTo("a-fast");
        }

        @Test
        @DisplayName("should handle empty candidate list")
        void shouldHandleEmptyCandidateList() {
            assertThat(strategy.select(List.of(), context)).isEmpty();
        }
    }

    @Nested
    @DisplayName("WeightedRoundRobinStrategy")
    class WeightedRoundRobinTests {

        @Test
        @DisplayName("should respect weight overrides in distribution")
        void shouldRespectWeightOverrides() {
            WeightedRoundRobinStrategy strategy = new WeightedRoundRobinStrategy(Map.of("a-fast", 3, "b-slow", 1));
            List<AiInstance> pair = List.of(fast, slow);

            Map<String, Integer> counts = new HashMap<>();
            for (int i = 0; i < 8; i++) {
                counts.merge(selectId(strategy, pair, context), 1, Integer::sum);
            }

            assertThat(counts).containsEntry("a-fast", 6).containsEntry("b-slow", 2);
        }

        @Test
        @DisplayName("should fall back to instance priority as weight")
        void shouldFallBackToPriority() {
            WeightedRoundRobinStrategy strategy = new WeightedRoundRobinStrategy();
            List<AiInstance> pair = List.of(fast, slow);

            Map<String, Integer> counts = new HashMap<>();
            for (int i = 0; i < 13; i++) {
                counts.merge(selectId(strategy, pair, context), 1, Integer::sum);
            }

            assertThat(counts).containsEntry("a-fast", 8).containsEntry("b-slow", 5);
        }

        @Test
        @DisplayName("should skip candidates with zero weight")
        void shouldSkipZeroWeight() {
            WeightedRoundRobinStrategy strategy = new WeightedRoundRobinStrategy(Map.of("a-fast", 0));

            for (int i = 0; i < 5; i++) {
                assertThat(selectId(strategy, List.of(fast, slow), context)).isEqualTo("b-slow");
            }
        }
    }

    @Nested
    @DisplayName("LeastConnectionsStrategy")
    class LeastConnectionsTests {

        @Test
        @DisplayName("should pick the lowest load ratio")
        void shouldPickLowestLoadRatio() {
            fast.tryAcquireSlot();
            fast.tryAcquireSlot();
            slow.tryAcquireSlot();
            cheap.tryAcquireSlot();
            cheap.tryAcquireSlot();
            cheap.tryAcquireSlot();

            // 2/10 beats 1/4 even though the load is higher
            assertThat(selectId(new LeastConnectionsStrategy(), candidates, context)).isEqualTo("a-fast");
        }
    }

    @Nested
    @DisplayName("LeastResponseTimeStrategy")
    class LeastResponseTimeTests {

        @Test
        @DisplayName("should pick the lowest average latency")
        void shouldPickLowestLatency() {
            assertThat(selectId(new LeastResponseTimeStrategy(), candidates, context)).isEqualTo("c-cheap");
        }
    }

    @Nested
    @DisplayName("CostOptimizedStrategy")
    class CostOptimizedTests {

        @Test
        @DisplayName("should pick the lowest estimated cost")
        void shouldPickLowestCost() {
            assertThat(selectId(new CostOptimizedStrategy(), candidates, context)).isEqualTo("c-cheap");
        }

        @Test
        @DisplayName("should estimate cost from expected units")
        void shouldEstimateCost() {
            RequestContext large = RequestContext.forModel("gpt-4", 5000);

            assertThat(InstanceScoring.estimateCost(slow, large)).isEqualTo(0.00008 * 5000);
        }
    }

    @Nested
    @DisplayName("AdaptiveStrategy")
    class AdaptiveTests {

        private AdaptiveStrategy strategy;

        @BeforeEach
        void setUp() {
            strategy = new AdaptiveStrategy(AdaptiveWeights.DEFAULT);
        }

        @Test
        @DisplayName("should favour high-priority, fast instances")
        void shouldFavourHighPriorityFastInstances() {
            assertThat(selectId(strategy, candidates, context)).isEqualTo("a-fast");
        }

        @Test
        @DisplayName("should penalise instances slower than the latency limit")
        void shouldPenaliseSlowInstances() {
            RequestContext bounded = RequestContext.builder()
                    .model("gpt-4")
                    .maxLatencyMs(400L)
                    .build();

            assertThat(selectId(strategy, candidates, bounded)).isEqualTo("c-cheap");
        }

        @Test
        @DisplayName("should boost high-priority instances for critical requests")
        void shouldBoostForCriticalRequests() {
            RequestContext critical = RequestContext.builder()
                    .model("gpt-4")
                    .priority(RequestPriority.CRITICAL)
                    .build();

            double normal = InstanceScoring.adaptiveScore(fast, context, AdaptiveWeights.DEFAULT);
            double boosted = InstanceScoring.adaptiveScore(fast, critical, AdaptiveWeights.DEFAULT);
            double lowered = InstanceScoring.adaptiveScore(slow, critical, AdaptiveWeights.DEFAULT);

            assertThat(boosted).isGreaterThan(normal);
            assertThat(lowered).isLessThan(InstanceScoring.adaptiveScore(slow, context, AdaptiveWeights.DEFAULT));
        }

        @Test
        @DisplayName("should return empty for no candidates")
        void shouldReturnEmptyForNoCandidates() {
            Optional<AiInstance> result = strategy.select(List.of(), context);

            assertThat(result).isEmpty();
        }
    }

    @Nested
    @DisplayName("StrategyFactory")
    class StrategyFactoryTests {

        @Test
        @DisplayName("should create strategies by configuration name")
        void shouldCreateByName() {
            assertThat(StrategyFactory.create("round-robin").getType()).isEqualTo(SelectionStrategyType.ROUND_ROBIN);
            assertThat(StrategyFactory.create("least_connections").getType())
                    .isEqualTo(SelectionStrategyType.LEAST_CONNECTIONS);
            assertThat(StrategyFactory.create("ADAPTIVE")).isInstanceOf(AdaptiveStrategy.class);
        }

        @Test
        @DisplayName("should reject unknown strategy names")
        void shouldRejectUnknownNames() {
            assertThatThrownBy(() -> StrategyFactory.create("random"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("random");
        }
    }
}
