package fr.lapetina.orchestrator.infrastructure.metrics;

import fr.lapetina.orchestrator.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class OutcomeWindowTest {

    private final MutableClock clock = new MutableClock();
    private final OutcomeWindow window = new OutcomeWindow(clock, Duration.ofMinutes(5));

    @Test
    @DisplayName("should summarize an empty window as zeros")
    void shouldSummarizeEmptyWindow() {
        OutcomeWindow.Summary summary = window.summarize();

        assertThat(summary.totalRequests()).isZero();
        assertThat(summary.errorRate()).isZero();
        assertThat(summary.averageLatencyMs()).isZero();
    }

    @Test
    @DisplayName("should aggregate latency, errors and cost")
    void shouldAggregate() {
        window.record(100, true, 0.01);
        window.record(300, false, 0.0);
        window.record(200, true, 0.02);
        window.record(400, false, 0.0);

        OutcomeWindow.Summary summary = window.summarize();

        assertThat(summary.totalRequests()).isEqualTo(4);
        assertThat(summary.errorCount()).isEqualTo(2);
        assertThat(summary.errorRate()).isEqualTo(0.5);
        assertThat(summary.averageLatencyMs()).isEqualTo(250.0);
        assertThat(summary.totalCost()).isCloseTo(0.03, within(1e-9));
    }

    @Test
    @DisplayName("should forget outcomes older than the retention")
    void shouldPruneOldOutcomes() {
        window.record(100, false, 0.0);
        clock.advance(Duration.ofMinutes(4));
        window.record(200, true, 0.0);
        clock.advance(Duration.ofMinutes(2));

        OutcomeWindow.Summary summary = window.summarize();

        assertThat(summary.totalRequests()).isEqualTo(1);
        assertThat(summary.errorCount()).isZero();
        assertThat(window.size()).isEqualTo(1);
    }
}
