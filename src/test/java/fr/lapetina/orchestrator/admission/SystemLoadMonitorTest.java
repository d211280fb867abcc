package fr.lapetina.orchestrator.admission;

import fr.lapetina.orchestrator.infrastructure.metrics.OutcomeWindow;
import fr.lapetina.orchestrator.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SystemLoadMonitorTest {

    private MutableClock clock;
    private OutcomeWindow window;
    private SystemLoadMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        window = new OutcomeWindow(clock);
        monitor = new SystemLoadMonitor(window, clock, AdaptiveConfig.DEFAULT);
    }

    @Test
    @DisplayName("should report zero load without outcomes")
    void shouldReportZeroLoadWhenIdle() {
        monitor.refresh();

        assertThat(monitor.getSystemLoad()).isZero();
        assertThat(monitor.loadFactor()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should average error rate, latency and cost components")
    void shouldAverageComponents() {
        window.record(2500, false, 1.0);
        window.record(2500, true, 1.0);

        monitor.refresh();

        // (0.5 + 2500/5000 + 2/10) / 3
        assertThat(monitor.getSystemLoad()).isCloseTo(0.4, within(1e-9));
    }

    @Test
    @DisplayName("should cap each component at one")
    void shouldCapComponents() {
        window.record(60_000, false, 50.0);

        monitor.refresh();

        assertThat(monitor.getSystemLoad()).isCloseTo(1.0, within(1e-9));
        assertThat(monitor.loadFactor()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("should recover the factor linearly once load subsides")
    void shouldRecoverLinearly() {
        monitor.simulateLoad(0.9);
        assertThat(monitor.loadFactor()).isEqualTo(0.5);

        monitor.clearSimulatedLoad();
        clock.advance(Duration.ofSeconds(150));

        assertThat(monitor.loadFactor()).isCloseTo(0.75, within(1e-9));

        clock.advance(Duration.ofSeconds(150));
        assertThat(monitor.loadFactor()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should ignore load when adaptation is disabled")
    void shouldIgnoreLoadWhenDisabled() {
        monitor.updateConfig(new AdaptiveConfig(false, 0.8, 0.5, 300_000, 10));

        monitor.simulateLoad(1.0);

        assertThat(monitor.loadFactor()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should reject simulated load outside [0, 1]")
    void shouldRejectInvalidSimulatedLoad() {
        assertThatThrownBy(() -> monitor.simulateLoad(1.5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should clamp restored load values")
    void shouldClampRestoredLoad() {
        monitor.restore(3.0);

        assertThat(monitor.getSystemLoad()).isEqualTo(1.0);
    }
}
