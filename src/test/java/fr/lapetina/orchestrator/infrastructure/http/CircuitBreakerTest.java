package fr.lapetina.orchestrator.infrastructure.http;

import fr.lapetina.orchestrator.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker circuitBreaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        // 3 failures, 100ms recovery, 2 trial calls
        circuitBreaker = new CircuitBreaker("test-instance", 3, Duration.ofMillis(100), 2, clock);
    }

    private void open() {
        circuitBreaker.recordFailure();
        circuitBreaker.recordFailure();
        circuitBreaker.recordFailure();
    }

    @Test
    @DisplayName("should start in CLOSED state")
    void shouldStartClosed() {
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(circuitBreaker.tryAcquirePermission()).isTrue();
    }

    @Test
    @DisplayName("should open after threshold failures")
    void shouldOpenAfterThresholdFailures() {
        circuitBreaker.recordFailure();
        circuitBreaker.recordFailure();
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);

        circuitBreaker.recordFailure();

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(circuitBreaker.tryAcquirePermission()).isFalse();
        assertThat(circuitBreaker.getLastFailureTime()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("should reset failure count on success")
    void shouldResetFailureCountOnSuccess() {
        circuitBreaker.recordFailure();
        circuitBreaker.recordFailure();
        assertThat(circuitBreaker.getFailureCount()).isEqualTo(2);

        circuitBreaker.recordSuccess();

        assertThat(circuitBreaker.getFailureCount()).isZero();
    }

    @Test
    @DisplayName("should stay OPEN before the recovery timeout")
    void shouldStayOpenBeforeRecoveryTimeout() {
        open();
        clock.advanceMillis(99);

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
    }

    @Test
    @DisplayName("should transition to HALF_OPEN after recovery timeout")
    void shouldTransitionToHalfOpenAfterTimeout() {
        open();
        clock.advanceMillis(100);

        assertThat(circuitBreaker.tryAcquirePermission()).isTrue();
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.HALF_OPEN);
    }

    @Test
    @DisplayName("should limit trial calls in HALF_OPEN")
    void shouldLimitTrialCallsInHalfOpen() {
        open();
        clock.advanceMillis(100);

        assertThat(circuitBreaker.tryAcquirePermission()).isTrue();
        assertThat(circuitBreaker.tryAcquirePermission()).isTrue();
        assertThat(circuitBreaker.tryAcquirePermission()).isFalse();
    }

    @Test
    @DisplayName("should close after successful trials in HALF_OPEN")
    void shouldCloseAfterSuccessesInHalfOpen() {
        open();
        clock.advanceMillis(100);
        circuitBreaker.tryAcquirePermission();
        circuitBreaker.tryAcquirePermission();

        circuitBreaker.recordSuccess();
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.HALF_OPEN);
        circuitBreaker.recordSuccess();

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(circuitBreaker.getFailureCount()).isZero();
    }

    @Test
    @DisplayName("should reopen on failure in HALF_OPEN")
    void shouldReopenOnFailureInHalfOpen() {
        open();
        clock.advanceMillis(100);
        circuitBreaker.tryAcquirePermission();

        circuitBreaker.recordFailure();

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(circuitBreaker.tryAcquirePermission()).isFalse();
    }

    @Test
    @DisplayName("should allow forcing state")
    void shouldAllowForcingState() {
        circuitBreaker.forceState(CircuitBreaker.State.OPEN);
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);

        circuitBreaker.forceState(CircuitBreaker.State.CLOSED);
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(circuitBreaker.getFailureCount()).isZero();
    }
}
