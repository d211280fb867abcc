package fr.lapetina.orchestrator.infrastructure.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Per-instance circuit breaker for outbound provider calls.
 *
 * States:
 * - CLOSED: calls pass through, consecutive failures are counted
 * - OPEN: calls are rejected until the recovery timeout elapses
 * - HALF_OPEN: a limited number of trial calls pass; enough successes close the circuit,
 *   any failure opens it again
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String instanceId;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final int trialCalls;
    private final Clock clock;

    private State state = State.CLOSED;
    private int failureCount;
    private int trialsInFlight;
    private int trialSuccesses;
    private Instant openedAt;
    private Instant lastFailureTime;

    public CircuitBreaker(String instanceId, int failureThreshold, Duration recoveryTimeout, int trialCalls, Clock clock) {
        if (failureThreshold < 1 || trialCalls < 1) {
            throw new IllegalArgumentException("Thresholds must be positive");
        }
        this.instanceId = instanceId;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.trialCalls = trialCalls;
        this.clock = clock;
    }

    public CircuitBreaker(String instanceId, Clock clock) {
        this(instanceId, 5, Duration.ofSeconds(30), 3, clock);
    }

    /**
     * Asks to make one call. In HALF_OPEN each granted permission must be followed by
     * {@link #recordSuccess()} or {@link #recordFailure()}.
     *
     * @return false if the call must not be made
     */
    public synchronized boolean tryAcquirePermission() {
        switch (currentState()) {
            case CLOSED:
                return true;
            case OPEN:
                return false;
            case HALF_OPEN:
                if (trialsInFlight + trialSuccesses >= trialCalls) {
                    return false;
                }
                trialsInFlight++;
                return true;
            default:
                throw new IllegalStateException("Unknown state: " + state);
        }
    }

    public synchronized void recordSuccess() {
        if (state == State.HALF_OPEN) {
            trialsInFlight = Math.max(0, trialsInFlight - 1);
            trialSuccesses++;
            if (trialSuccesses >= trialCalls) {
                transition(State.CLOSED);
            }
            return;
        }
        failureCount = 0;
    }

    public synchronized void recordFailure() {
        lastFailureTime = clock.instant();
        if (state == State.HALF_OPEN) {
            log.warn("Circuit breaker trial failed: instanceId={}", instanceId);
            transition(State.OPEN);
            return;
        }
        failureCount++;
        if (state == State.CLOSED && failureCount >= failureThreshold) {
            log.warn("Circuit breaker failure threshold reached: instanceId={}, failures={}", instanceId, failureCount);
            transition(State.OPEN);
        }
    }

    /**
     * Forces a state, for admin use.
     */
    public synchronized void forceState(State newState) {
        transition(newState);
    }

    public synchronized State getState() {
        return currentState();
    }

    private State currentState() {
        if (state == State.OPEN && !clock.instant().isBefore(openedAt.plus(recoveryTimeout))) {
            transition(State.HALF_OPEN);
        }
        return state;
    }

    private void transition(State newState) {
        State old = state;
        state = newState;
        switch (newState) {
            case CLOSED -> failureCount = 0;
            case OPEN -> openedAt = clock.instant();
            case HALF_OPEN -> {
                trialsInFlight = 0;
                trialSuccesses = 0;
            }
        }
        if (old != newState) {
            log.info("Circuit breaker {} -> {}: instanceId={}", old, newState, instanceId);
        }
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    public synchronized Instant getLastFailureTime() {
        return lastFailureTime;
    }

    public String getInstanceId() {
        return instanceId;
    }

    @Override
    public synchronized String toString() {
        return "CircuitBreaker{" +
                "instanceId='" + instanceId + '\'' +
                ", state=" + state +
                ", failures=" + failureCount +
                '}';
    }
}
