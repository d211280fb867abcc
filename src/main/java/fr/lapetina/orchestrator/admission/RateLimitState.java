package fr.lapetina.orchestrator.admission;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Mutable limiter state for one (identity, rule) pair. Created lazily on first request.
 * Not thread-safe: callers synchronize on the instance.
 */
final class RateLimitState {

    final Deque<Long> timestamps = new ArrayDeque<>();

    double tokens;
    boolean tokensInitialized;
    long lastRefillMs;

    double leakyLevel;
    long lastLeakMs;

    final long firstRequestMs;
    long lastSeenMs;

    int consecutiveDenials;
    long blockedUntilMs;

    RateLimitState(long nowMs) {
        this.firstRequestMs = nowMs;
        this.lastSeenMs = nowMs;
        this.lastLeakMs = nowMs;
    }

    boolean isBlocked(long nowMs) {
        return nowMs < blockedUntilMs;
    }
}
