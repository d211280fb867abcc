package fr.lapetina.orchestrator.admission;

/**
 * Applies one rate-limiting algorithm to a state. All times are epoch milliseconds.
 */
final class RateLimitEvaluator {

    /**
     * Outcome of one evaluation.
     */
    record Evaluation(boolean allowed, long limit, long remaining, long resetAtMs, Long retryAfterSeconds) {
    }

    /**
     * Evaluates a request and, when allowed, consumes from the state.
     *
     * @param maxRequests effective limit, already scaled for adaptive rules
     */
    Evaluation evaluate(RateLimitState state, TierLimit limit, int maxRequests, long nowMs) {
        if (maxRequests <= 0) {
            long resetAt = nowMs + limit.windowMs();
            return new Evaluation(false, 0, 0, resetAt, retryAfterSeconds(resetAt, nowMs));
        }
        return switch (limit.algorithm()) {
            case SLIDING_WINDOW, ADAPTIVE -> slidingWindow(state, limit.windowMs(), maxRequests, nowMs);
            case TOKEN_BUCKET -> tokenBucket(state, limit, maxRequests, nowMs);
            case LEAKY_BUCKET -> leakyBucket(state, limit.windowMs(), maxRequests, nowMs);
        };
    }

    private Evaluation slidingWindow(RateLimitState state, long windowMs, int max, long nowMs) {
        long windowStart = nowMs - windowMs;
        while (!state.timestamps.isEmpty() && state.timestamps.peekFirst() < windowStart) {
            state.timestamps.removeFirst();
        }

        int count = state.timestamps.size();
        if (count < max) {
            state.timestamps.addLast(nowMs);
            long resetAt = state.timestamps.peekFirst() + windowMs;
            return new Evaluation(true, max, max - count - 1, resetAt, null);
        }

        long resetAt = state.timestamps.peekFirst() + windowMs;
        return new Evaluation(false, max, 0, resetAt, retryAfterSeconds(resetAt, nowMs));
    }

    private Evaluation tokenBucket(RateLimitState state, TierLimit limit, int max, long nowMs) {
        double capacity = limit.burst() != null ? limit.burst() : max;
        double refillPerMs = (double) max / limit.windowMs();

        if (!state.tokensInitialized) {
            state.tokens = capacity;
            state.lastRefillMs = nowMs;
            state.tokensInitialized = true;
        }

        long elapsed = Math.max(0, nowMs - state.lastRefillMs);
        state.tokens = Math.min(capacity, state.tokens + elapsed * refillPerMs);
        state.lastRefillMs = nowMs;

        if (state.tokens >= 1.0) {
            state.tokens -= 1.0;
            long resetAt = nowMs + (long) Math.ceil((capacity - state.tokens) / refillPerMs);
            return new Evaluation(true, (long) capacity, (long) Math.floor(state.tokens), resetAt, null);
        }

        long waitMs = (long) Math.ceil((1.0 - state.tokens) / refillPerMs);
        long resetAt = nowMs + waitMs;
        return new Evaluation(false, (long) capacity, 0, resetAt, retryAfterSeconds(resetAt, nowMs));
    }

    private Evaluation leakyBucket(RateLimitState state, long windowMs, int max, long nowMs) {
        double leakPerMs = (double) max / windowMs;

        long elapsed = Math.max(0, nowMs - state.lastLeakMs);
        state.leakyLevel = Math.max(0.0, state.leakyLevel - elapsed * leakPerMs);
        state.lastLeakMs = nowMs;

        if (state.leakyLevel < max) {
            state.leakyLevel += 1.0;
            long resetAt = nowMs + (long) Math.ceil(state.leakyLevel / leakPerMs);
            return new Evaluation(true, max, (long) Math.floor(max - state.leakyLevel), resetAt, null);
        }

        long waitMs = (long) Math.ceil((state.leakyLevel - max) / leakPerMs) + 1;
        long resetAt = nowMs + waitMs;
        return new Evaluation(false, max, 0, resetAt, retryAfterSeconds(resetAt, nowMs));
    }

    static long retryAfterSeconds(long resetAtMs, long nowMs) {
        return Math.max(1L, (long) Math.ceil((resetAtMs - nowMs) / 1000.0));
    }
}
