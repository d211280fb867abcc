package fr.lapetina.orchestrator.infrastructure.metrics;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Trailing window of provider call outcomes, used to derive system load.
 * Samples older than the retention are dropped on write and on read.
 */
public final class OutcomeWindow {

    private final ConcurrentLinkedDeque<Outcome> outcomes = new ConcurrentLinkedDeque<>();
    private final Clock clock;
    private final Duration retention;

    public OutcomeWindow(Clock clock, Duration retention) {
        this.clock = clock;
        this.retention = retention;
    }

    public OutcomeWindow(Clock clock) {
        this(clock, Duration.ofMinutes(5));
    }

    public void record(long latencyMs, boolean success, double cost) {
        long now = clock.millis();
        outcomes.addLast(new Outcome(now, latencyMs, success, cost));
        prune(now);
    }

    /**
     * Summarizes the outcomes within the retention window.
     */
    public Summary summarize() {
        long now = clock.millis();
        prune(now);

        long total = 0;
        long errors = 0;
        long latencySum = 0;
        double costSum = 0;
        for (Outcome outcome : outcomes) {
            total++;
            if (!outcome.success()) {
                errors++;
            }
            latencySum += outcome.latencyMs();
            costSum += outcome.cost();
        }
        double averageLatency = total == 0 ? 0.0 : (double) latencySum / total;
        return new Summary(total, errors, averageLatency, costSum);
    }

    public int size() {
        return outcomes.size();
    }

    private void prune(long now) {
        long cutoff = now - retention.toMillis();
        Iterator<Outcome> it = outcomes.iterator();
        while (it.hasNext()) {
            if (it.next().timestampMs() < cutoff) {
                it.remove();
            } else {
                break;
            }
        }
    }

    private record Outcome(long timestampMs, long latencyMs, boolean success, double cost) {
    }

    /**
     * Aggregate over the window.
     */
    public record Summary(long totalRequests, long errorCount, double averageLatencyMs, double totalCost) {

        public double errorRate() {
            return totalRequests == 0 ? 0.0 : (double) errorCount / totalRequests;
        }
    }
}
