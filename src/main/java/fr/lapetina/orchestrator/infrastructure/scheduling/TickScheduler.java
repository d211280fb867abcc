package fr.lapetina.orchestrator.infrastructure.scheduling;

import java.time.Duration;

/**
 * Drives the periodic work of the orchestrator: queue ticks, health sweeps,
 * cache and rate-limit cleanup, load refresh and snapshots.
 *
 * Tests substitute a manual implementation to advance time deterministically.
 */
public interface TickScheduler extends AutoCloseable {

    /**
     * Runs {@code task} every {@code interval}, first run after one interval.
     * Exceptions thrown by the task are logged and do not cancel later runs.
     *
     * @param name used in logs
     * @return handle to cancel the periodic run
     */
    Registration schedule(String name, Duration interval, Runnable task);

    @Override
    void close();

    /**
     * Handle of a periodic task.
     */
    @FunctionalInterface
    interface Registration {
        void cancel();
    }
}
