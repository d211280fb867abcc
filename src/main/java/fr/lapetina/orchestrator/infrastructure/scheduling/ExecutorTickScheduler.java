package fr.lapetina.orchestrator.infrastructure.scheduling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link TickScheduler} backed by a single daemon scheduler thread.
 * All periodic work shares the thread, so ticks never overlap each other.
 */
public final class ExecutorTickScheduler implements TickScheduler {

    private static final Logger log = LoggerFactory.getLogger(ExecutorTickScheduler.class);

    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public ExecutorTickScheduler(String threadName) {
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    public ExecutorTickScheduler() {
        this("orchestrator-scheduler");
    }

    @Override
    public Registration schedule(String name, Duration interval, Runnable task) {
        if (closed.get()) {
            throw new IllegalStateException("Scheduler is closed");
        }
        long periodMs = interval.toMillis();
        ScheduledFuture<?> future = scheduler.scheduleWithFixedDelay(() -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("Periodic task failed: name={}", name, e);
            }
        }, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.debug("Periodic task scheduled: name={}, interval={}", name, interval);
        return () -> future.cancel(false);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Scheduler stopped");
        }
    }
}
