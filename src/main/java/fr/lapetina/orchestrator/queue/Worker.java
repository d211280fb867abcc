package fr.lapetina.orchestrator.queue;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Executes tasks of some kinds, at most {@code maxConcurrent} at a time.
 * A worker with no kinds accepts every kind.
 */
public final class Worker {

    private final String id;
    private final String name;
    private final Set<TaskKind> kinds;
    private final int maxConcurrent;
    private final TaskHandler handler;

    private final AtomicReference<WorkerStatus> status = new AtomicReference<>(WorkerStatus.ACTIVE);
    private final AtomicInteger currentTasks = new AtomicInteger();
    private final AtomicLong completedTasks = new AtomicLong();
    private final AtomicLong failedTasks = new AtomicLong();

    public Worker(String id, String name, Set<TaskKind> kinds, int maxConcurrent, TaskHandler handler) {
        this.id = Objects.requireNonNull(id, "Worker ID is required");
        this.name = name != null ? name : id;
        this.kinds = kinds == null || kinds.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(kinds));
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be positive: " + maxConcurrent);
        }
        this.maxConcurrent = maxConcurrent;
        this.handler = Objects.requireNonNull(handler, "Handler is required");
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    /**
     * Accepted kinds; empty means any kind.
     */
    public Set<TaskKind> getKinds() {
        return kinds;
    }

    public boolean accepts(TaskKind kind) {
        return kinds.isEmpty() || kinds.contains(kind);
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public TaskHandler getHandler() {
        return handler;
    }

    public WorkerStatus getStatus() {
        return status.get();
    }

    void setStatus(WorkerStatus newStatus) {
        status.set(newStatus);
    }

    public int getCurrentTasks() {
        return currentTasks.get();
    }

    boolean canTake(TaskKind kind) {
        return status.get() == WorkerStatus.ACTIVE && accepts(kind) && currentTasks.get() < maxConcurrent;
    }

    void taskStarted() {
        currentTasks.incrementAndGet();
    }

    void taskFinished() {
        currentTasks.updateAndGet(current -> Math.max(0, current - 1));
    }

    void recordCompleted() {
        completedTasks.incrementAndGet();
    }

    void recordFailed() {
        failedTasks.incrementAndGet();
    }

    public WorkerInfo info() {
        return new WorkerInfo(id, name, kinds, maxConcurrent, status.get(), currentTasks.get(),
                completedTasks.get(), failedTasks.get());
    }

    @Override
    public String toString() {
        return "Worker{" +
                "id='" + id + '\'' +
                ", kinds=" + (kinds.isEmpty() ? "*" : kinds) +
                ", status=" + status.get() +
                ", tasks=" + currentTasks.get() +
                "/" + maxConcurrent +
                '}';
    }

    /**
     * Point-in-time view of a worker.
     */
    public record WorkerInfo(
            String id,
            String name,
            Set<TaskKind> kinds,
            int maxConcurrent,
            WorkerStatus status,
            int currentTasks,
            long completedTasks,
            long failedTasks
    ) {
    }
}
