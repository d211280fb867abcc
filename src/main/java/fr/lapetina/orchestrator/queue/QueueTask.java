package fr.lapetina.orchestrator.queue;

import fr.lapetina.orchestrator.domain.model.RequestPriority;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Mutable task state owned by {@link TaskQueue}. Guarded by the queue's lock.
 */
final class QueueTask {

    final String id;
    final long sequence;
    final TaskKind kind;
    final Map<String, Object> payload;
    final RequestPriority priority;
    final String requesterIdentity;
    final String sessionId;
    final int maxRetries;
    final Duration timeout;
    final Set<String> dependencies;
    final String requiredModel;
    final long expectedUnits;
    final boolean retryable;
    final Set<String> tags;
    final String cacheKey;
    final boolean cacheable;
    final Instant createdAt;

    TaskStatus status = TaskStatus.PENDING;
    int retryCount;
    int attempt;
    Object result;
    String error;
    TaskProgress progress = TaskProgress.NONE;
    String workerId;
    Instant scheduledAt;
    Instant startedAt;
    Instant completedAt;
    Instant failedAt;
    Instant notBefore;

    QueueTask(String id, long sequence, TaskSpec spec, int maxRetries, Duration timeout, Instant createdAt) {
        this.id = id;
        this.sequence = sequence;
        this.kind = spec.kind();
        this.payload = spec.payload();
        this.priority = spec.priority();
        this.requesterIdentity = spec.requesterIdentity();
        this.sessionId = spec.sessionId();
        this.maxRetries = maxRetries;
        this.timeout = timeout;
        this.dependencies = spec.dependencies();
        this.requiredModel = spec.requiredModel();
        this.expectedUnits = spec.expectedUnits();
        this.retryable = spec.retryable();
        this.tags = spec.tags();
        this.cacheKey = spec.cacheKey();
        this.cacheable = spec.cacheable();
        this.createdAt = createdAt;
        this.notBefore = spec.delay() != null ? createdAt.plus(spec.delay()) : createdAt;
    }

    /**
     * Rebuilds a task from a snapshot. A task that was running is put back to pending.
     */
    static QueueTask restore(TaskView view, long sequence) {
        TaskSpec spec = new TaskSpec(view.kind(), view.payload(), view.priority(), view.requesterIdentity(),
                view.sessionId(), view.maxRetries(), null, null, view.dependencies(), view.requiredModel(),
                view.expectedUnits(), view.retryable(), view.tags(), view.cacheKey(), view.cacheable());
        QueueTask task = new QueueTask(view.id(), sequence, spec, view.maxRetries(),
                Duration.ofMillis(view.timeoutMs()), view.createdAt());
        task.status = view.status() == TaskStatus.RUNNING ? TaskStatus.PENDING : view.status();
        task.retryCount = view.retryCount();
        task.result = view.result();
        task.error = view.error();
        task.progress = view.progress() != null ? view.progress() : TaskProgress.NONE;
        task.scheduledAt = view.scheduledAt();
        task.startedAt = view.startedAt();
        task.completedAt = view.completedAt();
        task.failedAt = view.failedAt();
        task.notBefore = view.notBefore() != null ? view.notBefore() : view.createdAt();
        if (task.status == TaskStatus.PENDING) {
            task.workerId = null;
        } else {
            task.workerId = view.workerId();
        }
        return task;
    }

    boolean isWaiting() {
        return status == TaskStatus.PENDING || status == TaskStatus.SCHEDULED;
    }

    TaskView toView() {
        return new TaskView(id, kind, payload, priority, requesterIdentity, sessionId, maxRetries, retryCount,
                timeout.toMillis(), dependencies, requiredModel, expectedUnits, retryable, tags, cacheKey,
                cacheable, status, result, error, progress, workerId, createdAt, scheduledAt, startedAt,
                completedAt, failedAt, notBefore);
    }
}
