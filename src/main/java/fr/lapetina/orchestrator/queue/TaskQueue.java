package fr.lapetina.orchestrator.queue;

import fr.lapetina.orchestrator.domain.exception.NoCompatibleInstanceException;
import fr.lapetina.orchestrator.domain.exception.ProviderException;
import fr.lapetina.orchestrator.domain.exception.QueueFullException;
import fr.lapetina.orchestrator.domain.exception.TaskTimeoutException;
import fr.lapetina.orchestrator.domain.exception.UnsatisfiedDependencyException;
import fr.lapetina.orchestrator.domain.model.RequestPriority;
import fr.lapetina.orchestrator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.orchestrator.infrastructure.scheduling.TickScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Priority task queue with workers, retries and a dead-letter set.
 *
 * <p>Every tick moves ready tasks (due, dependencies completed) to SCHEDULED, orders them by
 * priority weight then submission order, and hands them to matching workers while worker and
 * global slots remain. Handlers run asynchronously; each attempt races its timeout and the
 * outcome of an attempt that is no longer current (cancelled task, timed-out attempt) is discarded.
 *
 * <p>Bookkeeping is synchronized on the queue. Listeners are notified under the lock and must not
 * block.
 */
public final class TaskQueue {

    private static final Logger log = LoggerFactory.getLogger(TaskQueue.class);

    private static final Duration THROUGHPUT_WINDOW = Duration.ofHours(1);

    private final Map<String, QueueTask> tasks = new LinkedHashMap<>();
    private final Map<String, Worker> workers = new LinkedHashMap<>();
    private final List<TaskView> deadLetters = new ArrayList<>();
    private final List<Consumer<QueueEvent>> listeners = new CopyOnWriteArrayList<>();
    private final Deque<Instant> recentCompletions = new ArrayDeque<>();
    private final Settings settings;
    private final MetricsRegistry metrics;
    private final Clock clock;

    private final Comparator<QueueTask> dispatchOrder;

    private long sequence;
    private int runningSlots;
    private long totalCompleted;
    private long totalFailed;
    private long totalRetries;
    private long totalExecutionMs;
    private long executions;
    private long totalWaitMs;
    private long waits;

    private volatile TickScheduler.Registration registration;

    public TaskQueue(Settings settings, MetricsRegistry metrics, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "Settings are required");
        this.metrics = metrics;
        this.clock = clock;
        this.dispatchOrder = Comparator
                .comparingInt((QueueTask task) -> weightOf(task.priority)).reversed()
                .thenComparing(task -> task.createdAt)
                .thenComparingLong(task -> task.sequence);
    }

    /**
     * Starts ticking on the given scheduler.
     */
    public synchronized void start(TickScheduler scheduler) {
        if (registration == null) {
            registration = scheduler.schedule("task-queue", settings.tickInterval(), this::tick);
            log.info("Task queue started: tickInterval={}, maxConcurrent={}, workers={}",
                    settings.tickInterval(), settings.maxConcurrent(), workers.size());
        }
    }

    public synchronized void stop() {
        if (registration != null) {
            registration.cancel();
            registration = null;
            log.info("Task queue stopped");
        }
    }

    /**
     * Adds a task.
     *
     * @return the task id
     * @throws QueueFullException              if the queue holds its maximum of unfinished tasks
     * @throws UnsatisfiedDependencyException if a dependency is unknown or not completed
     */
    public synchronized String enqueue(TaskSpec spec) {
        checkAcceptable(spec);

        String id = UUID.randomUUID().toString();
        int maxRetries = spec.maxRetries() != null ? spec.maxRetries() : settings.defaultMaxRetries();
        Duration timeout = spec.timeout() != null ? spec.timeout() : settings.defaultTimeout();
        QueueTask task = new QueueTask(id, sequence++, spec, maxRetries, timeout, clock.instant());
        tasks.put(id, task);

        log.info("Task enqueued: taskId={}, kind={}, priority={}, identity={}, notBefore={}",
                id, task.kind, task.priority, task.requesterIdentity, task.notBefore);
        countTask(task, "queued");
        emit(QueueEvent.Type.ADDED, task);
        return id;
    }

    /**
     * Verifies that {@link #enqueue} would currently accept the task, without adding it.
     *
     * @throws QueueFullException              if the queue holds its maximum of unfinished tasks
     * @throws UnsatisfiedDependencyException if a dependency is unknown or not completed
     */
    public synchronized void checkAcceptable(TaskSpec spec) {
        long unfinished = tasks.values().stream().filter(task -> !task.status.isTerminal()).count();
        if (unfinished >= settings.maxQueueSize()) {
            log.warn("Task rejected, queue full: kind={}, identity={}, capacity={}",
                    spec.kind(), spec.requesterIdentity(), settings.maxQueueSize());
            throw new QueueFullException(settings.maxQueueSize());
        }
        for (String dependencyId : spec.dependencies()) {
            QueueTask dependency = tasks.get(dependencyId);
            if (dependency == null) {
                throw new UnsatisfiedDependencyException(dependencyId, "does not exist");
            }
            if (dependency.status != TaskStatus.COMPLETED) {
                throw new UnsatisfiedDependencyException(dependencyId, "is not completed: status=" + dependency.status);
            }
        }
    }

    /**
     * Dispatches ready tasks to free worker slots.
     */
    public void tick() {
        List<Dispatch> dispatches = new ArrayList<>();
        synchronized (this) {
            Instant now = clock.instant();
            List<QueueTask> ready = new ArrayList<>();
            for (QueueTask task : tasks.values()) {
                if (isReady(task, now)) {
                    if (task.status == TaskStatus.PENDING) {
                        task.status = TaskStatus.SCHEDULED;
                        task.scheduledAt = now;
                    }
                    ready.add(task);
                }
            }
            ready.sort(dispatchOrder);

            for (QueueTask task : ready) {
                if (runningSlots >= settings.maxConcurrent()) {
                    break;
                }
                Worker worker = findWorker(task.kind);
                if (worker == null) {
                    continue;
                }
                if (task.startedAt == null) {
                    totalWaitMs += Duration.between(task.createdAt, now).toMillis();
                    waits++;
                }
                task.status = TaskStatus.RUNNING;
                task.startedAt = now;
                task.workerId = worker.getId();
                task.attempt++;
                worker.taskStarted();
                runningSlots++;

                log.debug("Task started: taskId={}, workerId={}, attempt={}", task.id, worker.getId(), task.attempt);
                emit(QueueEvent.Type.STARTED, task);
                dispatches.add(new Dispatch(task.toView(), task.attempt, worker, now));
            }
        }

        for (Dispatch dispatch : dispatches) {
            execute(dispatch);
        }
    }

    private boolean isReady(QueueTask task, Instant now) {
        if (!task.isWaiting() || now.isBefore(task.notBefore)) {
            return false;
        }
        for (String dependencyId : task.dependencies) {
            QueueTask dependency = tasks.get(dependencyId);
            // a cleared dependency had completed when the task was accepted
            if (dependency != null && dependency.status != TaskStatus.COMPLETED) {
                return false;
            }
        }
        return true;
    }

    private Worker findWorker(TaskKind kind) {
        for (Worker worker : workers.values()) {
            if (worker.canTake(kind)) {
                return worker;
            }
        }
        return null;
    }

    private void execute(Dispatch dispatch) {
        TaskView task = dispatch.task();
        MDC.put("taskId", task.id());
        try {
            CompletableFuture<Object> attempt;
            try {
                attempt = dispatch.worker().getHandler().handle(task);
                if (attempt == null) {
                    attempt = CompletableFuture.failedFuture(new IllegalStateException("Handler returned no future"));
                }
            } catch (Exception e) {
                attempt = CompletableFuture.failedFuture(e);
            }

            // the copy is what times out; the handler's own future completes undisturbed
            attempt.copy()
                    .orTimeout(task.timeoutMs(), TimeUnit.MILLISECONDS)
                    .whenComplete((result, error) -> onAttemptFinished(dispatch, result, error));
        } finally {
            MDC.remove("taskId");
        }
    }

    private synchronized void onAttemptFinished(Dispatch dispatch, Object result, Throwable error) {
        Worker worker = dispatch.worker();
        worker.taskFinished();
        runningSlots = Math.max(0, runningSlots - 1);

        String taskId = dispatch.task().id();
        QueueTask task = tasks.get(taskId);
        if (task == null || task.status != TaskStatus.RUNNING || task.attempt != dispatch.attempt()) {
            log.debug("Stale attempt outcome discarded: taskId={}, attempt={}", taskId, dispatch.attempt());
            return;
        }

        Instant now = clock.instant();
        long durationMs = Duration.between(dispatch.startedAt(), now).toMillis();
        totalExecutionMs += durationMs;
        executions++;
        if (metrics != null) {
            metrics.recordTaskDuration(task.kind.name(), Duration.ofMillis(durationMs));
        }

        MDC.put("taskId", taskId);
        try {
            if (error == null) {
                complete(task, worker, result, now, durationMs);
            } else {
                fail(task, worker, unwrap(error, task), now);
            }
        } finally {
            MDC.remove("taskId");
        }
    }

    private void complete(QueueTask task, Worker worker, Object result, Instant now, long durationMs) {
        task.status = TaskStatus.COMPLETED;
        task.result = result;
        task.error = null;
        task.completedAt = now;
        worker.recordCompleted();
        totalCompleted++;
        recentCompletions.addLast(now);

        log.info("Task completed: taskId={}, kind={}, durationMs={}, retries={}",
                task.id, task.kind, durationMs, task.retryCount);
        countTask(task, "completed");
        emit(QueueEvent.Type.COMPLETED, task);
    }

    private void fail(QueueTask task, Worker worker, Throwable cause, Instant now) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        task.error = message;

        if (isRetryable(task, cause) && task.retryCount < task.maxRetries) {
            long delayMs = retryDelayMs(task.retryCount);
            task.retryCount++;
            task.status = TaskStatus.SCHEDULED;
            task.scheduledAt = now;
            task.notBefore = now.plusMillis(delayMs);
            totalRetries++;

            log.warn("Task attempt failed, retry scheduled: taskId={}, retry={}/{}, delayMs={}, error={}",
                    task.id, task.retryCount, task.maxRetries, delayMs, message);
            countTask(task, "retried");
            emit(QueueEvent.Type.RETRY_SCHEDULED, task);
            return;
        }

        task.status = TaskStatus.FAILED;
        task.failedAt = now;
        worker.recordFailed();
        totalFailed++;
        if (settings.deadLetterEnabled()) {
            deadLetters.add(task.toView());
        }

        log.error("Task failed: taskId={}, kind={}, retries={}, error={}", task.id, task.kind, task.retryCount, message);
        countTask(task, "failed");
        emit(QueueEvent.Type.FAILED, task);
    }

    private static boolean isRetryable(QueueTask task, Throwable cause) {
        if (!task.retryable || cause instanceof NoCompatibleInstanceException) {
            return false;
        }
        if (cause instanceof ProviderException providerException) {
            return providerException.isRetryable();
        }
        return true;
    }

    private static Throwable unwrap(Throwable error, QueueTask task) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            return new TaskTimeoutException(task.id, task.timeout);
        }
        return cause;
    }

    /**
     * Delay before retry number {@code retryCount + 1}: exponential from the base, capped.
     */
    long retryDelayMs(int retryCount) {
        double delay = settings.retryBaseDelay().toMillis() * Math.pow(2, retryCount);
        return (long) Math.min(delay, settings.retryMaxDelay().toMillis());
    }

    /**
     * Cancels an unfinished task. A running attempt completes in the background and its outcome is discarded.
     *
     * @return false if the task is unknown or already finished
     */
    public synchronized boolean cancel(String taskId) {
        QueueTask task = tasks.get(taskId);
        if (task == null || task.status.isTerminal()) {
            return false;
        }
        task.status = TaskStatus.CANCELLED;
        task.completedAt = clock.instant();
        log.info("Task cancelled: taskId={}", taskId);
        countTask(task, "cancelled");
        emit(QueueEvent.Type.CANCELLED, task);
        return true;
    }

    /**
     * Puts a failed task back to pending with a fresh retry budget and drops it from the dead letters.
     *
     * @return false if the task is unknown or not failed
     */
    public synchronized boolean retry(String taskId) {
        QueueTask task = tasks.get(taskId);
        if (task == null || task.status != TaskStatus.FAILED) {
            return false;
        }
        task.status = TaskStatus.PENDING;
        task.retryCount = 0;
        task.error = null;
        task.failedAt = null;
        task.notBefore = clock.instant();
        deadLetters.removeIf(view -> view.id().equals(taskId));
        log.info("Task requeued manually: taskId={}", taskId);
        emit(QueueEvent.Type.RETRIED, task);
        return true;
    }

    /**
     * Records progress of a running task.
     *
     * @return false if the task is unknown or not running
     */
    public synchronized boolean updateProgress(String taskId, int current, int total, String message) {
        QueueTask task = tasks.get(taskId);
        if (task == null || task.status != TaskStatus.RUNNING) {
            return false;
        }
        task.progress = new TaskProgress(current, total, message);
        return true;
    }

    public synchronized Optional<TaskView> getTask(String taskId) {
        return Optional.ofNullable(tasks.get(taskId)).map(QueueTask::toView);
    }

    /**
     * Tasks matching the filter, in submission order.
     */
    public synchronized List<TaskView> listTasks(TaskFilter filter) {
        TaskFilter effective = filter != null ? filter : TaskFilter.ALL;
        return tasks.values().stream()
                .map(QueueTask::toView)
                .filter(effective::matches)
                .toList();
    }

    /**
     * Tasks waiting to run.
     */
    public synchronized int depth() {
        return (int) tasks.values().stream().filter(QueueTask::isWaiting).count();
    }

    /**
     * Drops completed tasks.
     *
     * @return number of tasks removed
     */
    public synchronized int clearCompleted() {
        int removed = 0;
        Iterator<QueueTask> it = tasks.values().iterator();
        while (it.hasNext()) {
            if (it.next().status == TaskStatus.COMPLETED) {
                it.remove();
                removed++;
            }
        }
        log.info("Completed tasks cleared: count={}", removed);
        return removed;
    }

    public synchronized List<TaskView> getDeadLetters() {
        return List.copyOf(deadLetters);
    }

    public synchronized int clearDeadLetters() {
        int count = deadLetters.size();
        deadLetters.clear();
        return count;
    }

    public synchronized void addWorker(Worker worker) {
        if (workers.putIfAbsent(worker.getId(), worker) != null) {
            throw new IllegalArgumentException("Worker already exists: " + worker.getId());
        }
        log.info("Worker added: {}", worker);
    }

    /**
     * Removes a worker. Tasks it is running complete normally.
     */
    public synchronized boolean removeWorker(String workerId) {
        Worker removed = workers.remove(workerId);
        if (removed != null) {
            removed.setStatus(WorkerStatus.STOPPED);
            log.info("Worker removed: {}", removed);
        }
        return removed != null;
    }

    public synchronized boolean pauseWorker(String workerId) {
        return setWorkerStatus(workerId, WorkerStatus.PAUSED);
    }

    public synchronized boolean resumeWorker(String workerId) {
        return setWorkerStatus(workerId, WorkerStatus.ACTIVE);
    }

    private boolean setWorkerStatus(String workerId, WorkerStatus status) {
        Worker worker = workers.get(workerId);
        if (worker == null) {
            return false;
        }
        worker.setStatus(status);
        log.info("Worker status changed: workerId={}, status={}", workerId, status);
        return true;
    }

    public synchronized List<Worker.WorkerInfo> getWorkers() {
        return workers.values().stream().map(Worker::info).toList();
    }

    public synchronized QueueStats getStats() {
        Map<TaskStatus, Integer> byStatus = new EnumMap<>(TaskStatus.class);
        Map<RequestPriority, Long> byPriority = new EnumMap<>(RequestPriority.class);
        Map<TaskKind, Long> byKind = new EnumMap<>(TaskKind.class);
        for (QueueTask task : tasks.values()) {
            byStatus.merge(task.status, 1, Integer::sum);
            byPriority.merge(task.priority, 1L, Long::sum);
            byKind.merge(task.kind, 1L, Long::sum);
        }

        Instant cutoff = clock.instant().minus(THROUGHPUT_WINDOW);
        while (!recentCompletions.isEmpty() && recentCompletions.peekFirst().isBefore(cutoff)) {
            recentCompletions.removeFirst();
        }

        long finished = totalCompleted + totalFailed;
        int activeWorkers = (int) workers.values().stream()
                .filter(worker -> worker.getStatus() == WorkerStatus.ACTIVE)
                .count();

        return new QueueStats(
                tasks.size(),
                byStatus.getOrDefault(TaskStatus.PENDING, 0),
                byStatus.getOrDefault(TaskStatus.SCHEDULED, 0),
                byStatus.getOrDefault(TaskStatus.RUNNING, 0),
                byStatus.getOrDefault(TaskStatus.COMPLETED, 0),
                byStatus.getOrDefault(TaskStatus.FAILED, 0),
                byStatus.getOrDefault(TaskStatus.CANCELLED, 0),
                deadLetters.size(),
                totalCompleted,
                totalFailed,
                totalRetries,
                finished == 0 ? 0.0 : (double) totalCompleted / finished,
                executions == 0 ? 0.0 : (double) totalExecutionMs / executions,
                waits == 0 ? 0.0 : (double) totalWaitMs / waits,
                recentCompletions.size(),
                byPriority,
                byKind,
                activeWorkers
        );
    }

    /**
     * Loads tasks and dead letters from a snapshot. Running tasks come back as pending.
     * Ignored unless the queue is empty.
     */
    public synchronized void restore(Collection<TaskView> restoredTasks, Collection<TaskView> restoredDeadLetters) {
        if (!tasks.isEmpty()) {
            log.warn("Queue not empty, snapshot ignored: tasks={}", tasks.size());
            return;
        }
        for (TaskView view : restoredTasks) {
            tasks.put(view.id(), QueueTask.restore(view, sequence++));
        }
        deadLetters.addAll(restoredDeadLetters);
        log.info("Queue restored: tasks={}, deadLetters={}", tasks.size(), deadLetters.size());
    }

    public synchronized List<TaskView> snapshotTasks() {
        return tasks.values().stream().map(QueueTask::toView).toList();
    }

    public void addListener(Consumer<QueueEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<QueueEvent> listener) {
        listeners.remove(listener);
    }

    private void emit(QueueEvent.Type type, QueueTask task) {
        if (listeners.isEmpty()) {
            return;
        }
        QueueEvent event = new QueueEvent(type, task.toView(), clock.instant());
        for (Consumer<QueueEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying queue listener: type={}, taskId={}", type, task.id, e);
            }
        }
    }

    private void countTask(QueueTask task, String status) {
        if (metrics != null) {
            metrics.incrementTaskCount(task.kind.name(), status);
        }
    }

    private int weightOf(RequestPriority priority) {
        return settings.priorityWeights().getOrDefault(priority, priority.getDefaultWeight());
    }

    public Settings getSettings() {
        return settings;
    }

    private record Dispatch(TaskView task, int attempt, Worker worker, Instant startedAt) {
    }

    /**
     * Queue limits and retry policy.
     *
     * @param maxConcurrent     tasks running at once across all workers
     * @param maxQueueSize      unfinished tasks held at once
     * @param defaultTimeout    per-attempt timeout when the task sets none
     * @param defaultMaxRetries retries when the task sets none
     * @param retryBaseDelay    delay before the first retry, doubled for each later one
     * @param retryMaxDelay     cap on the retry delay
     * @param deadLetterEnabled whether failed tasks are copied to the dead-letter set
     * @param priorityWeights   dispatch weight per priority, defaults from {@link RequestPriority}
     * @param tickInterval      dispatch period
     */
    public record Settings(
            int maxConcurrent,
            int maxQueueSize,
            Duration defaultTimeout,
            int defaultMaxRetries,
            Duration retryBaseDelay,
            Duration retryMaxDelay,
            boolean deadLetterEnabled,
            Map<RequestPriority, Integer> priorityWeights,
            Duration tickInterval
    ) {
        public static final Settings DEFAULT = new Settings(5, 1000, Duration.ofMinutes(5), 3,
                Duration.ofSeconds(1), Duration.ofMinutes(1), true, Map.of(), Duration.ofSeconds(1));

        public Settings {
            if (maxConcurrent < 1 || maxQueueSize < 1) {
                throw new IllegalArgumentException("Queue limits must be positive");
            }
            priorityWeights = priorityWeights != null ? Map.copyOf(priorityWeights) : Map.of();
        }
    }
}
