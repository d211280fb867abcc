package fr.lapetina.orchestrator.queue;

import fr.lapetina.orchestrator.domain.exception.NoCompatibleInstanceException;
import fr.lapetina.orchestrator.domain.exception.QueueFullException;
import fr.lapetina.orchestrator.domain.exception.UnsatisfiedDependencyException;
import fr.lapetina.orchestrator.domain.model.RequestPriority;
import fr.lapetina.orchestrator.support.ManualTickScheduler;
import fr.lapetina.orchestrator.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskQueueTest {

    private static final TaskQueue.Settings SETTINGS = new TaskQueue.Settings(10, 50, Duration.ofSeconds(5), 2,
            Duration.ofMillis(10), Duration.ofMillis(50), true, Map.of(), Duration.ofMillis(10));

    private MutableClock clock;
    private TaskQueue queue;
    private List<String> executed;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        queue = new TaskQueue(SETTINGS, null, clock);
        executed = new CopyOnWriteArrayList<>();
    }

    private TaskHandler succeeding() {
        return task -> {
            executed.add(task.id());
            return CompletableFuture.completedFuture("done:" + task.kind());
        };
    }

    private TaskHandler failing(RuntimeException error) {
        return task -> {
            executed.add(task.id());
            return CompletableFuture.failedFuture(error);
        };
    }

    private static TaskSpec chat(RequestPriority priority) {
        return TaskSpec.builder(TaskKind.CHAT)
                .payload(Map.of("prompt", "hello"))
                .priority(priority)
                .requesterIdentity("u1")
                .build();
    }

    private TaskStatus statusOf(String taskId) {
        return queue.getTask(taskId).orElseThrow().status();
    }

    @Nested
    @DisplayName("Dispatch")
    class Dispatch {

        @Test
        @DisplayName("should run higher priorities first and equal priorities in submission order")
        void shouldOrderByPriorityThenFifo() {
            queue.addWorker(new Worker("w", "worker", Set.of(), 10, succeeding()));
            String low = queue.enqueue(chat(RequestPriority.LOW));
            String normal1 = queue.enqueue(chat(RequestPriority.NORMAL));
            String critical = queue.enqueue(chat(RequestPriority.CRITICAL));
            String normal2 = queue.enqueue(chat(RequestPriority.NORMAL));
            String high = queue.enqueue(chat(RequestPriority.HIGH));

            queue.tick();

            assertThat(executed).containsExactly(critical, high, normal1, normal2, low);
            assertThat(queue.listTasks(TaskFilter.ALL)).allMatch(task -> task.status() == TaskStatus.COMPLETED);
        }

        @Test
        @DisplayName("should honour configured priority weights")
        void shouldHonourPriorityWeights() {
            TaskQueue.Settings inverted = new TaskQueue.Settings(10, 50, Duration.ofSeconds(5), 0,
                    Duration.ofMillis(10), Duration.ofMillis(50), true,
                    Map.of(RequestPriority.LOW, 200), Duration.ofMillis(10));
            TaskQueue weighted = new TaskQueue(inverted, null, clock);
            weighted.addWorker(new Worker("w", null, null, 10, succeeding()));
            String high = weighted.enqueue(chat(RequestPriority.HIGH));
            String low = weighted.enqueue(chat(RequestPriority.LOW));

            weighted.tick();

            assertThat(executed).containsExactly(low, high);
        }

        @Test
        @DisplayName("should respect worker and global concurrency limits")
        void shouldRespectConcurrencyLimits() {
            List<CompletableFuture<Object>> inFlight = new ArrayList<>();
            queue.addWorker(new Worker("w", "worker", Set.of(), 2, task -> {
                CompletableFuture<Object> future = new CompletableFuture<>();
                inFlight.add(future);
                return future;
            }));
            for (int i = 0; i < 3; i++) {
                queue.enqueue(chat(RequestPriority.NORMAL));
            }

            queue.tick();
            assertThat(inFlight).hasSize(2);
            assertThat(queue.getStats().running()).isEqualTo(2);

            inFlight.get(0).complete("ok");
            queue.tick();

            assertThat(inFlight).hasSize(3);
            assertThat(queue.getStats().completed()).isEqualTo(1);
        }

        @Test
        @DisplayName("should only hand tasks to workers accepting their kind")
        void shouldMatchWorkerKinds() {
            queue.addWorker(new Worker("chat-worker", null, Set.of(TaskKind.CHAT), 2, succeeding()));
            String chat = queue.enqueue(chat(RequestPriority.NORMAL));
            String embeddings = queue.enqueue(TaskSpec.builder(TaskKind.EMBEDDINGS).build());

            queue.tick();

            assertThat(statusOf(chat)).isEqualTo(TaskStatus.COMPLETED);
            assertThat(statusOf(embeddings)).isEqualTo(TaskStatus.SCHEDULED);
            assertThat(queue.getTask(chat).orElseThrow().workerId()).isEqualTo("chat-worker");
        }

        @Test
        @DisplayName("should skip paused workers until resumed")
        void shouldSkipPausedWorkers() {
            queue.addWorker(new Worker("w", null, null, 2, succeeding()));
            queue.pauseWorker("w");
            String id = queue.enqueue(chat(RequestPriority.NORMAL));

            queue.tick();
            assertThat(statusOf(id)).isEqualTo(TaskStatus.SCHEDULED);

            queue.resumeWorker("w");
            queue.tick();
            assertThat(statusOf(id)).isEqualTo(TaskStatus.COMPLETED);
        }

        @Test
        @DisplayName("should not start a delayed task before its start time")
        void shouldHonourDelay() {
            queue.addWorker(new Worker("w", null, null, 2, succeeding()));
            String id = queue.enqueue(TaskSpec.builder(TaskKind.CHAT).delay(Duration.ofSeconds(5)).build());

            queue.tick();
            assertThat(statusOf(id)).isEqualTo(TaskStatus.PENDING);

            clock.advance(Duration.ofSeconds(5));
            queue.tick();
            assertThat(statusOf(id)).isEqualTo(TaskStatus.COMPLETED);
        }

        @Test
        @DisplayName("should tick on the scheduler once started")
        void shouldTickOnScheduler() {
            ManualTickScheduler scheduler = new ManualTickScheduler();
            queue.addWorker(new Worker("w", null, null, 2, succeeding()));
            String id = queue.enqueue(chat(RequestPriority.NORMAL));

            queue.start(scheduler);
            scheduler.run("task-queue");

            assertThat(statusOf(id)).isEqualTo(TaskStatus.COMPLETED);
            queue.stop();
            assertThat(scheduler.isScheduled("task-queue")).isFalse();
        }
    }

    @Nested
    @DisplayName("Retries")
    class Retries {

        @Test
        @DisplayName("should double the retry delay up to the cap")
        void shouldBackOffExponentially() {
            TaskQueue slow = new TaskQueue(TaskQueue.Settings.DEFAULT, null, clock);

            assertThat(slow.retryDelayMs(0)).isEqualTo(1000);
            assertThat(slow.retryDelayMs(1)).isEqualTo(2000);
            assertThat(slow.retryDelayMs(2)).isEqualTo(4000);
            assertThat(slow.retryDelayMs(10)).isEqualTo(60_000);
        }

        @Test
        @DisplayName("should run a failing task once plus its retries then dead-letter it")
        void shouldRetryThenDeadLetter() {
            queue.addWorker(new Worker("w", null, null, 2, failing(new IllegalStateException("provider down"))));
            String id = queue.enqueue(chat(RequestPriority.NORMAL));

            queue.tick();
            TaskView afterFirst = queue.getTask(id).orElseThrow();
            assertThat(afterFirst.status()).isEqualTo(TaskStatus.SCHEDULED);
            assertThat(afterFirst.retryCount()).isEqualTo(1);
            assertThat(afterFirst.notBefore()).isEqualTo(clock.instant().plusMillis(10));

            queue.tick();
            assertThat(executed).hasSize(1);

            clock.advanceMillis(10);
            queue.tick();
            clock.advanceMillis(20);
            queue.tick();

            TaskView failed = queue.getTask(id).orElseThrow();
            assertThat(executed).hasSize(3);
            assertThat(failed.status()).isEqualTo(TaskStatus.FAILED);
            assertThat(failed.error()).isEqualTo("provider down");
            assertThat(failed.failedAt()).isNotNull();
            assertThat(queue.getDeadLetters()).singleElement()
                    .satisfies(dead -> assertThat(dead.id()).isEqualTo(id));

            QueueStats stats = queue.getStats();
            assertThat(stats.totalRetries()).isEqualTo(2);
            assertThat(stats.totalFailed()).isEqualTo(1);
            assertThat(stats.successRate()).isZero();
        }

        @Test
        @DisplayName("should not retry when no instance can serve the model")
        void shouldNotRetryNoCompatibleInstance() {
            queue.addWorker(new Worker("w", null, null, 2, failing(new NoCompatibleInstanceException("gpt-9"))));
            String id = queue.enqueue(chat(RequestPriority.NORMAL));

            queue.tick();

            assertThat(statusOf(id)).isEqualTo(TaskStatus.FAILED);
            assertThat(executed).hasSize(1);
        }

        @Test
        @DisplayName("should not retry a task marked non-retryable")
        void shouldNotRetryNonRetryableTask() {
            queue.addWorker(new Worker("w", null, null, 2, failing(new IllegalStateException("boom"))));
            String id = queue.enqueue(TaskSpec.builder(TaskKind.CHAT).retryable(false).build());

            queue.tick();

            assertThat(statusOf(id)).isEqualTo(TaskStatus.FAILED);
        }

        @Test
        @DisplayName("should requeue a failed task with a fresh retry budget")
        void shouldRetryManually() {
            AtomicInteger calls = new AtomicInteger();
            queue.addWorker(new Worker("w", null, null, 2, task -> calls.incrementAndGet() == 1
                    ? CompletableFuture.failedFuture(new IllegalStateException("first call fails"))
                    : CompletableFuture.completedFuture("recovered")));
            String id = queue.enqueue(TaskSpec.builder(TaskKind.CHAT).maxRetries(0).build());
            queue.tick();
            assertThat(statusOf(id)).isEqualTo(TaskStatus.FAILED);

            assertThat(queue.retry(id)).isTrue();
            assertThat(statusOf(id)).isEqualTo(TaskStatus.PENDING);
            queue.tick();

            TaskView task = queue.getTask(id).orElseThrow();
            assertThat(task.status()).isEqualTo(TaskStatus.COMPLETED);
            assertThat(task.result()).isEqualTo("recovered");
            assertThat(task.error()).isNull();
            assertThat(queue.retry(id)).isFalse();
        }

        @Test
        @DisplayName("should fail an attempt that exceeds its timeout")
        void shouldTimeOut() throws InterruptedException {
            CountDownLatch failed = new CountDownLatch(1);
            queue.addListener(event -> {
                if (event.type() == QueueEvent.Type.FAILED) {
                    failed.countDown();
                }
            });
            queue.addWorker(new Worker("w", null, null, 2, task -> new CompletableFuture<>()));
            String id = queue.enqueue(TaskSpec.builder(TaskKind.CHAT)
                    .timeout(Duration.ofMillis(50))
                    .maxRetries(0)
                    .build());

            queue.tick();

            assertThat(failed.await(5, TimeUnit.SECONDS)).isTrue();
            TaskView task = queue.getTask(id).orElseThrow();
            assertThat(task.status()).isEqualTo(TaskStatus.FAILED);
            assertThat(task.error()).contains("timed out after 50ms");
            assertThat(queue.getWorkers()).singleElement()
                    .satisfies(worker -> assertThat(worker.currentTasks()).isZero());
        }
    }

    @Nested
    @DisplayName("Admission to the queue")
    class Enqueue {

        @Test
        @DisplayName("should reject tasks once the queue is full")
        void shouldRejectWhenFull() {
            TaskQueue.Settings small = new TaskQueue.Settings(10, 2, Duration.ofSeconds(5), 0,
                    Duration.ofMillis(10), Duration.ofMillis(50), true, Map.of(), Duration.ofMillis(10));
            TaskQueue tiny = new TaskQueue(small, null, clock);
            tiny.addWorker(new Worker("w", null, null, 2, succeeding()));
            tiny.enqueue(chat(RequestPriority.NORMAL));
            tiny.enqueue(chat(RequestPriority.NORMAL));

            assertThatThrownBy(() -> tiny.enqueue(chat(RequestPriority.NORMAL)))
                    .isInstanceOf(QueueFullException.class)
                    .hasMessageContaining("capacity=2");

            tiny.tick();

            assertThat(tiny.enqueue(chat(RequestPriority.NORMAL))).isNotBlank();
        }

        @Test
        @DisplayName("should reject unknown or unfinished dependencies")
        void shouldRejectUnsatisfiedDependencies() {
            String pending = queue.enqueue(chat(RequestPriority.NORMAL));

            assertThatThrownBy(() -> queue.enqueue(TaskSpec.builder(TaskKind.ANALYSIS)
                    .dependencies(Set.of("missing")).build()))
                    .isInstanceOf(UnsatisfiedDependencyException.class)
                    .hasMessageContaining("does not exist");
            assertThatThrownBy(() -> queue.enqueue(TaskSpec.builder(TaskKind.ANALYSIS)
                    .dependencies(Set.of(pending)).build()))
                    .isInstanceOf(UnsatisfiedDependencyException.class)
                    .hasMessageContaining("not completed");
        }

        @Test
        @DisplayName("should accept a task whose dependencies completed")
        void shouldAcceptCompletedDependencies() {
            queue.addWorker(new Worker("w", null, null, 2, succeeding()));
            String first = queue.enqueue(chat(RequestPriority.NORMAL));
            queue.tick();

            String second = queue.enqueue(TaskSpec.builder(TaskKind.ANALYSIS).dependencies(Set.of(first)).build());
            queue.tick();

            assertThat(statusOf(second)).isEqualTo(TaskStatus.COMPLETED);
        }

        @Test
        @DisplayName("should apply queue defaults to unset limits")
        void shouldApplyDefaults() {
            TaskView task = queue.getTask(queue.enqueue(TaskSpec.builder(TaskKind.CHAT).build())).orElseThrow();

            assertThat(task.maxRetries()).isEqualTo(2);
            assertThat(task.timeoutMs()).isEqualTo(5000);
            assertThat(task.requesterIdentity()).isEqualTo("anonymous");
            assertThat(task.priority()).isEqualTo(RequestPriority.NORMAL);
            assertThat(task.cacheable()).isTrue();
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("should never run a cancelled pending task")
        void shouldNotRunCancelledTask() {
            queue.addWorker(new Worker("w", null, null, 2, succeeding()));
            String id = queue.enqueue(chat(RequestPriority.NORMAL));

            assertThat(queue.cancel(id)).isTrue();
            queue.tick();

            assertThat(statusOf(id)).isEqualTo(TaskStatus.CANCELLED);
            assertThat(executed).isEmpty();
        }

        @Test
        @DisplayName("should discard the outcome of a cancelled running task")
        void shouldDiscardOutcomeOfCancelledRunningTask() {
            CompletableFuture<Object> inFlight = new CompletableFuture<>();
            queue.addWorker(new Worker("w", null, null, 1, task -> inFlight));
            String id = queue.enqueue(chat(RequestPriority.NORMAL));
            queue.tick();
            assertThat(statusOf(id)).isEqualTo(TaskStatus.RUNNING);

            assertThat(queue.cancel(id)).isTrue();
            inFlight.complete("late result");

            TaskView task = queue.getTask(id).orElseThrow();
            assertThat(task.status()).isEqualTo(TaskStatus.CANCELLED);
            assertThat(task.result()).isNull();
            assertThat(queue.getStats().totalCompleted()).isZero();
            assertThat(queue.getWorkers()).singleElement()
                    .satisfies(worker -> assertThat(worker.currentTasks()).isZero());
        }

        @Test
        @DisplayName("should refuse to cancel finished or unknown tasks")
        void shouldRefuseFinishedTasks() {
            queue.addWorker(new Worker("w", null, null, 2, succeeding()));
            String id = queue.enqueue(chat(RequestPriority.NORMAL));
            queue.tick();

            assertThat(queue.cancel(id)).isFalse();
            assertThat(queue.cancel("missing")).isFalse();
        }
    }

    @Nested
    @DisplayName("Inspection")
    class Inspection {

        @Test
        @DisplayName("should filter tasks by status, kind and identity")
        void shouldFilterTasks() {
            queue.enqueue(chat(RequestPriority.NORMAL));
            queue.enqueue(TaskSpec.builder(TaskKind.EMBEDDINGS).requesterIdentity("u2").build());

            assertThat(queue.listTasks(new TaskFilter(null, TaskKind.EMBEDDINGS, null))).hasSize(1);
            assertThat(queue.listTasks(new TaskFilter(null, null, "u1"))).hasSize(1);
            assertThat(queue.listTasks(new TaskFilter(TaskStatus.PENDING, null, null))).hasSize(2);
            assertThat(queue.depth()).isEqualTo(2);
        }

        @Test
        @DisplayName("should report throughput and distributions")
        void shouldReportStats() {
            queue.addWorker(new Worker("w", null, null, 5, succeeding()));
            queue.enqueue(chat(RequestPriority.HIGH));
            queue.enqueue(chat(RequestPriority.NORMAL));
            queue.enqueue(TaskSpec.builder(TaskKind.EMBEDDINGS).build());
            clock.advanceMillis(100);
            queue.tick();

            QueueStats stats = queue.getStats();
            assertThat(stats.totalTasks()).isEqualTo(3);
            assertThat(stats.completed()).isEqualTo(3);
            assertThat(stats.successRate()).isEqualTo(1.0);
            assertThat(stats.averageWaitMs()).isEqualTo(100.0);
            assertThat(stats.throughputPerHour()).isEqualTo(3);
            assertThat(stats.kindDistribution()).containsEntry(TaskKind.CHAT, 2L).containsEntry(TaskKind.EMBEDDINGS, 1L);
            assertThat(stats.priorityDistribution()).containsEntry(RequestPriority.HIGH, 1L);
            assertThat(stats.activeWorkers()).isEqualTo(1);

            clock.advance(Duration.ofHours(2));
            assertThat(queue.getStats().throughputPerHour()).isZero();
        }

        @Test
        @DisplayName("should clear only completed tasks")
        void shouldClearCompleted() {
            queue.addWorker(new Worker("w", null, Set.of(TaskKind.CHAT), 2, succeeding()));
            queue.enqueue(chat(RequestPriority.NORMAL));
            String waiting = queue.enqueue(TaskSpec.builder(TaskKind.EMBEDDINGS).build());
            queue.tick();

            assertThat(queue.clearCompleted()).isEqualTo(1);
            assertThat(queue.listTasks(TaskFilter.ALL)).extracting(TaskView::id).containsExactly(waiting);
        }

        @Test
        @DisplayName("should record progress of running tasks only")
        void shouldRecordProgress() {
            queue.addWorker(new Worker("w", null, null, 1, task -> new CompletableFuture<>()));
            String id = queue.enqueue(chat(RequestPriority.NORMAL));
            String other = queue.enqueue(chat(RequestPriority.NORMAL));
            queue.tick();

            assertThat(queue.updateProgress(id, 3, 10, "chunking")).isTrue();
            assertThat(queue.updateProgress(other, 1, 10, "too early")).isFalse();
            assertThat(queue.getTask(id).orElseThrow().progress()).isEqualTo(new TaskProgress(3, 10, "chunking"));
        }

        @Test
        @DisplayName("should emit lifecycle events in order")
        void shouldEmitEvents() {
            List<QueueEvent.Type> events = new ArrayList<>();
            queue.addListener(event -> events.add(event.type()));
            queue.addWorker(new Worker("w", null, null, 1, succeeding()));

            queue.enqueue(chat(RequestPriority.NORMAL));
            queue.tick();

            assertThat(events).containsExactly(QueueEvent.Type.ADDED, QueueEvent.Type.STARTED, QueueEvent.Type.COMPLETED);
        }

        @Test
        @DisplayName("should restore running tasks as pending")
        void shouldRestoreRunningAsPending() {
            queue.addWorker(new Worker("w", null, null, 1, task -> new CompletableFuture<>()));
            String id = queue.enqueue(chat(RequestPriority.HIGH));
            queue.tick();
            List<TaskView> snapshot = queue.snapshotTasks();

            TaskQueue restored = new TaskQueue(SETTINGS, null, clock);
            restored.restore(snapshot, List.of());

            TaskView task = restored.getTask(id).orElseThrow();
            assertThat(task.status()).isEqualTo(TaskStatus.PENDING);
            assertThat(task.workerId()).isNull();
            assertThat(task.priority()).isEqualTo(RequestPriority.HIGH);
        }

        @Test
        @DisplayName("should reject duplicate worker ids")
        void shouldRejectDuplicateWorker() {
            queue.addWorker(new Worker("w", null, null, 1, succeeding()));

            assertThatThrownBy(() -> queue.addWorker(new Worker("w", null, null, 1, succeeding())))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(queue.removeWorker("w")).isTrue();
            assertThat(queue.removeWorker("w")).isFalse();
        }
    }
}
