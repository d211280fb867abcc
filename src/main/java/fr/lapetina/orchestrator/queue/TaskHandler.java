package fr.lapetina.orchestrator.queue;

import java.util.concurrent.CompletableFuture;

/**
 * Executes a task on behalf of a worker.
 */
@FunctionalInterface
public interface TaskHandler {

    /**
     * Starts the task. Must not block; the queue applies the task timeout to the returned future.
     *
     * @return a future completing with the task result, or exceptionally on failure
     */
    CompletableFuture<Object> handle(TaskView task);
}
