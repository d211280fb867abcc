package fr.lapetina.orchestrator.domain.exception;

import fr.lapetina.orchestrator.domain.model.ErrorType;

/**
 * Thrown when a task is submitted while the queue holds its maximum number of active tasks.
 */
public final class QueueFullException extends OrchestrationException {

    private final int capacity;

    public QueueFullException(int capacity) {
        super(ErrorType.CAPACITY_ERROR, "Task queue is full: capacity=" + capacity);
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }
}
