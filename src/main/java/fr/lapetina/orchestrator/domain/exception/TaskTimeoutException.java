package fr.lapetina.orchestrator.domain.exception;

import fr.lapetina.orchestrator.domain.model.ErrorType;

import java.time.Duration;

/**
 * Thrown when a task does not finish within its timeout.
 */
public final class TaskTimeoutException extends OrchestrationException {

    public TaskTimeoutException(String taskId, Duration timeout) {
        super(ErrorType.TIMEOUT, "Task " + taskId + " timed out after " + timeout.toMillis() + "ms");
    }
}
