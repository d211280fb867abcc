package fr.lapetina.orchestrator.domain.exception;

import fr.lapetina.orchestrator.domain.model.ErrorType;

/**
 * Base class of all orchestration failures. Carries an {@link ErrorType}
 * so callers can map errors to HTTP statuses and metrics without instanceof chains.
 */
public class OrchestrationException extends RuntimeException {

    private final ErrorType errorType;

    public OrchestrationException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public OrchestrationException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
