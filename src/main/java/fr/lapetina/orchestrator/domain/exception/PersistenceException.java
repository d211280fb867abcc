package fr.lapetina.orchestrator.domain.exception;

import fr.lapetina.orchestrator.domain.model.ErrorType;

/**
 * Snapshot save or load failure. Always logged, never fatal.
 */
public final class PersistenceException extends OrchestrationException {

    public PersistenceException(String message, Throwable cause) {
        super(ErrorType.PERSISTENCE_ERROR, message, cause);
    }
}
