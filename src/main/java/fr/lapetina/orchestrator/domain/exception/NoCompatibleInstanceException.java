package fr.lapetina.orchestrator.domain.exception;

import fr.lapetina.orchestrator.domain.model.ErrorType;

/**
 * Thrown when no active instance can serve a model.
 * Never retried by the task queue.
 */
public final class NoCompatibleInstanceException extends OrchestrationException {

    private final String model;

    public NoCompatibleInstanceException(String model) {
        super(ErrorType.NO_AVAILABLE_INSTANCE, "No compatible instance available for model: " + model);
        this.model = model;
    }

    public String getModel() {
        return model;
    }
}
