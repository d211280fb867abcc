package fr.lapetina.orchestrator.domain.exception;

import fr.lapetina.orchestrator.domain.model.ErrorType;

/**
 * Failure of a provider call.
 */
public final class ProviderException extends OrchestrationException {

    private final String instanceId;
    private final boolean retryable;

    public ProviderException(String instanceId, String message, boolean retryable) {
        super(ErrorType.PROVIDER_ERROR, message);
        this.instanceId = instanceId;
        this.retryable = retryable;
    }

    public ProviderException(ErrorType errorType, String instanceId, String message, boolean retryable, Throwable cause) {
        super(errorType, message, cause);
        this.instanceId = instanceId;
        this.retryable = retryable;
    }

    public String getInstanceId() {
        return instanceId;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
