package fr.lapetina.orchestrator.admission;

import fr.lapetina.orchestrator.domain.exception.OrchestrationException;
import fr.lapetina.orchestrator.domain.model.ErrorType;

/**
 * Thrown at submission when admission control denies a request.
 */
public final class AdmissionDeniedException extends OrchestrationException {

    private final AdmissionDecision decision;

    public AdmissionDeniedException(AdmissionDecision decision) {
        super(decision.reason() == DenialReason.CONTENT_REJECTED ? ErrorType.CLIENT_ERROR : ErrorType.RATE_LIMITED,
                message(decision));
        this.decision = decision;
    }

    public AdmissionDecision getDecision() {
        return decision;
    }

    /**
     * Seconds to wait before retrying, or null when retrying will not help.
     */
    public Long getRetryAfterSeconds() {
        return decision.retryAfterSeconds();
    }

    private static String message(AdmissionDecision decision) {
        if (decision.reason() == DenialReason.CONTENT_REJECTED) {
            return "Request rejected: " + decision.warning();
        }
        return "Request denied: reason=" + decision.reason() + ", rule=" + decision.ruleId()
                + ", retryAfterSeconds=" + decision.retryAfterSeconds();
    }
}
