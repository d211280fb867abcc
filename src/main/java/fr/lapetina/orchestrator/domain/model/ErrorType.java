package fr.lapetina.orchestrator.domain.model;

/**
 * Error taxonomy for orchestration failures.
 * Used for exception classification, HTTP status mapping and metrics.
 */
public enum ErrorType {
    /** Invalid request (unknown task kind, malformed payload, bad rule) */
    CLIENT_ERROR,

    /** The provider call failed */
    PROVIDER_ERROR,

    /** No active instance can serve the requested model */
    NO_AVAILABLE_INSTANCE,

    /** The task queue is full */
    CAPACITY_ERROR,

    /** Admission control denied the request */
    RATE_LIMITED,

    /** A task dependency is missing or not completed */
    DEPENDENCY_ERROR,

    /** The task did not finish within its timeout */
    TIMEOUT,

    /** The circuit breaker of the target instance is open */
    CIRCUIT_OPEN,

    /** Snapshot save or load failed */
    PERSISTENCE_ERROR,

    /** Internal system error */
    INTERNAL_ERROR
}
