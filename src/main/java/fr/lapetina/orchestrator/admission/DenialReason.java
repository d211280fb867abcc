package fr.lapetina.orchestrator.admission;

/**
 * Why a request was not admitted.
 */
public enum DenialReason {
    /** The rule's limit for the tier is exhausted */
    RATE_LIMITED,

    /** The requester exceeded the limit repeatedly and is blocked for a window */
    BLOCKED,

    /** The content validator rejected the request */
    CONTENT_REJECTED
}
