package fr.lapetina.orchestrator.domain.model;

/**
 * Lifecycle status of a provider instance.
 */
public enum InstanceStatus {
    /** Accepting requests */
    ACTIVE,

    /** Taken out of rotation after repeated failures; health checks may bring it back */
    INACTIVE,

    /** Reachable but saturated */
    OVERLOADED,

    /** Administratively disabled; never reactivated by health checks */
    MAINTENANCE
}
