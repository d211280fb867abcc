package fr.lapetina.orchestrator.queue;

/**
 * Whether a worker takes new tasks.
 */
public enum WorkerStatus {
    ACTIVE,
    PAUSED,
    STOPPED
}
