package fr.lapetina.orchestrator.queue;

/**
 * Task lifecycle: PENDING, SCHEDULED, RUNNING, then COMPLETED, FAILED or CANCELLED.
 * A retriable failure moves a RUNNING task back to SCHEDULED.
 */
public enum TaskStatus {
    PENDING,
    SCHEDULED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
