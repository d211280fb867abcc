package fr.lapetina.orchestrator.queue;

import java.time.Instant;

/**
 * Task lifecycle notification.
 */
public record QueueEvent(Type type, TaskView task, Instant timestamp) {

    public enum Type {
        ADDED,
        STARTED,
        COMPLETED,
        RETRY_SCHEDULED,
        FAILED,
        CANCELLED,
        RETRIED
    }
}
