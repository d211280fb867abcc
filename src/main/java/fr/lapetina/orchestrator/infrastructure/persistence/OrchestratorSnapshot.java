package fr.lapetina.orchestrator.infrastructure.persistence;

import fr.lapetina.orchestrator.queue.TaskView;

import java.time.Instant;
import java.util.List;

/**
 * Persisted orchestrator state. Cached values are not part of it.
 *
 * @param version          format version
 * @param savedAt          when the snapshot was taken
 * @param tasks            every task still held by the queue
 * @param deadLetters      the dead-letter set
 * @param admissionTotal   requests seen by admission control
 * @param admissionBlocked requests denied by admission control
 * @param systemLoad       last computed system load
 * @param cacheHits        cache hit counter
 * @param cacheMisses      cache miss counter
 */
public record OrchestratorSnapshot(
        int version,
        Instant savedAt,
        List<TaskView> tasks,
        List<TaskView> deadLetters,
        long admissionTotal,
        long admissionBlocked,
        double systemLoad,
        long cacheHits,
        long cacheMisses
) {
    public static final int CURRENT_VERSION = 1;

    public OrchestratorSnapshot {
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
        deadLetters = deadLetters != null ? List.copyOf(deadLetters) : List.of();
    }
}
