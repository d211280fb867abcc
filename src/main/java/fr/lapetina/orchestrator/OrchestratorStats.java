package fr.lapetina.orchestrator;

import fr.lapetina.orchestrator.admission.AdmissionStats;
import fr.lapetina.orchestrator.cache.CacheStats;
import fr.lapetina.orchestrator.queue.QueueStats;
import fr.lapetina.orchestrator.selection.InstanceStats;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of the whole orchestrator.
 *
 * @param timestamp       when the view was taken
 * @param queueDepth      tasks waiting to run
 * @param taskSuccessRate completed over finished tasks
 * @param cacheHitRatio   hits over lookups
 * @param systemLoad      load driving adaptive limits, in [0, 1]
 * @param queue           queue details
 * @param cache           cache details
 * @param admission       admission details
 * @param instances       per-instance health and performance
 */
public record OrchestratorStats(
        Instant timestamp,
        int queueDepth,
        double taskSuccessRate,
        double cacheHitRatio,
        double systemLoad,
        QueueStats queue,
        CacheStats cache,
        AdmissionStats admission,
        List<InstanceStats> instances
) {
}
