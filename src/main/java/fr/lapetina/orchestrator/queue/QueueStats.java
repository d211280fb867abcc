package fr.lapetina.orchestrator.queue;

import fr.lapetina.orchestrator.domain.model.RequestPriority;

import java.util.Map;

/**
 * Queue counters. Status counts cover the tasks currently held; completed, failed and
 * retry totals cover the queue's lifetime.
 */
public record QueueStats(
        int totalTasks,
        int pending,
        int scheduled,
        int running,
        int completed,
        int failed,
        int cancelled,
        int deadLetters,
        long totalCompleted,
        long totalFailed,
        long totalRetries,
        double successRate,
        double averageExecutionMs,
        double averageWaitMs,
        int throughputPerHour,
        Map<RequestPriority, Long> priorityDistribution,
        Map<TaskKind, Long> kindDistribution,
        int activeWorkers
) {
}
