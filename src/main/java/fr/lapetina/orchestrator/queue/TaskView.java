package fr.lapetina.orchestrator.queue;

import fr.lapetina.orchestrator.domain.model.RequestPriority;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Immutable copy of a task's state, handed to handlers, listeners, the HTTP API and snapshots.
 */
public record TaskView(
        String id,
        TaskKind kind,
        Map<String, Object> payload,
        RequestPriority priority,
        String requesterIdentity,
        String sessionId,
        int maxRetries,
        int retryCount,
        long timeoutMs,
        Set<String> dependencies,
        String requiredModel,
        long expectedUnits,
        boolean retryable,
        Set<String> tags,
        String cacheKey,
        boolean cacheable,
        TaskStatus status,
        Object result,
        String error,
        TaskProgress progress,
        String workerId,
        Instant createdAt,
        Instant scheduledAt,
        Instant startedAt,
        Instant completedAt,
        Instant failedAt,
        Instant notBefore
) {
}
