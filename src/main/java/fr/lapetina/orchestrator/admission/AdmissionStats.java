package fr.lapetina.orchestrator.admission;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate admission counters.
 */
public record AdmissionStats(
        long totalRequests,
        long blockedRequests,
        double blockRate,
        int trackedStates,
        double systemLoad,
        double loadFactor,
        List<IdentityStats> identities
) {

    /**
     * Counters of one requester.
     */
    public record IdentityStats(
            String identity,
            UserTier tier,
            long requests,
            long blocked,
            Instant lastSeen
    ) {
    }
}
