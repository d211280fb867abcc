package fr.lapetina.orchestrator.selection;

import fr.lapetina.orchestrator.domain.model.InstanceSnapshot;
import fr.lapetina.orchestrator.domain.model.PerformanceSample;

import java.util.List;

/**
 * Instance state together with its recent outcomes and current adaptive score.
 */
public record InstanceStats(
        InstanceSnapshot instance,
        List<PerformanceSample> recentHistory,
        double adaptiveScore
) {
}
