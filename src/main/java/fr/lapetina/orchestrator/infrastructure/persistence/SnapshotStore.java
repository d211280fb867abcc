package fr.lapetina.orchestrator.infrastructure.persistence;

import java.util.Optional;

/**
 * Stores the orchestrator snapshot between runs.
 */
public interface SnapshotStore {

    /**
     * @throws fr.lapetina.orchestrator.domain.exception.PersistenceException if the snapshot cannot be written
     */
    void save(OrchestratorSnapshot snapshot);

    /**
     * @return the last saved snapshot, or empty when there is none or it cannot be read
     */
    Optional<OrchestratorSnapshot> load();
}
