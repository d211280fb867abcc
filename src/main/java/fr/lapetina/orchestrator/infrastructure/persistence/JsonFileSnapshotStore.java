package fr.lapetina.orchestrator.infrastructure.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.orchestrator.domain.exception.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Keeps the snapshot in a JSON file. Writes go to a temporary file that then replaces the
 * snapshot, so a crash mid-write leaves the previous snapshot intact.
 */
public final class JsonFileSnapshotStore implements SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileSnapshotStore.class);

    private final Path path;
    private final ObjectMapper objectMapper;

    public JsonFileSnapshotStore(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    @Override
    public void save(OrchestratorSnapshot snapshot) {
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(temp.toFile(), snapshot);
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Snapshot saved: path={}, tasks={}, deadLetters={}",
                    path, snapshot.tasks().size(), snapshot.deadLetters().size());
        } catch (IOException e) {
            throw new PersistenceException("Failed to save snapshot to " + path, e);
        }
    }

    @Override
    public Optional<OrchestratorSnapshot> load() {
        if (!Files.exists(path)) {
            log.info("No snapshot found, cold start: path={}", path);
            return Optional.empty();
        }
        try {
            OrchestratorSnapshot snapshot = objectMapper.readValue(path.toFile(), OrchestratorSnapshot.class);
            if (snapshot == null || snapshot.version() > OrchestratorSnapshot.CURRENT_VERSION) {
                log.warn("Unsupported snapshot ignored, cold start: path={}", path);
                return Optional.empty();
            }
            log.info("Snapshot loaded: path={}, savedAt={}, tasks={}", path, snapshot.savedAt(), snapshot.tasks().size());
            return Optional.of(snapshot);
        } catch (IOException e) {
            PersistenceException failure = new PersistenceException("Failed to read snapshot from " + path, e);
            log.error("Corrupt snapshot ignored, cold start: {}", failure.getMessage(), e);
            return Optional.empty();
        }
    }

    public Path getPath() {
        return path;
    }
}
