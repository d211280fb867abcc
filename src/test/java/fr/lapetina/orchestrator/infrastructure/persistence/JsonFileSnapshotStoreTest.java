package fr.lapetina.orchestrator.infrastructure.persistence;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.orchestrator.domain.model.RequestPriority;
import fr.lapetina.orchestrator.queue.TaskKind;
import fr.lapetina.orchestrator.queue.TaskQueue;
import fr.lapetina.orchestrator.queue.TaskSpec;
import fr.lapetina.orchestrator.queue.TaskStatus;
import fr.lapetina.orchestrator.queue.TaskView;
import fr.lapetina.orchestrator.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class JsonFileSnapshotStoreTest {

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;
    private JsonFileSnapshotStore store;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        store = new JsonFileSnapshotStore(tempDir.resolve("state/snapshot.json"), objectMapper);
    }

    private static List<TaskView> sampleTasks() {
        TaskQueue queue = new TaskQueue(TaskQueue.Settings.DEFAULT, null, new MutableClock());
        queue.enqueue(TaskSpec.builder(TaskKind.CHAT)
                .payload(Map.of("prompt", "hello"))
                .priority(RequestPriority.HIGH)
                .requesterIdentity("u1")
                .tags(Set.of("demo"))
                .build());
        return queue.snapshotTasks();
    }

    @Test
    @DisplayName("should report a cold start when no snapshot exists")
    void shouldReturnEmptyWithoutFile() {
        assertThat(store.load()).isEmpty();
    }

    @Test
    @DisplayName("should read back what it saved")
    void shouldSaveAndLoad() {
        List<TaskView> tasks = sampleTasks();
        OrchestratorSnapshot snapshot = new OrchestratorSnapshot(OrchestratorSnapshot.CURRENT_VERSION,
                Instant.parse("2024-01-01T00:00:00Z"), tasks, List.of(), 42, 7, 0.35, 10, 4);

        store.save(snapshot);

        assertThat(store.getPath()).exists();
        assertThat(store.getPath().resolveSibling("snapshot.json.tmp")).doesNotExist();
        OrchestratorSnapshot loaded = store.load().orElseThrow();
        assertThat(loaded.admissionTotal()).isEqualTo(42);
        assertThat(loaded.admissionBlocked()).isEqualTo(7);
        assertThat(loaded.systemLoad()).isEqualTo(0.35);
        assertThat(loaded.cacheHits()).isEqualTo(10);
        assertThat(loaded.tasks()).singleElement().satisfies(task -> {
            assertThat(task.id()).isEqualTo(tasks.get(0).id());
            assertThat(task.kind()).isEqualTo(TaskKind.CHAT);
            assertThat(task.priority()).isEqualTo(RequestPriority.HIGH);
            assertThat(task.status()).isEqualTo(TaskStatus.PENDING);
            assertThat(task.payload()).containsEntry("prompt", "hello");
            assertThat(task.tags()).containsExactly("demo");
            assertThat(task.createdAt()).isEqualTo(tasks.get(0).createdAt());
        });
    }

    @Test
    @DisplayName("should ignore a corrupt snapshot")
    void shouldIgnoreCorruptFile() throws IOException {
        Files.createDirectories(store.getPath().getParent());
        Files.writeString(store.getPath(), "{ not json");

        assertThat(store.load()).isEmpty();
    }

    @Test
    @DisplayName("should ignore a snapshot from a newer format")
    void shouldIgnoreNewerVersion() {
        store.save(new OrchestratorSnapshot(OrchestratorSnapshot.CURRENT_VERSION + 1, Instant.EPOCH,
                List.of(), List.of(), 0, 0, 0, 0, 0));

        assertThat(store.load()).isEmpty();
    }
}
