package fr.lapetina.orchestrator.queue;

/**
 * Progress reported by a running task.
 */
public record TaskProgress(int current, int total, String message) {

    public static final TaskProgress NONE = new TaskProgress(0, 0, null);

    public TaskProgress {
        if (current < 0 || total < 0) {
            throw new IllegalArgumentException("Progress must not be negative");
        }
    }
}
