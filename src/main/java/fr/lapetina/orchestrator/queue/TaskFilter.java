package fr.lapetina.orchestrator.queue;

/**
 * Criteria for listing tasks; null fields match everything.
 */
public record TaskFilter(TaskStatus status, TaskKind kind, String requesterIdentity) {

    public static final TaskFilter ALL = new TaskFilter(null, null, null);

    boolean matches(TaskView task) {
        return (status == null || task.status() == status)
                && (kind == null || task.kind() == kind)
                && (requesterIdentity == null || requesterIdentity.equals(task.requesterIdentity()));
    }
}
