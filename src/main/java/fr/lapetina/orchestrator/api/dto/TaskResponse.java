package fr.lapetina.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import fr.lapetina.orchestrator.queue.TaskProgress;
import fr.lapetina.orchestrator.queue.TaskView;

import java.time.Instant;
import java.util.Locale;
import java.util.Set;

/**
 * Task state as returned by the API.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskResponse {

    private String id;
    private String kind;
    private String status;
    private String priority;
    private String identity;
    private Object result;
    private String error;
    private TaskProgress progress;
    private int retryCount;
    private int maxRetries;
    private String workerId;
    private Set<String> tags;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private Instant failedAt;
    private Instant notBefore;

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getKind() { return kind; }
    public void setKind(String kind) { this.kind = kind; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public String getPriority() { return priority; }
    public void setPriority(String priority) { this.priority = priority; }

    public String getIdentity() { return identity; }
    public void setIdentity(String identity) { this.identity = identity; }

    public Object getResult() { return result; }
    public void setResult(Object result) { this.result = result; }

    public String getError() { return error; }
    public void setError(String error) { this.error = error; }

    public TaskProgress getProgress() { return progress; }
    public void setProgress(TaskProgress progress) { this.progress = progress; }

    public int getRetryCount() { return retryCount; }
    public void setRetryCount(int retryCount) { this.retryCount = retryCount; }

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

    public String getWorkerId() { return workerId; }
    public void setWorkerId(String workerId) { this.workerId = workerId; }

    public Set<String> getTags() { return tags; }
    public void setTags(Set<String> tags) { this.tags = tags; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }

    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }

    public Instant getFailedAt() { return failedAt; }
    public void setFailedAt(Instant failedAt) { this.failedAt = failedAt; }

    public Instant getNotBefore() { return notBefore; }
    public void setNotBefore(Instant notBefore) { this.notBefore = notBefore; }

    /**
     * Creates from a task view.
     */
    public static TaskResponse fromTaskView(TaskView task) {
        TaskResponse api = new TaskResponse();
        api.setId(task.id());
        api.setKind(task.kind().name().toLowerCase(Locale.ROOT));
        api.setStatus(task.status().name());
        api.setPriority(task.priority().name());
        api.setIdentity(task.requesterIdentity());
        api.setResult(task.result());
        api.setError(task.error());
        api.setProgress(task.progress());
        api.setRetryCount(task.retryCount());
        api.setMaxRetries(task.maxRetries());
        api.setWorkerId(task.workerId());
        api.setTags(task.tags().isEmpty() ? null : task.tags());
        api.setCreatedAt(task.createdAt());
        api.setStartedAt(task.startedAt());
        api.setCompletedAt(task.completedAt());
        api.setFailedAt(task.failedAt());
        api.setNotBefore(task.notBefore());
        return api;
    }
}
