package fr.lapetina.orchestrator;

import fr.lapetina.orchestrator.admission.AdmissionController;
import fr.lapetina.orchestrator.admission.AdmissionDecision;
import fr.lapetina.orchestrator.admission.AdmissionDeniedException;
import fr.lapetina.orchestrator.admission.AdmissionStats;
import fr.lapetina.orchestrator.admission.RateLimitRule;
import fr.lapetina.orchestrator.admission.UserTier;
import fr.lapetina.orchestrator.cache.CacheOptions;
import fr.lapetina.orchestrator.cache.CacheStats;
import fr.lapetina.orchestrator.cache.Fingerprinter;
import fr.lapetina.orchestrator.cache.ResponseCache;
import fr.lapetina.orchestrator.domain.exception.PersistenceException;
import fr.lapetina.orchestrator.domain.exception.QueueFullException;
import fr.lapetina.orchestrator.domain.exception.UnsatisfiedDependencyException;
import fr.lapetina.orchestrator.domain.model.AiInstance;
import fr.lapetina.orchestrator.domain.model.RequestContext;
import fr.lapetina.orchestrator.domain.model.RequestPriority;
import fr.lapetina.orchestrator.domain.model.SelectionResult;
import fr.lapetina.orchestrator.domain.provider.ProviderResult;
import fr.lapetina.orchestrator.domain.strategy.SelectionStrategy;
import fr.lapetina.orchestrator.infrastructure.health.InstanceRegistry;
import fr.lapetina.orchestrator.infrastructure.persistence.OrchestratorSnapshot;
import fr.lapetina.orchestrator.infrastructure.persistence.SnapshotStore;
import fr.lapetina.orchestrator.queue.ProviderTaskHandler;
import fr.lapetina.orchestrator.queue.QueueStats;
import fr.lapetina.orchestrator.queue.TaskFilter;
import fr.lapetina.orchestrator.queue.TaskKind;
import fr.lapetina.orchestrator.queue.TaskQueue;
import fr.lapetina.orchestrator.queue.TaskSpec;
import fr.lapetina.orchestrator.queue.TaskView;
import fr.lapetina.orchestrator.selection.InstanceSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Entry point for applications: task submission behind admission control, direct selection
 * and cached calls, instance and rule management, statistics and snapshots.
 *
 * <p>Submission errors ({@link AdmissionDeniedException},
 * {@link fr.lapetina.orchestrator.domain.exception.QueueFullException},
 * {@link fr.lapetina.orchestrator.domain.exception.UnsatisfiedDependencyException}) are thrown
 * synchronously; execution errors end up on the task.
 */
public final class OrchestrationService {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationService.class);

    private final InstanceRegistry registry;
    private final InstanceSelector selector;
    private final AdmissionController admission;
    private final ResponseCache cache;
    private final Fingerprinter fingerprinter;
    private final TaskQueue queue;
    private final ProviderTaskHandler providerHandler;
    private final SnapshotStore snapshotStore;
    private final Clock clock;

    public OrchestrationService(
            InstanceRegistry registry,
            InstanceSelector selector,
            AdmissionController admission,
            ResponseCache cache,
            Fingerprinter fingerprinter,
            TaskQueue queue,
            ProviderTaskHandler providerHandler,
            SnapshotStore snapshotStore,
            Clock clock
    ) {
        this.registry = registry;
        this.selector = selector;
        this.admission = admission;
        this.cache = cache;
        this.fingerprinter = fingerprinter;
        this.queue = queue;
        this.providerHandler = providerHandler;
        this.snapshotStore = snapshotStore;
        this.clock = clock;
    }

    // ---- Tasks ----

    /**
     * Submits a task with default options.
     */
    public String submitTask(TaskKind kind, Map<String, Object> payload, RequestPriority priority,
                             String identity, UserTier tier) {
        TaskSpec spec = TaskSpec.builder(kind)
                .payload(payload)
                .priority(priority)
                .requesterIdentity(identity)
                .build();
        return submitTask(spec, tier, null);
    }

    public String submitTask(TaskSpec spec, UserTier tier) {
        return submitTask(spec, tier, null);
    }

    /**
     * Checks that the queue can take the task, then checks admission for the requester and
     * enqueues the task. A task the queue refuses is not charged against the requester's quota.
     *
     * @param endpoint endpoint checked by admission control, or null for the kind's default
     * @return the task id
     * @throws AdmissionDeniedException        if admission control denies the request
     * @throws QueueFullException              if the queue holds its maximum of unfinished tasks
     * @throws UnsatisfiedDependencyException if a dependency is unknown or not completed
     */
    public String submitTask(TaskSpec spec, UserTier tier, String endpoint) {
        queue.checkAcceptable(spec);
        String effectiveEndpoint = endpoint != null ? endpoint : spec.kind().getDefaultEndpoint();
        AdmissionDecision decision = admission.check(effectiveEndpoint, spec.requesterIdentity(), tier, spec.payload());
        if (!decision.allowed()) {
            log.info("Task submission denied: identity={}, endpoint={}, reason={}, retryAfterSeconds={}",
                    spec.requesterIdentity(), effectiveEndpoint, decision.reason(), decision.retryAfterSeconds());
            throw new AdmissionDeniedException(decision);
        }
        if (decision.warning() != null) {
            log.warn("Admission warning: identity={}, endpoint={}, warning={}",
                    spec.requesterIdentity(), effectiveEndpoint, decision.warning());
        }
        return queue.enqueue(spec);
    }

    public Optional<TaskView> getTask(String taskId) {
        return queue.getTask(taskId);
    }

    public List<TaskView> listTasks(TaskFilter filter) {
        return queue.listTasks(filter);
    }

    public boolean cancelTask(String taskId) {
        return queue.cancel(taskId);
    }

    public boolean retryTask(String taskId) {
        return queue.retry(taskId);
    }

    public List<TaskView> getDeadLetters() {
        return queue.getDeadLetters();
    }

    // ---- Admission, selection, cache ----

    public AdmissionDecision checkAdmission(String endpoint, String identity, UserTier tier) {
        return admission.check(endpoint, identity, tier);
    }

    public AdmissionDecision checkAdmission(String endpoint, String identity, UserTier tier, Object content) {
        return admission.check(endpoint, identity, tier, content);
    }

    public SelectionResult selectInstance(RequestContext context) {
        return selector.select(context);
    }

    /**
     * Returns the cached value for {@code key}, or runs the operation and caches its result.
     */
    public <T> CompletableFuture<T> cachedCall(String key, Supplier<CompletableFuture<T>> operation, CacheOptions options) {
        return cache.wrapAsync(key, operation, options);
    }

    /**
     * Calls a provider directly, bypassing the queue, through the cache keyed on model and payload.
     */
    public CompletableFuture<ProviderResult> cachedCall(RequestContext context, Map<String, Object> payload,
                                                        CacheOptions options) {
        String key = fingerprinter.fingerprint(context.model(), payload);
        return cache.wrapAsync(key, () -> providerHandler.invoke(context, payload), options);
    }

    // ---- Instances and rules ----

    public void registerInstance(AiInstance instance) {
        registry.register(instance);
    }

    public boolean deregisterInstance(String instanceId) {
        return registry.deregister(instanceId) != null;
    }

    public List<AiInstance> getInstances() {
        return registry.getAll();
    }

    public void setStrategy(SelectionStrategy strategy) {
        selector.setStrategy(strategy);
    }

    public void addRule(RateLimitRule rule) {
        admission.addRule(rule);
    }

    public void updateRule(RateLimitRule rule) {
        admission.updateRule(rule);
    }

    public boolean removeRule(String ruleId) {
        return admission.removeRule(ruleId);
    }

    public List<RateLimitRule> getRules() {
        return admission.getRules();
    }

    // ---- Stats and snapshots ----

    public OrchestratorStats getStats() {
        QueueStats queueStats = queue.getStats();
        CacheStats cacheStats = cache.getStats();
        return new OrchestratorStats(
                clock.instant(),
                queue.depth(),
                queueStats.successRate(),
                cacheStats.hitRate(),
                admission.getLoadMonitor().getSystemLoad(),
                queueStats,
                cacheStats,
                admission.getStats(),
                selector.getAllInstanceStats()
        );
    }

    /**
     * Writes the current state to the snapshot store. Failures are logged, never thrown.
     *
     * @return whether the snapshot was written
     */
    public boolean saveSnapshot() {
        if (snapshotStore == null) {
            return false;
        }
        try {
            CacheStats cacheStats = cache.getStats();
            AdmissionStats admissionStats = admission.getStats();
            snapshotStore.save(new OrchestratorSnapshot(
                    OrchestratorSnapshot.CURRENT_VERSION,
                    clock.instant(),
                    queue.snapshotTasks(),
                    queue.getDeadLetters(),
                    admissionStats.totalRequests(),
                    admissionStats.blockedRequests(),
                    admission.getLoadMonitor().getSystemLoad(),
                    cacheStats.hits(),
                    cacheStats.misses()
            ));
            return true;
        } catch (PersistenceException e) {
            log.error("Snapshot not saved: {}", e.getMessage(), e);
            return false;
        }
    }

    /**
     * Restores the last snapshot, if any. A missing or unreadable snapshot means a cold start.
     *
     * @return whether a snapshot was restored
     */
    public boolean restoreSnapshot() {
        if (snapshotStore == null) {
            return false;
        }
        Optional<OrchestratorSnapshot> loaded = snapshotStore.load();
        if (loaded.isEmpty()) {
            return false;
        }
        OrchestratorSnapshot snapshot = loaded.get();
        queue.restore(snapshot.tasks(), snapshot.deadLetters());
        admission.restoreCounters(snapshot.admissionTotal(), snapshot.admissionBlocked());
        admission.getLoadMonitor().restore(snapshot.systemLoad());
        cache.restoreCounters(snapshot.cacheHits(), snapshot.cacheMisses());
        log.info("State restored from snapshot: savedAt={}, tasks={}", snapshot.savedAt(), snapshot.tasks().size());
        return true;
    }

    public TaskQueue getQueue() {
        return queue;
    }

    public InstanceSelector getSelector() {
        return selector;
    }

    public AdmissionController getAdmission() {
        return admission;
    }

    public ResponseCache getCache() {
        return cache;
    }

    public InstanceRegistry getRegistry() {
        return registry;
    }
}
