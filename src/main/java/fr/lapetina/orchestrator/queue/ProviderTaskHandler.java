package fr.lapetina.orchestrator.queue;

import fr.lapetina.orchestrator.cache.CacheOptions;
import fr.lapetina.orchestrator.cache.Fingerprinter;
import fr.lapetina.orchestrator.cache.ResponseCache;
import fr.lapetina.orchestrator.domain.exception.OrchestrationException;
import fr.lapetina.orchestrator.domain.exception.ProviderException;
import fr.lapetina.orchestrator.domain.model.AiInstance;
import fr.lapetina.orchestrator.domain.model.ErrorType;
import fr.lapetina.orchestrator.domain.model.RequestContext;
import fr.lapetina.orchestrator.domain.model.SelectionResult;
import fr.lapetina.orchestrator.domain.provider.ProviderInvoker;
import fr.lapetina.orchestrator.domain.provider.ProviderResult;
import fr.lapetina.orchestrator.selection.InstanceSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Default task handler: picks an instance, takes a slot on it, calls the provider and feeds
 * the outcome back into the selector. Cacheable tasks go through the response cache first.
 *
 * <p>When the chosen instance fills up between selection and acquisition, the fallbacks
 * are tried in order.
 */
public final class ProviderTaskHandler implements TaskHandler {

    private static final Logger log = LoggerFactory.getLogger(ProviderTaskHandler.class);

    private final InstanceSelector selector;
    private final ResponseCache cache;
    private final ProviderInvoker invoker;
    private final Fingerprinter fingerprinter;
    private final Clock clock;

    public ProviderTaskHandler(
            InstanceSelector selector,
            ResponseCache cache,
            ProviderInvoker invoker,
            Fingerprinter fingerprinter,
            Clock clock
    ) {
        this.selector = Objects.requireNonNull(selector, "Selector is required");
        this.cache = cache;
        this.invoker = Objects.requireNonNull(invoker, "Invoker is required");
        this.fingerprinter = fingerprinter;
        this.clock = clock;
    }

    @Override
    public CompletableFuture<Object> handle(TaskView task) {
        String model = task.requiredModel() != null ? task.requiredModel() : task.kind().getDefaultModel();
        if (model == null) {
            return CompletableFuture.failedFuture(new ProviderException(
                    ErrorType.CLIENT_ERROR, null, "Task of kind " + task.kind() + " requires a model", false, null));
        }

        RequestContext context = RequestContext.builder()
                .model(model)
                .priority(task.priority())
                .expectedUnits(task.expectedUnits())
                .retryable(task.retryable())
                .requesterIdentity(task.requesterIdentity())
                .sessionId(task.sessionId())
                .build();

        if (!task.cacheable() || cache == null) {
            return invoke(context, task.payload()).thenApply(result -> result);
        }

        String key = task.cacheKey() != null
                ? task.cacheKey()
                : fingerprinter.fingerprint(task.kind().name(), model, task.payload());
        CacheOptions options = CacheOptions.builder()
                .contentType(task.kind().getContentType())
                .service("provider")
                .operation("task")
                .model(model)
                .build();
        return cache.wrapAsync(key, () -> invoke(context, task.payload()), options)
                .thenApply(result -> result);
    }

    /**
     * Runs one provider call for {@code context}: selection, slot, invocation, outcome.
     * The slot is released whatever the outcome.
     */
    public CompletableFuture<ProviderResult> invoke(RequestContext context, Map<String, Object> payload) {
        AiInstance instance;
        try {
            instance = acquireInstance(selector.select(context));
        } catch (OrchestrationException e) {
            return CompletableFuture.failedFuture(e);
        }

        String instanceId = instance.getId();
        long startMs = clock.millis();
        log.debug("Invoking provider: instanceId={}, model={}, identity={}",
                instanceId, context.model(), context.requesterIdentity());

        CompletableFuture<ProviderResult> call;
        try {
            call = invoker.invoke(instance, context.model(), payload);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }

        return call.handle((result, error) -> {
            long latencyMs = Math.max(0, clock.millis() - startMs);
            try {
                if (error != null) {
                    selector.recordOutcome(instanceId, latencyMs, false, 0.0);
                    log.warn("Provider call failed: instanceId={}, model={}, latencyMs={}, error={}",
                            instanceId, context.model(), latencyMs, rootMessage(error));
                    throw asCompletionException(error, instanceId);
                }
                selector.recordOutcome(instanceId, latencyMs, true, result.cost());
                instance.applyThroughput(result.unitsConsumed(), latencyMs);
                log.info("Provider call succeeded: instanceId={}, model={}, latencyMs={}, units={}, cost={}",
                        instanceId, context.model(), latencyMs, result.unitsConsumed(), result.cost());
                return result.instanceId() != null ? result : result.withInstanceId(instanceId);
            } finally {
                selector.release(instanceId);
            }
        });
    }

    private AiInstance acquireInstance(SelectionResult selection) {
        List<AiInstance> candidates = new ArrayList<>();
        candidates.add(selection.instance());
        candidates.addAll(selection.fallbacks());
        for (AiInstance candidate : candidates) {
            if (selector.acquire(candidate.getId())) {
                return candidate;
            }
        }
        throw new ProviderException(ErrorType.CAPACITY_ERROR, selection.instance().getId(),
                "All candidate instances are at capacity", true, null);
    }

    private static CompletionException asCompletionException(Throwable error, String instanceId) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof OrchestrationException) {
            return new CompletionException(cause);
        }
        return new CompletionException(new ProviderException(
                ErrorType.PROVIDER_ERROR, instanceId, rootMessage(cause), true, cause));
    }

    private static String rootMessage(Throwable error) {
        Throwable cause = error;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
