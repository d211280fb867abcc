package fr.lapetina.orchestrator.infrastructure.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.orchestrator.domain.exception.ProviderException;
import fr.lapetina.orchestrator.domain.model.AiInstance;
import fr.lapetina.orchestrator.domain.model.ErrorType;
import fr.lapetina.orchestrator.domain.provider.ProviderInvoker;
import fr.lapetina.orchestrator.domain.provider.ProviderResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Calls provider instances over HTTP with a circuit breaker per instance.
 *
 * <p>The payload is posted as JSON with the model added. The response is read as
 * {@code {"result": ..., "unitsConsumed": n, "cost": x}}; when {@code result} is absent the whole
 * body is the result, units fall back to {@code usage.total_tokens} and cost to units times the
 * instance's cost per unit.
 */
public final class HttpProviderInvoker implements ProviderInvoker {

    private static final Logger log = LoggerFactory.getLogger(HttpProviderInvoker.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String invokePath;
    private final Duration requestTimeout;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Map<String, CircuitBreaker> circuitBreakers = new ConcurrentHashMap<>();

    public HttpProviderInvoker(
            HttpClient httpClient,
            ObjectMapper objectMapper,
            Clock clock,
            String invokePath,
            Duration requestTimeout,
            int failureThreshold,
            Duration recoveryTimeout
    ) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.invokePath = invokePath.startsWith("/") ? invokePath : "/" + invokePath;
        this.requestTimeout = requestTimeout;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
    }

    @Override
    public CompletableFuture<ProviderResult> invoke(AiInstance instance, String model, Map<String, Object> payload) {
        CircuitBreaker breaker = circuitBreakerFor(instance.getId());
        if (!breaker.tryAcquirePermission()) {
            log.warn("Call blocked by circuit breaker: instanceId={}, model={}", instance.getId(), model);
            return CompletableFuture.failedFuture(new ProviderException(ErrorType.CIRCUIT_OPEN, instance.getId(),
                    "Circuit breaker is open for instance: " + instance.getId(), true, null));
        }

        HttpRequest request;
        try {
            request = buildRequest(instance, model, payload);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            // a request we cannot build says nothing about the instance
            breaker.recordSuccess();
            return CompletableFuture.failedFuture(new ProviderException(ErrorType.CLIENT_ERROR, instance.getId(),
                    "Failed to build request: " + e.getMessage(), false, e));
        }

        log.debug("Sending provider request: instanceId={}, model={}, uri={}", instance.getId(), model, request.uri());
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    if (error != null) {
                        breaker.recordFailure();
                        throw new CompletionException(classify(instance, error));
                    }
                    return handleResponse(instance, response, breaker);
                });
    }

    private HttpRequest buildRequest(AiInstance instance, String model, Map<String, Object> payload)
            throws JsonProcessingException {
        Map<String, Object> body = new LinkedHashMap<>(payload);
        body.put("model", model);

        return HttpRequest.newBuilder()
                .uri(resolve(instance.getBaseUrl(), invokePath))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("X-Provider", instance.getProvider().configName())
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                .build();
    }

    private ProviderResult handleResponse(AiInstance instance, HttpResponse<String> response, CircuitBreaker breaker) {
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            breaker.recordSuccess();
            return parse(instance, response.body());
        }

        if (status == 429) {
            breaker.recordSuccess();
            throw new ProviderException(ErrorType.RATE_LIMITED, instance.getId(), "Provider rate limit (HTTP 429)", true, null);
        }
        if (status >= 400 && status < 500) {
            // the instance is up, the request is wrong
            breaker.recordSuccess();
            throw new ProviderException(ErrorType.CLIENT_ERROR, instance.getId(),
                    "HTTP " + status + ": " + errorMessage(response.body()), false, null);
        }
        breaker.recordFailure();
        throw new ProviderException(ErrorType.PROVIDER_ERROR, instance.getId(),
                "HTTP " + status + ": " + errorMessage(response.body()), true, null);
    }

    private ProviderResult parse(AiInstance instance, String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException(ErrorType.PROVIDER_ERROR, instance.getId(),
                    "Unreadable provider response: " + e.getOriginalMessage(), true, e);
        }

        Object result = objectMapper.convertValue(root.has("result") ? root.get("result") : root, Object.class);
        long units = root.has("unitsConsumed")
                ? root.get("unitsConsumed").asLong()
                : root.path("usage").path("total_tokens").asLong(0);
        double cost = root.has("cost") ? root.get("cost").asDouble() : units * instance.getCostPerUnit();
        return new ProviderResult(result, units, cost, instance.getId());
    }

    private String errorMessage(String body) {
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            if (error.isTextual()) {
                return error.asText();
            }
            if (error.has("message")) {
                return error.get("message").asText();
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: {}", e.getOriginalMessage());
        }
        return body == null || body.isBlank() ? "no body" : body;
    }

    private static ProviderException classify(AiInstance instance, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof HttpTimeoutException) {
            return new ProviderException(ErrorType.TIMEOUT, instance.getId(), "Provider timeout: " + cause.getMessage(), true, cause);
        }
        if (cause instanceof IOException) {
            return new ProviderException(ErrorType.PROVIDER_ERROR, instance.getId(),
                    "Connection error: " + cause.getClass().getSimpleName() + " " + cause.getMessage(), true, cause);
        }
        return new ProviderException(ErrorType.INTERNAL_ERROR, instance.getId(), "Unexpected error: " + cause, true, cause);
    }

    static URI resolve(URI baseUrl, String path) {
        String base = baseUrl.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + path);
    }

    private CircuitBreaker circuitBreakerFor(String instanceId) {
        return circuitBreakers.computeIfAbsent(instanceId, id ->
                new CircuitBreaker(id, failureThreshold, recoveryTimeout, 3, clock));
    }

    public CircuitBreaker getCircuitBreaker(String instanceId) {
        return circuitBreakers.get(instanceId);
    }

    public void resetCircuitBreaker(String instanceId) {
        CircuitBreaker breaker = circuitBreakers.get(instanceId);
        if (breaker != null) {
            breaker.forceState(CircuitBreaker.State.CLOSED);
        }
    }

    /**
     * Forgets the breaker of a deregistered instance.
     */
    public void removeCircuitBreaker(String instanceId) {
        circuitBreakers.remove(instanceId);
    }
}
