package fr.lapetina.orchestrator.infrastructure.http;

import fr.lapetina.orchestrator.domain.model.AiInstance;
import fr.lapetina.orchestrator.infrastructure.health.HealthProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Probes {@code GET {baseUrl}{path}}; any 2xx is healthy.
 */
public final class HttpHealthProbe implements HealthProbe {

    private static final Logger log = LoggerFactory.getLogger(HttpHealthProbe.class);

    private final HttpClient httpClient;
    private final String path;
    private final Duration timeout;

    public HttpHealthProbe(HttpClient httpClient, String path, Duration timeout) {
        this.httpClient = httpClient;
        this.path = path.startsWith("/") ? path : "/" + path;
        this.timeout = timeout;
    }

    @Override
    public CompletableFuture<Boolean> probe(AiInstance instance) {
        URI uri = HttpProviderInvoker.resolve(instance.getBaseUrl(), path);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .GET()
                .build();

        log.debug("Health check started: instanceId={}, uri={}", instance.getId(), uri);

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .thenApply(response -> {
                    boolean healthy = response.statusCode() >= 200 && response.statusCode() < 300;
                    if (!healthy) {
                        log.warn("Health check failed: instanceId={}, status={}", instance.getId(), response.statusCode());
                    }
                    return healthy;
                })
                .exceptionally(ex -> {
                    log.warn("Health check error: instanceId={}, error={}", instance.getId(), ex.getMessage());
                    return false;
                });
    }
}
