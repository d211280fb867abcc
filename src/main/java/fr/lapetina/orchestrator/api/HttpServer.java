package fr.lapetina.orchestrator.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.orchestrator.OrchestrationService;
import fr.lapetina.orchestrator.admission.AdmissionDeniedException;
import fr.lapetina.orchestrator.admission.UserTier;
import fr.lapetina.orchestrator.api.dto.TaskRequest;
import fr.lapetina.orchestrator.api.dto.TaskResponse;
import fr.lapetina.orchestrator.domain.exception.OrchestrationException;
import fr.lapetina.orchestrator.domain.model.AiInstance;
import fr.lapetina.orchestrator.domain.model.ErrorType;
import fr.lapetina.orchestrator.domain.model.InstanceStatus;
import fr.lapetina.orchestrator.domain.strategy.AdaptiveWeights;
import fr.lapetina.orchestrator.domain.strategy.SelectionStrategy;
import fr.lapetina.orchestrator.domain.strategy.SelectionStrategyType;
import fr.lapetina.orchestrator.domain.strategy.StrategyFactory;
import fr.lapetina.orchestrator.infrastructure.config.ConfigLoader;
import fr.lapetina.orchestrator.infrastructure.config.OrchestratorConfig;
import fr.lapetina.orchestrator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.orchestrator.queue.TaskFilter;
import fr.lapetina.orchestrator.queue.TaskKind;
import fr.lapetina.orchestrator.queue.TaskSpec;
import fr.lapetina.orchestrator.queue.TaskStatus;
import fr.lapetina.orchestrator.queue.TaskView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - POST /api/tasks - Submit a task (429 with Retry-After when admission denies it)
 * - GET /api/tasks - List tasks, filtered by status, kind and identity query parameters
 * - GET /api/tasks/{id} - Task state
 * - DELETE /api/tasks/{id} - Cancel a task
 * - POST /api/tasks/{id}/retry - Retry a failed task
 * - GET /api/stats - Orchestrator statistics
 * - GET /health - Health check endpoint
 * - GET /metrics - Prometheus metrics endpoint
 * - GET /admin/instances - List all instances
 * - POST /admin/instances/{id}/maintenance - Take an instance out of rotation
 * - POST /admin/instances/{id}/activate - Put an instance back in rotation
 * - DELETE /admin/instances/{id} - Deregister an instance
 * - GET|POST /admin/strategy - Current selection strategy, or change it
 * - GET /admin/rules - Rate-limit rules
 * - GET /admin/dead-letters - Tasks that exhausted their retries
 * - POST /admin/reload - Reload configuration
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private static final String TASKS_PATH = "/api/tasks";

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final OrchestrationService service;
    private final MetricsRegistry metricsRegistry;
    private final ConfigLoader configLoader;
    private final Clock clock;

    public HttpServer(
            String host,
            int port,
            int backlog,
            OrchestrationService service,
            MetricsRegistry metricsRegistry,
            ConfigLoader configLoader,
            ObjectMapper objectMapper,
            Clock clock
    ) throws IOException {
        this.service = service;
        this.metricsRegistry = metricsRegistry;
        this.configLoader = configLoader;
        this.objectMapper = objectMapper;
        this.clock = clock;

        InetSocketAddress address = host == null || host.isBlank()
                ? new InetSocketAddress(port)
                : new InetSocketAddress(host, port);
        this.server = com.sun.net.httpserver.HttpServer.create(address, backlog);

        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "http-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext("/api/tasks", new TaskHandler());
        server.createContext("/api/stats", new StatsHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/admin", new AdminHandler());

        log.info("HTTP server configured on port {}", port);
    }

    public void start() {
        server.start();
        log.info("HTTP server started");
    }

    /**
     * Bound port; differs from the configured one when that was 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(5);
        executor.shutdownNow();
        log.info("HTTP server stopped");
    }

    // ==================== TASK HANDLER ====================

    private class TaskHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();
            MDC.put("requestId", UUID.randomUUID().toString());

            try {
                if (path.equals(TASKS_PATH) || path.equals(TASKS_PATH + "/")) {
                    if ("POST".equalsIgnoreCase(method)) {
                        handleSubmit(exchange);
                    } else if ("GET".equalsIgnoreCase(method)) {
                        handleList(exchange);
                    } else {
                        sendError(exchange, 405, "Method Not Allowed");
                    }
                    return;
                }

                String[] parts = path.substring(TASKS_PATH.length() + 1).split("/");
                String taskId = parts[0];
                if (parts.length == 1 && "GET".equalsIgnoreCase(method)) {
                    handleGet(exchange, taskId);
                } else if (parts.length == 1 && "DELETE".equalsIgnoreCase(method)) {
                    handleCancel(exchange, taskId);
                } else if (parts.length == 2 && parts[1].equals("retry") && "POST".equalsIgnoreCase(method)) {
                    handleRetry(exchange, taskId);
                } else {
                    sendError(exchange, 404, "Not Found");
                }
            } catch (Exception e) {
                log.error("Error handling task request", e);
                sendError(exchange, 500, "Internal server error: " + e.getMessage());
            } finally {
                MDC.clear();
            }
        }

        private void handleSubmit(HttpExchange exchange) throws IOException {
            TaskRequest request;
            TaskSpec spec;
            UserTier tier;
            try (InputStream is = exchange.getRequestBody()) {
                request = objectMapper.readValue(is, TaskRequest.class);
                spec = request.toTaskSpec(exchange.getRemoteAddress().getAddress().getHostAddress());
                tier = UserTier.fromName(request.getTier());
            } catch (JsonProcessingException e) {
                sendError(exchange, 400, "Malformed request body: " + e.getOriginalMessage());
                return;
            } catch (IllegalArgumentException e) {
                sendError(exchange, 400, e.getMessage());
                return;
            }

            String endpoint = request.getOptions() != null ? request.getOptions().getEndpoint() : null;
            try {
                String taskId = service.submitTask(spec, tier, endpoint);
                sendJson(exchange, 202, Map.of("taskId", taskId, "status", TaskStatus.PENDING.name()));
            } catch (AdmissionDeniedException e) {
                Long retryAfter = e.getRetryAfterSeconds();
                if (retryAfter != null) {
                    exchange.getResponseHeaders().set("Retry-After", String.valueOf(retryAfter));
                }
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("error", e.getMessage());
                body.put("reason", e.getDecision().reason().name());
                body.put("limit", e.getDecision().limit());
                body.put("remaining", e.getDecision().remaining());
                if (retryAfter != null) {
                    body.put("retryAfterSeconds", retryAfter);
                }
                sendJson(exchange, mapErrorToStatus(e.getErrorType()), body);
            } catch (OrchestrationException e) {
                log.warn("Task submission failed: {}", e.getMessage());
                sendError(exchange, mapErrorToStatus(e.getErrorType()), e.getMessage());
            }
        }

        private void handleList(HttpExchange exchange) throws IOException {
            Map<String, String> query = parseQuery(exchange.getRequestURI().getRawQuery());
            TaskFilter filter;
            try {
                filter = new TaskFilter(
                        query.containsKey("status") ? TaskStatus.valueOf(query.get("status").toUpperCase(Locale.ROOT)) : null,
                        query.containsKey("kind") ? TaskKind.fromName(query.get("kind")) : null,
                        query.get("identity")
                );
            } catch (IllegalArgumentException e) {
                sendError(exchange, 400, e.getMessage());
                return;
            }
            List<TaskResponse> tasks = service.listTasks(filter).stream()
                    .map(TaskResponse::fromTaskView)
                    .toList();
            sendJson(exchange, 200, tasks);
        }

        private void handleGet(HttpExchange exchange, String taskId) throws IOException {
            Optional<TaskView> task = service.getTask(taskId);
            if (task.isEmpty()) {
                sendError(exchange, 404, "Task not found: " + taskId);
                return;
            }
            sendJson(exchange, 200, TaskResponse.fromTaskView(task.get()));
        }

        private void handleCancel(HttpExchange exchange, String taskId) throws IOException {
            if (service.getTask(taskId).isEmpty()) {
                sendError(exchange, 404, "Task not found: " + taskId);
                return;
            }
            if (!service.cancelTask(taskId)) {
                sendError(exchange, 409, "Task already finished: " + taskId);
                return;
            }
            sendJson(exchange, 200, Map.of("taskId", taskId, "status", TaskStatus.CANCELLED.name()));
        }

        private void handleRetry(HttpExchange exchange, String taskId) throws IOException {
            if (service.getTask(taskId).isEmpty()) {
                sendError(exchange, 404, "Task not found: " + taskId);
                return;
            }
            if (!service.retryTask(taskId)) {
                sendError(exchange, 409, "Only failed tasks can be retried: " + taskId);
                return;
            }
            sendJson(exchange, 200, Map.of("taskId", taskId, "status", TaskStatus.PENDING.name()));
        }
    }

    // ==================== STATS HANDLER ====================

    private class StatsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            sendJson(exchange, 200, service.getStats());
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            List<AiInstance> instances = service.getInstances();
            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", determineOverallHealth(instances));
            health.put("timestamp", clock.millis());

            List<Map<String, Object>> instanceInfos = new ArrayList<>();
            for (AiInstance instance : instances) {
                Map<String, Object> info = new LinkedHashMap<>();
                info.put("id", instance.getId());
                info.put("status", instance.getStatus().name());
                info.put("load", instance.getCurrentLoad());
                info.put("maxConcurrent", instance.getMaxConcurrent());
                instanceInfos.add(info);
            }
            health.put("instances", instanceInfos);

            Map<String, Object> queueStats = new LinkedHashMap<>();
            queueStats.put("depth", service.getQueue().depth());
            queueStats.put("running", service.getQueue().getStats().running());
            health.put("queue", queueStats);

            int statusCode = "DOWN".equals(health.get("status")) ? 503 : 200;
            sendJson(exchange, statusCode, health);
        }

        private String determineOverallHealth(List<AiInstance> instances) {
            if (instances.isEmpty()) {
                return "DOWN";
            }
            long activeCount = instances.stream()
                    .filter(i -> i.getStatus() == InstanceStatus.ACTIVE)
                    .count();
            if (activeCount == 0) {
                return "DOWN";
            } else if (activeCount < instances.size()) {
                return "DEGRADED";
            }
            return "UP";
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== ADMIN HANDLER ====================

    private class AdminHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();

            try {
                if (path.equals("/admin/instances") && "GET".equals(method)) {
                    handleListInstances(exchange);
                } else if (path.matches("/admin/instances/[^/]+/maintenance") && "POST".equals(method)) {
                    handleInstanceStatus(exchange, path, InstanceStatus.MAINTENANCE);
                } else if (path.matches("/admin/instances/[^/]+/activate") && "POST".equals(method)) {
                    handleInstanceStatus(exchange, path, InstanceStatus.ACTIVE);
                } else if (path.matches("/admin/instances/[^/]+") && "DELETE".equals(method)) {
                    handleDeregister(exchange, path);
                } else if (path.equals("/admin/strategy") && "POST".equals(method)) {
                    handleChangeStrategy(exchange);
                } else if (path.equals("/admin/strategy") && "GET".equals(method)) {
                    handleGetStrategy(exchange);
                } else if (path.equals("/admin/rules") && "GET".equals(method)) {
                    sendJson(exchange, 200, service.getRules());
                } else if (path.equals("/admin/dead-letters") && "GET".equals(method)) {
                    sendJson(exchange, 200, service.getDeadLetters().stream().map(TaskResponse::fromTaskView).toList());
                } else if (path.equals("/admin/reload") && "POST".equals(method)) {
                    handleReloadConfig(exchange);
                } else {
                    sendError(exchange, 404, "Not Found");
                }
            } catch (Exception e) {
                log.error("Error in admin handler", e);
                sendError(exchange, 500, e.getMessage());
            }
        }

        private void handleListInstances(HttpExchange exchange) throws IOException {
            sendJson(exchange, 200, service.getSelector().getAllInstanceStats());
        }

        private void handleInstanceStatus(HttpExchange exchange, String path, InstanceStatus status) throws IOException {
            String instanceId = path.split("/")[3];
            if (service.getRegistry().get(instanceId).isEmpty()) {
                sendError(exchange, 404, "Instance not found: " + instanceId);
                return;
            }
            service.getRegistry().updateStatus(instanceId, status);
            sendJson(exchange, 200, Map.of("instance", instanceId, "status", status.name()));
        }

        private void handleDeregister(HttpExchange exchange, String path) throws IOException {
            String instanceId = path.split("/")[3];
            if (!service.deregisterInstance(instanceId)) {
                sendError(exchange, 404, "Instance not found: " + instanceId);
                return;
            }
            sendJson(exchange, 200, Map.of("instance", instanceId, "action", "deregistered"));
        }

        private void handleChangeStrategy(HttpExchange exchange) throws IOException {
            Map<String, String> request;
            try (InputStream is = exchange.getRequestBody()) {
                request = objectMapper.readValue(is, new TypeReference<Map<String, String>>() { });
            }

            String strategyName = request.get("strategy");
            if (strategyName == null || strategyName.isBlank()) {
                sendError(exchange, 400, "Missing 'strategy' field");
                return;
            }

            SelectionStrategy strategy;
            try {
                OrchestratorConfig.SelectionConfig selection = configLoader.getCurrentConfig().getSelection();
                OrchestratorConfig.AdaptiveWeightsConfig weights = selection.getAdaptiveWeights();
                strategy = StrategyFactory.create(
                        SelectionStrategyType.fromName(strategyName),
                        selection.getWeights(),
                        new AdaptiveWeights(weights.getLatency(), weights.getCost(), weights.getSuccessRate(),
                                weights.getCapacity()));
            } catch (IllegalArgumentException e) {
                sendError(exchange, 400, e.getMessage());
                return;
            }

            service.setStrategy(strategy);
            sendJson(exchange, 200, Map.of(
                    "strategy", strategy.getType().getConfigName(),
                    "message", "Strategy changed successfully"
            ));
        }

        private void handleGetStrategy(HttpExchange exchange) throws IOException {
            List<String> available = new ArrayList<>();
            for (SelectionStrategyType type : SelectionStrategyType.values()) {
                available.add(type.getConfigName());
            }
            sendJson(exchange, 200, Map.of(
                    "current", service.getSelector().getStrategy().getType().getConfigName(),
                    "available", available
            ));
        }

        private void handleReloadConfig(HttpExchange exchange) throws IOException {
            OrchestratorConfig newConfig = configLoader.reload();
            sendJson(exchange, 200, Map.of(
                    "message", "Configuration reloaded",
                    "instances", newConfig.getInstances().size(),
                    "rules", newConfig.getRateLimit().getRules().size()
            ));
        }
    }

    // ==================== HELPER METHODS ====================

    static int mapErrorToStatus(ErrorType errorType) {
        if (errorType == null) return 500;
        return switch (errorType) {
            case CLIENT_ERROR, DEPENDENCY_ERROR -> 400;
            case RATE_LIMITED -> 429;
            case NO_AVAILABLE_INSTANCE, CAPACITY_ERROR, CIRCUIT_OPEN -> 503;
            case TIMEOUT -> 504;
            default -> 500;
        };
    }

    static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            if (eq > 0) {
                params.put(URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8),
                        URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
            }
        }
        return params;
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", message != null ? message : "Unknown error");
        sendJson(exchange, statusCode, error);
    }
}
