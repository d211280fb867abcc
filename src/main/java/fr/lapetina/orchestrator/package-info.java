/**
 * AI request orchestration layer: admission control, instance selection, response caching and a
 * prioritized task queue in front of a pool of AI provider instances.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.orchestrator.OrchestratorFactory} - Builds a fully-wired orchestrator
 *       from YAML configuration</li>
 *   <li>{@link fr.lapetina.orchestrator.OrchestrationService} - Task submission, cached calls,
 *       instance and rule management</li>
 *   <li>{@link fr.lapetina.orchestrator.OrchestratorApplication} - Standalone HTTP server</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (OrchestratorFactory factory = OrchestratorFactory.create("config.yaml").start()) {
 *     OrchestrationService service = factory.getService();
 *
 *     String taskId = service.submitTask(TaskKind.CHAT, Map.of("prompt", "Hello!"),
 *             RequestPriority.NORMAL, "user-1", UserTier.AUTHENTICATED);
 *
 *     Optional<TaskView> task = service.getTask(taskId);
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Selection strategies: round-robin, weighted, least-connections, least-response-time,
 *       cost-optimized and adaptive</li>
 *   <li>Per-tier rate limits with sliding window, token bucket, leaky bucket and adaptive algorithms</li>
 *   <li>Response cache with per-content-type TTL and entry and size bounds</li>
 *   <li>Retries with exponential backoff and a dead-letter list</li>
 *   <li>Hot-reload configuration without restart</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.orchestrator.OrchestratorFactory
 * @see fr.lapetina.orchestrator.OrchestrationService
 */
package fr.lapetina.orchestrator;
