/**
 * YAML configuration of the orchestrator and hot reload.
 *
 * <p>{@link fr.lapetina.orchestrator.infrastructure.config.ConfigLoader} reads
 * {@link fr.lapetina.orchestrator.infrastructure.config.OrchestratorConfig} from the file system or the
 * classpath and, when watching, reloads it on change and notifies each
 * {@link fr.lapetina.orchestrator.infrastructure.config.ConfigChangeListener}.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - admin HTTP server</li>
 *   <li>{@code instances} - provider instances</li>
 *   <li>{@code selection} - strategy, failover threshold and weights</li>
 *   <li>{@code healthCheck} - probe interval and timeout</li>
 *   <li>{@code http} - outbound timeouts and circuit breaker</li>
 *   <li>{@code rateLimit} - rules per tier and adaptive limits</li>
 *   <li>{@code cache} - TTLs and bounds</li>
 *   <li>{@code queue} - concurrency, retries and workers</li>
 *   <li>{@code persistence} - snapshot file</li>
 *   <li>{@code metrics} - Prometheus prefix</li>
 * </ul>
 */
package fr.lapetina.orchestrator.infrastructure.config;
