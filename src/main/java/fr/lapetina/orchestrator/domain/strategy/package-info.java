/**
 * Instance selection strategies.
 *
 * <p>Each strategy receives only the instances that can currently serve the request
 * (active, model supported, spare capacity, usable quota, below the failover threshold),
 * sorted by id, and picks one. All implementations are thread-safe.
 *
 * <h2>Available Strategies</h2>
 * <table border="1">
 *   <tr><th>Strategy</th><th>Picks</th></tr>
 *   <tr><td>{@code round-robin}</td><td>Next instance in rotation</td></tr>
 *   <tr><td>{@code weighted-round-robin}</td><td>Smooth rotation proportional to weight</td></tr>
 *   <tr><td>{@code least-connections}</td><td>Lowest load ratio</td></tr>
 *   <tr><td>{@code least-response-time}</td><td>Lowest rolling latency</td></tr>
 *   <tr><td>{@code cost-optimized}</td><td>Lowest cost per unit times expected units</td></tr>
 *   <tr><td>{@code adaptive}</td><td>Highest weighted score of latency, cost, success and capacity</td></tr>
 * </table>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * SelectionStrategy strategy = StrategyFactory.create("least-connections");
 * Optional<AiInstance> instance = strategy.select(candidates, RequestContext.forModel("gpt-4", 500));
 * }</pre>
 *
 * @see fr.lapetina.orchestrator.domain.strategy.SelectionStrategy
 * @see fr.lapetina.orchestrator.domain.strategy.StrategyFactory
 */
package fr.lapetina.orchestrator.domain.strategy;
