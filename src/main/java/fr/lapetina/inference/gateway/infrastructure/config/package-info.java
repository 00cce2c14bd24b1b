/**
 * Configuration loading, validation and hot-reload support.
 *
 * <p>The YAML file describes the ambient settings of the gateway and its catalog: clusters,
 * endpoints and federated endpoints. A candidate configuration goes through
 * {@link fr.lapetina.inference.gateway.infrastructure.config.ConfigValidator} and then
 * every registered listener; only when all accept it does it replace the running one.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.inference.gateway.infrastructure.config.GatewayConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.inference.gateway.infrastructure.config.ConfigLoader} - YAML loading and file watching</li>
 *   <li>{@link fr.lapetina.inference.gateway.infrastructure.config.ConfigValidator} - Structural checks</li>
 *   <li>{@link fr.lapetina.inference.gateway.infrastructure.config.ConfigChangeListener} - Callback for configuration changes</li>
 * </ul>
 */
package fr.lapetina.inference.gateway.infrastructure.config;
