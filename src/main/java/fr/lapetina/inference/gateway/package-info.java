/**
 * Federated Inference Gateway.
 *
 * <p>A single OpenAI compatible entry point in front of model deployments spread over
 * several clusters. A request names either a logical model, which the gateway resolves
 * to one of several equivalent targets, or a specific cluster and framework.
 *
 * <h2>Architecture</h2>
 * <pre>
 * HTTP API → auth → FederatedRouter → adaptor → cluster
 *                        ↑
 *                ClusterStatusCache (refreshed in the background)
 * </pre>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (GatewayApplication app = new GatewayApplication("config.yaml")) {
 *     app.start();
 *     app.awaitShutdown();
 * }
 * }</pre>
 *
 * @see fr.lapetina.inference.gateway.GatewayFactory
 * @see fr.lapetina.inference.gateway.routing.FederatedRouter
 */
package fr.lapetina.inference.gateway;
