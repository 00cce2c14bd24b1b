/**
 * Domain model classes for the federated gateway.
 *
 * <p>Configuration data ({@code Cluster}, {@code Endpoint}, {@code FederatedEndpoint}) is
 * owned by the operator and immutable at request time. Runtime data ({@code RequestLog},
 * {@code RequestMetrics}, {@code BatchJob}) is owned by the gateway.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.inference.gateway.domain.model.InferenceRequest} - OpenAI-compatible request</li>
 *   <li>{@link fr.lapetina.inference.gateway.domain.model.GatewayError} - Structured error returned instead of exceptions</li>
 *   <li>{@link fr.lapetina.inference.gateway.domain.model.BatchJob} - Batch workload with monotonic {@code BatchStatus}</li>
 *   <li>{@link fr.lapetina.inference.gateway.domain.model.ClusterStatus} - get_jobs payload used by the status cache</li>
 *   <li>{@link fr.lapetina.inference.gateway.domain.model.ErrorType} - Error taxonomy with default HTTP status</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Every type here is an immutable record or enum. Stores replace instances rather than
 * mutating them.
 */
package fr.lapetina.inference.gateway.domain.model;
