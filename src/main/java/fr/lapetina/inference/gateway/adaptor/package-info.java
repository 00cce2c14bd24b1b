/**
 * Adaptor seam between the gateway and heterogeneous backends.
 *
 * <p>An {@link fr.lapetina.inference.gateway.adaptor.EndpointAdaptor} serves one model deployment
 * and a {@link fr.lapetina.inference.gateway.adaptor.ClusterAdaptor} reports what a cluster is
 * running. Adaptors never throw: every operation completes with a tagged result such as
 * {@link fr.lapetina.inference.gateway.adaptor.TaskResult}.
 *
 * <h2>Built-in types</h2>
 * <ul>
 *   <li>{@code remote-execution} - Submits work to an execution fabric</li>
 *   <li>{@code remote-execution-multi-user} - Same, running under the caller's identity</li>
 *   <li>{@code direct-api} - Plain OpenAI compatible HTTP API</li>
 *   <li>{@code static} - Cluster that always reports its endpoints running</li>
 * </ul>
 *
 * New types are added through {@link fr.lapetina.inference.gateway.adaptor.AdaptorRegistry#builder()}.
 */
package fr.lapetina.inference.gateway.adaptor;
