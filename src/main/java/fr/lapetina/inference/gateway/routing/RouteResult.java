package fr.lapetina.inference.gateway.routing;

import fr.lapetina.inference.gateway.domain.model.Endpoint;
import fr.lapetina.inference.gateway.domain.model.GatewayError;

import java.util.Objects;

/**
 * Outcome of routing one request across its candidate targets.
 *
 * @param <T> what a successful target produced
 */
public sealed interface RouteResult<T> permits RouteResult.Served, RouteResult.Failed {

    /**
     * @param endpoint  endpoint that served the request
     * @param value     adaptor result
     * @param failovers number of targets that failed before this one
     */
    record Served<T>(Endpoint endpoint, T value, int failovers) implements RouteResult<T> {
        public Served {
            Objects.requireNonNull(endpoint, "Endpoint is required");
            Objects.requireNonNull(value, "Value is required");
        }
    }

    /**
     * @param error        error returned to the client
     * @param lastEndpoint last endpoint attempted, null when none was
     */
    record Failed<T>(GatewayError error, Endpoint lastEndpoint) implements RouteResult<T> {
        public Failed {
            Objects.requireNonNull(error, "Error is required");
        }
    }
}
