package fr.lapetina.inference.gateway.adaptor;

import fr.lapetina.inference.gateway.domain.model.Endpoint;

/**
 * Builds an endpoint adaptor from its configuration.
 * Throws {@code ConfigurationException} when the endpoint settings are unusable.
 */
@FunctionalInterface
public interface EndpointAdaptorFactory {

    EndpointAdaptor create(Endpoint endpoint, AdaptorContext context);
}
