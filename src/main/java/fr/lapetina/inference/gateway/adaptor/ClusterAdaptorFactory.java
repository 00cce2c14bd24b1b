package fr.lapetina.inference.gateway.adaptor;

import fr.lapetina.inference.gateway.domain.model.Cluster;
import fr.lapetina.inference.gateway.domain.model.Endpoint;

import java.util.List;

/**
 * Builds a cluster adaptor. Receives the endpoints configured on the cluster.
 */
@FunctionalInterface
public interface ClusterAdaptorFactory {

    ClusterAdaptor create(Cluster cluster, List<Endpoint> endpoints, AdaptorContext context);
}
