package fr.lapetina.inference.gateway.adaptor;

import fr.lapetina.inference.gateway.adaptor.fabric.MultiUserRemoteExecutionEndpointAdaptor;
import fr.lapetina.inference.gateway.adaptor.fabric.RemoteExecutionClusterAdaptor;
import fr.lapetina.inference.gateway.adaptor.fabric.RemoteExecutionEndpointAdaptor;
import fr.lapetina.inference.gateway.adaptor.http.DirectApiClusterAdaptor;
import fr.lapetina.inference.gateway.adaptor.http.DirectApiEndpointAdaptor;
import fr.lapetina.inference.gateway.adaptor.local.StaticClusterAdaptor;
import fr.lapetina.inference.gateway.domain.model.Cluster;
import fr.lapetina.inference.gateway.domain.model.Endpoint;
import fr.lapetina.inference.gateway.infrastructure.config.ConfigLoader.ConfigurationException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps configured adaptor type names to factories.
 *
 * The mapping is fixed once built. Unknown type names are rejected while the
 * configuration is loaded, never on the request path.
 */
public final class AdaptorRegistry {

    public static final String REMOTE_EXECUTION = "remote-execution";
    public static final String REMOTE_EXECUTION_MULTI_USER = "remote-execution-multi-user";
    public static final String DIRECT_API = "direct-api";
    public static final String STATIC = "static";

    private final Map<String, EndpointAdaptorFactory> endpointFactories;
    private final Map<String, ClusterAdaptorFactory> clusterFactories;

    private AdaptorRegistry(Builder builder) {
        this.endpointFactories = Map.copyOf(builder.endpointFactories);
        this.clusterFactories = Map.copyOf(builder.clusterFactories);
    }

    /**
     * Registry with the built-in variants.
     */
    public static AdaptorRegistry defaults() {
        return builder().withBuiltIns().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public EndpointAdaptor createEndpointAdaptor(Endpoint endpoint, AdaptorContext context) {
        EndpointAdaptorFactory factory = endpointFactories.get(endpoint.adaptorType());
        if (factory == null) {
            throw new ConfigurationException("Unknown endpoint adaptor type '" + endpoint.adaptorType()
                    + "' for endpoint " + endpoint.slug());
        }
        return factory.create(endpoint, context);
    }

    public ClusterAdaptor createClusterAdaptor(Cluster cluster, List<Endpoint> endpoints, AdaptorContext context) {
        ClusterAdaptorFactory factory = clusterFactories.get(cluster.adaptorType());
        if (factory == null) {
            throw new ConfigurationException("Unknown cluster adaptor type '" + cluster.adaptorType()
                    + "' for cluster " + cluster.name());
        }
        return factory.create(cluster, endpoints, context);
    }

    public Set<String> endpointTypes() {
        return endpointFactories.keySet();
    }

    public Set<String> clusterTypes() {
        return clusterFactories.keySet();
    }

    public static final class Builder {
        private final Map<String, EndpointAdaptorFactory> endpointFactories = new LinkedHashMap<>();
        private final Map<String, ClusterAdaptorFactory> clusterFactories = new LinkedHashMap<>();

        public Builder withBuiltIns() {
            endpoint(REMOTE_EXECUTION, RemoteExecutionEndpointAdaptor::new);
            endpoint(REMOTE_EXECUTION_MULTI_USER, MultiUserRemoteExecutionEndpointAdaptor::new);
            endpoint(DIRECT_API, DirectApiEndpointAdaptor::new);
            cluster(REMOTE_EXECUTION, RemoteExecutionClusterAdaptor::new);
            cluster(DIRECT_API, DirectApiClusterAdaptor::new);
            cluster(STATIC, StaticClusterAdaptor::new);
            return this;
        }

        public Builder endpoint(String type, EndpointAdaptorFactory factory) {
            endpointFactories.put(type, factory);
            return this;
        }

        public Builder cluster(String type, ClusterAdaptorFactory factory) {
            clusterFactories.put(type, factory);
            return this;
        }

        public AdaptorRegistry build() {
            return new AdaptorRegistry(this);
        }
    }
}
