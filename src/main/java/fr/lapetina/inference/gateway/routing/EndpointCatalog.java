package fr.lapetina.inference.gateway.routing;

import fr.lapetina.inference.gateway.adaptor.AdaptorContext;
import fr.lapetina.inference.gateway.adaptor.AdaptorRegistry;
import fr.lapetina.inference.gateway.adaptor.ClusterAdaptor;
import fr.lapetina.inference.gateway.adaptor.EndpointAdaptor;
import fr.lapetina.inference.gateway.domain.model.ApiRoute;
import fr.lapetina.inference.gateway.domain.model.Cluster;
import fr.lapetina.inference.gateway.domain.model.Endpoint;
import fr.lapetina.inference.gateway.domain.model.FederatedEndpoint;
import fr.lapetina.inference.gateway.domain.model.Target;
import fr.lapetina.inference.gateway.infrastructure.config.ConfigChangeListener;
import fr.lapetina.inference.gateway.infrastructure.config.ConfigLoader.ConfigurationException;
import fr.lapetina.inference.gateway.infrastructure.config.GatewayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Clusters, endpoints, federated endpoints and their adaptors, built from configuration.
 *
 * The whole catalog is rebuilt on reload and swapped in one step. A configuration that
 * cannot be turned into adaptors is rejected and the previous catalog stays in effect.
 * Adaptors of a replaced catalog are closed after the swap.
 */
public final class EndpointCatalog implements ConfigChangeListener, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EndpointCatalog.class);

    private final AdaptorRegistry registry;
    private final AdaptorContext context;
    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(Snapshot.EMPTY);
    private final AtomicReference<Prepared> prepared = new AtomicReference<>();

    public EndpointCatalog(AdaptorRegistry registry, AdaptorContext context) {
        this.registry = registry;
        this.context = context;
    }

    /**
     * Builds the catalog for {@code candidate} without installing it.
     *
     * @throws ConfigurationException if an adaptor cannot be created
     */
    @Override
    public void validate(GatewayConfig candidate) {
        discard(prepared.getAndSet(new Prepared(candidate, build(candidate))));
    }

    @Override
    public void onConfigRejected(GatewayConfig candidate) {
        Prepared pending = prepared.get();
        if (pending != null && pending.config == candidate && prepared.compareAndSet(pending, null)) {
            discard(pending);
        }
    }

    @Override
    public void onConfigChanged(GatewayConfig oldConfig, GatewayConfig newConfig) {
        Prepared pending = prepared.getAndSet(null);
        if (pending != null && pending.config == newConfig) {
            install(pending.snapshot);
        } else {
            discard(pending);
            apply(newConfig);
        }
    }

    /**
     * Builds a catalog from {@code config} and makes it current.
     *
     * @throws ConfigurationException if an adaptor cannot be created
     */
    public void apply(GatewayConfig config) {
        install(build(config));
    }

    private void install(Snapshot next) {
        Snapshot previous = snapshot.getAndSet(next);
        log.info("Catalog applied: clusters={}, endpoints={}, federatedEndpoints={}",
                next.clusters.size(), next.endpoints.size(), next.federated.size());
        previous.closeAdaptors();
    }

    private Snapshot build(GatewayConfig config) {
        Map<String, Cluster> clusters = new LinkedHashMap<>();
        Map<String, Endpoint> endpoints = new LinkedHashMap<>();
        Map<String, FederatedEndpoint> federated = new LinkedHashMap<>();
        try {
            for (GatewayConfig.ClusterConfig cc : config.getClusters()) {
                clusters.put(cc.getName(), toCluster(cc));
            }
            for (GatewayConfig.EndpointConfig ec : config.getEndpoints()) {
                Endpoint endpoint = toEndpoint(ec);
                endpoints.put(endpoint.slug(), endpoint);
            }
            for (GatewayConfig.FederatedEndpointConfig fc : config.getFederatedEndpoints()) {
                FederatedEndpoint fe = toFederated(fc);
                federated.put(fe.targetModelName(), fe);
            }
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigurationException("Invalid catalog entry: " + e.getMessage(), e);
        }

        Map<String, EndpointAdaptor> endpointAdaptors = new LinkedHashMap<>();
        Map<String, ClusterAdaptor> clusterAdaptors = new LinkedHashMap<>();
        Snapshot candidate = new Snapshot(clusters, endpoints, federated, endpointAdaptors, clusterAdaptors);
        try {
            for (Endpoint endpoint : endpoints.values()) {
                endpointAdaptors.put(endpoint.slug(), registry.createEndpointAdaptor(endpoint, context));
            }
            for (Cluster cluster : clusters.values()) {
                List<Endpoint> owned = endpoints.values().stream()
                        .filter(e -> e.cluster().equals(cluster.name()))
                        .toList();
                clusterAdaptors.put(cluster.name(), registry.createClusterAdaptor(cluster, owned, context));
            }
        } catch (RuntimeException e) {
            candidate.closeAdaptors();
            if (e instanceof ConfigurationException) {
                throw e;
            }
            throw new ConfigurationException("Failed to create adaptors: " + e.getMessage(), e);
        }
        return candidate;
    }

    private static Cluster toCluster(GatewayConfig.ClusterConfig cc) {
        Set<ApiRoute> routes = new LinkedHashSet<>();
        for (String path : cc.getApiRoutes()) {
            routes.add(ApiRoute.fromPath(path).orElseThrow(() ->
                    new IllegalArgumentException("Unknown API route '" + path + "' on cluster " + cc.getName())));
        }
        return new Cluster(
                cc.getName(),
                cc.getAdaptor(),
                new LinkedHashSet<>(cc.getFrameworks()),
                routes,
                cc.getAllowedGroups(),
                cc.getAllowedDomains(),
                cc.getMaintenanceNotice(),
                stringify(cc.getConfig())
        );
    }

    private static Endpoint toEndpoint(GatewayConfig.EndpointConfig ec) {
        return new Endpoint(
                ec.getSlug(),
                ec.getCluster(),
                ec.getFramework(),
                ec.getModel(),
                ec.getAdaptor(),
                ec.getAllowedGroups(),
                ec.getAllowedDomains(),
                stringify(ec.getConfig())
        );
    }

    private static FederatedEndpoint toFederated(GatewayConfig.FederatedEndpointConfig fc) {
        List<Target> targets = new ArrayList<>();
        for (GatewayConfig.TargetConfig tc : fc.getTargets()) {
            targets.add(new Target(tc.getCluster(), tc.getFramework(), tc.getModel(), tc.getEndpointSlug()));
        }
        return new FederatedEndpoint(fc.getSlug(), fc.getName(), fc.getTargetModelName(), fc.getDescription(), targets);
    }

    // YAML scalars arrive as Integer, Boolean, ...; adaptor settings are strings
    private static Map<String, String> stringify(Map<String, Object> raw) {
        Map<String, String> result = new LinkedHashMap<>();
        if (raw != null) {
            raw.forEach((key, value) -> {
                if (value != null) {
                    result.put(key, String.valueOf(value));
                }
            });
        }
        return result;
    }

    public Optional<Endpoint> endpoint(String slug) {
        return Optional.ofNullable(snapshot.get().endpoints.get(slug));
    }

    public Optional<Cluster> cluster(String name) {
        return Optional.ofNullable(snapshot.get().clusters.get(name));
    }

    public Optional<FederatedEndpoint> federatedByModel(String model) {
        return Optional.ofNullable(snapshot.get().federated.get(model));
    }

    public Collection<FederatedEndpoint> federatedEndpoints() {
        return snapshot.get().federated.values();
    }

    public Collection<Endpoint> endpoints() {
        return snapshot.get().endpoints.values();
    }

    public Collection<Cluster> clusters() {
        return snapshot.get().clusters.values();
    }

    public Optional<EndpointAdaptor> endpointAdaptor(String slug) {
        return Optional.ofNullable(snapshot.get().endpointAdaptors.get(slug));
    }

    public Optional<ClusterAdaptor> clusterAdaptor(String cluster) {
        return Optional.ofNullable(snapshot.get().clusterAdaptors.get(cluster));
    }

    public Collection<ClusterAdaptor> clusterAdaptors() {
        return snapshot.get().clusterAdaptors.values();
    }

    @Override
    public void close() {
        discard(prepared.getAndSet(null));
        snapshot.getAndSet(Snapshot.EMPTY).closeAdaptors();
    }

    private static void discard(Prepared unused) {
        if (unused != null) {
            unused.snapshot.closeAdaptors();
        }
    }

    private record Prepared(GatewayConfig config, Snapshot snapshot) {
    }

    private record Snapshot(
            Map<String, Cluster> clusters,
            Map<String, Endpoint> endpoints,
            Map<String, FederatedEndpoint> federated,
            Map<String, EndpointAdaptor> endpointAdaptors,
            Map<String, ClusterAdaptor> clusterAdaptors
    ) {
        static final Snapshot EMPTY = new Snapshot(Map.of(), Map.of(), Map.of(), Map.of(), Map.of());

        void closeAdaptors() {
            for (AutoCloseable adaptor : endpointAdaptors.values()) {
                closeQuietly(adaptor);
            }
            for (AutoCloseable adaptor : clusterAdaptors.values()) {
                closeQuietly(adaptor);
            }
        }

        private static void closeQuietly(AutoCloseable adaptor) {
            try {
                adaptor.close();
            } catch (Exception e) {
                log.warn("Error closing adaptor: {}", e.getMessage());
            }
        }
    }
}
