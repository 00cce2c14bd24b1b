package fr.lapetina.inference.gateway.infrastructure.config;

import fr.lapetina.inference.gateway.domain.model.ApiRoute;
import fr.lapetina.inference.gateway.domain.model.Endpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks run on every candidate configuration before it is applied.
 * All problems are collected and reported in a single {@link ConfigLoader.ConfigurationException}.
 */
public final class ConfigValidator {

    private static final Logger log = LoggerFactory.getLogger(ConfigValidator.class);

    private final Set<String> endpointAdaptorTypes;
    private final Set<String> clusterAdaptorTypes;

    public ConfigValidator(Set<String> endpointAdaptorTypes, Set<String> clusterAdaptorTypes) {
        this.endpointAdaptorTypes = Set.copyOf(endpointAdaptorTypes);
        this.clusterAdaptorTypes = Set.copyOf(clusterAdaptorTypes);
    }

    public void validate(GatewayConfig config) {
        List<String> problems = new ArrayList<>();

        int port = config.getServer().getPort();
        if (port < 0 || port > 65535) {
            problems.add("server.port out of range: " + port);
        }
        if (config.getServer().getWorkerThreads() < 1) {
            problems.add("server.workerThreads must be at least 1");
        }

        Set<String> clusterNames = validateClusters(config, problems);
        Set<String> endpointSlugs = validateEndpoints(config, clusterNames, problems);
        validateFederatedEndpoints(config, endpointSlugs, problems);
        validateSettings(config, problems);

        String secret = config.getStreaming().getInternalSecret();
        if (secret == null || secret.isBlank()) {
            log.warn("No internal streaming secret configured, relay posts will be rejected");
        }

        if (!problems.isEmpty()) {
            throw new ConfigLoader.ConfigurationException(
                    "Invalid configuration: " + String.join("; ", problems));
        }
    }

    private Set<String> validateClusters(GatewayConfig config, List<String> problems) {
        Set<String> names = new HashSet<>();
        for (GatewayConfig.ClusterConfig cluster : config.getClusters()) {
            String name = cluster.getName();
            if (isBlank(name)) {
                problems.add("cluster without name");
                continue;
            }
            if (!names.add(name)) {
                problems.add("duplicate cluster: " + name);
            }
            if (isBlank(cluster.getAdaptor())) {
                problems.add("cluster " + name + " has no adaptor");
            } else if (!clusterAdaptorTypes.contains(cluster.getAdaptor())) {
                problems.add("cluster " + name + " uses unknown adaptor type: " + cluster.getAdaptor());
            }
            for (String route : cluster.getApiRoutes()) {
                if (ApiRoute.fromPath(route).isEmpty()) {
                    problems.add("cluster " + name + " lists unknown api route: " + route);
                }
            }
        }
        return names;
    }

    private Set<String> validateEndpoints(GatewayConfig config, Set<String> clusterNames, List<String> problems) {
        Set<String> slugs = new HashSet<>();
        for (GatewayConfig.EndpointConfig endpoint : config.getEndpoints()) {
            if (isBlank(endpoint.getCluster()) || isBlank(endpoint.getFramework()) || isBlank(endpoint.getModel())) {
                problems.add("endpoint " + endpoint.getSlug() + " needs cluster, framework and model");
                continue;
            }
            String slug = isBlank(endpoint.getSlug())
                    ? Endpoint.slugOf(endpoint.getCluster(), endpoint.getFramework(), endpoint.getModel())
                    : endpoint.getSlug();
            if (!slugs.add(slug)) {
                problems.add("duplicate endpoint slug: " + slug);
            }
            if (!clusterNames.contains(endpoint.getCluster())) {
                problems.add("endpoint " + slug + " references unknown cluster: " + endpoint.getCluster());
            }
            if (isBlank(endpoint.getAdaptor())) {
                problems.add("endpoint " + slug + " has no adaptor");
            } else if (!endpointAdaptorTypes.contains(endpoint.getAdaptor())) {
                problems.add("endpoint " + slug + " uses unknown adaptor type: " + endpoint.getAdaptor());
            }
        }
        return slugs;
    }

    private void validateFederatedEndpoints(GatewayConfig config, Set<String> endpointSlugs, List<String> problems) {
        Set<String> models = new HashSet<>();
        for (GatewayConfig.FederatedEndpointConfig federated : config.getFederatedEndpoints()) {
            String model = federated.getTargetModelName();
            if (isBlank(model)) {
                problems.add("federated endpoint " + federated.getSlug() + " has no targetModelName");
                continue;
            }
            if (!models.add(model)) {
                problems.add("duplicate federated endpoint for model: " + model);
            }
            if (federated.getTargets().isEmpty()) {
                log.warn("Federated endpoint has no targets: model={}", model);
            }
            for (GatewayConfig.TargetConfig target : federated.getTargets()) {
                if (!model.equals(target.getModel())) {
                    problems.add("federated endpoint " + model + " has target serving " + target.getModel());
                    continue;
                }
                if (isBlank(target.getCluster()) || isBlank(target.getFramework())) {
                    problems.add("federated endpoint " + model + " has a target without cluster or framework");
                    continue;
                }
                String slug = isBlank(target.getEndpointSlug())
                        ? Endpoint.slugOf(target.getCluster(), target.getFramework(), target.getModel())
                        : target.getEndpointSlug();
                if (!endpointSlugs.contains(slug)) {
                    problems.add("federated endpoint " + model + " targets unknown endpoint: " + slug);
                }
            }
        }
    }

    private void validateSettings(GatewayConfig config, List<String> problems) {
        GatewayConfig.RoutingConfig routing = config.getRouting();
        if (routing.getMaxAttempts() < 0) {
            problems.add("routing.maxAttempts must not be negative");
        }
        if (routing.getAdaptorTimeoutMs() <= 0) {
            problems.add("routing.adaptorTimeoutMs must be positive");
        }
        if (config.getStatusCache().getRefreshIntervalMs() <= 0) {
            problems.add("statusCache.refreshIntervalMs must be positive");
        }
        GatewayConfig.BatchConfig batch = config.getBatch();
        if (batch.getMaxActivePerUser() < 1) {
            problems.add("batch.maxActivePerUser must be at least 1");
        }
        if (batch.getPollIntervalMs() <= 0) {
            problems.add("batch.pollIntervalMs must be positive");
        }
        if (batch.getRetentionWindowMs() <= 0) {
            problems.add("batch.retentionWindowMs must be positive");
        }
        GatewayConfig.MetricsIngestionConfig ingestion = config.getMetricsIngestion();
        if (ingestion.getWorkers() < 1 || ingestion.getBatchSize() < 1) {
            problems.add("metricsIngestion.workers and batchSize must be at least 1");
        }
        int ringSize = config.getRequestLog().getRingBufferSize();
        if (ringSize < 1 || Integer.bitCount(ringSize) != 1) {
            problems.add("requestLog.ringBufferSize must be a power of 2: " + ringSize);
        }
        if (config.getStreaming().getFirstChunkTimeoutMs() <= 0 || config.getStreaming().getMaxDurationMs() <= 0) {
            problems.add("streaming timeouts must be positive");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
