package fr.lapetina.inference.gateway.domain.model;

import java.util.Objects;

/**
 * One concrete deployment backing a federated endpoint.
 */
public record Target(String cluster, String framework, String model, String endpointSlug) {

    public Target {
        Objects.requireNonNull(cluster, "Cluster is required");
        Objects.requireNonNull(framework, "Framework is required");
        Objects.requireNonNull(model, "Model is required");
        if (endpointSlug == null || endpointSlug.isBlank()) {
            endpointSlug = Endpoint.slugOf(cluster, framework, model);
        }
    }

    public String key() {
        return cluster + "/" + framework + "/" + model;
    }
}
