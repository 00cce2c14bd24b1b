package fr.lapetina.inference.gateway.routing;

import java.util.Objects;

/**
 * Cluster and framework named in a pinned request path, {@code /{cluster}/{framework}/v1/...}.
 */
public record PinnedTarget(String cluster, String framework) {

    public PinnedTarget {
        Objects.requireNonNull(cluster, "Cluster is required");
        Objects.requireNonNull(framework, "Framework is required");
    }
}
