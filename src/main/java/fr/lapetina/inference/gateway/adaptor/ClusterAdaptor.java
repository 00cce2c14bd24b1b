package fr.lapetina.inference.gateway.adaptor;

import fr.lapetina.inference.gateway.domain.model.Cluster;

import java.util.concurrent.CompletableFuture;

/**
 * Capability contract for cluster-level operations.
 *
 * <p>{@link #getJobs()} is called only by the cluster status cache, never on the request
 * path. Like endpoint adaptors, implementations report failures through the result type.
 */
public interface ClusterAdaptor extends AutoCloseable {

    Cluster cluster();

    CompletableFuture<JobsResult> getJobs();

    @Override
    default void close() {
    }
}
