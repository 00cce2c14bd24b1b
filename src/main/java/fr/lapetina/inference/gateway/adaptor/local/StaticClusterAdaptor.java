package fr.lapetina.inference.gateway.adaptor.local;

import fr.lapetina.inference.gateway.adaptor.AdaptorContext;
import fr.lapetina.inference.gateway.adaptor.ClusterAdaptor;
import fr.lapetina.inference.gateway.adaptor.JobsResult;
import fr.lapetina.inference.gateway.domain.model.Cluster;
import fr.lapetina.inference.gateway.domain.model.ClusterStatus;
import fr.lapetina.inference.gateway.domain.model.Endpoint;
import fr.lapetina.inference.gateway.domain.model.JobInfo;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Cluster without a status source: every configured endpoint is reported running.
 */
public class StaticClusterAdaptor implements ClusterAdaptor {

    private final Cluster cluster;
    private final ClusterStatus status;

    public StaticClusterAdaptor(Cluster cluster, List<Endpoint> endpoints, AdaptorContext context) {
        this.cluster = cluster;
        this.status = ClusterStatus.ofRunning(endpoints.stream()
                .map(endpoint -> new JobInfo(endpoint.model(), endpoint.framework(), cluster.name()))
                .toList());
    }

    @Override
    public Cluster cluster() {
        return cluster;
    }

    @Override
    public CompletableFuture<JobsResult> getJobs() {
        return CompletableFuture.completedFuture(new JobsResult.Jobs(status));
    }
}
