package fr.lapetina.inference.gateway.support;

import fr.lapetina.inference.gateway.adaptor.ClusterAdaptor;
import fr.lapetina.inference.gateway.adaptor.JobsResult;
import fr.lapetina.inference.gateway.domain.model.Cluster;
import fr.lapetina.inference.gateway.domain.model.ClusterStatus;
import fr.lapetina.inference.gateway.domain.model.Endpoint;
import fr.lapetina.inference.gateway.domain.model.ErrorType;
import fr.lapetina.inference.gateway.domain.model.GatewayError;
import fr.lapetina.inference.gateway.domain.model.JobInfo;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Cluster adaptor reporting a status chosen by the test. Starts with every endpoint running.
 */
public final class FakeClusterAdaptor implements ClusterAdaptor {

    private volatile Cluster cluster;
    private volatile List<Endpoint> endpoints;
    private volatile CompletableFuture<JobsResult> next;
    private final AtomicInteger calls = new AtomicInteger();

    FakeClusterAdaptor(Cluster cluster, List<Endpoint> endpoints) {
        this.cluster = cluster;
        this.endpoints = endpoints;
        allRunning();
    }

    FakeClusterAdaptor rebind(Cluster cluster, List<Endpoint> endpoints) {
        this.cluster = cluster;
        this.endpoints = endpoints;
        return this;
    }

    public void allRunning() {
        next = CompletableFuture.completedFuture(new JobsResult.Jobs(ClusterStatus.ofRunning(endpoints.stream()
                .map(e -> new JobInfo(e.model(), e.framework(), cluster.name()))
                .toList())));
    }

    public void reportStatus(ClusterStatus status) {
        next = CompletableFuture.completedFuture(new JobsResult.Jobs(status));
    }

    public void nothingRunning() {
        reportStatus(new ClusterStatus(List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), null));
    }

    public void fail(String message) {
        next = CompletableFuture.completedFuture(
                new JobsResult.Failure(GatewayError.of(ErrorType.ADAPTOR_ERROR, message)));
    }

    /**
     * Makes the next calls hang until {@code future} completes.
     */
    public void answerWith(CompletableFuture<JobsResult> future) {
        next = future;
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public Cluster cluster() {
        return cluster;
    }

    @Override
    public CompletableFuture<JobsResult> getJobs() {
        calls.incrementAndGet();
        return next;
    }
}
