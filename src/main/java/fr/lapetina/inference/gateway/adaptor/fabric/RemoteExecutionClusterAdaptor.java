package fr.lapetina.inference.gateway.adaptor.fabric;

import com.fasterxml.jackson.core.JsonProcessingException;
import fr.lapetina.inference.gateway.adaptor.AdaptorContext;
import fr.lapetina.inference.gateway.adaptor.AdaptorErrors;
import fr.lapetina.inference.gateway.adaptor.AdaptorSettings;
import fr.lapetina.inference.gateway.adaptor.ClusterAdaptor;
import fr.lapetina.inference.gateway.adaptor.JobsPayloadParser;
import fr.lapetina.inference.gateway.adaptor.JobsResult;
import fr.lapetina.inference.gateway.domain.model.Cluster;
import fr.lapetina.inference.gateway.domain.model.Endpoint;
import fr.lapetina.inference.gateway.domain.model.ErrorType;
import fr.lapetina.inference.gateway.domain.model.GatewayError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Cluster whose job status comes from a scheduler query function run on the fabric.
 *
 * <p>Settings: {@code status-endpoint-id}, {@code status-function-id} (required) and
 * {@code status-poll-interval-ms} (default 500), {@code status-timeout-ms} (default 60000).
 */
public class RemoteExecutionClusterAdaptor implements ClusterAdaptor {

    private static final Logger log = LoggerFactory.getLogger(RemoteExecutionClusterAdaptor.class);

    private final Cluster cluster;
    private final AdaptorContext context;
    private final String statusEndpointId;
    private final String statusFunctionId;
    private final long pollIntervalMs;
    private final long timeoutMs;
    private final JobsPayloadParser parser;

    public RemoteExecutionClusterAdaptor(Cluster cluster, List<Endpoint> endpoints, AdaptorContext context) {
        this.cluster = cluster;
        this.context = context;
        AdaptorSettings settings = new AdaptorSettings("cluster " + cluster.name(), cluster.config());
        this.statusEndpointId = settings.require("status-endpoint-id");
        this.statusFunctionId = settings.require("status-function-id");
        this.pollIntervalMs = settings.longValue("status-poll-interval-ms", 500);
        this.timeoutMs = settings.longValue("status-timeout-ms", 60000);
        String defaultFramework = cluster.frameworks().size() == 1 ? cluster.frameworks().iterator().next() : null;
        this.parser = new JobsPayloadParser(context.objectMapper(), defaultFramework, cluster.name());
    }

    @Override
    public Cluster cluster() {
        return cluster;
    }

    @Override
    public CompletableFuture<JobsResult> getJobs() {
        ExecutionFabricClient fabric = context.fabricClient();
        return fabric.submitFunction(statusEndpointId, statusFunctionId, Map.of(), Map.of())
                .thenCompose(this::awaitResult)
                .thenApply(this::toJobsResult)
                .exceptionally(ex -> {
                    GatewayError error = AdaptorErrors.classify(ex, cluster.name());
                    log.warn("get_jobs failed: cluster={}, error={}", cluster.name(), error.message());
                    return new JobsResult.Failure(error);
                });
    }

    private CompletableFuture<FabricTask> awaitResult(String taskId) {
        CompletableFuture<FabricTask> result = new CompletableFuture<>();
        result.orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
        poll(taskId, result);
        return result;
    }

    private void poll(String taskId, CompletableFuture<FabricTask> result) {
        if (result.isDone()) {
            return;
        }
        context.fabricClient().getTask(taskId).whenComplete((task, ex) -> {
            if (ex != null) {
                result.completeExceptionally(ex);
            } else if (task.isTerminal()) {
                result.complete(task);
            } else {
                context.scheduler().schedule(() -> poll(taskId, result), pollIntervalMs, TimeUnit.MILLISECONDS);
            }
        });
    }

    private JobsResult toJobsResult(FabricTask task) {
        if (task.state() != FabricTask.State.SUCCESS || task.result() == null) {
            return new JobsResult.Failure(GatewayError.of(ErrorType.ADAPTOR_ERROR,
                    "Status function for " + cluster.name() + " ended in state " + task.state() + ": " + task.error()));
        }
        try {
            return new JobsResult.Jobs(parser.parse(task.result()));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return new JobsResult.Failure(GatewayError.of(ErrorType.ADAPTOR_ERROR,
                    "Malformed jobs payload from " + cluster.name() + ": " + e.getMessage()));
        }
    }
}
