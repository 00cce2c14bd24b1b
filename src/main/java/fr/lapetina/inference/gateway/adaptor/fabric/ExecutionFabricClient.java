package fr.lapetina.inference.gateway.adaptor.fabric;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Client for a remote execution fabric: a service that runs registered functions on
 * managed compute endpoints and reports task status.
 *
 * <p>Unlike adaptors, implementations complete futures exceptionally on failure;
 * adaptors translate those exceptions into gateway errors.
 */
public interface ExecutionFabricClient extends AutoCloseable {

    /**
     * Runs {@code functionId} on {@code endpointId} and returns the task id.
     */
    CompletableFuture<String> submitFunction(String endpointId, String functionId,
                                             Map<String, Object> kwargs, Map<String, Object> options);

    CompletableFuture<FabricTask> getTask(String taskId);

    CompletableFuture<FabricEndpointStatus> getEndpointStatus(String endpointId);

    /**
     * Submits one task per kwargs entry. Task ids come back in input order.
     */
    CompletableFuture<FabricBatch> submitBatch(String endpointId, String functionId,
                                               List<Map<String, Object>> kwargsList, Map<String, Object> options);

    CompletableFuture<Void> cancelTask(String taskId);

    @Override
    default void close() {
    }
}
