package fr.lapetina.inference.gateway.adaptor;

import fr.lapetina.inference.gateway.domain.model.BatchJob;
import fr.lapetina.inference.gateway.domain.model.Endpoint;
import fr.lapetina.inference.gateway.domain.model.ErrorType;
import fr.lapetina.inference.gateway.domain.model.GatewayError;
import fr.lapetina.inference.gateway.domain.model.Identity;
import fr.lapetina.inference.gateway.domain.model.InferenceRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Capability contract every backend endpoint variant implements.
 *
 * <p>Implementations must never complete a returned future exceptionally and never
 * throw: every failure is reported through the error variant of the result type, so the
 * router can apply one retry policy to all backends. Callers still guard each call with
 * a timeout.
 *
 * <p>Batch support is optional. The defaults report {@link ErrorType#NOT_SUPPORTED}.
 */
public interface EndpointAdaptor extends AutoCloseable {

    Endpoint endpoint();

    /**
     * Sends one inference request and waits for the full response.
     */
    CompletableFuture<TaskResult> submitTask(InferenceRequest request);

    /**
     * Opens a streaming inference call.
     *
     * @param requestLogId id of the request log the stream's usage will be written against
     */
    CompletableFuture<StreamResult> submitStreamingTask(InferenceRequest request, String requestLogId);

    /**
     * Reports whether the backend can accept work right now.
     */
    default CompletableFuture<EndpointStatus> endpointStatus() {
        return CompletableFuture.completedFuture(EndpointStatus.ONLINE);
    }

    default boolean hasBatchEnabled() {
        return false;
    }

    default CompletableFuture<BatchSubmitResult> submitBatch(BatchRequest request, Identity identity) {
        return CompletableFuture.completedFuture(new BatchSubmitResult.Failure(notSupported("submit_batch")));
    }

    default CompletableFuture<BatchStatusResult> getBatchStatus(BatchJob job) {
        return CompletableFuture.completedFuture(
                new BatchStatusResult.Failure(notSupported("get_batch_status"), true));
    }

    private GatewayError notSupported(String operation) {
        return GatewayError.of(ErrorType.NOT_SUPPORTED,
                operation + " unavailable for endpoint " + endpoint().slug());
    }

    @Override
    default void close() {
    }
}
