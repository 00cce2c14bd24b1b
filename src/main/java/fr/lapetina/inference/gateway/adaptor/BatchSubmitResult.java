package fr.lapetina.inference.gateway.adaptor;

import fr.lapetina.inference.gateway.domain.model.GatewayError;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of handing a batch to the backend.
 */
public sealed interface BatchSubmitResult permits BatchSubmitResult.Accepted, BatchSubmitResult.Failure {

    /**
     * @param backendBatchId identifier the backend assigned to the batch, may be null
     * @param taskIds        one task id per input line, in line order
     */
    record Accepted(String backendBatchId, List<String> taskIds) implements BatchSubmitResult {
        public Accepted {
            taskIds = List.copyOf(taskIds);
        }
    }

    record Failure(GatewayError error) implements BatchSubmitResult {
        public Failure {
            Objects.requireNonNull(error, "Error is required");
        }
    }
}
