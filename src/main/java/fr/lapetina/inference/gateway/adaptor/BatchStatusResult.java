package fr.lapetina.inference.gateway.adaptor;

import fr.lapetina.inference.gateway.domain.model.BatchLineResult;
import fr.lapetina.inference.gateway.domain.model.BatchStatus;
import fr.lapetina.inference.gateway.domain.model.GatewayError;

import java.util.List;
import java.util.Objects;

/**
 * What the backend reports about a batch on one poll.
 */
public sealed interface BatchStatusResult
        permits BatchStatusResult.Progress, BatchStatusResult.Finished, BatchStatusResult.Failure {

    /**
     * Some tasks are still pending or running.
     *
     * @param status    PENDING when nothing has started yet, RUNNING otherwise
     * @param completed number of tasks in a terminal state
     * @param total     number of tasks
     */
    record Progress(BatchStatus status, int completed, int total) implements BatchStatusResult {
        public Progress {
            if (status != BatchStatus.PENDING && status != BatchStatus.RUNNING) {
                throw new IllegalArgumentException("Progress status must be PENDING or RUNNING: " + status);
            }
        }
    }

    /**
     * Every task reached a terminal outcome. Lines may individually carry errors.
     */
    record Finished(List<BatchLineResult> lines) implements BatchStatusResult {
        public Finished {
            lines = List.copyOf(lines);
        }
    }

    /**
     * The status could not be obtained, or the batch failed as a whole.
     *
     * @param terminal true when the batch itself failed, false for a transient poll error
     */
    record Failure(GatewayError error, boolean terminal) implements BatchStatusResult {
        public Failure {
            Objects.requireNonNull(error, "Error is required");
        }
    }
}
