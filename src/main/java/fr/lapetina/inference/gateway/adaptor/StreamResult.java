package fr.lapetina.inference.gateway.adaptor;

import fr.lapetina.inference.gateway.domain.model.ErrorType;
import fr.lapetina.inference.gateway.domain.model.GatewayError;
import fr.lapetina.inference.gateway.streaming.StreamHandle;

import java.util.Objects;

/**
 * Outcome of opening a streaming call: a live handle or a tagged error.
 */
public sealed interface StreamResult permits StreamResult.Opened, StreamResult.Failure {

    record Opened(StreamHandle handle, String taskId) implements StreamResult {
        public Opened {
            Objects.requireNonNull(handle, "Handle is required");
        }
    }

    record Failure(GatewayError error) implements StreamResult {
        public Failure {
            Objects.requireNonNull(error, "Error is required");
        }
    }

    static StreamResult opened(StreamHandle handle, String taskId) {
        return new Opened(handle, taskId);
    }

    static StreamResult failure(GatewayError error) {
        return new Failure(error);
    }

    static StreamResult failure(ErrorType type, String message) {
        return new Failure(GatewayError.of(type, message));
    }
}
