package fr.lapetina.inference.gateway.adaptor;

import fr.lapetina.inference.gateway.domain.model.ErrorType;
import fr.lapetina.inference.gateway.domain.model.GatewayError;

import java.util.Objects;

/**
 * Outcome of a synchronous inference call: the backend body or a tagged error.
 */
public sealed interface TaskResult permits TaskResult.Success, TaskResult.Failure {

    record Success(String body, int statusCode, String taskId) implements TaskResult {
        public Success {
            Objects.requireNonNull(body, "Body is required");
            if (statusCode <= 0) {
                statusCode = 200;
            }
        }
    }

    record Failure(GatewayError error) implements TaskResult {
        public Failure {
            Objects.requireNonNull(error, "Error is required");
        }
    }

    static TaskResult success(String body, String taskId) {
        return new Success(body, 200, taskId);
    }

    static TaskResult failure(GatewayError error) {
        return new Failure(error);
    }

    static TaskResult failure(ErrorType type, String message) {
        return new Failure(GatewayError.of(type, message));
    }
}
