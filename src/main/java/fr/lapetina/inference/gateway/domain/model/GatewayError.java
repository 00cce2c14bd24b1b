package fr.lapetina.inference.gateway.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Structured error surfaced to callers instead of an exception.
 *
 * @param type     taxonomy entry
 * @param message  human readable message, never a stack trace
 * @param code     HTTP-equivalent status code
 * @param failures per-target failures, only populated for aggregate routing errors
 */
public record GatewayError(
        ErrorType type,
        String message,
        int code,
        List<TargetFailure> failures
) {
    public GatewayError {
        Objects.requireNonNull(type, "Error type is required");
        if (message == null) {
            message = type.wireName();
        }
        if (code <= 0) {
            code = type.defaultStatus();
        }
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    public GatewayError(ErrorType type, String message, int code) {
        this(type, message, code, null);
    }

    public static GatewayError of(ErrorType type, String message) {
        return new GatewayError(type, message, type.defaultStatus(), null);
    }

    /**
     * Errors caused by the request itself. Another target would reject them the same way,
     * so the router returns them without failing over.
     */
    public boolean isClientFault() {
        if (type == ErrorType.VALIDATION_ERROR) {
            return true;
        }
        return type == ErrorType.ADAPTOR_ERROR && (code == 400 || code == 413 || code == 422);
    }

    /**
     * Builds the aggregate error returned once every candidate target has failed.
     */
    public static GatewayError routing(String model, List<TargetFailure> failures) {
        return new GatewayError(
                ErrorType.ROUTING_ERROR,
                "All " + failures.size() + " target(s) failed for model " + model,
                ErrorType.ROUTING_ERROR.defaultStatus(),
                failures
        );
    }
}
