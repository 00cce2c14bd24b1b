package fr.lapetina.inference.gateway.domain.model;

/**
 * Thrown at the API boundary and inside management operations when a request is rejected.
 * Adaptors never throw this; they return the error variant of their result type instead.
 */
public class GatewayException extends RuntimeException {

    private final GatewayError error;

    public GatewayException(GatewayError error) {
        super(error.message());
        this.error = error;
    }

    public GatewayException(ErrorType type, String message) {
        this(GatewayError.of(type, message));
    }

    public GatewayError getError() {
        return error;
    }
}
