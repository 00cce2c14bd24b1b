package fr.lapetina.inference.gateway.domain.model;

/**
 * One failed attempt against a target, kept for the aggregate routing error.
 */
public record TargetFailure(String target, ErrorType type, String message, int code) {

    public static TargetFailure of(String target, GatewayError error) {
        return new TargetFailure(target, error.type(), error.message(), error.code());
    }
}
