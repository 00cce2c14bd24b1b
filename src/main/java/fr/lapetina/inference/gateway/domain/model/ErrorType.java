package fr.lapetina.inference.gateway.domain.model;

import java.util.Locale;

/**
 * Error taxonomy for gateway operations.
 * Each type carries the HTTP status returned to clients when no more specific code is known.
 */
public enum ErrorType {
    /** Backend network failure or remote 4xx/5xx */
    ADAPTOR_ERROR(502),

    /** Backend call exceeded its timeout */
    ADAPTOR_TIMEOUT(504),

    /** No target succeeded after exhausting all candidates */
    ROUTING_ERROR(503),

    /** Invalid or expired credential, or no accessible target */
    AUTH_ERROR(401),

    /** Valid identity but not allowed to touch this resource */
    FORBIDDEN(403),

    /** Result-retention window elapsed before a terminal status was captured */
    BATCH_EXPIRY_ERROR(410),

    /** Malformed or missing adaptor configuration */
    CONFIG_ERROR(500),

    /** Per-user quota reached */
    CAPACITY_ERROR(429),

    /** Request body or parameters rejected */
    VALIDATION_ERROR(400),

    /** Unknown endpoint, model or batch */
    NOT_FOUND(404),

    /** Operation not offered by this adaptor */
    NOT_SUPPORTED(501),

    /** Backend offline or cluster under maintenance */
    UNAVAILABLE(503),

    /** Internal system error */
    INTERNAL_ERROR(500);

    private final int defaultStatus;

    ErrorType(int defaultStatus) {
        this.defaultStatus = defaultStatus;
    }

    public int defaultStatus() {
        return defaultStatus;
    }

    /**
     * Lower snake case name used in client-facing error bodies.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
