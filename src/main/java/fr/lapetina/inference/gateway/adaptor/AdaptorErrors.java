package fr.lapetina.inference.gateway.adaptor;

import fr.lapetina.inference.gateway.domain.model.ErrorType;
import fr.lapetina.inference.gateway.domain.model.GatewayError;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Turns exceptions raised by backend clients into gateway errors.
 */
public final class AdaptorErrors {

    private AdaptorErrors() {
        // Utility class
    }

    public static GatewayError classify(Throwable ex, String target) {
        Throwable cause = unwrap(ex);
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();

        if (cause instanceof BackendException backend) {
            return new GatewayError(ErrorType.ADAPTOR_ERROR, backend.getMessage(), backend.getStatusCode());
        }
        if (cause instanceof TimeoutException
                || (cause instanceof HttpTimeoutException && !(cause instanceof HttpConnectTimeoutException))) {
            return GatewayError.of(ErrorType.ADAPTOR_TIMEOUT, "Backend " + target + " timed out: " + message);
        }
        if (cause instanceof ConnectException || cause instanceof HttpConnectTimeoutException) {
            return GatewayError.of(ErrorType.ADAPTOR_ERROR, "Cannot connect to " + target + ": " + message);
        }
        if (cause instanceof IOException) {
            return GatewayError.of(ErrorType.ADAPTOR_ERROR, "I/O error talking to " + target + ": " + message);
        }
        return GatewayError.of(ErrorType.ADAPTOR_ERROR, "Unexpected error from " + target + ": " + message);
    }

    public static Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Non-2xx answer from a backend, carrying the HTTP status.
     */
    public static class BackendException extends RuntimeException {
        private final int statusCode;

        public BackendException(int statusCode, String message) {
            super(message);
            this.statusCode = statusCode;
        }

        public int getStatusCode() {
            return statusCode;
        }
    }
}
