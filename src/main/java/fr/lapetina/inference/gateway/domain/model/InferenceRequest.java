package fr.lapetina.inference.gateway.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * An OpenAI-compatible inference request on its way to a backend.
 * Immutable and thread-safe.
 *
 * <p>The payload keeps every field sent by the client, including the ones the gateway
 * does not interpret, so adaptors can forward it unchanged.
 */
public record InferenceRequest(
        String requestId,
        ApiRoute route,
        String model,
        boolean stream,
        Map<String, Object> payload,
        Instant createdAt
) {
    /** Fields that only make sense inside the gateway and must not reach a backend. */
    public static final Set<String> INTERNAL_FIELDS = Set.of("openai_endpoint", "api_port");

    public InferenceRequest {
        Objects.requireNonNull(route, "Route is required");
        Objects.requireNonNull(model, "Model is required");
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        Map<String, Object> copy = new LinkedHashMap<>(payload != null ? payload : Map.of());
        copy.put("model", model);
        payload = Collections.unmodifiableMap(copy);
    }

    /**
     * Creates a request from a parsed client body.
     */
    public static InferenceRequest fromPayload(ApiRoute route, Map<String, Object> body) {
        Object model = body.get("model");
        if (!(model instanceof String) || ((String) model).isBlank()) {
            throw new GatewayException(ErrorType.VALIDATION_ERROR, "Field 'model' is required");
        }
        boolean stream = Boolean.TRUE.equals(body.get("stream"));
        if (stream && !route.supportsStreaming()) {
            throw new GatewayException(ErrorType.VALIDATION_ERROR,
                    "Streaming is not supported for " + route.path());
        }
        switch (route) {
            case CHAT_COMPLETIONS -> requireField(body, "messages");
            case COMPLETIONS -> requireField(body, "prompt");
            case EMBEDDINGS -> requireField(body, "input");
        }
        return new InferenceRequest(null, route, (String) model, stream, body, null);
    }

    private static void requireField(Map<String, Object> body, String field) {
        if (body.get(field) == null) {
            throw new GatewayException(ErrorType.VALIDATION_ERROR, "Field '" + field + "' is required");
        }
    }

    /**
     * Returns a copy addressed to another physical model, keeping the request id.
     */
    public InferenceRequest withModel(String targetModel) {
        return new InferenceRequest(requestId, route, targetModel, stream, payload, createdAt);
    }

    /**
     * Body to send to a backend: internal fields removed and {@code stream} forced.
     */
    public Map<String, Object> backendPayload(boolean streaming) {
        Map<String, Object> body = new LinkedHashMap<>(payload);
        INTERNAL_FIELDS.forEach(body::remove);
        body.put("stream", streaming);
        return body;
    }

    /**
     * Short text form of the prompt for the request log.
     */
    public String promptExcerpt(int maxLength) {
        Object source = switch (route) {
            case CHAT_COMPLETIONS -> payload.get("messages");
            case COMPLETIONS -> payload.get("prompt");
            case EMBEDDINGS -> payload.get("input");
        };
        String text;
        if (source instanceof List<?> list && !list.isEmpty() && list.get(list.size() - 1) instanceof Map<?, ?> last) {
            text = String.valueOf(last.get("content"));
        } else {
            text = String.valueOf(source);
        }
        return text.length() <= maxLength ? text : text.substring(0, maxLength);
    }
}
