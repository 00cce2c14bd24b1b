package fr.lapetina.inference.gateway.domain.model;

import java.util.Optional;

/**
 * OpenAI-compatible API surfaces a cluster may expose.
 */
public enum ApiRoute {
    CHAT_COMPLETIONS("chat/completions"),
    COMPLETIONS("completions"),
    EMBEDDINGS("embeddings");

    private final String path;

    ApiRoute(String path) {
        this.path = path;
    }

    public String path() {
        return path;
    }

    public boolean supportsStreaming() {
        return this != EMBEDDINGS;
    }

    public static Optional<ApiRoute> fromPath(String path) {
        if (path == null) {
            return Optional.empty();
        }
        String normalized = path.startsWith("/") ? path.substring(1) : path;
        if (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        for (ApiRoute route : values()) {
            if (route.path.equals(normalized)) {
                return Optional.of(route);
            }
        }
        return Optional.empty();
    }
}
