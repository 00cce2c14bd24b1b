package fr.lapetina.inference.gateway.streaming;

import fr.lapetina.inference.gateway.domain.model.GatewayError;

import java.util.Objects;

/**
 * One item delivered by a {@link StreamHandle}: a chunk, the end of the stream, or a failure.
 */
public record StreamEvent(Kind kind, String data, GatewayError error) {

    public enum Kind {
        CHUNK,
        DONE,
        ERROR
    }

    private static final StreamEvent DONE = new StreamEvent(Kind.DONE, null, null);

    public StreamEvent {
        Objects.requireNonNull(kind, "Kind is required");
        if (kind == Kind.CHUNK) {
            Objects.requireNonNull(data, "Chunk data is required");
        }
        if (kind == Kind.ERROR) {
            Objects.requireNonNull(error, "Error is required");
        }
    }

    public static StreamEvent chunk(String data) {
        return new StreamEvent(Kind.CHUNK, data, null);
    }

    public static StreamEvent done() {
        return DONE;
    }

    public static StreamEvent error(GatewayError error) {
        return new StreamEvent(Kind.ERROR, null, error);
    }

    public boolean isTerminal() {
        return kind != Kind.CHUNK;
    }
}
