package fr.lapetina.inference.gateway.streaming;

import java.io.IOException;

/**
 * Client side of a proxied stream.
 *
 * An {@link IOException} from either method means the client is gone; the proxy then
 * cancels the backend stream.
 */
public interface ChunkSink {

    /**
     * Called once, when the backend stream is established and before the first line.
     */
    void open() throws IOException;

    /**
     * Writes one SSE line, e.g. {@code data: {...}}, and flushes it.
     */
    void send(String line) throws IOException;
}
