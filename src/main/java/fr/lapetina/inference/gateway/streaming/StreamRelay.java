package fr.lapetina.inference.gateway.streaming;

import fr.lapetina.inference.gateway.domain.model.ErrorType;
import fr.lapetina.inference.gateway.domain.model.GatewayError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Receiving end of the internal streaming hop.
 *
 * <p>Remote functions cannot hold a connection open to the client, so they post their
 * chunks back to the gateway, keyed by the request log id they were given. The relay
 * feeds those posts into the matching {@link QueueStreamHandle}.
 *
 * <p>Posts are authenticated with a shared secret that is distinct from any end-user
 * bearer token. Comparison is constant-time.
 */
public final class StreamRelay {

    private static final Logger log = LoggerFactory.getLogger(StreamRelay.class);

    public enum Outcome {
        ACCEPTED,
        UNAUTHORIZED,
        UNKNOWN_STREAM
    }

    private final Map<String, QueueStreamHandle> streams = new ConcurrentHashMap<>();
    private volatile byte[] secret;

    public StreamRelay(String secret) {
        updateSecret(secret);
    }

    public void updateSecret(String newSecret) {
        this.secret = newSecret != null ? newSecret.getBytes(StandardCharsets.UTF_8) : new byte[0];
    }

    /**
     * Registers a stream that relay posts may feed. The registration is dropped when the
     * consumer cancels or once the stream reaches a terminal event.
     */
    public QueueStreamHandle open(String streamId) {
        QueueStreamHandle handle = new QueueStreamHandle(streamId);
        QueueStreamHandle previous = streams.putIfAbsent(streamId, handle);
        if (previous != null) {
            throw new IllegalStateException("Stream already open: " + streamId);
        }
        handle.onCancel(() -> streams.remove(streamId, handle));
        log.debug("Relay stream opened: streamId={}", streamId);
        return handle;
    }

    public boolean authenticate(String presentedSecret) {
        byte[] expected = secret;
        if (expected.length == 0 || presentedSecret == null) {
            return false;
        }
        return MessageDigest.isEqual(expected, presentedSecret.getBytes(StandardCharsets.UTF_8));
    }

    public Outcome data(String presentedSecret, String streamId, String chunk) {
        return dispatch(presentedSecret, streamId, handle -> handle.emit(chunk));
    }

    public Outcome done(String presentedSecret, String streamId) {
        Outcome outcome = dispatch(presentedSecret, streamId, QueueStreamHandle::complete);
        if (outcome == Outcome.ACCEPTED) {
            streams.remove(streamId);
            log.debug("Relay stream done: streamId={}", streamId);
        }
        return outcome;
    }

    public Outcome error(String presentedSecret, String streamId, String message) {
        Outcome outcome = dispatch(presentedSecret, streamId, handle ->
                handle.fail(GatewayError.of(ErrorType.ADAPTOR_ERROR, message)));
        if (outcome == Outcome.ACCEPTED) {
            streams.remove(streamId);
            log.warn("Relay stream failed: streamId={}, error={}", streamId, message);
        }
        return outcome;
    }

    /**
     * Closes a stream from the gateway side, e.g. when the backend task ended without
     * posting a done event.
     */
    public void completeQuietly(String streamId) {
        QueueStreamHandle handle = streams.remove(streamId);
        if (handle != null) {
            handle.complete();
        }
    }

    public void failQuietly(String streamId, GatewayError error) {
        QueueStreamHandle handle = streams.remove(streamId);
        if (handle != null) {
            handle.fail(error);
        }
    }

    public int openStreams() {
        return streams.size();
    }

    private Outcome dispatch(String presentedSecret, String streamId, Consumer<QueueStreamHandle> action) {
        QueueStreamHandle handle = streamId != null ? streams.get(streamId) : null;
        if (!authenticate(presentedSecret)) {
            log.warn("Relay post rejected, bad secret: streamId={}", streamId);
            if (handle != null) {
                streams.remove(streamId, handle);
                handle.fail(GatewayError.of(ErrorType.AUTH_ERROR, "Internal streaming authentication failed"));
            }
            return Outcome.UNAUTHORIZED;
        }
        if (handle == null) {
            log.debug("Relay post for unknown stream: streamId={}", streamId);
            return Outcome.UNKNOWN_STREAM;
        }
        action.accept(handle);
        return Outcome.ACCEPTED;
    }
}
