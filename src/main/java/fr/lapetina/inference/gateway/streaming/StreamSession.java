package fr.lapetina.inference.gateway.streaming;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Lifecycle of one proxied stream:
 * IDLE -> CONNECTING -> STREAMING -> {COMPLETED | FAILED | CANCELLED}.
 *
 * Transitions are compare-and-set, so exactly one caller wins the move to a terminal
 * state even when a timeout, a client disconnect and the backend race each other.
 */
public final class StreamSession {

    private static final Logger log = LoggerFactory.getLogger(StreamSession.class);

    public enum State {
        IDLE,
        CONNECTING,
        STREAMING,
        COMPLETED,
        FAILED,
        CANCELLED;

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED || this == CANCELLED;
        }
    }

    private final String streamId;
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);

    public StreamSession(String streamId) {
        this.streamId = streamId;
    }

    public boolean connecting() {
        return move(State.IDLE, State.CONNECTING);
    }

    public boolean streaming() {
        return move(State.CONNECTING, State.STREAMING);
    }

    /**
     * Moves to a terminal state.
     *
     * @return true for the single caller that ended the session
     */
    public boolean finish(State terminal) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal state: " + terminal);
        }
        State current;
        do {
            current = state.get();
            if (current.isTerminal()) {
                return false;
            }
        } while (!state.compareAndSet(current, terminal));
        log.debug("Stream state changed: streamId={}, {} -> {}", streamId, current, terminal);
        return true;
    }

    private boolean move(State from, State to) {
        boolean moved = state.compareAndSet(from, to);
        if (moved) {
            log.debug("Stream state changed: streamId={}, {} -> {}", streamId, from, to);
        }
        return moved;
    }

    public State state() {
        return state.get();
    }

    public String getStreamId() {
        return streamId;
    }
}
