package fr.lapetina.inference.gateway.streaming;

import java.time.Duration;

/**
 * Consumer side of a backend stream. Events come out in backend arrival order and the
 * last event is always {@code DONE} or {@code ERROR}, unless the handle is cancelled.
 */
public interface StreamHandle {

    /**
     * Waits up to {@code timeout} for the next event.
     *
     * @return the next event, or {@code null} if nothing arrived in time
     */
    StreamEvent poll(Duration timeout) throws InterruptedException;

    /**
     * Stops the stream and releases the backend call. Idempotent.
     */
    void cancel();

    boolean isCancelled();
}
