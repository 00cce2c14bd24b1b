package fr.lapetina.inference.gateway.streaming;

import fr.lapetina.inference.gateway.domain.model.GatewayError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stream handle backed by a FIFO queue. Producers push chunks as they arrive from the
 * backend; the proxy pulls them on the client thread.
 *
 * Thread-safe. Anything pushed after the terminal event or after cancellation is dropped.
 */
public final class QueueStreamHandle implements StreamHandle {

    private static final Logger log = LoggerFactory.getLogger(QueueStreamHandle.class);

    private final String streamId;
    private final LinkedBlockingQueue<StreamEvent> events = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> cancelCallbacks = new CopyOnWriteArrayList<>();

    public QueueStreamHandle(String streamId) {
        this.streamId = streamId;
    }

    public String getStreamId() {
        return streamId;
    }

    /**
     * Registers work to run when the consumer cancels, e.g. aborting the backend call.
     * Runs immediately if the handle is already cancelled.
     */
    public void onCancel(Runnable callback) {
        cancelCallbacks.add(callback);
        if (cancelled.get() && cancelCallbacks.remove(callback)) {
            runQuietly(callback);
        }
    }

    public boolean emit(String chunk) {
        if (closed.get()) {
            return false;
        }
        return events.offer(StreamEvent.chunk(chunk));
    }

    public boolean complete() {
        if (closed.compareAndSet(false, true)) {
            return events.offer(StreamEvent.done());
        }
        return false;
    }

    public boolean fail(GatewayError error) {
        if (closed.compareAndSet(false, true)) {
            return events.offer(StreamEvent.error(error));
        }
        return false;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public StreamEvent poll(Duration timeout) throws InterruptedException {
        return events.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            closed.set(true);
            log.info("Stream cancelled: streamId={}, pendingEvents={}", streamId, events.size());
            for (Runnable callback : cancelCallbacks) {
                if (cancelCallbacks.remove(callback)) {
                    runQuietly(callback);
                }
            }
        }
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }

    private void runQuietly(Runnable callback) {
        try {
            callback.run();
        } catch (Exception e) {
            log.warn("Cancel callback failed: streamId={}, error={}", streamId, e.getMessage());
        }
    }
}
