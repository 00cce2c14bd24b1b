package fr.lapetina.inference.gateway.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.inference.gateway.domain.model.RequestLog;
import fr.lapetina.inference.gateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.gateway.store.RequestLogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Write-behind queue for request logs.
 *
 * Request threads publish finished logs into a pre-allocated ring buffer and return
 * immediately; one consumer thread writes them to the store in order. The ring uses
 * MULTI producer mode because every HTTP worker thread publishes.
 *
 * A log is never dropped: when the ring is full, or the pipeline is stopped, the
 * publishing thread writes the log itself.
 */
public final class RequestLogPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RequestLogPipeline.class);

    private final Disruptor<RequestLogEvent> disruptor;
    private final RingBuffer<RequestLogEvent> ringBuffer;
    private final RequestLogStore store;
    private final MetricsRegistry metrics;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public RequestLogPipeline(RequestLogStore store, MetricsRegistry metrics, int ringBufferSize, String waitStrategy) {
        if (Integer.bitCount(ringBufferSize) != 1) {
            throw new IllegalArgumentException("Ring buffer size must be power of 2");
        }
        this.store = store;
        this.metrics = metrics;

        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, "request-log-writer");
            t.setDaemon(true);
            return t;
        };
        this.disruptor = new Disruptor<>(RequestLogEvent.FACTORY, ringBufferSize, threadFactory,
                ProducerType.MULTI, createWaitStrategy(waitStrategy));
        disruptor.handleEventsWith(new RequestLogWriter(store, metrics));
        disruptor.setDefaultExceptionHandler(new WriterExceptionHandler());
        this.ringBuffer = disruptor.getRingBuffer();
        metrics.registerRingBufferRemaining(ringBuffer::remainingCapacity);

        log.info("RequestLogPipeline created: ringBufferSize={}, waitStrategy={}", ringBufferSize, waitStrategy);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("RequestLogPipeline started");
        }
    }

    /**
     * Queues a log for writing. Never blocks and never throws for capacity reasons.
     */
    public void publish(RequestLog requestLog) {
        if (!running.get()) {
            writeDirect(requestLog, "stopped");
            return;
        }
        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            log.warn("Request log ring full, writing inline: id={}", requestLog.id());
            writeDirect(requestLog, "overflow");
            return;
        }
        try {
            ringBuffer.get(sequence).setLog(requestLog);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    private void writeDirect(RequestLog requestLog, String path) {
        store.save(requestLog);
        metrics.incrementRequestLogWrites(path);
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    /**
     * Drains pending logs, then stops the writer thread.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down RequestLogPipeline...");
            try {
                disruptor.shutdown(10, TimeUnit.SECONDS);
                log.info("RequestLogPipeline drained");
            } catch (TimeoutException e) {
                log.warn("RequestLogPipeline shutdown timed out, halting");
                disruptor.halt();
            }
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name == null ? "blocking" : name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    private final class WriterExceptionHandler implements ExceptionHandler<RequestLogEvent> {

        @Override
        public void handleEventException(Throwable ex, long sequence, RequestLogEvent event) {
            RequestLog failed = event.getLog();
            log.error("Request log write failed: sequence={}, id={}", sequence,
                    failed != null ? failed.id() : null, ex);
            metrics.incrementRequestLogWrites("failed");
            event.clear();
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during request log writer start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during request log writer shutdown", ex);
        }
    }
}
