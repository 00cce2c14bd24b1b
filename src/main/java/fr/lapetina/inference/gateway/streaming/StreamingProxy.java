package fr.lapetina.inference.gateway.streaming;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.inference.gateway.adaptor.StreamResult;
import fr.lapetina.inference.gateway.disruptor.RequestLogPipeline;
import fr.lapetina.inference.gateway.domain.model.Endpoint;
import fr.lapetina.inference.gateway.domain.model.ErrorType;
import fr.lapetina.inference.gateway.domain.model.GatewayError;
import fr.lapetina.inference.gateway.domain.model.Identity;
import fr.lapetina.inference.gateway.domain.model.InferenceRequest;
import fr.lapetina.inference.gateway.domain.model.RequestLog;
import fr.lapetina.inference.gateway.domain.model.UsageStats;
import fr.lapetina.inference.gateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.gateway.routing.FederatedRouter;
import fr.lapetina.inference.gateway.routing.PinnedTarget;
import fr.lapetina.inference.gateway.routing.RouteResult;
import fr.lapetina.inference.gateway.streaming.StreamSession.State;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

/**
 * Relays a backend stream to a client as server-sent events.
 *
 * Runs on the calling thread until the stream ends. Chunks are written to the sink as
 * they arrive and in backend order. Only {@code data: } lines are forwarded and the
 * client always sees {@code data: [DONE]} last, also after an error.
 *
 * Whatever way the stream ends, exactly one request log is written for it.
 */
public final class StreamingProxy {

    private static final Logger log = LoggerFactory.getLogger(StreamingProxy.class);

    static final String DATA_PREFIX = "data: ";
    static final String DONE_LINE = "data: [DONE]";
    static final int CLIENT_CLOSED_STATUS = 499;

    private final FederatedRouter router;
    private final RequestLogPipeline requestLogs;
    private final MetricsRegistry metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int promptExcerptLength;
    private volatile Duration firstChunkTimeout;
    private volatile Duration maxDuration;

    public StreamingProxy(
            FederatedRouter router,
            RequestLogPipeline requestLogs,
            MetricsRegistry metrics,
            ObjectMapper objectMapper,
            Clock clock,
            Duration firstChunkTimeout,
            Duration maxDuration,
            int promptExcerptLength
    ) {
        this.router = router;
        this.requestLogs = requestLogs;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.firstChunkTimeout = firstChunkTimeout;
        this.maxDuration = maxDuration;
        this.promptExcerptLength = promptExcerptLength;
    }

    public StreamOutcome proxy(InferenceRequest request, Identity identity, PinnedTarget pin, ChunkSink sink) {
        StreamSession session = new StreamSession(request.requestId());
        Instant receivedAt = clock.instant();
        long startNanos = System.nanoTime();
        session.connecting();

        RouteResult<StreamResult.Opened> routed;
        try {
            routed = router.openStream(request, identity, pin, request.requestId()).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            routed = new RouteResult.Failed<>(GatewayError.of(ErrorType.INTERNAL_ERROR, "Interrupted while connecting"), null);
        } catch (ExecutionException e) {
            routed = new RouteResult.Failed<>(GatewayError.of(ErrorType.INTERNAL_ERROR,
                    "Stream routing failed: " + e.getCause().getMessage()), null);
        }

        if (routed instanceof RouteResult.Failed<StreamResult.Opened> failed) {
            session.finish(State.FAILED);
            Transfer transfer = new Transfer();
            transfer.error = failed.error();
            return terminate(request, identity, session, failed.lastEndpoint(), null, transfer, receivedAt, false);
        }

        RouteResult.Served<StreamResult.Opened> served = (RouteResult.Served<StreamResult.Opened>) routed;
        StreamHandle handle = served.value().handle();
        Endpoint endpoint = served.endpoint();
        Transfer transfer = new Transfer();
        try {
            sink.open();
        } catch (IOException e) {
            session.finish(State.CANCELLED);
            handle.cancel();
            log.info("Client gone before stream start: requestId={}", request.requestId());
            return terminate(request, identity, session, endpoint, served.value().taskId(), transfer, receivedAt, true);
        }
        session.streaming();
        log.debug("Stream established: requestId={}, target={}", request.requestId(), endpoint.targetKey());

        pump(session, handle, sink, transfer, startNanos);
        return terminate(request, identity, session, endpoint, served.value().taskId(), transfer, receivedAt, true);
    }

    private void pump(StreamSession session, StreamHandle handle, ChunkSink sink, Transfer transfer, long startNanos) {
        Duration firstChunk = firstChunkTimeout;
        Duration total = maxDuration;
        long endNanos = startNanos + total.toNanos();
        long firstChunkEndNanos = Math.min(endNanos, startNanos + firstChunk.toNanos());
        try {
            while (!session.state().isTerminal()) {
                long deadline = transfer.chunks == 0 ? firstChunkEndNanos : endNanos;
                long remaining = deadline - System.nanoTime();
                StreamEvent event = remaining > 0 ? handle.poll(Duration.ofNanos(remaining)) : null;
                if (event == null) {
                    String limit = transfer.chunks == 0
                            ? "first chunk not received within " + firstChunk.toMillis() + "ms"
                            : "stream exceeded " + total.toMillis() + "ms";
                    handle.cancel();
                    fail(session, sink, transfer, GatewayError.of(ErrorType.ADAPTOR_TIMEOUT, limit));
                    return;
                }
                switch (event.kind()) {
                    case CHUNK -> forward(event.data(), sink, transfer);
                    case DONE -> {
                        if (session.finish(State.COMPLETED)) {
                            sink.send(DONE_LINE);
                        }
                    }
                    case ERROR -> fail(session, sink, transfer, event.error());
                }
            }
        } catch (IOException e) {
            if (session.finish(State.CANCELLED)) {
                handle.cancel();
                log.info("Client disconnected, stream cancelled: streamId={}, chunks={}",
                        session.getStreamId(), transfer.chunks);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (session.finish(State.CANCELLED)) {
                handle.cancel();
            }
        }
    }

    private void forward(String chunk, ChunkSink sink, Transfer transfer) throws IOException {
        for (String line : chunk.split("\n")) {
            String trimmed = line.strip();
            if (!trimmed.startsWith(DATA_PREFIX.strip())) {
                continue;
            }
            String payload = trimmed.substring(DATA_PREFIX.strip().length()).strip();
            if (payload.isEmpty() || "[DONE]".equals(payload)) {
                continue;
            }
            sink.send(DATA_PREFIX + payload);
            transfer.chunks++;
            if (transfer.content.length() > 0) {
                transfer.content.append('\n');
            }
            transfer.content.append(payload);
        }
    }

    private void fail(StreamSession session, ChunkSink sink, Transfer transfer, GatewayError error)
            throws IOException {
        if (!session.finish(State.FAILED)) {
            return;
        }
        transfer.error = error;
        log.warn("Stream failed: streamId={}, errorType={}, message={}, chunks={}",
                session.getStreamId(), error.type(), error.message(), transfer.chunks);
        sink.send(DATA_PREFIX + errorChunk(error));
        sink.send(DONE_LINE);
    }

    /**
     * OpenAI-style chunk that shows the error to the user as trailing content.
     */
    String errorChunk(GatewayError error) {
        Map<String, Object> chunk = Map.of(
                "object", "chat.completion.chunk",
                "choices", List.of(Map.of(
                        "index", 0,
                        "delta", Map.of("content", "\n\n[ERROR] " + error.message()),
                        "finish_reason", "error"
                ))
        );
        try {
            return objectMapper.writeValueAsString(chunk);
        } catch (JsonProcessingException e) {
            return "{\"error\":{\"message\":\"stream failed\"}}";
        }
    }

    private StreamOutcome terminate(InferenceRequest request, Identity identity, StreamSession session,
                                    Endpoint endpoint, String taskId, Transfer transfer, Instant receivedAt,
                                    boolean started) {
        State state = session.state();
        Instant endedAt = clock.instant();
        String content = transfer.content.toString();
        UsageStats usage = UsageStats.parse(content);
        int statusCode = switch (state) {
            case COMPLETED -> 200;
            case CANCELLED -> CLIENT_CLOSED_STATUS;
            default -> transfer.error != null ? transfer.error.code() : ErrorType.INTERNAL_ERROR.defaultStatus();
        };

        RequestLog.Builder entry = RequestLog.builder()
                .id(request.requestId())
                .username(identity.username())
                .route(request.route().path())
                .statusCode(statusCode)
                .receivedAt(receivedAt)
                .backendRequestAt(receivedAt)
                .prompt(request.promptExcerpt(promptExcerptLength))
                .taskId(taskId)
                .streaming(true);
        if (started) {
            entry.backendResponseAt(endedAt);
        }
        if (!content.isEmpty()) {
            entry.result(content);
        }
        if (endpoint != null) {
            entry.cluster(endpoint.cluster()).framework(endpoint.framework()).model(endpoint.model());
        } else {
            entry.model(request.model());
        }
        try {
            requestLogs.publish(entry.build());
        } catch (RuntimeException e) {
            log.error("Failed to record stream: requestId={}, error={}", request.requestId(), e.getMessage());
        }

        Duration latency = Duration.between(receivedAt, endedAt);
        metrics.incrementStreamOutcome(state.name());
        metrics.recordRequest(request.route().path(), endpoint != null ? endpoint.targetKey() : "none",
                statusCode, true, latency);
        log.info("Stream ended: requestId={}, state={}, chunks={}, totalTokens={}, latencyMs={}",
                request.requestId(), state, transfer.chunks, usage.totalTokens(), latency.toMillis());
        return new StreamOutcome(state, transfer.error, started, transfer.chunks, usage);
    }

    public void updateTimeouts(Duration firstChunkTimeout, Duration maxDuration) {
        this.firstChunkTimeout = firstChunkTimeout;
        this.maxDuration = maxDuration;
    }

    private static final class Transfer {
        private final StringBuilder content = new StringBuilder();
        private int chunks;
        private GatewayError error;
    }
}
