package fr.lapetina.inference.gateway.routing;

import fr.lapetina.inference.gateway.adaptor.TaskResult;
import fr.lapetina.inference.gateway.disruptor.RequestLogPipeline;
import fr.lapetina.inference.gateway.domain.model.Endpoint;
import fr.lapetina.inference.gateway.domain.model.Identity;
import fr.lapetina.inference.gateway.domain.model.InferenceRequest;
import fr.lapetina.inference.gateway.domain.model.RequestLog;
import fr.lapetina.inference.gateway.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Non-streaming inference: routes the request, then records its outcome.
 *
 * Every request that reaches the router produces exactly one request log, whether it
 * succeeded or not. Log writes never affect the response.
 */
public final class InferenceService {

    private static final Logger log = LoggerFactory.getLogger(InferenceService.class);

    private final FederatedRouter router;
    private final RequestLogPipeline requestLogs;
    private final MetricsRegistry metrics;
    private final Clock clock;
    private final int promptExcerptLength;

    public InferenceService(
            FederatedRouter router,
            RequestLogPipeline requestLogs,
            MetricsRegistry metrics,
            Clock clock,
            int promptExcerptLength
    ) {
        this.router = router;
        this.requestLogs = requestLogs;
        this.metrics = metrics;
        this.clock = clock;
        this.promptExcerptLength = promptExcerptLength;
    }

    public CompletableFuture<RouteResult<TaskResult.Success>> infer(
            InferenceRequest request, Identity identity, PinnedTarget pin) {
        Instant receivedAt = clock.instant();
        return router.route(request, identity, pin).whenComplete((result, ex) -> {
            if (result != null) {
                record(request, identity, receivedAt, result);
            } else {
                log.error("Routing completed exceptionally: requestId={}", request.requestId(), ex);
            }
        });
    }

    private void record(InferenceRequest request, Identity identity, Instant receivedAt,
                        RouteResult<TaskResult.Success> result) {
        Instant respondedAt = clock.instant();
        RequestLog.Builder entry = RequestLog.builder()
                .id(request.requestId())
                .username(identity.username())
                .route(request.route().path())
                .receivedAt(receivedAt)
                .backendRequestAt(receivedAt)
                .prompt(request.promptExcerpt(promptExcerptLength))
                .streaming(false);

        Endpoint endpoint;
        int statusCode;
        if (result instanceof RouteResult.Served<TaskResult.Success> served) {
            endpoint = served.endpoint();
            statusCode = served.value().statusCode();
            entry.backendResponseAt(respondedAt)
                    .result(served.value().body())
                    .taskId(served.value().taskId());
        } else {
            RouteResult.Failed<TaskResult.Success> failed = (RouteResult.Failed<TaskResult.Success>) result;
            endpoint = failed.lastEndpoint();
            statusCode = failed.error().code();
        }
        entry.statusCode(statusCode);
        if (endpoint != null) {
            entry.cluster(endpoint.cluster()).framework(endpoint.framework()).model(endpoint.model());
        } else {
            entry.model(request.model());
        }

        try {
            requestLogs.publish(entry.build());
        } catch (RuntimeException e) {
            log.error("Failed to record request: requestId={}, error={}", request.requestId(), e.getMessage());
        }
        metrics.recordRequest(request.route().path(), endpoint != null ? endpoint.targetKey() : "none",
                statusCode, false, Duration.between(receivedAt, respondedAt));
    }
}
