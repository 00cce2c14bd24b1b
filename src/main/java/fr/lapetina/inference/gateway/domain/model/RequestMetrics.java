package fr.lapetina.inference.gateway.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Aggregated metrics derived from one request log, keyed by request id.
 */
public record RequestMetrics(
        String requestId,
        String cluster,
        String framework,
        String model,
        int statusCode,
        Long promptTokens,
        Long completionTokens,
        Long totalTokens,
        Double responseTimeSec,
        Double throughputTokensPerSec,
        Instant backendRequestAt,
        Instant backendResponseAt
) {
    public RequestMetrics {
        Objects.requireNonNull(requestId, "Request ID is required");
    }

    /**
     * Derives metrics from a log row. Pure: the same row always yields the same metrics.
     * Throughput falls back to completion tokens over response time when the payload
     * does not report it.
     */
    public static RequestMetrics from(RequestLog log) {
        UsageStats usage = UsageStats.parse(log.result());

        Double responseTime = null;
        if (log.backendRequestAt() != null && log.backendResponseAt() != null) {
            responseTime = Duration.between(log.backendRequestAt(), log.backendResponseAt()).toNanos() / 1e9;
        }

        Double throughput = usage.throughputTokensPerSecond();
        if (throughput == null && responseTime != null && responseTime > 0 && usage.completionTokens() != null) {
            throughput = usage.completionTokens() / responseTime;
        }

        return new RequestMetrics(
                log.id(),
                log.cluster(),
                log.framework(),
                log.model(),
                log.statusCode(),
                usage.promptTokens(),
                usage.completionTokens(),
                usage.totalTokens(),
                responseTime,
                throughput,
                log.backendRequestAt(),
                log.backendResponseAt()
        );
    }
}
