package fr.lapetina.inference.gateway.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Per-request record written once a request reaches a terminal outcome.
 *
 * <p>{@code metricsProcessed} has three states: {@code null} for rows written before
 * metrics ingestion existed, {@code false} once a usable result is waiting to be
 * ingested, and {@code true} after a successful metrics upsert.
 */
public record RequestLog(
        String id,
        String username,
        String cluster,
        String framework,
        String model,
        String route,
        int statusCode,
        Instant receivedAt,
        Instant backendRequestAt,
        Instant backendResponseAt,
        String prompt,
        String result,
        String taskId,
        boolean streaming,
        Boolean metricsProcessed
) {
    public RequestLog {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        Objects.requireNonNull(receivedAt, "Receive timestamp is required");
    }

    /**
     * Whether this row can feed metrics ingestion: 2xx, answered, and carrying a token count.
     */
    public boolean isMetricsEligible() {
        return statusCode >= 200 && statusCode < 300
                && backendResponseAt != null
                && result != null && !result.isEmpty()
                && UsageStats.hasTotalTokens(result);
    }

    public RequestLog withMetricsProcessed(Boolean processed) {
        return new RequestLog(id, username, cluster, framework, model, route, statusCode,
                receivedAt, backendRequestAt, backendResponseAt, prompt, result, taskId,
                streaming, processed);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String username;
        private String cluster;
        private String framework;
        private String model;
        private String route;
        private int statusCode;
        private Instant receivedAt;
        private Instant backendRequestAt;
        private Instant backendResponseAt;
        private String prompt;
        private String result;
        private String taskId;
        private boolean streaming;
        private Boolean metricsProcessed;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder cluster(String cluster) {
            this.cluster = cluster;
            return this;
        }

        public Builder framework(String framework) {
            this.framework = framework;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder route(String route) {
            this.route = route;
            return this;
        }

        public Builder statusCode(int statusCode) {
            this.statusCode = statusCode;
            return this;
        }

        public Builder receivedAt(Instant receivedAt) {
            this.receivedAt = receivedAt;
            return this;
        }

        public Builder backendRequestAt(Instant backendRequestAt) {
            this.backendRequestAt = backendRequestAt;
            return this;
        }

        public Builder backendResponseAt(Instant backendResponseAt) {
            this.backendResponseAt = backendResponseAt;
            return this;
        }

        public Builder prompt(String prompt) {
            this.prompt = prompt;
            return this;
        }

        public Builder result(String result) {
            this.result = result;
            return this;
        }

        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder streaming(boolean streaming) {
            this.streaming = streaming;
            return this;
        }

        public Builder metricsProcessed(Boolean metricsProcessed) {
            this.metricsProcessed = metricsProcessed;
            return this;
        }

        /**
         * Builds the log. When the processed flag was not set explicitly, eligible rows
         * are flagged {@code false} so ingestion picks them up.
         */
        public RequestLog build() {
            RequestLog log = new RequestLog(id, username, cluster, framework, model, route,
                    statusCode, receivedAt, backendRequestAt, backendResponseAt, prompt, result,
                    taskId, streaming, metricsProcessed);
            if (metricsProcessed == null && log.isMetricsEligible()) {
                return log.withMetricsProcessed(Boolean.FALSE);
            }
            return log;
        }
    }
}
