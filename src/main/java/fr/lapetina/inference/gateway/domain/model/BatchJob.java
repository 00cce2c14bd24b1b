package fr.lapetina.inference.gateway.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A multi-line batch workload tracked until every line reaches a terminal outcome.
 * Immutable; state changes produce a new instance through {@link #toBuilder()}.
 */
public record BatchJob(
        String id,
        String username,
        String model,
        String cluster,
        String framework,
        String endpointSlug,
        String inputFile,
        String outputFolder,
        BatchStatus status,
        String backendBatchId,
        List<String> taskIds,
        List<BatchLineResult> results,
        String resultLocation,
        GatewayError error,
        BatchMetrics metrics,
        Instant createdAt,
        Instant inProgressAt,
        Instant completedAt,
        Instant failedAt
) {
    public BatchJob {
        Objects.requireNonNull(username, "Username is required");
        Objects.requireNonNull(status, "Status is required");
        Objects.requireNonNull(createdAt, "Creation timestamp is required");
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        taskIds = taskIds != null ? List.copyOf(taskIds) : List.of();
        results = results != null ? List.copyOf(results) : List.of();
    }

    /**
     * Returns a copy moved to {@code next}, stamping the matching timestamp.
     *
     * @throws IllegalStateException if the transition would move backwards
     */
    public BatchJob transitionTo(BatchStatus next, Instant at) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal batch transition " + status + " -> " + next + " for " + id);
        }
        Builder builder = toBuilder().status(next);
        switch (next) {
            case RUNNING -> builder.inProgressAt(at);
            case COMPLETED -> builder.completedAt(at);
            case FAILED -> builder.failedAt(at);
            default -> {
            }
        }
        return builder.build();
    }

    public long successCount() {
        return results.stream().filter(BatchLineResult::isSuccess).count();
    }

    public long errorCount() {
        return results.size() - successCount();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .username(username)
                .model(model)
                .cluster(cluster)
                .framework(framework)
                .endpointSlug(endpointSlug)
                .inputFile(inputFile)
                .outputFolder(outputFolder)
                .status(status)
                .backendBatchId(backendBatchId)
                .taskIds(taskIds)
                .results(results)
                .resultLocation(resultLocation)
                .error(error)
                .metrics(metrics)
                .createdAt(createdAt)
                .inProgressAt(inProgressAt)
                .completedAt(completedAt)
                .failedAt(failedAt);
    }

    public static final class Builder {
        private String id;
        private String username;
        private String model;
        private String cluster;
        private String framework;
        private String endpointSlug;
        private String inputFile;
        private String outputFolder;
        private BatchStatus status = BatchStatus.SUBMITTED;
        private String backendBatchId;
        private List<String> taskIds;
        private List<BatchLineResult> results;
        private String resultLocation;
        private GatewayError error;
        private BatchMetrics metrics;
        private Instant createdAt;
        private Instant inProgressAt;
        private Instant completedAt;
        private Instant failedAt;

        public Builder id(String id) { this.id = id; return this; }
        public Builder username(String username) { this.username = username; return this; }
        public Builder model(String model) { this.model = model; return this; }
        public Builder cluster(String cluster) { this.cluster = cluster; return this; }
        public Builder framework(String framework) { this.framework = framework; return this; }
        public Builder endpointSlug(String endpointSlug) { this.endpointSlug = endpointSlug; return this; }
        public Builder inputFile(String inputFile) { this.inputFile = inputFile; return this; }
        public Builder outputFolder(String outputFolder) { this.outputFolder = outputFolder; return this; }
        public Builder status(BatchStatus status) { this.status = status; return this; }
        public Builder backendBatchId(String backendBatchId) { this.backendBatchId = backendBatchId; return this; }
        public Builder taskIds(List<String> taskIds) { this.taskIds = taskIds; return this; }
        public Builder results(List<BatchLineResult> results) { this.results = results; return this; }
        public Builder resultLocation(String resultLocation) { this.resultLocation = resultLocation; return this; }
        public Builder error(GatewayError error) { this.error = error; return this; }
        public Builder metrics(BatchMetrics metrics) { this.metrics = metrics; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }
        public Builder inProgressAt(Instant inProgressAt) { this.inProgressAt = inProgressAt; return this; }
        public Builder completedAt(Instant completedAt) { this.completedAt = completedAt; return this; }
        public Builder failedAt(Instant failedAt) { this.failedAt = failedAt; return this; }

        public BatchJob build() {
            return new BatchJob(id, username, model, cluster, framework, endpointSlug, inputFile,
                    outputFolder, status, backendBatchId, taskIds, results, resultLocation, error,
                    metrics, createdAt, inProgressAt, completedAt, failedAt);
        }
    }
}
