package fr.lapetina.inference.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.inference.gateway.domain.model.BatchJob;
import fr.lapetina.inference.gateway.domain.model.BatchLineResult;
import fr.lapetina.inference.gateway.domain.model.BatchMetrics;

import java.time.Instant;
import java.util.List;

/**
 * Client view of a batch job. Per-line results are only filled for the result route.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchResponse {

    private String id;
    private String model;
    private String cluster;
    private String framework;
    private String status;

    @JsonProperty("input_file")
    private String inputFile;

    @JsonProperty("output_folder_path")
    private String outputFolderPath;

    @JsonProperty("result_location")
    private String resultLocation;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("in_progress_at")
    private Instant inProgressAt;

    @JsonProperty("completed_at")
    private Instant completedAt;

    @JsonProperty("failed_at")
    private Instant failedAt;

    private BatchMetrics metrics;
    private ErrorResponse.Body error;
    private List<Line> results;

    public static BatchResponse fromJob(BatchJob job) {
        BatchResponse response = new BatchResponse();
        response.setId(job.id());
        response.setModel(job.model());
        response.setCluster(job.cluster());
        response.setFramework(job.framework());
        response.setStatus(job.status().wireValue());
        response.setInputFile(job.inputFile());
        response.setOutputFolderPath(job.outputFolder());
        response.setResultLocation(job.resultLocation());
        response.setCreatedAt(job.createdAt());
        response.setInProgressAt(job.inProgressAt());
        response.setCompletedAt(job.completedAt());
        response.setFailedAt(job.failedAt());
        response.setMetrics(job.metrics());
        if (job.error() != null) {
            response.setError(ErrorResponse.from(job.error()).getError());
        }
        return response;
    }

    public static BatchResponse withResults(BatchJob job) {
        BatchResponse response = fromJob(job);
        response.setResults(job.results().stream().map(Line::from).toList());
        return response;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public String getCluster() { return cluster; }
    public void setCluster(String cluster) { this.cluster = cluster; }

    public String getFramework() { return framework; }
    public void setFramework(String framework) { this.framework = framework; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public String getInputFile() { return inputFile; }
    public void setInputFile(String inputFile) { this.inputFile = inputFile; }

    public String getOutputFolderPath() { return outputFolderPath; }
    public void setOutputFolderPath(String outputFolderPath) { this.outputFolderPath = outputFolderPath; }

    public String getResultLocation() { return resultLocation; }
    public void setResultLocation(String resultLocation) { this.resultLocation = resultLocation; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getInProgressAt() { return inProgressAt; }
    public void setInProgressAt(Instant inProgressAt) { this.inProgressAt = inProgressAt; }

    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }

    public Instant getFailedAt() { return failedAt; }
    public void setFailedAt(Instant failedAt) { this.failedAt = failedAt; }

    public BatchMetrics getMetrics() { return metrics; }
    public void setMetrics(BatchMetrics metrics) { this.metrics = metrics; }

    public ErrorResponse.Body getError() { return error; }
    public void setError(ErrorResponse.Body error) { this.error = error; }

    public List<Line> getResults() { return results; }
    public void setResults(List<Line> results) { this.results = results; }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Line {
        private int line;

        @JsonProperty("task_id")
        private String taskId;

        private String result;
        private ErrorResponse.Body error;

        static Line from(BatchLineResult result) {
            Line l = new Line();
            l.setLine(result.line());
            l.setTaskId(result.taskId());
            l.setResult(result.result());
            if (result.error() != null) {
                l.setError(ErrorResponse.from(result.error()).getError());
            }
            return l;
        }

        public int getLine() { return line; }
        public void setLine(int line) { this.line = line; }

        public String getTaskId() { return taskId; }
        public void setTaskId(String taskId) { this.taskId = taskId; }

        public String getResult() { return result; }
        public void setResult(String result) { this.result = result; }

        public ErrorResponse.Body getError() { return error; }
        public void setError(ErrorResponse.Body error) { this.error = error; }
    }
}
