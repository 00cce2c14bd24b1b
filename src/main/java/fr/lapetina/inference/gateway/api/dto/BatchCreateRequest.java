package fr.lapetina.inference.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.inference.gateway.batch.BatchSubmission;

/**
 * Body of {@code POST /v1/batches}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BatchCreateRequest {

    private String model;

    @JsonProperty("input_file")
    private String inputFile;

    @JsonProperty("output_folder_path")
    private String outputFolderPath;

    private String cluster;
    private String framework;

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public String getInputFile() { return inputFile; }
    public void setInputFile(String inputFile) { this.inputFile = inputFile; }

    public String getOutputFolderPath() { return outputFolderPath; }
    public void setOutputFolderPath(String outputFolderPath) { this.outputFolderPath = outputFolderPath; }

    public String getCluster() { return cluster; }
    public void setCluster(String cluster) { this.cluster = cluster; }

    public String getFramework() { return framework; }
    public void setFramework(String framework) { this.framework = framework; }

    /**
     * Validates the body and converts it to a submission.
     */
    public BatchSubmission toSubmission() {
        return new BatchSubmission(model, inputFile, outputFolderPath, cluster, framework);
    }
}
