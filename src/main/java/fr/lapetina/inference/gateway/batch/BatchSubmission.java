package fr.lapetina.inference.gateway.batch;

import fr.lapetina.inference.gateway.domain.model.ErrorType;
import fr.lapetina.inference.gateway.domain.model.GatewayException;
import fr.lapetina.inference.gateway.routing.PinnedTarget;

/**
 * A client's request to run a batch.
 *
 * @param cluster   optional, pins the batch together with {@code framework}
 * @param framework optional
 */
public record BatchSubmission(String model, String inputFile, String outputFolder, String cluster, String framework) {

    public BatchSubmission {
        if (model == null || model.isBlank()) {
            throw new GatewayException(ErrorType.VALIDATION_ERROR, "Field 'model' is required");
        }
        if (inputFile == null || inputFile.isBlank()) {
            throw new GatewayException(ErrorType.VALIDATION_ERROR, "Field 'input_file' is required");
        }
        if (outputFolder == null || outputFolder.isBlank()) {
            throw new GatewayException(ErrorType.VALIDATION_ERROR, "Field 'output_folder_path' is required");
        }
        if ((cluster == null) != (framework == null)) {
            throw new GatewayException(ErrorType.VALIDATION_ERROR,
                    "Fields 'cluster' and 'framework' must be given together");
        }
    }

    public PinnedTarget pin() {
        return cluster != null ? new PinnedTarget(cluster, framework) : null;
    }
}
