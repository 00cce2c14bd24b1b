package fr.lapetina.inference.gateway.adaptor;

import fr.lapetina.inference.gateway.domain.model.ApiRoute;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A batch ready for submission: one OpenAI request body per input line.
 */
public record BatchRequest(
        String batchId,
        String model,
        String inputFile,
        String outputFolder,
        List<Line> lines
) {
    /**
     * One input line.
     *
     * @param customId caller-chosen identifier echoed in the results, may be null
     * @param route    API surface the body is meant for
     * @param body     OpenAI request body
     */
    public record Line(String customId, ApiRoute route, Map<String, Object> body) {
        public Line {
            Objects.requireNonNull(route, "Route is required");
            Objects.requireNonNull(body, "Body is required");
        }
    }

    public BatchRequest {
        Objects.requireNonNull(batchId, "Batch ID is required");
        Objects.requireNonNull(model, "Model is required");
        lines = lines != null ? List.copyOf(lines) : List.of();
    }
}
