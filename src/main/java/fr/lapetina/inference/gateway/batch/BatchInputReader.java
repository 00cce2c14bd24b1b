package fr.lapetina.inference.gateway.batch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.inference.gateway.adaptor.BatchRequest;
import fr.lapetina.inference.gateway.domain.model.ApiRoute;
import fr.lapetina.inference.gateway.domain.model.ErrorType;
import fr.lapetina.inference.gateway.domain.model.GatewayException;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads a batch input file: one JSON request per line.
 *
 * A line is either an OpenAI batch entry ({@code custom_id}, {@code url}, {@code body})
 * or a bare request body, which is sent to chat completions.
 */
public final class BatchInputReader {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final int maxLines;

    public BatchInputReader(ObjectMapper objectMapper, int maxLines) {
        this.objectMapper = objectMapper;
        this.maxLines = maxLines;
    }

    /**
     * @throws GatewayException VALIDATION_ERROR if the file is missing, unreadable, empty,
     *                          too long or holds a line that is not a JSON object
     */
    public List<BatchRequest.Line> read(String inputFile) {
        Path path = Paths.get(inputFile);
        if (!Files.isRegularFile(path)) {
            throw new GatewayException(ErrorType.VALIDATION_ERROR, "Input file " + inputFile + " not found");
        }
        List<BatchRequest.Line> lines = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String raw;
            int number = 0;
            while ((raw = reader.readLine()) != null) {
                number++;
                if (raw.isBlank()) {
                    continue;
                }
                if (lines.size() >= maxLines) {
                    throw new GatewayException(ErrorType.VALIDATION_ERROR,
                            "Input file " + inputFile + " exceeds " + maxLines + " lines");
                }
                lines.add(parseLine(raw, number, inputFile));
            }
        } catch (IOException e) {
            throw new GatewayException(ErrorType.VALIDATION_ERROR,
                    "Cannot read input file " + inputFile + ": " + e.getMessage());
        }
        if (lines.isEmpty()) {
            throw new GatewayException(ErrorType.VALIDATION_ERROR, "Input file " + inputFile + " is empty");
        }
        return lines;
    }

    @SuppressWarnings("unchecked")
    private BatchRequest.Line parseLine(String raw, int number, String inputFile) {
        Map<String, Object> entry;
        try {
            entry = objectMapper.readValue(raw, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new GatewayException(ErrorType.VALIDATION_ERROR,
                    "Line " + number + " of " + inputFile + " is not a JSON object");
        }
        Object body = entry.get("body");
        if (!(body instanceof Map)) {
            return new BatchRequest.Line(null, ApiRoute.CHAT_COMPLETIONS, entry);
        }
        ApiRoute route = ApiRoute.CHAT_COMPLETIONS;
        Object url = entry.get("url");
        if (url instanceof String path) {
            String trimmed = path.startsWith("/v1/") ? path.substring(4) : path;
            route = ApiRoute.fromPath(trimmed).orElseThrow(() -> new GatewayException(ErrorType.VALIDATION_ERROR,
                    "Line " + number + " of " + inputFile + " targets unsupported url " + path));
        }
        Object customId = entry.get("custom_id");
        return new BatchRequest.Line(customId != null ? String.valueOf(customId) : null, route,
                (Map<String, Object>) body);
    }
}
