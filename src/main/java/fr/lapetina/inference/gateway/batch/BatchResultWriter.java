package fr.lapetina.inference.gateway.batch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.inference.gateway.domain.model.BatchLineResult;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes batch results as JSONL to {@code {outputFolder}/{batchId}.jsonl}, one line per
 * input line, in input order.
 */
public final class BatchResultWriter {

    private final ObjectMapper objectMapper;

    public BatchResultWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return location of the written file
     */
    public String write(String outputFolder, String batchId, List<BatchLineResult> results) throws IOException {
        Path folder = Paths.get(outputFolder);
        Files.createDirectories(folder);
        Path target = folder.resolve(batchId + ".jsonl");
        Path partial = folder.resolve(batchId + ".jsonl.tmp");
        try (BufferedWriter writer = Files.newBufferedWriter(partial, StandardCharsets.UTF_8)) {
            for (BatchLineResult line : results) {
                writer.write(objectMapper.writeValueAsString(toEntry(line)));
                writer.newLine();
            }
        }
        Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
        return target.toString();
    }

    Map<String, Object> toEntry(BatchLineResult line) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("line", line.line());
        entry.put("task_id", line.taskId());
        if (line.isSuccess()) {
            entry.put("response", parseOrText(line.result()));
            entry.put("error", null);
        } else {
            entry.put("response", null);
            entry.put("error", Map.of(
                    "message", line.error().message(),
                    "type", line.error().type().wireName(),
                    "code", line.error().code()));
        }
        return entry;
    }

    private Object parseOrText(String raw) {
        try {
            JsonNode node = objectMapper.readTree(raw);
            return node != null ? node : raw;
        } catch (JsonProcessingException e) {
            return raw;
        }
    }
}
