package fr.lapetina.inference.gateway.domain.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Token usage extracted from a raw OpenAI-style result payload.
 * Counts are {@code null} when the payload does not carry them or carries a value
 * that does not fit a {@code long}.
 *
 * <p>The payload is either a single JSON body or a sequence of streaming chunks, one
 * per line and optionally prefixed with {@code data:}. Each chunk is read as its own
 * document; lines that are not JSON are skipped. When several {@code usage} objects
 * are present the last one wins.
 */
public record UsageStats(
        Long promptTokens,
        Long completionTokens,
        Long totalTokens,
        Double throughputTokensPerSecond
) {
    private static final Logger log = LoggerFactory.getLogger(UsageStats.class);

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();
    private static final String DATA_PREFIX = "data:";

    public static final UsageStats EMPTY = new UsageStats(null, null, null, null);

    public static UsageStats parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return EMPTY;
        }
        JsonNode usage = null;
        JsonNode owner = null;
        for (JsonNode document : documents(raw)) {
            List<JsonNode> found = document.findValues("usage");
            for (int i = found.size() - 1; i >= 0; i--) {
                if (found.get(i).isObject()) {
                    usage = found.get(i);
                    owner = document;
                    break;
                }
            }
        }
        if (usage == null) {
            return EMPTY;
        }
        Double throughput = rate(usage.get("throughput_tokens_per_second"));
        if (throughput == null) {
            throughput = rate(owner.get("throughput_tokens_per_second"));
        }
        return new UsageStats(
                count(usage.get("prompt_tokens")),
                count(usage.get("completion_tokens")),
                count(usage.get("total_tokens")),
                throughput
        );
    }

    public static boolean hasTotalTokens(String raw) {
        return parse(raw).totalTokens() != null;
    }

    public boolean isEmpty() {
        return totalTokens == null && promptTokens == null && completionTokens == null;
    }

    private static List<JsonNode> documents(String raw) {
        try {
            JsonNode whole = MAPPER.readTree(raw);
            if (whole != null && whole.isContainerNode()) {
                return List.of(whole);
            }
        } catch (JsonProcessingException e) {
            // Not a single document: read it chunk by chunk below
        }
        List<JsonNode> documents = new ArrayList<>();
        for (String line : raw.split("\n")) {
            String data = line.strip();
            if (data.startsWith(DATA_PREFIX)) {
                data = data.substring(DATA_PREFIX.length()).strip();
            }
            if (!data.startsWith("{")) {
                continue;
            }
            try {
                documents.add(MAPPER.readTree(data));
            } catch (JsonProcessingException e) {
                log.debug("Skipping unreadable usage chunk: {}", e.getOriginalMessage());
            }
        }
        return documents;
    }

    private static Long count(JsonNode node) {
        if (node == null || !node.isIntegralNumber() || !node.canConvertToLong()) {
            return null;
        }
        return node.longValue();
    }

    private static Double rate(JsonNode node) {
        if (node == null || !node.isNumber()) {
            return null;
        }
        double value = node.doubleValue();
        return Double.isFinite(value) ? value : null;
    }
}
