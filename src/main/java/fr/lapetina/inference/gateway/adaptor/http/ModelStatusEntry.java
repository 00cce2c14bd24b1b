package fr.lapetina.inference.gateway.adaptor.http;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One deployment listed by a direct API status page.
 *
 * <p>The page is a JSON object keyed by deployment name:
 * <pre>
 * {"deployment": {"status": "Live", "experts": ["model-a"], "url": "https://...", "endpoint_id": "..."}}
 * </pre>
 */
public record ModelStatusEntry(String key, String status, List<String> experts, String url, String endpointId) {

    public static final String LIVE = "Live";

    public ModelStatusEntry {
        experts = experts != null ? List.copyOf(experts) : List.of();
    }

    public boolean isLive() {
        return LIVE.equals(status);
    }

    public boolean serves(String model) {
        return experts.contains(model) || (experts.isEmpty() && key.equals(model));
    }

    public static List<ModelStatusEntry> parse(JsonNode document) {
        List<ModelStatusEntry> entries = new ArrayList<>();
        if (document == null || !document.isObject()) {
            return entries;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = document.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode info = field.getValue();
            if (!info.isObject()) {
                continue;
            }
            List<String> experts = new ArrayList<>();
            info.path("experts").forEach(expert -> experts.add(expert.asText()));
            entries.add(new ModelStatusEntry(
                    field.getKey(),
                    info.path("status").asText("Unknown"),
                    experts,
                    info.path("url").asText(null),
                    info.path("endpoint_id").asText(null)
            ));
        }
        return entries;
    }

    /**
     * Finds the deployment serving {@code model}, preferring a live one.
     */
    public static Optional<ModelStatusEntry> find(List<ModelStatusEntry> entries, String model) {
        ModelStatusEntry fallback = null;
        for (ModelStatusEntry entry : entries) {
            if (entry.serves(model)) {
                if (entry.isLive()) {
                    return Optional.of(entry);
                }
                if (fallback == null) {
                    fallback = entry;
                }
            }
        }
        return Optional.ofNullable(fallback);
    }
}
