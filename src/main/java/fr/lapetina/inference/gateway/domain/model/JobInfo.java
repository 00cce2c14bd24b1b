package fr.lapetina.inference.gateway.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One job entry of a cluster's get_jobs payload. Adaptors may attach extra fields.
 */
public record JobInfo(String model, String framework, String cluster, Map<String, Object> extras) {

    public JobInfo {
        Objects.requireNonNull(model, "Model is required");
        extras = extras != null ? Map.copyOf(extras) : Map.of();
    }

    public JobInfo(String model, String framework, String cluster) {
        this(model, framework, cluster, null);
    }

    /**
     * Whether this entry describes {@code model} served by {@code framework}.
     * Multi-model jobs list their models comma separated.
     */
    public boolean serves(String framework, String model) {
        if (this.framework != null && framework != null && !this.framework.equalsIgnoreCase(framework)) {
            return false;
        }
        for (String name : this.model.split(",")) {
            if (name.trim().equals(model)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Wire form: the three mandatory keys followed by the adaptor extras.
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("Models", model);
        payload.put("Framework", framework);
        payload.put("Cluster", cluster);
        payload.putAll(extras);
        return payload;
    }
}
