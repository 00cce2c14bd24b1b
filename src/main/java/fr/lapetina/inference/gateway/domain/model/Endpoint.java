package fr.lapetina.inference.gateway.domain.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A physical model deployment on one cluster, served through one adaptor.
 *
 * @param slug          unique identifier, {@code cluster-framework-model}
 * @param cluster       owning cluster name
 * @param framework     serving framework (vllm, sglang, api, ...)
 * @param model         model name as the backend knows it
 * @param adaptorType   registry key of the endpoint adaptor
 * @param allowedGroups group ids allowed to use this endpoint; empty means unrestricted
 * @param allowedDomains user domains allowed to use this endpoint; empty means unrestricted
 * @param config        adaptor-specific settings, parsed by the adaptor factory
 */
public record Endpoint(
        String slug,
        String cluster,
        String framework,
        String model,
        String adaptorType,
        List<String> allowedGroups,
        List<String> allowedDomains,
        Map<String, String> config
) {
    private static final Pattern SLUG_CHARS = Pattern.compile("[^a-z0-9]+");

    public Endpoint {
        Objects.requireNonNull(cluster, "Cluster is required");
        Objects.requireNonNull(framework, "Framework is required");
        Objects.requireNonNull(model, "Model is required");
        Objects.requireNonNull(adaptorType, "Adaptor type is required");
        if (slug == null || slug.isBlank()) {
            slug = slugOf(cluster, framework, model);
        }
        allowedGroups = allowedGroups != null ? List.copyOf(allowedGroups) : List.of();
        allowedDomains = allowedDomains != null ? List.copyOf(allowedDomains) : List.of();
        config = config != null ? Map.copyOf(config) : Map.of();
    }

    /**
     * Canonical slug: lower-cased parts with non alphanumeric runs collapsed to a dash.
     */
    public static String slugOf(String cluster, String framework, String model) {
        return normalize(cluster) + "-" + normalize(framework) + "-" + normalize(model);
    }

    private static String normalize(String part) {
        String lowered = SLUG_CHARS.matcher(part.toLowerCase()).replaceAll("-");
        return lowered.replaceAll("^-+|-+$", "");
    }

    public String targetKey() {
        return cluster + "/" + framework + "/" + model;
    }
}
