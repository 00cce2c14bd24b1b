package fr.lapetina.inference.gateway.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * A logical model identity servable by several targets across clusters.
 * Every target serves exactly {@code targetModelName}.
 */
public record FederatedEndpoint(
        String slug,
        String name,
        String targetModelName,
        String description,
        List<Target> targets
) {
    public FederatedEndpoint {
        Objects.requireNonNull(targetModelName, "Target model name is required");
        if (slug == null || slug.isBlank()) {
            slug = "federated-" + targetModelName.toLowerCase().replaceAll("[^a-z0-9]+", "-");
        }
        if (name == null) {
            name = targetModelName;
        }
        targets = targets != null ? List.copyOf(targets) : List.of();
        for (Target target : targets) {
            if (!targetModelName.equals(target.model())) {
                throw new IllegalArgumentException("Target " + target.key()
                        + " does not serve " + targetModelName);
            }
        }
    }
}
