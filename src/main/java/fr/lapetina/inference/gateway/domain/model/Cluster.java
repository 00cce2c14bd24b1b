package fr.lapetina.inference.gateway.domain.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A compute cluster hosting zero or more endpoints.
 */
public record Cluster(
        String name,
        String adaptorType,
        Set<String> frameworks,
        Set<ApiRoute> apiRoutes,
        List<String> allowedGroups,
        List<String> allowedDomains,
        String maintenanceNotice,
        Map<String, String> config
) {
    public Cluster {
        Objects.requireNonNull(name, "Cluster name is required");
        Objects.requireNonNull(adaptorType, "Adaptor type is required");
        frameworks = frameworks != null ? Set.copyOf(frameworks) : Set.of();
        apiRoutes = apiRoutes != null ? Set.copyOf(apiRoutes) : Set.of();
        allowedGroups = allowedGroups != null ? List.copyOf(allowedGroups) : List.of();
        allowedDomains = allowedDomains != null ? List.copyOf(allowedDomains) : List.of();
        config = config != null ? Map.copyOf(config) : Map.of();
        if (maintenanceNotice != null && maintenanceNotice.isBlank()) {
            maintenanceNotice = null;
        }
    }

    public boolean isUnderMaintenance() {
        return maintenanceNotice != null;
    }

    public boolean supports(ApiRoute route) {
        return apiRoutes.isEmpty() || apiRoutes.contains(route);
    }
}
