package fr.lapetina.inference.gateway.routing;

import fr.lapetina.inference.gateway.domain.model.Cluster;
import fr.lapetina.inference.gateway.domain.model.Endpoint;
import fr.lapetina.inference.gateway.domain.model.Identity;

import java.util.List;

/**
 * Group and domain restrictions on clusters and endpoints.
 *
 * An empty restriction list means unrestricted. A non-empty group list requires at least
 * one shared group; a non-empty domain list requires the username's domain to be listed.
 * Cluster and endpoint restrictions must both pass.
 */
public final class AccessPolicy {

    private AccessPolicy() {
    }

    public static boolean canAccess(Identity identity, Cluster cluster, Endpoint endpoint) {
        if (identity == null || !identity.allowed()) {
            return false;
        }
        if (cluster != null && !passes(identity, cluster.allowedGroups(), cluster.allowedDomains())) {
            return false;
        }
        return endpoint == null || passes(identity, endpoint.allowedGroups(), endpoint.allowedDomains());
    }

    private static boolean passes(Identity identity, List<String> groups, List<String> domains) {
        if (!groups.isEmpty() && groups.stream().noneMatch(identity.groups()::contains)) {
            return false;
        }
        return domains.isEmpty() || domains.stream().anyMatch(d -> d.equalsIgnoreCase(identity.domain()));
    }
}
