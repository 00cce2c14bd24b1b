package fr.lapetina.inference.gateway.domain.model;

import java.util.Objects;
import java.util.Set;

/**
 * Authenticated caller as reported by the identity provider.
 *
 * @param username unique user name, usually an email address
 * @param groups   group memberships
 * @param allowed  whether the provider admits this user at all
 */
public record Identity(String username, Set<String> groups, boolean allowed) {

    public Identity {
        Objects.requireNonNull(username, "Username is required");
        groups = groups != null ? Set.copyOf(groups) : Set.of();
    }

    /**
     * Domain part of the username, or an empty string for non-email usernames.
     */
    public String domain() {
        int at = username.lastIndexOf('@');
        return at >= 0 ? username.substring(at + 1).toLowerCase() : "";
    }
}
