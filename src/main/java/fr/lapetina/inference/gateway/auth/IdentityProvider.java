package fr.lapetina.inference.gateway.auth;

import fr.lapetina.inference.gateway.domain.model.Identity;

import java.util.Optional;

/**
 * Resolves a bearer token to the caller it belongs to.
 */
public interface IdentityProvider {

    /**
     * @return the identity, or empty when the token is unknown or expired
     */
    Optional<Identity> introspect(String bearerToken);
}
