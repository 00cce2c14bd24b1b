package fr.lapetina.inference.gateway.auth;

import fr.lapetina.inference.gateway.domain.model.Identity;
import fr.lapetina.inference.gateway.infrastructure.config.ConfigChangeListener;
import fr.lapetina.inference.gateway.infrastructure.config.GatewayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;

/**
 * Identity provider backed by the {@code auth.tokens} configuration section.
 * The token table is replaced on every configuration reload.
 */
public final class StaticTokenIdentityProvider implements IdentityProvider, ConfigChangeListener {

    private static final Logger log = LoggerFactory.getLogger(StaticTokenIdentityProvider.class);

    private volatile Map<String, Identity> identities = Map.of();

    public StaticTokenIdentityProvider(GatewayConfig.AuthConfig config) {
        update(config);
    }

    @Override
    public Optional<Identity> introspect(String bearerToken) {
        if (bearerToken == null || bearerToken.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(identities.get(bearerToken.trim()));
    }

    @Override
    public void onConfigChanged(GatewayConfig oldConfig, GatewayConfig newConfig) {
        update(newConfig.getAuth());
    }

    private void update(GatewayConfig.AuthConfig config) {
        Map<String, Identity> table = new HashMap<>();
        for (GatewayConfig.TokenConfig token : config.getTokens()) {
            if (token.getToken() == null || token.getUsername() == null) {
                log.warn("Ignoring incomplete token entry: username={}", token.getUsername());
                continue;
            }
            table.put(token.getToken(), new Identity(token.getUsername(),
                    new LinkedHashSet<>(token.getGroups()), token.isAllowed()));
        }
        identities = Map.copyOf(table);
        log.info("Identity table loaded: tokens={}", table.size());
    }
}
