package fr.lapetina.inference.gateway.adaptor;

import fr.lapetina.inference.gateway.infrastructure.config.ConfigLoader.ConfigurationException;

import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Typed view over the free-form {@code config} map of an endpoint or cluster.
 * Every accessor fails with {@link ConfigurationException} naming the owner and key.
 */
public final class AdaptorSettings {

    private final String owner;
    private final Map<String, String> values;
    private final UnaryOperator<String> environment;

    public AdaptorSettings(String owner, Map<String, String> values) {
        this(owner, values, System::getenv);
    }

    AdaptorSettings(String owner, Map<String, String> values, UnaryOperator<String> environment) {
        this.owner = owner;
        this.values = values;
        this.environment = environment;
    }

    public String require(String key) {
        String value = values.get(key);
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(owner + ": missing required setting '" + key + "'");
        }
        return value.trim();
    }

    public String optional(String key, String defaultValue) {
        String value = values.get(key);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    public int intValue(String key, int defaultValue) {
        String value = optional(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(owner + ": setting '" + key + "' is not an integer: " + value, e);
        }
    }

    public long longValue(String key, long defaultValue) {
        String value = optional(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(owner + ": setting '" + key + "' is not a number: " + value, e);
        }
    }

    /**
     * Resolves a secret whose environment variable name is given by {@code key}.
     * Returns {@code null} when the setting is absent.
     */
    public String secretFromEnv(String key) {
        String variable = optional(key, null);
        if (variable == null) {
            return null;
        }
        String secret = environment.apply(variable);
        if (secret == null || secret.isBlank()) {
            throw new ConfigurationException(owner + ": environment variable " + variable + " is not set");
        }
        return secret;
    }
}
