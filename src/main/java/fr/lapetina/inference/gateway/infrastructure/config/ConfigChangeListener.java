package fr.lapetina.inference.gateway.infrastructure.config;

/**
 * Listener for configuration changes.
 *
 * Publishing runs in two phases. Every listener first gets {@link #validate} and may
 * reject the candidate by throwing {@link ConfigLoader.ConfigurationException}; the loader
 * then keeps the previous configuration and tells the listeners that already validated
 * through {@link #onConfigRejected}. Once all listeners accepted, each one gets
 * {@link #onConfigChanged}; a failure there is logged and does not stop the others.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * Checks a candidate configuration before anything is applied.
     *
     * @throws ConfigLoader.ConfigurationException to reject the candidate
     */
    default void validate(GatewayConfig candidate) {
    }

    /**
     * Called when a candidate this listener validated was rejected by another listener.
     */
    default void onConfigRejected(GatewayConfig candidate) {
    }

    /**
     * Called when configuration is loaded or reloaded.
     *
     * @param oldConfig The previous configuration (may be null on first load)
     * @param newConfig The new configuration
     */
    void onConfigChanged(GatewayConfig oldConfig, GatewayConfig newConfig);
}
