package fr.lapetina.inference.gateway.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Loads the gateway YAML, validates it and hands it to listeners.
 *
 * A candidate configuration only becomes current once it has passed validation and
 * every listener accepted it in {@link ConfigChangeListener#validate}. A failed reload
 * leaves the running configuration in place. Listeners then apply the candidate one by
 * one; a listener that fails to apply is logged and skipped.
 * Secrets can be kept out of the file with environment variables:
 * {@code GATEWAY_INTERNAL_STREAMING_SECRET} overrides {@code streaming.internalSecret}.
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    static final String SECRET_ENV = "GATEWAY_INTERNAL_STREAMING_SECRET";
    static final String PORT_ENV = "GATEWAY_PORT";

    private final AtomicReference<GatewayConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final ConfigValidator validator;
    private final UnaryOperator<String> environment;

    private WatchService watchService;
    private ScheduledExecutorService watchExecutor;
    private volatile long lastModified;

    public ConfigLoader(String configPath, ConfigValidator validator) {
        this(configPath, validator, System::getenv);
    }

    ConfigLoader(String configPath, ConfigValidator validator, UnaryOperator<String> environment) {
        this.configPath = Paths.get(configPath);
        this.validator = validator;
        this.environment = environment;
    }

    private Yaml newYaml() {
        // Yaml instances are not thread-safe; reloads run on the watcher thread
        return new Yaml(new Constructor(GatewayConfig.class, new LoaderOptions()));
    }

    /**
     * Loads, validates and publishes the configuration.
     *
     * @throws ConfigurationException if the file is missing, malformed, invalid or rejected
     */
    public GatewayConfig load() {
        return publish(loadFromPath());
    }

    /**
     * Loads configuration from an input stream.
     */
    public GatewayConfig loadFromStream(InputStream inputStream) {
        return publish(parse(inputStream, "stream"));
    }

    private synchronized GatewayConfig publish(GatewayConfig candidate) {
        applyEnvironmentOverrides(candidate);
        validator.validate(candidate);
        List<ConfigChangeListener> accepted = new ArrayList<>(listeners.size());
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.validate(candidate);
                accepted.add(listener);
            } catch (RuntimeException e) {
                for (ConfigChangeListener validated : accepted) {
                    validated.onConfigRejected(candidate);
                }
                throw e;
            }
        }
        GatewayConfig previous = currentConfig.get();
        for (ConfigChangeListener listener : accepted) {
            try {
                listener.onConfigChanged(previous, candidate);
            } catch (RuntimeException e) {
                log.error("Configuration listener failed to apply the new configuration: listener={}",
                        listener.getClass().getName(), e);
            }
        }
        currentConfig.set(candidate);
        log.info("Configuration applied: clusters={}, endpoints={}, federatedEndpoints={}",
                candidate.getClusters().size(), candidate.getEndpoints().size(),
                candidate.getFederatedEndpoints().size());
        return candidate;
    }

    private GatewayConfig loadFromPath() {
        if (Files.exists(configPath)) {
            try {
                log.info("Loading configuration from file: {}", configPath);
                lastModified = Files.getLastModifiedTime(configPath).toMillis();
                try (InputStream is = Files.newInputStream(configPath)) {
                    return parse(is, configPath.toString());
                }
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load configuration from: " + configPath, e);
            }
        }

        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private GatewayConfig parse(InputStream inputStream, String source) {
        try {
            GatewayConfig config = newYaml().load(inputStream);
            if (config == null) {
                throw new ConfigurationException("Configuration is empty: " + source);
            }
            return config;
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    private void applyEnvironmentOverrides(GatewayConfig config) {
        String secret = environment.apply(SECRET_ENV);
        if (secret != null && !secret.isBlank()) {
            config.getStreaming().setInternalSecret(secret);
        }
        String port = environment.apply(PORT_ENV);
        if (port != null && !port.isBlank()) {
            try {
                config.getServer().setPort(Integer.parseInt(port.trim()));
            } catch (NumberFormatException e) {
                throw new ConfigurationException(PORT_ENV + " is not a port number: " + port, e);
            }
        }
    }

    public GatewayConfig getCurrentConfig() {
        return currentConfig.get();
    }

    /**
     * Starts watching the configuration file for changes.
     */
    public void startWatching() {
        if (!Files.exists(configPath)) {
            log.warn("Config file does not exist, hot reload disabled: {}", configPath);
            return;
        }

        try {
            watchService = FileSystems.getDefault().newWatchService();
            Path parent = configPath.toAbsolutePath().getParent();
            parent.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY, StandardWatchEventKinds.ENTRY_CREATE);

            watchExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "config-watcher");
                t.setDaemon(true);
                return t;
            });
            watchExecutor.scheduleWithFixedDelay(this::checkForChanges, 1, 1, TimeUnit.SECONDS);

            log.info("Configuration hot-reload enabled for: {}", configPath);
        } catch (IOException e) {
            log.error("Failed to start config watcher", e);
        }
    }

    private void checkForChanges() {
        try {
            WatchKey key = watchService.poll();
            if (key == null) {
                return;
            }
            boolean touched = false;
            for (WatchEvent<?> event : key.pollEvents()) {
                if (configPath.getFileName().equals(event.context())) {
                    touched = true;
                }
            }
            key.reset();

            // Editors fire several events per save
            if (touched && Files.getLastModifiedTime(configPath).toMillis() > lastModified) {
                log.info("Configuration file changed, reloading");
                reload();
            }
        } catch (IOException | ClosedWatchServiceException e) {
            log.error("Error checking for config changes", e);
        }
    }

    /**
     * Forces a reload. Returns the configuration in effect afterwards.
     */
    public GatewayConfig reload() {
        try {
            return load();
        } catch (ConfigurationException e) {
            log.error("Failed to reload configuration, keeping current: {}", e.getMessage());
            return currentConfig.get();
        }
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void close() {
        if (watchExecutor != null) {
            watchExecutor.shutdown();
            try {
                watchExecutor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Error closing watch service", e);
            }
        }
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
