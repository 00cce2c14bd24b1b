package fr.lapetina.inference.gateway;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.inference.gateway.adaptor.AdaptorContext;
import fr.lapetina.inference.gateway.adaptor.AdaptorRegistry;
import fr.lapetina.inference.gateway.adaptor.fabric.ExecutionFabricClient;
import fr.lapetina.inference.gateway.adaptor.fabric.HttpExecutionFabricClient;
import fr.lapetina.inference.gateway.adaptor.http.OpenAiHttpClient;
import fr.lapetina.inference.gateway.auth.IdentityProvider;
import fr.lapetina.inference.gateway.auth.StaticTokenIdentityProvider;
import fr.lapetina.inference.gateway.batch.BatchAdmissionControl;
import fr.lapetina.inference.gateway.batch.BatchInputReader;
import fr.lapetina.inference.gateway.batch.BatchJobManager;
import fr.lapetina.inference.gateway.batch.BatchPoller;
import fr.lapetina.inference.gateway.batch.BatchResultWriter;
import fr.lapetina.inference.gateway.disruptor.RequestLogPipeline;
import fr.lapetina.inference.gateway.infrastructure.config.ConfigLoader;
import fr.lapetina.inference.gateway.infrastructure.config.ConfigValidator;
import fr.lapetina.inference.gateway.infrastructure.config.GatewayConfig;
import fr.lapetina.inference.gateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.gateway.ingestion.MetricsIngestionScheduler;
import fr.lapetina.inference.gateway.routing.EndpointCatalog;
import fr.lapetina.inference.gateway.routing.FederatedRouter;
import fr.lapetina.inference.gateway.routing.InferenceService;
import fr.lapetina.inference.gateway.routing.RoutingPolicy;
import fr.lapetina.inference.gateway.routing.TargetHealthTracker;
import fr.lapetina.inference.gateway.status.ClusterStatusCache;
import fr.lapetina.inference.gateway.store.BatchJobStore;
import fr.lapetina.inference.gateway.store.RequestLogStore;
import fr.lapetina.inference.gateway.store.RequestMetricsStore;
import fr.lapetina.inference.gateway.store.memory.InMemoryBatchJobStore;
import fr.lapetina.inference.gateway.store.memory.InMemoryRequestLogStore;
import fr.lapetina.inference.gateway.store.memory.InMemoryRequestMetricsStore;
import fr.lapetina.inference.gateway.streaming.StreamRelay;
import fr.lapetina.inference.gateway.streaming.StreamingProxy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds a fully wired gateway from a configuration file.
 *
 * <p>Usage:
 * <pre>{@code
 * try (GatewayFactory factory = GatewayFactory.create("config.yaml").start()) {
 *     InferenceService inference = factory.getInferenceService();
 *     // ...
 * }
 * }</pre>
 */
public class GatewayFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GatewayFactory.class);

    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final ConfigLoader configLoader;
    private final GatewayConfig config;
    private final MetricsRegistry metricsRegistry;
    private final StreamRelay streamRelay;
    private final OpenAiHttpClient httpClient;
    private final ExecutionFabricClient fabricClient;
    private final ScheduledExecutorService adaptorScheduler;
    private final ExecutorService streamExecutor;
    private final EndpointCatalog catalog;
    private final ClusterStatusCache statusCache;
    private final TargetHealthTracker healthTracker;
    private final FederatedRouter router;
    private final RequestLogStore requestLogStore;
    private final RequestMetricsStore requestMetricsStore;
    private final BatchJobStore batchJobStore;
    private final RequestLogPipeline requestLogPipeline;
    private final InferenceService inferenceService;
    private final StreamingProxy streamingProxy;
    private final BatchAdmissionControl batchAdmission;
    private final BatchJobManager batchJobManager;
    private final BatchPoller batchPoller;
    private final MetricsIngestionScheduler ingestionScheduler;
    private final StaticTokenIdentityProvider identityProvider;

    protected GatewayFactory(
            String configPath,
            AdaptorRegistry registryOverride,
            ExecutionFabricClient fabricClientOverride,
            Clock clockOverride
    ) {
        log.info("Initializing GatewayFactory from config: {}", configPath);

        this.clock = clockOverride != null ? clockOverride : Clock.systemUTC();
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        AdaptorRegistry registry = registryOverride != null ? registryOverride : AdaptorRegistry.defaults();

        // Load configuration
        this.configLoader = new ConfigLoader(configPath,
                new ConfigValidator(registry.endpointTypes(), registry.clusterTypes()));
        this.config = configLoader.load();

        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        // Outbound clients
        this.streamRelay = new StreamRelay(config.getStreaming().getInternalSecret());
        metricsRegistry.registerOpenStreams(streamRelay::openStreams);
        this.httpClient = new OpenAiHttpClient(Duration.ofMillis(config.getHttp().getConnectTimeoutMs()), objectMapper);
        this.fabricClient = fabricClientOverride != null ? fabricClientOverride : createFabricClient();
        this.adaptorScheduler = Executors.newScheduledThreadPool(2, daemonThreads("adaptor-timer"));
        this.streamExecutor = Executors.newCachedThreadPool(daemonThreads("stream-pump"));

        // Catalog and routing
        AdaptorContext context = new AdaptorContext(
                httpClient,
                fabricClient,
                adaptorScheduler,
                streamExecutor,
                streamRelay,
                config.getStreaming().getRelayBaseUrl(),
                Duration.ofMillis(config.getFabric().getPollIntervalMs()),
                objectMapper,
                clock
        );
        this.catalog = new EndpointCatalog(registry, context);
        catalog.apply(config);

        this.statusCache = new ClusterStatusCache(
                catalog::clusterAdaptors,
                metricsRegistry,
                clock,
                Duration.ofMillis(config.getStatusCache().getRefreshIntervalMs()),
                Duration.ofMillis(config.getStatusCache().getJobsTimeoutMs())
        );
        this.healthTracker = new TargetHealthTracker(clock, Duration.ofMillis(config.getRouting().getCooldownMs()));
        this.router = new FederatedRouter(catalog, statusCache, healthTracker, metricsRegistry,
                RoutingPolicy.from(config.getRouting()));

        // Stores and request logging
        this.requestLogStore = new InMemoryRequestLogStore();
        this.requestMetricsStore = new InMemoryRequestMetricsStore();
        this.batchJobStore = new InMemoryBatchJobStore();
        this.requestLogPipeline = new RequestLogPipeline(
                requestLogStore,
                metricsRegistry,
                config.getRequestLog().getRingBufferSize(),
                config.getRequestLog().getWaitStrategy()
        );

        int excerptLength = config.getRequestLog().getPromptExcerptLength();
        this.inferenceService = new InferenceService(router, requestLogPipeline, metricsRegistry, clock, excerptLength);
        this.streamingProxy = new StreamingProxy(
                router,
                requestLogPipeline,
                metricsRegistry,
                objectMapper,
                clock,
                Duration.ofMillis(config.getStreaming().getFirstChunkTimeoutMs()),
                Duration.ofMillis(config.getStreaming().getMaxDurationMs()),
                excerptLength
        );

        // Batch processing
        GatewayConfig.BatchConfig batch = config.getBatch();
        this.batchAdmission = new BatchAdmissionControl(batch.getMaxActivePerUser());
        metricsRegistry.registerActiveBatches(batchAdmission::totalActive);
        this.batchJobManager = new BatchJobManager(
                batchJobStore,
                router,
                catalog,
                batchAdmission,
                new BatchInputReader(objectMapper, batch.getMaxLines()),
                metricsRegistry,
                clock,
                Duration.ofMillis(config.getRouting().getAdaptorTimeoutMs()),
                Duration.ofMillis(batch.getRetentionWindowMs())
        );
        this.batchPoller = new BatchPoller(
                batchJobStore,
                batchJobManager,
                catalog,
                new BatchResultWriter(objectMapper),
                clock,
                Duration.ofMillis(batch.getPollIntervalMs()),
                Duration.ofMillis(batch.effectiveInitialPollDelayMs()),
                Duration.ofMillis(batch.getPollTimeoutMs())
        );

        // Metrics ingestion
        GatewayConfig.MetricsIngestionConfig ingestion = config.getMetricsIngestion();
        this.ingestionScheduler = new MetricsIngestionScheduler(
                requestLogStore,
                requestMetricsStore,
                metricsRegistry,
                ingestion.getWorkers(),
                ingestion.getBatchSize(),
                Duration.ofMillis(ingestion.getIntervalMs())
        );

        this.identityProvider = new StaticTokenIdentityProvider(config.getAuth());

        // The catalog rejects a configuration whose adaptors cannot be built
        configLoader.addListener(catalog);
        configLoader.addListener(identityProvider);
        configLoader.addListener(this::onConfigChanged);

        log.info("GatewayFactory initialized: clusters={}, endpoints={}, federatedEndpoints={}",
                catalog.clusters().size(), catalog.endpoints().size(), catalog.federatedEndpoints().size());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static GatewayFactory create(String configPath) {
        return new GatewayFactory(configPath, null, null, null);
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static GatewayFactory create() {
        return create("config.yaml");
    }

    /**
     * Starts the request log writer and the background workers.
     */
    public GatewayFactory start() {
        requestLogPipeline.start();
        statusCache.start();
        batchPoller.start();
        if (config.getMetricsIngestion().isEnabled()) {
            ingestionScheduler.start();
        }
        configLoader.startWatching();
        log.info("Gateway started");
        return this;
    }

    private ExecutionFabricClient createFabricClient() {
        GatewayConfig.FabricConfig fabric = config.getFabric();
        String token = fabric.getTokenEnv() != null ? System.getenv(fabric.getTokenEnv()) : null;
        if (token == null) {
            log.warn("No fabric access token in environment: variable={}", fabric.getTokenEnv());
        }
        return new HttpExecutionFabricClient(
                fabric.getBaseUrl(),
                token,
                Duration.ofMillis(fabric.getRequestTimeoutMs()),
                objectMapper
        );
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }

    private void onConfigChanged(GatewayConfig oldConfig, GatewayConfig newConfig) {
        log.info("Configuration changed, applying updates...");

        router.updatePolicy(RoutingPolicy.from(newConfig.getRouting()));
        healthTracker.setCooldown(Duration.ofMillis(newConfig.getRouting().getCooldownMs()));
        streamRelay.updateSecret(newConfig.getStreaming().getInternalSecret());
        streamingProxy.updateTimeouts(
                Duration.ofMillis(newConfig.getStreaming().getFirstChunkTimeoutMs()),
                Duration.ofMillis(newConfig.getStreaming().getMaxDurationMs()));
        batchAdmission.setMaxActivePerUser(newConfig.getBatch().getMaxActivePerUser());

        log.info("Configuration updates applied");
    }

    public GatewayConfig getConfig() {
        GatewayConfig current = configLoader.getCurrentConfig();
        return current != null ? current : config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public StreamRelay getStreamRelay() {
        return streamRelay;
    }

    public EndpointCatalog getCatalog() {
        return catalog;
    }

    public ClusterStatusCache getStatusCache() {
        return statusCache;
    }

    public TargetHealthTracker getHealthTracker() {
        return healthTracker;
    }

    public FederatedRouter getRouter() {
        return router;
    }

    public RequestLogStore getRequestLogStore() {
        return requestLogStore;
    }

    public RequestMetricsStore getRequestMetricsStore() {
        return requestMetricsStore;
    }

    public BatchJobStore getBatchJobStore() {
        return batchJobStore;
    }

    public RequestLogPipeline getRequestLogPipeline() {
        return requestLogPipeline;
    }

    public InferenceService getInferenceService() {
        return inferenceService;
    }

    public StreamingProxy getStreamingProxy() {
        return streamingProxy;
    }

    public BatchAdmissionControl getBatchAdmission() {
        return batchAdmission;
    }

    public BatchJobManager getBatchJobManager() {
        return batchJobManager;
    }

    public BatchPoller getBatchPoller() {
        return batchPoller;
    }

    public MetricsIngestionScheduler getIngestionScheduler() {
        return ingestionScheduler;
    }

    public IdentityProvider getIdentityProvider() {
        return identityProvider;
    }

    @Override
    public void close() {
        log.info("Shutting down GatewayFactory...");

        closeQuietly("config loader", configLoader);
        closeQuietly("metrics ingestion", ingestionScheduler);
        closeQuietly("batch poller", batchPoller);
        closeQuietly("status cache", statusCache);
        closeQuietly("catalog", catalog);
        closeQuietly("request log pipeline", requestLogPipeline);
        closeQuietly("fabric client", fabricClient);
        closeQuietly("HTTP client", httpClient);

        adaptorScheduler.shutdownNow();
        streamExecutor.shutdownNow();
        try {
            streamExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        closeQuietly("metrics registry", metricsRegistry);
        log.info("GatewayFactory shut down");
    }

    private static void closeQuietly(String name, AutoCloseable resource) {
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Error closing {}", name, e);
        }
    }
}
