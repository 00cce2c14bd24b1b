package fr.lapetina.inference.gateway.infrastructure.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration object for the gateway.
 * Designed to be populated from YAML.
 */
public class GatewayConfig {

    private ServerConfig server = new ServerConfig();
    private AuthConfig auth = new AuthConfig();
    private RoutingConfig routing = new RoutingConfig();
    private StatusCacheConfig statusCache = new StatusCacheConfig();
    private StreamingConfig streaming = new StreamingConfig();
    private BatchConfig batch = new BatchConfig();
    private MetricsIngestionConfig metricsIngestion = new MetricsIngestionConfig();
    private RequestLogConfig requestLog = new RequestLogConfig();
    private FabricConfig fabric = new FabricConfig();
    private HttpConfig http = new HttpConfig();
    private MetricsConfig metrics = new MetricsConfig();
    private List<ClusterConfig> clusters = new ArrayList<>();
    private List<EndpointConfig> endpoints = new ArrayList<>();
    private List<FederatedEndpointConfig> federatedEndpoints = new ArrayList<>();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public AuthConfig getAuth() { return auth; }
    public void setAuth(AuthConfig auth) { this.auth = auth; }

    public RoutingConfig getRouting() { return routing; }
    public void setRouting(RoutingConfig routing) { this.routing = routing; }

    public StatusCacheConfig getStatusCache() { return statusCache; }
    public void setStatusCache(StatusCacheConfig statusCache) { this.statusCache = statusCache; }

    public StreamingConfig getStreaming() { return streaming; }
    public void setStreaming(StreamingConfig streaming) { this.streaming = streaming; }

    public BatchConfig getBatch() { return batch; }
    public void setBatch(BatchConfig batch) { this.batch = batch; }

    public MetricsIngestionConfig getMetricsIngestion() { return metricsIngestion; }
    public void setMetricsIngestion(MetricsIngestionConfig metricsIngestion) { this.metricsIngestion = metricsIngestion; }

    public RequestLogConfig getRequestLog() { return requestLog; }
    public void setRequestLog(RequestLogConfig requestLog) { this.requestLog = requestLog; }

    public FabricConfig getFabric() { return fabric; }
    public void setFabric(FabricConfig fabric) { this.fabric = fabric; }

    public HttpConfig getHttp() { return http; }
    public void setHttp(HttpConfig http) { this.http = http; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    public List<ClusterConfig> getClusters() { return clusters; }
    public void setClusters(List<ClusterConfig> clusters) { this.clusters = clusters; }

    public List<EndpointConfig> getEndpoints() { return endpoints; }
    public void setEndpoints(List<EndpointConfig> endpoints) { this.endpoints = endpoints; }

    public List<FederatedEndpointConfig> getFederatedEndpoints() { return federatedEndpoints; }
    public void setFederatedEndpoints(List<FederatedEndpointConfig> federatedEndpoints) { this.federatedEndpoints = federatedEndpoints; }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private int workerThreads = 64;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    }

    /**
     * Static bearer tokens for the built-in identity provider.
     */
    public static class AuthConfig {
        private List<TokenConfig> tokens = new ArrayList<>();

        public List<TokenConfig> getTokens() { return tokens; }
        public void setTokens(List<TokenConfig> tokens) { this.tokens = tokens; }
    }

    public static class TokenConfig {
        private String token;
        private String username;
        private List<String> groups = new ArrayList<>();
        private boolean allowed = true;

        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }

        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }

        public List<String> getGroups() { return groups; }
        public void setGroups(List<String> groups) { this.groups = groups; }

        public boolean isAllowed() { return allowed; }
        public void setAllowed(boolean allowed) { this.allowed = allowed; }
    }

    /**
     * Federated routing and failover.
     */
    public static class RoutingConfig {
        private int maxAttempts = 0;
        private long cooldownMs = 30000;
        private long stalenessMs = 120000;
        private long adaptorTimeoutMs = 120000;
        private boolean fallbackToNonLive = true;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public long getCooldownMs() { return cooldownMs; }
        public void setCooldownMs(long cooldownMs) { this.cooldownMs = cooldownMs; }

        public long getStalenessMs() { return stalenessMs; }
        public void setStalenessMs(long stalenessMs) { this.stalenessMs = stalenessMs; }

        public long getAdaptorTimeoutMs() { return adaptorTimeoutMs; }
        public void setAdaptorTimeoutMs(long adaptorTimeoutMs) { this.adaptorTimeoutMs = adaptorTimeoutMs; }

        public boolean isFallbackToNonLive() { return fallbackToNonLive; }
        public void setFallbackToNonLive(boolean fallbackToNonLive) { this.fallbackToNonLive = fallbackToNonLive; }
    }

    /**
     * Cluster status cache refresh.
     */
    public static class StatusCacheConfig {
        private long refreshIntervalMs = 60000;
        private long jobsTimeoutMs = 30000;

        public long getRefreshIntervalMs() { return refreshIntervalMs; }
        public void setRefreshIntervalMs(long refreshIntervalMs) { this.refreshIntervalMs = refreshIntervalMs; }

        public long getJobsTimeoutMs() { return jobsTimeoutMs; }
        public void setJobsTimeoutMs(long jobsTimeoutMs) { this.jobsTimeoutMs = jobsTimeoutMs; }
    }

    /**
     * Streaming proxy and internal relay.
     */
    public static class StreamingConfig {
        private String internalSecret;
        private String relayBaseUrl = "http://localhost:8080/internal/streaming";
        private long firstChunkTimeoutMs = 30000;
        private long maxDurationMs = 300000;

        public String getInternalSecret() { return internalSecret; }
        public void setInternalSecret(String internalSecret) { this.internalSecret = internalSecret; }

        public String getRelayBaseUrl() { return relayBaseUrl; }
        public void setRelayBaseUrl(String relayBaseUrl) { this.relayBaseUrl = relayBaseUrl; }

        public long getFirstChunkTimeoutMs() { return firstChunkTimeoutMs; }
        public void setFirstChunkTimeoutMs(long firstChunkTimeoutMs) { this.firstChunkTimeoutMs = firstChunkTimeoutMs; }

        public long getMaxDurationMs() { return maxDurationMs; }
        public void setMaxDurationMs(long maxDurationMs) { this.maxDurationMs = maxDurationMs; }
    }

    /**
     * Batch admission and polling.
     */
    public static class BatchConfig {
        private int maxActivePerUser = 2;
        private long pollIntervalMs = 300000;
        private long initialPollDelayMs = -1;
        private long retentionWindowMs = 3L * 24 * 60 * 60 * 1000;
        private long pollTimeoutMs = 60000;
        private int maxLines = 100000;

        public int getMaxActivePerUser() { return maxActivePerUser; }
        public void setMaxActivePerUser(int maxActivePerUser) { this.maxActivePerUser = maxActivePerUser; }

        public long getPollIntervalMs() { return pollIntervalMs; }
        public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }

        /** Delay before the first poll; negative means one poll interval. */
        public long getInitialPollDelayMs() { return initialPollDelayMs; }
        public void setInitialPollDelayMs(long initialPollDelayMs) { this.initialPollDelayMs = initialPollDelayMs; }

        public long effectiveInitialPollDelayMs() {
            return initialPollDelayMs < 0 ? pollIntervalMs : initialPollDelayMs;
        }

        public long getRetentionWindowMs() { return retentionWindowMs; }
        public void setRetentionWindowMs(long retentionWindowMs) { this.retentionWindowMs = retentionWindowMs; }

        public long getPollTimeoutMs() { return pollTimeoutMs; }
        public void setPollTimeoutMs(long pollTimeoutMs) { this.pollTimeoutMs = pollTimeoutMs; }

        public int getMaxLines() { return maxLines; }
        public void setMaxLines(int maxLines) { this.maxLines = maxLines; }
    }

    /**
     * Request metrics ingestion workers.
     */
    public static class MetricsIngestionConfig {
        private boolean enabled = true;
        private int workers = 1;
        private int batchSize = 500;
        private long intervalMs = 60000;
        private int backfillBatchSize = 1000;
        private long backfillDelayMs = 100;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getWorkers() { return workers; }
        public void setWorkers(int workers) { this.workers = workers; }

        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }

        public int getBackfillBatchSize() { return backfillBatchSize; }
        public void setBackfillBatchSize(int backfillBatchSize) { this.backfillBatchSize = backfillBatchSize; }

        public long getBackfillDelayMs() { return backfillDelayMs; }
        public void setBackfillDelayMs(long backfillDelayMs) { this.backfillDelayMs = backfillDelayMs; }
    }

    /**
     * Request log write-behind ring buffer.
     */
    public static class RequestLogConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private int promptExcerptLength = 2000;

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }

        public int getPromptExcerptLength() { return promptExcerptLength; }
        public void setPromptExcerptLength(int promptExcerptLength) { this.promptExcerptLength = promptExcerptLength; }
    }

    /**
     * Remote execution fabric REST API.
     */
    public static class FabricConfig {
        private String baseUrl = "http://localhost:9000/api";
        private String tokenEnv = "FABRIC_ACCESS_TOKEN";
        private long pollIntervalMs = 1000;
        private long requestTimeoutMs = 30000;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getTokenEnv() { return tokenEnv; }
        public void setTokenEnv(String tokenEnv) { this.tokenEnv = tokenEnv; }

        public long getPollIntervalMs() { return pollIntervalMs; }
        public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }
    }

    /**
     * Outbound HTTP client used by direct API adaptors.
     */
    public static class HttpConfig {
        private long connectTimeoutMs = 10000;

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "inference_gateway";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }

    /**
     * One compute cluster.
     */
    public static class ClusterConfig {
        private String name;
        private String adaptor;
        private List<String> frameworks = new ArrayList<>();
        private List<String> apiRoutes = new ArrayList<>();
        private List<String> allowedGroups = new ArrayList<>();
        private List<String> allowedDomains = new ArrayList<>();
        private String maintenanceNotice;
        private Map<String, Object> config = new LinkedHashMap<>();

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getAdaptor() { return adaptor; }
        public void setAdaptor(String adaptor) { this.adaptor = adaptor; }

        public List<String> getFrameworks() { return frameworks; }
        public void setFrameworks(List<String> frameworks) { this.frameworks = frameworks; }

        public List<String> getApiRoutes() { return apiRoutes; }
        public void setApiRoutes(List<String> apiRoutes) { this.apiRoutes = apiRoutes; }

        public List<String> getAllowedGroups() { return allowedGroups; }
        public void setAllowedGroups(List<String> allowedGroups) { this.allowedGroups = allowedGroups; }

        public List<String> getAllowedDomains() { return allowedDomains; }
        public void setAllowedDomains(List<String> allowedDomains) { this.allowedDomains = allowedDomains; }

        public String getMaintenanceNotice() { return maintenanceNotice; }
        public void setMaintenanceNotice(String maintenanceNotice) { this.maintenanceNotice = maintenanceNotice; }

        public Map<String, Object> getConfig() { return config; }
        public void setConfig(Map<String, Object> config) { this.config = config; }
    }

    /**
     * One physical model endpoint.
     */
    public static class EndpointConfig {
        private String slug;
        private String cluster;
        private String framework;
        private String model;
        private String adaptor;
        private List<String> allowedGroups = new ArrayList<>();
        private List<String> allowedDomains = new ArrayList<>();
        private Map<String, Object> config = new LinkedHashMap<>();

        public String getSlug() { return slug; }
        public void setSlug(String slug) { this.slug = slug; }

        public String getCluster() { return cluster; }
        public void setCluster(String cluster) { this.cluster = cluster; }

        public String getFramework() { return framework; }
        public void setFramework(String framework) { this.framework = framework; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public String getAdaptor() { return adaptor; }
        public void setAdaptor(String adaptor) { this.adaptor = adaptor; }

        public List<String> getAllowedGroups() { return allowedGroups; }
        public void setAllowedGroups(List<String> allowedGroups) { this.allowedGroups = allowedGroups; }

        public List<String> getAllowedDomains() { return allowedDomains; }
        public void setAllowedDomains(List<String> allowedDomains) { this.allowedDomains = allowedDomains; }

        public Map<String, Object> getConfig() { return config; }
        public void setConfig(Map<String, Object> config) { this.config = config; }
    }

    /**
     * A logical model served by several targets.
     */
    public static class FederatedEndpointConfig {
        private String slug;
        private String name;
        private String targetModelName;
        private String description;
        private List<TargetConfig> targets = new ArrayList<>();

        public String getSlug() { return slug; }
        public void setSlug(String slug) { this.slug = slug; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getTargetModelName() { return targetModelName; }
        public void setTargetModelName(String targetModelName) { this.targetModelName = targetModelName; }

        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }

        public List<TargetConfig> getTargets() { return targets; }
        public void setTargets(List<TargetConfig> targets) { this.targets = targets; }
    }

    public static class TargetConfig {
        private String cluster;
        private String framework;
        private String model;
        private String endpointSlug;

        public String getCluster() { return cluster; }
        public void setCluster(String cluster) { this.cluster = cluster; }

        public String getFramework() { return framework; }
        public void setFramework(String framework) { this.framework = framework; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public String getEndpointSlug() { return endpointSlug; }
        public void setEndpointSlug(String endpointSlug) { this.endpointSlug = endpointSlug; }
    }
}
