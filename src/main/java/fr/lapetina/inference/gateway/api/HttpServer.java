package fr.lapetina.inference.gateway.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.inference.gateway.GatewayFactory;
import fr.lapetina.inference.gateway.adaptor.AdaptorErrors;
import fr.lapetina.inference.gateway.adaptor.EndpointAdaptor;
import fr.lapetina.inference.gateway.adaptor.EndpointStatus;
import fr.lapetina.inference.gateway.adaptor.TaskResult;
import fr.lapetina.inference.gateway.api.dto.BatchCreateRequest;
import fr.lapetina.inference.gateway.api.dto.BatchResponse;
import fr.lapetina.inference.gateway.api.dto.ErrorResponse;
import fr.lapetina.inference.gateway.api.dto.RelayMessage;
import fr.lapetina.inference.gateway.domain.model.ApiRoute;
import fr.lapetina.inference.gateway.domain.model.BatchJob;
import fr.lapetina.inference.gateway.domain.model.BatchStatus;
import fr.lapetina.inference.gateway.domain.model.Cluster;
import fr.lapetina.inference.gateway.domain.model.ClusterStatus;
import fr.lapetina.inference.gateway.domain.model.Endpoint;
import fr.lapetina.inference.gateway.domain.model.ErrorType;
import fr.lapetina.inference.gateway.domain.model.FederatedEndpoint;
import fr.lapetina.inference.gateway.domain.model.GatewayError;
import fr.lapetina.inference.gateway.domain.model.GatewayException;
import fr.lapetina.inference.gateway.domain.model.Identity;
import fr.lapetina.inference.gateway.domain.model.InferenceRequest;
import fr.lapetina.inference.gateway.domain.model.JobInfo;
import fr.lapetina.inference.gateway.domain.model.ModelAvailability;
import fr.lapetina.inference.gateway.domain.model.Target;
import fr.lapetina.inference.gateway.infrastructure.config.ConfigLoader;
import fr.lapetina.inference.gateway.infrastructure.config.GatewayConfig;
import fr.lapetina.inference.gateway.ingestion.MetricsIngestionWorker;
import fr.lapetina.inference.gateway.routing.AccessPolicy;
import fr.lapetina.inference.gateway.routing.PinnedTarget;
import fr.lapetina.inference.gateway.routing.RouteResult;
import fr.lapetina.inference.gateway.status.ClusterStatusEntry;
import fr.lapetina.inference.gateway.streaming.ChunkSink;
import fr.lapetina.inference.gateway.streaming.StreamOutcome;
import fr.lapetina.inference.gateway.streaming.StreamRelay;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * OpenAI compatible HTTP front end on the JDK's built-in HttpServer.
 *
 * Endpoints:
 * - POST /v1/{chat/completions|completions|embeddings} - Federated inference
 * - POST /{cluster}/{framework}/v1/{route} - Inference pinned to one deployment
 * - POST /v1/batches, GET /v1/batches[?status=], GET /v1/batches/{id}[/result] - Batches
 * - GET /v1/models - Federated models and their live targets
 * - GET /{cluster}/jobs - Cached cluster status
 * - POST /internal/streaming/{data|done|error} - Streaming relay for execution fabrics
 * - GET /health - Health check endpoint
 * - GET /metrics - Prometheus metrics endpoint
 * - GET /admin/ingestion/lag, POST /admin/ingestion/backfill,
 *   POST /admin/batches/poll, POST /admin/reload - Operations
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    static final String SECRET_HEADER = "X-Internal-Streaming-Secret";

    private static final Pattern FEDERATED_PATH =
            Pattern.compile("^/v1/(chat/completions|completions|embeddings)/?$");
    private static final Pattern PINNED_PATH =
            Pattern.compile("^/([^/]+)/([^/]+)/v1/(chat/completions|completions|embeddings)/?$");
    private static final Pattern JOBS_PATH = Pattern.compile("^/([^/]+)/jobs/?$");
    private static final Pattern STATUS_PATH = Pattern.compile("^/([^/]+)/([^/]+)/(.+)/status/?$");
    private static final Pattern BATCH_PATH = Pattern.compile("^/v1/batches/([^/]+)(/result)?/?$");
    private static final TypeReference<Map<String, Object>> BODY_TYPE = new TypeReference<>() {
    };

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final GatewayFactory factory;

    public HttpServer(GatewayConfig.ServerConfig serverConfig, GatewayFactory factory) throws IOException {
        this.factory = factory;
        this.objectMapper = factory.getObjectMapper();

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(serverConfig.getHost(), serverConfig.getPort()), serverConfig.getBacklog()
        );

        // Streaming responses hold a worker for their whole duration
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(serverConfig.getWorkerThreads(), r -> {
            Thread t = new Thread(r, "http-worker-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        // Register handlers
        server.createContext("/", new InferenceHandler());
        server.createContext("/v1/batches", new BatchHandler());
        server.createContext("/v1/models", new ModelsHandler());
        server.createContext("/internal/streaming", new RelayHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/admin", new AdminHandler());

        log.info("HTTP server configured: host={}, port={}, workers={}",
                serverConfig.getHost(), serverConfig.getPort(), serverConfig.getWorkerThreads());
    }

    public void start() {
        server.start();
        log.info("HTTP server started");
    }

    /**
     * Actual bound port, useful when configured with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(5);
        executor.shutdownNow();
        try {
            executor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("HTTP server stopped");
    }

    // ==================== INFERENCE HANDLER ====================

    private class InferenceHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String requestId = UUID.randomUUID().toString();
            MDC.put("requestId", requestId);

            try {
                String path = exchange.getRequestURI().getPath();
                Matcher federated = FEDERATED_PATH.matcher(path);
                Matcher pinned = PINNED_PATH.matcher(path);
                Matcher jobs = JOBS_PATH.matcher(path);
                Matcher status = STATUS_PATH.matcher(path);

                if (federated.matches()) {
                    handleInference(exchange, requestId, federated.group(1), null);
                } else if (pinned.matches()) {
                    handleInference(exchange, requestId, pinned.group(3),
                            new PinnedTarget(pinned.group(1), pinned.group(2)));
                } else if (jobs.matches()) {
                    handleJobs(exchange, jobs.group(1));
                } else if (status.matches()) {
                    handleEndpointStatus(exchange, status.group(1), status.group(2), status.group(3));
                } else {
                    sendError(exchange, GatewayError.of(ErrorType.NOT_FOUND, "No route for " + path));
                }
            } catch (GatewayException e) {
                sendError(exchange, e.getError());
            } catch (Exception e) {
                log.error("Error handling inference request", e);
                sendError(exchange, GatewayError.of(ErrorType.INTERNAL_ERROR, "Internal server error"));
            } finally {
                MDC.clear();
            }
        }

        private void handleInference(HttpExchange exchange, String requestId, String routePath, PinnedTarget pin)
                throws IOException {
            requireMethod(exchange, "POST");
            Identity identity = authenticate(exchange);
            ApiRoute route = ApiRoute.fromPath(routePath)
                    .orElseThrow(() -> new GatewayException(ErrorType.NOT_FOUND, "Unknown route " + routePath));

            InferenceRequest parsed = InferenceRequest.fromPayload(route, readBody(exchange));
            InferenceRequest request = new InferenceRequest(
                    requestId, parsed.route(), parsed.model(), parsed.stream(), parsed.payload(), parsed.createdAt());

            log.debug("Inference request: requestId={}, user={}, route={}, model={}, stream={}, pinned={}",
                    requestId, identity.username(), route.path(), request.model(), request.stream(), pin);

            if (request.stream()) {
                handleStream(exchange, request, identity, pin);
                return;
            }

            RouteResult<TaskResult.Success> result;
            try {
                result = factory.getInferenceService().infer(request, identity, pin).join();
            } catch (CompletionException e) {
                throw unwrap(e);
            }

            if (result instanceof RouteResult.Served<TaskResult.Success> served) {
                byte[] bytes = served.value().body().getBytes(StandardCharsets.UTF_8);
                exchange.getResponseHeaders().set("Content-Type", "application/json");
                exchange.getResponseHeaders().set("X-Gateway-Endpoint", served.endpoint().slug());
                exchange.sendResponseHeaders(served.value().statusCode(), bytes.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(bytes);
                }
            } else if (result instanceof RouteResult.Failed<TaskResult.Success> failed) {
                sendError(exchange, failed.error());
            }
        }

        private void handleStream(HttpExchange exchange, InferenceRequest request, Identity identity,
                                  PinnedTarget pin) throws IOException {
            SseSink sink = new SseSink(exchange);
            StreamOutcome outcome = factory.getStreamingProxy().proxy(request, identity, pin, sink);
            if (!outcome.started()) {
                GatewayError error = outcome.error() != null
                        ? outcome.error()
                        : GatewayError.of(ErrorType.INTERNAL_ERROR, "Stream ended before it started");
                sendError(exchange, error);
                return;
            }
            sink.close();
        }

        private void handleJobs(HttpExchange exchange, String cluster) throws IOException {
            requireMethod(exchange, "GET");
            authenticate(exchange);
            if (factory.getCatalog().cluster(cluster).isEmpty()) {
                throw new GatewayException(ErrorType.NOT_FOUND, "Cluster " + cluster + " not found");
            }

            Optional<ClusterStatusEntry> entry = factory.getStatusCache().get(cluster);
            if (entry.isEmpty() || entry.get().status() == null) {
                GatewayError lastError = entry.map(ClusterStatusEntry::lastError).orElse(null);
                throw new GatewayException(ErrorType.UNAVAILABLE, "No status available for cluster " + cluster
                        + (lastError != null ? ": " + lastError.message() : ""));
            }

            ClusterStatusEntry status = entry.get();
            Map<String, Object> body = new LinkedHashMap<>(status.status().toPayload());
            body.put("refreshed_at", status.refreshedAt());
            body.put("age_seconds", Duration.between(status.refreshedAt(), Instant.now()).toSeconds());
            if (status.lastError() != null) {
                body.put("last_error", status.lastError().message());
            }
            sendJson(exchange, 200, body);
        }

        /**
         * Detailed status of one endpoint: what the status cache knows about its model and
         * what the endpoint's adaptor reports right now.
         */
        private void handleEndpointStatus(HttpExchange exchange, String clusterName, String framework,
                                          String model) throws IOException {
            requireMethod(exchange, "GET");
            Identity identity = authenticate(exchange);
            String slug = Endpoint.slugOf(clusterName, framework, model);
            Endpoint endpoint = factory.getCatalog().endpoint(slug)
                    .orElseThrow(() -> new GatewayException(ErrorType.NOT_FOUND, "Endpoint " + slug + " not found"));
            Cluster cluster = factory.getCatalog().cluster(endpoint.cluster())
                    .orElseThrow(() -> new GatewayException(ErrorType.NOT_FOUND, "Cluster " + clusterName + " not found"));
            if (!AccessPolicy.canAccess(identity, cluster, endpoint)) {
                throw new GatewayException(ErrorType.FORBIDDEN, "User not authorized to access endpoint " + slug);
            }

            Duration staleness = factory.getRouter().getPolicy().staleness();
            ModelAvailability availability = factory.getStatusCache()
                    .availability(cluster.name(), endpoint.framework(), endpoint.model(), staleness);
            Map<String, Object> modelStatus = new LinkedHashMap<>();
            modelStatus.put("availability", availability.name().toLowerCase());
            Optional<ClusterStatusEntry> entry = factory.getStatusCache().get(cluster.name());
            if (entry.isPresent() && entry.get().status() != null) {
                ClusterStatus jobs = entry.get().status();
                List<Map<String, Object>> matching = new ArrayList<>();
                addServing(matching, "running", jobs.running(), endpoint);
                addServing(matching, "queued", jobs.queued(), endpoint);
                addServing(matching, "stopped", jobs.stopped(), endpoint);
                modelStatus.put("jobs", matching);
                modelStatus.put("refreshed_at", entry.get().refreshedAt());
            }

            EndpointStatus endpointStatus = factory.getCatalog().endpointAdaptor(slug)
                    .map(adaptor -> currentEndpointStatus(adaptor, slug))
                    .orElseGet(() -> EndpointStatus.offline("No adaptor for endpoint " + slug));

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("cluster", cluster.name());
            body.put("model", modelStatus);
            Map<String, Object> endpointInfo = new LinkedHashMap<>();
            endpointInfo.put("online", endpointStatus.online());
            endpointInfo.put("detail", endpointStatus.detail());
            body.put("endpoint", endpointInfo);
            sendJson(exchange, 200, body);
        }

        private EndpointStatus currentEndpointStatus(EndpointAdaptor adaptor, String slug) {
            long timeoutMs = factory.getConfig().getRouting().getAdaptorTimeoutMs();
            try {
                return adaptor.endpointStatus().orTimeout(timeoutMs, TimeUnit.MILLISECONDS).join();
            } catch (RuntimeException e) {
                return EndpointStatus.offline(AdaptorErrors.classify(e, slug).message());
            }
        }

        private void addServing(List<Map<String, Object>> into, String state, List<JobInfo> jobs, Endpoint endpoint) {
            for (JobInfo job : jobs) {
                if (job.serves(endpoint.framework(), endpoint.model())) {
                    Map<String, Object> payload = new LinkedHashMap<>(job.toPayload());
                    payload.put("state", state);
                    into.add(payload);
                }
            }
        }
    }

    /**
     * Server-sent events over the exchange's response body.
     */
    private static final class SseSink implements ChunkSink {
        private final HttpExchange exchange;
        private OutputStream out;

        SseSink(HttpExchange exchange) {
            this.exchange = exchange;
        }

        @Override
        public void open() throws IOException {
            exchange.getResponseHeaders().set("Content-Type", "text/event-stream");
            exchange.getResponseHeaders().set("Cache-Control", "no-cache");
            exchange.sendResponseHeaders(200, 0);
            out = exchange.getResponseBody();
        }

        @Override
        public void send(String line) throws IOException {
            out.write((line + "\n\n").getBytes(StandardCharsets.UTF_8));
            out.flush();
        }

        void close() {
            try {
                out.close();
            } catch (IOException e) {
                log.debug("Client went away before the stream was closed: {}", e.getMessage());
            }
        }
    }

    // ==================== BATCH HANDLER ====================

    private class BatchHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            MDC.put("requestId", UUID.randomUUID().toString());
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();

            try {
                Identity identity = authenticate(exchange);
                Matcher single = BATCH_PATH.matcher(path);

                if (path.matches("^/v1/batches/?$") && "POST".equals(method)) {
                    BatchCreateRequest body = readValue(exchange, BatchCreateRequest.class);
                    BatchJob job = factory.getBatchJobManager().submit(body.toSubmission(), identity);
                    sendJson(exchange, 200, BatchResponse.fromJob(job));
                } else if (path.matches("^/v1/batches/?$") && "GET".equals(method)) {
                    String statusParam = queryParam(exchange, "status");
                    BatchStatus status = null;
                    if (statusParam != null) {
                        status = BatchStatus.fromWire(statusParam).orElseThrow(() -> new GatewayException(
                                ErrorType.VALIDATION_ERROR, "Unknown batch status: " + statusParam));
                    }
                    List<BatchResponse> batches = factory.getBatchJobManager().list(identity, status).stream()
                            .map(BatchResponse::fromJob)
                            .toList();
                    sendJson(exchange, 200, Map.of("data", batches));
                } else if (single.matches() && "GET".equals(method)) {
                    String batchId = single.group(1);
                    if (single.group(2) != null) {
                        BatchJob job = factory.getBatchJobManager().result(batchId, identity);
                        sendJson(exchange, 200, BatchResponse.withResults(job));
                    } else {
                        BatchJob job = factory.getBatchJobManager().status(batchId, identity);
                        sendJson(exchange, 200, BatchResponse.fromJob(job));
                    }
                } else if (path.matches("^/v1/batches.*")) {
                    sendError(exchange, new GatewayError(ErrorType.VALIDATION_ERROR, "Method Not Allowed", 405));
                } else {
                    sendError(exchange, GatewayError.of(ErrorType.NOT_FOUND, "No route for " + path));
                }
            } catch (GatewayException e) {
                sendError(exchange, e.getError());
            } catch (Exception e) {
                log.error("Error in batch handler", e);
                sendError(exchange, GatewayError.of(ErrorType.INTERNAL_ERROR, "Internal server error"));
            } finally {
                MDC.clear();
            }
        }
    }

    // ==================== MODELS HANDLER ====================

    private class ModelsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            try {
                requireMethod(exchange, "GET");
                authenticate(exchange);

                Duration staleness = factory.getRouter().getPolicy().staleness();
                List<Map<String, Object>> models = new ArrayList<>();
                for (FederatedEndpoint federated : factory.getCatalog().federatedEndpoints()) {
                    List<Map<String, Object>> targets = new ArrayList<>();
                    for (Target target : federated.targets()) {
                        Map<String, Object> info = new LinkedHashMap<>();
                        info.put("cluster", target.cluster());
                        info.put("framework", target.framework());
                        info.put("availability", factory.getStatusCache()
                                .availability(target.cluster(), target.framework(), target.model(), staleness)
                                .name().toLowerCase());
                        info.put("cooling_down", factory.getHealthTracker().isCoolingDown(target.key()));
                        targets.add(info);
                    }
                    Map<String, Object> model = new LinkedHashMap<>();
                    model.put("id", federated.targetModelName());
                    model.put("object", "model");
                    model.put("name", federated.name());
                    model.put("description", federated.description());
                    model.put("targets", targets);
                    models.add(model);
                }
                sendJson(exchange, 200, Map.of("object", "list", "data", models));
            } catch (GatewayException e) {
                sendError(exchange, e.getError());
            } catch (Exception e) {
                log.error("Error listing models", e);
                sendError(exchange, GatewayError.of(ErrorType.INTERNAL_ERROR, "Internal server error"));
            }
        }
    }

    // ==================== RELAY HANDLER ====================

    private class RelayHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();

            try {
                requireMethod(exchange, "POST");
                String secret = exchange.getRequestHeaders().getFirst(SECRET_HEADER);
                RelayMessage message = readValue(exchange, RelayMessage.class);
                if (message.getTaskId() == null || message.getTaskId().isBlank()) {
                    throw new GatewayException(ErrorType.VALIDATION_ERROR, "Field 'task_id' is required");
                }

                StreamRelay relay = factory.getStreamRelay();
                StreamRelay.Outcome outcome;
                if (path.matches("^/internal/streaming/data/?$")) {
                    if (message.getData() == null) {
                        throw new GatewayException(ErrorType.VALIDATION_ERROR, "Field 'data' is required");
                    }
                    outcome = relay.data(secret, message.getTaskId(), message.getData());
                } else if (path.matches("^/internal/streaming/done/?$")) {
                    outcome = relay.done(secret, message.getTaskId());
                } else if (path.matches("^/internal/streaming/error/?$")) {
                    String error = message.getError() != null ? message.getError() : "Remote stream failed";
                    outcome = relay.error(secret, message.getTaskId(), error);
                } else {
                    throw new GatewayException(ErrorType.NOT_FOUND, "No route for " + path);
                }

                switch (outcome) {
                    case ACCEPTED -> sendJson(exchange, 200, Map.of("status", "ok"));
                    case UNAUTHORIZED -> {
                        log.warn("Rejected relay message with bad secret: path={}, taskId={}",
                                path, message.getTaskId());
                        sendError(exchange, GatewayError.of(ErrorType.AUTH_ERROR, "Invalid streaming secret"));
                    }
                    case UNKNOWN_STREAM -> sendError(exchange, GatewayError.of(ErrorType.NOT_FOUND,
                            "No open stream for task " + message.getTaskId()));
                }
            } catch (GatewayException e) {
                sendError(exchange, e.getError());
            } catch (Exception e) {
                log.error("Error in streaming relay", e);
                sendError(exchange, GatewayError.of(ErrorType.INTERNAL_ERROR, "Internal server error"));
            }
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, new GatewayError(ErrorType.VALIDATION_ERROR, "Method Not Allowed", 405));
                return;
            }

            Instant now = Instant.now();
            Duration staleness = factory.getRouter().getPolicy().staleness();
            Map<String, ClusterStatusEntry> snapshot = factory.getStatusCache().snapshot();

            List<Map<String, Object>> clusters = new ArrayList<>();
            int fresh = 0;
            for (String name : snapshot.keySet()) {
                ClusterStatusEntry entry = snapshot.get(name);
                boolean isFresh = entry.isFresh(now, staleness);
                if (isFresh) {
                    fresh++;
                }
                Map<String, Object> info = new LinkedHashMap<>();
                info.put("name", name);
                info.put("fresh", isFresh);
                info.put("refreshedAt", entry.refreshedAt());
                info.put("lastError", entry.lastError() != null ? entry.lastError().message() : null);
                clusters.add(info);
            }

            String status;
            if (clusters.isEmpty() || fresh == clusters.size()) {
                status = "UP";
            } else if (fresh == 0) {
                status = "DOWN";
            } else {
                status = "DEGRADED";
            }

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", status);
            health.put("timestamp", System.currentTimeMillis());
            health.put("clusters", clusters);

            Map<String, Object> runtime = new LinkedHashMap<>();
            runtime.put("openStreams", factory.getStreamRelay().openStreams());
            runtime.put("requestLogBufferRemaining", factory.getRequestLogPipeline().getRemainingCapacity());
            health.put("runtime", runtime);

            sendJson(exchange, "DOWN".equals(status) ? 503 : 200, health);
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, new GatewayError(ErrorType.VALIDATION_ERROR, "Method Not Allowed", 405));
                return;
            }

            String metrics = factory.getMetricsRegistry().scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== ADMIN HANDLER ====================

    private class AdminHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();

            try {
                if (path.equals("/admin/ingestion/lag") && "GET".equals(method)) {
                    sendJson(exchange, 200, factory.getIngestionScheduler().primaryWorker().lag());
                } else if (path.equals("/admin/ingestion/backfill") && "POST".equals(method)) {
                    handleBackfill(exchange);
                } else if (path.equals("/admin/batches/poll") && "POST".equals(method)) {
                    int polled = factory.getBatchPoller().pollAll().join();
                    sendJson(exchange, 200, Map.of("polled", polled));
                } else if (path.equals("/admin/reload") && "POST".equals(method)) {
                    handleReloadConfig(exchange);
                } else {
                    sendError(exchange, GatewayError.of(ErrorType.NOT_FOUND, "Not Found"));
                }
            } catch (ConfigLoader.ConfigurationException e) {
                log.warn("Configuration reload rejected: {}", e.getMessage());
                sendError(exchange, GatewayError.of(ErrorType.CONFIG_ERROR, e.getMessage()));
            } catch (GatewayException e) {
                sendError(exchange, e.getError());
            } catch (Exception e) {
                log.error("Error in admin handler", e);
                sendError(exchange, GatewayError.of(ErrorType.INTERNAL_ERROR, "Internal server error"));
            }
        }

        private void handleBackfill(HttpExchange exchange) throws IOException {
            GatewayConfig.MetricsIngestionConfig ingestion = factory.getConfig().getMetricsIngestion();
            MetricsIngestionWorker worker = factory.getIngestionScheduler().primaryWorker();
            try {
                long processed = worker.backfill(ingestion.getBackfillBatchSize(),
                        Duration.ofMillis(ingestion.getBackfillDelayMs()));
                sendJson(exchange, 200, Map.of("processed", processed, "lag", worker.lag()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                sendError(exchange, GatewayError.of(ErrorType.INTERNAL_ERROR, "Backfill interrupted"));
            }
        }

        private void handleReloadConfig(HttpExchange exchange) throws IOException {
            GatewayConfig newConfig = factory.getConfigLoader().reload();
            sendJson(exchange, 200, Map.of(
                    "message", "Configuration reloaded",
                    "clusters", newConfig.getClusters().size(),
                    "endpoints", newConfig.getEndpoints().size(),
                    "federatedEndpoints", newConfig.getFederatedEndpoints().size()
            ));
        }
    }

    // ==================== HELPER METHODS ====================

    private Identity authenticate(HttpExchange exchange) {
        String header = exchange.getRequestHeaders().getFirst("Authorization");
        if (header == null || !header.regionMatches(true, 0, "Bearer ", 0, 7)) {
            throw new GatewayException(ErrorType.AUTH_ERROR, "Missing bearer token");
        }
        String token = header.substring(7).trim();
        Identity identity = factory.getIdentityProvider().introspect(token)
                .orElseThrow(() -> new GatewayException(ErrorType.AUTH_ERROR, "Invalid or expired token"));
        if (!identity.allowed()) {
            throw new GatewayException(ErrorType.AUTH_ERROR, "User " + identity.username() + " is not allowed");
        }
        return identity;
    }

    private static void requireMethod(HttpExchange exchange, String method) {
        if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
            throw new GatewayException(new GatewayError(ErrorType.VALIDATION_ERROR, "Method Not Allowed", 405));
        }
    }

    private Map<String, Object> readBody(HttpExchange exchange) throws IOException {
        try (InputStream is = exchange.getRequestBody()) {
            Map<String, Object> body = objectMapper.readValue(is, BODY_TYPE);
            if (body == null) {
                throw new GatewayException(ErrorType.VALIDATION_ERROR, "Request body is required");
            }
            return body;
        } catch (JsonProcessingException e) {
            throw new GatewayException(ErrorType.VALIDATION_ERROR, "Request body is not valid JSON");
        }
    }

    private <T> T readValue(HttpExchange exchange, Class<T> type) throws IOException {
        try (InputStream is = exchange.getRequestBody()) {
            T value = objectMapper.readValue(is, type);
            if (value == null) {
                throw new GatewayException(ErrorType.VALIDATION_ERROR, "Request body is required");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new GatewayException(ErrorType.VALIDATION_ERROR, "Request body is not valid JSON");
        }
    }

    private static String queryParam(HttpExchange exchange, String name) {
        String query = exchange.getRequestURI().getRawQuery();
        if (query == null) {
            return null;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq >= 0 ? pair.substring(0, eq) : pair;
            if (key.equals(name)) {
                return eq >= 0 ? URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8) : "";
            }
        }
        return null;
    }

    private static RuntimeException unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return e;
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, GatewayError error) throws IOException {
        if (error.code() >= 500) {
            log.warn("Request failed: errorType={}, code={}, message={}", error.type(), error.code(), error.message());
        }
        sendJson(exchange, error.code(), ErrorResponse.from(error));
    }
}
