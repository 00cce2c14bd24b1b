package fr.lapetina.inference.gateway.adaptor.http;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.inference.gateway.adaptor.AdaptorContext;
import fr.lapetina.inference.gateway.adaptor.AdaptorErrors;
import fr.lapetina.inference.gateway.adaptor.AdaptorSettings;
import fr.lapetina.inference.gateway.adaptor.EndpointAdaptor;
import fr.lapetina.inference.gateway.adaptor.EndpointStatus;
import fr.lapetina.inference.gateway.adaptor.StreamResult;
import fr.lapetina.inference.gateway.adaptor.TaskResult;
import fr.lapetina.inference.gateway.domain.model.Endpoint;
import fr.lapetina.inference.gateway.domain.model.ErrorType;
import fr.lapetina.inference.gateway.domain.model.GatewayError;
import fr.lapetina.inference.gateway.domain.model.InferenceRequest;
import fr.lapetina.inference.gateway.streaming.QueueStreamHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Endpoint reached over an OpenAI-compatible HTTP API that is already running.
 * A status page tells which deployment serves the model and whether it is live.
 *
 * <p>Settings:
 * <ul>
 *   <li>{@code status-url} - status page listing the deployments (required)</li>
 *   <li>{@code base-url} - API base, overrides the deployment url from the status page</li>
 *   <li>{@code api-key-env} - environment variable holding the bearer key</li>
 *   <li>{@code status-ttl-ms} - how long a fetched status page is reused, default 60000</li>
 * </ul>
 */
public class DirectApiEndpointAdaptor implements EndpointAdaptor {

    private static final Logger log = LoggerFactory.getLogger(DirectApiEndpointAdaptor.class);

    private static final String DATA_PREFIX = "data: ";
    private static final String DONE_MARKER = "[DONE]";

    private final Endpoint endpoint;
    private final AdaptorContext context;
    private final OpenAiHttpClient client;
    private final URI statusUrl;
    private final String baseUrl;
    private final String apiKey;
    private final Duration statusTtl;

    private final AtomicReference<CachedStatus> cachedStatus = new AtomicReference<>();

    private record CachedStatus(List<ModelStatusEntry> entries, Instant fetchedAt) {
    }

    public DirectApiEndpointAdaptor(Endpoint endpoint, AdaptorContext context) {
        this.endpoint = endpoint;
        this.context = context;
        this.client = context.httpClient();
        AdaptorSettings settings = new AdaptorSettings("endpoint " + endpoint.slug(), endpoint.config());
        this.statusUrl = URI.create(settings.require("status-url"));
        this.baseUrl = settings.optional("base-url", null);
        this.apiKey = settings.secretFromEnv("api-key-env");
        this.statusTtl = Duration.ofMillis(settings.longValue("status-ttl-ms", 60000));
    }

    @Override
    public Endpoint endpoint() {
        return endpoint;
    }

    @Override
    public CompletableFuture<TaskResult> submitTask(InferenceRequest request) {
        return resolveDeployment()
                .thenCompose(deployment -> client.post(endpoint.slug(), apiUri(deployment, request), apiKey,
                        request.backendPayload(false), request.requestId()))
                .exceptionally(ex -> TaskResult.failure(toError(ex)));
    }

    @Override
    public CompletableFuture<StreamResult> submitStreamingTask(InferenceRequest request, String requestLogId) {
        return resolveDeployment()
                .thenCompose(deployment -> client.openStream(apiUri(deployment, request), apiKey,
                        request.backendPayload(true), request.requestId()))
                .thenApply(response -> StreamResult.opened(pump(requestLogId, response), null))
                .exceptionally(ex -> StreamResult.failure(toError(ex)));
    }

    @Override
    public CompletableFuture<EndpointStatus> endpointStatus() {
        return resolveDeployment()
                .thenApply(deployment -> new EndpointStatus(true, deployment.status()))
                .exceptionally(ex -> EndpointStatus.offline(toError(ex).message()));
    }

    /**
     * Starts copying the SSE body into a handle on the stream executor. Cancelling the
     * handle closes the body, which releases the backend connection.
     */
    private QueueStreamHandle pump(String streamId, HttpResponse<Stream<String>> response) {
        QueueStreamHandle handle = new QueueStreamHandle(streamId);
        Stream<String> lines = response.body();
        handle.onCancel(lines::close);
        context.streamExecutor().execute(() -> {
            try (lines) {
                Iterator<String> iterator = lines.iterator();
                while (iterator.hasNext() && !handle.isCancelled()) {
                    String line = iterator.next();
                    if (!line.startsWith(DATA_PREFIX)) {
                        continue;
                    }
                    if (DONE_MARKER.equals(line.substring(DATA_PREFIX.length()).trim())) {
                        break;
                    }
                    handle.emit(line);
                }
                handle.complete();
            } catch (RuntimeException e) {
                if (!handle.isCancelled()) {
                    GatewayError error = AdaptorErrors.classify(e.getCause() != null ? e.getCause() : e, endpoint.slug());
                    log.warn("Stream broke: endpoint={}, streamId={}, error={}", endpoint.slug(), streamId, error.message());
                    handle.fail(error);
                }
            }
        });
        return handle;
    }

    private URI apiUri(ModelStatusEntry deployment, InferenceRequest request) {
        String base = baseUrl != null ? baseUrl : deployment.url();
        if (base == null) {
            throw new DeploymentException(GatewayError.of(ErrorType.CONFIG_ERROR,
                    "No API url known for " + endpoint.model() + " on " + endpoint.cluster()));
        }
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + "/" + request.route().path());
    }

    private CompletableFuture<ModelStatusEntry> resolveDeployment() {
        return statusEntries().thenApply(entries -> {
            ModelStatusEntry entry = ModelStatusEntry.find(entries, endpoint.model()).orElseThrow(() -> {
                String available = entries.stream()
                        .filter(ModelStatusEntry::isLive)
                        .flatMap(e -> e.experts().stream())
                        .collect(Collectors.joining(", "));
                String message = available.isEmpty()
                        ? "No live models currently available on " + endpoint.cluster()
                        : "Model '" + endpoint.model() + "' not available on " + endpoint.cluster()
                                + ". Available models: " + available;
                return new DeploymentException(GatewayError.of(ErrorType.NOT_FOUND, message));
            });
            if (!entry.isLive()) {
                throw new DeploymentException(GatewayError.of(ErrorType.UNAVAILABLE, "'" + endpoint.model()
                        + "' is not currently live on " + endpoint.cluster() + ". Status: " + entry.status()));
            }
            return entry;
        });
    }

    private CompletableFuture<List<ModelStatusEntry>> statusEntries() {
        CachedStatus cached = cachedStatus.get();
        Instant now = context.clock().instant();
        if (cached != null && now.isBefore(cached.fetchedAt().plus(statusTtl))) {
            return CompletableFuture.completedFuture(cached.entries());
        }
        return client.getJson(statusUrl, apiKey, Duration.ofSeconds(10))
                .thenApply((JsonNode document) -> {
                    List<ModelStatusEntry> entries = ModelStatusEntry.parse(document);
                    cachedStatus.set(new CachedStatus(entries, now));
                    return entries;
                });
    }

    private GatewayError toError(Throwable ex) {
        Throwable cause = AdaptorErrors.unwrap(ex);
        if (cause instanceof DeploymentException deployment) {
            return deployment.error;
        }
        return AdaptorErrors.classify(cause, endpoint.slug());
    }

    /**
     * Carries a resolved error through the future chain.
     */
    private static final class DeploymentException extends RuntimeException {
        private final GatewayError error;

        DeploymentException(GatewayError error) {
            super(error.message(), null, false, false);
            this.error = error;
        }
    }
}
