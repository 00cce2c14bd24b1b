package fr.lapetina.inference.gateway.routing;

import fr.lapetina.inference.gateway.adaptor.AdaptorErrors;
import fr.lapetina.inference.gateway.adaptor.EndpointAdaptor;
import fr.lapetina.inference.gateway.adaptor.StreamResult;
import fr.lapetina.inference.gateway.adaptor.TaskResult;
import fr.lapetina.inference.gateway.domain.model.ApiRoute;
import fr.lapetina.inference.gateway.domain.model.Cluster;
import fr.lapetina.inference.gateway.domain.model.Endpoint;
import fr.lapetina.inference.gateway.domain.model.ErrorType;
import fr.lapetina.inference.gateway.domain.model.FederatedEndpoint;
import fr.lapetina.inference.gateway.domain.model.GatewayError;
import fr.lapetina.inference.gateway.domain.model.GatewayException;
import fr.lapetina.inference.gateway.domain.model.Identity;
import fr.lapetina.inference.gateway.domain.model.InferenceRequest;
import fr.lapetina.inference.gateway.domain.model.ModelAvailability;
import fr.lapetina.inference.gateway.domain.model.Target;
import fr.lapetina.inference.gateway.domain.model.TargetFailure;
import fr.lapetina.inference.gateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.gateway.status.ClusterStatusCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Picks targets for a request and fails over between them.
 *
 * Candidate selection:
 * <ol>
 *   <li>A pinned request has exactly one candidate, the endpoint named by its path.</li>
 *   <li>A federated request starts from the targets of the federated endpoint serving the
 *       requested model, drops the ones the caller may not use or whose cluster is under
 *       maintenance, and keeps the live ones. With no live target it may fall back to
 *       queued, then unknown, then stopped targets.</li>
 *   <li>Targets cooling down after a recent failure are moved to the end.</li>
 * </ol>
 *
 * Each attempt is bounded by the adaptor timeout. A failure caused by the request itself
 * is returned at once; any other failure moves on to the next candidate.
 */
public final class FederatedRouter {

    private static final Logger log = LoggerFactory.getLogger(FederatedRouter.class);

    private final EndpointCatalog catalog;
    private final ClusterStatusCache statusCache;
    private final TargetHealthTracker healthTracker;
    private final MetricsRegistry metrics;
    private volatile RoutingPolicy policy;

    public FederatedRouter(
            EndpointCatalog catalog,
            ClusterStatusCache statusCache,
            TargetHealthTracker healthTracker,
            MetricsRegistry metrics,
            RoutingPolicy policy
    ) {
        this.catalog = catalog;
        this.statusCache = statusCache;
        this.healthTracker = healthTracker;
        this.metrics = metrics;
        this.policy = policy;
    }

    /**
     * Routes a non-streaming request. The returned future never completes exceptionally.
     *
     * @param pin pinned cluster and framework, or null for a federated request
     */
    public CompletableFuture<RouteResult<TaskResult.Success>> route(
            InferenceRequest request, Identity identity, PinnedTarget pin) {
        return dispatch(request, identity, pin, (adaptor, rewritten) -> adaptor.submitTask(rewritten)
                .thenApply(result -> {
                    if (result instanceof TaskResult.Success success) {
                        return Attempt.ok(success);
                    }
                    return Attempt.<TaskResult.Success>failed(((TaskResult.Failure) result).error());
                }), ignored -> {
        });
    }

    /**
     * Opens a stream on the first target that accepts it. A target that fails to open
     * counts as a failed attempt, like a failed synchronous call.
     */
    public CompletableFuture<RouteResult<StreamResult.Opened>> openStream(
            InferenceRequest request, Identity identity, PinnedTarget pin, String requestLogId) {
        return dispatch(request, identity, pin, (adaptor, rewritten) -> adaptor
                .submitStreamingTask(rewritten, requestLogId)
                .thenApply(result -> {
                    if (result instanceof StreamResult.Opened opened) {
                        return Attempt.ok(opened);
                    }
                    return Attempt.<StreamResult.Opened>failed(((StreamResult.Failure) result).error());
                }), late -> late.handle().cancel());
    }

    private <T> CompletableFuture<RouteResult<T>> dispatch(
            InferenceRequest request, Identity identity, PinnedTarget pin, Call<T> call, Consumer<T> discard) {
        List<Endpoint> candidates;
        try {
            candidates = candidates(request, identity, pin);
        } catch (GatewayException e) {
            log.info("No candidate: requestId={}, model={}, errorType={}, message={}",
                    request.requestId(), request.model(), e.getError().type(), e.getMessage());
            return CompletableFuture.completedFuture(new RouteResult.Failed<>(e.getError(), null));
        }
        RoutingPolicy current = policy;
        Attempts<T> attempts = new Attempts<>(request, candidates, current.attemptLimit(candidates.size()),
                pin != null, current, call, discard);
        return attempts.next(0);
    }

    /**
     * Ordered targets for a request.
     *
     * @throws GatewayException when no target qualifies
     */
    public List<Endpoint> candidates(InferenceRequest request, Identity identity, PinnedTarget pin) {
        if (pin != null) {
            Endpoint endpoint = resolvePinned(request.model(), identity, pin);
            requireRoute(endpoint, request.route());
            return List.of(endpoint);
        }
        RoutingPolicy current = policy;
        FederatedEndpoint federated = resolveFederated(request.model());
        List<Endpoint> usable = new ArrayList<>();
        for (Endpoint endpoint : accessibleTargets(federated, identity)) {
            Cluster cluster = catalog.cluster(endpoint.cluster()).orElse(null);
            if (cluster == null || cluster.isUnderMaintenance()) {
                log.debug("Target skipped for maintenance: target={}", endpoint.targetKey());
                continue;
            }
            if (!cluster.supports(request.route())) {
                continue;
            }
            usable.add(endpoint);
        }
        if (usable.isEmpty()) {
            throw new GatewayException(ErrorType.UNAVAILABLE,
                    "No available target for model " + request.model() + ": clusters under maintenance or not exposing "
                            + request.route().path());
        }

        Map<Endpoint, ModelAvailability> availability = new HashMap<>();
        for (Endpoint endpoint : usable) {
            availability.put(endpoint, statusCache.availability(
                    endpoint.cluster(), endpoint.framework(), endpoint.model(), current.staleness()));
        }
        List<Endpoint> live = usable.stream()
                .filter(e -> availability.get(e) == ModelAvailability.LIVE)
                .toList();
        List<Endpoint> selected;
        if (!live.isEmpty()) {
            selected = live;
        } else if (current.fallbackToNonLive()) {
            selected = new ArrayList<>(usable);
            selected.sort(Comparator.comparing(availability::get));
            log.info("No live target, falling back: requestId={}, model={}, candidates={}",
                    request.requestId(), request.model(), selected.size());
        } else {
            throw new GatewayException(ErrorType.UNAVAILABLE, "No live target for model " + request.model());
        }
        return healthTracker.order(selected, Endpoint::targetKey);
    }

    /**
     * Endpoint a batch for {@code model} goes to: the pinned endpoint, or the first
     * accessible batch-enabled target of the federated endpoint.
     *
     * @throws GatewayException when no endpoint can take the batch
     */
    public Endpoint resolveBatchEndpoint(String model, Identity identity, PinnedTarget pin) {
        if (pin != null) {
            return resolvePinned(model, identity, pin);
        }
        FederatedEndpoint federated = resolveFederated(model);
        for (Endpoint endpoint : accessibleTargets(federated, identity)) {
            boolean maintenance = catalog.cluster(endpoint.cluster()).map(Cluster::isUnderMaintenance).orElse(true);
            boolean batchEnabled = catalog.endpointAdaptor(endpoint.slug())
                    .map(EndpointAdaptor::hasBatchEnabled)
                    .orElse(false);
            if (!maintenance && batchEnabled) {
                return endpoint;
            }
        }
        throw new GatewayException(ErrorType.NOT_SUPPORTED, "Batch processing is not available for model " + model);
    }

    private Endpoint resolvePinned(String model, Identity identity, PinnedTarget pin) {
        Endpoint endpoint = catalog.endpoints().stream()
                .filter(e -> e.cluster().equals(pin.cluster())
                        && e.framework().equalsIgnoreCase(pin.framework())
                        && e.model().equals(model))
                .findFirst()
                .orElseThrow(() -> new GatewayException(ErrorType.NOT_FOUND,
                        "Endpoint " + Endpoint.slugOf(pin.cluster(), pin.framework(), model) + " not found"));
        Cluster cluster = catalog.cluster(endpoint.cluster()).orElseThrow(() ->
                new GatewayException(ErrorType.NOT_FOUND, "Cluster " + pin.cluster() + " not found"));
        if (!AccessPolicy.canAccess(identity, cluster, endpoint)) {
            throw new GatewayException(ErrorType.FORBIDDEN,
                    "User not authorized to access endpoint " + endpoint.slug());
        }
        if (cluster.isUnderMaintenance()) {
            throw new GatewayException(ErrorType.UNAVAILABLE,
                    "Cluster " + cluster.name() + " is under maintenance: " + cluster.maintenanceNotice());
        }
        return endpoint;
    }

    private void requireRoute(Endpoint endpoint, ApiRoute route) {
        boolean supported = catalog.cluster(endpoint.cluster()).map(c -> c.supports(route)).orElse(false);
        if (!supported) {
            throw new GatewayException(ErrorType.NOT_SUPPORTED,
                    "Cluster " + endpoint.cluster() + " does not expose " + route.path());
        }
    }

    private FederatedEndpoint resolveFederated(String model) {
        FederatedEndpoint federated = catalog.federatedByModel(model).orElseThrow(() ->
                new GatewayException(ErrorType.NOT_FOUND, "Model " + model + " not found"));
        if (federated.targets().isEmpty()) {
            throw new GatewayException(ErrorType.CONFIG_ERROR,
                    "Federated endpoint " + federated.slug() + " has no targets");
        }
        return federated;
    }

    private List<Endpoint> accessibleTargets(FederatedEndpoint federated, Identity identity) {
        List<Endpoint> accessible = new ArrayList<>();
        for (Target target : federated.targets()) {
            Optional<Endpoint> endpoint = catalog.endpoint(target.endpointSlug());
            if (endpoint.isEmpty()) {
                log.warn("Federated target has no endpoint: federated={}, target={}", federated.slug(), target.key());
                continue;
            }
            Cluster cluster = catalog.cluster(target.cluster()).orElse(null);
            if (AccessPolicy.canAccess(identity, cluster, endpoint.get())) {
                accessible.add(endpoint.get());
            }
        }
        if (accessible.isEmpty()) {
            throw new GatewayException(ErrorType.AUTH_ERROR, "User not authorized to access any target");
        }
        return accessible;
    }

    public void updatePolicy(RoutingPolicy policy) {
        this.policy = policy;
        log.info("Routing policy updated: {}", policy);
    }

    public RoutingPolicy getPolicy() {
        return policy;
    }

    @FunctionalInterface
    private interface Call<T> {
        CompletableFuture<Attempt<T>> call(EndpointAdaptor adaptor, InferenceRequest request);
    }

    private record Attempt<T>(T value, GatewayError error) {
        static <T> Attempt<T> ok(T value) {
            return new Attempt<>(value, null);
        }

        static <T> Attempt<T> failed(GatewayError error) {
            return new Attempt<>(null, error);
        }
    }

    /**
     * State of one request walking its candidate list.
     */
    private final class Attempts<T> {
        private final InferenceRequest request;
        private final List<Endpoint> candidates;
        private final int limit;
        private final boolean pinned;
        private final RoutingPolicy policy;
        private final Call<T> call;
        private final Consumer<T> discard;
        private final List<TargetFailure> failures = new ArrayList<>();
        private GatewayError lastError;

        Attempts(InferenceRequest request, List<Endpoint> candidates, int limit, boolean pinned,
                 RoutingPolicy policy, Call<T> call, Consumer<T> discard) {
            this.request = request;
            this.candidates = candidates;
            this.limit = limit;
            this.pinned = pinned;
            this.policy = policy;
            this.call = call;
            this.discard = discard;
        }

        CompletableFuture<RouteResult<T>> next(int index) {
            if (index >= limit) {
                return CompletableFuture.completedFuture(exhausted());
            }
            Endpoint endpoint = candidates.get(index);
            String target = endpoint.targetKey();
            Optional<EndpointAdaptor> adaptor = catalog.endpointAdaptor(endpoint.slug());
            if (adaptor.isEmpty()) {
                return onFailure(index, endpoint, GatewayError.of(ErrorType.CONFIG_ERROR,
                        "No adaptor for endpoint " + endpoint.slug()));
            }

            log.debug("Attempting target: requestId={}, target={}, attempt={}/{}",
                    request.requestId(), target, index + 1, limit);
            CompletableFuture<Attempt<T>> raw;
            try {
                raw = call.call(adaptor.get(), request.withModel(endpoint.model()));
            } catch (RuntimeException e) {
                raw = CompletableFuture.failedFuture(e);
            }
            CompletableFuture<Attempt<T>> source = raw;
            return raw.copy()
                    .orTimeout(policy.adaptorTimeout().toMillis(), TimeUnit.MILLISECONDS)
                    .handle((attempt, ex) -> {
                        if (ex != null) {
                            if (AdaptorErrors.unwrap(ex) instanceof TimeoutException) {
                                source.thenAccept(late -> {
                                    if (late.value() != null) {
                                        discard.accept(late.value());
                                    }
                                });
                                return Attempt.<T>failed(GatewayError.of(ErrorType.ADAPTOR_TIMEOUT,
                                        "Target " + target + " did not answer within "
                                                + policy.adaptorTimeout().toMillis() + "ms"));
                            }
                            return Attempt.<T>failed(AdaptorErrors.classify(ex, target));
                        }
                        return attempt;
                    })
                    .thenCompose(attempt -> {
                        if (attempt.error() == null) {
                            healthTracker.recordSuccess(target);
                            log.debug("Request routed: requestId={}, target={}, failovers={}",
                                    request.requestId(), target, index);
                            return CompletableFuture.completedFuture(
                                    new RouteResult.Served<>(endpoint, attempt.value(), index));
                        }
                        return onFailure(index, endpoint, attempt.error());
                    });
        }

        private CompletableFuture<RouteResult<T>> onFailure(int index, Endpoint endpoint, GatewayError error) {
            String target = endpoint.targetKey();
            lastError = error;
            if (error.isClientFault()) {
                log.info("Request rejected by target: requestId={}, target={}, code={}, message={}",
                        request.requestId(), target, error.code(), error.message());
                return CompletableFuture.completedFuture(new RouteResult.Failed<>(error, endpoint));
            }
            log.warn("Request failed: requestId={}, target={}, errorType={}, message={}",
                    request.requestId(), target, error.type(), error.message());
            healthTracker.recordFailure(target);
            metrics.incrementTargetFailure(target, error.type());
            failures.add(TargetFailure.of(target, error));
            if (index + 1 < limit) {
                metrics.incrementFailover(request.model());
                return next(index + 1);
            }
            return CompletableFuture.completedFuture(exhausted());
        }

        private RouteResult<T> exhausted() {
            Endpoint last = failures.isEmpty() ? null : candidates.get(failures.size() - 1);
            if (pinned && lastError != null) {
                return new RouteResult.Failed<>(lastError, last);
            }
            log.warn("All targets failed: requestId={}, model={}, attempts={}",
                    request.requestId(), request.model(), failures.size());
            return new RouteResult.Failed<>(GatewayError.routing(request.model(), failures), last);
        }
    }
}
