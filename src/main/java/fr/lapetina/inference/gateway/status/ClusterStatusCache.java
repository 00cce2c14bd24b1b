package fr.lapetina.inference.gateway.status;

import fr.lapetina.inference.gateway.adaptor.ClusterAdaptor;
import fr.lapetina.inference.gateway.adaptor.JobsResult;
import fr.lapetina.inference.gateway.domain.model.ErrorType;
import fr.lapetina.inference.gateway.domain.model.GatewayError;
import fr.lapetina.inference.gateway.domain.model.ModelAvailability;
import fr.lapetina.inference.gateway.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Background cache of cluster job status, read by the router on every request.
 *
 * A refresh queries every cluster adaptor concurrently, then publishes all results in
 * one atomic swap. Readers therefore always see a complete snapshot, never a mix of two
 * refreshes. A failed cluster keeps its previous status and ages towards staleness.
 */
public final class ClusterStatusCache implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ClusterStatusCache.class);

    private final Supplier<Collection<ClusterAdaptor>> adaptors;
    private final MetricsRegistry metrics;
    private final Clock clock;
    private final Duration refreshInterval;
    private final Duration jobsTimeout;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<Map<String, ClusterStatusEntry>> snapshot = new AtomicReference<>(Map.of());

    public ClusterStatusCache(
            Supplier<Collection<ClusterAdaptor>> adaptors,
            MetricsRegistry metrics,
            Clock clock,
            Duration refreshInterval,
            Duration jobsTimeout
    ) {
        this.adaptors = adaptors;
        this.metrics = metrics;
        this.clock = clock;
        this.refreshInterval = refreshInterval;
        this.jobsTimeout = jobsTimeout;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "status-refresher");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts periodic refreshes, the first one immediately.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(this::refreshQuietly, 0, refreshInterval.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Status cache started with interval: {}", refreshInterval);
        }
    }

    private void refreshQuietly() {
        try {
            refresh().get(jobsTimeout.toMillis() + 1000, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("Status refresh cycle failed", e);
        }
    }

    /**
     * Queries every cluster once and publishes the combined result.
     */
    public CompletableFuture<Map<String, ClusterStatusEntry>> refresh() {
        List<ClusterAdaptor> current = new ArrayList<>(adaptors.get());
        List<CompletableFuture<JobsResult>> calls = new ArrayList<>(current.size());
        for (ClusterAdaptor adaptor : current) {
            calls.add(adaptor.getJobs()
                    .orTimeout(jobsTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .exceptionally(ex -> new JobsResult.Failure(GatewayError.of(ErrorType.ADAPTOR_TIMEOUT,
                            "get_jobs timed out after " + jobsTimeout.toMillis() + "ms"))));
        }
        return CompletableFuture.allOf(calls.toArray(new CompletableFuture[0])).thenApply(ignored -> {
            Instant now = clock.instant();
            Map<String, ClusterStatusEntry> previous = snapshot.get();
            Map<String, ClusterStatusEntry> next = new HashMap<>();
            for (int i = 0; i < current.size(); i++) {
                String cluster = current.get(i).cluster().name();
                JobsResult result = calls.get(i).join();
                if (result instanceof JobsResult.Jobs jobs) {
                    next.put(cluster, new ClusterStatusEntry(jobs.status(), now, null));
                    metrics.incrementStatusRefresh(cluster, true);
                } else if (result instanceof JobsResult.Failure failure) {
                    ClusterStatusEntry old = previous.get(cluster);
                    next.put(cluster, new ClusterStatusEntry(
                            old != null ? old.status() : null,
                            old != null ? old.refreshedAt() : null,
                            failure.error()));
                    metrics.incrementStatusRefresh(cluster, false);
                    log.warn("Cluster status refresh failed: cluster={}, error={}", cluster, failure.error().message());
                }
            }
            Map<String, ClusterStatusEntry> published = Map.copyOf(next);
            snapshot.set(published);
            log.debug("Cluster status refreshed: clusters={}", published.size());
            return published;
        });
    }

    /**
     * Availability of a model, or {@link ModelAvailability#UNKNOWN} when the cluster
     * status is missing or older than {@code stalenessBound}.
     */
    public ModelAvailability availability(String cluster, String framework, String model, Duration stalenessBound) {
        ClusterStatusEntry entry = snapshot.get().get(cluster);
        if (entry == null || !entry.isFresh(clock.instant(), stalenessBound)) {
            return ModelAvailability.UNKNOWN;
        }
        return entry.status().availabilityOf(framework, model);
    }

    public Optional<ClusterStatusEntry> get(String cluster) {
        return Optional.ofNullable(snapshot.get().get(cluster));
    }

    public Map<String, ClusterStatusEntry> snapshot() {
        return snapshot.get();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Status cache stopped");
        } else {
            scheduler.shutdownNow();
        }
    }
}
