package fr.lapetina.inference.gateway.infrastructure.metrics;

import fr.lapetina.inference.gateway.domain.model.BatchStatus;
import fr.lapetina.inference.gateway.domain.model.ErrorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Request counters and latency per route, target and outcome
 * - Failover and error counters
 * - Batch, streaming and ingestion counters
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("inference_gateway");
    }

    /**
     * Counts a finished client request.
     */
    public void recordRequest(String route, String target, int statusCode, boolean streaming, Duration latency) {
        String outcome = statusCode >= 200 && statusCode < 300 ? "success" : "error";
        counter("requests_total", "Client requests by route, target and outcome",
                "route", route, "target", target, "outcome", outcome, "streaming", Boolean.toString(streaming))
                .increment();
        timers.computeIfAbsent("latency:" + route + ":" + target, k ->
                Timer.builder(prefix + "_request_latency")
                        .description("End-to-end request latency")
                        .tag("route", route)
                        .tag("target", target)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Counts one failed attempt against a target.
     */
    public void incrementTargetFailure(String target, ErrorType errorType) {
        counter("target_failures_total", "Failed attempts per target and error type",
                "target", target, "type", errorType.name()).increment();
    }

    public void incrementFailover(String model) {
        counter("failovers_total", "Attempts moved to another target", "model", model).increment();
    }

    public void incrementStreamOutcome(String state) {
        counter("streams_total", "Streams by terminal state", "state", state).increment();
    }

    public void incrementBatchTransition(BatchStatus status) {
        counter("batch_transitions_total", "Batch status transitions", "status", status.wireValue()).increment();
    }

    public void incrementIngested(int rows) {
        counter("ingestion_rows_total", "Request logs turned into metrics rows").increment(rows);
    }

    public void incrementIngestionSkipped(int rows) {
        counter("ingestion_skipped_total", "Request logs marked processed without metrics").increment(rows);
    }

    public void incrementIngestionFailure() {
        counter("ingestion_failures_total", "Ingestion batches that failed and were released").increment();
    }

    public void incrementRequestLogWrites(String path) {
        counter("request_log_writes_total", "Request log writes by path", "path", path).increment();
    }

    public void incrementStatusRefresh(String cluster, boolean success) {
        counter("status_refresh_total", "Cluster status refreshes", "cluster", cluster,
                "outcome", success ? "success" : "error").increment();
    }

    public void registerRingBufferRemaining(Supplier<Number> remaining) {
        gauge("ringbuffer_remaining", "Remaining capacity in the request log ring buffer", remaining);
    }

    public void registerOpenStreams(Supplier<Number> openStreams) {
        gauge("relay_open_streams", "Relay streams waiting for chunks", openStreams);
    }

    public void registerActiveBatches(Supplier<Number> activeBatches) {
        gauge("active_batches", "Batches not yet in a terminal state", activeBatches);
    }

    public void registerIngestionBacklog(Supplier<Number> backlog) {
        gauge("ingestion_backlog", "Request logs waiting for metrics ingestion", backlog);
    }

    private void gauge(String name, String description, Supplier<Number> value) {
        Gauge.builder(prefix + "_" + name, value, s -> s.get().doubleValue())
                .description(description)
                .strongReference(true)
                .register(registry);
    }

    private Counter counter(String name, String description, String... tags) {
        String key = name + ":" + String.join(":", tags);
        return counters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_" + name)
                        .description(description)
                        .tags(tags)
                        .register(registry)
        );
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
