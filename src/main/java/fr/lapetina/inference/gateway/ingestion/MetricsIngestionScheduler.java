package fr.lapetina.inference.gateway.ingestion;

import fr.lapetina.inference.gateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.gateway.store.RequestLogStore;
import fr.lapetina.inference.gateway.store.RequestMetricsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a fixed number of ingestion workers on a schedule.
 * Workers claim disjoint rows, so they never wait on each other.
 */
public final class MetricsIngestionScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsIngestionScheduler.class);

    private final List<MetricsIngestionWorker> workers = new ArrayList<>();
    private final int batchSize;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public MetricsIngestionScheduler(
            RequestLogStore logStore,
            RequestMetricsStore metricsStore,
            MetricsRegistry metrics,
            int workerCount,
            int batchSize,
            Duration interval
    ) {
        for (int i = 0; i < Math.max(1, workerCount); i++) {
            workers.add(new MetricsIngestionWorker("ingestion-" + i, logStore, metricsStore, metrics));
        }
        this.batchSize = batchSize;
        this.interval = interval;
        AtomicInteger threadIndex = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(Math.max(1, workerCount), r -> {
            Thread t = new Thread(r, "metrics-ingestion-" + threadIndex.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        metrics.registerIngestionBacklog(logStore::countUnprocessed);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            for (MetricsIngestionWorker worker : workers) {
                scheduler.scheduleWithFixedDelay(() -> runQuietly(worker),
                        interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
            }
            log.info("Metrics ingestion started: workers={}, batchSize={}, interval={}",
                    workers.size(), batchSize, interval);
        }
    }

    private void runQuietly(MetricsIngestionWorker worker) {
        try {
            int processed;
            do {
                processed = worker.processBatch(batchSize);
            } while (processed == batchSize && running.get());
        } catch (Exception e) {
            log.error("Ingestion worker failed: workerId={}", worker.getWorkerId(), e);
        }
    }

    /**
     * Worker used for admin operations (lag, backfill).
     */
    public MetricsIngestionWorker primaryWorker() {
        return workers.get(0);
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
            log.info("Metrics ingestion stopped");
        } else {
            scheduler.shutdownNow();
        }
    }
}
