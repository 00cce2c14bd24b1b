package fr.lapetina.inference.gateway.ingestion;

import fr.lapetina.inference.gateway.domain.model.RequestLog;
import fr.lapetina.inference.gateway.domain.model.RequestMetrics;
import fr.lapetina.inference.gateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.gateway.store.RequestLogStore;
import fr.lapetina.inference.gateway.store.RequestMetricsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Turns request logs into request metrics.
 *
 * A batch is claimed, derived, upserted and only then marked processed. A row whose
 * derivation fails is marked processed without metrics so it cannot hold back the rest
 * of its batch. If the upsert fails the claims are released and the rows stay
 * unprocessed for a later pass. Derivation is pure and the upsert is keyed by request
 * id, so a row processed twice yields the same metrics.
 */
public final class MetricsIngestionWorker {

    private static final Logger log = LoggerFactory.getLogger(MetricsIngestionWorker.class);

    private final String workerId;
    private final RequestLogStore logStore;
    private final RequestMetricsStore metricsStore;
    private final MetricsRegistry metrics;
    private final Function<RequestLog, RequestMetrics> derivation;

    public MetricsIngestionWorker(
            String workerId,
            RequestLogStore logStore,
            RequestMetricsStore metricsStore,
            MetricsRegistry metrics
    ) {
        this(workerId, logStore, metricsStore, metrics, RequestMetrics::from);
    }

    MetricsIngestionWorker(
            String workerId,
            RequestLogStore logStore,
            RequestMetricsStore metricsStore,
            MetricsRegistry metrics,
            Function<RequestLog, RequestMetrics> derivation
    ) {
        this.workerId = workerId;
        this.logStore = logStore;
        this.metricsStore = metricsStore;
        this.metrics = metrics;
        this.derivation = derivation;
    }

    /**
     * Processes at most {@code batchSize} rows.
     *
     * @return number of rows processed, 0 when nothing was pending or the batch failed
     */
    public int processBatch(int batchSize) {
        List<RequestLog> claimed = logStore.claimUnprocessed(batchSize, workerId);
        if (claimed.isEmpty()) {
            return 0;
        }
        List<String> ids = claimed.stream().map(RequestLog::id).toList();
        try {
            List<RequestMetrics> derived = new ArrayList<>(claimed.size());
            int skipped = 0;
            for (RequestLog row : claimed) {
                try {
                    derived.add(derivation.apply(row));
                } catch (RuntimeException e) {
                    skipped++;
                    log.warn("Request log skipped, metrics cannot be derived: workerId={}, requestId={}, error={}",
                            workerId, row.id(), e.getMessage());
                }
            }
            metricsStore.upsertAll(derived);
            logStore.markProcessed(ids, workerId);
            metrics.incrementIngested(derived.size());
            if (skipped > 0) {
                metrics.incrementIngestionSkipped(skipped);
            }
            log.debug("Metrics batch ingested: workerId={}, rows={}, skipped={}", workerId, derived.size(), skipped);
            return ids.size();
        } catch (RuntimeException e) {
            logStore.releaseClaims(ids, workerId);
            metrics.incrementIngestionFailure();
            log.error("Metrics batch failed, claims released: workerId={}, rows={}, error={}",
                    workerId, ids.size(), e.getMessage());
            return 0;
        }
    }

    /**
     * Flags historical rows for ingestion and drains them in bounded batches.
     *
     * @return total rows processed
     */
    public long backfill(int batchSize, Duration delay) throws InterruptedException {
        long total = 0;
        int flagged;
        do {
            flagged = logStore.flagLegacyRows(batchSize);
            int processed;
            do {
                processed = processBatch(batchSize);
                total += processed;
                if (processed > 0 && !delay.isZero()) {
                    Thread.sleep(delay.toMillis());
                }
            } while (processed == batchSize);
        } while (flagged == batchSize);
        log.info("Metrics backfill finished: workerId={}, processed={}", workerId, total);
        return total;
    }

    /**
     * Current ingestion backlog.
     */
    public MetricsLag lag() {
        long unprocessed = logStore.countUnprocessed();
        long processed = logStore.countProcessed();
        long tracked = unprocessed + processed;
        double percentage = tracked == 0 ? 100.0 : processed * 100.0 / tracked;
        return new MetricsLag(
                unprocessed,
                processed,
                percentage,
                logStore.oldestUnprocessed().orElse(null),
                logStore.newestUnprocessed().orElse(null)
        );
    }

    public String getWorkerId() {
        return workerId;
    }
}
