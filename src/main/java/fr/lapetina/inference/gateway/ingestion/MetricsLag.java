package fr.lapetina.inference.gateway.ingestion;

import java.time.Instant;

/**
 * How far metrics ingestion is behind the request log.
 */
public record MetricsLag(
        long unprocessedCount,
        long processedCount,
        double processedPercentage,
        Instant oldestUnprocessed,
        Instant newestUnprocessed
) {
}
