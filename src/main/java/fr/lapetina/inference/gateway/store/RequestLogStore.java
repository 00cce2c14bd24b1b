package fr.lapetina.inference.gateway.store;

import fr.lapetina.inference.gateway.domain.model.RequestLog;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for request logs, including the claim protocol used by metrics ingestion.
 *
 * <p>A claim reserves unprocessed rows for one worker. Two workers never hold a claim on
 * the same row; claims are dropped by {@link #markProcessed} or {@link #releaseClaims}.
 */
public interface RequestLogStore {

    void save(RequestLog log);

    Optional<RequestLog> findById(String id);

    /**
     * Claims up to {@code limit} rows flagged {@code metricsProcessed = false} that no other
     * worker holds, oldest first.
     */
    List<RequestLog> claimUnprocessed(int limit, String workerId);

    /**
     * Flags the rows processed and drops their claims.
     */
    void markProcessed(Collection<String> ids, String workerId);

    /**
     * Drops claims without touching the rows, so another pass can pick them up.
     */
    void releaseClaims(Collection<String> ids, String workerId);

    /**
     * Flags up to {@code limit} eligible rows whose flag is {@code null} as unprocessed.
     *
     * @return number of rows flagged
     */
    int flagLegacyRows(int limit);

    long countUnprocessed();

    Optional<Instant> oldestUnprocessed();

    Optional<Instant> newestUnprocessed();

    long countProcessed();

    long count();
}
