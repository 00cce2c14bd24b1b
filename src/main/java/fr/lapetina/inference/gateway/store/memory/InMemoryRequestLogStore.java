package fr.lapetina.inference.gateway.store.memory;

import fr.lapetina.inference.gateway.domain.model.RequestLog;
import fr.lapetina.inference.gateway.store.RequestLogStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Request log store held in memory. Claims live in a separate map so that
 * {@code putIfAbsent} decides which worker wins a row.
 */
public final class InMemoryRequestLogStore implements RequestLogStore {

    private static final Comparator<RequestLog> OLDEST_FIRST = Comparator
            .comparing(RequestLog::backendResponseAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(RequestLog::receivedAt)
            .thenComparing(RequestLog::id);

    private final Map<String, RequestLog> logs = new ConcurrentHashMap<>();
    private final Map<String, String> claims = new ConcurrentHashMap<>();

    @Override
    public void save(RequestLog log) {
        logs.put(log.id(), log);
    }

    @Override
    public Optional<RequestLog> findById(String id) {
        return Optional.ofNullable(logs.get(id));
    }

    @Override
    public List<RequestLog> claimUnprocessed(int limit, String workerId) {
        List<RequestLog> candidates = logs.values().stream()
                .filter(log -> Boolean.FALSE.equals(log.metricsProcessed()))
                .filter(log -> !claims.containsKey(log.id()))
                .sorted(OLDEST_FIRST)
                .toList();
        List<RequestLog> claimed = new ArrayList<>();
        for (RequestLog candidate : candidates) {
            if (claimed.size() >= limit) {
                break;
            }
            if (claims.putIfAbsent(candidate.id(), workerId) == null) {
                // Re-read: the row may have been processed between the scan and the claim
                RequestLog current = logs.get(candidate.id());
                if (current != null && Boolean.FALSE.equals(current.metricsProcessed())) {
                    claimed.add(current);
                } else {
                    claims.remove(candidate.id(), workerId);
                }
            }
        }
        return claimed;
    }

    @Override
    public void markProcessed(Collection<String> ids, String workerId) {
        for (String id : ids) {
            logs.computeIfPresent(id, (key, log) -> log.withMetricsProcessed(Boolean.TRUE));
            claims.remove(id, workerId);
        }
    }

    @Override
    public void releaseClaims(Collection<String> ids, String workerId) {
        for (String id : ids) {
            claims.remove(id, workerId);
        }
    }

    @Override
    public int flagLegacyRows(int limit) {
        List<String> legacy = logs.values().stream()
                .filter(log -> log.metricsProcessed() == null && log.isMetricsEligible())
                .sorted(OLDEST_FIRST)
                .limit(limit)
                .map(RequestLog::id)
                .toList();
        int flagged = 0;
        for (String id : legacy) {
            RequestLog updated = logs.computeIfPresent(id, (key, log) ->
                    log.metricsProcessed() == null ? log.withMetricsProcessed(Boolean.FALSE) : log);
            if (updated != null) {
                flagged++;
            }
        }
        return flagged;
    }

    @Override
    public long countUnprocessed() {
        return logs.values().stream().filter(log -> Boolean.FALSE.equals(log.metricsProcessed())).count();
    }

    @Override
    public Optional<Instant> oldestUnprocessed() {
        return logs.values().stream()
                .filter(log -> Boolean.FALSE.equals(log.metricsProcessed()))
                .map(RequestLog::receivedAt)
                .min(Comparator.naturalOrder());
    }

    @Override
    public Optional<Instant> newestUnprocessed() {
        return logs.values().stream()
                .filter(log -> Boolean.FALSE.equals(log.metricsProcessed()))
                .map(RequestLog::receivedAt)
                .max(Comparator.naturalOrder());
    }

    @Override
    public long countProcessed() {
        return logs.values().stream().filter(log -> Boolean.TRUE.equals(log.metricsProcessed())).count();
    }

    @Override
    public long count() {
        return logs.size();
    }
}
