package fr.lapetina.inference.gateway.store.memory;

import fr.lapetina.inference.gateway.domain.model.RequestMetrics;
import fr.lapetina.inference.gateway.store.RequestMetricsStore;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryRequestMetricsStore implements RequestMetricsStore {

    private final Map<String, RequestMetrics> metrics = new ConcurrentHashMap<>();

    @Override
    public void upsertAll(Collection<RequestMetrics> rows) {
        for (RequestMetrics row : rows) {
            metrics.put(row.requestId(), row);
        }
    }

    @Override
    public Optional<RequestMetrics> find(String requestId) {
        return Optional.ofNullable(metrics.get(requestId));
    }

    @Override
    public long count() {
        return metrics.size();
    }
}
