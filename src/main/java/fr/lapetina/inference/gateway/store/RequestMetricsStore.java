package fr.lapetina.inference.gateway.store;

import fr.lapetina.inference.gateway.domain.model.RequestMetrics;

import java.util.Collection;
import java.util.Optional;

/**
 * Persistence for derived request metrics, keyed by request id.
 */
public interface RequestMetricsStore {

    /**
     * Inserts or replaces the rows. Replaying the same rows leaves the store unchanged.
     */
    void upsertAll(Collection<RequestMetrics> metrics);

    Optional<RequestMetrics> find(String requestId);

    long count();
}
