package fr.lapetina.inference.gateway.store;

import fr.lapetina.inference.gateway.domain.model.BatchJob;
import fr.lapetina.inference.gateway.domain.model.BatchStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Persistence for batch jobs.
 */
public interface BatchJobStore {

    void insert(BatchJob job);

    /**
     * Atomically replaces a job with {@code change.apply(current)}.
     *
     * @return the stored job after the change, or empty if the id is unknown
     */
    Optional<BatchJob> update(String id, UnaryOperator<BatchJob> change);

    Optional<BatchJob> findById(String id);

    /**
     * Jobs of one user, newest first, optionally filtered by status.
     */
    List<BatchJob> findByUser(String username, BatchStatus status);

    /**
     * Jobs not yet in a terminal state.
     */
    List<BatchJob> findActive();

    /**
     * Number of non-terminal jobs per username.
     */
    Map<String, Integer> countActiveByUser();
}
