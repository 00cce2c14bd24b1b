package fr.lapetina.inference.gateway.store.memory;

import fr.lapetina.inference.gateway.domain.model.BatchJob;
import fr.lapetina.inference.gateway.domain.model.BatchStatus;
import fr.lapetina.inference.gateway.store.BatchJobStore;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

public final class InMemoryBatchJobStore implements BatchJobStore {

    private final Map<String, BatchJob> jobs = new ConcurrentHashMap<>();

    @Override
    public void insert(BatchJob job) {
        if (jobs.putIfAbsent(job.id(), job) != null) {
            throw new IllegalStateException("Batch already exists: " + job.id());
        }
    }

    @Override
    public Optional<BatchJob> update(String id, UnaryOperator<BatchJob> change) {
        return Optional.ofNullable(jobs.computeIfPresent(id, (key, current) -> change.apply(current)));
    }

    @Override
    public Optional<BatchJob> findById(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public List<BatchJob> findByUser(String username, BatchStatus status) {
        return jobs.values().stream()
                .filter(job -> job.username().equals(username))
                .filter(job -> status == null || job.status() == status)
                .sorted(Comparator.comparing(BatchJob::createdAt).reversed())
                .toList();
    }

    @Override
    public List<BatchJob> findActive() {
        return jobs.values().stream()
                .filter(job -> !job.status().isTerminal())
                .sorted(Comparator.comparing(BatchJob::createdAt))
                .toList();
    }

    @Override
    public Map<String, Integer> countActiveByUser() {
        return jobs.values().stream()
                .filter(job -> !job.status().isTerminal())
                .collect(Collectors.groupingBy(BatchJob::username, Collectors.summingInt(job -> 1)));
    }
}
