package fr.lapetina.inference.gateway.batch;

import fr.lapetina.inference.gateway.adaptor.AdaptorErrors;
import fr.lapetina.inference.gateway.adaptor.BatchRequest;
import fr.lapetina.inference.gateway.adaptor.BatchSubmitResult;
import fr.lapetina.inference.gateway.adaptor.EndpointAdaptor;
import fr.lapetina.inference.gateway.adaptor.EndpointStatus;
import fr.lapetina.inference.gateway.domain.model.BatchJob;
import fr.lapetina.inference.gateway.domain.model.BatchStatus;
import fr.lapetina.inference.gateway.domain.model.Endpoint;
import fr.lapetina.inference.gateway.domain.model.ErrorType;
import fr.lapetina.inference.gateway.domain.model.GatewayError;
import fr.lapetina.inference.gateway.domain.model.GatewayException;
import fr.lapetina.inference.gateway.domain.model.Identity;
import fr.lapetina.inference.gateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.gateway.routing.EndpointCatalog;
import fr.lapetina.inference.gateway.routing.FederatedRouter;
import fr.lapetina.inference.gateway.store.BatchJobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Submission, lookup and status transitions of batch jobs.
 *
 * Status only moves forward. Every transition goes through {@link #transition}, which
 * re-checks the stored status atomically, logs {@code before -> after} and frees the
 * owner's admission slot when the job reaches a terminal state.
 */
public final class BatchJobManager {

    private static final Logger log = LoggerFactory.getLogger(BatchJobManager.class);

    private final BatchJobStore store;
    private final FederatedRouter router;
    private final EndpointCatalog catalog;
    private final BatchAdmissionControl admission;
    private final BatchInputReader inputReader;
    private final MetricsRegistry metrics;
    private final Clock clock;
    private final Duration backendTimeout;
    private final Duration retentionWindow;

    public BatchJobManager(
            BatchJobStore store,
            FederatedRouter router,
            EndpointCatalog catalog,
            BatchAdmissionControl admission,
            BatchInputReader inputReader,
            MetricsRegistry metrics,
            Clock clock,
            Duration backendTimeout,
            Duration retentionWindow
    ) {
        this.store = store;
        this.router = router;
        this.catalog = catalog;
        this.admission = admission;
        this.inputReader = inputReader;
        this.metrics = metrics;
        this.clock = clock;
        this.backendTimeout = backendTimeout;
        this.retentionWindow = retentionWindow;
        admission.initialize(store.countActiveByUser());
    }

    /**
     * Validates and hands a batch to its endpoint.
     *
     * @return the stored job, PENDING when the backend accepted it, FAILED otherwise
     * @throws GatewayException when the batch is refused before anything is stored
     */
    public BatchJob submit(BatchSubmission submission, Identity identity) {
        Endpoint endpoint = router.resolveBatchEndpoint(submission.model(), identity, submission.pin());
        EndpointAdaptor adaptor = catalog.endpointAdaptor(endpoint.slug()).orElseThrow(() ->
                new GatewayException(ErrorType.CONFIG_ERROR, "No adaptor for endpoint " + endpoint.slug()));
        if (!adaptor.hasBatchEnabled()) {
            throw new GatewayException(ErrorType.NOT_SUPPORTED,
                    "submit_batch unavailable for endpoint " + endpoint.slug());
        }

        if (!admission.tryAcquire(identity.username())) {
            int limit = admission.getMaxActivePerUser();
            throw new GatewayException(ErrorType.CAPACITY_ERROR,
                    "Quota of " + limit + " active batch(es) per user exceeded");
        }

        BatchJob job;
        BatchRequest request;
        try {
            rejectDuplicateInput(submission.inputFile());
            String batchId = UUID.randomUUID().toString();
            request = new BatchRequest(batchId, endpoint.model(), submission.inputFile(),
                    submission.outputFolder(), inputReader.read(submission.inputFile()));
            requireOnline(adaptor, endpoint);

            job = BatchJob.builder()
                    .id(batchId)
                    .username(identity.username())
                    .model(endpoint.model())
                    .cluster(endpoint.cluster())
                    .framework(endpoint.framework())
                    .endpointSlug(endpoint.slug())
                    .inputFile(submission.inputFile())
                    .outputFolder(submission.outputFolder())
                    .status(BatchStatus.SUBMITTED)
                    .createdAt(clock.instant())
                    .build();
            store.insert(job);
        } catch (RuntimeException e) {
            admission.release(identity.username());
            throw e;
        }
        metrics.incrementBatchTransition(BatchStatus.SUBMITTED);
        log.info("Batch created: batchId={}, username={}, endpoint={}, lines={}",
                job.id(), job.username(), endpoint.slug(), request.lines().size());

        BatchSubmitResult result;
        try {
            result = adaptor.submitBatch(request, identity)
                    .orTimeout(backendTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .exceptionally(ex -> new BatchSubmitResult.Failure(AdaptorErrors.classify(ex, endpoint.slug())))
                    .join();
        } catch (RuntimeException e) {
            result = new BatchSubmitResult.Failure(AdaptorErrors.classify(e, endpoint.slug()));
        }

        if (result instanceof BatchSubmitResult.Accepted accepted) {
            return accept(job, accepted);
        }
        GatewayError error = ((BatchSubmitResult.Failure) result).error();
        log.warn("Batch submission failed: batchId={}, errorType={}, message={}",
                job.id(), error.type(), error.message());
        return transition(job.id(), BatchStatus.FAILED, current -> current.toBuilder().error(error).build())
                .orElse(job);
    }

    /**
     * Records the backend ids and moves the job to PENDING. The ids are kept even when
     * the job already moved on, so that later polls can still reach its tasks.
     */
    private BatchJob accept(BatchJob job, BatchSubmitResult.Accepted accepted) {
        UnaryOperator<BatchJob> withIds = current -> current.toBuilder()
                .backendBatchId(accepted.backendBatchId())
                .taskIds(accepted.taskIds())
                .build();
        Optional<BatchJob> moved = transition(job.id(), BatchStatus.PENDING, withIds);
        if (moved.isEmpty() || moved.get().taskIds().equals(accepted.taskIds())) {
            return moved.orElse(job);
        }
        if (moved.get().status().isTerminal()) {
            log.warn("Batch ended before its submission returned, backend tasks left behind: batchId={}, "
                    + "backendBatchId={}, status={}", job.id(), accepted.backendBatchId(), moved.get().status());
        } else {
            log.warn("Batch moved before its submission returned, recording backend ids: batchId={}, status={}",
                    job.id(), moved.get().status());
            moved = store.update(job.id(), current -> current.status().isTerminal() ? current : withIds.apply(current));
        }
        return moved.orElse(job);
    }

    private void rejectDuplicateInput(String inputFile) {
        for (BatchJob active : store.findActive()) {
            if (inputFile.equals(active.inputFile())) {
                throw new GatewayException(ErrorType.VALIDATION_ERROR,
                        "Input file " + inputFile + " already used by ongoing batch " + active.id() + ".");
            }
        }
    }

    private void requireOnline(EndpointAdaptor adaptor, Endpoint endpoint) {
        EndpointStatus status;
        try {
            status = adaptor.endpointStatus()
                    .orTimeout(backendTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .join();
        } catch (RuntimeException e) {
            status = EndpointStatus.offline(AdaptorErrors.classify(e, endpoint.slug()).message());
        }
        if (!status.online()) {
            throw new GatewayException(ErrorType.UNAVAILABLE,
                    "Endpoint " + endpoint.slug() + " is not available: " + status.detail());
        }
    }

    public List<BatchJob> list(Identity identity, BatchStatus status) {
        return store.findByUser(identity.username(), status);
    }

    /**
     * @throws GatewayException NOT_FOUND for an unknown id, FORBIDDEN for another user's batch
     */
    public BatchJob status(String batchId, Identity identity) {
        BatchJob job = store.findById(batchId).orElseThrow(() ->
                new GatewayException(ErrorType.NOT_FOUND, "Batch " + batchId + " not found"));
        if (!job.username().equals(identity.username())) {
            throw new GatewayException(ErrorType.FORBIDDEN, "Batch " + batchId + " belongs to another user");
        }
        return expireIfDue(job).orElse(job);
    }

    public Duration getRetentionWindow() {
        return retentionWindow;
    }

    /**
     * Fails a non-terminal job whose retention window has elapsed, since the backend
     * has discarded its results by then.
     *
     * @return the failed job, empty when the job is terminal or still within its window
     */
    Optional<BatchJob> expireIfDue(BatchJob job) {
        if (job.status().isTerminal() || clock.instant().isBefore(job.createdAt().plus(retentionWindow))) {
            return Optional.empty();
        }
        log.warn("Batch expired: batchId={}, createdAt={}, status={}", job.id(), job.createdAt(), job.status());
        GatewayError expired = GatewayError.of(ErrorType.BATCH_EXPIRY_ERROR,
                "Batch " + job.id() + " expired: results are discarded after " + retentionWindow.toHours() + "h");
        return transition(job.id(), BatchStatus.FAILED, current -> current.toBuilder().error(expired).build());
    }

    /**
     * A completed batch, ready to have its results read.
     */
    public BatchJob result(String batchId, Identity identity) {
        BatchJob job = status(batchId, identity);
        if (job.status() == BatchStatus.FAILED) {
            String reason = job.error() != null ? job.error().message() : "unknown error";
            throw new GatewayException(ErrorType.VALIDATION_ERROR, "Batch failed: " + reason);
        }
        if (job.status() != BatchStatus.COMPLETED) {
            throw new GatewayException(ErrorType.VALIDATION_ERROR, "Batch not completed yet. Results not ready.");
        }
        return job;
    }

    /**
     * Moves a job to {@code next} if its stored status still allows it, applying
     * {@code change} to the moved job.
     *
     * @return the job as stored afterwards, empty if the id is unknown
     */
    Optional<BatchJob> transition(String batchId, BatchStatus next, UnaryOperator<BatchJob> change) {
        Instant now = clock.instant();
        AtomicReference<BatchStatus> before = new AtomicReference<>();
        Optional<BatchJob> stored = store.update(batchId, current -> {
            if (!current.status().canTransitionTo(next)) {
                return current;
            }
            before.set(current.status());
            return change.apply(current.transitionTo(next, now));
        });
        if (before.get() != null && stored.isPresent()) {
            BatchJob job = stored.get();
            log.info("Batch status changed: batchId={}, {} -> {}", batchId, before.get(), next);
            metrics.incrementBatchTransition(next);
            if (next.isTerminal()) {
                admission.release(job.username());
            }
        } else if (stored.isPresent()) {
            log.debug("Batch transition skipped: batchId={}, status={}, requested={}",
                    batchId, stored.get().status(), next);
        }
        return stored;
    }
}
