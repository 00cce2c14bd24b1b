package fr.lapetina.inference.gateway.batch;

import fr.lapetina.inference.gateway.adaptor.AdaptorErrors;
import fr.lapetina.inference.gateway.adaptor.BatchStatusResult;
import fr.lapetina.inference.gateway.adaptor.EndpointAdaptor;
import fr.lapetina.inference.gateway.domain.model.BatchJob;
import fr.lapetina.inference.gateway.domain.model.BatchMetrics;
import fr.lapetina.inference.gateway.domain.model.BatchStatus;
import fr.lapetina.inference.gateway.domain.model.GatewayError;
import fr.lapetina.inference.gateway.routing.EndpointCatalog;
import fr.lapetina.inference.gateway.store.BatchJobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background poller that drives batch jobs to a terminal state.
 *
 * Each tick polls every non-terminal job independently, each under its own timeout.
 * A job whose retention window has elapsed is failed without asking the backend, since
 * the backend has discarded its results by then.
 */
public final class BatchPoller implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BatchPoller.class);

    private final BatchJobStore store;
    private final BatchJobManager manager;
    private final EndpointCatalog catalog;
    private final BatchResultWriter resultWriter;
    private final Clock clock;
    private final Duration pollInterval;
    private final Duration initialDelay;
    private final Duration pollTimeout;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public BatchPoller(
            BatchJobStore store,
            BatchJobManager manager,
            EndpointCatalog catalog,
            BatchResultWriter resultWriter,
            Clock clock,
            Duration pollInterval,
            Duration initialDelay,
            Duration pollTimeout
    ) {
        this.store = store;
        this.manager = manager;
        this.catalog = catalog;
        this.resultWriter = resultWriter;
        this.clock = clock;
        this.pollInterval = pollInterval;
        this.initialDelay = initialDelay;
        this.pollTimeout = pollTimeout;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "batch-poller");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(this::pollQuietly,
                    initialDelay.toMillis(), pollInterval.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Batch poller started: interval={}, initialDelay={}, retention={}",
                    pollInterval, initialDelay, manager.getRetentionWindow());
        }
    }

    private void pollQuietly() {
        try {
            // Bounded: every job poll carries its own timeout
            pollAll().join();
        } catch (Exception e) {
            log.error("Batch poll cycle failed", e);
        }
    }

    /**
     * Polls every active job once.
     *
     * @return completes when every poll has finished, with the number of jobs polled
     */
    public CompletableFuture<Integer> pollAll() {
        List<BatchJob> active = store.findActive();
        log.debug("Batch poll cycle: activeJobs={}", active.size());
        CompletableFuture<?>[] polls = active.stream()
                .map(job -> poll(job).exceptionally(ex -> {
                    log.error("Batch poll failed: batchId={}", job.id(), ex);
                    return job;
                }))
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(polls).thenApply(ignored -> polls.length);
    }

    /**
     * Polls one job and applies what the backend reports.
     *
     * @return the job as stored afterwards
     */
    public CompletableFuture<BatchJob> poll(BatchJob job) {
        if (job.status().isTerminal()) {
            return CompletableFuture.completedFuture(job);
        }
        Optional<BatchJob> expired = manager.expireIfDue(job);
        if (expired.isPresent()) {
            return CompletableFuture.completedFuture(expired.get());
        }
        if (job.status() == BatchStatus.SUBMITTED && job.taskIds().isEmpty() && job.backendBatchId() == null) {
            // Submission still in flight
            log.debug("Batch not handed to its backend yet, skipping: batchId={}", job.id());
            return CompletableFuture.completedFuture(job);
        }

        Optional<EndpointAdaptor> adaptor = catalog.endpointAdaptor(job.endpointSlug());
        if (adaptor.isEmpty()) {
            log.warn("Batch endpoint no longer configured, retrying later: batchId={}, endpoint={}",
                    job.id(), job.endpointSlug());
            return CompletableFuture.completedFuture(job);
        }

        CompletableFuture<BatchStatusResult> status;
        try {
            status = adaptor.get().getBatchStatus(job);
        } catch (RuntimeException e) {
            status = CompletableFuture.failedFuture(e);
        }
        return status
                .orTimeout(pollTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(ex -> new BatchStatusResult.Failure(AdaptorErrors.classify(ex, job.endpointSlug()), false))
                .thenApply(result -> apply(job, result));
    }

    private BatchJob apply(BatchJob job, BatchStatusResult result) {
        if (result instanceof BatchStatusResult.Progress progress) {
            log.debug("Batch progress: batchId={}, status={}, completed={}/{}",
                    job.id(), progress.status(), progress.completed(), progress.total());
            if (progress.status() == BatchStatus.RUNNING) {
                return manager.transition(job.id(), BatchStatus.RUNNING, current -> current).orElse(job);
            }
            if (job.status() == BatchStatus.SUBMITTED) {
                return manager.transition(job.id(), BatchStatus.PENDING, current -> current).orElse(job);
            }
            return job;
        }
        if (result instanceof BatchStatusResult.Finished finished) {
            return complete(job, finished);
        }
        BatchStatusResult.Failure failure = (BatchStatusResult.Failure) result;
        if (failure.terminal()) {
            log.warn("Batch failed on backend: batchId={}, message={}", job.id(), failure.error().message());
            return fail(job, failure.error());
        }
        log.warn("Batch poll error, retrying next cycle: batchId={}, errorType={}, message={}",
                job.id(), failure.error().type(), failure.error().message());
        return job;
    }

    private BatchJob complete(BatchJob job, BatchStatusResult.Finished finished) {
        String location = null;
        try {
            location = resultWriter.write(job.outputFolder(), job.id(), finished.lines());
        } catch (IOException e) {
            log.error("Failed to write batch results: batchId={}, folder={}, error={}",
                    job.id(), job.outputFolder(), e.getMessage());
        }
        String resultLocation = location;
        Instant completedAt = clock.instant();
        return manager.transition(job.id(), BatchStatus.COMPLETED, current -> {
            Instant startedAt = current.inProgressAt() != null ? current.inProgressAt() : current.createdAt();
            BatchMetrics metrics = BatchMetrics.compute(finished.lines(), startedAt, completedAt);
            return current.toBuilder()
                    .results(finished.lines())
                    .resultLocation(resultLocation)
                    .metrics(metrics)
                    .build();
        }).orElse(job);
    }

    private BatchJob fail(BatchJob job, GatewayError error) {
        return manager.transition(job.id(), BatchStatus.FAILED, current -> current.toBuilder().error(error).build())
                .orElse(job);
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
            log.info("Batch poller stopped");
        } else {
            scheduler.shutdownNow();
        }
    }
}
