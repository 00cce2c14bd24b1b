package fr.lapetina.inference.gateway.batch;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.inference.gateway.adaptor.BatchStatusResult;
import fr.lapetina.inference.gateway.adaptor.BatchSubmitResult;
import fr.lapetina.inference.gateway.domain.model.BatchJob;
import fr.lapetina.inference.gateway.domain.model.BatchLineResult;
import fr.lapetina.inference.gateway.domain.model.BatchStatus;
import fr.lapetina.inference.gateway.domain.model.ErrorType;
import fr.lapetina.inference.gateway.domain.model.GatewayError;
import fr.lapetina.inference.gateway.domain.model.Identity;
import fr.lapetina.inference.gateway.integration.TestGatewayFactory;
import fr.lapetina.inference.gateway.support.FakeEndpointAdaptor;
import fr.lapetina.inference.gateway.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static fr.lapetina.inference.gateway.integration.TestGatewayFactory.MODEL;
import static org.assertj.core.api.Assertions.assertThat;

class BatchPollerTest {

    private static final Duration RETENTION = Duration.ofDays(3);

    @TempDir
    Path workDir;

    private MutableClock clock;
    private TestGatewayFactory factory;
    private BatchPoller poller;
    private Identity alice;
    private FakeEndpointAdaptor alpha;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingNow();
        factory = TestGatewayFactory.create(clock);
        poller = factory.getBatchPoller();
        alice = factory.identity("alice-token");
        alpha = factory.endpoint("alpha", "vllm", MODEL);
    }

    @AfterEach
    void tearDown() {
        if (factory != null) {
            factory.close();
        }
    }

    private BatchJob submit(int lines) throws Exception {
        StringBuilder content = new StringBuilder();
        for (int i = 0; i < lines; i++) {
            content.append("{\"model\":\"").append(MODEL)
                    .append("\",\"messages\":[{\"role\":\"user\",\"content\":\"q").append(i).append("\"}]}\n");
        }
        Path input = workDir.resolve("input-" + System.nanoTime() + ".jsonl");
        Files.writeString(input, content.toString(), StandardCharsets.UTF_8);
        return factory.getBatchJobManager().submit(
                new BatchSubmission(MODEL, input.toString(), workDir.resolve("out").toString(), null, null), alice);
    }

    private BatchJob poll(BatchJob job) throws Exception {
        BatchJob current = factory.getBatchJobStore().findById(job.id()).orElseThrow();
        return poller.poll(current).get(10, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("should complete a batch whose lines all ended, keeping per line errors")
    void shouldCompleteWithPartialErrors() throws Exception {
        BatchJob job = submit(3);
        alpha.onBatchStatus(current -> new BatchStatusResult.Finished(List.of(
                BatchLineResult.success(0, current.taskIds().get(0), "{\"id\":\"r0\"}"),
                BatchLineResult.failure(1, current.taskIds().get(1),
                        GatewayError.of(ErrorType.ADAPTOR_ERROR, "context too long")),
                BatchLineResult.success(2, current.taskIds().get(2), "{\"id\":\"r2\"}"))));
        clock.advance(Duration.ofMinutes(5));

        BatchJob done = poll(job);

        assertThat(done.status()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(done.successCount()).isEqualTo(2);
        assertThat(done.errorCount()).isEqualTo(1);
        assertThat(done.completedAt()).isEqualTo(clock.instant());
        assertThat(done.metrics()).isNotNull();
        assertThat(factory.getBatchAdmission().activeFor(alice.username())).isZero();

        Path results = Path.of(done.resultLocation());
        assertThat(results).exists();
        List<String> lines = Files.readAllLines(results, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(3);
        JsonNode failed = factory.getObjectMapper().readTree(lines.get(1));
        assertThat(failed.path("error").path("message").asText()).isEqualTo("context too long");
        assertThat(factory.getObjectMapper().readTree(lines.get(0)).path("response").path("id").asText())
                .isEqualTo("r0");
    }

    @Test
    @DisplayName("should fail an expired batch without asking the backend")
    void shouldExpireAtRetentionDeadline() throws Exception {
        BatchJob job = submit(1);
        clock.advance(RETENTION.minusMillis(1));
        assertThat(poll(job).status()).isEqualTo(BatchStatus.RUNNING);
        int callsBefore = alpha.batchStatusCalls();

        clock.advance(Duration.ofMillis(1));
        BatchJob expired = poll(job);

        assertThat(expired.status()).isEqualTo(BatchStatus.FAILED);
        assertThat(expired.error().type()).isEqualTo(ErrorType.BATCH_EXPIRY_ERROR);
        assertThat(alpha.batchStatusCalls()).isEqualTo(callsBefore);
        assertThat(factory.getBatchAdmission().activeFor(alice.username())).isZero();
    }

    @Test
    @DisplayName("should never report a running batch as pending again")
    void shouldStayRunning() throws Exception {
        BatchJob job = submit(1);
        assertThat(poll(job).status()).isEqualTo(BatchStatus.RUNNING);

        alpha.onBatchStatus(current -> new BatchStatusResult.Progress(BatchStatus.PENDING, 0, 1));

        assertThat(poll(job).status()).isEqualTo(BatchStatus.RUNNING);
    }

    @Test
    @DisplayName("should keep the batch active after a transient poll error")
    void shouldRetryAfterTransientError() throws Exception {
        BatchJob job = submit(1);
        alpha.onBatchStatus(current -> new BatchStatusResult.Failure(
                GatewayError.of(ErrorType.ADAPTOR_ERROR, "fabric unreachable"), false));

        assertThat(poll(job).status()).isEqualTo(BatchStatus.PENDING);

        alpha.onBatchStatus(current -> new BatchStatusResult.Failure(
                GatewayError.of(ErrorType.ADAPTOR_ERROR, "batch cancelled"), true));

        BatchJob failed = poll(job);
        assertThat(failed.status()).isEqualTo(BatchStatus.FAILED);
        assertThat(failed.error().message()).isEqualTo("batch cancelled");
    }

    @Test
    @DisplayName("should poll every active batch in one cycle")
    void shouldPollAllActive() throws Exception {
        submit(1);
        submit(2);

        int polled = poller.pollAll().get(10, TimeUnit.SECONDS);

        assertThat(polled).isEqualTo(2);
        assertThat(factory.getBatchJobStore().findActive())
                .extracting(BatchJob::status)
                .containsOnly(BatchStatus.RUNNING);
    }

    @Test
    @DisplayName("should leave a batch alone while its submission is still in flight")
    void shouldSkipBatchStillBeingSubmitted() throws Exception {
        CountDownLatch inFlight = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        alpha.onBatchSubmit(request -> {
            inFlight.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new BatchSubmitResult.Accepted("backend-1", List.of("t0", "t1"));
        });
        CompletableFuture<BatchJob> submission = CompletableFuture.supplyAsync(() -> {
            try {
                return submit(2);
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        });
        assertThat(inFlight.await(10, TimeUnit.SECONDS)).isTrue();

        poller.pollAll().get(10, TimeUnit.SECONDS);
        assertThat(factory.getBatchJobStore().findActive())
                .extracting(BatchJob::status)
                .containsExactly(BatchStatus.SUBMITTED);
        assertThat(alpha.batchStatusCalls()).isZero();

        release.countDown();
        BatchJob accepted = submission.get(10, TimeUnit.SECONDS);

        assertThat(accepted.status()).isEqualTo(BatchStatus.PENDING);
        assertThat(accepted.taskIds()).containsExactly("t0", "t1");
        assertThat(accepted.backendBatchId()).isEqualTo("backend-1");
    }

    @Test
    @DisplayName("should keep backend ids of a batch that moved on before its submission returned")
    void shouldRecordIdsOfBatchAlreadyRunning() throws Exception {
        BatchJobManager manager = factory.getBatchJobManager();
        alpha.onBatchSubmit(request -> {
            manager.transition(request.batchId(), BatchStatus.RUNNING, current -> current);
            return new BatchSubmitResult.Accepted("backend-2", List.of("t0"));
        });

        BatchJob job = submit(1);

        assertThat(job.status()).isEqualTo(BatchStatus.RUNNING);
        assertThat(job.taskIds()).containsExactly("t0");
        assertThat(job.backendBatchId()).isEqualTo("backend-2");
    }

    @Test
    @DisplayName("should report an expired batch as failed when read, before the next poll")
    void shouldExpireOnStatusRead() throws Exception {
        BatchJob job = submit(1);
        assertThat(poll(job).status()).isEqualTo(BatchStatus.RUNNING);
        int callsBefore = alpha.batchStatusCalls();

        clock.advance(RETENTION.minusMillis(1));
        assertThat(factory.getBatchJobManager().status(job.id(), alice).status()).isEqualTo(BatchStatus.RUNNING);

        clock.advance(Duration.ofMillis(1));
        BatchJob read = factory.getBatchJobManager().status(job.id(), alice);

        assertThat(read.status()).isEqualTo(BatchStatus.FAILED);
        assertThat(read.error().type()).isEqualTo(ErrorType.BATCH_EXPIRY_ERROR);
        assertThat(alpha.batchStatusCalls()).isEqualTo(callsBefore);
        assertThat(factory.getBatchAdmission().activeFor(alice.username())).isZero();
        assertThat(factory.getBatchJobStore().findActive()).isEmpty();
    }
}
