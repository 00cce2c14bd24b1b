package fr.lapetina.inference.gateway.batch;

import fr.lapetina.inference.gateway.adaptor.BatchSubmitResult;
import fr.lapetina.inference.gateway.domain.model.BatchJob;
import fr.lapetina.inference.gateway.domain.model.BatchStatus;
import fr.lapetina.inference.gateway.domain.model.ErrorType;
import fr.lapetina.inference.gateway.domain.model.GatewayError;
import fr.lapetina.inference.gateway.domain.model.GatewayException;
import fr.lapetina.inference.gateway.domain.model.Identity;
import fr.lapetina.inference.gateway.integration.TestGatewayFactory;
import fr.lapetina.inference.gateway.support.FakeEndpointAdaptor;
import fr.lapetina.inference.gateway.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static fr.lapetina.inference.gateway.integration.TestGatewayFactory.MODEL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchJobManagerTest {

    @TempDir
    Path workDir;

    private TestGatewayFactory factory;
    private BatchJobManager manager;
    private Identity alice;
    private Identity bob;
    private FakeEndpointAdaptor alpha;

    @BeforeEach
    void setUp() {
        factory = TestGatewayFactory.create(MutableClock.startingNow());
        manager = factory.getBatchJobManager();
        alice = factory.identity("alice-token");
        bob = factory.identity("bob-token");
        alpha = factory.endpoint("alpha", "vllm", MODEL);
    }

    @AfterEach
    void tearDown() {
        if (factory != null) {
            factory.close();
        }
    }

    private String inputFile(String name, int lines) throws IOException {
        StringBuilder content = new StringBuilder();
        for (int i = 0; i < lines; i++) {
            content.append("{\"custom_id\":\"req-").append(i).append("\",\"url\":\"/v1/chat/completions\",")
                    .append("\"body\":{\"model\":\"").append(MODEL).append("\",")
                    .append("\"messages\":[{\"role\":\"user\",\"content\":\"line ").append(i).append("\"}]}}\n");
        }
        Path file = workDir.resolve(name);
        Files.writeString(file, content.toString(), StandardCharsets.UTF_8);
        return file.toString();
    }

    private BatchSubmission submission(String input) {
        return new BatchSubmission(MODEL, input, workDir.resolve("out").toString(), null, null);
    }

    @Nested
    @DisplayName("submission")
    class Submission {

        @Test
        @DisplayName("should store an accepted batch as pending with its backend ids")
        void shouldStoreAcceptedBatch() throws Exception {
            BatchJob job = manager.submit(submission(inputFile("in.jsonl", 3)), alice);

            assertThat(job.status()).isEqualTo(BatchStatus.PENDING);
            assertThat(job.username()).isEqualTo("alice@example.org");
            assertThat(job.cluster()).isEqualTo("alpha");
            assertThat(job.backendBatchId()).isEqualTo("backend-" + job.id());
            assertThat(job.taskIds()).hasSize(3);
            assertThat(alpha.submittedBatches()).hasSize(1);
            assertThat(alpha.submittedBatches().get(0).lines()).hasSize(3);
            assertThat(factory.getBatchAdmission().activeFor(alice.username())).isEqualTo(1);
        }

        @Test
        @DisplayName("should refuse a third active batch for the same user")
        void shouldEnforcePerUserQuota() throws Exception {
            manager.submit(submission(inputFile("a.jsonl", 1)), alice);
            manager.submit(submission(inputFile("b.jsonl", 1)), alice);
            String third = inputFile("c.jsonl", 1);

            assertThatThrownBy(() -> manager.submit(submission(third), alice))
                    .isInstanceOf(GatewayException.class)
                    .satisfies(e -> {
                        GatewayError error = ((GatewayException) e).getError();
                        assertThat(error.type()).isEqualTo(ErrorType.CAPACITY_ERROR);
                        assertThat(error.code()).isEqualTo(429);
                    });

            assertThat(alpha.submittedBatches()).hasSize(2);
            assertThat(manager.submit(submission(inputFile("d.jsonl", 1)), bob).status())
                    .isEqualTo(BatchStatus.PENDING);
        }

        @Test
        @DisplayName("should reject an input file already used by an ongoing batch")
        void shouldRejectDuplicateInput() throws Exception {
            String input = inputFile("shared.jsonl", 2);
            manager.submit(submission(input), alice);

            assertThatThrownBy(() -> manager.submit(submission(input), bob))
                    .isInstanceOf(GatewayException.class)
                    .hasMessageContaining("already used by ongoing batch");
            assertThat(factory.getBatchAdmission().activeFor(bob.username())).isZero();
        }

        @Test
        @DisplayName("should reject a missing input file without using a slot")
        void shouldRejectMissingInput() {
            String missing = workDir.resolve("missing.jsonl").toString();

            assertThatThrownBy(() -> manager.submit(submission(missing), alice))
                    .isInstanceOf(GatewayException.class)
                    .hasMessageContaining("not found");
            assertThat(factory.getBatchAdmission().activeFor(alice.username())).isZero();
        }

        @Test
        @DisplayName("should refuse endpoints that do not run batches")
        void shouldRefuseWithoutBatchSupport() throws Exception {
            alpha.setBatchEnabled(false);
            factory.endpoint("beta", "vllm", MODEL).setBatchEnabled(false);
            String input = inputFile("in.jsonl", 1);

            assertThatThrownBy(() -> manager.submit(submission(input), alice))
                    .isInstanceOf(GatewayException.class)
                    .satisfies(e -> assertThat(((GatewayException) e).getError().type())
                            .isEqualTo(ErrorType.NOT_SUPPORTED));
        }

        @Test
        @DisplayName("should store a rejected batch as failed and free its slot")
        void shouldFailRejectedBatch() throws Exception {
            alpha.onBatchSubmit(request -> new BatchSubmitResult.Failure(
                    GatewayError.of(ErrorType.ADAPTOR_ERROR, "queue closed")));

            BatchJob job = manager.submit(submission(inputFile("in.jsonl", 1)), alice);

            assertThat(job.status()).isEqualTo(BatchStatus.FAILED);
            assertThat(job.error().message()).isEqualTo("queue closed");
            assertThat(job.failedAt()).isNotNull();
            assertThat(factory.getBatchAdmission().activeFor(alice.username())).isZero();
        }
    }

    @Nested
    @DisplayName("lookup")
    class Lookup {

        @Test
        @DisplayName("should hide a batch from other users")
        void shouldEnforceOwnership() throws Exception {
            BatchJob job = manager.submit(submission(inputFile("in.jsonl", 1)), alice);

            assertThat(manager.status(job.id(), alice).id()).isEqualTo(job.id());
            assertThatThrownBy(() -> manager.status(job.id(), bob))
                    .isInstanceOf(GatewayException.class)
                    .satisfies(e -> assertThat(((GatewayException) e).getError().type())
                            .isEqualTo(ErrorType.FORBIDDEN));
            assertThatThrownBy(() -> manager.status("nope", alice))
                    .isInstanceOf(GatewayException.class)
                    .hasMessage("Batch nope not found");
        }

        @Test
        @DisplayName("should refuse results before completion")
        void shouldRefuseEarlyResults() throws Exception {
            BatchJob job = manager.submit(submission(inputFile("in.jsonl", 1)), alice);

            assertThatThrownBy(() -> manager.result(job.id(), alice))
                    .isInstanceOf(GatewayException.class)
                    .hasMessageContaining("not completed yet");
        }

        @Test
        @DisplayName("should list only the caller's batches, filtered by status")
        void shouldListOwnBatches() throws Exception {
            manager.submit(submission(inputFile("a.jsonl", 1)), alice);
            manager.submit(submission(inputFile("b.jsonl", 1)), bob);

            List<BatchJob> mine = manager.list(alice, null);

            assertThat(mine).hasSize(1);
            assertThat(mine.get(0).username()).isEqualTo(alice.username());
            assertThat(manager.list(alice, BatchStatus.PENDING)).hasSize(1);
            assertThat(manager.list(alice, BatchStatus.COMPLETED)).isEmpty();
        }
    }

    @Test
    @DisplayName("should never move a batch backwards")
    void shouldKeepTransitionsMonotonic() throws Exception {
        BatchJob job = manager.submit(submission(inputFile("in.jsonl", 1)), alice);
        manager.transition(job.id(), BatchStatus.RUNNING, current -> current);

        BatchJob after = manager.transition(job.id(), BatchStatus.PENDING, current -> current).orElseThrow();

        assertThat(after.status()).isEqualTo(BatchStatus.RUNNING);
        assertThat(after.inProgressAt()).isNotNull();
    }
}
