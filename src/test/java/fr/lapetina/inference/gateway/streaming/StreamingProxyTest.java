package fr.lapetina.inference.gateway.streaming;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.inference.gateway.adaptor.StreamResult;
import fr.lapetina.inference.gateway.adaptor.TaskResult;
import fr.lapetina.inference.gateway.domain.model.ApiRoute;
import fr.lapetina.inference.gateway.domain.model.ErrorType;
import fr.lapetina.inference.gateway.domain.model.GatewayError;
import fr.lapetina.inference.gateway.domain.model.Identity;
import fr.lapetina.inference.gateway.domain.model.InferenceRequest;
import fr.lapetina.inference.gateway.domain.model.RequestLog;
import fr.lapetina.inference.gateway.integration.TestGatewayFactory;
import fr.lapetina.inference.gateway.routing.RouteResult;
import fr.lapetina.inference.gateway.support.FakeEndpointAdaptor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static fr.lapetina.inference.gateway.integration.TestGatewayFactory.MODEL;
import static org.assertj.core.api.Assertions.assertThat;

class StreamingProxyTest {

    private TestGatewayFactory factory;
    private StreamingProxy proxy;
    private ObjectMapper mapper;
    private Identity alice;
    private FakeEndpointAdaptor alpha;

    @BeforeEach
    void setUp() {
        factory = TestGatewayFactory.create();
        proxy = factory.getStreamingProxy();
        mapper = factory.getObjectMapper();
        alice = factory.identity("alice-token");
        alpha = factory.endpoint("alpha", "vllm", MODEL);
    }

    @AfterEach
    void tearDown() {
        if (factory != null) {
            factory.close();
        }
    }

    private static InferenceRequest chat(String model, boolean stream) {
        return InferenceRequest.fromPayload(ApiRoute.CHAT_COMPLETIONS, Map.of(
                "model", model,
                "stream", stream,
                "messages", List.of(Map.of("role", "user", "content", "Hello"))
        ));
    }

    private String deltaContent(List<String> lines) throws IOException {
        StringBuilder content = new StringBuilder();
        for (String line : lines) {
            if (line.equals("data: [DONE]")) {
                continue;
            }
            JsonNode choices = mapper.readTree(line.substring("data: ".length())).path("choices");
            if (choices.size() > 0) {
                content.append(choices.get(0).path("delta").path("content").asText(""));
            }
        }
        return content.toString();
    }

    @Test
    @DisplayName("should stream the same content as the non streaming call")
    void shouldMatchNonStreamingContent() throws Exception {
        RouteResult<TaskResult.Success> direct = factory.getInferenceService()
                .infer(chat(MODEL, false), alice, null).get(10, TimeUnit.SECONDS);
        String body = ((RouteResult.Served<TaskResult.Success>) direct).value().body();
        String expected = mapper.readTree(body).path("choices").get(0).path("message").path("content").asText();

        RecordingSink sink = new RecordingSink();
        StreamOutcome outcome = proxy.proxy(chat(MODEL, true), alice, null, sink);

        assertThat(outcome.state()).isEqualTo(StreamSession.State.COMPLETED);
        assertThat(outcome.started()).isTrue();
        assertThat(outcome.usage().totalTokens()).isEqualTo(9L);
        assertThat(sink.opened).isTrue();
        assertThat(sink.lines).last().isEqualTo("data: [DONE]");
        assertThat(sink.lines).filteredOn("data: [DONE]"::equals).hasSize(1);
        assertThat(deltaContent(sink.lines)).isEqualTo(expected);
    }

    @Test
    @DisplayName("should write exactly one request log for a completed stream")
    void shouldLogCompletedStream() {
        InferenceRequest request = chat(MODEL, true);

        proxy.proxy(request, alice, null, new RecordingSink());

        RequestLog entry = factory.getRequestLogStore().findById(request.requestId()).orElseThrow();
        assertThat(entry.streaming()).isTrue();
        assertThat(entry.statusCode()).isEqualTo(200);
        assertThat(entry.cluster()).isEqualTo("alpha");
        assertThat(entry.username()).isEqualTo("alice@example.org");
        assertThat(entry.result()).contains("total_tokens");
    }

    @Test
    @DisplayName("should cancel the backend stream when the client goes away")
    void shouldPropagateClientCancellation() {
        RecordingSink sink = new RecordingSink();
        sink.failAfter = 1;
        InferenceRequest request = chat(MODEL, true);

        StreamOutcome outcome = proxy.proxy(request, alice, null, sink);

        assertThat(outcome.state()).isEqualTo(StreamSession.State.CANCELLED);
        assertThat(alpha.openedStreams()).hasSize(1);
        assertThat(alpha.openedStreams().get(0).isCancelled()).isTrue();
        assertThat(factory.getRequestLogStore().findById(request.requestId()).orElseThrow().statusCode())
                .isEqualTo(499);
    }

    @Test
    @DisplayName("should fail with a timeout when the first chunk never arrives")
    void shouldTimeOutOnFirstChunk() {
        QueueStreamHandle silent = new QueueStreamHandle("silent");
        alpha.onStream((request, id) -> CompletableFuture.completedFuture(StreamResult.opened(silent, "task-1")));
        proxy.updateTimeouts(Duration.ofMillis(100), Duration.ofSeconds(5));
        RecordingSink sink = new RecordingSink();

        StreamOutcome outcome = proxy.proxy(chat(MODEL, true), alice, null, sink);

        assertThat(outcome.state()).isEqualTo(StreamSession.State.FAILED);
        assertThat(outcome.error().type()).isEqualTo(ErrorType.ADAPTOR_TIMEOUT);
        assertThat(silent.isCancelled()).isTrue();
        assertThat(sink.lines).hasSize(2);
        assertThat(sink.lines.get(0)).contains("[ERROR]");
        assertThat(sink.lines.get(1)).isEqualTo("data: [DONE]");
    }

    @Test
    @DisplayName("should show a mid stream failure as a trailing error chunk")
    void shouldReportMidStreamError() {
        QueueStreamHandle handle = new QueueStreamHandle("broken");
        handle.emit(FakeEndpointAdaptor.streamChunks("x").get(0));
        handle.fail(GatewayError.of(ErrorType.ADAPTOR_ERROR, "worker lost"));
        alpha.onStream((request, id) -> CompletableFuture.completedFuture(StreamResult.opened(handle, "task-2")));
        RecordingSink sink = new RecordingSink();

        StreamOutcome outcome = proxy.proxy(chat(MODEL, true), alice, null, sink);

        assertThat(outcome.state()).isEqualTo(StreamSession.State.FAILED);
        assertThat(outcome.chunks()).isEqualTo(1);
        assertThat(sink.lines).hasSize(3);
        assertThat(sink.lines.get(1)).contains("[ERROR] worker lost");
        assertThat(sink.lines.get(2)).isEqualTo("data: [DONE]");
    }

    @Test
    @DisplayName("should not open the client stream when routing fails")
    void shouldNotStartWhenRoutingFails() {
        RecordingSink sink = new RecordingSink();

        StreamOutcome outcome = proxy.proxy(chat("no-such-model", true), alice, null, sink);

        assertThat(outcome.started()).isFalse();
        assertThat(outcome.error().type()).isEqualTo(ErrorType.NOT_FOUND);
        assertThat(sink.opened).isFalse();
        assertThat(sink.lines).isEmpty();
    }

    private static final class RecordingSink implements ChunkSink {
        private final List<String> lines = new ArrayList<>();
        private boolean opened;
        private int failAfter = -1;

        @Override
        public void open() {
            opened = true;
        }

        @Override
        public void send(String line) throws IOException {
            if (failAfter >= 0 && lines.size() >= failAfter) {
                throw new IOException("Broken pipe");
            }
            lines.add(line);
        }
    }
}
