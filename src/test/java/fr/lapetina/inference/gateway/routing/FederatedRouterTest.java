package fr.lapetina.inference.gateway.routing;

import fr.lapetina.inference.gateway.adaptor.TaskResult;
import fr.lapetina.inference.gateway.domain.model.ApiRoute;
import fr.lapetina.inference.gateway.domain.model.ErrorType;
import fr.lapetina.inference.gateway.domain.model.GatewayError;
import fr.lapetina.inference.gateway.domain.model.GatewayException;
import fr.lapetina.inference.gateway.domain.model.Identity;
import fr.lapetina.inference.gateway.domain.model.InferenceRequest;
import fr.lapetina.inference.gateway.domain.model.JobInfo;
import fr.lapetina.inference.gateway.domain.model.ClusterStatus;
import fr.lapetina.inference.gateway.integration.TestGatewayFactory;
import fr.lapetina.inference.gateway.support.FakeEndpointAdaptor;
import io.micrometer.core.instrument.Counter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static fr.lapetina.inference.gateway.integration.TestGatewayFactory.MODEL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FederatedRouterTest {

    private TestGatewayFactory factory;
    private FederatedRouter router;
    private Identity alice;
    private FakeEndpointAdaptor alpha;
    private FakeEndpointAdaptor beta;

    @BeforeEach
    void setUp() {
        factory = TestGatewayFactory.create();
        router = factory.getRouter();
        alice = factory.identity("alice-token");
        alpha = factory.endpoint("alpha", "vllm", MODEL);
        beta = factory.endpoint("beta", "vllm", MODEL);
    }

    @AfterEach
    void tearDown() {
        if (factory != null) {
            factory.close();
        }
    }

    private static InferenceRequest chat(String model) {
        return InferenceRequest.fromPayload(ApiRoute.CHAT_COMPLETIONS, Map.of(
                "model", model,
                "messages", List.of(Map.of("role", "user", "content", "Hello"))
        ));
    }

    private RouteResult<TaskResult.Success> route(InferenceRequest request, PinnedTarget pin) throws Exception {
        return router.route(request, alice, pin).get(10, TimeUnit.SECONDS);
    }

    private double failovers() {
        Counter counter = factory.getMetricsRegistry().getRegistry()
                .find("test_gateway_failovers_total").counter();
        return counter != null ? counter.count() : 0;
    }

    @Nested
    @DisplayName("federated requests")
    class Federated {

        @Test
        @DisplayName("should succeed on the first live target without failover")
        void shouldServeFromFirstLiveTarget() throws Exception {
            RouteResult<TaskResult.Success> result = route(chat(MODEL), null);

            assertThat(result).isInstanceOf(RouteResult.Served.class);
            RouteResult.Served<TaskResult.Success> served = (RouteResult.Served<TaskResult.Success>) result;
            assertThat(served.endpoint().cluster()).isEqualTo("alpha");
            assertThat(served.failovers()).isZero();
            assertThat(served.value().body()).contains("Hello from alpha-vllm-facebook-opt-125m");
            assertThat(alpha.taskCalls()).isEqualTo(1);
            assertThat(beta.taskCalls()).isZero();
            assertThat(failovers()).isZero();
        }

        @Test
        @DisplayName("should fail over on timeout and skip the timed out target during its cooldown")
        void shouldFailOverOnTimeoutAndSkipDuringCooldown() throws Exception {
            RoutingPolicy policy = router.getPolicy();
            router.updatePolicy(new RoutingPolicy(policy.maxAttempts(), policy.staleness(),
                    Duration.ofMillis(200), policy.fallbackToNonLive()));
            alpha.onTask(request -> new CompletableFuture<>());

            RouteResult<TaskResult.Success> first = route(chat(MODEL), null);

            assertThat(first).isInstanceOf(RouteResult.Served.class);
            RouteResult.Served<TaskResult.Success> served = (RouteResult.Served<TaskResult.Success>) first;
            assertThat(served.endpoint().cluster()).isEqualTo("beta");
            assertThat(served.failovers()).isEqualTo(1);
            assertThat(served.value().body()).contains("Hello from beta-vllm-facebook-opt-125m");
            assertThat(factory.getHealthTracker().isCoolingDown("alpha/vllm/" + MODEL)).isTrue();

            RouteResult<TaskResult.Success> second = route(chat(MODEL), null);

            assertThat(((RouteResult.Served<TaskResult.Success>) second).endpoint().cluster()).isEqualTo("beta");
            assertThat(((RouteResult.Served<TaskResult.Success>) second).failovers()).isZero();
            assertThat(alpha.taskCalls()).isEqualTo(1);
            assertThat(beta.taskCalls()).isEqualTo(2);
        }

        @Test
        @DisplayName("should return an aggregate routing error once every target failed")
        void shouldAggregateFailures() throws Exception {
            alpha.onTask(request -> CompletableFuture.completedFuture(
                    TaskResult.failure(new GatewayError(ErrorType.ADAPTOR_ERROR, "boom", 500))));
            beta.onTask(request -> CompletableFuture.completedFuture(
                    TaskResult.failure(new GatewayError(ErrorType.ADAPTOR_ERROR, "down", 502))));

            RouteResult<TaskResult.Success> result = route(chat(MODEL), null);

            assertThat(result).isInstanceOf(RouteResult.Failed.class);
            GatewayError error = ((RouteResult.Failed<TaskResult.Success>) result).error();
            assertThat(error.type()).isEqualTo(ErrorType.ROUTING_ERROR);
            assertThat(error.code()).isEqualTo(503);
            assertThat(error.failures()).hasSize(2);
            assertThat(error.failures()).extracting(f -> f.message()).containsExactly("boom", "down");
        }

        @Test
        @DisplayName("should not fail over on a client fault")
        void shouldNotFailOverOnClientFault() throws Exception {
            alpha.onTask(request -> CompletableFuture.completedFuture(
                    TaskResult.failure(new GatewayError(ErrorType.ADAPTOR_ERROR, "max_tokens too large", 400))));

            RouteResult<TaskResult.Success> result = route(chat(MODEL), null);

            assertThat(result).isInstanceOf(RouteResult.Failed.class);
            assertThat(((RouteResult.Failed<TaskResult.Success>) result).error().code()).isEqualTo(400);
            assertThat(beta.taskCalls()).isZero();
            assertThat(factory.getHealthTracker().isCoolingDown("alpha/vllm/" + MODEL)).isFalse();
        }

        @Test
        @DisplayName("should prefer a live target over one that is not running")
        void shouldPreferLiveTarget() throws Exception {
            factory.cluster("alpha").nothingRunning();
            factory.getStatusCache().refresh().join();

            RouteResult<TaskResult.Success> result = route(chat(MODEL), null);

            assertThat(((RouteResult.Served<TaskResult.Success>) result).endpoint().cluster()).isEqualTo("beta");
            assertThat(alpha.taskCalls()).isZero();
        }

        @Test
        @DisplayName("should fall back to queued targets before stopped ones when nothing is live")
        void shouldFallBackByAvailability() {
            factory.cluster("alpha").nothingRunning();
            factory.cluster("beta").reportStatus(new ClusterStatus(List.of(),
                    List.of(new JobInfo(MODEL, "vllm", "beta")), List.of(), List.of(), List.of(), List.of(), null));
            factory.getStatusCache().refresh().join();

            List<String> clusters = router.candidates(chat(MODEL), alice, null).stream()
                    .map(e -> e.cluster())
                    .toList();

            assertThat(clusters).containsExactly("beta", "alpha");
        }

        @Test
        @DisplayName("should reject when nothing is live and fallback is disabled")
        void shouldRejectWithoutFallback() {
            RoutingPolicy policy = router.getPolicy();
            router.updatePolicy(new RoutingPolicy(policy.maxAttempts(), policy.staleness(),
                    policy.adaptorTimeout(), false));
            factory.cluster("alpha").nothingRunning();
            factory.cluster("beta").nothingRunning();
            factory.getStatusCache().refresh().join();

            assertThatThrownBy(() -> router.candidates(chat(MODEL), alice, null))
                    .isInstanceOf(GatewayException.class)
                    .extracting(e -> ((GatewayException) e).getError().type())
                    .isEqualTo(ErrorType.UNAVAILABLE);
        }

        @Test
        @DisplayName("should stop after the configured number of attempts")
        void shouldHonourMaxAttempts() throws Exception {
            RoutingPolicy policy = router.getPolicy();
            router.updatePolicy(new RoutingPolicy(1, policy.staleness(), policy.adaptorTimeout(),
                    policy.fallbackToNonLive()));
            alpha.onTask(request -> CompletableFuture.completedFuture(
                    TaskResult.failure(ErrorType.ADAPTOR_ERROR, "boom")));

            RouteResult<TaskResult.Success> result = route(chat(MODEL), null);

            assertThat(result).isInstanceOf(RouteResult.Failed.class);
            assertThat(beta.taskCalls()).isZero();
        }

        @Test
        @DisplayName("should report an unknown model as not found")
        void shouldRejectUnknownModel() throws Exception {
            RouteResult<TaskResult.Success> result = route(chat("no-such-model"), null);

            GatewayError error = ((RouteResult.Failed<TaskResult.Success>) result).error();
            assertThat(error.type()).isEqualTo(ErrorType.NOT_FOUND);
            assertThat(error.message()).isEqualTo("Model no-such-model not found");
        }

        @Test
        @DisplayName("should skip clusters under maintenance")
        void shouldRejectWhenEveryClusterIsUnderMaintenance() throws Exception {
            RouteResult<TaskResult.Success> result = route(chat("mistral-7b"), null);

            assertThat(((RouteResult.Failed<TaskResult.Success>) result).error().type())
                    .isEqualTo(ErrorType.UNAVAILABLE);
            assertThat(factory.endpoint("omega", "vllm", "mistral-7b").taskCalls()).isZero();
        }

        @Test
        @DisplayName("should deny users outside the allowed groups")
        void shouldDenyOutsideGroups() throws Exception {
            RouteResult<TaskResult.Success> denied = route(chat("research-model"), null);
            RouteResult<TaskResult.Success> allowed = router.route(chat("research-model"),
                    factory.identity("researcher-token"), null).get(10, TimeUnit.SECONDS);

            assertThat(((RouteResult.Failed<TaskResult.Success>) denied).error().type())
                    .isEqualTo(ErrorType.AUTH_ERROR);
            assertThat(allowed).isInstanceOf(RouteResult.Served.class);
        }

        @Test
        @DisplayName("should skip clusters that do not expose the route")
        void shouldFilterByRoute() {
            InferenceRequest embeddings = InferenceRequest.fromPayload(ApiRoute.EMBEDDINGS,
                    Map.of("model", MODEL, "input", "text"));

            assertThat(router.candidates(embeddings, alice, null))
                    .extracting(e -> e.cluster())
                    .containsExactly("alpha");
        }
    }

    @Nested
    @DisplayName("pinned requests")
    class Pinned {

        @Test
        @DisplayName("should call only the pinned endpoint")
        void shouldRouteToPinnedEndpoint() throws Exception {
            RouteResult<TaskResult.Success> result = route(chat(MODEL), new PinnedTarget("beta", "vllm"));

            assertThat(((RouteResult.Served<TaskResult.Success>) result).endpoint().cluster()).isEqualTo("beta");
            assertThat(alpha.taskCalls()).isZero();
        }

        @Test
        @DisplayName("should return the target error without failing over")
        void shouldReturnTargetError() throws Exception {
            beta.onTask(request -> CompletableFuture.completedFuture(
                    TaskResult.failure(new GatewayError(ErrorType.ADAPTOR_ERROR, "oom", 500))));

            RouteResult<TaskResult.Success> result = route(chat(MODEL), new PinnedTarget("beta", "vllm"));

            GatewayError error = ((RouteResult.Failed<TaskResult.Success>) result).error();
            assertThat(error.message()).isEqualTo("oom");
            assertThat(error.code()).isEqualTo(500);
            assertThat(alpha.taskCalls()).isZero();
        }

        @Test
        @DisplayName("should report an unknown pinned endpoint")
        void shouldRejectUnknownEndpoint() throws Exception {
            RouteResult<TaskResult.Success> result = route(chat(MODEL), new PinnedTarget("gamma", "vllm"));

            GatewayError error = ((RouteResult.Failed<TaskResult.Success>) result).error();
            assertThat(error.type()).isEqualTo(ErrorType.NOT_FOUND);
            assertThat(error.message()).isEqualTo("Endpoint gamma-vllm-facebook-opt-125m not found");
        }

        @Test
        @DisplayName("should forbid a pinned endpoint outside the user's groups")
        void shouldForbidPinnedEndpoint() throws Exception {
            RouteResult<TaskResult.Success> result = route(chat("research-model"),
                    new PinnedTarget("secure", "sglang"));

            assertThat(((RouteResult.Failed<TaskResult.Success>) result).error().type())
                    .isEqualTo(ErrorType.FORBIDDEN);
        }

        @Test
        @DisplayName("should reject a route the pinned cluster does not expose")
        void shouldRejectUnsupportedRoute() throws Exception {
            InferenceRequest embeddings = InferenceRequest.fromPayload(ApiRoute.EMBEDDINGS,
                    Map.of("model", MODEL, "input", "text"));

            RouteResult<TaskResult.Success> result = route(embeddings, new PinnedTarget("beta", "vllm"));

            assertThat(((RouteResult.Failed<TaskResult.Success>) result).error().type())
                    .isEqualTo(ErrorType.NOT_SUPPORTED);
        }
    }
}
