package fr.lapetina.inference.gateway.integration;

import fr.lapetina.inference.gateway.GatewayFactory;
import fr.lapetina.inference.gateway.domain.model.Identity;
import fr.lapetina.inference.gateway.support.FakeBackends;
import fr.lapetina.inference.gateway.support.FakeClusterAdaptor;
import fr.lapetina.inference.gateway.support.FakeEndpointAdaptor;
import fr.lapetina.inference.gateway.support.MutableClock;

import java.time.Clock;

/**
 * Test extension of GatewayFactory wired with fake adaptors.
 *
 * <p>The factory is not started: tests drive the status refresh, the batch poller and
 * metrics ingestion themselves. Request logs are then written inline.
 */
public final class TestGatewayFactory extends GatewayFactory {

    public static final String MODEL = "facebook/opt-125m";

    private final FakeBackends backends;

    private TestGatewayFactory(String configPath, FakeBackends backends, Clock clock) {
        super(configPath, backends.registry(), null, clock);
        this.backends = backends;
    }

    /**
     * Creates a test factory from the default test configuration, on the system clock.
     */
    public static TestGatewayFactory create() {
        return create("test-config.yaml", Clock.systemUTC());
    }

    /**
     * Creates a test factory driven by a clock the test controls.
     */
    public static TestGatewayFactory create(MutableClock clock) {
        return create("test-config.yaml", clock);
    }

    public static TestGatewayFactory create(String configPath, Clock clock) {
        TestGatewayFactory factory = new TestGatewayFactory(configPath, new FakeBackends(), clock);
        factory.getStatusCache().refresh().join();
        return factory;
    }

    public FakeEndpointAdaptor endpoint(String cluster, String framework, String model) {
        return backends.endpoint(cluster, framework, model);
    }

    public FakeClusterAdaptor cluster(String name) {
        return backends.cluster(name);
    }

    /**
     * Identity behind a token of the test configuration.
     */
    public Identity identity(String token) {
        return getIdentityProvider().introspect(token)
                .orElseThrow(() -> new IllegalArgumentException("Unknown test token " + token));
    }
}
