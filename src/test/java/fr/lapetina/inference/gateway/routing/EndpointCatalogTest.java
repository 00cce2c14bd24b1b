package fr.lapetina.inference.gateway.routing;

import fr.lapetina.inference.gateway.domain.model.Endpoint;
import fr.lapetina.inference.gateway.infrastructure.config.ConfigChangeListener;
import fr.lapetina.inference.gateway.infrastructure.config.ConfigLoader;
import fr.lapetina.inference.gateway.infrastructure.config.ConfigValidator;
import fr.lapetina.inference.gateway.infrastructure.config.GatewayConfig;
import fr.lapetina.inference.gateway.support.FakeBackends;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class EndpointCatalogTest {

    private static final String CONFIG = """
            clusters:
              - name: alpha
                adaptor: fake
            endpoints:
              - cluster: alpha
                framework: vllm
                model: m1
                adaptor: fake
            federatedEndpoints:
              - targetModelName: m1
                targets:
                  - cluster: alpha
                    framework: vllm
                    model: m1
            """;

    @TempDir
    Path workDir;

    private Path file;
    private EndpointCatalog catalog;
    private ConfigLoader loader;
    private final List<GatewayConfig> applied = new ArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        file = workDir.resolve("gateway.yaml");
        Files.writeString(file, CONFIG, StandardCharsets.UTF_8);
        catalog = new EndpointCatalog(new FakeBackends().registry(), null);
        // "ghost" passes validation but has no adaptor factory
        loader = new ConfigLoader(file.toString(), new ConfigValidator(Set.of("fake", "ghost"), Set.of("fake")));
        loader.addListener(catalog);
        loader.addListener((oldConfig, newConfig) -> applied.add(newConfig));
        loader.load();
    }

    @AfterEach
    void tearDown() {
        catalog.close();
    }

    @Test
    @DisplayName("should reject a configuration whose adaptors cannot be built before any listener applies it")
    void shouldRejectUnbuildableConfiguration() throws Exception {
        GatewayConfig original = loader.getCurrentConfig();
        Files.writeString(file, CONFIG.replace("federatedEndpoints:",
                "  - cluster: alpha\n    framework: vllm\n    model: m2\n    adaptor: ghost\nfederatedEndpoints:"),
                StandardCharsets.UTF_8);

        GatewayConfig afterReload = loader.reload();

        assertThat(afterReload).isSameAs(original);
        assertThat(catalog.endpoints()).extracting(Endpoint::model).containsExactly("m1");
        assertThat(applied).containsExactly(original);
    }

    @Test
    @DisplayName("should keep the current catalog when a later listener rejects the configuration")
    void shouldKeepCatalogWhenOtherListenerRejects() throws Exception {
        loader.addListener(new ConfigChangeListener() {
            @Override
            public void validate(GatewayConfig candidate) {
                if (candidate.getClusters().size() > 1) {
                    throw new ConfigLoader.ConfigurationException("too many clusters");
                }
            }

            @Override
            public void onConfigChanged(GatewayConfig oldConfig, GatewayConfig newConfig) {
            }
        });
        Files.writeString(file, CONFIG.replace("clusters:\n", "clusters:\n  - name: beta\n    adaptor: fake\n"),
                StandardCharsets.UTF_8);

        loader.reload();

        assertThat(catalog.clusters()).hasSize(1);
        assertThat(catalog.cluster("beta")).isEmpty();
    }

    @Test
    @DisplayName("should install the catalog built during validation")
    void shouldInstallPreparedCatalog() throws Exception {
        Files.writeString(file, CONFIG.replace("clusters:\n", "clusters:\n  - name: beta\n    adaptor: fake\n"),
                StandardCharsets.UTF_8);

        loader.reload();

        assertThat(catalog.cluster("beta")).isPresent();
        assertThat(catalog.clusterAdaptor("beta")).isPresent();
        assertThat(applied).hasSize(2);
    }
}
