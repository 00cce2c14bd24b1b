package fr.lapetina.inference.gateway.infrastructure.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static final String MINIMAL = """
            streaming:
              internalSecret: from-file
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

    private ConfigValidator validator;

    @BeforeEach
    void setUp() {
        validator = new ConfigValidator(Set.of("fake"), Set.of("fake"));
    }

    private static InputStream yaml(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("should load the test configuration from the classpath")
    void shouldLoadFromClasspath() {
        ConfigLoader loader = new ConfigLoader("test-config.yaml", validator, name -> null);

        GatewayConfig config = loader.load();

        assertThat(config.getClusters()).hasSize(4);
        assertThat(config.getAuth().getTokens()).hasSize(4);
        assertThat(config.getBatch().getMaxActivePerUser()).isEqualTo(2);
        assertThat(loader.getCurrentConfig()).isSameAs(config);
    }

    @Test
    @DisplayName("should keep defaults for sections the file leaves out")
    void shouldApplyDefaults() {
        ConfigLoader loader = new ConfigLoader("unused.yaml", validator, name -> null);

        GatewayConfig config = loader.loadFromStream(yaml(MINIMAL));

        assertThat(config.getRouting().getCooldownMs()).isEqualTo(30000);
        assertThat(config.getRouting().isFallbackToNonLive()).isTrue();
        assertThat(config.getBatch().getRetentionWindowMs()).isEqualTo(259_200_000L);
        assertThat(config.getStreaming().getInternalSecret()).isEqualTo("from-file");
    }

    @Test
    @DisplayName("should let the environment override the secret and the port")
    void shouldApplyEnvironmentOverrides() {
        Map<String, String> env = Map.of(
                ConfigLoader.SECRET_ENV, "from-env",
                ConfigLoader.PORT_ENV, "9191");
        ConfigLoader loader = new ConfigLoader("unused.yaml", validator, env::get);

        GatewayConfig config = loader.loadFromStream(yaml(MINIMAL));

        assertThat(config.getStreaming().getInternalSecret()).isEqualTo("from-env");
        assertThat(config.getServer().getPort()).isEqualTo(9191);
    }

    @Test
    @DisplayName("should reject a non numeric port override")
    void shouldRejectBadPortOverride() {
        ConfigLoader loader = new ConfigLoader("unused.yaml", validator,
                name -> ConfigLoader.PORT_ENV.equals(name) ? "eighty" : null);

        assertThatThrownBy(() -> loader.loadFromStream(yaml(MINIMAL)))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining(ConfigLoader.PORT_ENV);
    }

    @Test
    @DisplayName("should notify listeners with the previous and the new configuration")
    void shouldNotifyListeners() {
        ConfigLoader loader = new ConfigLoader("unused.yaml", validator, name -> null);
        List<GatewayConfig[]> calls = new ArrayList<>();
        loader.addListener((oldConfig, newConfig) -> calls.add(new GatewayConfig[]{oldConfig, newConfig}));

        GatewayConfig first = loader.loadFromStream(yaml(MINIMAL));
        GatewayConfig second = loader.loadFromStream(yaml(MINIMAL));

        assertThat(calls).hasSize(2);
        assertThat(calls.get(0)[0]).isNull();
        assertThat(calls.get(1)[0]).isSameAs(first);
        assertThat(calls.get(1)[1]).isSameAs(second);
    }

    @Test
    @DisplayName("should keep the running configuration when a listener rejects the new one")
    void shouldKeepPreviousOnListenerVeto() throws Exception {
        Path file = workDir.resolve("gateway.yaml");
        Files.writeString(file, MINIMAL, StandardCharsets.UTF_8);
        ConfigLoader loader = new ConfigLoader(file.toString(), validator, name -> null);
        GatewayConfig original = loader.load();
        List<GatewayConfig> applied = new ArrayList<>();
        List<GatewayConfig> rejected = new ArrayList<>();
        loader.addListener(new ConfigChangeListener() {
            @Override
            public void onConfigRejected(GatewayConfig candidate) {
                rejected.add(candidate);
            }

            @Override
            public void onConfigChanged(GatewayConfig oldConfig, GatewayConfig newConfig) {
                applied.add(newConfig);
            }
        });
        loader.addListener(new ConfigChangeListener() {
            @Override
            public void validate(GatewayConfig candidate) {
                if (candidate.getClusters().size() > 1) {
                    throw new ConfigLoader.ConfigurationException("too many clusters");
                }
            }

            @Override
            public void onConfigChanged(GatewayConfig oldConfig, GatewayConfig newConfig) {
                applied.add(newConfig);
            }
        });

        Files.writeString(file, MINIMAL.replace("clusters:\n", "clusters:\n  - name: beta\n    adaptor: fake\n"),
                StandardCharsets.UTF_8);
        GatewayConfig afterReload = loader.reload();

        assertThat(afterReload).isSameAs(original);
        assertThat(loader.getCurrentConfig().getClusters()).hasSize(1);
        assertThat(applied).isEmpty();
        assertThat(rejected).hasSize(1);
    }

    @Test
    @DisplayName("should keep applying to other listeners when one of them fails")
    void shouldIsolateFailingListener() {
        ConfigLoader loader = new ConfigLoader("unused.yaml", validator, name -> null);
        List<String> applied = new ArrayList<>();
        loader.addListener((oldConfig, newConfig) -> applied.add("first"));
        loader.addListener((oldConfig, newConfig) -> {
            throw new IllegalStateException("listener broke");
        });
        loader.addListener((oldConfig, newConfig) -> applied.add("third"));

        GatewayConfig loaded = loader.loadFromStream(yaml(MINIMAL));

        assertThat(applied).containsExactly("first", "third");
        assertThat(loader.getCurrentConfig()).isSameAs(loaded);
    }

    @Test
    @DisplayName("should keep the running configuration when the file becomes malformed")
    void shouldKeepPreviousOnMalformedFile() throws Exception {
        Path file = workDir.resolve("gateway.yaml");
        Files.writeString(file, MINIMAL, StandardCharsets.UTF_8);
        ConfigLoader loader = new ConfigLoader(file.toString(), validator, name -> null);
        GatewayConfig original = loader.load();

        Files.writeString(file, "clusters: [unterminated", StandardCharsets.UTF_8);

        assertThat(loader.reload()).isSameAs(original);
        assertThatThrownBy(loader::load).isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("Malformed configuration");
    }

    @Test
    @DisplayName("should fail when the file cannot be found")
    void shouldFailOnMissingFile() {
        ConfigLoader loader = new ConfigLoader(workDir.resolve("absent.yaml").toString(), validator, name -> null);

        assertThatThrownBy(loader::load)
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("not found");
    }
}
