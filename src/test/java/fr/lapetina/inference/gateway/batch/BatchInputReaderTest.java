package fr.lapetina.inference.gateway.batch;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.inference.gateway.adaptor.BatchRequest;
import fr.lapetina.inference.gateway.domain.model.ApiRoute;
import fr.lapetina.inference.gateway.domain.model.GatewayException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchInputReaderTest {

    @TempDir
    Path workDir;

    private BatchInputReader reader;

    @BeforeEach
    void setUp() {
        reader = new BatchInputReader(new ObjectMapper(), 3);
    }

    private String write(String content) throws IOException {
        Path file = workDir.resolve("input.jsonl");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file.toString();
    }

    @Test
    @DisplayName("should read batch entries and bare bodies, skipping blank lines")
    void shouldReadBothLineForms() throws Exception {
        String file = write("""
                {"custom_id":"a","url":"/v1/embeddings","body":{"model":"m","input":"hi"}}

                {"model":"m","messages":[{"role":"user","content":"hello"}]}
                """);

        List<BatchRequest.Line> lines = reader.read(file);

        assertThat(lines).hasSize(2);
        assertThat(lines.get(0).customId()).isEqualTo("a");
        assertThat(lines.get(0).route()).isEqualTo(ApiRoute.EMBEDDINGS);
        assertThat(lines.get(0).body()).containsEntry("input", "hi");
        assertThat(lines.get(1).customId()).isNull();
        assertThat(lines.get(1).route()).isEqualTo(ApiRoute.CHAT_COMPLETIONS);
    }

    @Test
    @DisplayName("should reject files it cannot use")
    void shouldRejectInvalidFiles() throws Exception {
        assertThatThrownBy(() -> reader.read(workDir.resolve("missing.jsonl").toString()))
                .isInstanceOf(GatewayException.class)
                .hasMessageContaining("not found");
        assertThatThrownBy(() -> reader.read(write("\n\n")))
                .isInstanceOf(GatewayException.class)
                .hasMessageContaining("is empty");
        assertThatThrownBy(() -> reader.read(write("{\"model\":\"m\"}\nnot json\n")))
                .isInstanceOf(GatewayException.class)
                .hasMessageContaining("Line 2");
        assertThatThrownBy(() -> reader.read(write("{}\n{}\n{}\n{}\n")))
                .isInstanceOf(GatewayException.class)
                .hasMessageContaining("exceeds 3 lines");
        assertThatThrownBy(() -> reader.read(write("{\"url\":\"/v1/images\",\"body\":{}}\n")))
                .isInstanceOf(GatewayException.class)
                .hasMessageContaining("unsupported url");
    }
}
