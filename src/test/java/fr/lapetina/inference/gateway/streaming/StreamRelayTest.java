package fr.lapetina.inference.gateway.streaming;

import fr.lapetina.inference.gateway.domain.model.ErrorType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamRelayTest {

    private static final String SECRET = "s3cret";

    private StreamRelay relay;

    @BeforeEach
    void setUp() {
        relay = new StreamRelay(SECRET);
    }

    @Test
    @DisplayName("should feed accepted posts into the open stream in order")
    void shouldRelayChunksInOrder() throws Exception {
        QueueStreamHandle handle = relay.open("log-1");

        assertThat(relay.data(SECRET, "log-1", "data: a")).isEqualTo(StreamRelay.Outcome.ACCEPTED);
        assertThat(relay.data(SECRET, "log-1", "data: b")).isEqualTo(StreamRelay.Outcome.ACCEPTED);
        assertThat(relay.done(SECRET, "log-1")).isEqualTo(StreamRelay.Outcome.ACCEPTED);

        assertThat(handle.poll(Duration.ofSeconds(1)).data()).isEqualTo("data: a");
        assertThat(handle.poll(Duration.ofSeconds(1)).data()).isEqualTo("data: b");
        assertThat(handle.poll(Duration.ofSeconds(1)).kind()).isEqualTo(StreamEvent.Kind.DONE);
        assertThat(relay.openStreams()).isZero();
    }

    @Test
    @DisplayName("should reject a bad secret and fail the targeted stream")
    void shouldRejectBadSecret() throws Exception {
        QueueStreamHandle handle = relay.open("log-1");

        assertThat(relay.data("wrong", "log-1", "data: a")).isEqualTo(StreamRelay.Outcome.UNAUTHORIZED);
        assertThat(relay.data(null, "log-1", "data: a")).isEqualTo(StreamRelay.Outcome.UNAUTHORIZED);

        StreamEvent event = handle.poll(Duration.ofSeconds(1));
        assertThat(event.kind()).isEqualTo(StreamEvent.Kind.ERROR);
        assertThat(event.error().type()).isEqualTo(ErrorType.AUTH_ERROR);
        assertThat(relay.openStreams()).isZero();
    }

    @Test
    @DisplayName("should report posts for streams that are not open")
    void shouldReportUnknownStream() {
        assertThat(relay.data(SECRET, "missing", "data: a")).isEqualTo(StreamRelay.Outcome.UNKNOWN_STREAM);
        assertThat(relay.error(SECRET, "missing", "boom")).isEqualTo(StreamRelay.Outcome.UNKNOWN_STREAM);
    }

    @Test
    @DisplayName("should authenticate nothing when no secret is configured")
    void shouldRejectEverythingWithoutSecret() {
        relay.updateSecret(null);
        relay.open("log-1");

        assertThat(relay.authenticate("")).isFalse();
        assertThat(relay.data("", "log-1", "data: a")).isEqualTo(StreamRelay.Outcome.UNAUTHORIZED);
    }

    @Test
    @DisplayName("should drop the registration when the consumer cancels")
    void shouldUnregisterOnCancel() {
        QueueStreamHandle handle = relay.open("log-1");

        handle.cancel();

        assertThat(relay.openStreams()).isZero();
        assertThat(relay.data(SECRET, "log-1", "data: late")).isEqualTo(StreamRelay.Outcome.UNKNOWN_STREAM);
    }

    @Test
    @DisplayName("should refuse to open the same stream twice")
    void shouldRefuseDuplicateStream() {
        relay.open("log-1");

        assertThatThrownBy(() -> relay.open("log-1")).isInstanceOf(IllegalStateException.class);
    }
}
