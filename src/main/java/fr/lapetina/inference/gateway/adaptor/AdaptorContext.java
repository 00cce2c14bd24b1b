package fr.lapetina.inference.gateway.adaptor;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.inference.gateway.adaptor.fabric.ExecutionFabricClient;
import fr.lapetina.inference.gateway.adaptor.http.OpenAiHttpClient;
import fr.lapetina.inference.gateway.streaming.StreamRelay;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Shared services handed to adaptor factories. One instance per gateway.
 *
 * @param httpClient         outbound client for OpenAI-compatible backends
 * @param fabricClient       client for the remote execution fabric
 * @param scheduler          timer used for task polling
 * @param streamExecutor     runs blocking stream pumps
 * @param relay              receiving end of relayed streams
 * @param relayBaseUrl       URL remote functions post stream chunks to
 * @param fabricPollInterval delay between two task status polls
 * @param objectMapper       shared JSON mapper
 * @param clock              time source
 */
public record AdaptorContext(
        OpenAiHttpClient httpClient,
        ExecutionFabricClient fabricClient,
        ScheduledExecutorService scheduler,
        Executor streamExecutor,
        StreamRelay relay,
        String relayBaseUrl,
        Duration fabricPollInterval,
        ObjectMapper objectMapper,
        Clock clock
) {
}
