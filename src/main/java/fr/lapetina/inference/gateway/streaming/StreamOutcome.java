package fr.lapetina.inference.gateway.streaming;

import fr.lapetina.inference.gateway.domain.model.GatewayError;
import fr.lapetina.inference.gateway.domain.model.UsageStats;

/**
 * How a proxied stream ended.
 *
 * @param state   terminal state
 * @param error   failure cause, null unless FAILED
 * @param started whether the client sink was opened; when false nothing was written
 *                and the caller must answer with a plain error response
 * @param chunks  number of data lines forwarded, excluding the closing marker
 * @param usage   token usage parsed from the forwarded chunks
 */
public record StreamOutcome(
        StreamSession.State state,
        GatewayError error,
        boolean started,
        int chunks,
        UsageStats usage
) {
}
