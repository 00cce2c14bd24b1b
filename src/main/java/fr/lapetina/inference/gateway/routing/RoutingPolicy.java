package fr.lapetina.inference.gateway.routing;

import fr.lapetina.inference.gateway.infrastructure.config.GatewayConfig;

import java.time.Duration;

/**
 * Router settings in effect for one request.
 *
 * @param maxAttempts       cap on targets tried per request, 0 for every candidate
 * @param staleness         age after which a cluster status counts as unknown
 * @param adaptorTimeout    bound on each adaptor call
 * @param fallbackToNonLive try queued, unknown and stopped targets when none is live
 */
public record RoutingPolicy(int maxAttempts, Duration staleness, Duration adaptorTimeout, boolean fallbackToNonLive) {

    public static RoutingPolicy from(GatewayConfig.RoutingConfig config) {
        return new RoutingPolicy(
                config.getMaxAttempts(),
                Duration.ofMillis(config.getStalenessMs()),
                Duration.ofMillis(config.getAdaptorTimeoutMs()),
                config.isFallbackToNonLive()
        );
    }

    public int attemptLimit(int candidates) {
        return maxAttempts <= 0 ? candidates : Math.min(maxAttempts, candidates);
    }
}
