package fr.lapetina.inference.gateway.status;

import fr.lapetina.inference.gateway.domain.model.ClusterStatus;
import fr.lapetina.inference.gateway.domain.model.GatewayError;

import java.time.Duration;
import java.time.Instant;

/**
 * Last known status of one cluster.
 *
 * @param status      last successful get_jobs payload, null if none succeeded yet
 * @param refreshedAt time of that success, null if none
 * @param lastError   error of the latest refresh attempt, null when it succeeded
 */
public record ClusterStatusEntry(ClusterStatus status, Instant refreshedAt, GatewayError lastError) {

    public boolean isFresh(Instant now, Duration stalenessBound) {
        return status != null && refreshedAt != null && !now.isAfter(refreshedAt.plus(stalenessBound));
    }
}
