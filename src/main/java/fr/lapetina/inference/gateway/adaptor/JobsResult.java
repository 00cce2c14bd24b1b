package fr.lapetina.inference.gateway.adaptor;

import fr.lapetina.inference.gateway.domain.model.ClusterStatus;
import fr.lapetina.inference.gateway.domain.model.GatewayError;

import java.util.Objects;

/**
 * Outcome of a get_jobs call.
 */
public sealed interface JobsResult permits JobsResult.Jobs, JobsResult.Failure {

    record Jobs(ClusterStatus status) implements JobsResult {
        public Jobs {
            Objects.requireNonNull(status, "Status is required");
        }
    }

    record Failure(GatewayError error) implements JobsResult {
        public Failure {
            Objects.requireNonNull(error, "Error is required");
        }
    }
}
