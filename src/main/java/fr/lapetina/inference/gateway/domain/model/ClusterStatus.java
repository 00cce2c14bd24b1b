package fr.lapetina.inference.gateway.domain.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Snapshot of which models a cluster is running, queueing or has stopped.
 */
public record ClusterStatus(
        List<JobInfo> running,
        List<JobInfo> queued,
        List<JobInfo> stopped,
        List<JobInfo> others,
        List<JobInfo> privateBatchRunning,
        List<JobInfo> privateBatchQueued,
        Map<String, Object> clusterStatus
) {
    public ClusterStatus {
        running = running != null ? List.copyOf(running) : List.of();
        queued = queued != null ? List.copyOf(queued) : List.of();
        stopped = stopped != null ? List.copyOf(stopped) : List.of();
        others = others != null ? List.copyOf(others) : List.of();
        privateBatchRunning = privateBatchRunning != null ? List.copyOf(privateBatchRunning) : List.of();
        privateBatchQueued = privateBatchQueued != null ? List.copyOf(privateBatchQueued) : List.of();
        clusterStatus = clusterStatus != null ? Map.copyOf(clusterStatus) : Map.of();
    }

    public static ClusterStatus ofRunning(List<JobInfo> running) {
        return new ClusterStatus(running, null, null, null, null, null, null);
    }

    /**
     * Availability of {@code model} under {@code framework}. Running wins over queued,
     * which wins over stopped; a model absent from every list is reported stopped.
     */
    public ModelAvailability availabilityOf(String framework, String model) {
        if (anyServes(running, framework, model)) {
            return ModelAvailability.LIVE;
        }
        if (anyServes(queued, framework, model)) {
            return ModelAvailability.QUEUED;
        }
        return ModelAvailability.STOPPED;
    }

    private static boolean anyServes(List<JobInfo> jobs, String framework, String model) {
        for (JobInfo job : jobs) {
            if (job.serves(framework, model)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Wire form of the get_jobs payload.
     */
    public Map<String, Object> toPayload() {
        Function<List<JobInfo>, List<Map<String, Object>>> convert =
                jobs -> jobs.stream().map(JobInfo::toPayload).toList();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("running", convert.apply(running));
        payload.put("queued", convert.apply(queued));
        payload.put("stopped", convert.apply(stopped));
        payload.put("others", convert.apply(others));
        payload.put("private_batch_running", convert.apply(privateBatchRunning));
        payload.put("private_batch_queued", convert.apply(privateBatchQueued));
        payload.put("cluster_status", clusterStatus);
        return payload;
    }
}
