package fr.lapetina.inference.gateway.adaptor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.inference.gateway.domain.model.ClusterStatus;
import fr.lapetina.inference.gateway.domain.model.JobInfo;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a get_jobs payload produced by a cluster status function.
 *
 * Job entries missing {@code Framework} or {@code Cluster} inherit the defaults given at
 * construction. Entries without a model are skipped.
 */
public final class JobsPayloadParser {

    private static final Set<String> KNOWN_KEYS = Set.of("Models", "Models Served", "Framework", "Cluster");

    private final ObjectMapper objectMapper;
    private final String defaultFramework;
    private final String defaultCluster;

    public JobsPayloadParser(ObjectMapper objectMapper, String defaultFramework, String defaultCluster) {
        this.objectMapper = objectMapper;
        this.defaultFramework = defaultFramework;
        this.defaultCluster = defaultCluster;
    }

    public ClusterStatus parse(String raw) throws JsonProcessingException {
        JsonNode root = objectMapper.readTree(raw);
        // Status functions sometimes return the payload as a JSON string
        if (root.isTextual()) {
            root = objectMapper.readTree(root.asText());
        }
        if (!root.isObject()) {
            throw new IllegalArgumentException("get_jobs payload is not an object");
        }
        Map<String, Object> clusterStatus = new LinkedHashMap<>();
        JsonNode statusNode = root.path("cluster_status");
        if (statusNode.isObject()) {
            statusNode.fields().forEachRemaining(field -> {
                if (!field.getValue().isNull()) {
                    clusterStatus.put(field.getKey(), objectMapper.convertValue(field.getValue(), Object.class));
                }
            });
        }
        return new ClusterStatus(
                jobs(root.path("running")),
                jobs(root.path("queued")),
                jobs(root.path("stopped")),
                jobs(root.path("others")),
                jobs(root.path("private_batch_running")),
                jobs(root.path("private_batch_queued")),
                clusterStatus
        );
    }

    private List<JobInfo> jobs(JsonNode array) {
        List<JobInfo> jobs = new ArrayList<>();
        if (!array.isArray()) {
            return jobs;
        }
        for (JsonNode node : array) {
            String models = text(node, "Models");
            if (models == null) {
                models = text(node, "Models Served");
            }
            if (models == null || models.isBlank()) {
                continue;
            }
            Map<String, Object> extras = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!KNOWN_KEYS.contains(field.getKey()) && !field.getValue().isNull()) {
                    extras.put(field.getKey(), objectMapper.convertValue(field.getValue(), Object.class));
                }
            }
            String framework = text(node, "Framework");
            String cluster = text(node, "Cluster");
            jobs.add(new JobInfo(models,
                    framework != null ? framework : defaultFramework,
                    cluster != null ? cluster : defaultCluster,
                    extras));
        }
        return jobs;
    }

    private static String text(JsonNode node, String key) {
        JsonNode value = node.get(key);
        return value == null || value.isNull() ? null : value.asText();
    }
}
