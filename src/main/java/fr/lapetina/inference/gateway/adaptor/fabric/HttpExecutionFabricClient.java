package fr.lapetina.inference.gateway.adaptor.fabric;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.inference.gateway.adaptor.AdaptorErrors.BackendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * REST client for the execution fabric.
 *
 * <pre>
 * POST   {base}/endpoints/{endpoint}/tasks    {"function_id", "kwargs", "options"} -> {"task_id"}
 * POST   {base}/endpoints/{endpoint}/batch    {"function_id", "kwargs_list", "options"} -> {"batch_id", "task_ids"}
 * GET    {base}/endpoints/{endpoint}/status   -> {"status", "details": {"managers"}}
 * GET    {base}/tasks/{task}                  -> {"task_id", "status", "result", "exception"}
 * DELETE {base}/tasks/{task}
 * </pre>
 */
public class HttpExecutionFabricClient implements ExecutionFabricClient {

    private static final Logger log = LoggerFactory.getLogger(HttpExecutionFabricClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String accessToken;
    private final Duration requestTimeout;

    public HttpExecutionFabricClient(String baseUrl, String accessToken, Duration requestTimeout,
                                     ObjectMapper objectMapper) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.accessToken = accessToken;
        this.requestTimeout = requestTimeout;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    @Override
    public CompletableFuture<String> submitFunction(String endpointId, String functionId,
                                                    Map<String, Object> kwargs, Map<String, Object> options) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("function_id", functionId);
        body.put("kwargs", kwargs);
        body.put("options", options);
        return send(post("/endpoints/" + encode(endpointId) + "/tasks", body))
                .thenApply(json -> {
                    String taskId = json.path("task_id").asText(null);
                    if (taskId == null) {
                        throw new BackendException(502, "Fabric returned no task id for endpoint " + endpointId);
                    }
                    log.debug("Fabric task submitted: endpointId={}, functionId={}, taskId={}",
                            endpointId, functionId, taskId);
                    return taskId;
                });
    }

    @Override
    public CompletableFuture<FabricTask> getTask(String taskId) {
        return send(request("/tasks/" + encode(taskId)).GET().build())
                .thenApply(json -> new FabricTask(
                        taskId,
                        FabricTask.State.fromWire(json.path("status").asText(null)),
                        textOrJson(json.get("result")),
                        textOrJson(json.get("exception"))
                ));
    }

    @Override
    public CompletableFuture<FabricEndpointStatus> getEndpointStatus(String endpointId) {
        return send(request("/endpoints/" + encode(endpointId) + "/status").GET().build())
                .thenApply(json -> {
                    JsonNode managers = json.path("details").path("managers");
                    if (managers.isMissingNode()) {
                        managers = json.path("managers");
                    }
                    return new FabricEndpointStatus(json.path("status").asText("unknown"), managers.asInt(0));
                });
    }

    @Override
    public CompletableFuture<FabricBatch> submitBatch(String endpointId, String functionId,
                                                      List<Map<String, Object>> kwargsList,
                                                      Map<String, Object> options) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("function_id", functionId);
        body.put("kwargs_list", kwargsList);
        body.put("options", options);
        return send(post("/endpoints/" + encode(endpointId) + "/batch", body))
                .thenApply(json -> {
                    List<String> taskIds = new ArrayList<>();
                    json.path("task_ids").forEach(node -> taskIds.add(node.asText()));
                    if (taskIds.size() != kwargsList.size()) {
                        throw new BackendException(502, "Fabric returned " + taskIds.size()
                                + " task ids for " + kwargsList.size() + " inputs");
                    }
                    return new FabricBatch(json.path("batch_id").asText(null), taskIds);
                });
    }

    @Override
    public CompletableFuture<Void> cancelTask(String taskId) {
        return send(request("/tasks/" + encode(taskId)).DELETE().build())
                .thenAccept(json -> log.debug("Fabric task cancelled: taskId={}", taskId));
    }

    private HttpRequest post(String path, Object body) {
        try {
            return request(path)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                    .build();
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private HttpRequest.Builder request(String path) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout)
                .header("Accept", "application/json");
        if (accessToken != null) {
            builder.header("Authorization", "Bearer " + accessToken);
        }
        return builder;
    }

    private CompletableFuture<JsonNode> send(HttpRequest request) {
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> {
                    int status = response.statusCode();
                    if (status < 200 || status >= 300) {
                        log.warn("Fabric call failed: method={}, uri={}, status={}",
                                request.method(), request.uri(), status);
                        throw new BackendException(status, "Fabric returned HTTP " + status + ": "
                                + abbreviate(response.body()));
                    }
                    String body = response.body();
                    if (body == null || body.isBlank()) {
                        return objectMapper.createObjectNode();
                    }
                    try {
                        return objectMapper.readTree(body);
                    } catch (JsonProcessingException e) {
                        throw new BackendException(502, "Fabric returned malformed JSON: " + e.getOriginalMessage());
                    }
                });
    }

    private static String textOrJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return node.isTextual() ? node.asText() : node.toString();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
