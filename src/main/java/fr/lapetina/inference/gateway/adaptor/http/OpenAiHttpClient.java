package fr.lapetina.inference.gateway.adaptor.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.inference.gateway.adaptor.AdaptorErrors;
import fr.lapetina.inference.gateway.adaptor.AdaptorErrors.BackendException;
import fr.lapetina.inference.gateway.adaptor.TaskResult;
import fr.lapetina.inference.gateway.domain.model.ErrorType;
import fr.lapetina.inference.gateway.domain.model.GatewayError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * HTTP client for OpenAI-compatible backends.
 *
 * Uses java.net.http.HttpClient for non-blocking I/O. Failures are returned as
 * {@link TaskResult.Failure}, never thrown.
 */
public class OpenAiHttpClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OpenAiHttpClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public OpenAiHttpClient(Duration connectTimeout, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    /**
     * Posts a non-streaming request and returns the raw response body.
     *
     * @param target    name used in logs and error messages
     * @param requestId gateway request id, forwarded as {@code X-Request-ID}
     */
    public CompletableFuture<TaskResult> post(String target, URI uri, String apiKey,
                                              Map<String, Object> body, String requestId) {
        HttpRequest httpRequest;
        try {
            httpRequest = buildPost(uri, apiKey, body, requestId, "application/json");
        } catch (JsonProcessingException e) {
            log.error("Failed to build request: target={}, requestId={}", target, requestId, e);
            return CompletableFuture.completedFuture(TaskResult.failure(ErrorType.VALIDATION_ERROR,
                    "Failed to encode request: " + e.getOriginalMessage()));
        }
        Instant startTime = Instant.now();
        log.info("Sending request: target={}, requestId={}, uri={}", target, requestId, uri);

        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> handleResponse(target, requestId, response, startTime))
                .exceptionally(ex -> handleException(target, requestId, ex));
    }

    /**
     * Opens a server-sent events stream. The future completes once the response
     * headers are in; a non-2xx status completes it with {@link BackendException}.
     */
    public CompletableFuture<HttpResponse<Stream<String>>> openStream(URI uri, String apiKey,
                                                                      Map<String, Object> body, String requestId) {
        HttpRequest httpRequest;
        try {
            httpRequest = buildPost(uri, apiKey, body, requestId, "text/event-stream");
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(e);
        }
        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofLines())
                .thenApply(response -> {
                    int status = response.statusCode();
                    if (status >= 200 && status < 300) {
                        return response;
                    }
                    StringBuilder errorBody = new StringBuilder();
                    try (Stream<String> lines = response.body()) {
                        lines.limit(20).forEach(errorBody::append);
                    }
                    throw new BackendException(status, extractErrorMessage(status, errorBody.toString()));
                });
    }

    /**
     * Fetches a JSON document, typically a status page.
     */
    public CompletableFuture<JsonNode> getJson(URI uri, String apiKey, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET();
        if (apiKey != null) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return httpClient.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> {
                    if (response.statusCode() != 200) {
                        throw new BackendException(response.statusCode(),
                                extractErrorMessage(response.statusCode(), response.body()));
                    }
                    try {
                        return objectMapper.readTree(response.body());
                    } catch (JsonProcessingException e) {
                        throw new BackendException(502, "Malformed JSON from " + uri + ": " + e.getOriginalMessage());
                    }
                });
    }

    private HttpRequest buildPost(URI uri, String apiKey, Map<String, Object> body, String requestId,
                                  String accept) throws JsonProcessingException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .header("Content-Type", "application/json")
                .header("Accept", accept)
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)));
        if (requestId != null) {
            builder.header("X-Request-ID", requestId);
        }
        if (apiKey != null) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder.build();
    }

    private TaskResult handleResponse(String target, String requestId, HttpResponse<String> response,
                                      Instant startTime) {
        long latencyMs = Duration.between(startTime, Instant.now()).toMillis();
        int statusCode = response.statusCode();

        if (statusCode >= 200 && statusCode < 300) {
            log.info("Request successful: target={}, requestId={}, status={}, latencyMs={}",
                    target, requestId, statusCode, latencyMs);
            return new TaskResult.Success(response.body(), statusCode, null);
        }
        log.warn("Request failed with HTTP error: target={}, requestId={}, status={}, latencyMs={}",
                target, requestId, statusCode, latencyMs);
        return TaskResult.failure(new GatewayError(ErrorType.ADAPTOR_ERROR,
                extractErrorMessage(statusCode, response.body()), statusCode));
    }

    private TaskResult handleException(String target, String requestId, Throwable ex) {
        GatewayError error = AdaptorErrors.classify(ex, target);
        Throwable cause = AdaptorErrors.unwrap(ex);
        if (error.type() == ErrorType.ADAPTOR_TIMEOUT) {
            log.error("Request timeout: target={}, requestId={}, error={}", target, requestId, cause.getMessage());
        } else {
            log.error("Backend connection error: target={}, requestId={}, errorType={}, error={}",
                    target, requestId, cause.getClass().getSimpleName(), cause.getMessage());
        }
        return TaskResult.failure(error);
    }

    /**
     * Pulls {@code error.message} (or a string {@code error}) out of an OpenAI error body.
     */
    String extractErrorMessage(int statusCode, String body) {
        String fallback = "HTTP " + statusCode;
        if (body == null || body.isBlank()) {
            return fallback;
        }
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            if (error.isTextual()) {
                return error.asText();
            }
            String message = error.path("message").asText(null);
            if (message != null) {
                return message;
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: status={}", statusCode);
        }
        return fallback + ": " + (body.length() > 200 ? body.substring(0, 200) : body);
    }

    @Override
    public void close() {
        // HttpClient is not AutoCloseable before Java 21
    }
}
