package fr.lapetina.inference.gateway.adaptor.fabric;

import fr.lapetina.inference.gateway.adaptor.AdaptorContext;
import fr.lapetina.inference.gateway.adaptor.AdaptorErrors;
import fr.lapetina.inference.gateway.adaptor.AdaptorSettings;
import fr.lapetina.inference.gateway.adaptor.BatchRequest;
import fr.lapetina.inference.gateway.adaptor.BatchStatusResult;
import fr.lapetina.inference.gateway.adaptor.BatchSubmitResult;
import fr.lapetina.inference.gateway.adaptor.EndpointAdaptor;
import fr.lapetina.inference.gateway.adaptor.EndpointStatus;
import fr.lapetina.inference.gateway.adaptor.StreamResult;
import fr.lapetina.inference.gateway.adaptor.TaskResult;
import fr.lapetina.inference.gateway.domain.model.BatchJob;
import fr.lapetina.inference.gateway.domain.model.BatchLineResult;
import fr.lapetina.inference.gateway.domain.model.BatchStatus;
import fr.lapetina.inference.gateway.domain.model.Endpoint;
import fr.lapetina.inference.gateway.domain.model.ErrorType;
import fr.lapetina.inference.gateway.domain.model.GatewayError;
import fr.lapetina.inference.gateway.domain.model.Identity;
import fr.lapetina.inference.gateway.domain.model.InferenceRequest;
import fr.lapetina.inference.gateway.streaming.QueueStreamHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Endpoint served by a function registered on the execution fabric. The function
 * starts (or reuses) a model server on the compute node and forwards the request to it.
 *
 * <p>Settings:
 * <ul>
 *   <li>{@code endpoint-id}, {@code function-id} - fabric endpoint and inference function (required)</li>
 *   <li>{@code api-port} - port of the model server on the compute node, default 8000</li>
 *   <li>{@code batch-endpoint-id}, {@code batch-function-id} - enable batch support when both are set</li>
 *   <li>{@code trigger-grace-seconds} - how long a cold endpoint is considered to be loading, default 600</li>
 *   <li>{@code task-timeout-seconds} - give up polling a task after this long, default 1800</li>
 * </ul>
 */
public class RemoteExecutionEndpointAdaptor implements EndpointAdaptor {

    private static final Logger log = LoggerFactory.getLogger(RemoteExecutionEndpointAdaptor.class);

    private final Endpoint endpoint;
    private final AdaptorContext context;
    private final ExecutionFabricClient fabric;
    private final boolean checkManagers;

    protected final AdaptorSettings settings;
    private final String endpointId;
    private final String functionId;
    private final int apiPort;
    private final String batchEndpointId;
    private final String batchFunctionId;
    private final Duration triggerGrace;
    private final Duration taskTimeout;

    private final AtomicReference<Instant> lastTriggered = new AtomicReference<>();

    public RemoteExecutionEndpointAdaptor(Endpoint endpoint, AdaptorContext context) {
        this(endpoint, context, true);
    }

    protected RemoteExecutionEndpointAdaptor(Endpoint endpoint, AdaptorContext context, boolean checkManagers) {
        this.endpoint = endpoint;
        this.context = context;
        this.fabric = context.fabricClient();
        this.checkManagers = checkManagers;
        this.settings = new AdaptorSettings("endpoint " + endpoint.slug(), endpoint.config());
        this.endpointId = settings.require("endpoint-id");
        this.functionId = settings.require("function-id");
        this.apiPort = settings.intValue("api-port", 8000);
        this.batchEndpointId = settings.optional("batch-endpoint-id", null);
        this.batchFunctionId = settings.optional("batch-function-id", null);
        this.triggerGrace = Duration.ofSeconds(settings.longValue("trigger-grace-seconds", 600));
        this.taskTimeout = Duration.ofSeconds(settings.longValue("task-timeout-seconds", 1800));
    }

    @Override
    public Endpoint endpoint() {
        return endpoint;
    }

    @Override
    public CompletableFuture<TaskResult> submitTask(InferenceRequest request) {
        return readiness()
                .thenCompose(notReady -> {
                    if (notReady != null) {
                        return CompletableFuture.completedFuture(TaskResult.failure(notReady));
                    }
                    Map<String, Object> kwargs = Map.of("model_params", modelParams(request.backendPayload(false),
                            request.route().path()));
                    return fabric.submitFunction(endpointId, functionId, kwargs, taskOptions())
                            .thenCompose(taskId -> {
                                markTriggered();
                                log.info("Task submitted: endpoint={}, requestId={}, taskId={}",
                                        endpoint.slug(), request.requestId(), taskId);
                                return awaitTask(taskId);
                            })
                            .thenApply(this::toTaskResult);
                })
                .exceptionally(ex -> {
                    GatewayError error = AdaptorErrors.classify(ex, endpoint.slug());
                    log.warn("Task failed: endpoint={}, requestId={}, errorType={}, error={}",
                            endpoint.slug(), request.requestId(), error.type(), error.message());
                    return TaskResult.failure(error);
                });
    }

    @Override
    public CompletableFuture<StreamResult> submitStreamingTask(InferenceRequest request, String requestLogId) {
        return readiness()
                .thenCompose(notReady -> {
                    if (notReady != null) {
                        return CompletableFuture.completedFuture(StreamResult.failure(notReady));
                    }
                    QueueStreamHandle handle = context.relay().open(requestLogId);
                    Map<String, Object> params = modelParams(request.backendPayload(true), request.route().path());
                    Map<String, Object> streamingServer = new LinkedHashMap<>();
                    streamingServer.put("url", context.relayBaseUrl());
                    streamingServer.put("task_id", requestLogId);
                    params.put("streaming_server", streamingServer);

                    return fabric.submitFunction(endpointId, functionId, Map.of("model_params", params), taskOptions())
                            .thenApply(taskId -> {
                                markTriggered();
                                log.info("Streaming task submitted: endpoint={}, requestId={}, streamId={}, taskId={}",
                                        endpoint.slug(), request.requestId(), requestLogId, taskId);
                                handle.onCancel(() -> cancelQuietly(taskId));
                                awaitTask(taskId).whenComplete((task, ex) -> settleStream(requestLogId, taskId, task, ex));
                                return StreamResult.opened(handle, taskId);
                            })
                            .exceptionally(ex -> {
                                GatewayError error = AdaptorErrors.classify(ex, endpoint.slug());
                                context.relay().failQuietly(requestLogId, error);
                                return StreamResult.failure(error);
                            });
                })
                .exceptionally(ex -> StreamResult.failure(AdaptorErrors.classify(ex, endpoint.slug())));
    }

    @Override
    public CompletableFuture<EndpointStatus> endpointStatus() {
        return fabric.getEndpointStatus(endpointId)
                .thenApply(status -> status.isOnline()
                        ? new EndpointStatus(true, "online, managers=" + status.managers())
                        : EndpointStatus.offline(status.status()))
                .exceptionally(ex -> EndpointStatus.offline(AdaptorErrors.classify(ex, endpoint.slug()).message()));
    }

    @Override
    public boolean hasBatchEnabled() {
        return batchEndpointId != null && batchFunctionId != null;
    }

    @Override
    public CompletableFuture<BatchSubmitResult> submitBatch(BatchRequest request, Identity identity) {
        if (!hasBatchEnabled()) {
            return EndpointAdaptor.super.submitBatch(request, identity);
        }
        List<Map<String, Object>> kwargsList = new ArrayList<>(request.lines().size());
        for (BatchRequest.Line line : request.lines()) {
            Map<String, Object> body = new LinkedHashMap<>(line.body());
            InferenceRequest.INTERNAL_FIELDS.forEach(body::remove);
            body.put("model", endpoint.model());
            body.put("stream", false);
            kwargsList.add(Map.of("model_params", modelParams(body, line.route().path())));
        }
        return fabric.submitBatch(batchEndpointId, batchFunctionId, kwargsList, batchOptions(identity))
                .<BatchSubmitResult>thenApply(batch -> {
                    log.info("Batch submitted: endpoint={}, batchId={}, backendBatchId={}, tasks={}",
                            endpoint.slug(), request.batchId(), batch.batchId(), batch.taskIds().size());
                    return new BatchSubmitResult.Accepted(batch.batchId(), batch.taskIds());
                })
                .exceptionally(ex -> new BatchSubmitResult.Failure(AdaptorErrors.classify(ex, endpoint.slug())));
    }

    @Override
    public CompletableFuture<BatchStatusResult> getBatchStatus(BatchJob job) {
        if (!hasBatchEnabled()) {
            return EndpointAdaptor.super.getBatchStatus(job);
        }
        List<String> taskIds = job.taskIds();
        if (taskIds.isEmpty()) {
            return CompletableFuture.completedFuture(new BatchStatusResult.Failure(
                    GatewayError.of(ErrorType.ADAPTOR_ERROR, "Batch " + job.id() + " has no tasks"), true));
        }
        List<CompletableFuture<FabricTask>> polls = taskIds.stream().map(fabric::getTask).toList();
        return CompletableFuture.allOf(polls.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> aggregate(polls.stream().map(CompletableFuture::join).toList()))
                .exceptionally(ex -> new BatchStatusResult.Failure(AdaptorErrors.classify(ex, endpoint.slug()), false));
    }

    /**
     * Folds per-task states into one batch status. The batch is finished only when
     * every task is terminal; it counts as running as soon as one task has started.
     */
    static BatchStatusResult aggregate(List<FabricTask> tasks) {
        int terminal = 0;
        boolean started = false;
        for (FabricTask task : tasks) {
            if (task.isTerminal()) {
                terminal++;
            }
            started |= task.hasStarted();
        }
        if (terminal < tasks.size()) {
            return new BatchStatusResult.Progress(started ? BatchStatus.RUNNING : BatchStatus.PENDING,
                    terminal, tasks.size());
        }
        List<BatchLineResult> lines = new ArrayList<>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            FabricTask task = tasks.get(i);
            if (task.state() == FabricTask.State.SUCCESS) {
                lines.add(BatchLineResult.success(i, task.taskId(), task.result() != null ? task.result() : ""));
            } else {
                String message = task.state() == FabricTask.State.UNKNOWN
                        ? "Task " + task.taskId() + " status unknown"
                        : "Task " + task.taskId() + " failed: " + task.error();
                lines.add(BatchLineResult.failure(i, task.taskId(), GatewayError.of(ErrorType.ADAPTOR_ERROR, message)));
            }
        }
        return new BatchStatusResult.Finished(lines);
    }

    /**
     * Fabric options attached to interactive tasks.
     */
    protected Map<String, Object> taskOptions() {
        return Map.of();
    }

    /**
     * Fabric options attached to batch submissions.
     */
    protected Map<String, Object> batchOptions(Identity identity) {
        return Map.of("username", identity.username());
    }

    private Map<String, Object> modelParams(Map<String, Object> body, String routePath) {
        Map<String, Object> params = new LinkedHashMap<>(body);
        params.put("openai_endpoint", routePath);
        params.put("api_port", apiPort);
        return params;
    }

    /**
     * Completes with {@code null} when the endpoint can take a task, or with the error
     * to report otherwise.
     */
    private CompletableFuture<GatewayError> readiness() {
        return fabric.getEndpointStatus(endpointId).thenApply(status -> {
            if (!status.isOnline()) {
                return GatewayError.of(ErrorType.UNAVAILABLE, "Endpoint " + endpoint.slug() + " is offline.");
            }
            if (checkManagers && !status.hasResources() && recentlyTriggered()) {
                return GatewayError.of(ErrorType.UNAVAILABLE, "Endpoint " + endpoint.slug()
                        + " online but not ready to receive tasks. Please try again later.");
            }
            return null;
        });
    }

    private boolean recentlyTriggered() {
        Instant triggered = lastTriggered.get();
        return triggered != null && context.clock().instant().isBefore(triggered.plus(triggerGrace));
    }

    private void markTriggered() {
        lastTriggered.set(context.clock().instant());
    }

    CompletableFuture<FabricTask> awaitTask(String taskId) {
        CompletableFuture<FabricTask> result = new CompletableFuture<>();
        Instant deadline = context.clock().instant().plus(taskTimeout);
        poll(taskId, deadline, result);
        return result;
    }

    private void poll(String taskId, Instant deadline, CompletableFuture<FabricTask> result) {
        fabric.getTask(taskId).whenComplete((task, ex) -> {
            if (ex != null) {
                result.completeExceptionally(ex);
            } else if (task.isTerminal()) {
                result.complete(task);
            } else if (!context.clock().instant().isBefore(deadline)) {
                result.completeExceptionally(new TimeoutException("Task " + taskId + " still "
                        + task.state() + " after " + taskTimeout.toSeconds() + "s"));
            } else {
                context.scheduler().schedule(() -> poll(taskId, deadline, result),
                        context.fabricPollInterval().toMillis(), TimeUnit.MILLISECONDS);
            }
        });
    }

    private TaskResult toTaskResult(FabricTask task) {
        return switch (task.state()) {
            case SUCCESS -> TaskResult.success(task.result() != null ? task.result() : "", task.taskId());
            case FAILED -> TaskResult.failure(ErrorType.ADAPTOR_ERROR,
                    "Task " + task.taskId() + " failed: " + task.error());
            default -> TaskResult.failure(ErrorType.ADAPTOR_ERROR,
                    "Task " + task.taskId() + " ended in state " + task.state());
        };
    }

    /**
     * Ends the relay stream once the remote task is over, in case the function never
     * posted its own done or error event.
     */
    private void settleStream(String streamId, String taskId, FabricTask task, Throwable ex) {
        if (ex != null) {
            context.relay().failQuietly(streamId, AdaptorErrors.classify(ex, endpoint.slug()));
        } else if (task.state() == FabricTask.State.SUCCESS) {
            context.relay().completeQuietly(streamId);
        } else {
            context.relay().failQuietly(streamId, GatewayError.of(ErrorType.ADAPTOR_ERROR,
                    "Task " + taskId + " ended in state " + task.state() + ": " + task.error()));
        }
    }

    private void cancelQuietly(String taskId) {
        fabric.cancelTask(taskId).whenComplete((ignored, ex) -> {
            if (ex != null) {
                log.warn("Task cancel failed: endpoint={}, taskId={}, error={}",
                        endpoint.slug(), taskId, AdaptorErrors.unwrap(ex).getMessage());
            } else {
                log.info("Task cancelled: endpoint={}, taskId={}", endpoint.slug(), taskId);
            }
        });
    }
}
