package fr.lapetina.inference.gateway.support;

import fr.lapetina.inference.gateway.adaptor.BatchRequest;
import fr.lapetina.inference.gateway.adaptor.BatchStatusResult;
import fr.lapetina.inference.gateway.adaptor.BatchSubmitResult;
import fr.lapetina.inference.gateway.adaptor.EndpointAdaptor;
import fr.lapetina.inference.gateway.adaptor.EndpointStatus;
import fr.lapetina.inference.gateway.adaptor.StreamResult;
import fr.lapetina.inference.gateway.adaptor.TaskResult;
import fr.lapetina.inference.gateway.domain.model.BatchJob;
import fr.lapetina.inference.gateway.domain.model.BatchStatus;
import fr.lapetina.inference.gateway.domain.model.Endpoint;
import fr.lapetina.inference.gateway.domain.model.Identity;
import fr.lapetina.inference.gateway.domain.model.InferenceRequest;
import fr.lapetina.inference.gateway.streaming.QueueStreamHandle;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Endpoint adaptor whose behaviour is set by the test.
 *
 * <p>By default every call succeeds: the synchronous answer is {@link #completionBody(String)},
 * streams emit {@link #streamChunks(String)} and batches are accepted, then reported running.
 */
public final class FakeEndpointAdaptor implements EndpointAdaptor {

    private volatile Endpoint endpoint;
    private volatile Function<InferenceRequest, CompletableFuture<TaskResult>> taskBehavior;
    private volatile BiFunction<InferenceRequest, String, CompletableFuture<StreamResult>> streamBehavior;
    private volatile Function<BatchRequest, BatchSubmitResult> batchSubmitBehavior;
    private volatile Function<BatchJob, BatchStatusResult> batchStatusBehavior;
    private volatile EndpointStatus status = EndpointStatus.ONLINE;
    private volatile boolean batchEnabled = true;

    private final AtomicInteger taskCalls = new AtomicInteger();
    private final AtomicInteger streamCalls = new AtomicInteger();
    private final AtomicInteger batchStatusCalls = new AtomicInteger();
    private final List<QueueStreamHandle> openedStreams = new CopyOnWriteArrayList<>();
    private final List<BatchRequest> submittedBatches = new CopyOnWriteArrayList<>();

    FakeEndpointAdaptor(Endpoint endpoint) {
        this.endpoint = endpoint;
        reset();
    }

    FakeEndpointAdaptor rebind(Endpoint endpoint) {
        this.endpoint = endpoint;
        return this;
    }

    /**
     * Restores the default behaviour and clears the counters.
     */
    public void reset() {
        taskBehavior = request -> CompletableFuture.completedFuture(
                TaskResult.success(completionBody(endpoint.slug()), "task-" + taskCalls.get()));
        streamBehavior = (request, requestLogId) -> {
            QueueStreamHandle handle = new QueueStreamHandle(requestLogId);
            openedStreams.add(handle);
            for (String chunk : streamChunks(endpoint.slug())) {
                handle.emit(chunk);
            }
            handle.complete();
            return CompletableFuture.completedFuture(StreamResult.opened(handle, "stream-" + requestLogId));
        };
        batchSubmitBehavior = request -> {
            List<String> taskIds = new ArrayList<>();
            for (int i = 0; i < request.lines().size(); i++) {
                taskIds.add(request.batchId() + "-task-" + i);
            }
            return new BatchSubmitResult.Accepted("backend-" + request.batchId(), taskIds);
        };
        batchStatusBehavior = job -> new BatchStatusResult.Progress(BatchStatus.RUNNING, 0, job.taskIds().size());
        status = EndpointStatus.ONLINE;
        batchEnabled = true;
        taskCalls.set(0);
        streamCalls.set(0);
        batchStatusCalls.set(0);
        openedStreams.clear();
        submittedBatches.clear();
    }

    /**
     * OpenAI chat completion body answering {@code "Hello from <slug>"}.
     */
    public static String completionBody(String slug) {
        return "{\"id\":\"cmpl-1\",\"object\":\"chat.completion\",\"choices\":[{\"index\":0,"
                + "\"message\":{\"role\":\"assistant\",\"content\":\"Hello from " + slug + "\"},"
                + "\"finish_reason\":\"stop\"}],"
                + "\"usage\":{\"prompt_tokens\":5,\"completion_tokens\":4,\"total_tokens\":9}}";
    }

    /**
     * SSE data lines whose concatenated deltas equal the content of {@link #completionBody(String)}.
     */
    public static List<String> streamChunks(String slug) {
        return List.of(
                chunk("Hello"),
                chunk(" from"),
                chunk(" " + slug),
                "data: {\"object\":\"chat.completion.chunk\",\"choices\":[],"
                        + "\"usage\":{\"prompt_tokens\":5,\"completion_tokens\":4,\"total_tokens\":9}}",
                "data: [DONE]"
        );
    }

    private static String chunk(String content) {
        return "data: {\"object\":\"chat.completion.chunk\",\"choices\":[{\"index\":0,"
                + "\"delta\":{\"content\":\"" + content + "\"}}]}";
    }

    public void onTask(Function<InferenceRequest, CompletableFuture<TaskResult>> behavior) {
        this.taskBehavior = behavior;
    }

    public void onStream(BiFunction<InferenceRequest, String, CompletableFuture<StreamResult>> behavior) {
        this.streamBehavior = behavior;
    }

    public void onBatchSubmit(Function<BatchRequest, BatchSubmitResult> behavior) {
        this.batchSubmitBehavior = behavior;
    }

    public void onBatchStatus(Function<BatchJob, BatchStatusResult> behavior) {
        this.batchStatusBehavior = behavior;
    }

    public void setStatus(EndpointStatus status) {
        this.status = status;
    }

    public void setBatchEnabled(boolean batchEnabled) {
        this.batchEnabled = batchEnabled;
    }

    public int taskCalls() {
        return taskCalls.get();
    }

    public int streamCalls() {
        return streamCalls.get();
    }

    public int batchStatusCalls() {
        return batchStatusCalls.get();
    }

    public List<QueueStreamHandle> openedStreams() {
        return openedStreams;
    }

    public List<BatchRequest> submittedBatches() {
        return submittedBatches;
    }

    @Override
    public Endpoint endpoint() {
        return endpoint;
    }

    @Override
    public CompletableFuture<TaskResult> submitTask(InferenceRequest request) {
        taskCalls.incrementAndGet();
        return taskBehavior.apply(request);
    }

    @Override
    public CompletableFuture<StreamResult> submitStreamingTask(InferenceRequest request, String requestLogId) {
        streamCalls.incrementAndGet();
        return streamBehavior.apply(request, requestLogId);
    }

    @Override
    public CompletableFuture<EndpointStatus> endpointStatus() {
        return CompletableFuture.completedFuture(status);
    }

    @Override
    public boolean hasBatchEnabled() {
        return batchEnabled;
    }

    @Override
    public CompletableFuture<BatchSubmitResult> submitBatch(BatchRequest request, Identity identity) {
        submittedBatches.add(request);
        return CompletableFuture.completedFuture(batchSubmitBehavior.apply(request));
    }

    @Override
    public CompletableFuture<BatchStatusResult> getBatchStatus(BatchJob job) {
        batchStatusCalls.incrementAndGet();
        return CompletableFuture.completedFuture(batchStatusBehavior.apply(job));
    }
}
