package fr.lapetina.inference.gateway.adaptor.http;

import fr.lapetina.inference.gateway.adaptor.AdaptorContext;
import fr.lapetina.inference.gateway.adaptor.AdaptorErrors;
import fr.lapetina.inference.gateway.adaptor.AdaptorSettings;
import fr.lapetina.inference.gateway.adaptor.ClusterAdaptor;
import fr.lapetina.inference.gateway.adaptor.JobsResult;
import fr.lapetina.inference.gateway.domain.model.Cluster;
import fr.lapetina.inference.gateway.domain.model.ClusterStatus;
import fr.lapetina.inference.gateway.domain.model.Endpoint;
import fr.lapetina.inference.gateway.domain.model.JobInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Cluster of always-on API deployments. Live deployments are reported running,
 * everything else stopped.
 *
 * <p>Settings: {@code status-url} (required), {@code api-key-env}, {@code framework} (default "api").
 */
public class DirectApiClusterAdaptor implements ClusterAdaptor {

    private static final Logger log = LoggerFactory.getLogger(DirectApiClusterAdaptor.class);

    private final Cluster cluster;
    private final OpenAiHttpClient client;
    private final URI statusUrl;
    private final String apiKey;
    private final String framework;

    public DirectApiClusterAdaptor(Cluster cluster, List<Endpoint> endpoints, AdaptorContext context) {
        this.cluster = cluster;
        this.client = context.httpClient();
        AdaptorSettings settings = new AdaptorSettings("cluster " + cluster.name(), cluster.config());
        this.statusUrl = URI.create(settings.require("status-url"));
        this.apiKey = settings.secretFromEnv("api-key-env");
        this.framework = settings.optional("framework", "api");
    }

    @Override
    public Cluster cluster() {
        return cluster;
    }

    @Override
    public CompletableFuture<JobsResult> getJobs() {
        return client.getJson(statusUrl, apiKey, Duration.ofSeconds(10))
                .<JobsResult>thenApply(document -> new JobsResult.Jobs(toStatus(ModelStatusEntry.parse(document))))
                .exceptionally(ex -> {
                    JobsResult.Failure failure = new JobsResult.Failure(AdaptorErrors.classify(ex, cluster.name()));
                    log.warn("get_jobs failed: cluster={}, error={}", cluster.name(), failure.error().message());
                    return failure;
                });
    }

    private ClusterStatus toStatus(List<ModelStatusEntry> entries) {
        List<JobInfo> running = new ArrayList<>();
        List<JobInfo> stopped = new ArrayList<>();
        for (ModelStatusEntry entry : entries) {
            String models = entry.experts().isEmpty() ? entry.key() : String.join(",", entry.experts());
            Map<String, Object> extras = new LinkedHashMap<>();
            extras.put("Deployment", entry.key());
            extras.put("Model Status", entry.status());
            JobInfo job = new JobInfo(models, framework, cluster.name(), extras);
            if (entry.isLive()) {
                running.add(job);
            } else {
                stopped.add(job);
            }
        }
        return new ClusterStatus(running, List.of(), stopped, List.of(), List.of(), List.of(),
                Map.of("deployments", entries.size(), "live", running.size()));
    }
}
