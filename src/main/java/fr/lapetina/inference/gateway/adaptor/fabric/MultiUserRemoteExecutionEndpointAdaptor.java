package fr.lapetina.inference.gateway.adaptor.fabric;

import fr.lapetina.inference.gateway.adaptor.AdaptorContext;
import fr.lapetina.inference.gateway.domain.model.Endpoint;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Remote execution on a multi-user fabric endpoint. Each task carries the scheduler
 * account, queue and walltime to spawn a user endpoint with, so there is no shared
 * manager pool to wait for. Batch support is not offered.
 */
public class MultiUserRemoteExecutionEndpointAdaptor extends RemoteExecutionEndpointAdaptor {

    private final Map<String, Object> userEndpointConfig;

    public MultiUserRemoteExecutionEndpointAdaptor(Endpoint endpoint, AdaptorContext context) {
        super(endpoint, context, false);
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("account", settings.require("account"));
        config.put("queue", settings.optional("queue", "default"));
        config.put("walltime", settings.optional("walltime", "01:00:00"));
        this.userEndpointConfig = Map.copyOf(config);
    }

    @Override
    protected Map<String, Object> taskOptions() {
        return Map.of("user_endpoint_config", userEndpointConfig);
    }

    @Override
    public boolean hasBatchEnabled() {
        return false;
    }
}
