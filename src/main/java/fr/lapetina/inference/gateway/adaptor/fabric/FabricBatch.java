package fr.lapetina.inference.gateway.adaptor.fabric;

import java.util.List;

/**
 * Identifiers returned when a batch of tasks is submitted in one call.
 */
public record FabricBatch(String batchId, List<String> taskIds) {

    public FabricBatch {
        taskIds = taskIds != null ? List.copyOf(taskIds) : List.of();
    }
}
