package fr.lapetina.inference.gateway.adaptor.fabric;

/**
 * Status of a fabric endpoint: whether it is online and how many managers (worker
 * nodes) it currently holds. Zero managers means the model still has to be loaded.
 */
public record FabricEndpointStatus(String status, int managers) {

    public boolean isOnline() {
        return "online".equalsIgnoreCase(status);
    }

    public boolean hasResources() {
        return managers > 0;
    }
}
