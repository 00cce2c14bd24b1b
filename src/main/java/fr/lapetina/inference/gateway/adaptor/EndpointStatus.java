package fr.lapetina.inference.gateway.adaptor;

/**
 * Whether an endpoint's backend can accept work right now.
 */
public record EndpointStatus(boolean online, String detail) {

    public static final EndpointStatus ONLINE = new EndpointStatus(true, "online");

    public static EndpointStatus offline(String detail) {
        return new EndpointStatus(false, detail);
    }
}
