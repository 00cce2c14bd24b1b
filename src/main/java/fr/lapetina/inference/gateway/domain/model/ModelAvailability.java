package fr.lapetina.inference.gateway.domain.model;

/**
 * Availability of a model on a cluster, as seen by the status cache.
 * Declaration order is routing preference order.
 */
public enum ModelAvailability {
    /** Running and able to serve right now */
    LIVE,

    /** Scheduled on the cluster but not started yet */
    QUEUED,

    /** No fresh status for the cluster */
    UNKNOWN,

    /** Known to be stopped */
    STOPPED
}
