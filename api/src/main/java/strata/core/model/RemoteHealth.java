package strata.core.model;

/**
 * Connectivity state of the remote tier.
 */
public enum RemoteHealth {
    /** Enough consecutive successful checks. */
    HEALTHY,
    /** Recovering: reachable again but not yet trusted. */
    DEGRADED,
    /** Failure threshold reached; data calls short-circuit until reconnected. */
    UNREACHABLE,
    /** Remote tier disabled by configuration. */
    DISABLED;

    public boolean acceptsTraffic() {
        return this == HEALTHY || this == DEGRADED;
    }
}
