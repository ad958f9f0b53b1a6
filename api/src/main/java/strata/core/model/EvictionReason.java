package strata.core.model;

/**
 * Why the memory tier dropped an entry without being asked to.
 */
public enum EvictionReason {
    LRU,
    LFU,
    TTL,
    EXPIRED
}
