package strata.core.model;

import java.util.Set;

/**
 * Outcome of a write.
 *
 * <p>{@link #stored()} is true when at least one tier accepted the value. A write that reached
 * memory but failed on the remote tier is a degraded success, not an error.
 */
public record SetResult(
        boolean stored,
        Set<CacheTier> storedTiers,
        Set<CacheTier> failedTiers,
        boolean rejectedForCapacity,
        boolean invalidatedDuringWrite) {

    public SetResult {
        storedTiers = Set.copyOf(storedTiers);
        failedTiers = Set.copyOf(failedTiers);
    }

    public boolean degraded() {
        return stored && !failedTiers.isEmpty();
    }
}
