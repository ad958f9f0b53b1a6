package strata.core.model;

import java.util.List;
import java.util.Locale;

/**
 * Backing store layers, ordered fastest first.
 */
public enum CacheTier {
    MEMORY,
    REMOTE,
    PERSISTENT;

    private static final List<CacheTier> LOOKUP_ORDER = List.of(MEMORY, REMOTE, PERSISTENT);

    /**
     * Default lookup order for reads: memory, then remote, then persistent.
     */
    public static List<CacheTier> lookupOrder() {
        return LOOKUP_ORDER;
    }

    /**
     * Whether this tier is served faster than {@code other}.
     */
    public boolean isFasterThan(CacheTier other) {
        return ordinal() < other.ordinal();
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a tier name case-insensitively. The legacy alias {@code redis} maps to {@link #REMOTE}.
     *
     * @throws IllegalArgumentException if the name is not a known tier
     */
    public static CacheTier parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tier name must not be blank");
        }
        var normalized = name.trim().toUpperCase(Locale.ROOT);
        if ("REDIS".equals(normalized)) {
            return REMOTE;
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown cache tier: " + name);
        }
    }
}
