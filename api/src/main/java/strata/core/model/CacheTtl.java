package strata.core.model;

/**
 * Common TTL presets, in seconds.
 */
public final class CacheTtl {

    public static final long SHORT = 60;
    public static final long MEDIUM = 5 * 60;
    public static final long LONG = 15 * 60;
    public static final long VERY_LONG = 60 * 60;

    private CacheTtl() {}
}
