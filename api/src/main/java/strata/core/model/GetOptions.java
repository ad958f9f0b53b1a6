package strata.core.model;

/**
 * Read options.
 *
 * @param preferredTier tier queried first, or null for the default order
 * @param backfill whether a hit in a slower tier is copied into faster tiers
 */
public record GetOptions(CacheTier preferredTier, boolean backfill) {

    public static GetOptions defaults() {
        return new GetOptions(null, true);
    }

    public static GetOptions preferring(CacheTier tier) {
        return new GetOptions(tier, true);
    }

    public GetOptions withoutBackfill() {
        return new GetOptions(preferredTier, false);
    }
}
