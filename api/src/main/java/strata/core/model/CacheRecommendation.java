package strata.core.model;

/**
 * Tuning advice derived from a statistics snapshot.
 *
 * @param category stable identifier, e.g. {@code low-hit-rate}
 * @param severity how urgently the finding should be acted on
 * @param message human-readable explanation with the observed figure
 */
public record CacheRecommendation(String category, Severity severity, String message) {

    public enum Severity {
        INFO,
        WARNING,
        CRITICAL
    }
}
