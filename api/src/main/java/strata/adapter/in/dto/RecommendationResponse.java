package strata.adapter.in.dto;

import java.util.Locale;

import strata.core.model.CacheRecommendation;

/**
 * DTO for a tuning recommendation.
 *
 * @param severity {@code info}, {@code warning} or {@code critical}
 */
public record RecommendationResponse(String category, String severity, String message) {

    public static RecommendationResponse from(CacheRecommendation recommendation) {
        return new RecommendationResponse(
                recommendation.category(),
                recommendation.severity().name().toLowerCase(Locale.ROOT),
                recommendation.message());
    }
}
