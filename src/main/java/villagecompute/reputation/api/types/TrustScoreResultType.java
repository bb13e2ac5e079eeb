/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.api.types;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Trust score of one content item for one viewer.
 *
 * <p>
 * {@code finalScore} keeps full precision; {@link #displayScore()} rounds to one decimal for rendering. Instances are
 * never mutated and may be cached.
 *
 * @param contentId
 *            scored content item
 * @param viewerId
 *            viewer the score is personalized for
 * @param baseScore
 *            base score applied to the social multiplier (5.0)
 * @param socialMultiplier
 *            capped weighted endorsement sum, in [0, 3]
 * @param finalScore
 *            {@code min(baseScore * socialMultiplier, 10)}
 * @param computedAt
 *            computation timestamp
 * @param breakdown
 *            endorsement counts and weights
 */
public record TrustScoreResultType(@JsonProperty("content_id") String contentId,
        @JsonProperty("viewer_id") String viewerId, @JsonProperty("base_score") double baseScore,
        @JsonProperty("social_multiplier") double socialMultiplier, @JsonProperty("final_score") double finalScore,
        @JsonProperty("computed_at") Instant computedAt,
        @JsonProperty("breakdown") TrustScoreBreakdownType breakdown) {

    @JsonProperty("display_score")
    public double displayScore() {
        return BigDecimal.valueOf(finalScore).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }

    @JsonIgnore
    public boolean hasEndorsements() {
        return breakdown.directCount() + breakdown.indirectCount() > 0;
    }
}
