/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.api.types;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Read-only view of an incentive campaign as returned by eligibility listings.
 */
public record IncentiveCampaignType(@JsonProperty("campaign_id") String campaignId,
        @JsonProperty("region") String region, @JsonProperty("category") String category,
        @JsonProperty("bonus_multiplier") double bonusMultiplier,
        @JsonProperty("target_recommendation_count") int targetRecommendationCount,
        @JsonProperty("min_trust_score") double minTrustScore, @JsonProperty("expires_at") Instant expiresAt,
        @JsonProperty("bonus_pool") long bonusPool) {
}
