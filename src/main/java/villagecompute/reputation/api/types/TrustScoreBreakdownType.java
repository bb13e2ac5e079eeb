/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.api.types;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Observability detail attached to every trust score.
 *
 * @param directCount
 *            endorsements at hop distance 1
 * @param indirectCount
 *            endorsements at hop distance 2
 * @param totalWeight
 *            uncapped sum of weighted endorsements
 * @param clampedCount
 *            endorsements whose trust score was outside [0, 1] and got clamped
 * @param clampedEndorserIds
 *            endorsers whose trust score was clamped
 * @param provenance
 *            human-readable summary, e.g. "3 endorsements • 1 direct • 1 network"
 */
public record TrustScoreBreakdownType(@JsonProperty("direct_count") int directCount,
        @JsonProperty("indirect_count") int indirectCount, @JsonProperty("total_weight") double totalWeight,
        @JsonProperty("clamped_count") int clampedCount,
        @JsonProperty("clamped_endorser_ids") List<String> clampedEndorserIds,
        @JsonProperty("provenance") String provenance) {
}
