/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.api.types;

import java.time.Instant;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Read-only view of a recorded bonus claim.
 */
public record ClaimRecordType(@JsonProperty("campaign_id") String campaignId, @JsonProperty("user_id") String userId,
        @JsonProperty("claimed_at") Instant claimedAt, @JsonProperty("amount") long amount,
        @JsonProperty("transaction_id") String transactionId,
        @JsonProperty("contributing_content_ids") Set<String> contributingContentIds) {
}
