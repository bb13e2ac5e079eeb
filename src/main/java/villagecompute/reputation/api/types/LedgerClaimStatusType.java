/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.api.types;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Ledger view of a (campaign, user) bonus claim.
 *
 * @param claimed
 *            true when the ledger has recorded a claim for the pair
 * @param transactionId
 *            claim transaction id, null when unclaimed
 * @param amount
 *            paid amount in token units, 0 when unclaimed
 * @param claimedAt
 *            claim timestamp recorded on the ledger, null when unclaimed or unknown
 */
public record LedgerClaimStatusType(@JsonProperty("claimed") boolean claimed,
        @JsonProperty("transaction_id") String transactionId, @JsonProperty("amount") long amount,
        @JsonProperty("claimed_at") Instant claimedAt) {

    public static LedgerClaimStatusType unclaimed() {
        return new LedgerClaimStatusType(false, null, 0L, null);
    }
}
