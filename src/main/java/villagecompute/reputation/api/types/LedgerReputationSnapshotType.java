/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.api.types;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Canonical projection of a user's reputation as recorded on the ledger.
 *
 * @param userId
 *            user the snapshot belongs to
 * @param reputationScoreOnLedger
 *            fixed-point reputation score as stored on the ledger
 * @param verificationLevelOnLedger
 *            0 = basic, 1 = verified, 2 = expert
 * @param lastUpdatedOnLedger
 *            last update timestamp recorded on the ledger (may be null)
 * @param sourceTransactionId
 *            transaction that produced the recorded state (may be null)
 */
public record LedgerReputationSnapshotType(@JsonProperty("user_id") String userId,
        @JsonProperty("reputation_score_on_ledger") long reputationScoreOnLedger,
        @JsonProperty("verification_level_on_ledger") int verificationLevelOnLedger,
        @JsonProperty("last_updated_on_ledger") Instant lastUpdatedOnLedger,
        @JsonProperty("source_transaction_id") String sourceTransactionId) {
}
