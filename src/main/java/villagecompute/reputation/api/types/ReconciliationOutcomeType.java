/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.api.types;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of one reconciliation run for a user. Immutable; the caller decides whether to persist it.
 *
 * @param userId
 *            reconciled user
 * @param discrepancies
 *            ordered, human-readable discrepancy descriptions (empty when local and ledger agree)
 * @param synced
 *            true when the ledger matches the local record after the run
 * @param lastSyncAttempt
 *            timestamp of this run
 * @param correctiveTransactionId
 *            id of the confirmed corrective transaction, null when none was needed or it failed
 */
public record ReconciliationOutcomeType(@JsonProperty("user_id") String userId,
        @JsonProperty("discrepancies") List<String> discrepancies, @JsonProperty("synced") boolean synced,
        @JsonProperty("last_sync_attempt") Instant lastSyncAttempt,
        @JsonProperty("corrective_transaction_id") String correctiveTransactionId) {

    public ReconciliationOutcomeType {
        discrepancies = List.copyOf(discrepancies);
    }

    public Optional<String> correctiveTransaction() {
        return Optional.ofNullable(correctiveTransactionId);
    }
}
