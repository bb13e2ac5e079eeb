/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.data.repositories;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import villagecompute.reputation.data.models.ClaimRecord;
import villagecompute.reputation.data.models.PendingClaim;

/**
 * Local bookkeeping of confirmed bonus claims and of claims awaiting ledger confirmation.
 */
public interface ClaimRecordRepository {

    Optional<ClaimRecord> find(String campaignId, String userId);

    ClaimRecord create(String campaignId, String userId, long amount, String transactionId, Set<String> contentIds,
            Instant claimedAt);

    List<ClaimRecord> findByUser(String userId);

    PendingClaim createPending(String campaignId, String userId, long amount, String transactionId,
            Set<String> contentIds, Instant submittedAt);

    Optional<PendingClaim> findPending(String campaignId, String userId);

    /**
     * Turns the pair's pending marker into a claim record.
     */
    ClaimRecord settlePending(String campaignId, String userId, String transactionId, Instant claimedAt);

    /**
     * @return true if a pending marker existed and was removed
     */
    boolean releasePending(String campaignId, String userId);
}
