/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.data.repositories;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.reputation.data.models.ClaimRecord;
import villagecompute.reputation.data.models.PendingClaim;

/**
 * {@link ClaimRecordRepository} backed by the {@link ClaimRecord} entity.
 */
@ApplicationScoped
public class PanacheClaimRecordRepository implements ClaimRecordRepository {

    @Override
    public Optional<ClaimRecord> find(String campaignId, String userId) {
        return ClaimRecord.findByCampaignAndUser(campaignId, userId);
    }

    @Override
    public ClaimRecord create(String campaignId, String userId, long amount, String transactionId,
            Set<String> contentIds, Instant claimedAt) {
        return ClaimRecord.create(campaignId, userId, amount, transactionId, contentIds, claimedAt);
    }

    @Override
    public List<ClaimRecord> findByUser(String userId) {
        return ClaimRecord.findByUserId(userId);
    }

    @Override
    public PendingClaim createPending(String campaignId, String userId, long amount, String transactionId,
            Set<String> contentIds, Instant submittedAt) {
        return PendingClaim.create(campaignId, userId, amount, transactionId, contentIds, submittedAt);
    }

    @Override
    public Optional<PendingClaim> findPending(String campaignId, String userId) {
        return PendingClaim.findByCampaignAndUser(campaignId, userId);
    }

    @Override
    public ClaimRecord settlePending(String campaignId, String userId, String transactionId, Instant claimedAt) {
        return PendingClaim.settle(campaignId, userId, transactionId, claimedAt);
    }

    @Override
    public boolean releasePending(String campaignId, String userId) {
        return PendingClaim.release(campaignId, userId);
    }
}
