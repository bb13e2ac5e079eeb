/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.data.repositories;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import villagecompute.reputation.data.models.IncentiveCampaign;

/**
 * Incentive campaign definitions and their bonus pools.
 */
public interface CampaignRepository {

    Optional<IncentiveCampaign> findById(String campaignId);

    List<IncentiveCampaign> findUnexpired(Instant now);

    /**
     * Conditionally debits the pool: succeeds only if the remaining pool covers {@code amount}, as one atomic
     * operation against the store.
     *
     * @return true when debited
     */
    boolean debitPool(String campaignId, long amount);

    void creditPool(String campaignId, long amount);
}
