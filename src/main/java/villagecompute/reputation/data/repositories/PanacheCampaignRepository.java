/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.data.repositories;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.reputation.data.models.IncentiveCampaign;

/**
 * {@link CampaignRepository} backed by the {@link IncentiveCampaign} entity.
 */
@ApplicationScoped
public class PanacheCampaignRepository implements CampaignRepository {

    @Override
    public Optional<IncentiveCampaign> findById(String campaignId) {
        return IncentiveCampaign.findByIdOptional(campaignId);
    }

    @Override
    public List<IncentiveCampaign> findUnexpired(Instant now) {
        return IncentiveCampaign.findUnexpired(now);
    }

    @Override
    public boolean debitPool(String campaignId, long amount) {
        return IncentiveCampaign.debitPool(campaignId, amount);
    }

    @Override
    public void creditPool(String campaignId, long amount) {
        IncentiveCampaign.creditPool(campaignId, amount);
    }
}
