/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.data.repositories;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static villagecompute.reputation.TestConstants.CAMPAIGN_ID;
import static villagecompute.reputation.TestConstants.CAMPAIGN_ID_2;
import static villagecompute.reputation.TestConstants.CATEGORY;
import static villagecompute.reputation.TestConstants.NOW;
import static villagecompute.reputation.TestConstants.REGION;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import villagecompute.reputation.data.models.IncentiveCampaign;
import villagecompute.reputation.testing.H2TestResource;

/**
 * Tests for {@link PanacheCampaignRepository}, mainly the conditional pool debit.
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
class PanacheCampaignRepositoryTest {

    @Inject
    CampaignRepository repository;

    @BeforeEach
    @Transactional
    void setUp() {
        IncentiveCampaign.deleteAll();
        persist(CAMPAIGN_ID, NOW.plus(Duration.ofDays(7)), 100);
        persist(CAMPAIGN_ID_2, NOW.minus(Duration.ofDays(1)), 100);
    }

    private void persist(String campaignId, Instant expiresAt, long pool) {
        IncentiveCampaign campaign = new IncentiveCampaign();
        campaign.campaignId = campaignId;
        campaign.region = REGION;
        campaign.category = CATEGORY;
        campaign.bonusMultiplier = 2.5;
        campaign.targetRecommendationCount = 3;
        campaign.minTrustScore = 0.6;
        campaign.expiresAt = expiresAt;
        campaign.bonusPool = pool;
        campaign.createdAt = NOW;
        campaign.persist();
    }

    private long poolOf(String campaignId) {
        return repository.findById(campaignId).orElseThrow().bonusPool;
    }

    @Test
    void testDebitPool_onlyWhenBalanceCovers() {
        assertTrue(repository.debitPool(CAMPAIGN_ID, 60));
        assertFalse(repository.debitPool(CAMPAIGN_ID, 60));
        assertTrue(repository.debitPool(CAMPAIGN_ID, 40));

        assertEquals(0, poolOf(CAMPAIGN_ID));
    }

    @Test
    void testDebitPool_unknownCampaign() {
        assertFalse(repository.debitPool("campaign-missing", 1));
    }

    @Test
    void testCreditPool_restoresBalance() {
        repository.debitPool(CAMPAIGN_ID, 30);

        repository.creditPool(CAMPAIGN_ID, 30);

        assertEquals(100, poolOf(CAMPAIGN_ID));
    }

    @Test
    void testFindUnexpired() {
        List<IncentiveCampaign> campaigns = repository.findUnexpired(NOW);

        assertEquals(1, campaigns.size());
        assertEquals(CAMPAIGN_ID, campaigns.get(0).campaignId);
        assertEquals(7, campaigns.get(0).claimAmount());
    }
}
