/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import villagecompute.reputation.api.types.IncentiveCampaignType;

import java.time.Instant;
import java.util.List;

/**
 * IncentiveCampaign entity implementing the Panache ActiveRecord pattern for time-bounded discovery bonus campaigns.
 *
 * <p>
 * Campaigns are created by an administrative process and are immutable afterwards, except for {@code bonus_pool}
 * which only changes through the conditional {@link #debitPool} / {@link #creditPool} updates.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code campaign_id} (TEXT, PK) - Campaign identifier</li>
 * <li>{@code region} (TEXT) - Region the campaign targets</li>
 * <li>{@code category} (TEXT) - Content category the campaign targets</li>
 * <li>{@code bonus_multiplier} (DOUBLE) - Multiplier applied to the target count to compute the payout</li>
 * <li>{@code target_recommendation_count} (INT) - Contributions required to claim</li>
 * <li>{@code min_trust_score} (DOUBLE) - Minimum trust score in [0, 1]</li>
 * <li>{@code expires_at} (TIMESTAMPTZ) - End of the campaign</li>
 * <li>{@code bonus_pool} (BIGINT) - Remaining token units</li>
 * <li>{@code created_at} (TIMESTAMPTZ) - Creation timestamp</li>
 * </ul>
 */
@Entity
@Table(
        name = "incentive_campaigns")
public class IncentiveCampaign extends PanacheEntityBase {

    @Id
    @Column(
            name = "campaign_id",
            nullable = false)
    public String campaignId;

    @Column(
            nullable = false)
    public String region;

    @Column(
            nullable = false)
    public String category;

    @Column(
            name = "bonus_multiplier",
            nullable = false)
    public double bonusMultiplier;

    @Column(
            name = "target_recommendation_count",
            nullable = false)
    public int targetRecommendationCount;

    @Column(
            name = "min_trust_score",
            nullable = false)
    public double minTrustScore;

    @Column(
            name = "expires_at",
            nullable = false)
    public Instant expiresAt;

    @Column(
            name = "bonus_pool",
            nullable = false)
    public long bonusPool;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    /**
     * Campaigns whose expiry lies after {@code now}.
     */
    public static List<IncentiveCampaign> findUnexpired(Instant now) {
        return find("expiresAt > ?1", now).list();
    }

    /**
     * Debits the pool only if it still covers {@code amount}. Check and decrement are one conditional UPDATE, so two
     * concurrent claims can never both spend the same balance.
     *
     * @return true when the pool was debited
     */
    public static boolean debitPool(String campaignId, long amount) {
        int updated = QuarkusTransaction.requiringNew().call(() -> update(
                "bonusPool = bonusPool - ?1 WHERE campaignId = ?2 AND bonusPool >= ?1", amount, campaignId));
        return updated == 1;
    }

    /**
     * Returns a previously debited amount to the pool.
     */
    public static void creditPool(String campaignId, long amount) {
        QuarkusTransaction.requiringNew()
                .run(() -> update("bonusPool = bonusPool + ?1 WHERE campaignId = ?2", amount, campaignId));
    }

    /**
     * Active means not yet expired and with a non-empty pool.
     */
    public boolean isActive(Instant now) {
        return expiresAt.isAfter(now) && bonusPool > 0;
    }

    /**
     * Token units paid by one claim: {@code floor(bonusMultiplier * targetRecommendationCount)}.
     */
    public long claimAmount() {
        return (long) Math.floor(bonusMultiplier * targetRecommendationCount);
    }

    public IncentiveCampaignType toType() {
        return new IncentiveCampaignType(campaignId, region, category, bonusMultiplier, targetRecommendationCount,
                minTrustScore, expiresAt, bonusPool);
    }
}
