/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import org.jboss.logging.Logger;
import villagecompute.reputation.api.types.ClaimRecordType;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * ClaimRecord entity implementing the Panache ActiveRecord pattern for paid-out campaign bonuses.
 *
 * <p>
 * At most one record exists per (campaign, user) pair, enforced by a unique constraint. Records are created after the
 * ledger confirms the claim transaction and are never updated or deleted.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (UUID, PK) - Primary identifier</li>
 * <li>{@code campaign_id} (TEXT) - Claimed campaign</li>
 * <li>{@code user_id} (TEXT) - Claiming user</li>
 * <li>{@code claimed_at} (TIMESTAMPTZ) - Claim timestamp</li>
 * <li>{@code amount} (BIGINT) - Paid token units</li>
 * <li>{@code transaction_id} (TEXT) - Confirmed claim transaction</li>
 * <li>{@code claim_record_content} - Contributing content ids (collection table)</li>
 * </ul>
 */
@Entity
@Table(
        name = "claim_records",
        uniqueConstraints = @UniqueConstraint(
                columnNames = {"campaign_id", "user_id"}))
public class ClaimRecord extends PanacheEntityBase {

    private static final Logger LOG = Logger.getLogger(ClaimRecord.class);

    @Id
    @GeneratedValue
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "campaign_id",
            nullable = false)
    public String campaignId;

    @Column(
            name = "user_id",
            nullable = false)
    public String userId;

    @Column(
            name = "claimed_at",
            nullable = false)
    public Instant claimedAt;

    @Column(
            nullable = false)
    public long amount;

    @Column(
            name = "transaction_id",
            nullable = false)
    public String transactionId;

    @ElementCollection(
            fetch = FetchType.EAGER)
    @CollectionTable(
            name = "claim_record_content",
            joinColumns = @JoinColumn(
                    name = "claim_id"))
    @Column(
            name = "content_id",
            nullable = false)
    public Set<String> contributingContentIds = new HashSet<>();

    public static Optional<ClaimRecord> findByCampaignAndUser(String campaignId, String userId) {
        return find("campaignId = ?1 AND userId = ?2", campaignId, userId).firstResultOptional();
    }

    /**
     * All claims of a user, most recent first.
     */
    public static List<ClaimRecord> findByUserId(String userId) {
        return find("userId = ?1 ORDER BY claimedAt DESC", userId).list();
    }

    /**
     * Records a confirmed claim in its own transaction.
     *
     * @return persisted record
     */
    public static ClaimRecord create(String campaignId, String userId, long amount, String transactionId,
            Set<String> contentIds, Instant claimedAt) {
        ClaimRecord record = new ClaimRecord();
        record.campaignId = campaignId;
        record.userId = userId;
        record.amount = amount;
        record.transactionId = transactionId;
        record.contributingContentIds = new HashSet<>(contentIds);
        record.claimedAt = claimedAt;

        QuarkusTransaction.requiringNew().run(() -> record.persist());
        LOG.infof("Recorded claim of %d units for user %s in campaign %s (tx %s)", amount, userId, campaignId,
                transactionId);
        return record;
    }

    public ClaimRecordType toType() {
        return new ClaimRecordType(campaignId, userId, claimedAt, amount, transactionId,
                Set.copyOf(contributingContentIds));
    }
}
