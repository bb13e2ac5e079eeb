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

import java.time.Instant;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * PendingClaim entity marking a claim transaction the ledger accepted but had not confirmed when the claim returned.
 *
 * <p>
 * The campaign pool stays debited while the marker exists. The next claim for the same (campaign, user) pair resolves
 * it against the ledger: a confirmed claim is settled into a {@link ClaimRecord}; a claim still absent after the settle
 * grace is released and its debit credited back.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (UUID, PK) - Primary identifier</li>
 * <li>{@code campaign_id} (TEXT) - Claimed campaign</li>
 * <li>{@code user_id} (TEXT) - Claiming user</li>
 * <li>{@code transaction_id} (TEXT) - Submitted claim transaction</li>
 * <li>{@code amount} (BIGINT) - Debited token units</li>
 * <li>{@code submitted_at} (TIMESTAMPTZ) - Submission timestamp</li>
 * <li>{@code pending_claim_content} - Contributing content ids (collection table)</li>
 * </ul>
 */
@Entity
@Table(
        name = "pending_claims",
        uniqueConstraints = @UniqueConstraint(
                columnNames = {"campaign_id", "user_id"}))
public class PendingClaim extends PanacheEntityBase {

    private static final Logger LOG = Logger.getLogger(PendingClaim.class);

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
            name = "transaction_id",
            nullable = false)
    public String transactionId;

    @Column(
            nullable = false)
    public long amount;

    @Column(
            name = "submitted_at",
            nullable = false)
    public Instant submittedAt;

    @ElementCollection(
            fetch = FetchType.EAGER)
    @CollectionTable(
            name = "pending_claim_content",
            joinColumns = @JoinColumn(
                    name = "pending_claim_id"))
    @Column(
            name = "content_id",
            nullable = false)
    public Set<String> contributingContentIds = new HashSet<>();

    public static Optional<PendingClaim> findByCampaignAndUser(String campaignId, String userId) {
        return find("campaignId = ?1 AND userId = ?2", campaignId, userId).firstResultOptional();
    }

    /**
     * Stores a marker in its own transaction.
     */
    public static PendingClaim create(String campaignId, String userId, long amount, String transactionId,
            Set<String> contentIds, Instant submittedAt) {
        PendingClaim pending = new PendingClaim();
        pending.campaignId = campaignId;
        pending.userId = userId;
        pending.amount = amount;
        pending.transactionId = transactionId;
        pending.contributingContentIds = new HashSet<>(contentIds);
        pending.submittedAt = submittedAt;

        QuarkusTransaction.requiringNew().run(() -> pending.persist());
        LOG.infof("Recorded pending claim %s of %d units for user %s in campaign %s", transactionId, amount, userId,
                campaignId);
        return pending;
    }

    /**
     * Replaces the marker with the confirmed claim record in one transaction.
     *
     * @return persisted claim record
     */
    public static ClaimRecord settle(String campaignId, String userId, String transactionId, Instant claimedAt) {
        return QuarkusTransaction.requiringNew().call(() -> {
            PendingClaim pending = findByCampaignAndUser(campaignId, userId).orElseThrow(
                    () -> new IllegalStateException("No pending claim for user " + userId + " in " + campaignId));
            ClaimRecord record = new ClaimRecord();
            record.campaignId = campaignId;
            record.userId = userId;
            record.amount = pending.amount;
            record.transactionId = transactionId;
            record.contributingContentIds = new HashSet<>(pending.contributingContentIds);
            record.claimedAt = claimedAt;
            record.persist();
            pending.delete();
            return record;
        });
    }

    /**
     * Deletes the marker in its own transaction.
     *
     * @return true if a marker was deleted
     */
    public static boolean release(String campaignId, String userId) {
        // Entity delete so the content collection rows go with it
        return QuarkusTransaction.requiringNew().call(() -> findByCampaignAndUser(campaignId, userId).map(pending -> {
            pending.delete();
            return true;
        }).orElse(false));
    }
}
