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
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * ReputationRecord entity implementing the Panache ActiveRecord pattern for the off-chain reputation snapshot of a
 * user.
 *
 * <p>
 * The record is authoritative for reputation. It is created at registration and mutated by the activity pipeline;
 * the ledger synchronizer only reads it and pushes it to the ledger. {@code ledger_sync_state} is written by the
 * background sync job and the ledger event monitor.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code user_id} (TEXT, PK) - External user identifier</li>
 * <li>{@code reputation_score} (DOUBLE) - Current reputation score</li>
 * <li>{@code verification_level} (TEXT) - basic, verified, expert (unknown values are treated as basic)</li>
 * <li>{@code social_connection_count} (INT) - Number of direct connections</li>
 * <li>{@code last_updated} (TIMESTAMPTZ) - Last reputation change</li>
 * <li>{@code ledger_sync_state} (TEXT) - synced, diverged, pending</li>
 * <li>{@code last_sync_attempt} (TIMESTAMPTZ) - Last reconciliation run</li>
 * </ul>
 */
@Entity
@Table(
        name = "reputation_records")
public class ReputationRecord extends PanacheEntityBase {

    private static final Logger LOG = Logger.getLogger(ReputationRecord.class);

    public static final String SYNC_STATE_SYNCED = "synced";
    public static final String SYNC_STATE_DIVERGED = "diverged";
    public static final String SYNC_STATE_PENDING = "pending";

    @Id
    @Column(
            name = "user_id",
            nullable = false)
    public String userId;

    @Column(
            name = "reputation_score",
            nullable = false)
    public double reputationScore;

    @Column(
            name = "verification_level",
            nullable = false)
    public String verificationLevel;

    @Column(
            name = "social_connection_count",
            nullable = false)
    public int socialConnectionCount;

    @Column(
            name = "last_updated",
            nullable = false)
    public Instant lastUpdated;

    @Column(
            name = "ledger_sync_state",
            nullable = false)
    public String ledgerSyncState;

    @Column(
            name = "last_sync_attempt")
    public Instant lastSyncAttempt;

    /**
     * Finds the record of a user.
     *
     * @param userId
     *            external user id
     * @return Optional containing the record if present
     */
    public static Optional<ReputationRecord> findByUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            return Optional.empty();
        }
        return findByIdOptional(userId);
    }

    /**
     * Finds records the sync job should reconcile: pending or diverged, least recently attempted first.
     *
     * @param limit
     *            maximum number of records
     * @return records needing reconciliation
     */
    public static List<ReputationRecord> findNeedingSync(int limit) {
        return find("ledgerSyncState IN (?1, ?2) ORDER BY lastSyncAttempt ASC NULLS FIRST, userId ASC",
                SYNC_STATE_PENDING, SYNC_STATE_DIVERGED).page(0, limit).list();
    }

    /**
     * Creates a record for a newly registered user, initially pending publication to the ledger.
     *
     * @param userId
     *            external user id
     * @param reputationScore
     *            starting score
     * @param verificationLevel
     *            starting verification label
     * @return persisted record
     */
    public static ReputationRecord create(String userId, double reputationScore, String verificationLevel) {
        ReputationRecord record = new ReputationRecord();
        record.userId = userId;
        record.reputationScore = reputationScore;
        record.verificationLevel = verificationLevel;
        record.socialConnectionCount = 0;
        record.lastUpdated = Instant.now();
        record.ledgerSyncState = SYNC_STATE_PENDING;

        QuarkusTransaction.requiringNew().run(() -> record.persist());
        LOG.infof("Created reputation record for user %s (score=%.3f, level=%s)", userId, reputationScore,
                verificationLevel);
        return record;
    }

    /**
     * Inserts or updates a record in its own transaction.
     *
     * @param record
     *            record to store
     */
    public static void upsert(ReputationRecord record) {
        QuarkusTransaction.requiringNew().run(() -> getEntityManager().merge(record));
    }

    /**
     * Updates only the sync bookkeeping columns, leaving reputation fields untouched.
     *
     * @return number of updated rows (0 when the user has no record)
     */
    public static int updateSyncState(String userId, String syncState, Instant attemptedAt) {
        return QuarkusTransaction.requiringNew().call(() -> update(
                "ledgerSyncState = ?1, lastSyncAttempt = ?2 WHERE userId = ?3", syncState, attemptedAt, userId));
    }

    /**
     * Updates the sync bookkeeping columns only if they still hold the values read earlier, so a concurrent
     * {@code pending} mark is not overwritten.
     *
     * @return number of updated rows (0 when the record changed or does not exist)
     */
    public static int updateSyncStateIfUnchanged(String userId, String expectedState, Instant expectedAttempt,
            String syncState, Instant attemptedAt) {
        if (expectedAttempt == null) {
            return QuarkusTransaction.requiringNew().call(() -> update(
                    "ledgerSyncState = ?1, lastSyncAttempt = ?2 WHERE userId = ?3 AND ledgerSyncState = ?4"
                            + " AND lastSyncAttempt IS NULL",
                    syncState, attemptedAt, userId, expectedState));
        }
        return QuarkusTransaction.requiringNew().call(() -> update(
                "ledgerSyncState = ?1, lastSyncAttempt = ?2 WHERE userId = ?3 AND ledgerSyncState = ?4"
                        + " AND lastSyncAttempt = ?5",
                syncState, attemptedAt, userId, expectedState, expectedAttempt));
    }

    /**
     * Verification level resolved from the stored label.
     */
    public VerificationLevel verification() {
        return VerificationLevel.fromLabel(verificationLevel);
    }
}
