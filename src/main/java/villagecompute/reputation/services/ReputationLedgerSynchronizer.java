/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.services;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.reputation.api.types.LedgerReputationSnapshotType;
import villagecompute.reputation.api.types.LedgerTransactionResultType;
import villagecompute.reputation.api.types.ReconciliationOutcomeType;
import villagecompute.reputation.data.models.ReputationRecord;
import villagecompute.reputation.data.repositories.ReputationRecordRepository;
import villagecompute.reputation.exceptions.LedgerUnavailableException;
import villagecompute.reputation.exceptions.ResourceNotFoundException;
import villagecompute.reputation.exceptions.ValidationException;
import villagecompute.reputation.integration.ledger.LedgerGateway;
import villagecompute.reputation.observability.EngineMetrics;

/**
 * Compares a user's local reputation record with the ledger's recorded state and pushes the local values when they
 * diverge.
 *
 * <p>
 * <b>Run:</b> fetch local, fetch ledger, compare, then either nothing or one corrective transaction. Each call is
 * stateless and safe to repeat: once a correction lands, the next run compares equal and submits nothing.
 *
 * <p>
 * <b>Comparison:</b>
 * <ul>
 * <li>Score diverges when {@code |local * scale - ledger| > tolerance}, compared unrounded; the corrective write
 * carries {@code round(local * scale)}
 * ({@code reputation.sync.score-scale}, {@code reputation.sync.score-tolerance})</li>
 * <li>Verification level diverges when the local label's code (basic=0, verified=1, expert=2, unknown=0) differs
 * from the ledger's</li>
 * <li>No ledger record at all is a divergence</li>
 * </ul>
 *
 * <p>
 * The local record is never modified here. An unreachable ledger yields an unsynced outcome rather than an
 * exception; persisting the outcome is the caller's decision.
 */
@ApplicationScoped
public class ReputationLedgerSynchronizer {

    private static final Logger LOG = Logger.getLogger(ReputationLedgerSynchronizer.class);

    public static final String LEDGER_UNREACHABLE = "ledger unreachable";
    public static final String NO_LEDGER_RECORD = "no ledger record";

    @ConfigProperty(
            name = "reputation.sync.score-scale",
            defaultValue = "1000")
    long scoreScale;

    @ConfigProperty(
            name = "reputation.sync.score-tolerance",
            defaultValue = "10")
    long scoreTolerance;

    @Inject
    ReputationRecordRepository repository;

    @Inject
    LedgerGateway ledger;

    @Inject
    EngineMetrics metrics;

    @Inject
    Clock clock;

    /**
     * Reconciles one user.
     *
     * @param userId
     *            user to reconcile
     * @return outcome of this run
     * @throws ValidationException
     *             if userId is blank
     * @throws ResourceNotFoundException
     *             if the user has no local record
     */
    public ReconciliationOutcomeType reconcile(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("User id is required");
        }
        ReputationRecord local = repository.get(userId)
                .orElseThrow(() -> new ResourceNotFoundException("No reputation record for user " + userId));
        Instant attemptedAt = clock.instant();

        Optional<LedgerReputationSnapshotType> snapshot;
        try {
            snapshot = ledger.fetchReputation(userId);
        } catch (LedgerUnavailableException e) {
            LOG.warnf("Ledger unreachable while reconciling user %s: %s", userId, e.getMessage());
            metrics.incrementReconcile(EngineMetrics.RECONCILE_LEDGER_UNREACHABLE);
            return new ReconciliationOutcomeType(userId, List.of(LEDGER_UNREACHABLE), false, attemptedAt, null);
        }

        long localScaledScore = scaledScore(local.reputationScore);
        int localLevelCode = local.verification().ledgerCode();
        List<String> discrepancies = compare(local, localScaledScore, localLevelCode, snapshot);

        if (discrepancies.isEmpty()) {
            LOG.debugf("Reputation for user %s matches ledger", userId);
            metrics.incrementReconcile(EngineMetrics.RECONCILE_NOOP);
            return new ReconciliationOutcomeType(userId, List.of(), true, attemptedAt, null);
        }

        LOG.infof("Reputation for user %s diverges from ledger: %s", userId, discrepancies);
        return correctLedger(userId, localScaledScore, localLevelCode, discrepancies, attemptedAt);
    }

    List<String> compare(ReputationRecord local, long localScaledScore, int localLevelCode,
            Optional<LedgerReputationSnapshotType> snapshot) {
        List<String> discrepancies = new ArrayList<>();
        if (snapshot.isEmpty()) {
            discrepancies.add(NO_LEDGER_RECORD);
            return discrepancies;
        }

        LedgerReputationSnapshotType onLedger = snapshot.get();
        if (Math.abs(local.reputationScore * scoreScale - onLedger.reputationScoreOnLedger()) > scoreTolerance) {
            discrepancies.add("Reputation score differs: off-chain " + localScaledScore + ", on-chain "
                    + onLedger.reputationScoreOnLedger());
        }
        if (localLevelCode != onLedger.verificationLevelOnLedger()) {
            discrepancies.add("Verification level differs: off-chain " + local.verification().label() + ", on-chain "
                    + onLedger.verificationLevelOnLedger());
        }
        return discrepancies;
    }

    long scaledScore(double reputationScore) {
        return Math.round(reputationScore * scoreScale);
    }

    private ReconciliationOutcomeType correctLedger(String userId, long scaledScore, int levelCode,
            List<String> discrepancies, Instant attemptedAt) {
        LedgerTransactionResultType result;
        try {
            result = ledger.submitReputationCorrection(userId, scaledScore, levelCode);
        } catch (LedgerUnavailableException e) {
            LOG.warnf("Ledger unreachable while correcting user %s: %s", userId, e.getMessage());
            metrics.incrementReconcile(EngineMetrics.RECONCILE_LEDGER_UNREACHABLE);
            List<String> withError = new ArrayList<>(discrepancies);
            withError.add(LEDGER_UNREACHABLE + ": " + e.getMessage());
            return new ReconciliationOutcomeType(userId, withError, false, attemptedAt, null);
        }

        if (!result.isConfirmed()) {
            LOG.warnf("Corrective transaction for user %s not applied: %s", userId, result.describeFailure());
            metrics.incrementReconcile(EngineMetrics.RECONCILE_CORRECTION_FAILED);
            List<String> withError = new ArrayList<>(discrepancies);
            withError.add(result.describeFailure());
            return new ReconciliationOutcomeType(userId, withError, false, attemptedAt, null);
        }

        LOG.infof("Corrected ledger reputation for user %s in transaction %s", userId, result.transactionId());
        metrics.incrementReconcile(EngineMetrics.RECONCILE_CORRECTED);
        return new ReconciliationOutcomeType(userId, discrepancies, true, attemptedAt, result.transactionId());
    }
}
