/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.jobs;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.reputation.api.types.ReconciliationOutcomeType;
import villagecompute.reputation.data.models.ReputationRecord;
import villagecompute.reputation.data.repositories.ReputationRecordRepository;
import villagecompute.reputation.observability.LoggingConfig;
import villagecompute.reputation.services.ReputationLedgerSynchronizer;

/**
 * Background reconciliation of reputation records against the ledger.
 *
 * <p>
 * Every {@code reputation.sync.interval} the job picks up to {@code reputation.sync.batch-size} records in state
 * {@code pending} or {@code diverged}, least recently attempted first, reconciles each one and stores the resulting
 * sync state ({@code synced} or {@code diverged}).
 *
 * <p>
 * The outcome is stored only if the record's sync state and last attempt are still those read at batch start. A
 * {@code pending} mark written by {@link LedgerEventMonitor} during the run is kept for the next run.
 *
 * <ul>
 * <li>Users are processed independently; one failure never aborts the batch</li>
 * <li>OpenTelemetry span per run with a child span per user</li>
 * <li>Overlapping runs are skipped</li>
 * </ul>
 */
@ApplicationScoped
public class ReputationSyncJob {

    private static final Logger LOG = Logger.getLogger(ReputationSyncJob.class);

    /**
     * Counts of one run.
     */
    public record SyncRunSummary(int synced, int diverged, int failed) {

        public int total() {
            return synced + diverged + failed;
        }
    }

    /**
     * Sync bookkeeping of a record as read at batch start.
     */
    record SyncCandidate(String userId, String syncState, Instant lastSyncAttempt) {

        static SyncCandidate of(ReputationRecord record) {
            return new SyncCandidate(record.userId, record.ledgerSyncState, record.lastSyncAttempt);
        }
    }

    @ConfigProperty(
            name = "reputation.sync.batch-size",
            defaultValue = "200")
    int batchSize;

    @Inject
    ReputationRecordRepository repository;

    @Inject
    ReputationLedgerSynchronizer synchronizer;

    @Inject
    Tracer tracer;

    @Inject
    Clock clock;

    @Scheduled(
            identity = "reputation-sync",
            every = "{reputation.sync.interval}",
            delayed = "30s",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduledRun() {
        runOnce();
    }

    /**
     * Reconciles one batch of records.
     */
    public SyncRunSummary runOnce() {
        String runId = "reputation-sync-" + clock.millis();
        Span jobSpan = tracer.spanBuilder("job.reputation_sync").setAttribute("job.id", runId).startSpan();

        try (Scope jobScope = jobSpan.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setJobId(runId);

            List<SyncCandidate> candidates = repository.findNeedingSync(batchSize).stream().map(SyncCandidate::of)
                    .toList();
            LOG.infof("Starting reputation sync run %s for %d records", runId, candidates.size());
            jobSpan.setAttribute("records.count", candidates.size());

            int synced = 0;
            int diverged = 0;
            int failed = 0;

            for (SyncCandidate candidate : candidates) {
                Span userSpan = tracer.spanBuilder("reputation.reconcile_user").setAttribute("job.id", runId)
                        .setAttribute("user.id", candidate.userId()).startSpan();

                try (Scope userScope = userSpan.makeCurrent()) {
                    LoggingConfig.setUserId(candidate.userId());
                    ReconciliationOutcomeType outcome = synchronizer.reconcile(candidate.userId());

                    String state = outcome.synced() ? ReputationRecord.SYNC_STATE_SYNCED
                            : ReputationRecord.SYNC_STATE_DIVERGED;
                    storeOutcome(candidate, state, outcome.lastSyncAttempt());
                    userSpan.setAttribute("status", state);

                    if (outcome.synced()) {
                        synced++;
                    } else {
                        diverged++;
                        LOG.infof("User %s not synced: %s", candidate.userId(), outcome.discrepancies());
                    }

                } catch (Exception e) {
                    failed++;
                    userSpan.setAttribute("status", "error");
                    userSpan.recordException(e);
                    LOG.errorf(e, "Failed to reconcile reputation for user %s", candidate.userId());
                    markDiverged(candidate);

                } finally {
                    userSpan.end();
                }
            }

            jobSpan.setAttribute("records.synced", synced);
            jobSpan.setAttribute("records.diverged", diverged);
            jobSpan.setAttribute("records.failed", failed);
            LOG.infof("Reputation sync run %s completed: %d synced, %d diverged, %d failed", runId, synced, diverged,
                    failed);
            return new SyncRunSummary(synced, diverged, failed);

        } finally {
            jobSpan.end();
            LoggingConfig.clearMDC();
        }
    }

    private void storeOutcome(SyncCandidate candidate, String state, Instant attemptedAt) {
        if (!repository.updateSyncStateIfUnchanged(candidate.userId(), candidate.syncState(),
                candidate.lastSyncAttempt(), state, attemptedAt)) {
            LOG.infof("Sync state of user %s changed during run; leaving it for the next run", candidate.userId());
        }
    }

    /**
     * Moves a failed record behind the rest of the queue so it cannot starve other users.
     */
    private void markDiverged(SyncCandidate candidate) {
        try {
            storeOutcome(candidate, ReputationRecord.SYNC_STATE_DIVERGED, clock.instant());
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to record sync failure for user %s", candidate.userId());
        }
    }
}
