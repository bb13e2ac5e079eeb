/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.testing;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import villagecompute.reputation.data.models.ReputationRecord;
import villagecompute.reputation.data.repositories.ReputationRecordRepository;

public class InMemoryReputationRecordRepository implements ReputationRecordRepository {

    private final Map<String, ReputationRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<ReputationRecord> get(String userId) {
        return Optional.ofNullable(records.get(userId));
    }

    @Override
    public void save(ReputationRecord record) {
        records.put(record.userId, record);
    }

    @Override
    public List<ReputationRecord> findNeedingSync(int limit) {
        return records.values().stream()
                .filter(r -> ReputationRecord.SYNC_STATE_PENDING.equals(r.ledgerSyncState)
                        || ReputationRecord.SYNC_STATE_DIVERGED.equals(r.ledgerSyncState))
                .sorted(Comparator.comparing((ReputationRecord r) -> r.lastSyncAttempt,
                        Comparator.nullsFirst(Comparator.naturalOrder())).thenComparing(r -> r.userId))
                .limit(limit).toList();
    }

    @Override
    public synchronized void updateSyncState(String userId, String syncState, Instant attemptedAt) {
        ReputationRecord record = records.get(userId);
        if (record != null) {
            record.ledgerSyncState = syncState;
            record.lastSyncAttempt = attemptedAt;
        }
    }

    @Override
    public synchronized boolean updateSyncStateIfUnchanged(String userId, String expectedState,
            Instant expectedAttempt, String syncState, Instant attemptedAt) {
        ReputationRecord record = records.get(userId);
        if (record == null || !Objects.equals(record.ledgerSyncState, expectedState)
                || !Objects.equals(record.lastSyncAttempt, expectedAttempt)) {
            return false;
        }
        record.ledgerSyncState = syncState;
        record.lastSyncAttempt = attemptedAt;
        return true;
    }

    /**
     * Stores a record in state pending.
     */
    public ReputationRecord add(String userId, double score, String verificationLevel) {
        ReputationRecord record = new ReputationRecord();
        record.userId = userId;
        record.reputationScore = score;
        record.verificationLevel = verificationLevel;
        record.ledgerSyncState = ReputationRecord.SYNC_STATE_PENDING;
        record.lastUpdated = Instant.EPOCH;
        save(record);
        return record;
    }
}
