/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.data.repositories;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.reputation.data.models.ReputationRecord;

/**
 * {@link ReputationRecordRepository} backed by the {@link ReputationRecord} entity.
 */
@ApplicationScoped
public class PanacheReputationRecordRepository implements ReputationRecordRepository {

    @Override
    public Optional<ReputationRecord> get(String userId) {
        return ReputationRecord.findByUserId(userId);
    }

    @Override
    public void save(ReputationRecord record) {
        ReputationRecord.upsert(record);
    }

    @Override
    public List<ReputationRecord> findNeedingSync(int limit) {
        return ReputationRecord.findNeedingSync(limit);
    }

    @Override
    public void updateSyncState(String userId, String syncState, Instant attemptedAt) {
        ReputationRecord.updateSyncState(userId, syncState, attemptedAt);
    }

    @Override
    public boolean updateSyncStateIfUnchanged(String userId, String expectedState, Instant expectedAttempt,
            String syncState, Instant attemptedAt) {
        return ReputationRecord.updateSyncStateIfUnchanged(userId, expectedState, expectedAttempt, syncState,
                attemptedAt) > 0;
    }
}
