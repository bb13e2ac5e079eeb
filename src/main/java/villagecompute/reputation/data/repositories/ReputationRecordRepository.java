/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.data.repositories;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import villagecompute.reputation.data.models.ReputationRecord;

/**
 * Local authoritative store of off-chain reputation records.
 */
public interface ReputationRecordRepository {

    /**
     * @return the user's record, or empty when the user is unknown
     */
    Optional<ReputationRecord> get(String userId);

    void save(ReputationRecord record);

    /**
     * Records in state {@code pending} or {@code diverged}, least recently reconciled first.
     */
    List<ReputationRecord> findNeedingSync(int limit);

    /**
     * Writes sync bookkeeping only; reputation fields are never touched.
     */
    void updateSyncState(String userId, String syncState, Instant attemptedAt);

    /**
     * Like {@link #updateSyncState}, but only when the record's sync state and last attempt still equal the expected
     * values.
     *
     * @return false if the record changed in the meantime or does not exist
     */
    boolean updateSyncStateIfUnchanged(String userId, String expectedState, Instant expectedAttempt, String syncState,
            Instant attemptedAt);
}
