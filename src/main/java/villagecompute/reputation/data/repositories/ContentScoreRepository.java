/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.data.repositories;

import java.util.Collection;
import java.util.Map;

/**
 * Read access to stored content trust scores.
 */
public interface ContentScoreRepository {

    /**
     * Stored scores normalized to [0, 1], keyed by content id. Content without a stored score is absent from the map.
     */
    Map<String, Double> findNormalizedScores(Collection<String> contentIds);
}
