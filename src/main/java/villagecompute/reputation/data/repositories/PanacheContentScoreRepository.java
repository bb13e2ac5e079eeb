/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.data.repositories;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.reputation.data.models.ContentTrustScore;

/**
 * {@link ContentScoreRepository} backed by the {@link ContentTrustScore} entity.
 */
@ApplicationScoped
public class PanacheContentScoreRepository implements ContentScoreRepository {

    @Override
    public Map<String, Double> findNormalizedScores(Collection<String> contentIds) {
        Map<String, Double> scores = new HashMap<>();
        for (ContentTrustScore score : ContentTrustScore.findByContentIds(contentIds)) {
            scores.put(score.contentId, score.normalizedScore());
        }
        return scores;
    }
}
