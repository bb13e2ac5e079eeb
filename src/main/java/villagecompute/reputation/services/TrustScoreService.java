/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.services;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.reputation.api.types.EndorsementType;
import villagecompute.reputation.api.types.SocialEdgeType;
import villagecompute.reputation.api.types.TrustScoreResultType;
import villagecompute.reputation.data.models.ContentEndorsement;
import villagecompute.reputation.data.repositories.EndorsementRepository;
import villagecompute.reputation.data.repositories.SocialGraphStore;
import villagecompute.reputation.exceptions.ValidationException;
import villagecompute.reputation.observability.EngineMetrics;

/**
 * Gathers endorsement inputs for a viewer and content item, then scores them through {@link TrustScorer} behind
 * {@link TrustScoreCache}.
 *
 * <p>
 * <b>Input assembly:</b>
 * <ul>
 * <li>Endorsements are loaded from the vote records and deduplicated by endorser; the highest endorser trust score
 * wins</li>
 * <li>Hop distance comes from the viewer's social edges; an endorser with no edge gets distance 3 and contributes
 * nothing</li>
 * </ul>
 */
@ApplicationScoped
public class TrustScoreService {

    private static final Logger LOG = Logger.getLogger(TrustScoreService.class);

    /** Hop distance assigned to endorsers outside the viewer's two-hop neighbourhood. */
    static final int UNCONNECTED_HOP_DISTANCE = 3;

    @Inject
    TrustScorer trustScorer;

    @Inject
    TrustScoreCache cache;

    @Inject
    SocialGraphStore socialGraphStore;

    @Inject
    EndorsementRepository endorsementRepository;

    @Inject
    EngineMetrics metrics;

    /**
     * Returns the viewer's trust score for a content item, from cache when fresh.
     *
     * @throws ValidationException
     *             if either id is blank
     */
    public TrustScoreResultType scoreFor(String viewerId, String contentId) {
        if (viewerId == null || viewerId.isBlank() || contentId == null || contentId.isBlank()) {
            throw new ValidationException("Viewer and content ids are required");
        }

        Optional<TrustScoreResultType> cached = cache.find(viewerId, contentId);
        if (cached.isPresent()) {
            metrics.incrementTrustScore(true);
            return cached.get();
        }

        long generation = cache.generation();
        List<EndorsementType> endorsements = assembleEndorsements(viewerId, contentId);
        TrustScoreResultType result = trustScorer.computeTrustScore(viewerId, contentId, endorsements);
        if (!cache.put(result, generation)) {
            LOG.debugf("Cache invalidated while scoring content %s for viewer %s; result not cached", contentId,
                    viewerId);
        }

        metrics.incrementTrustScore(false);
        metrics.incrementClampedEndorsements(result.breakdown().clampedCount());
        if (result.breakdown().clampedCount() > 0) {
            LOG.warnf("Clamped %d endorser trust scores for content %s: %s", result.breakdown().clampedCount(),
                    contentId, result.breakdown().clampedEndorserIds());
        }
        LOG.debugf("Scored content %s for viewer %s: %.3f (%s)", contentId, viewerId, result.finalScore(),
                result.breakdown().provenance());
        return result;
    }

    /**
     * Drops cached scores for a content item after a new endorsement is recorded.
     */
    public void onEndorsementRecorded(String contentId) {
        int removed = cache.invalidateContent(contentId);
        LOG.debugf("Endorsement recorded for content %s, invalidated %d cached scores", contentId, removed);
    }

    /**
     * Drops cached scores computed for a viewer after their connections change.
     */
    public void onConnectionsChanged(String viewerId) {
        int removed = cache.invalidateViewer(viewerId);
        LOG.debugf("Connections changed for viewer %s, invalidated %d cached scores", viewerId, removed);
    }

    List<EndorsementType> assembleEndorsements(String viewerId, String contentId) {
        Map<String, Double> bestScoreByEndorser = new LinkedHashMap<>();
        for (ContentEndorsement endorsement : endorsementRepository.findByContentId(contentId)) {
            bestScoreByEndorser.merge(endorsement.endorserId, endorsement.endorserTrustScore, Math::max);
        }
        if (bestScoreByEndorser.isEmpty()) {
            return List.of();
        }

        Map<String, Integer> hopByUser = new HashMap<>();
        for (SocialEdgeType edge : socialGraphStore.getEdges(viewerId)) {
            hopByUser.merge(edge.otherId(), edge.hopDistance(), Math::min);
        }

        List<EndorsementType> endorsements = new ArrayList<>(bestScoreByEndorser.size());
        bestScoreByEndorser.forEach((endorserId, trust) -> endorsements.add(new EndorsementType(endorserId, contentId,
                trust, hopByUser.getOrDefault(endorserId, UNCONNECTED_HOP_DISTANCE))));
        return endorsements;
    }
}
