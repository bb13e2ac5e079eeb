/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.data.repositories;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.reputation.api.types.SocialEdgeType;
import villagecompute.reputation.data.models.SocialEdge;

/**
 * {@link SocialGraphStore} backed by stored direct edges; friend-of-friend edges are derived per call.
 */
@ApplicationScoped
public class PanacheSocialGraphStore implements SocialGraphStore {

    @Override
    public List<SocialEdgeType> getEdges(String viewerId) {
        Set<String> direct = new LinkedHashSet<>();
        for (SocialEdge edge : SocialEdge.findByFollower(viewerId)) {
            direct.add(edge.followedId);
        }

        Set<String> indirect = new LinkedHashSet<>();
        for (SocialEdge edge : SocialEdge.findByFollowers(direct)) {
            if (!edge.followedId.equals(viewerId) && !direct.contains(edge.followedId)) {
                indirect.add(edge.followedId);
            }
        }

        List<SocialEdgeType> edges = new ArrayList<>(direct.size() + indirect.size());
        direct.forEach(otherId -> edges.add(SocialEdgeType.direct(viewerId, otherId)));
        indirect.forEach(otherId -> edges.add(SocialEdgeType.indirect(viewerId, otherId)));
        return edges;
    }

    @Override
    public boolean hasDirectEdge(String followerId, String followedId) {
        return SocialEdge.findEdge(followerId, followedId).isPresent();
    }

    @Override
    public boolean addDirectEdge(String followerId, String followedId, String ledgerTransactionId) {
        return QuarkusTransaction.requiringNew().call(() -> {
            if (SocialEdge.findEdge(followerId, followedId).isPresent()) {
                return false;
            }
            SocialEdge edge = new SocialEdge();
            edge.followerId = followerId;
            edge.followedId = followedId;
            edge.ledgerTransactionId = ledgerTransactionId;
            edge.createdAt = Instant.now();
            edge.persist();
            return true;
        });
    }

    @Override
    public boolean removeDirectEdge(String followerId, String followedId) {
        return QuarkusTransaction.requiringNew()
                .call(() -> SocialEdge.delete("followerId = ?1 AND followedId = ?2", followerId, followedId) > 0);
    }
}
