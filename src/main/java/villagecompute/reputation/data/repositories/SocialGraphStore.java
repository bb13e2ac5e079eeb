/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.data.repositories;

import java.util.List;

import villagecompute.reputation.api.types.SocialEdgeType;

/**
 * View over follow relationships.
 */
public interface SocialGraphStore {

    /**
     * Edges of the viewer up to two hops: hop-1 for users the viewer follows, hop-2 for users they follow, excluding
     * the viewer and hop-1 users. Users further away are absent.
     */
    List<SocialEdgeType> getEdges(String viewerId);

    boolean hasDirectEdge(String followerId, String followedId);

    /**
     * Stores a direct follow edge.
     *
     * @return false when the edge already existed
     */
    boolean addDirectEdge(String followerId, String followedId, String ledgerTransactionId);

    /**
     * Removes a direct follow edge.
     *
     * @return false when there was no such edge
     */
    boolean removeDirectEdge(String followerId, String followedId);
}
