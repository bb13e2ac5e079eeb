/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Edge of the viewer's social graph view.
 *
 * <p>
 * Hop distance 1 always carries weight 0.75 and hop distance 2 weight 0.25. Anything further away is not represented.
 *
 * @param viewerId
 *            viewer the edge is relative to
 * @param otherId
 *            connected user
 * @param hopDistance
 *            1 or 2
 * @param edgeWeight
 *            influence weight derived from the hop distance
 */
public record SocialEdgeType(@JsonProperty("viewer_id") String viewerId, @JsonProperty("other_id") String otherId,
        @JsonProperty("hop_distance") int hopDistance, @JsonProperty("edge_weight") double edgeWeight) {

    public static final double DIRECT_WEIGHT = 0.75;
    public static final double INDIRECT_WEIGHT = 0.25;

    public static SocialEdgeType direct(String viewerId, String otherId) {
        return new SocialEdgeType(viewerId, otherId, 1, DIRECT_WEIGHT);
    }

    public static SocialEdgeType indirect(String viewerId, String otherId) {
        return new SocialEdgeType(viewerId, otherId, 2, INDIRECT_WEIGHT);
    }

    /**
     * Influence weight for a hop distance: 0.75 for direct, 0.25 for friend-of-friend, 0 otherwise.
     */
    public static double weightFor(int hopDistance) {
        if (hopDistance == 1) {
            return DIRECT_WEIGHT;
        }
        if (hopDistance == 2) {
            return INDIRECT_WEIGHT;
        }
        return 0.0;
    }
}
