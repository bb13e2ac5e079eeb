/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One endorsement of a content item, already resolved against the viewer's social graph.
 *
 * <p>
 * Transient input to a single trust-score computation; never persisted by the engine. Lists handed to the scorer must
 * already be deduplicated by {@code endorserId}.
 *
 * @param endorserId
 *            user who endorsed the content
 * @param targetContentId
 *            endorsed content item
 * @param endorserTrustScore
 *            endorser's own trust score, nominally in [0, 1]; out-of-range values are clamped by the scorer
 * @param hopDistanceFromViewer
 *            social distance from the viewer (1 = direct, 2 = friend-of-friend, 3+ = no influence)
 */
public record EndorsementType(@JsonProperty("endorser_id") String endorserId,
        @JsonProperty("target_content_id") String targetContentId,
        @JsonProperty("endorser_trust_score") double endorserTrustScore,
        @JsonProperty("hop_distance_from_viewer") int hopDistanceFromViewer) {
}
