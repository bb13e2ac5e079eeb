/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.services;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.reputation.api.types.EndorsementType;
import villagecompute.reputation.api.types.SocialEdgeType;
import villagecompute.reputation.api.types.TrustScoreBreakdownType;
import villagecompute.reputation.api.types.TrustScoreResultType;
import villagecompute.reputation.exceptions.ValidationException;

/**
 * Computes a viewer-specific trust score for a content item from weighted social endorsements.
 *
 * <p>
 * <b>Algorithm:</b>
 * <ul>
 * <li>Each endorsement contributes {@code weightFor(hop) * endorserTrustScore}: 0.75 for a direct connection, 0.25
 * for a friend-of-friend, 0 beyond</li>
 * <li>The sum is capped at {@value #MAX_SOCIAL_MULTIPLIER} to give the social multiplier</li>
 * <li>{@code finalScore = min(BASE_SCORE * socialMultiplier, 10.0)}; an unendorsed item scores 0</li>
 * </ul>
 *
 * <p>
 * Endorser trust scores outside [0, 1] are clamped and reported in the breakdown instead of failing the whole
 * computation. Input must already be deduplicated by endorser.
 *
 * <p>
 * This class is pure: it never reads the social graph or the ledger, and is safe to call from any thread.
 */
@ApplicationScoped
public class TrustScorer {

    public static final double BASE_SCORE = 5.0;
    public static final double MAX_SOCIAL_MULTIPLIER = 3.0;
    public static final double MAX_FINAL_SCORE = 10.0;

    /**
     * Minimum final score (0-10 scale) at which content qualifies for reward programs.
     */
    public static final double REWARD_ELIGIBILITY_THRESHOLD = 2.5;

    private final Clock clock;

    @Inject
    public TrustScorer(Clock clock) {
        this.clock = clock;
    }

    /**
     * Scores a content item for a viewer.
     *
     * @param viewerId
     *            viewer the score is personalised for
     * @param contentId
     *            content being scored
     * @param endorsements
     *            endorsements deduplicated by endorser, with hop distances resolved from the viewer
     * @return fresh result with full-precision scores and a breakdown
     * @throws ValidationException
     *             if endorsements is null, contains null, or has a hop distance below 1
     */
    public TrustScoreResultType computeTrustScore(String viewerId, String contentId,
            List<EndorsementType> endorsements) {
        if (endorsements == null) {
            throw new ValidationException("Endorsements must not be null");
        }

        int directCount = 0;
        int indirectCount = 0;
        double totalWeight = 0.0;
        List<String> clampedEndorserIds = new ArrayList<>();

        for (EndorsementType endorsement : endorsements) {
            if (endorsement == null) {
                throw new ValidationException("Endorsement list for content " + contentId + " contains null");
            }
            int hop = endorsement.hopDistanceFromViewer();
            if (hop < 1) {
                throw new ValidationException("Hop distance must be at least 1, got " + hop + " for endorser "
                        + endorsement.endorserId());
            }

            double trust = endorsement.endorserTrustScore();
            double clamped = clamp(trust);
            if (clamped != trust || Double.isNaN(trust)) {
                clampedEndorserIds.add(endorsement.endorserId());
            }

            if (hop == 1) {
                directCount++;
            } else if (hop == 2) {
                indirectCount++;
            }
            totalWeight += SocialEdgeType.weightFor(hop) * clamped;
        }

        double socialMultiplier = Math.min(totalWeight, MAX_SOCIAL_MULTIPLIER);
        double finalScore = Math.min(BASE_SCORE * socialMultiplier, MAX_FINAL_SCORE);

        TrustScoreBreakdownType breakdown = new TrustScoreBreakdownType(directCount, indirectCount, totalWeight,
                clampedEndorserIds.size(), List.copyOf(clampedEndorserIds),
                provenance(endorsements.size(), directCount, indirectCount));

        return new TrustScoreResultType(contentId, viewerId, BASE_SCORE, socialMultiplier, finalScore, clock.instant(),
                breakdown);
    }

    /**
     * @return true when the score meets {@link #REWARD_ELIGIBILITY_THRESHOLD}
     */
    public static boolean isRewardEligible(TrustScoreResultType result) {
        return result.finalScore() >= REWARD_ELIGIBILITY_THRESHOLD;
    }

    static String provenance(int total, int direct, int indirect) {
        return total + " endorsements • " + direct + " direct • " + indirect + " network";
    }

    private static double clamp(double trust) {
        if (Double.isNaN(trust)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, trust));
    }
}
