/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static villagecompute.reputation.TestConstants.CONTENT_ID;
import static villagecompute.reputation.TestConstants.FRIEND_ID;
import static villagecompute.reputation.TestConstants.FRIEND_OF_FRIEND_ID;
import static villagecompute.reputation.TestConstants.NOW;
import static villagecompute.reputation.TestConstants.STRANGER_ID;
import static villagecompute.reputation.TestConstants.VIEWER_ID;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import villagecompute.reputation.api.types.EndorsementType;
import villagecompute.reputation.api.types.TrustScoreResultType;
import villagecompute.reputation.exceptions.ValidationException;

/**
 * Unit tests for {@link TrustScorer}.
 */
class TrustScorerTest {

    private static final double DELTA = 1e-9;

    private TrustScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new TrustScorer(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testComputeTrustScore_directAndIndirectEndorsers() {
        TrustScoreResultType result = scorer.computeTrustScore(VIEWER_ID, CONTENT_ID,
                List.of(endorsement(FRIEND_ID, 0.8, 1), endorsement(FRIEND_OF_FRIEND_ID, 0.6, 2)));

        assertEquals(0.75, result.socialMultiplier(), DELTA);
        assertEquals(3.75, result.finalScore(), DELTA);
        assertEquals(3.8, result.displayScore(), DELTA);
        assertEquals(5.0, result.baseScore(), DELTA);
        assertEquals(1, result.breakdown().directCount());
        assertEquals(1, result.breakdown().indirectCount());
        assertEquals(0.75, result.breakdown().totalWeight(), DELTA);
        assertEquals("2 endorsements • 1 direct • 1 network", result.breakdown().provenance());
        assertEquals(NOW, result.computedAt());
        assertEquals(VIEWER_ID, result.viewerId());
        assertEquals(CONTENT_ID, result.contentId());
    }

    @Test
    void testComputeTrustScore_noEndorsementsScoresZero() {
        TrustScoreResultType result = scorer.computeTrustScore(VIEWER_ID, CONTENT_ID, List.of());

        assertEquals(0.0, result.finalScore(), DELTA);
        assertEquals(0.0, result.socialMultiplier(), DELTA);
        assertFalse(result.hasEndorsements());
        assertFalse(TrustScorer.isRewardEligible(result));
    }

    @Test
    void testComputeTrustScore_endorsersBeyondTwoHopsContributeNothing() {
        TrustScoreResultType result = scorer.computeTrustScore(VIEWER_ID, CONTENT_ID,
                List.of(endorsement(STRANGER_ID, 1.0, 3)));

        assertEquals(0.0, result.finalScore(), DELTA);
        assertEquals(0, result.breakdown().directCount());
        assertEquals(0, result.breakdown().indirectCount());
        assertEquals("1 endorsements • 0 direct • 0 network", result.breakdown().provenance());
    }

    @Test
    void testComputeTrustScore_multiplierAndScoreAreCapped() {
        List<EndorsementType> endorsements = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            endorsements.add(endorsement("friend-" + i, 1.0, 1));
        }

        TrustScoreResultType result = scorer.computeTrustScore(VIEWER_ID, CONTENT_ID, endorsements);

        assertEquals(7.5, result.breakdown().totalWeight(), DELTA);
        assertEquals(TrustScorer.MAX_SOCIAL_MULTIPLIER, result.socialMultiplier(), DELTA);
        assertEquals(TrustScorer.MAX_FINAL_SCORE, result.finalScore(), DELTA);
    }

    @Test
    void testComputeTrustScore_scoreCappedAtTenBeforeMultiplierCap() {
        // 3 direct endorsers at 1.0 give a multiplier of 2.25, i.e. 11.25 before the score cap
        TrustScoreResultType result = scorer.computeTrustScore(VIEWER_ID, CONTENT_ID, List.of(
                endorsement("f1", 1.0, 1), endorsement("f2", 1.0, 1), endorsement("f3", 1.0, 1)));

        assertEquals(2.25, result.socialMultiplier(), DELTA);
        assertEquals(10.0, result.finalScore(), DELTA);
    }

    @Test
    void testComputeTrustScore_monotonicInEndorserTrust() {
        double previous = -1.0;
        for (double trust = 0.0; trust <= 1.0; trust += 0.1) {
            TrustScoreResultType result = scorer.computeTrustScore(VIEWER_ID, CONTENT_ID,
                    List.of(endorsement(FRIEND_ID, trust, 1), endorsement(FRIEND_OF_FRIEND_ID, 0.5, 2)));
            assertTrue(result.finalScore() >= previous, "score decreased at trust " + trust);
            previous = result.finalScore();
        }
    }

    @Test
    void testComputeTrustScore_outOfRangeTrustIsClampedAndReported() {
        TrustScoreResultType result = scorer.computeTrustScore(VIEWER_ID, CONTENT_ID,
                List.of(endorsement(FRIEND_ID, 4.0, 1), endorsement(FRIEND_OF_FRIEND_ID, -2.0, 2),
                        endorsement("friend-nan", Double.NaN, 1)));

        assertEquals(0.75, result.socialMultiplier(), DELTA);
        assertEquals(3, result.breakdown().clampedCount());
        assertEquals(List.of(FRIEND_ID, FRIEND_OF_FRIEND_ID, "friend-nan"),
                result.breakdown().clampedEndorserIds());
    }

    @Test
    void testComputeTrustScore_nullEndorsementsRejected() {
        assertThrows(ValidationException.class, () -> scorer.computeTrustScore(VIEWER_ID, CONTENT_ID, null));
    }

    @Test
    void testComputeTrustScore_nullEntryRejected() {
        List<EndorsementType> endorsements = Arrays.asList(endorsement(FRIEND_ID, 0.5, 1), null);

        assertThrows(ValidationException.class,
                () -> scorer.computeTrustScore(VIEWER_ID, CONTENT_ID, endorsements));
    }

    @Test
    void testComputeTrustScore_hopDistanceBelowOneRejected() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> scorer.computeTrustScore(VIEWER_ID, CONTENT_ID, List.of(endorsement(FRIEND_ID, 0.5, 0))));

        assertTrue(e.getMessage().contains(FRIEND_ID));
    }

    @Test
    void testIsRewardEligible_threshold() {
        // two friend-of-friend endorsers at full trust: multiplier 0.5, final score exactly 2.5
        TrustScoreResultType atThreshold = scorer.computeTrustScore(VIEWER_ID, CONTENT_ID,
                List.of(endorsement("fof-1", 1.0, 2), endorsement("fof-2", 1.0, 2)));
        TrustScoreResultType below = scorer.computeTrustScore(VIEWER_ID, CONTENT_ID,
                List.of(endorsement("fof-1", 1.0, 2)));

        assertEquals(TrustScorer.REWARD_ELIGIBILITY_THRESHOLD, atThreshold.finalScore(), DELTA);
        assertTrue(TrustScorer.isRewardEligible(atThreshold));
        assertFalse(TrustScorer.isRewardEligible(below));
    }

    private static EndorsementType endorsement(String endorserId, double trust, int hop) {
        return new EndorsementType(endorserId, CONTENT_ID, trust, hop);
    }
}
