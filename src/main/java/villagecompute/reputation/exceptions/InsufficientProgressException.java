/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.exceptions;

import java.util.List;

/**
 * Rejection: too few contributing content items, or some of them score below the campaign's minimum trust score.
 */
public class InsufficientProgressException extends ClaimRejectedException {

    public static final String REASON = "insufficient_progress";

    private final int missingCount;
    private final List<String> belowThresholdContentIds;

    public InsufficientProgressException(String campaignId, String userId, int missingCount,
            List<String> belowThresholdContentIds) {
        super(campaignId, userId, buildMessage(missingCount, belowThresholdContentIds));
        this.missingCount = missingCount;
        this.belowThresholdContentIds = List.copyOf(belowThresholdContentIds);
    }

    private static String buildMessage(int missingCount, List<String> belowThresholdContentIds) {
        StringBuilder message = new StringBuilder("Insufficient campaign progress");
        if (missingCount > 0) {
            message.append(": need ").append(missingCount).append(" more recommendation")
                    .append(missingCount == 1 ? "" : "s");
        }
        if (!belowThresholdContentIds.isEmpty()) {
            message.append(missingCount > 0 ? "; " : ": ").append("below minimum trust score: ")
                    .append(String.join(", ", belowThresholdContentIds));
        }
        return message.toString();
    }

    @Override
    public String reasonCode() {
        return REASON;
    }

    /**
     * @return number of additional content items needed to reach the campaign target (0 when the count was met)
     */
    public int getMissingCount() {
        return missingCount;
    }

    public List<String> getBelowThresholdContentIds() {
        return belowThresholdContentIds;
    }
}
