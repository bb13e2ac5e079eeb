/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.exceptions;

/**
 * Rejection: the campaign's remaining bonus pool cannot cover the claim amount.
 */
public class PoolExhaustedException extends ClaimRejectedException {

    public static final String REASON = "pool_exhausted";

    private final long requestedAmount;

    public PoolExhaustedException(String campaignId, String userId, long requestedAmount) {
        super(campaignId, userId,
                "Bonus pool of campaign " + campaignId + " cannot cover a claim of " + requestedAmount + " units");
        this.requestedAmount = requestedAmount;
    }

    @Override
    public String reasonCode() {
        return REASON;
    }

    public long getRequestedAmount() {
        return requestedAmount;
    }
}
