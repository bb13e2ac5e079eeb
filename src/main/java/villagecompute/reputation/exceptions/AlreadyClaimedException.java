/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.exceptions;

/**
 * Rejection: the ledger already holds a claim for this (campaign, user) pair.
 */
public class AlreadyClaimedException extends ClaimRejectedException {

    public static final String REASON = "already_claimed";

    public AlreadyClaimedException(String campaignId, String userId) {
        super(campaignId, userId, "Bonus for campaign " + campaignId + " was already claimed by user " + userId);
    }

    @Override
    public String reasonCode() {
        return REASON;
    }
}
