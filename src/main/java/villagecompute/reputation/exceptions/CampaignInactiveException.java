/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.exceptions;

/**
 * Rejection: the campaign does not exist, has expired, or its bonus pool is empty.
 */
public class CampaignInactiveException extends ClaimRejectedException {

    public static final String REASON = "campaign_inactive";

    public CampaignInactiveException(String campaignId, String userId, String message) {
        super(campaignId, userId, message);
    }

    @Override
    public String reasonCode() {
        return REASON;
    }
}
