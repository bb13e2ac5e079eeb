/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.exceptions;

/**
 * Base type for business-rule rejections of a bonus claim.
 *
 * <p>
 * Rejections are deterministic: retrying with the same arguments fails again. {@link #reasonCode()} is stable and
 * meant to be rendered verbatim by the UI layer.
 */
public abstract class ClaimRejectedException extends RuntimeException {

    private final String campaignId;
    private final String userId;

    protected ClaimRejectedException(String campaignId, String userId, String message) {
        super(message);
        this.campaignId = campaignId;
        this.userId = userId;
    }

    /**
     * @return stable machine-readable rejection reason (e.g. {@code already_claimed})
     */
    public abstract String reasonCode();

    public String getCampaignId() {
        return campaignId;
    }

    public String getUserId() {
        return userId;
    }
}
