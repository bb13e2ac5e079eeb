/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.services;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.reputation.api.types.ClaimRecordType;
import villagecompute.reputation.api.types.ClaimResultType;
import villagecompute.reputation.api.types.IncentiveCampaignType;
import villagecompute.reputation.api.types.LedgerClaimStatusType;
import villagecompute.reputation.api.types.LedgerTransactionResultType;
import villagecompute.reputation.api.types.LedgerTransactionStatus;
import villagecompute.reputation.data.models.ClaimRecord;
import villagecompute.reputation.data.models.IncentiveCampaign;
import villagecompute.reputation.data.models.PendingClaim;
import villagecompute.reputation.data.models.ReputationRecord;
import villagecompute.reputation.data.repositories.CampaignRepository;
import villagecompute.reputation.data.repositories.ClaimRecordRepository;
import villagecompute.reputation.data.repositories.ContentScoreRepository;
import villagecompute.reputation.data.repositories.ReputationRecordRepository;
import villagecompute.reputation.exceptions.AlreadyClaimedException;
import villagecompute.reputation.exceptions.CampaignInactiveException;
import villagecompute.reputation.exceptions.ClaimRejectedException;
import villagecompute.reputation.exceptions.DataIntegrityException;
import villagecompute.reputation.exceptions.InsufficientProgressException;
import villagecompute.reputation.exceptions.LedgerUnavailableException;
import villagecompute.reputation.exceptions.PoolExhaustedException;
import villagecompute.reputation.exceptions.ResourceNotFoundException;
import villagecompute.reputation.exceptions.ValidationException;
import villagecompute.reputation.integration.ledger.LedgerGateway;
import villagecompute.reputation.observability.EngineMetrics;
import villagecompute.reputation.observability.LoggingConfig;

/**
 * Lists the bonus campaigns a user qualifies for and pays out campaign claims through the ledger.
 *
 * <p>
 * <b>Claim preconditions</b>, checked in order:
 * <ol>
 * <li>A claim this pair left pending is resolved first: confirmed on the ledger it becomes a claim record and the call
 * is rejected as already claimed; still unconfirmed it is reported as unavailable until the settle grace passes, after
 * which it is released and its pool debit credited back</li>
 * <li>Campaign exists, is unexpired and has a non-empty pool ({@link CampaignInactiveException})</li>
 * <li>The ledger has no claim for the pair ({@link AlreadyClaimedException}); local and ledger claim state must
 * agree, otherwise {@link DataIntegrityException}</li>
 * <li>Enough distinct content items whose stored trust score meets the campaign minimum
 * ({@link InsufficientProgressException})</li>
 * <li>The pool covers the claim amount ({@link PoolExhaustedException}), checked and debited in one conditional
 * update</li>
 * </ol>
 *
 * <p>
 * <b>Concurrency:</b> two claims for the same pair are serialized by the ledger, which accepts at most one claim per
 * (campaign, user). The loser's transaction fails, its pool debit is credited back, and it is rejected as already
 * claimed. No in-process lock is held, so several engine instances can run side by side.
 *
 * <p>
 * A ledger claim without a local record or pending marker is treated as in flight for
 * {@code reputation.campaign.claim-settle-grace}; after that it is a data-integrity violation.
 */
@ApplicationScoped
public class IncentiveCampaignService {

    private static final Logger LOG = Logger.getLogger(IncentiveCampaignService.class);

    @ConfigProperty(
            name = "reputation.campaign.claim-settle-grace",
            defaultValue = "2m")
    Duration claimSettleGrace;

    @Inject
    CampaignRepository campaignRepository;

    @Inject
    ClaimRecordRepository claimRecordRepository;

    @Inject
    ContentScoreRepository contentScoreRepository;

    @Inject
    ReputationRecordRepository reputationRecordRepository;

    @Inject
    LedgerGateway ledger;

    @Inject
    EngineMetrics metrics;

    @Inject
    Clock clock;

    /**
     * Lists unexpired campaigns the user's reputation qualifies for, highest multiplier first, then soonest expiry.
     *
     * @param region
     *            region filter; null or empty matches any region
     * @param category
     *            category filter; null or empty matches any category
     * @throws ResourceNotFoundException
     *             if the user has no reputation record
     */
    public List<IncentiveCampaignType> listEligibleCampaigns(String userId, String region, String category) {
        requireId(userId, "User id");
        ReputationRecord user = reputationRecordRepository.get(userId)
                .orElseThrow(() -> new ResourceNotFoundException("No reputation record for user " + userId));

        List<IncentiveCampaignType> eligible = new ArrayList<>();
        for (IncentiveCampaign campaign : campaignRepository.findUnexpired(clock.instant())) {
            if (matches(region, campaign.region) && matches(category, campaign.category)
                    && user.reputationScore >= campaign.minTrustScore) {
                eligible.add(campaign.toType());
            }
        }
        eligible.sort(Comparator.comparingDouble(IncentiveCampaignType::bonusMultiplier).reversed()
                .thenComparing(IncentiveCampaignType::expiresAt));

        LOG.debugf("User %s eligible for %d campaigns (region=%s, category=%s)", userId, eligible.size(), region,
                category);
        return eligible;
    }

    /**
     * Claims a campaign bonus for the user.
     *
     * @param contentIds
     *            recommendations the user puts forward as campaign progress; duplicates count once
     * @return successful claim with the paid amount and ledger transaction id
     * @throws ClaimRejectedException
     *             subclass naming the failed precondition
     * @throws LedgerUnavailableException
     *             if the ledger cannot be reached or the claim transaction does not confirm
     * @throws DataIntegrityException
     *             if ledger and local claim state disagree
     */
    public ClaimResultType claimBonus(String userId, String campaignId, List<String> contentIds) {
        requireId(userId, "User id");
        requireId(campaignId, "Campaign id");
        if (contentIds == null) {
            throw new ValidationException("Content ids must not be null");
        }

        LoggingConfig.setUserId(userId);
        LoggingConfig.setCampaignId(campaignId);
        try {
            ClaimResultType result = doClaim(userId, campaignId, new LinkedHashSet<>(contentIds));
            metrics.incrementClaim(EngineMetrics.CLAIM_SUCCESS);
            return result;
        } catch (ClaimRejectedException e) {
            LOG.infof("Claim rejected for user %s in campaign %s: %s", userId, campaignId, e.getMessage());
            metrics.incrementClaim(e.reasonCode());
            throw e;
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    /**
     * @return the user's claims, most recent first
     */
    public List<ClaimRecordType> findClaims(String userId) {
        requireId(userId, "User id");
        return claimRecordRepository.findByUser(userId).stream().map(ClaimRecord::toType).toList();
    }

    private ClaimResultType doClaim(String userId, String campaignId, Set<String> contentIds) {
        Instant now = clock.instant();

        IncentiveCampaign campaign = campaignRepository.findById(campaignId)
                .orElseThrow(() -> new CampaignInactiveException(campaignId, userId, "Campaign " + campaignId
                        + " does not exist"));
        campaign = resolvePendingClaim(campaign, userId, now);
        if (!campaign.isActive(now)) {
            String reason = campaign.expiresAt.isAfter(now) ? "bonus pool exhausted" : "expired " + campaign.expiresAt;
            throw new CampaignInactiveException(campaignId, userId,
                    "Campaign " + campaignId + " is inactive: " + reason);
        }

        checkNotClaimed(campaignId, userId, now);
        checkProgress(campaign, userId, contentIds);

        long amount = campaign.claimAmount();
        if (!campaignRepository.debitPool(campaignId, amount)) {
            throw new PoolExhaustedException(campaignId, userId, amount);
        }

        LedgerTransactionResultType result = submitClaim(campaign, userId, amount, contentIds);

        try {
            claimRecordRepository.create(campaignId, userId, amount, result.transactionId(), contentIds,
                    clock.instant());
        } catch (RuntimeException e) {
            // The ledger holds the claim; the next evaluation of this pair re-queries it and surfaces the gap
            LOG.errorf(e, "Claim %s confirmed on ledger but local record for user %s in campaign %s failed",
                    result.transactionId(), userId, campaignId);
            metrics.incrementClaimBookkeepingFailure();
        }

        LOG.infof("User %s claimed %d units from campaign %s (tx %s)", userId, amount, campaignId,
                result.transactionId());
        return new ClaimResultType(true, amount, result.transactionId());
    }

    /**
     * Settles or releases a claim an earlier call left pending.
     *
     * @return the campaign, reloaded when a release changed its pool
     */
    private IncentiveCampaign resolvePendingClaim(IncentiveCampaign campaign, String userId, Instant now) {
        String campaignId = campaign.campaignId;
        Optional<PendingClaim> pending = claimRecordRepository.findPending(campaignId, userId);
        if (pending.isEmpty()) {
            return campaign;
        }
        PendingClaim marker = pending.get();

        LedgerClaimStatusType onLedger = ledger.fetchClaimStatus(campaignId, userId);
        if (onLedger.claimed()) {
            String transactionId = onLedger.transactionId() != null ? onLedger.transactionId() : marker.transactionId;
            Instant claimedAt = onLedger.claimedAt() != null ? onLedger.claimedAt() : now;
            claimRecordRepository.settlePending(campaignId, userId, transactionId, claimedAt);
            LOG.infof("Pending claim %s of %d units for user %s in campaign %s confirmed on ledger", transactionId,
                    marker.amount, userId, campaignId);
            throw new AlreadyClaimedException(campaignId, userId);
        }

        if (!marker.submittedAt.plus(claimSettleGrace).isBefore(now)) {
            throw new LedgerUnavailableException("Claim transaction " + marker.transactionId
                    + " not confirmed yet; retry later");
        }
        if (claimRecordRepository.releasePending(campaignId, userId)) {
            campaignRepository.creditPool(campaignId, marker.amount);
            LOG.warnf("Pending claim %s for user %s in campaign %s never confirmed; credited %d units back",
                    marker.transactionId, userId, campaignId, marker.amount);
        }
        return campaignRepository.findById(campaignId).orElse(campaign);
    }

    /**
     * Queries the ledger, the authoritative claim registry, and cross-checks local bookkeeping.
     */
    private void checkNotClaimed(String campaignId, String userId, Instant now) {
        LedgerClaimStatusType onLedger = ledger.fetchClaimStatus(campaignId, userId);
        Optional<ClaimRecord> local = claimRecordRepository.find(campaignId, userId);

        if (onLedger.claimed()) {
            if (local.isPresent() || isSettling(onLedger, now)) {
                throw new AlreadyClaimedException(campaignId, userId);
            }
            LOG.errorf("Ledger reports claim %s for user %s in campaign %s with no local record",
                    onLedger.transactionId(), userId, campaignId);
            throw new DataIntegrityException("Ledger reports claim " + onLedger.transactionId() + " for user "
                    + userId + " in campaign " + campaignId + " but no local claim record exists");
        }
        if (local.isPresent()) {
            LOG.errorf("Local claim %s for user %s in campaign %s is unknown to the ledger", local.get().transactionId,
                    userId, campaignId);
            throw new DataIntegrityException("Local claim record " + local.get().transactionId + " for user " + userId
                    + " in campaign " + campaignId + " is unknown to the ledger");
        }
    }

    private boolean isSettling(LedgerClaimStatusType onLedger, Instant now) {
        return onLedger.claimedAt() != null && !onLedger.claimedAt().plus(claimSettleGrace).isBefore(now);
    }

    private void checkProgress(IncentiveCampaign campaign, String userId, Set<String> contentIds) {
        Map<String, Double> scores = contentScoreRepository.findNormalizedScores(contentIds);

        List<String> belowThreshold = new ArrayList<>();
        for (String contentId : contentIds) {
            Double score = scores.get(contentId);
            if (score == null || score < campaign.minTrustScore) {
                belowThreshold.add(contentId);
            }
        }

        int missing = Math.max(0, campaign.targetRecommendationCount - contentIds.size());
        if (missing > 0 || !belowThreshold.isEmpty()) {
            throw new InsufficientProgressException(campaign.campaignId, userId, missing, belowThreshold);
        }
    }

    /**
     * Submits the claim; any outcome other than confirmation rolls the pool debit back unless the transaction may
     * still land.
     */
    private LedgerTransactionResultType submitClaim(IncentiveCampaign campaign, String userId, long amount,
            Set<String> contentIds) {
        String campaignId = campaign.campaignId;
        LedgerTransactionResultType result;
        try {
            result = ledger.submitClaim(campaignId, userId, amount, List.copyOf(contentIds));
        } catch (LedgerUnavailableException e) {
            campaignRepository.creditPool(campaignId, amount);
            throw e;
        }

        if (result.isConfirmed()) {
            return result;
        }

        if (result.status() == LedgerTransactionStatus.PENDING) {
            // Pool stays debited: the claim may still confirm
            LOG.warnf("Claim transaction %s for user %s in campaign %s still pending", result.transactionId(), userId,
                    campaignId);
            recordPending(campaignId, userId, amount, result.transactionId(), contentIds);
            throw new LedgerUnavailableException("Claim transaction " + result.transactionId()
                    + " not confirmed yet; retry later");
        }

        campaignRepository.creditPool(campaignId, amount);
        if (ledger.fetchClaimStatus(campaignId, userId).claimed()) {
            throw new AlreadyClaimedException(campaignId, userId);
        }
        LOG.warnf("Claim transaction for user %s in campaign %s failed: %s", userId, campaignId,
                result.describeFailure());
        throw new LedgerUnavailableException("Claim transaction failed: " + result.describeFailure());
    }

    private void recordPending(String campaignId, String userId, long amount, String transactionId,
            Set<String> contentIds) {
        try {
            claimRecordRepository.createPending(campaignId, userId, amount, transactionId, contentIds, clock.instant());
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to record pending claim %s for user %s in campaign %s", transactionId, userId,
                    campaignId);
            metrics.incrementClaimBookkeepingFailure();
        }
    }

    private static boolean matches(String filter, String value) {
        return filter == null || filter.isEmpty() || filter.equalsIgnoreCase(value);
    }

    private static void requireId(String id, String name) {
        if (id == null || id.isBlank()) {
            throw new ValidationException(name + " is required");
        }
    }
}
