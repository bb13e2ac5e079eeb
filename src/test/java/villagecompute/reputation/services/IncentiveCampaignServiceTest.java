/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static villagecompute.reputation.TestConstants.CAMPAIGN_ID;
import static villagecompute.reputation.TestConstants.CAMPAIGN_ID_2;
import static villagecompute.reputation.TestConstants.CATEGORY;
import static villagecompute.reputation.TestConstants.CONTENT_ID;
import static villagecompute.reputation.TestConstants.CONTENT_ID_2;
import static villagecompute.reputation.TestConstants.CONTENT_ID_3;
import static villagecompute.reputation.TestConstants.NOW;
import static villagecompute.reputation.TestConstants.REGION;
import static villagecompute.reputation.TestConstants.STRANGER_ID;
import static villagecompute.reputation.TestConstants.USER_ID;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import villagecompute.reputation.api.types.ClaimRecordType;
import villagecompute.reputation.api.types.ClaimResultType;
import villagecompute.reputation.api.types.IncentiveCampaignType;
import villagecompute.reputation.api.types.LedgerTransactionRequestType;
import villagecompute.reputation.api.types.LedgerTransactionStatus;
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
import villagecompute.reputation.integration.ledger.TestLedgerGateways;
import villagecompute.reputation.observability.EngineMetrics;
import villagecompute.reputation.testing.InMemoryCampaignRepository;
import villagecompute.reputation.testing.InMemoryClaimRecordRepository;
import villagecompute.reputation.testing.InMemoryContentRepositories;
import villagecompute.reputation.testing.InMemoryLedgerAdapter;
import villagecompute.reputation.testing.InMemoryReputationRecordRepository;

/**
 * Unit tests for {@link IncentiveCampaignService}.
 */
class IncentiveCampaignServiceTest {

    private static final Instant EXPIRES = NOW.plus(Duration.ofDays(7));

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    private InMemoryLedgerAdapter ledger;
    private InMemoryCampaignRepository campaigns;
    private InMemoryClaimRecordRepository claims;
    private InMemoryContentRepositories content;
    private InMemoryReputationRecordRepository records;
    private SimpleMeterRegistry meterRegistry;
    private IncentiveCampaignService service;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryLedgerAdapter(clock);
        campaigns = new InMemoryCampaignRepository();
        claims = new InMemoryClaimRecordRepository();
        content = new InMemoryContentRepositories();
        records = new InMemoryReputationRecordRepository();
        meterRegistry = new SimpleMeterRegistry();

        service = new IncentiveCampaignService();
        service.claimSettleGrace = Duration.ofMinutes(2);
        service.campaignRepository = campaigns;
        service.claimRecordRepository = claims;
        service.contentScoreRepository = content;
        service.reputationRecordRepository = records;
        service.ledger = TestLedgerGateways.over(ledger, clock);
        service.metrics = new EngineMetrics(meterRegistry);
        service.clock = clock;

        // target 3, multiplier 2.5 -> claim amount 7
        campaigns.add(CAMPAIGN_ID, REGION, CATEGORY, 2.5, 3, 0.6, EXPIRES, 100);
        content.putScore(CONTENT_ID, 8.0);
        content.putScore(CONTENT_ID_2, 7.5);
        content.putScore(CONTENT_ID_3, 6.0);
    }

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    // ========== claimBonus ==========

    @Test
    void testClaimBonus_success() {
        ClaimResultType result = service.claimBonus(USER_ID, CAMPAIGN_ID, List.of(CONTENT_ID, CONTENT_ID_2,
                CONTENT_ID_3));

        assertTrue(result.success());
        assertEquals(7, result.amount());
        assertEquals(93, campaigns.poolOf(CAMPAIGN_ID));
        assertTrue(ledger.hasClaim(CAMPAIGN_ID, USER_ID));

        ClaimRecordType record = claims.find(CAMPAIGN_ID, USER_ID).orElseThrow().toType();
        assertEquals(result.transactionId(), record.transactionId());
        assertEquals(Set.of(CONTENT_ID, CONTENT_ID_2, CONTENT_ID_3), record.contributingContentIds());
        assertEquals(NOW, record.claimedAt());

        LedgerTransactionRequestType submitted = ledger.submissions(LedgerGateway.FN_CLAIM_BONUS).get(0);
        assertEquals(USER_ID, submitted.args().get(0));
        assertEquals(CAMPAIGN_ID, submitted.args().get(1));
        assertEquals(7L, submitted.args().get(2));
        assertEquals(1.0, meterRegistry.counter("reputation_claims_total", "result", "success").count());
    }

    @Test
    void testClaimBonus_tooFewContentItems() {
        InsufficientProgressException e = assertThrows(InsufficientProgressException.class,
                () -> service.claimBonus(USER_ID, CAMPAIGN_ID, List.of(CONTENT_ID, CONTENT_ID_2)));

        assertEquals(1, e.getMissingCount());
        assertTrue(e.getBelowThresholdContentIds().isEmpty());
        assertTrue(e.getMessage().contains("need 1 more"));
        assertTrue(ledger.submissions().isEmpty());
        assertEquals(100, campaigns.poolOf(CAMPAIGN_ID));
    }

    @Test
    void testClaimBonus_duplicateContentIdsCountOnce() {
        InsufficientProgressException e = assertThrows(InsufficientProgressException.class,
                () -> service.claimBonus(USER_ID, CAMPAIGN_ID, List.of(CONTENT_ID, CONTENT_ID, CONTENT_ID_2)));

        assertEquals(1, e.getMissingCount());
    }

    @Test
    void testClaimBonus_contentBelowMinimumTrustListed() {
        content.putScore(CONTENT_ID_3, 5.9);

        InsufficientProgressException e = assertThrows(InsufficientProgressException.class,
                () -> service.claimBonus(USER_ID, CAMPAIGN_ID, List.of(CONTENT_ID, CONTENT_ID_2, CONTENT_ID_3,
                        "rec-unscored")));

        assertEquals(0, e.getMissingCount());
        assertEquals(List.of(CONTENT_ID_3, "rec-unscored"), e.getBelowThresholdContentIds());
        assertEquals(InsufficientProgressException.REASON, e.reasonCode());
    }

    @Test
    void testClaimBonus_poolTooSmall() {
        // multiplier 5 x target 2 = 10 units against a pool of 5
        campaigns.add(CAMPAIGN_ID_2, REGION, CATEGORY, 5.0, 2, 0.5, EXPIRES, 5);

        PoolExhaustedException e = assertThrows(PoolExhaustedException.class,
                () -> service.claimBonus(USER_ID, CAMPAIGN_ID_2, List.of(CONTENT_ID, CONTENT_ID_2)));

        assertEquals(10, e.getRequestedAmount());
        assertTrue(ledger.submissions().isEmpty());
        assertEquals(5, campaigns.poolOf(CAMPAIGN_ID_2));
        assertEquals(1.0, meterRegistry.counter("reputation_claims_total", "result", "pool_exhausted").count());
    }

    @Test
    void testClaimBonus_expiredCampaign() {
        campaigns.add(CAMPAIGN_ID_2, REGION, CATEGORY, 1.0, 1, 0.5, NOW.minusSeconds(1), 100);

        assertThrows(CampaignInactiveException.class,
                () -> service.claimBonus(USER_ID, CAMPAIGN_ID_2, List.of(CONTENT_ID)));
        assertEquals(0, ledger.queryCount());
    }

    @Test
    void testClaimBonus_emptyPoolIsInactive() {
        campaigns.add(CAMPAIGN_ID_2, REGION, CATEGORY, 1.0, 1, 0.5, EXPIRES, 0);

        assertThrows(CampaignInactiveException.class,
                () -> service.claimBonus(USER_ID, CAMPAIGN_ID_2, List.of(CONTENT_ID)));
    }

    @Test
    void testClaimBonus_unknownCampaignIsInactive() {
        CampaignInactiveException e = assertThrows(CampaignInactiveException.class,
                () -> service.claimBonus(USER_ID, "campaign-missing", List.of(CONTENT_ID)));

        assertEquals(CampaignInactiveException.REASON, e.reasonCode());
    }

    @Test
    void testClaimBonus_secondClaimRejected() {
        List<String> contentIds = List.of(CONTENT_ID, CONTENT_ID_2, CONTENT_ID_3);
        service.claimBonus(USER_ID, CAMPAIGN_ID, contentIds);

        assertThrows(AlreadyClaimedException.class, () -> service.claimBonus(USER_ID, CAMPAIGN_ID, contentIds));
        assertEquals(1, ledger.submissions(LedgerGateway.FN_CLAIM_BONUS).size());
        assertEquals(93, campaigns.poolOf(CAMPAIGN_ID));
    }

    @Test
    void testClaimBonus_alreadyClaimedCheckedBeforeProgress() {
        service.claimBonus(USER_ID, CAMPAIGN_ID, List.of(CONTENT_ID, CONTENT_ID_2, CONTENT_ID_3));

        assertThrows(AlreadyClaimedException.class, () -> service.claimBonus(USER_ID, CAMPAIGN_ID, List.of()));
    }

    @Test
    void testClaimBonus_ledgerClaimWithoutLocalRecordIsIntegrityViolation() {
        ledger.putClaim(CAMPAIGN_ID, USER_ID, "tx-orphan", 7, NOW.minus(Duration.ofHours(1)));

        DataIntegrityException e = assertThrows(DataIntegrityException.class,
                () -> service.claimBonus(USER_ID, CAMPAIGN_ID, List.of(CONTENT_ID, CONTENT_ID_2, CONTENT_ID_3)));

        assertTrue(e.getMessage().contains("tx-orphan"));
        assertTrue(ledger.submissions().isEmpty());
    }

    @Test
    void testClaimBonus_recentLedgerClaimWithoutLocalRecordIsInFlight() {
        ledger.putClaim(CAMPAIGN_ID, USER_ID, "tx-inflight", 7, NOW.minusSeconds(30));

        assertThrows(AlreadyClaimedException.class,
                () -> service.claimBonus(USER_ID, CAMPAIGN_ID, List.of(CONTENT_ID, CONTENT_ID_2, CONTENT_ID_3)));
    }

    @Test
    void testClaimBonus_localRecordUnknownToLedgerIsIntegrityViolation() {
        claims.create(CAMPAIGN_ID, USER_ID, 7, "tx-local", Set.of(CONTENT_ID), NOW);

        assertThrows(DataIntegrityException.class,
                () -> service.claimBonus(USER_ID, CAMPAIGN_ID, List.of(CONTENT_ID, CONTENT_ID_2, CONTENT_ID_3)));
    }

    @Test
    void testClaimBonus_ledgerUnreachableLeavesPoolUntouched() {
        ledger.setUnreachable(true);

        assertThrows(LedgerUnavailableException.class,
                () -> service.claimBonus(USER_ID, CAMPAIGN_ID, List.of(CONTENT_ID, CONTENT_ID_2, CONTENT_ID_3)));
        assertEquals(100, campaigns.poolOf(CAMPAIGN_ID));
    }

    @Test
    void testClaimBonus_failedTransactionCreditsPoolBack() {
        ledger.forceSubmitResult(LedgerTransactionStatus.FAILED, "contract paused");

        LedgerUnavailableException e = assertThrows(LedgerUnavailableException.class,
                () -> service.claimBonus(USER_ID, CAMPAIGN_ID, List.of(CONTENT_ID, CONTENT_ID_2, CONTENT_ID_3)));

        assertTrue(e.getMessage().contains("contract paused"));
        assertEquals(100, campaigns.poolOf(CAMPAIGN_ID));
        assertEquals(0, claims.size());
    }

    @Test
    void testClaimBonus_pendingTransactionKeepsPoolDebited() {
        ledger.forceSubmitResult(LedgerTransactionStatus.PENDING, null);

        assertThrows(LedgerUnavailableException.class,
                () -> service.claimBonus(USER_ID, CAMPAIGN_ID, List.of(CONTENT_ID, CONTENT_ID_2, CONTENT_ID_3)));
        assertEquals(93, campaigns.poolOf(CAMPAIGN_ID));
        assertEquals(0, campaigns.creditCount());
    }

    @Test
    void testClaimBonus_pendingClaimConfirmedLaterIsSettledOnNextClaim() {
        List<String> contentIds = List.of(CONTENT_ID, CONTENT_ID_2, CONTENT_ID_3);
        ledger.forceSubmitResult(LedgerTransactionStatus.PENDING, null);
        assertThrows(LedgerUnavailableException.class, () -> service.claimBonus(USER_ID, CAMPAIGN_ID, contentIds));
        assertEquals(1, claims.pendingCount());

        ledger.forceSubmitResult(null, null);
        ledger.putClaim(CAMPAIGN_ID, USER_ID, "tx-1", 7, NOW.plusSeconds(30));
        service.clock = Clock.fixed(NOW.plus(Duration.ofMinutes(5)), ZoneOffset.UTC);

        assertThrows(AlreadyClaimedException.class, () -> service.claimBonus(USER_ID, CAMPAIGN_ID, contentIds));

        ClaimRecordType record = claims.find(CAMPAIGN_ID, USER_ID).orElseThrow().toType();
        assertEquals("tx-1", record.transactionId());
        assertEquals(7, record.amount());
        assertEquals(NOW.plusSeconds(30), record.claimedAt());
        assertEquals(Set.copyOf(contentIds), record.contributingContentIds());
        assertEquals(0, claims.pendingCount());
        assertEquals(93, campaigns.poolOf(CAMPAIGN_ID));
        assertEquals(1, ledger.submissions(LedgerGateway.FN_CLAIM_BONUS).size());

        // settled bookkeeping agrees with the ledger from now on
        assertThrows(AlreadyClaimedException.class, () -> service.claimBonus(USER_ID, CAMPAIGN_ID, contentIds));
        assertEquals(1, service.findClaims(USER_ID).size());
    }

    @Test
    void testClaimBonus_pendingClaimWithinGraceBlocksResubmission() {
        List<String> contentIds = List.of(CONTENT_ID, CONTENT_ID_2, CONTENT_ID_3);
        ledger.forceSubmitResult(LedgerTransactionStatus.PENDING, null);
        assertThrows(LedgerUnavailableException.class, () -> service.claimBonus(USER_ID, CAMPAIGN_ID, contentIds));
        ledger.forceSubmitResult(null, null);

        assertThrows(LedgerUnavailableException.class, () -> service.claimBonus(USER_ID, CAMPAIGN_ID, contentIds));

        assertEquals(1, ledger.submissions(LedgerGateway.FN_CLAIM_BONUS).size());
        assertEquals(1, claims.pendingCount());
        assertEquals(93, campaigns.poolOf(CAMPAIGN_ID));
    }

    @Test
    void testClaimBonus_pendingClaimNeverConfirmedIsReleasedAndRetried() {
        List<String> contentIds = List.of(CONTENT_ID, CONTENT_ID_2, CONTENT_ID_3);
        ledger.forceSubmitResult(LedgerTransactionStatus.PENDING, null);
        assertThrows(LedgerUnavailableException.class, () -> service.claimBonus(USER_ID, CAMPAIGN_ID, contentIds));
        ledger.forceSubmitResult(null, null);
        service.clock = Clock.fixed(NOW.plus(Duration.ofMinutes(5)), ZoneOffset.UTC);

        ClaimResultType result = service.claimBonus(USER_ID, CAMPAIGN_ID, contentIds);

        assertTrue(result.success());
        assertEquals(0, claims.pendingCount());
        assertEquals(1, campaigns.creditCount());
        assertEquals(93, campaigns.poolOf(CAMPAIGN_ID));
        assertTrue(ledger.hasClaim(CAMPAIGN_ID, USER_ID));
        assertEquals(result.transactionId(), claims.find(CAMPAIGN_ID, USER_ID).orElseThrow().transactionId);
    }

    @Test
    void testClaimBonus_localWriteFailureStillReportsSuccessThenSurfacesOnRetry() {
        claims.setFailWrites(true);
        List<String> contentIds = List.of(CONTENT_ID, CONTENT_ID_2, CONTENT_ID_3);

        ClaimResultType result = service.claimBonus(USER_ID, CAMPAIGN_ID, contentIds);

        assertTrue(result.success());
        assertEquals(1.0, meterRegistry.counter("reputation_claim_bookkeeping_failures_total").count());

        // within the settle grace the claim reads as in flight
        assertThrows(AlreadyClaimedException.class, () -> service.claimBonus(USER_ID, CAMPAIGN_ID, contentIds));

        service.clock = Clock.fixed(NOW.plus(Duration.ofMinutes(5)), ZoneOffset.UTC);
        assertThrows(DataIntegrityException.class, () -> service.claimBonus(USER_ID, CAMPAIGN_ID, contentIds));
    }

    @Test
    void testClaimBonus_concurrentClaimsForSamePairYieldOneSuccess() throws Exception {
        List<String> contentIds = List.of(CONTENT_ID, CONTENT_ID_2, CONTENT_ID_3);
        int attempts = 8;
        executor = Executors.newFixedThreadPool(attempts);
        CountDownLatch start = new CountDownLatch(1);

        List<Future<ClaimResultType>> futures = new ArrayList<>();
        for (int i = 0; i < attempts; i++) {
            Callable<ClaimResultType> claim = () -> {
                start.await();
                return service.claimBonus(USER_ID, CAMPAIGN_ID, contentIds);
            };
            futures.add(executor.submit(claim));
        }
        start.countDown();

        int successes = 0;
        int rejections = 0;
        for (Future<ClaimResultType> future : futures) {
            try {
                assertTrue(future.get(10, TimeUnit.SECONDS).success());
                successes++;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                assertTrue(cause instanceof AlreadyClaimedException || cause instanceof PoolExhaustedException,
                        "unexpected failure: " + cause);
                rejections++;
            }
        }

        assertEquals(1, successes);
        assertEquals(attempts - 1, rejections);
        assertEquals(93, campaigns.poolOf(CAMPAIGN_ID));
        assertEquals(1, claims.size());
    }

    @Test
    void testClaimBonus_rejectionCarriesReasonAndIds() {
        ClaimRejectedException e = assertThrows(ClaimRejectedException.class,
                () -> service.claimBonus(USER_ID, CAMPAIGN_ID, List.of()));

        assertInstanceOf(InsufficientProgressException.class, e);
        assertEquals(CAMPAIGN_ID, e.getCampaignId());
        assertEquals(USER_ID, e.getUserId());
    }

    @Test
    void testClaimBonus_invalidArguments() {
        assertThrows(ValidationException.class, () -> service.claimBonus(" ", CAMPAIGN_ID, List.of()));
        assertThrows(ValidationException.class, () -> service.claimBonus(USER_ID, null, List.of()));
        assertThrows(ValidationException.class, () -> service.claimBonus(USER_ID, CAMPAIGN_ID, null));
    }

    // ========== listEligibleCampaigns ==========

    @Test
    void testListEligibleCampaigns_filtersAndOrders() {
        records.add(USER_ID, 0.7, "verified");
        campaigns.add("c-high-late", REGION, CATEGORY, 4.0, 3, 0.5, NOW.plus(Duration.ofDays(20)), 100);
        campaigns.add("c-high-soon", REGION, CATEGORY, 4.0, 3, 0.5, NOW.plus(Duration.ofDays(2)), 100);
        campaigns.add("c-other-region", "porto", CATEGORY, 9.0, 3, 0.5, EXPIRES, 100);
        campaigns.add("c-other-category", REGION, "bars", 9.0, 3, 0.5, EXPIRES, 100);
        campaigns.add("c-too-demanding", REGION, CATEGORY, 9.0, 3, 0.9, EXPIRES, 100);
        campaigns.add("c-expired", REGION, CATEGORY, 9.0, 3, 0.5, NOW.minusSeconds(60), 100);

        List<String> ids = service.listEligibleCampaigns(USER_ID, REGION, CATEGORY).stream()
                .map(IncentiveCampaignType::campaignId).toList();

        assertEquals(List.of("c-high-soon", "c-high-late", CAMPAIGN_ID), ids);
    }

    @Test
    void testListEligibleCampaigns_emptyFiltersMatchAny() {
        records.add(USER_ID, 0.7, "verified");
        campaigns.add("c-other-region", "porto", "bars", 1.0, 3, 0.5, EXPIRES, 100);

        List<IncentiveCampaignType> all = service.listEligibleCampaigns(USER_ID, "", null);

        assertEquals(2, all.size());
        assertFalse(service.listEligibleCampaigns(USER_ID, "porto", "").isEmpty());
    }

    @Test
    void testListEligibleCampaigns_unknownUser() {
        assertThrows(ResourceNotFoundException.class, () -> service.listEligibleCampaigns(STRANGER_ID, null, null));
    }

    // ========== findClaims ==========

    @Test
    void testFindClaims_returnsUsersClaims() {
        service.claimBonus(USER_ID, CAMPAIGN_ID, List.of(CONTENT_ID, CONTENT_ID_2, CONTENT_ID_3));

        List<ClaimRecordType> found = service.findClaims(USER_ID);

        assertEquals(1, found.size());
        assertEquals(7, found.get(0).amount());
        assertTrue(service.findClaims(STRANGER_ID).isEmpty());
    }
}
