/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.integration.ledger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import io.smallrye.mutiny.Multi;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.reputation.api.types.LedgerClaimStatusType;
import villagecompute.reputation.api.types.LedgerEventFilterType;
import villagecompute.reputation.api.types.LedgerEventType;
import villagecompute.reputation.api.types.LedgerReputationSnapshotType;
import villagecompute.reputation.api.types.LedgerStateQueryType;
import villagecompute.reputation.api.types.LedgerTransactionRequestType;
import villagecompute.reputation.api.types.LedgerTransactionResultType;

/**
 * Typed contract operations over the raw {@link LedgerAdapter}.
 *
 * <p>
 * Knows the contract addresses, function names and argument order of the three contracts the engine talks to:
 * <ul>
 * <li><b>reputation</b> - {@code update_user_reputation}, state method {@code get_user_reputation}</li>
 * <li><b>social graph</b> - {@code add_connection}, {@code remove_connection}</li>
 * <li><b>incentives</b> - {@code claim_discovery_bonus}, state method {@code get_claim_status}</li>
 * </ul>
 *
 * <p>
 * Transactions are sent from the configured operator address with the configured gas limit. Failures propagate
 * unchanged from the adapter.
 */
@ApplicationScoped
public class LedgerGateway {

    private static final Logger LOG = Logger.getLogger(LedgerGateway.class);

    public static final String FN_UPDATE_REPUTATION = "update_user_reputation";
    public static final String FN_ADD_CONNECTION = "add_connection";
    public static final String FN_REMOVE_CONNECTION = "remove_connection";
    public static final String FN_CLAIM_BONUS = "claim_discovery_bonus";
    public static final String QUERY_REPUTATION = "get_user_reputation";
    public static final String QUERY_CLAIM_STATUS = "get_claim_status";

    /** Connection type code for a direct follow. */
    public static final int DIRECT_CONNECTION_TYPE = 1;

    /** Fixed-point factor applied to edge weights before they go on the ledger (0.75 becomes 750). */
    public static final int WEIGHT_SCALE = 1000;

    public static final List<String> MONITORED_EVENTS = List.of("ReputationUpdated", "ConnectionAdded",
            "ConnectionRemoved", "EndorsementRecorded");

    @ConfigProperty(
            name = "reputation.ledger.operator-address",
            defaultValue = "0x0")
    String operatorAddress;

    @ConfigProperty(
            name = "reputation.ledger.gas-limit",
            defaultValue = "50000000")
    long gasLimit;

    @ConfigProperty(
            name = "reputation.ledger.contracts.reputation",
            defaultValue = "reputation")
    String reputationContract;

    @ConfigProperty(
            name = "reputation.ledger.contracts.social-graph",
            defaultValue = "social_graph")
    String socialGraphContract;

    @ConfigProperty(
            name = "reputation.ledger.contracts.incentives",
            defaultValue = "discovery_incentives")
    String incentivesContract;

    @Inject
    LedgerAdapter adapter;

    @Inject
    Clock clock;

    /**
     * Reads the ledger's recorded reputation for a user.
     *
     * @return empty when the ledger has never recorded the user
     */
    public Optional<LedgerReputationSnapshotType> fetchReputation(String userId) {
        Map<String, Object> data = adapter
                .queryState(new LedgerStateQueryType(reputationContract, QUERY_REPUTATION, Map.of("user_id", userId)))
                .data();
        return LedgerResponseNormalizer.toReputationSnapshot(userId, data);
    }

    /**
     * Pushes a user's score and verification level. The social connections argument is always empty: the
     * synchronizer only corrects the two ledger-visible fields that can drift.
     *
     * @param scaledScore
     *            score already multiplied into the ledger's fixed-point representation
     */
    public LedgerTransactionResultType submitReputationCorrection(String userId, long scaledScore, int levelCode) {
        LOG.infof("Submitting reputation correction for user %s: score=%d, level=%d", userId, scaledScore, levelCode);
        return submit(reputationContract, FN_UPDATE_REPUTATION,
                List.of(userId, scaledScore, List.of(), levelCode, timestamp()));
    }

    /**
     * Asks the incentives contract whether the user has claimed the campaign.
     */
    public LedgerClaimStatusType fetchClaimStatus(String campaignId, String userId) {
        Map<String, Object> data = adapter.queryState(new LedgerStateQueryType(incentivesContract, QUERY_CLAIM_STATUS,
                Map.of("campaign_id", campaignId, "user_id", userId))).data();
        return LedgerResponseNormalizer.toClaimStatus(data);
    }

    /**
     * Submits a discovery-bonus claim. The contract rejects a second claim for the same pair.
     */
    public LedgerTransactionResultType submitClaim(String campaignId, String userId, long amount,
            List<String> contentIds) {
        LOG.infof("Submitting claim of %d units for user %s in campaign %s", amount, userId, campaignId);
        return submit(incentivesContract, FN_CLAIM_BONUS,
                List.of(userId, campaignId, amount, List.copyOf(contentIds), timestamp()));
    }

    public LedgerTransactionResultType addConnection(String followerId, String followedId, double weight) {
        long scaledWeight = (long) Math.floor(weight * WEIGHT_SCALE);
        return submit(socialGraphContract, FN_ADD_CONNECTION,
                List.of(followerId, followedId, scaledWeight, DIRECT_CONNECTION_TYPE, timestamp()));
    }

    public LedgerTransactionResultType removeConnection(String followerId, String followedId) {
        return submit(socialGraphContract, FN_REMOVE_CONNECTION, List.of(followerId, followedId, timestamp()));
    }

    /**
     * Streams the events the engine reacts to, from all three contracts.
     */
    public Multi<LedgerEventType> watchEngineEvents() {
        List<String> addresses = new ArrayList<>(List.of(reputationContract, socialGraphContract, incentivesContract));
        return adapter.watchEvents(new LedgerEventFilterType(addresses, MONITORED_EVENTS));
    }

    private LedgerTransactionResultType submit(String contract, String function, List<Object> args) {
        LedgerTransactionRequestType request = new LedgerTransactionRequestType(operatorAddress, contract, function,
                args, gasLimit);
        return adapter.submitTransaction(request);
    }

    private String timestamp() {
        return Long.toString(clock.millis());
    }
}
