/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.services;

import java.util.List;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.reputation.api.types.LedgerTransactionResultType;
import villagecompute.reputation.api.types.SocialEdgeType;
import villagecompute.reputation.data.repositories.SocialGraphStore;
import villagecompute.reputation.exceptions.LedgerUnavailableException;
import villagecompute.reputation.exceptions.ValidationException;
import villagecompute.reputation.integration.ledger.LedgerGateway;

/**
 * Follow/unfollow lifecycle of direct social connections, mirrored to the social-graph contract.
 *
 * <p>
 * The ledger transaction is submitted first and the local edge is only written once it confirms, so a failed
 * submission leaves the local graph unchanged. Repeating a follow or unfollow that is already in effect is a no-op and
 * submits nothing.
 */
@ApplicationScoped
public class SocialGraphService {

    private static final Logger LOG = Logger.getLogger(SocialGraphService.class);

    @Inject
    SocialGraphStore store;

    @Inject
    LedgerGateway ledger;

    @Inject
    TrustScoreService trustScoreService;

    /**
     * Viewer's hop-1 and hop-2 edges.
     */
    public List<SocialEdgeType> getEdges(String viewerId) {
        requireId(viewerId, "Viewer id");
        return store.getEdges(viewerId);
    }

    /**
     * Creates a direct connection from follower to followed.
     *
     * @return true when a new connection was created, false when it already existed
     * @throws ValidationException
     *             if an id is blank or a user tries to follow themselves
     * @throws LedgerUnavailableException
     *             if the connection could not be recorded on the ledger
     */
    public boolean follow(String followerId, String followedId) {
        requireId(followerId, "Follower id");
        requireId(followedId, "Followed id");
        if (followerId.equals(followedId)) {
            throw new ValidationException("User " + followerId + " cannot follow themselves");
        }
        if (store.hasDirectEdge(followerId, followedId)) {
            LOG.debugf("User %s already follows %s", followerId, followedId);
            return false;
        }

        LedgerTransactionResultType result = ledger.addConnection(followerId, followedId,
                SocialEdgeType.DIRECT_WEIGHT);
        requireConfirmed(result, "add connection " + followerId + " -> " + followedId);

        boolean created = store.addDirectEdge(followerId, followedId, result.transactionId());
        trustScoreService.onConnectionsChanged(followerId);
        LOG.infof("User %s now follows %s (tx %s)", followerId, followedId, result.transactionId());
        return created;
    }

    /**
     * Removes a direct connection.
     *
     * @return true when a connection was removed, false when there was none
     * @throws LedgerUnavailableException
     *             if the removal could not be recorded on the ledger
     */
    public boolean unfollow(String followerId, String followedId) {
        requireId(followerId, "Follower id");
        requireId(followedId, "Followed id");
        if (!store.hasDirectEdge(followerId, followedId)) {
            LOG.debugf("User %s does not follow %s, nothing to remove", followerId, followedId);
            return false;
        }

        LedgerTransactionResultType result = ledger.removeConnection(followerId, followedId);
        requireConfirmed(result, "remove connection " + followerId + " -> " + followedId);

        boolean removed = store.removeDirectEdge(followerId, followedId);
        trustScoreService.onConnectionsChanged(followerId);
        LOG.infof("User %s unfollowed %s (tx %s)", followerId, followedId, result.transactionId());
        return removed;
    }

    private static void requireConfirmed(LedgerTransactionResultType result, String operation) {
        if (!result.isConfirmed()) {
            LOG.warnf("Ledger did not confirm %s: %s", operation, result.describeFailure());
            throw new LedgerUnavailableException("Ledger did not confirm " + operation + ": "
                    + result.describeFailure());
        }
    }

    private static void requireId(String id, String name) {
        if (id == null || id.isBlank()) {
            throw new ValidationException(name + " is required");
        }
    }
}
