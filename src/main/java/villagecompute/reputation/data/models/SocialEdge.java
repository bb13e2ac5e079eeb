/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Direct follow relationship between two users.
 *
 * <p>
 * Only hop-1 edges are stored. Friend-of-friend (hop-2) edges are derived at read time by the social graph store.
 * Rows are created on follow, deleted on unfollow and never updated.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (UUID, PK) - Primary identifier</li>
 * <li>{@code follower_id} (TEXT) - User who follows</li>
 * <li>{@code followed_id} (TEXT) - User being followed</li>
 * <li>{@code ledger_transaction_id} (TEXT) - add_connection transaction recorded on the ledger</li>
 * <li>{@code created_at} (TIMESTAMPTZ) - Follow timestamp</li>
 * </ul>
 */
@Entity
@Table(
        name = "social_edges",
        uniqueConstraints = @UniqueConstraint(
                columnNames = {"follower_id", "followed_id"}))
public class SocialEdge extends PanacheEntityBase {

    @Id
    @GeneratedValue
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "follower_id",
            nullable = false)
    public String followerId;

    @Column(
            name = "followed_id",
            nullable = false)
    public String followedId;

    @Column(
            name = "ledger_transaction_id")
    public String ledgerTransactionId;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    /**
     * Users directly followed by {@code followerId}.
     */
    public static List<SocialEdge> findByFollower(String followerId) {
        return find("followerId = ?1", followerId).list();
    }

    /**
     * Edges leaving any of the given users; used to derive friend-of-friend connections.
     */
    public static List<SocialEdge> findByFollowers(Collection<String> followerIds) {
        if (followerIds.isEmpty()) {
            return List.of();
        }
        return find("followerId IN ?1", followerIds).list();
    }

    public static Optional<SocialEdge> findEdge(String followerId, String followedId) {
        return find("followerId = ?1 AND followedId = ?2", followerId, followedId).firstResultOptional();
    }
}
