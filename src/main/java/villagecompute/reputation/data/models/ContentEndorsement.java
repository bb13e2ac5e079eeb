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

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Vote-backed endorsement of a content item.
 *
 * <p>
 * Rows are written by the recommendation pipeline when a user saves or upvotes content; the engine only reads them to
 * assemble trust-score inputs.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (UUID, PK) - Primary identifier</li>
 * <li>{@code content_id} (TEXT) - Endorsed content item</li>
 * <li>{@code endorser_id} (TEXT) - Endorsing user</li>
 * <li>{@code endorser_trust_score} (DOUBLE) - Endorser's trust score at vote time, nominally [0, 1]</li>
 * <li>{@code created_at} (TIMESTAMPTZ) - Vote timestamp</li>
 * </ul>
 */
@Entity
@Table(
        name = "content_endorsements")
public class ContentEndorsement extends PanacheEntityBase {

    @Id
    @GeneratedValue
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "content_id",
            nullable = false)
    public String contentId;

    @Column(
            name = "endorser_id",
            nullable = false)
    public String endorserId;

    @Column(
            name = "endorser_trust_score",
            nullable = false)
    public double endorserTrustScore;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    public static List<ContentEndorsement> findByContentId(String contentId) {
        return find("contentId = ?1 ORDER BY createdAt ASC", contentId).list();
    }
}
