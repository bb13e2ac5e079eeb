/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Stored trust score of a content item on the 0-10 scale, maintained by the recommendation pipeline.
 *
 * <p>
 * Campaign claims compare {@code trust_score / 10} against the campaign's minimum trust score.
 */
@Entity
@Table(
        name = "content_trust_scores")
public class ContentTrustScore extends PanacheEntityBase {

    public static final double SCALE = 10.0;

    @Id
    @Column(
            name = "content_id",
            nullable = false)
    public String contentId;

    @Column(
            name = "trust_score",
            nullable = false)
    public double trustScore;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    public static List<ContentTrustScore> findByContentIds(Collection<String> contentIds) {
        if (contentIds.isEmpty()) {
            return List.of();
        }
        return find("contentId IN ?1", contentIds).list();
    }

    /**
     * Stored score normalized to [0, 1].
     */
    public double normalizedScore() {
        return trustScore / SCALE;
    }
}
