/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.data.repositories;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.reputation.data.models.ContentEndorsement;

/**
 * {@link EndorsementRepository} backed by the {@link ContentEndorsement} entity.
 */
@ApplicationScoped
public class PanacheEndorsementRepository implements EndorsementRepository {

    @Override
    public List<ContentEndorsement> findByContentId(String contentId) {
        return ContentEndorsement.findByContentId(contentId);
    }
}
