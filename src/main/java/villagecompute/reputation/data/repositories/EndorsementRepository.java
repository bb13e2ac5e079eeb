/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.data.repositories;

import java.util.List;

import villagecompute.reputation.data.models.ContentEndorsement;

/**
 * Read access to vote-backed endorsements.
 */
public interface EndorsementRepository {

    List<ContentEndorsement> findByContentId(String contentId);
}
