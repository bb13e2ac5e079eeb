/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.api.types;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Subscription filter for ledger events.
 *
 * @param addresses
 *            contract addresses to watch
 * @param topics
 *            event types to receive (e.g. {@code ReputationUpdated})
 */
public record LedgerEventFilterType(@JsonProperty("addresses") List<String> addresses,
        @JsonProperty("topics") List<String> topics) {

    public LedgerEventFilterType {
        addresses = addresses == null ? List.of() : List.copyOf(addresses);
        topics = topics == null ? List.of() : List.copyOf(topics);
    }
}
