/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.api.types;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Read-only contract state query.
 */
public record LedgerStateQueryType(@JsonProperty("contract") String contract, @JsonProperty("method") String method,
        @JsonProperty("params") Map<String, Object> params) {
}
