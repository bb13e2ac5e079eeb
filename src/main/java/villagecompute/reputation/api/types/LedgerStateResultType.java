/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.api.types;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of a contract state query. An empty {@code data} map means the ledger holds no state for the query.
 */
public record LedgerStateResultType(@JsonProperty("data") Map<String, Object> data) {

    public LedgerStateResultType {
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return data.isEmpty();
    }
}
