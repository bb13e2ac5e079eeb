/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.api.types;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Event emitted by a ledger contract.
 */
public record LedgerEventType(@JsonProperty("type") String type, @JsonProperty("data") Map<String, Object> data) {

    public LedgerEventType {
        data = data == null ? Map.of() : data;
    }

    /**
     * @return string value of a data field, or null when absent
     */
    public String stringField(String name) {
        Object value = data.get(name);
        return value == null ? null : value.toString();
    }
}
