/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.api.types;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Canonical result of a submitted ledger transaction.
 *
 * @param transactionId
 *            transaction id (normalized from {@code transactionId}, {@code transactionHash}, {@code hash} or
 *            {@code digest})
 * @param status
 *            normalized status
 * @param events
 *            events emitted by the transaction
 * @param errorMessage
 *            ledger-reported error for failed transactions, null otherwise
 */
public record LedgerTransactionResultType(@JsonProperty("transaction_id") String transactionId,
        @JsonProperty("status") LedgerTransactionStatus status, @JsonProperty("events") List<LedgerEventType> events,
        @JsonProperty("error_message") String errorMessage) {

    public LedgerTransactionResultType {
        events = events == null ? List.of() : List.copyOf(events);
    }

    @JsonIgnore
    public boolean isConfirmed() {
        return status == LedgerTransactionStatus.CONFIRMED;
    }

    /**
     * Short description used in discrepancy lists and log lines.
     */
    public String describeFailure() {
        if (errorMessage != null && !errorMessage.isBlank()) {
            return errorMessage;
        }
        return "transaction " + transactionId + " not confirmed (" + status.name().toLowerCase() + ")";
    }
}
