/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of a successful bonus claim. Rejections are reported as {@code ClaimRejectedException} subclasses instead.
 *
 * @param success
 *            true when the claim transaction was confirmed by the ledger
 * @param amount
 *            token units paid out
 * @param transactionId
 *            confirmed ledger transaction id
 */
public record ClaimResultType(@JsonProperty("success") boolean success, @JsonProperty("amount") long amount,
        @JsonProperty("transaction_id") String transactionId) {
}
