/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.api.types;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Transaction to submit to a ledger contract.
 *
 * @param from
 *            operator address signing the transaction
 * @param to
 *            contract package id
 * @param functionName
 *            contract function to invoke
 * @param args
 *            positional function arguments
 * @param gasLimit
 *            gas budget for the call
 */
public record LedgerTransactionRequestType(@JsonProperty("from") String from, @JsonProperty("to") String to,
        @JsonProperty("function_name") String functionName, @JsonProperty("args") List<Object> args,
        @JsonProperty("gas_limit") long gasLimit) {
}
