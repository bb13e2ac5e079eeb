/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.api.types;

/**
 * Canonical transaction status after normalization of the ledger's raw response.
 *
 * <p>
 * Only {@link #CONFIRMED} counts as final success.
 */
public enum LedgerTransactionStatus {
    PENDING, CONFIRMED, FAILED
}
