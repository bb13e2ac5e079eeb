/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.exceptions;

/**
 * Exception thrown when the ledger cannot be reached, times out, or the calling thread is interrupted while waiting
 * on it.
 *
 * <p>
 * Retryable by the caller with backoff. The engine itself never retries.
 */
public class LedgerUnavailableException extends RuntimeException {

    public LedgerUnavailableException(String message) {
        super(message);
    }

    public LedgerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
