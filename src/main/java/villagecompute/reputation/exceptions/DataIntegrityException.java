/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.exceptions;

/**
 * Exception thrown when ledger and local state disagree in a way no corrective action covers, e.g. the ledger
 * reports a bonus claim the local store has no record of.
 *
 * <p>
 * Surfaced to operators instead of being resolved automatically: overwriting either side could hide fraud or a
 * prior partial failure.
 */
public class DataIntegrityException extends RuntimeException {

    public DataIntegrityException(String message) {
        super(message);
    }

    public DataIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
