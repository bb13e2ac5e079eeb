/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.exceptions;

/**
 * Exception thrown when caller input is malformed (null endorsement list, hop distance below 1, blank ids).
 *
 * <p>
 * Never retryable: the same arguments fail the same way. Extends RuntimeException per project standards.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
