package com.ryuqq.ledger.core.exception;

/**
 * Durable read or write failed.
 *
 * <p>Fatal for the operation that raised it. The failed operation left no partial
 * record behind.</p>
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public class StorageFailureException extends RuntimeException {

    public StorageFailureException(String message) {
        super(message);
    }

    public StorageFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
