package com.ryuqq.ledger.core.exception;

/**
 * A log record could not be decoded.
 *
 * <p>Raised by codecs for a single malformed record. Lenient readers catch it, log the
 * violation and skip the record; strict readers let it propagate.</p>
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public class CorruptRecordException extends RuntimeException {

    private final long lineNumber;

    public CorruptRecordException(String message) {
        this(message, 0L, null);
    }

    public CorruptRecordException(String message, Throwable cause) {
        this(message, 0L, cause);
    }

    public CorruptRecordException(String message, long lineNumber, Throwable cause) {
        super(message, cause);
        this.lineNumber = lineNumber;
    }

    /**
     * @return 1-based line number, or 0 when unknown
     */
    public long getLineNumber() {
        return lineNumber;
    }
}
