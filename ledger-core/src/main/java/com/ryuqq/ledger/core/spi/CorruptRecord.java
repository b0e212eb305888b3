package com.ryuqq.ledger.core.spi;

/**
 * A log line that could not be decoded into an event.
 *
 * @param lineNumber 1-based line number in the log
 * @param rawRecord the undecodable text
 * @param reason why decoding failed
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public record CorruptRecord(long lineNumber, String rawRecord, String reason) {

    public CorruptRecord {
        if (lineNumber < 1) {
            throw new IllegalArgumentException("lineNumber must be positive, but was: " + lineNumber);
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        rawRecord = rawRecord == null ? "" : rawRecord;
    }
}
