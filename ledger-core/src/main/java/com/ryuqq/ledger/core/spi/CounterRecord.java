package com.ryuqq.ledger.core.spi;

import java.time.Instant;

/**
 * Append-only record of one identifier issuance.
 *
 * @param counter the issued counter value
 * @param timestamp when it was issued
 * @param action what the record stands for ({@link #ID_GENERATED})
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public record CounterRecord(long counter, Instant timestamp, String action) {

    public static final String ID_GENERATED = "ID_GENERATED";

    public CounterRecord {
        if (counter < 1) {
            throw new IllegalArgumentException("counter must be positive, but was: " + counter);
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action cannot be null or blank");
        }
    }

    public static CounterRecord issued(long counter, Instant timestamp) {
        return new CounterRecord(counter, timestamp, ID_GENERATED);
    }
}
