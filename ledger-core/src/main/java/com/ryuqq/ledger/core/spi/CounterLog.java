package com.ryuqq.ledger.core.spi;

import java.util.List;

/**
 * Durable append-only counter log SPI backing identifier issuance.
 *
 * <p>Every issued counter is appended as its own record before the identifier is
 * handed out, so a crash between increment and use can never lead to reuse.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>{@link #append} is durable before it returns</li>
 *   <li>{@link #append} rejects a counter that is not greater than {@link #lastCounter()}</li>
 *   <li>Unreadable or unwritable storage fails with
 *       {@link com.ryuqq.ledger.core.exception.StorageFailureException}, never silently</li>
 * </ul>
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public interface CounterLog {

    /**
     * Returns the highest counter recorded so far.
     *
     * @return last counter, or 0 if nothing was ever issued
     * @throws com.ryuqq.ledger.core.exception.StorageFailureException if the log cannot be read
     */
    long lastCounter();

    /**
     * Appends an issuance record.
     *
     * @param record the record
     * @throws IllegalArgumentException if record is null or its counter does not advance
     * @throws com.ryuqq.ledger.core.exception.StorageFailureException if the record cannot be written durably
     */
    void append(CounterRecord record);

    /**
     * Reads all issuance records in append order.
     *
     * @return immutable snapshot
     */
    List<CounterRecord> readAll();
}
