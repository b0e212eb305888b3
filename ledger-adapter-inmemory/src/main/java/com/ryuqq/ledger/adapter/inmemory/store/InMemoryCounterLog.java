package com.ryuqq.ledger.adapter.inmemory.store;

import com.ryuqq.ledger.core.spi.CounterLog;
import com.ryuqq.ledger.core.spi.CounterRecord;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link CounterLog} SPI.
 *
 * <p>Records are kept in a {@link CopyOnWriteArrayList}. Appends are synchronized so the
 * advance check and the add happen together; reads never lock.</p>
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public class InMemoryCounterLog implements CounterLog {

    private final CopyOnWriteArrayList<CounterRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public long lastCounter() {
        long max = 0L;
        for (CounterRecord record : records) {
            max = Math.max(max, record.counter());
        }
        return max;
    }

    @Override
    public synchronized void append(CounterRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        long last = lastCounter();
        if (record.counter() <= last) {
            throw new IllegalArgumentException(
                "Counter must advance: " + record.counter() + " is not greater than " + last);
        }
        records.add(record);
    }

    @Override
    public List<CounterRecord> readAll() {
        return List.copyOf(records);
    }

    public void clear() {
        records.clear();
    }
}
