package com.ryuqq.ledger.core.spi;

import com.ryuqq.ledger.core.event.ShipmentEvent;

import java.util.List;

/**
 * Result of reading the whole log back from its source of truth.
 *
 * @param events every decodable event in log order
 * @param corruptRecords records that could not be decoded
 * @author Ledger Team
 * @since 1.0.0
 */
public record LogReplay(List<ShipmentEvent> events, List<CorruptRecord> corruptRecords) {

    public LogReplay {
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        events = List.copyOf(events);
        corruptRecords = corruptRecords == null ? List.of() : List.copyOf(corruptRecords);
    }
}
