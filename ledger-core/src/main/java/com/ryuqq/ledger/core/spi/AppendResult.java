package com.ryuqq.ledger.core.spi;

import com.ryuqq.ledger.core.event.ShipmentEvent;
import com.ryuqq.ledger.core.model.ShipmentId;

/**
 * Result of {@link EventStore#append}.
 *
 * <ul>
 *   <li>{@link Appended}: the record was durably written with a newly assigned sequence</li>
 *   <li>{@link Duplicate}: the event id already exists; nothing was written</li>
 *   <li>{@link Conflict}: the expected last sequence no longer matches; nothing was written</li>
 * </ul>
 *
 * <p>Storage failures are not represented here: they abort the call with
 * {@link com.ryuqq.ledger.core.exception.StorageFailureException}.</p>
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public sealed interface AppendResult {

    default boolean isAppended() {
        return this instanceof Appended;
    }

    default boolean isDuplicate() {
        return this instanceof Duplicate;
    }

    default boolean isConflict() {
        return this instanceof Conflict;
    }

    /**
     * Newly written record.
     *
     * @param event the stored event with its assigned sequence
     */
    record Appended(ShipmentEvent event) implements AppendResult {

        public Appended {
            if (event == null) {
                throw new IllegalArgumentException("event cannot be null");
            }
        }

        public long eventSeq() {
            return event.eventSeq();
        }
    }

    /**
     * Replay of an already stored event id.
     *
     * @param existing the record stored by the first append
     */
    record Duplicate(ShipmentEvent existing) implements AppendResult {

        public Duplicate {
            if (existing == null) {
                throw new IllegalArgumentException("existing cannot be null");
            }
        }

        public long eventSeq() {
            return existing.eventSeq();
        }
    }

    /**
     * Stale optimistic-concurrency token.
     *
     * @param shipmentId the contended shipment
     * @param expectedLastSeq the sequence the caller observed
     * @param actualLastSeq the sequence currently in the log
     */
    record Conflict(ShipmentId shipmentId, long expectedLastSeq, long actualLastSeq) implements AppendResult {

        public Conflict {
            if (shipmentId == null) {
                throw new IllegalArgumentException("shipmentId cannot be null");
            }
        }
    }
}
