package com.ryuqq.ledger.core.spi;

import com.ryuqq.ledger.core.event.EventDraft;
import com.ryuqq.ledger.core.event.ShipmentEvent;
import com.ryuqq.ledger.core.model.EventId;
import com.ryuqq.ledger.core.model.ShipmentId;

import java.util.List;
import java.util.Optional;

/**
 * Append-only event log SPI.
 *
 * <p>The event store is the single source of truth for shipment state. Append is
 * the only mutation primitive: there is no update and no delete.</p>
 *
 * <p><strong>Append Contract:</strong></p>
 * <ol>
 *   <li>Duplicate event id → {@link AppendResult.Duplicate} with the existing record, no side effect</li>
 *   <li>{@code expectedLastSeq} set and stale → {@link AppendResult.Conflict}, no side effect</li>
 *   <li>Timestamp earlier than the shipment's last event → {@link IllegalArgumentException}</li>
 *   <li>Otherwise assign {@code eventSeq = lastSequence + 1}, write durably, then return
 *       {@link AppendResult.Appended}</li>
 * </ol>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Appends for the same shipment are serialized (global serialization is acceptable)</li>
 *   <li>A record is durable before {@code append} returns</li>
 *   <li>A failed write leaves no partial record and throws
 *       {@link com.ryuqq.ledger.core.exception.StorageFailureException}</li>
 *   <li>Reads are lock-free and observe a consistent prefix of the log</li>
 * </ul>
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public interface EventStore {

    /**
     * Appends an event.
     *
     * @param draft the event to append
     * @return appended, duplicate or conflict
     * @throws IllegalArgumentException if draft is null or its timestamp regresses
     * @throws com.ryuqq.ledger.core.exception.StorageFailureException if the record cannot be written durably
     */
    AppendResult append(EventDraft draft);

    /**
     * Reads the whole log in append order.
     *
     * @return immutable snapshot of all events
     */
    List<ShipmentEvent> readAll();

    /**
     * Reads the events of one shipment in sequence order.
     *
     * @param shipmentId the shipment
     * @return immutable snapshot (empty if the shipment is unknown)
     * @throws IllegalArgumentException if shipmentId is null
     */
    List<ShipmentEvent> readFor(ShipmentId shipmentId);

    /**
     * Looks up an event by id.
     *
     * @param eventId the event id
     * @return the stored event, or empty
     * @throws IllegalArgumentException if eventId is null
     */
    Optional<ShipmentEvent> findEvent(EventId eventId);

    /**
     * Lists shipments in order of first appearance in the log.
     *
     * @return shipment ids
     */
    List<ShipmentId> shipmentIds();

    /**
     * Returns the highest sequence recorded for a shipment.
     *
     * @param shipmentId the shipment
     * @return last sequence, or 0 if the shipment has no events
     */
    long lastSequence(ShipmentId shipmentId);

    /**
     * Records that could not be decoded while reading the underlying log.
     *
     * <p>Implementations without a serialized form never produce corrupt records.</p>
     *
     * @return corrupt records skipped while reading (may be empty)
     */
    default List<CorruptRecord> corruptRecords() {
        return List.of();
    }

    /**
     * Replays the whole log from its source of truth.
     *
     * <p>Audits use this instead of {@link #readAll()} so that changes made to a durable
     * log behind the store's back are seen. Stores whose memory is the only copy of the
     * log return their current contents.</p>
     *
     * @return events and corrupt records as currently stored
     * @throws com.ryuqq.ledger.core.exception.StorageFailureException if the log cannot be read
     */
    default LogReplay replayAll() {
        return new LogReplay(readAll(), corruptRecords());
    }
}
