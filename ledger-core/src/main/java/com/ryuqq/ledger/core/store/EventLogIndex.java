package com.ryuqq.ledger.core.store;

import com.ryuqq.ledger.core.event.EventDraft;
import com.ryuqq.ledger.core.event.ShipmentEvent;
import com.ryuqq.ledger.core.model.EventId;
import com.ryuqq.ledger.core.model.ShipmentId;
import com.ryuqq.ledger.core.spi.AppendResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe in-memory index over an append-only event log.
 *
 * <p>Shared by the {@link com.ryuqq.ledger.core.spi.EventStore} adapters: it answers reads
 * and the pre-append checks, while the adapter owns locking and durability.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>log:</strong> CopyOnWriteArrayList&lt;ShipmentEvent&gt; - whole log in append order</li>
 *   <li><strong>byShipment:</strong> ConcurrentHashMap&lt;ShipmentId, List&gt; - immutable per-shipment snapshots</li>
 *   <li><strong>byEventId:</strong> ConcurrentHashMap&lt;EventId, ShipmentEvent&gt; - duplicate detection</li>
 * </ul>
 *
 * <p><strong>Concurrency:</strong> readers never lock. Per-shipment lists are replaced, never
 * mutated, so a reader always sees a complete prefix. Writers must serialize
 * {@link #precheck}, {@link #nextEvent} and {@link #add} for the same shipment.</p>
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public final class EventLogIndex {

    private final CopyOnWriteArrayList<ShipmentEvent> log = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<ShipmentId> shipmentOrder = new CopyOnWriteArrayList<>();
    private final ConcurrentHashMap<ShipmentId, List<ShipmentEvent>> byShipment = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<EventId, ShipmentEvent> byEventId = new ConcurrentHashMap<>();

    /**
     * Runs the duplicate, conflict and timestamp checks for a draft.
     *
     * @param draft the draft to append
     * @return a non-appending result, or empty if the draft may be written
     * @throws IllegalArgumentException if draft is null or its timestamp precedes the shipment's last event
     */
    public Optional<AppendResult> precheck(EventDraft draft) {
        if (draft == null) {
            throw new IllegalArgumentException("draft cannot be null");
        }

        ShipmentEvent existing = byEventId.get(draft.eventId());
        if (existing != null) {
            return Optional.of(new AppendResult.Duplicate(existing));
        }

        List<ShipmentEvent> events = eventsFor(draft.shipmentId());
        long lastSeq = lastSequenceOf(events);
        if (draft.hasExpectedLastSeq() && draft.expectedLastSeq() != lastSeq) {
            return Optional.of(new AppendResult.Conflict(draft.shipmentId(), draft.expectedLastSeq(), lastSeq));
        }

        if (!events.isEmpty()) {
            ShipmentEvent last = events.get(events.size() - 1);
            if (draft.timestamp().isBefore(last.timestamp())) {
                throw new IllegalArgumentException(String.format(
                    "Timestamp %s of %s precedes last event %s at %s",
                    draft.timestamp(), draft.shipmentId(), last.eventSeq(), last.timestamp()
                ));
            }
        }
        return Optional.empty();
    }

    /**
     * Assigns the next sequence to a draft.
     *
     * @param draft the draft
     * @return the event as it will be stored
     */
    public ShipmentEvent nextEvent(EventDraft draft) {
        return draft.toEvent(lastSequence(draft.shipmentId()) + 1);
    }

    /**
     * Adds a durably written event.
     *
     * @param event the event
     * @return false if another event with the same id won the race (nothing was added)
     */
    public boolean add(ShipmentEvent event) {
        if (byEventId.putIfAbsent(event.eventId(), event) != null) {
            return false;
        }
        publish(event);
        return true;
    }

    /**
     * Adds an event read back from durable storage without any check.
     *
     * <p>Replay keeps whatever the log holds, including gaps or repeated ids, so the
     * audit can report them.</p>
     *
     * @param event the decoded event
     */
    public void restore(ShipmentEvent event) {
        byEventId.putIfAbsent(event.eventId(), event);
        publish(event);
    }

    private void publish(ShipmentEvent event) {
        byShipment.compute(event.shipmentId(), (id, current) -> {
            if (current == null) {
                shipmentOrder.add(id);
                return List.of(event);
            }
            List<ShipmentEvent> next = new ArrayList<>(current.size() + 1);
            next.addAll(current);
            next.add(event);
            return Collections.unmodifiableList(next);
        });
        log.add(event);
    }

    public List<ShipmentEvent> all() {
        return List.copyOf(log);
    }

    public List<ShipmentEvent> eventsFor(ShipmentId shipmentId) {
        return byShipment.getOrDefault(shipmentId, List.of());
    }

    public Optional<ShipmentEvent> find(EventId eventId) {
        return Optional.ofNullable(byEventId.get(eventId));
    }

    public List<ShipmentId> shipmentIds() {
        return List.copyOf(shipmentOrder);
    }

    public long lastSequence(ShipmentId shipmentId) {
        return lastSequenceOf(eventsFor(shipmentId));
    }

    public int size() {
        return log.size();
    }

    public void clear() {
        log.clear();
        shipmentOrder.clear();
        byShipment.clear();
        byEventId.clear();
    }

    private static long lastSequenceOf(List<ShipmentEvent> events) {
        long max = 0L;
        for (ShipmentEvent event : events) {
            max = Math.max(max, event.eventSeq());
        }
        return max;
    }
}
