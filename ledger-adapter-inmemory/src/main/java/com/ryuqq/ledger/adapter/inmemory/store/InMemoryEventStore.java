package com.ryuqq.ledger.adapter.inmemory.store;

import com.ryuqq.ledger.core.event.EventDraft;
import com.ryuqq.ledger.core.event.ShipmentEvent;
import com.ryuqq.ledger.core.model.EventId;
import com.ryuqq.ledger.core.model.ShipmentId;
import com.ryuqq.ledger.core.spi.AppendResult;
import com.ryuqq.ledger.core.spi.EventStore;
import com.ryuqq.ledger.core.store.EventLogIndex;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory implementation of {@link EventStore} SPI for testing and reference purposes.
 *
 * <p>Appends are serialized per shipment with a {@link ReentrantLock} created on demand,
 * so writers of different shipments never block each other. Reads go straight to the
 * {@link EventLogIndex} snapshots and never lock.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>index:</strong> EventLogIndex - log, per-shipment snapshots and event id lookup</li>
 *   <li><strong>locks:</strong> ConcurrentHashMap&lt;ShipmentId, ReentrantLock&gt; - per-shipment append locks</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>"Durable" means visible in this process only</li>
 *   <li>Data lost on process restart</li>
 *   <li>Never produces corrupt records</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * EventStore store = new InMemoryEventStore();
 * AppendResult result = store.append(draft);
 * if (result instanceof AppendResult.Appended appended) {
 *     long seq = appended.eventSeq();
 * }
 * </pre>
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public class InMemoryEventStore implements EventStore {

    private final EventLogIndex index = new EventLogIndex();

    /**
     * Per-shipment append locks.
     * Key: ShipmentId, Value: lock guarding precheck + sequence assignment + publish
     */
    private final ConcurrentHashMap<ShipmentId, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Lock scope: the draft's shipment only</li>
     *   <li>Duplicate check is global because event ids are global</li>
     * </ul>
     */
    @Override
    public AppendResult append(EventDraft draft) {
        if (draft == null) {
            throw new IllegalArgumentException("draft cannot be null");
        }

        ReentrantLock lock = locks.computeIfAbsent(draft.shipmentId(), id -> new ReentrantLock());
        lock.lock();
        try {
            Optional<AppendResult> rejected = index.precheck(draft);
            if (rejected.isPresent()) {
                return rejected.get();
            }

            ShipmentEvent event = index.nextEvent(draft);
            if (!index.add(event)) {
                // same event id appended concurrently under another shipment's lock
                return new AppendResult.Duplicate(index.find(draft.eventId()).orElseThrow());
            }
            return new AppendResult.Appended(event);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ShipmentEvent> readAll() {
        return index.all();
    }

    @Override
    public List<ShipmentEvent> readFor(ShipmentId shipmentId) {
        if (shipmentId == null) {
            throw new IllegalArgumentException("shipmentId cannot be null");
        }
        return index.eventsFor(shipmentId);
    }

    @Override
    public Optional<ShipmentEvent> findEvent(EventId eventId) {
        if (eventId == null) {
            throw new IllegalArgumentException("eventId cannot be null");
        }
        return index.find(eventId);
    }

    @Override
    public List<ShipmentId> shipmentIds() {
        return index.shipmentIds();
    }

    @Override
    public long lastSequence(ShipmentId shipmentId) {
        if (shipmentId == null) {
            throw new IllegalArgumentException("shipmentId cannot be null");
        }
        return index.lastSequence(shipmentId);
    }

    /**
     * Number of events in the log.
     *
     * @return event count
     */
    public int size() {
        return index.size();
    }

    /**
     * Removes every event. Intended for test cleanup only.
     */
    public void clear() {
        index.clear();
        locks.clear();
    }
}
