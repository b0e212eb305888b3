package com.ryuqq.ledger.testkit.contract;

import com.ryuqq.ledger.core.event.EventDraft;
import com.ryuqq.ledger.core.event.ShipmentEvent;
import com.ryuqq.ledger.core.model.EventId;
import com.ryuqq.ledger.core.model.EventType;
import com.ryuqq.ledger.core.model.Payload;
import com.ryuqq.ledger.core.model.Role;
import com.ryuqq.ledger.core.model.ShipmentId;
import com.ryuqq.ledger.core.statemachine.LifecycleState;

import java.time.Instant;
import java.util.Map;

/**
 * Event fixtures shared by contract tests.
 *
 * <p>Every helper builds drafts that follow the standard lifecycle, so a store filled
 * through them also passes the audit.</p>
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public final class TestEvents {

    /**
     * Fixed base instant used by fixtures.
     */
    public static final Instant BASE_TIME = Instant.parse("2024-01-15T09:00:00Z");

    private TestEvents() {
    }

    public static ShipmentId shipment(long counter) {
        return ShipmentId.fromCounter(counter);
    }

    /**
     * Initial CREATED draft emitted by SENDER.
     *
     * @param shipmentId the shipment
     * @return draft without sequence expectation
     */
    public static EventDraft created(ShipmentId shipmentId) {
        return created(shipmentId, BASE_TIME);
    }

    public static EventDraft created(ShipmentId shipmentId, Instant timestamp) {
        return new EventDraft(
            EventId.random(), shipmentId, EventType.CREATED,
            null, LifecycleState.CREATED, Role.SENDER, timestamp,
            Payload.of(Map.of("origin", "Seoul", "destination", "Busan")),
            ShipmentEvent.CURRENT_SCHEMA_VERSION, EventDraft.ANY_SEQUENCE
        );
    }

    /**
     * MANAGER_APPROVED draft following a CREATED event.
     *
     * @param shipmentId the shipment
     * @param timestamp event time
     * @return draft without sequence expectation
     */
    public static EventDraft managerApproved(ShipmentId shipmentId, Instant timestamp) {
        return new EventDraft(
            EventId.random(), shipmentId, EventType.MANAGER_APPROVED,
            LifecycleState.CREATED, LifecycleState.MANAGER_APPROVED, Role.SENDER_MANAGER, timestamp,
            Payload.of(Map.of("approved_by", "manager-01")),
            ShipmentEvent.CURRENT_SCHEMA_VERSION, EventDraft.ANY_SEQUENCE
        );
    }

    /**
     * Draft for an arbitrary transition.
     *
     * @return draft without sequence expectation
     */
    public static EventDraft transition(ShipmentId shipmentId, EventType type, LifecycleState from,
                                        LifecycleState to, Role role, Instant timestamp) {
        return new EventDraft(
            EventId.random(), shipmentId, type, from, to, role, timestamp,
            Payload.empty(), ShipmentEvent.CURRENT_SCHEMA_VERSION, EventDraft.ANY_SEQUENCE
        );
    }
}
