package com.ryuqq.ledger.core.support;

import com.ryuqq.ledger.core.event.ShipmentEvent;
import com.ryuqq.ledger.core.model.EventId;
import com.ryuqq.ledger.core.model.EventType;
import com.ryuqq.ledger.core.model.Payload;
import com.ryuqq.ledger.core.model.Role;
import com.ryuqq.ledger.core.model.ShipmentId;
import com.ryuqq.ledger.core.statemachine.LifecycleState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 표준 생명주기를 따르는 이벤트 시퀀스 빌더.
 */
public final class EventFixtures {

    public static final Instant BASE_TIME = Instant.parse("2024-01-15T09:00:00Z");

    private EventFixtures() {
    }

    public static ShipmentEvent event(ShipmentId id, long seq, EventType type, LifecycleState from,
                                      LifecycleState to, Role role, Instant timestamp, Payload payload) {
        return new ShipmentEvent(EventId.random(), id, seq, type, from, to, role, timestamp, payload,
            ShipmentEvent.CURRENT_SCHEMA_VERSION);
    }

    /**
     * CREATED부터 LIFECYCLE_CLOSED까지의 정상 경로 이벤트 9개.
     */
    public static List<ShipmentEvent> fullLifecycle(ShipmentId id) {
        List<ShipmentEvent> events = new ArrayList<>();
        Step[] steps = {
            new Step(EventType.CREATED, null, LifecycleState.CREATED, Role.SENDER),
            new Step(EventType.MANAGER_APPROVED, LifecycleState.CREATED, LifecycleState.MANAGER_APPROVED, Role.SENDER_MANAGER),
            new Step(EventType.SUPERVISOR_APPROVED, LifecycleState.MANAGER_APPROVED, LifecycleState.SUPERVISOR_APPROVED, Role.SENDER_SUPERVISOR),
            new Step(EventType.DISPATCHED, LifecycleState.SUPERVISOR_APPROVED, LifecycleState.IN_TRANSIT, Role.SYSTEM),
            new Step(EventType.RECEIVER_ACKNOWLEDGED, LifecycleState.IN_TRANSIT, LifecycleState.RECEIVER_ACKNOWLEDGED, Role.RECEIVER_MANAGER),
            new Step(EventType.WAREHOUSE_INTAKE, LifecycleState.RECEIVER_ACKNOWLEDGED, LifecycleState.WAREHOUSE_INTAKE, Role.WAREHOUSE_MANAGER),
            new Step(EventType.OUT_FOR_DELIVERY, LifecycleState.WAREHOUSE_INTAKE, LifecycleState.OUT_FOR_DELIVERY, Role.WAREHOUSE_MANAGER),
            new Step(EventType.DELIVERED, LifecycleState.OUT_FOR_DELIVERY, LifecycleState.DELIVERED, Role.CUSTOMER),
            new Step(EventType.LIFECYCLE_CLOSED, LifecycleState.DELIVERED, LifecycleState.LIFECYCLE_CLOSED, Role.SYSTEM)
        };
        for (int i = 0; i < steps.length; i++) {
            Step step = steps[i];
            Payload payload = i == 0
                ? Payload.of(Map.of("origin", "Seoul", "priority", "normal"))
                : Payload.of(Map.of("step", step.type().name()));
            events.add(event(id, i + 1, step.type(), step.from(), step.to(), step.role(),
                BASE_TIME.plusSeconds(60L * i), payload));
        }
        return events;
    }

    /**
     * 정상 경로의 앞부분.
     */
    public static List<ShipmentEvent> lifecyclePrefix(ShipmentId id, int count) {
        return new ArrayList<>(fullLifecycle(id).subList(0, count));
    }

    /**
     * 한 이벤트의 일부 필드만 바꾼 복사본.
     */
    public static ShipmentEvent withSeq(ShipmentEvent e, long seq) {
        return new ShipmentEvent(e.eventId(), e.shipmentId(), seq, e.eventType(), e.previousState(),
            e.newState(), e.emittingRole(), e.timestamp(), e.payload(), e.schemaVersion());
    }

    public static ShipmentEvent withRole(ShipmentEvent e, Role role) {
        return new ShipmentEvent(e.eventId(), e.shipmentId(), e.eventSeq(), e.eventType(), e.previousState(),
            e.newState(), role, e.timestamp(), e.payload(), e.schemaVersion());
    }

    public static ShipmentEvent withTimestamp(ShipmentEvent e, Instant timestamp) {
        return new ShipmentEvent(e.eventId(), e.shipmentId(), e.eventSeq(), e.eventType(), e.previousState(),
            e.newState(), e.emittingRole(), timestamp, e.payload(), e.schemaVersion());
    }

    public static ShipmentEvent withStates(ShipmentEvent e, LifecycleState from, LifecycleState to) {
        return new ShipmentEvent(e.eventId(), e.shipmentId(), e.eventSeq(), e.eventType(), from,
            to, e.emittingRole(), e.timestamp(), e.payload(), e.schemaVersion());
    }

    public static ShipmentEvent withEventId(ShipmentEvent e, EventId eventId) {
        return new ShipmentEvent(eventId, e.shipmentId(), e.eventSeq(), e.eventType(), e.previousState(),
            e.newState(), e.emittingRole(), e.timestamp(), e.payload(), e.schemaVersion());
    }

    private record Step(EventType type, LifecycleState from, LifecycleState to, Role role) {
    }
}
