package com.ryuqq.ledger.application.engine;

import com.ryuqq.ledger.adapter.inmemory.store.InMemoryCounterLog;
import com.ryuqq.ledger.adapter.inmemory.store.InMemoryEventStore;
import com.ryuqq.ledger.core.audit.AuditReport;
import com.ryuqq.ledger.core.audit.AuditSummary;
import com.ryuqq.ledger.core.audit.AuditVerifier;
import com.ryuqq.ledger.core.audit.IntegrityStatus;
import com.ryuqq.ledger.core.event.ShipmentEvent;
import com.ryuqq.ledger.core.id.CounterLogIdGenerator;
import com.ryuqq.ledger.core.model.EventId;
import com.ryuqq.ledger.core.model.EventType;
import com.ryuqq.ledger.core.model.Payload;
import com.ryuqq.ledger.core.model.Role;
import com.ryuqq.ledger.core.model.ShipmentId;
import com.ryuqq.ledger.core.projection.Projector;
import com.ryuqq.ledger.core.projection.ShipmentProjection;
import com.ryuqq.ledger.core.statemachine.LifecycleState;
import com.ryuqq.ledger.core.statemachine.RejectReason;
import com.ryuqq.ledger.core.statemachine.TransitionValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DefaultLifecycleEngine 시나리오 테스트 (in-memory 저장소).
 *
 * @author Ledger Team
 * @since 1.0.0
 */
@DisplayName("DefaultLifecycleEngine 테스트")
class DefaultLifecycleEngineTest {

    private static final Instant START = Instant.parse("2024-01-15T09:00:00Z");

    private InMemoryEventStore store;
    private MutableClock clock;
    private DefaultLifecycleEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore();
        clock = new MutableClock(START);
        engine = new DefaultLifecycleEngine(
            store,
            new CounterLogIdGenerator(new InMemoryCounterLog(), clock),
            TransitionValidator.standard(),
            new Projector(),
            AuditVerifier.standard(),
            clock
        );
    }

    private TransitionResult step(ShipmentId id, EventType type, Role role) {
        clock.advance(Duration.ofMinutes(5));
        return engine.transitionShipment(id, type, role, Payload.empty());
    }

    private ShipmentId deliveredShipment() {
        ShipmentId id = engine.createShipment(Payload.of(Map.of("origin", "Seoul", "destination", "Busan")));
        step(id, EventType.MANAGER_APPROVED, Role.SENDER_MANAGER);
        step(id, EventType.SUPERVISOR_APPROVED, Role.SENDER_SUPERVISOR);
        step(id, EventType.DISPATCHED, Role.SYSTEM);
        step(id, EventType.RECEIVER_ACKNOWLEDGED, Role.RECEIVER_MANAGER);
        step(id, EventType.WAREHOUSE_INTAKE, Role.WAREHOUSE_MANAGER);
        step(id, EventType.OUT_FOR_DELIVERY, Role.WAREHOUSE_MANAGER);
        step(id, EventType.DELIVERED, Role.CUSTOMER);
        return id;
    }

    @Test
    @DisplayName("createShipment는 SHP-0000000001부터 ID를 발급하고 CREATED 상태로 시작한다")
    void createShipment_startsInCreated() {
        // when
        ShipmentId id = engine.createShipment(Payload.of(Map.of("origin", "Seoul")));

        // then
        assertThat(id.getValue()).isEqualTo("SHP-0000000001");
        ShipmentProjection projection = engine.getShipment(id).orElseThrow();
        assertThat(projection.currentState()).isEqualTo(LifecycleState.CREATED);
        assertThat(projection.eventCount()).isEqualTo(1);
        assertThat(projection.createdAt()).isEqualTo(START);
        assertThat(projection.currentPayload().find("origin")).contains("Seoul");

        ShipmentEvent created = engine.history(id).get(0);
        assertThat(created.previousState()).isNull();
        assertThat(created.emittingRole()).isEqualTo(Role.SENDER);
        assertThat(created.eventSeq()).isEqualTo(1L);
    }

    @Test
    @DisplayName("전체 정상 경로를 거쳐 LIFECYCLE_CLOSED에 도달하고 감사가 통과한다")
    void happyPath_reachesClosedAndAuditsClean() {
        // given
        ShipmentId id = deliveredShipment();

        // when
        TransitionResult closed = step(id, EventType.LIFECYCLE_CLOSED, Role.SYSTEM);

        // then
        assertThat(closed.isAccepted()).isTrue();
        ShipmentProjection projection = ((TransitionResult.Accepted) closed).projection();
        assertThat(projection.currentState()).isEqualTo(LifecycleState.LIFECYCLE_CLOSED);
        assertThat(projection.isClosed()).isTrue();
        assertThat(projection.eventCount()).isEqualTo(9);
        assertThat(projection.eventSequence()).startsWith(EventType.CREATED, EventType.MANAGER_APPROVED)
            .endsWith(EventType.DELIVERED, EventType.LIFECYCLE_CLOSED);
        assertThat(projection.actorsInvolved()).containsExactly(Role.SENDER, Role.SENDER_MANAGER,
            Role.SENDER_SUPERVISOR, Role.SYSTEM, Role.RECEIVER_MANAGER, Role.WAREHOUSE_MANAGER, Role.CUSTOMER);
        assertThat(engine.getShipment(id)).contains(projection);

        AuditReport report = engine.verifyIntegrity();
        assertThat(report.isValid()).isTrue();
        assertThat(report.totalEvents()).isEqualTo(9);
    }

    @Test
    @DisplayName("MANAGER_APPROVED를 두 번 보내면 두 번째는 INVALID_TRANSITION으로 거부된다")
    void approvingTwice_isInvalidTransition() {
        ShipmentId id = engine.createShipment(Payload.empty());
        assertThat(step(id, EventType.MANAGER_APPROVED, Role.SENDER_MANAGER).isAccepted()).isTrue();

        TransitionResult second = step(id, EventType.MANAGER_APPROVED, Role.SENDER_MANAGER);

        assertThat(second).isInstanceOf(TransitionResult.Rejected.class);
        assertThat(((TransitionResult.Rejected) second).reason()).isEqualTo(RejectReason.INVALID_TRANSITION);
        assertThat(engine.history(id)).hasSize(2);
    }

    @Test
    @DisplayName("권한 없는 Role의 요청은 UNAUTHORIZED로 거부되고 상태가 바뀌지 않는다")
    void wrongRole_isUnauthorized() {
        ShipmentId id = engine.createShipment(Payload.empty());
        step(id, EventType.MANAGER_APPROVED, Role.SENDER_MANAGER);

        TransitionResult result = step(id, EventType.SUPERVISOR_APPROVED, Role.SENDER_MANAGER);

        assertThat(((TransitionResult.Rejected) result).reason()).isEqualTo(RejectReason.UNAUTHORIZED);
        assertThat(engine.getShipment(id).orElseThrow().currentState()).isEqualTo(LifecycleState.MANAGER_APPROVED);
    }

    @Test
    @DisplayName("종료된 Shipment는 어떤 이벤트도 받지 않는다")
    void closedShipment_rejectsEverything() {
        ShipmentId id = deliveredShipment();
        step(id, EventType.LIFECYCLE_CLOSED, Role.SYSTEM);

        for (EventType type : EventType.values()) {
            for (Role role : Role.values()) {
                TransitionResult result = engine.transitionShipment(id, type, role, Payload.empty());
                assertThat(result.isRejected()).as("%s by %s", type, role).isTrue();
            }
        }
        assertThat(engine.history(id)).hasSize(9);
    }

    @Test
    @DisplayName("존재하지 않는 Shipment는 SHIPMENT_NOT_FOUND로 거부된다")
    void unknownShipment_isNotFound() {
        TransitionResult result = engine.transitionShipment(
            ShipmentId.fromCounter(404), EventType.MANAGER_APPROVED, Role.SENDER_MANAGER, Payload.empty());

        assertThat(((TransitionResult.Rejected) result).reason()).isEqualTo(RejectReason.SHIPMENT_NOT_FOUND);
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("같은 eventId로 재시도하면 기존 이벤트를 replayed로 반환하고 로그는 그대로다")
    void retryWithSameEventId_isIdempotent() {
        ShipmentId id = engine.createShipment(Payload.empty());
        EventId eventId = EventId.random();

        TransitionResult first = engine.transitionShipment(id, EventType.MANAGER_APPROVED, Role.SENDER_MANAGER,
            Payload.of(Map.of("note", "ok")), eventId);
        TransitionResult retry = engine.transitionShipment(id, EventType.MANAGER_APPROVED, Role.SENDER_MANAGER,
            Payload.of(Map.of("note", "ok")), eventId);

        assertThat(((TransitionResult.Accepted) first).replayed()).isFalse();
        TransitionResult.Accepted replayed = (TransitionResult.Accepted) retry;
        assertThat(replayed.replayed()).isTrue();
        assertThat(replayed.event()).isEqualTo(((TransitionResult.Accepted) first).event());
        assertThat(engine.history(id)).hasSize(2);
    }

    @Test
    @DisplayName("다른 Shipment의 eventId를 재사용하면 IllegalArgumentException")
    void eventIdOfAnotherShipment_isRejected() {
        ShipmentId first = engine.createShipment(Payload.empty());
        ShipmentId second = engine.createShipment(Payload.empty());
        EventId eventId = EventId.random();
        engine.transitionShipment(first, EventType.MANAGER_APPROVED, Role.SENDER_MANAGER, Payload.empty(), eventId);

        assertThatThrownBy(() -> engine.transitionShipment(
            second, EventType.MANAGER_APPROVED, Role.SENDER_MANAGER, Payload.empty(), eventId))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("보류 후 해제하면 CREATED로 돌아가고 다시 승인할 수 있다")
    void holdAndRelease_returnsToCreated() {
        ShipmentId id = engine.createShipment(Payload.empty());

        step(id, EventType.MANAGER_ON_HOLD, Role.SENDER_MANAGER);
        assertThat(engine.getShipment(id).orElseThrow().currentState()).isEqualTo(LifecycleState.MANAGER_ON_HOLD);
        step(id, EventType.HOLD_RELEASED, Role.SENDER_MANAGER);
        TransitionResult approved = step(id, EventType.MANAGER_APPROVED, Role.SENDER_MANAGER);

        assertThat(((TransitionResult.Accepted) approved).projection().currentState())
            .isEqualTo(LifecycleState.MANAGER_APPROVED);
    }

    @Test
    @DisplayName("배송 실패 후 재시도하면 OUT_FOR_DELIVERY로 돌아간다")
    void failedDelivery_canBeRetried() {
        ShipmentId id = engine.createShipment(Payload.empty());
        step(id, EventType.MANAGER_APPROVED, Role.SENDER_MANAGER);
        step(id, EventType.SUPERVISOR_APPROVED, Role.SENDER_SUPERVISOR);
        step(id, EventType.DISPATCHED, Role.SYSTEM);
        step(id, EventType.RECEIVER_ACKNOWLEDGED, Role.RECEIVER_MANAGER);
        step(id, EventType.WAREHOUSE_INTAKE, Role.WAREHOUSE_MANAGER);
        step(id, EventType.OUT_FOR_DELIVERY, Role.WAREHOUSE_MANAGER);

        assertThat(step(id, EventType.DELIVERY_FAILED, Role.CUSTOMER).isAccepted()).isTrue();
        assertThat(step(id, EventType.DELIVERY_RETRIED, Role.SYSTEM).isAccepted()).isTrue();
        assertThat(engine.getShipment(id).orElseThrow().currentState()).isEqualTo(LifecycleState.OUT_FOR_DELIVERY);
    }

    @Test
    @DisplayName("시계가 뒤로 가도 이벤트 timestamp는 감소하지 않는다")
    void clockGoingBackwards_keepsTimestampsMonotonic() {
        ShipmentId id = engine.createShipment(Payload.empty());
        clock.set(START.minus(Duration.ofHours(1)));

        TransitionResult result = engine.transitionShipment(id, EventType.MANAGER_APPROVED, Role.SENDER_MANAGER, Payload.empty());

        assertThat(((TransitionResult.Accepted) result).event().timestamp()).isEqualTo(START);
        assertThat(engine.verifyIntegrity().isValid()).isTrue();
    }

    @Test
    @DisplayName("payload는 누적되며 나중 값이 우선한다")
    void payload_mergesLaterKeysWin() {
        ShipmentId id = engine.createShipment(Payload.of(Map.of("priority", "normal", "origin", "Seoul")));

        engine.transitionShipment(id, EventType.MANAGER_APPROVED, Role.SENDER_MANAGER,
            Payload.of(Map.of("priority", "express")));

        Payload merged = engine.getShipment(id).orElseThrow().currentPayload();
        assertThat(merged.find("priority")).contains("express");
        assertThat(merged.find("origin")).contains("Seoul");
    }

    @Test
    @DisplayName("getShipmentsByState는 해당 상태만 최신 lastUpdated 순으로 반환한다")
    void shipmentsByState_newestFirst() {
        ShipmentId older = engine.createShipment(Payload.empty());
        clock.advance(Duration.ofMinutes(1));
        ShipmentId newer = engine.createShipment(Payload.empty());
        clock.advance(Duration.ofMinutes(1));
        ShipmentId approved = engine.createShipment(Payload.empty());
        step(approved, EventType.MANAGER_APPROVED, Role.SENDER_MANAGER);

        List<ShipmentProjection> created = engine.getShipmentsByState(LifecycleState.CREATED);

        assertThat(created).extracting(ShipmentProjection::shipmentId).containsExactly(newer, older);
        assertThat(engine.getShipmentsByState(LifecycleState.MANAGER_APPROVED)).hasSize(1);
        assertThat(engine.getAllShipments()).extracting(ShipmentProjection::shipmentId)
            .containsExactly(older, newer, approved);
    }

    @Test
    @DisplayName("auditReport는 건수, 분포, 시간 범위를 요약한다")
    void auditReport_summarizesLog() {
        assertThat(engine.auditReport().integrityStatus()).isEqualTo(IntegrityStatus.EMPTY);

        ShipmentId id = engine.createShipment(Payload.empty());
        engine.createShipment(Payload.empty());
        step(id, EventType.MANAGER_APPROVED, Role.SENDER_MANAGER);

        AuditSummary summary = engine.auditReport();

        assertThat(summary.totalEvents()).isEqualTo(3);
        assertThat(summary.totalShipments()).isEqualTo(2);
        assertThat(summary.integrityStatus()).isEqualTo(IntegrityStatus.VALID);
        assertThat(summary.eventTypeDistribution()).containsEntry(EventType.CREATED, 2L)
            .containsEntry(EventType.MANAGER_APPROVED, 1L);
        assertThat(summary.roleDistribution()).containsEntry(Role.SENDER, 2L);
        assertThat(summary.stateDistribution()).containsEntry(LifecycleState.CREATED, 1L)
            .containsEntry(LifecycleState.MANAGER_APPROVED, 1L);
        assertThat(summary.firstEventTime()).isEqualTo(START);
        assertThat(summary.lastEventTime()).isEqualTo(START.plus(Duration.ofMinutes(5)));
        assertThat(summary.integrityErrors()).isEmpty();
    }

    @Test
    @DisplayName("null 인자는 IllegalArgumentException")
    void nullArguments_areRejected() {
        ShipmentId id = engine.createShipment(Payload.empty());

        assertThatThrownBy(() -> engine.transitionShipment(null, EventType.MANAGER_APPROVED, Role.SENDER_MANAGER, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.transitionShipment(id, null, Role.SENDER_MANAGER, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.transitionShipment(id, EventType.MANAGER_APPROVED, null, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.getShipmentsByState(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
