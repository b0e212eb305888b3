package com.ryuqq.ledger.core.projection;

import com.ryuqq.ledger.core.event.ShipmentEvent;
import com.ryuqq.ledger.core.model.EventType;
import com.ryuqq.ledger.core.model.Payload;
import com.ryuqq.ledger.core.model.Role;
import com.ryuqq.ledger.core.model.ShipmentId;
import com.ryuqq.ledger.core.statemachine.LifecycleState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 이벤트를 접어서(fold) 계산한 Shipment의 현재 상태 (읽기 모델).
 *
 * <p>독립적으로 저장되는 진실이 아니라, 이벤트 로그에서 언제든 다시 계산할 수 있는
 * 파생 값입니다. {@link #apply(ShipmentEvent)}는 새 인스턴스를 반환하며 기존 인스턴스는
 * 변경되지 않습니다.</p>
 *
 * @param shipmentId 대상 Shipment
 * @param currentState 마지막 이벤트의 newState
 * @param createdAt 최초 이벤트 시각
 * @param lastUpdated 마지막 이벤트 시각
 * @param eventCount 이벤트 개수
 * @param lastEventSeq 마지막 이벤트 순번 (낙관적 동시성 토큰)
 * @param eventSequence 이벤트 타입 순서
 * @param currentPayload 누적 Payload (나중 값 우선)
 * @param actorsInvolved 이벤트를 발생시킨 Role (최초 등장 순서, 중복 없음)
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public record ShipmentProjection(
    ShipmentId shipmentId,
    LifecycleState currentState,
    Instant createdAt,
    Instant lastUpdated,
    int eventCount,
    long lastEventSeq,
    List<EventType> eventSequence,
    Payload currentPayload,
    List<Role> actorsInvolved
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public ShipmentProjection {
        if (shipmentId == null || currentState == null || createdAt == null || lastUpdated == null) {
            throw new IllegalArgumentException("shipmentId, currentState, createdAt and lastUpdated are required");
        }
        eventSequence = List.copyOf(eventSequence);
        actorsInvolved = List.copyOf(actorsInvolved);
        currentPayload = currentPayload == null ? Payload.empty() : currentPayload;
    }

    /**
     * 첫 이벤트로 프로젝션 시작.
     *
     * @param first 첫 이벤트
     * @return 새 프로젝션
     */
    public static ShipmentProjection start(ShipmentEvent first) {
        return new ShipmentProjection(
            first.shipmentId(),
            first.newState(),
            first.timestamp(),
            first.timestamp(),
            1,
            first.eventSeq(),
            List.of(first.eventType()),
            first.payload(),
            List.of(first.emittingRole())
        );
    }

    /**
     * 다음 이벤트 적용.
     *
     * @param event 다음 이벤트
     * @return 이벤트가 반영된 새 프로젝션
     * @throws IllegalArgumentException 다른 Shipment의 이벤트인 경우
     */
    public ShipmentProjection apply(ShipmentEvent event) {
        if (!shipmentId.equals(event.shipmentId())) {
            throw new IllegalArgumentException(
                "Event " + event.eventId() + " belongs to " + event.shipmentId() + ", not " + shipmentId);
        }
        List<EventType> sequence = new ArrayList<>(eventSequence);
        sequence.add(event.eventType());

        List<Role> actors = actorsInvolved;
        if (!actors.contains(event.emittingRole())) {
            actors = new ArrayList<>(actorsInvolved);
            actors.add(event.emittingRole());
        }

        return new ShipmentProjection(
            shipmentId,
            event.newState(),
            createdAt,
            event.timestamp(),
            eventCount + 1,
            event.eventSeq(),
            sequence,
            currentPayload.merge(event.payload()),
            actors
        );
    }

    /**
     * 종료되어 더 이상 이벤트를 받을 수 없는지 확인.
     *
     * @return currentState가 LIFECYCLE_CLOSED이면 true
     */
    public boolean isClosed() {
        return currentState.isTerminal();
    }
}
