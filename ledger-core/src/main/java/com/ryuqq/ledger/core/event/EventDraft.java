package com.ryuqq.ledger.core.event;

import com.ryuqq.ledger.core.model.EventId;
import com.ryuqq.ledger.core.model.EventType;
import com.ryuqq.ledger.core.model.Payload;
import com.ryuqq.ledger.core.model.Role;
import com.ryuqq.ledger.core.model.ShipmentId;
import com.ryuqq.ledger.core.statemachine.LifecycleState;

import java.time.Instant;

/**
 * append 요청 (eventSeq 할당 전 이벤트).
 *
 * <p>eventSeq는 EventStore가 append 시점에 할당합니다.
 * {@code expectedLastSeq}를 지정하면 EventStore는 해당 Shipment의 마지막 순번이
 * 기대값과 다를 때 append하지 않고 충돌을 반환합니다 (낙관적 동시성 제어).</p>
 *
 * @param eventId 전역 고유 이벤트 ID (재시도 시 동일 값 사용)
 * @param shipmentId 대상 Shipment
 * @param eventType 이벤트 타입
 * @param previousState 전이 전 상태 (최초 이벤트는 null)
 * @param newState 전이 후 상태
 * @param emittingRole 행위자
 * @param timestamp 발생 시각
 * @param payload 첨부 데이터 (null 허용)
 * @param schemaVersion 레코드 스키마 버전
 * @param expectedLastSeq 기대하는 마지막 순번 ({@link #ANY_SEQUENCE}이면 검사 안 함)
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public record EventDraft(
    EventId eventId,
    ShipmentId shipmentId,
    EventType eventType,
    LifecycleState previousState,
    LifecycleState newState,
    Role emittingRole,
    Instant timestamp,
    Payload payload,
    int schemaVersion,
    long expectedLastSeq
) {

    /**
     * 순번 검사를 하지 않음을 나타내는 값.
     */
    public static final long ANY_SEQUENCE = -1L;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 expectedLastSeq가 음수(ANY_SEQUENCE 제외)인 경우
     */
    public EventDraft {
        if (eventId == null || shipmentId == null || eventType == null
                || newState == null || emittingRole == null || timestamp == null) {
            throw new IllegalArgumentException("eventId, shipmentId, eventType, newState, emittingRole and timestamp are required");
        }
        if (schemaVersion < 1) {
            throw new IllegalArgumentException("schemaVersion must be positive, but was: " + schemaVersion);
        }
        if (expectedLastSeq < 0 && expectedLastSeq != ANY_SEQUENCE) {
            throw new IllegalArgumentException("expectedLastSeq must be >= 0 or ANY_SEQUENCE, but was: " + expectedLastSeq);
        }
        if (payload == null) {
            payload = Payload.empty();
        }
    }

    /**
     * 순번 검사 여부.
     *
     * @return expectedLastSeq가 지정되었으면 true
     */
    public boolean hasExpectedLastSeq() {
        return expectedLastSeq != ANY_SEQUENCE;
    }

    /**
     * expectedLastSeq만 변경한 새 인스턴스 생성.
     *
     * @param expectedLastSeq 기대 순번
     * @return 새 EventDraft 인스턴스
     */
    public EventDraft withExpectedLastSeq(long expectedLastSeq) {
        return new EventDraft(eventId, shipmentId, eventType, previousState, newState,
            emittingRole, timestamp, payload, schemaVersion, expectedLastSeq);
    }

    /**
     * 순번을 할당하여 ShipmentEvent로 변환.
     *
     * @param eventSeq 할당된 순번
     * @return ShipmentEvent
     */
    public ShipmentEvent toEvent(long eventSeq) {
        return new ShipmentEvent(eventId, shipmentId, eventSeq, eventType, previousState, newState,
            emittingRole, timestamp, payload, schemaVersion);
    }
}
