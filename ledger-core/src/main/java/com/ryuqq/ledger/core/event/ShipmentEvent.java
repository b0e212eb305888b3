package com.ryuqq.ledger.core.event;

import com.ryuqq.ledger.core.model.EventId;
import com.ryuqq.ledger.core.model.EventType;
import com.ryuqq.ledger.core.model.Payload;
import com.ryuqq.ledger.core.model.Role;
import com.ryuqq.ledger.core.model.ShipmentId;
import com.ryuqq.ledger.core.statemachine.LifecycleState;

import java.time.Instant;

/**
 * 이벤트 로그에 기록된 불변 이벤트.
 *
 * <p>ShipmentEvent는 하나의 상태 전이를 기술하는 사실(fact) 레코드입니다.
 * 기록된 후에는 수정, 삭제, 재정렬되지 않습니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>eventSeq는 Shipment마다 1부터 빈틈없이 증가</li>
 *   <li>n번째 이벤트의 newState == n+1번째 이벤트의 previousState</li>
 *   <li>timestamp는 같은 Shipment의 직전 이벤트보다 이르지 않음</li>
 *   <li>previousState는 최초 CREATED 이벤트에서만 null</li>
 * </ul>
 *
 * @param eventId 전역 고유 이벤트 ID
 * @param shipmentId 대상 Shipment
 * @param eventSeq Shipment 내 순번 (1부터)
 * @param eventType 이벤트 타입
 * @param previousState 전이 전 상태 (최초 이벤트는 null)
 * @param newState 전이 후 상태
 * @param emittingRole 이벤트를 발생시킨 Role
 * @param timestamp 발생 시각 (UTC)
 * @param payload 첨부 데이터
 * @param schemaVersion 레코드 스키마 버전
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public record ShipmentEvent(
    EventId eventId,
    ShipmentId shipmentId,
    long eventSeq,
    EventType eventType,
    LifecycleState previousState,
    LifecycleState newState,
    Role emittingRole,
    Instant timestamp,
    Payload payload,
    int schemaVersion
) {

    /**
     * 현재 레코드 스키마 버전. 이전 버전 레코드도 계속 유효합니다.
     */
    public static final int CURRENT_SCHEMA_VERSION = 1;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 eventSeq/schemaVersion이 1 미만인 경우
     */
    public ShipmentEvent {
        if (eventId == null || shipmentId == null || eventType == null
                || newState == null || emittingRole == null || timestamp == null) {
            throw new IllegalArgumentException("eventId, shipmentId, eventType, newState, emittingRole and timestamp are required");
        }
        if (eventSeq < 1) {
            throw new IllegalArgumentException("eventSeq must be positive, but was: " + eventSeq);
        }
        if (schemaVersion < 1) {
            throw new IllegalArgumentException("schemaVersion must be positive, but was: " + schemaVersion);
        }
        if (payload == null) {
            payload = Payload.empty();
        }
    }

    /**
     * Shipment를 생성한 최초 이벤트인지 확인.
     *
     * @return previousState가 없으면 true
     */
    public boolean isInitial() {
        return previousState == null;
    }
}
