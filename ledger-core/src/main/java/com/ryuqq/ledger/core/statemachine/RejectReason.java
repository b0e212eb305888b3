package com.ryuqq.ledger.core.statemachine;

/**
 * 전이 거부 사유.
 *
 * <p>모든 사유는 복구 가능하며 상태 변경을 남기지 않습니다.</p>
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public enum RejectReason {

    /**
     * 현재 상태에서 해당 이벤트로 가는 간선이 없음.
     */
    INVALID_TRANSITION,

    /**
     * Role이 현재 상태에서 해당 이벤트를 발생시킬 권한이 없음.
     */
    UNAUTHORIZED,

    /**
     * 같은 Shipment에 대한 다른 전이가 먼저 기록됨. 상태를 다시 읽고 재시도해야 합니다.
     */
    CONCURRENT_CONFLICT,

    /**
     * 해당 Shipment의 이벤트가 존재하지 않음.
     */
    SHIPMENT_NOT_FOUND
}
