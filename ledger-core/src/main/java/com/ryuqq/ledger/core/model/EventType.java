package com.ryuqq.ledger.core.model;

/**
 * 이벤트 타입 카탈로그.
 *
 * <p>각 이벤트 타입은 {@link com.ryuqq.ledger.core.statemachine.LifecycleGraph}의
 * 간선(edge) 라벨입니다. 카탈로그에 없는 이벤트는 로그에 기록될 수 없습니다.</p>
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public enum EventType {

    /** Shipment 최초 생성. */
    CREATED,

    /** 관리자 보류. */
    MANAGER_ON_HOLD,

    /** 보류 해제 (CREATED로 복귀). */
    HOLD_RELEASED,

    /** 관리자 승인. */
    MANAGER_APPROVED,

    /** 감독자 승인. */
    SUPERVISOR_APPROVED,

    /** 출고 (운송 시작). */
    DISPATCHED,

    /** 수신 측 도착 확인. */
    RECEIVER_ACKNOWLEDGED,

    /** 창고 입고. */
    WAREHOUSE_INTAKE,

    /** 배송 출발. */
    OUT_FOR_DELIVERY,

    /** 배송 완료. */
    DELIVERED,

    /** 배송 실패. */
    DELIVERY_FAILED,

    /** 재배송 시도. */
    DELIVERY_RETRIED,

    /** 생명주기 종료. */
    LIFECYCLE_CLOSED
}
