package com.ryuqq.ledger.core.model;

/**
 * 이벤트를 발생시키는 행위자(Role).
 *
 * <p>Role은 특정 상태에서 특정 이벤트를 발생시킬 수 있는 권한 집합의 이름입니다.
 * 어떤 Role이 어떤 상태에서 무엇을 할 수 있는지는
 * {@link com.ryuqq.ledger.core.statemachine.AuthorityMatrix}가 결정합니다.</p>
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public enum Role {

    /**
     * 발송인 (Shipment 생성).
     */
    SENDER,

    /**
     * 발송 측 관리자 (승인/보류).
     */
    SENDER_MANAGER,

    /**
     * 발송 측 감독자 (2차 승인).
     */
    SENDER_SUPERVISOR,

    /**
     * 시스템 (출고, 재배송, 종료).
     */
    SYSTEM,

    /**
     * 수신 측 관리자 (도착 확인).
     */
    RECEIVER_MANAGER,

    /**
     * 창고 관리자 (입고, 배송 출발).
     */
    WAREHOUSE_MANAGER,

    /**
     * 고객 (배송 완료/실패 확인).
     */
    CUSTOMER
}
