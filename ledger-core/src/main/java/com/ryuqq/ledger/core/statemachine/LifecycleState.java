package com.ryuqq.ledger.core.statemachine;

/**
 * Shipment의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * (none) ──CREATED──► CREATED ◄──HOLD_RELEASED── MANAGER_ON_HOLD
 *                        │  └──MANAGER_ON_HOLD──────────►│
 *                        ▼ MANAGER_APPROVED ◄─────────────┘
 *                 MANAGER_APPROVED
 *                        ▼ SUPERVISOR_APPROVED
 *                 SUPERVISOR_APPROVED
 *                        ▼ DISPATCHED
 *                    IN_TRANSIT
 *                        ▼ RECEIVER_ACKNOWLEDGED
 *               RECEIVER_ACKNOWLEDGED
 *                        ▼ WAREHOUSE_INTAKE
 *                  WAREHOUSE_INTAKE
 *                        ▼ OUT_FOR_DELIVERY
 *                  OUT_FOR_DELIVERY ◄──DELIVERY_RETRIED── DELIVERY_FAILED
 *                        │  └──DELIVERY_FAILED──────────────►│
 *                        ▼ DELIVERED
 *                     DELIVERED
 *                        ▼ LIFECYCLE_CLOSED
 *                 LIFECYCLE_CLOSED (종료)
 * </pre>
 *
 * <p>실제 허용 여부는 {@link LifecycleGraph}가 결정합니다.</p>
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public enum LifecycleState {

    CREATED,
    MANAGER_ON_HOLD,
    MANAGER_APPROVED,
    SUPERVISOR_APPROVED,
    IN_TRANSIT,
    RECEIVER_ACKNOWLEDGED,
    WAREHOUSE_INTAKE,
    OUT_FOR_DELIVERY,
    DELIVERY_FAILED,
    DELIVERED,

    /**
     * 종료 상태. 이후 어떤 이벤트도 기록될 수 없습니다.
     */
    LIFECYCLE_CLOSED;

    /**
     * 종료 상태인지 확인.
     *
     * @return LIFECYCLE_CLOSED인 경우 true
     */
    public boolean isTerminal() {
        return this == LIFECYCLE_CLOSED;
    }
}
