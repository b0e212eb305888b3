package com.ryuqq.ledger.core.id;

import com.ryuqq.ledger.core.model.ShipmentId;

/**
 * Shipment 식별자 발급기.
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>단조 증가: 나중에 발급된 ID가 항상 더 큼</li>
 *   <li>재사용 금지: 프로세스 재시작 후에도 동일 값 발급 불가</li>
 *   <li>동시성: 동시에 호출해도 같은 값을 두 번 반환하지 않음</li>
 * </ul>
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public interface ShipmentIdGenerator {

    /**
     * 다음 ShipmentId 발급.
     *
     * @return 새 ShipmentId
     * @throws com.ryuqq.ledger.core.exception.StorageFailureException 카운터를 기록할 수 없는 경우
     */
    ShipmentId nextId();
}
