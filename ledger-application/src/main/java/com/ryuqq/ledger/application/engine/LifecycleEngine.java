package com.ryuqq.ledger.application.engine;

import com.ryuqq.ledger.core.audit.AuditReport;
import com.ryuqq.ledger.core.audit.AuditSummary;
import com.ryuqq.ledger.core.event.ShipmentEvent;
import com.ryuqq.ledger.core.model.EventId;
import com.ryuqq.ledger.core.model.EventType;
import com.ryuqq.ledger.core.model.Payload;
import com.ryuqq.ledger.core.model.Role;
import com.ryuqq.ledger.core.model.ShipmentId;
import com.ryuqq.ledger.core.projection.ShipmentProjection;
import com.ryuqq.ledger.core.statemachine.LifecycleState;

import java.util.List;
import java.util.Optional;

/**
 * Shipment 생명주기 엔진.
 *
 * <p>Shipment 상태를 바꾸는 유일한 경로입니다. 모든 변경은 검증을 통과한 뒤
 * 이벤트 로그에 append되며, 현재 상태는 항상 로그에서 다시 계산됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ShipmentId id = engine.createShipment(Payload.of(Map.of("origin", "Seoul")));
 *
 * TransitionResult result = engine.transitionShipment(
 *     id, EventType.MANAGER_APPROVED, Role.SENDER_MANAGER, Payload.empty());
 *
 * if (result instanceof TransitionResult.Rejected rejected) {
 *     // INVALID_TRANSITION, UNAUTHORIZED, CONCURRENT_CONFLICT, SHIPMENT_NOT_FOUND
 *     log.warn("{}: {}", rejected.reason(), rejected.message());
 * }
 * </pre>
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public interface LifecycleEngine {

    /**
     * 새 Shipment 생성.
     *
     * <p>ID를 발급하고 SENDER가 발생시킨 CREATED 이벤트를 기록합니다.</p>
     *
     * @param initialPayload 초기 데이터 (null 허용)
     * @return 새 ShipmentId
     * @throws com.ryuqq.ledger.core.exception.StorageFailureException ID 발급 또는 이벤트 기록 실패 시
     */
    ShipmentId createShipment(Payload initialPayload);

    /**
     * 상태 전이 요청 (새 eventId 사용).
     *
     * @param shipmentId 대상 Shipment
     * @param eventType 발생시킬 이벤트
     * @param role 행위자
     * @param extraPayload 추가 데이터 (null 허용)
     * @return Accepted 또는 Rejected
     * @throws IllegalArgumentException shipmentId, eventType, role 중 null이 있는 경우
     * @throws com.ryuqq.ledger.core.exception.StorageFailureException 이벤트 기록 실패 시
     */
    TransitionResult transitionShipment(ShipmentId shipmentId, EventType eventType, Role role, Payload extraPayload);

    /**
     * 상태 전이 요청 (재시도 안전).
     *
     * <p>같은 eventId로 다시 호출하면 기존 이벤트를 {@code replayed=true}로 반환하며
     * 로그는 변경되지 않습니다.</p>
     *
     * @param eventId 호출자가 정한 이벤트 ID
     * @return Accepted 또는 Rejected
     * @throws IllegalArgumentException eventId가 다른 Shipment의 이벤트에 이미 사용된 경우
     */
    TransitionResult transitionShipment(ShipmentId shipmentId, EventType eventType, Role role,
                                        Payload extraPayload, EventId eventId);

    Optional<ShipmentProjection> getShipment(ShipmentId shipmentId);

    /**
     * 현재 상태로 Shipment 조회.
     *
     * @param state 현재 상태
     * @return 프로젝션 목록 (lastUpdated 최신순)
     */
    List<ShipmentProjection> getShipmentsByState(LifecycleState state);

    /**
     * 전체 Shipment 조회.
     *
     * @return 프로젝션 목록 (로그 최초 등장 순서)
     */
    List<ShipmentProjection> getAllShipments();

    /**
     * Shipment의 전체 이벤트 이력.
     *
     * @param shipmentId 대상 Shipment
     * @return eventSeq 순서의 이벤트 (없으면 빈 목록)
     */
    List<ShipmentEvent> history(ShipmentId shipmentId);

    /**
     * 전체 로그 무결성 검사.
     *
     * @return 모든 위반을 담은 감사 결과
     */
    AuditReport verifyIntegrity();

    /**
     * 전체 로그 운영 요약.
     *
     * @return 건수, 분포, 시간 범위, 무결성 상태
     */
    AuditSummary auditReport();
}
