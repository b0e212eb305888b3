package com.ryuqq.ledger.core.statemachine;

import com.ryuqq.ledger.core.model.EventType;
import com.ryuqq.ledger.core.model.Role;
import com.ryuqq.ledger.core.model.ShipmentId;

import java.util.Optional;

/**
 * 제안된 이벤트의 전이 및 권한 검증.
 *
 * <p>{@link LifecycleGraph}와 {@link AuthorityMatrix}를 조합하여
 * 이벤트가 append되기 전에 허용 여부를 판단합니다.</p>
 *
 * <p><strong>검증 순서:</strong></p>
 * <ol>
 *   <li>{@code LifecycleGraph.allowed(currentState, eventType)} 조회 → 없으면 INVALID_TRANSITION</li>
 *   <li>{@code AuthorityMatrix.permitted(currentState, role)}에 eventType 포함 여부 → 없으면 UNAUTHORIZED</li>
 *   <li>통과 시 Accept(newState)</li>
 * </ol>
 *
 * <p>이 클래스는 상태를 갖지 않으며 스레드 안전합니다. 검증과 append의 원자성은
 * 호출자가 {@code expectedLastSeq}를 이용한 낙관적 동시성 검사로 보장합니다.</p>
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public final class TransitionValidator {

    private final LifecycleGraph graph;
    private final AuthorityMatrix authority;

    /**
     * 생성자.
     *
     * @param graph 전이 그래프
     * @param authority 권한 테이블
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public TransitionValidator(LifecycleGraph graph, AuthorityMatrix authority) {
        if (graph == null) {
            throw new IllegalArgumentException("graph cannot be null");
        }
        if (authority == null) {
            throw new IllegalArgumentException("authority cannot be null");
        }
        this.graph = graph;
        this.authority = authority;
    }

    /**
     * 표준 그래프와 권한 테이블을 사용하는 Validator.
     *
     * @return TransitionValidator 인스턴스
     */
    public static TransitionValidator standard() {
        return new TransitionValidator(LifecycleGraph.standard(), AuthorityMatrix.standard());
    }

    /**
     * 전이 검증.
     *
     * @param shipmentId 대상 Shipment
     * @param eventType 발생시킬 이벤트
     * @param role 행위자
     * @param currentState 현재 상태 (null이면 미생성 Shipment)
     * @return Accept(newState) 또는 Reject(reason)
     * @throws IllegalArgumentException shipmentId, eventType, role 중 하나라도 null인 경우
     */
    public Verdict validate(ShipmentId shipmentId, EventType eventType, Role role, LifecycleState currentState) {
        if (shipmentId == null || eventType == null || role == null) {
            throw new IllegalArgumentException(
                "shipmentId, eventType and role are required (shipmentId: " + shipmentId
                    + ", eventType: " + eventType + ", role: " + role + ")"
            );
        }

        // 1. 그래프 검사
        Optional<LifecycleState> next = graph.allowed(currentState, eventType);
        if (next.isEmpty()) {
            return Reject.of(RejectReason.INVALID_TRANSITION, String.format(
                "Invalid transition for %s: %s does not accept %s (allowed: %s)",
                shipmentId, describe(currentState), eventType, graph.outgoing(currentState)
            ));
        }

        // 2. 권한 검사
        if (!authority.permitted(currentState, role).contains(eventType)) {
            return Reject.of(RejectReason.UNAUTHORIZED, String.format(
                "Role %s is not authorized to emit %s for %s in state %s (owner: %s)",
                role, eventType, shipmentId, describe(currentState),
                authority.owner(currentState).map(Enum::name).orElse("none")
            ));
        }

        return new Accept(next.get());
    }

    public LifecycleGraph graph() {
        return graph;
    }

    public AuthorityMatrix authority() {
        return authority;
    }

    private static String describe(LifecycleState state) {
        return state == null ? "(not created)" : state.name();
    }
}
