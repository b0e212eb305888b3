package com.ryuqq.ledger.core.statemachine;

import com.ryuqq.ledger.core.model.EventType;
import com.ryuqq.ledger.core.model.Role;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 상태별 이벤트 발생 권한 테이블.
 *
 * <p>각 상태에는 다음 이벤트를 발생시킬 수 있는 Role이 정확히 하나 존재합니다.
 * 권한은 오직 <em>현재 상태</em>의 함수이므로 세션이나 토큰을 철회할 필요가 없습니다.
 * 상태를 벗어나는 순간 이전 소유자의 권한은 사라지며,
 * 보류/재시도 순환으로 이전 상태에 재진입하더라도 그 상태에 정의된 권한만 복원됩니다.</p>
 *
 * <p><strong>권한 테이블:</strong></p>
 * <pre>
 * (none)                → SENDER             : CREATED
 * CREATED               → SENDER_MANAGER     : MANAGER_APPROVED, MANAGER_ON_HOLD
 * MANAGER_ON_HOLD       → SENDER_MANAGER     : HOLD_RELEASED, MANAGER_APPROVED
 * MANAGER_APPROVED      → SENDER_SUPERVISOR  : SUPERVISOR_APPROVED
 * SUPERVISOR_APPROVED   → SYSTEM             : DISPATCHED
 * IN_TRANSIT            → RECEIVER_MANAGER   : RECEIVER_ACKNOWLEDGED
 * RECEIVER_ACKNOWLEDGED → WAREHOUSE_MANAGER  : WAREHOUSE_INTAKE
 * WAREHOUSE_INTAKE      → WAREHOUSE_MANAGER  : OUT_FOR_DELIVERY
 * OUT_FOR_DELIVERY      → CUSTOMER           : DELIVERED, DELIVERY_FAILED
 * DELIVERY_FAILED       → SYSTEM             : DELIVERY_RETRIED
 * DELIVERED             → SYSTEM             : LIFECYCLE_CLOSED
 * LIFECYCLE_CLOSED      → (없음)
 * </pre>
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public final class AuthorityMatrix {

    /**
     * Shipment 생성 권한을 가진 Role.
     */
    public static final Role INITIAL_ROLE = Role.SENDER;

    private static final AuthorityMatrix STANDARD = new AuthorityMatrix(Map.of(
        LifecycleState.CREATED, new Grant(Role.SENDER_MANAGER, EnumSet.of(EventType.MANAGER_APPROVED, EventType.MANAGER_ON_HOLD)),
        LifecycleState.MANAGER_ON_HOLD, new Grant(Role.SENDER_MANAGER, EnumSet.of(EventType.HOLD_RELEASED, EventType.MANAGER_APPROVED)),
        LifecycleState.MANAGER_APPROVED, new Grant(Role.SENDER_SUPERVISOR, EnumSet.of(EventType.SUPERVISOR_APPROVED)),
        LifecycleState.SUPERVISOR_APPROVED, new Grant(Role.SYSTEM, EnumSet.of(EventType.DISPATCHED)),
        LifecycleState.IN_TRANSIT, new Grant(Role.RECEIVER_MANAGER, EnumSet.of(EventType.RECEIVER_ACKNOWLEDGED)),
        LifecycleState.RECEIVER_ACKNOWLEDGED, new Grant(Role.WAREHOUSE_MANAGER, EnumSet.of(EventType.WAREHOUSE_INTAKE)),
        LifecycleState.WAREHOUSE_INTAKE, new Grant(Role.WAREHOUSE_MANAGER, EnumSet.of(EventType.OUT_FOR_DELIVERY)),
        LifecycleState.OUT_FOR_DELIVERY, new Grant(Role.CUSTOMER, EnumSet.of(EventType.DELIVERED, EventType.DELIVERY_FAILED)),
        LifecycleState.DELIVERY_FAILED, new Grant(Role.SYSTEM, EnumSet.of(EventType.DELIVERY_RETRIED)),
        LifecycleState.DELIVERED, new Grant(Role.SYSTEM, EnumSet.of(EventType.LIFECYCLE_CLOSED))
    ));

    private static final Grant INITIAL_GRANT = new Grant(INITIAL_ROLE, EnumSet.of(LifecycleGraph.INITIAL_EVENT));

    private final Map<LifecycleState, Grant> grants;

    private AuthorityMatrix(Map<LifecycleState, Grant> definition) {
        if (definition.containsKey(LifecycleState.LIFECYCLE_CLOSED)) {
            throw new IllegalArgumentException("LIFECYCLE_CLOSED cannot grant authority");
        }
        this.grants = Collections.unmodifiableMap(new EnumMap<>(definition));
    }

    /**
     * 표준 권한 테이블.
     *
     * @return 공유 불변 인스턴스
     */
    public static AuthorityMatrix standard() {
        return STANDARD;
    }

    /**
     * 주어진 상태에서 Role이 발생시킬 수 있는 이벤트 타입.
     *
     * @param state 현재 상태 (null이면 미생성)
     * @param role 행위자
     * @return 허용된 이벤트 타입 (권한이 없으면 빈 집합)
     * @throws IllegalArgumentException role이 null인 경우
     */
    public Set<EventType> permitted(LifecycleState state, Role role) {
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
        Grant grant = grantFor(state);
        if (grant == null || grant.role() != role) {
            return Collections.emptySet();
        }
        return grant.eventTypes();
    }

    /**
     * 주어진 상태의 소유 Role.
     *
     * @param state 현재 상태 (null이면 미생성)
     * @return 소유 Role (종료 상태이면 empty)
     */
    public Optional<Role> owner(LifecycleState state) {
        return Optional.ofNullable(grantFor(state)).map(Grant::role);
    }

    private Grant grantFor(LifecycleState state) {
        return state == null ? INITIAL_GRANT : grants.get(state);
    }

    private record Grant(Role role, Set<EventType> eventTypes) {

        private Grant {
            eventTypes = Collections.unmodifiableSet(EnumSet.copyOf(eventTypes));
        }
    }
}
