package com.ryuqq.ledger.core.statemachine;

import com.ryuqq.ledger.core.model.EventType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 허용된 상태 전이 그래프.
 *
 * <p>각 간선은 (현재 상태, 이벤트 타입) → 다음 상태 형태이며,
 * 정적 정의에서 한 번만 생성되는 불변 조회 테이블로 보관됩니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>명시되지 않은 (상태, 이벤트) 조합은 모두 금지 (closed-world)</li>
 *   <li>LIFECYCLE_CLOSED에는 나가는 간선이 없음</li>
 *   <li>허용된 순환은 CREATED ⇄ MANAGER_ON_HOLD, OUT_FOR_DELIVERY ⇄ DELIVERY_FAILED 두 개뿐</li>
 * </ul>
 *
 * <p>현재 상태가 {@code null}이면 아직 생성되지 않은 Shipment를 의미하며,
 * 이때 허용되는 간선은 {@code CREATED → CREATED} 하나입니다.</p>
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public final class LifecycleGraph {

    private static final LifecycleGraph STANDARD = new LifecycleGraph(List.of(
        new Edge(LifecycleState.CREATED, EventType.MANAGER_APPROVED, LifecycleState.MANAGER_APPROVED),
        new Edge(LifecycleState.CREATED, EventType.MANAGER_ON_HOLD, LifecycleState.MANAGER_ON_HOLD),
        new Edge(LifecycleState.MANAGER_ON_HOLD, EventType.HOLD_RELEASED, LifecycleState.CREATED),
        new Edge(LifecycleState.MANAGER_ON_HOLD, EventType.MANAGER_APPROVED, LifecycleState.MANAGER_APPROVED),
        new Edge(LifecycleState.MANAGER_APPROVED, EventType.SUPERVISOR_APPROVED, LifecycleState.SUPERVISOR_APPROVED),
        new Edge(LifecycleState.SUPERVISOR_APPROVED, EventType.DISPATCHED, LifecycleState.IN_TRANSIT),
        new Edge(LifecycleState.IN_TRANSIT, EventType.RECEIVER_ACKNOWLEDGED, LifecycleState.RECEIVER_ACKNOWLEDGED),
        new Edge(LifecycleState.RECEIVER_ACKNOWLEDGED, EventType.WAREHOUSE_INTAKE, LifecycleState.WAREHOUSE_INTAKE),
        new Edge(LifecycleState.WAREHOUSE_INTAKE, EventType.OUT_FOR_DELIVERY, LifecycleState.OUT_FOR_DELIVERY),
        new Edge(LifecycleState.OUT_FOR_DELIVERY, EventType.DELIVERED, LifecycleState.DELIVERED),
        new Edge(LifecycleState.OUT_FOR_DELIVERY, EventType.DELIVERY_FAILED, LifecycleState.DELIVERY_FAILED),
        new Edge(LifecycleState.DELIVERY_FAILED, EventType.DELIVERY_RETRIED, LifecycleState.OUT_FOR_DELIVERY),
        new Edge(LifecycleState.DELIVERED, EventType.LIFECYCLE_CLOSED, LifecycleState.LIFECYCLE_CLOSED)
    ));

    /**
     * 최초 생성 이벤트.
     */
    public static final EventType INITIAL_EVENT = EventType.CREATED;

    /**
     * 최초 생성 이벤트가 만드는 상태.
     */
    public static final LifecycleState INITIAL_STATE = LifecycleState.CREATED;

    private final Map<LifecycleState, Map<EventType, LifecycleState>> edges;

    private LifecycleGraph(List<Edge> definition) {
        Map<LifecycleState, Map<EventType, LifecycleState>> table = new EnumMap<>(LifecycleState.class);
        for (LifecycleState state : LifecycleState.values()) {
            table.put(state, new EnumMap<>(EventType.class));
        }
        for (Edge edge : definition) {
            LifecycleState previous = table.get(edge.from()).putIfAbsent(edge.eventType(), edge.to());
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate edge definition: " + edge);
            }
        }
        if (!table.get(LifecycleState.LIFECYCLE_CLOSED).isEmpty()) {
            throw new IllegalArgumentException("LIFECYCLE_CLOSED cannot have outgoing edges");
        }
        table.replaceAll((state, out) -> Collections.unmodifiableMap(out));
        this.edges = Collections.unmodifiableMap(table);
    }

    /**
     * 표준 Shipment 생명주기 그래프.
     *
     * @return 공유 불변 인스턴스
     */
    public static LifecycleGraph standard() {
        return STANDARD;
    }

    /**
     * 전이 조회.
     *
     * @param from 현재 상태 (null이면 미생성)
     * @param eventType 이벤트 타입
     * @return 다음 상태, 허용되지 않으면 empty
     * @throws IllegalArgumentException eventType이 null인 경우
     */
    public Optional<LifecycleState> allowed(LifecycleState from, EventType eventType) {
        if (eventType == null) {
            throw new IllegalArgumentException("eventType cannot be null");
        }
        if (from == null) {
            return eventType == INITIAL_EVENT ? Optional.of(INITIAL_STATE) : Optional.empty();
        }
        return Optional.ofNullable(edges.get(from).get(eventType));
    }

    /**
     * (from, eventType) → to 간선이 존재하는지 확인.
     *
     * @param from 현재 상태 (null이면 미생성)
     * @param eventType 이벤트 타입
     * @param to 다음 상태
     * @return 간선이 존재하면 true
     */
    public boolean isEdge(LifecycleState from, EventType eventType, LifecycleState to) {
        return to != null && allowed(from, eventType).filter(to::equals).isPresent();
    }

    /**
     * 주어진 상태에서 나갈 수 있는 이벤트 타입.
     *
     * @param from 현재 상태 (null이면 미생성)
     * @return 이벤트 타입 집합 (종료 상태이면 빈 집합)
     */
    public Set<EventType> outgoing(LifecycleState from) {
        if (from == null) {
            return EnumSet.of(INITIAL_EVENT);
        }
        Set<EventType> types = edges.get(from).keySet();
        return types.isEmpty() ? EnumSet.noneOf(EventType.class) : EnumSet.copyOf(types);
    }

    /**
     * 정의된 전체 간선 목록 (최초 생성 간선 제외).
     *
     * @return 간선 목록
     */
    public List<Edge> edges() {
        return edges.entrySet().stream()
            .flatMap(entry -> entry.getValue().entrySet().stream()
                .map(out -> new Edge(entry.getKey(), out.getKey(), out.getValue())))
            .toList();
    }

    /**
     * 그래프 간선.
     *
     * @param from 출발 상태
     * @param eventType 간선 라벨
     * @param to 도착 상태
     */
    public record Edge(LifecycleState from, EventType eventType, LifecycleState to) {

        public Edge {
            if (from == null || eventType == null || to == null) {
                throw new IllegalArgumentException("Edge fields cannot be null");
            }
        }
    }
}
