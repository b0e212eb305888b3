package com.ryuqq.ledger.core.audit;

import com.ryuqq.ledger.core.event.ShipmentEvent;
import com.ryuqq.ledger.core.model.EventType;
import com.ryuqq.ledger.core.model.Role;
import com.ryuqq.ledger.core.projection.ShipmentProjection;
import com.ryuqq.ledger.core.statemachine.LifecycleState;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 로그 전체에 대한 운영 요약.
 *
 * @param totalEvents 전체 이벤트 수
 * @param totalShipments 전체 Shipment 수
 * @param integrityStatus 무결성 상태
 * @param eventTypeDistribution 이벤트 타입별 건수
 * @param roleDistribution Role별 이벤트 건수
 * @param stateDistribution 현재 상태별 Shipment 수
 * @param firstEventTime 가장 이른 이벤트 시각 (이벤트가 없으면 null)
 * @param lastEventTime 가장 늦은 이벤트 시각 (이벤트가 없으면 null)
 * @param integrityErrors 무결성 오류 메시지
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public record AuditSummary(
    int totalEvents,
    int totalShipments,
    IntegrityStatus integrityStatus,
    Map<EventType, Long> eventTypeDistribution,
    Map<Role, Long> roleDistribution,
    Map<LifecycleState, Long> stateDistribution,
    Instant firstEventTime,
    Instant lastEventTime,
    List<String> integrityErrors
) {

    public AuditSummary {
        if (integrityStatus == null) {
            throw new IllegalArgumentException("integrityStatus cannot be null");
        }
        eventTypeDistribution = Collections.unmodifiableMap(copy(eventTypeDistribution, EventType.class));
        roleDistribution = Collections.unmodifiableMap(copy(roleDistribution, Role.class));
        stateDistribution = Collections.unmodifiableMap(copy(stateDistribution, LifecycleState.class));
        integrityErrors = integrityErrors == null ? List.of() : List.copyOf(integrityErrors);
    }

    /**
     * 로그, 프로젝션, 감사 결과로 요약 생성.
     *
     * @param log 전체 이벤트 로그
     * @param projections Shipment 프로젝션
     * @param report 감사 결과
     * @return 요약
     */
    public static AuditSummary of(List<ShipmentEvent> log, Collection<ShipmentProjection> projections, AuditReport report) {
        Map<EventType, Long> byType = new EnumMap<>(EventType.class);
        Map<Role, Long> byRole = new EnumMap<>(Role.class);
        Instant first = null;
        Instant last = null;
        for (ShipmentEvent event : log) {
            byType.merge(event.eventType(), 1L, Long::sum);
            byRole.merge(event.emittingRole(), 1L, Long::sum);
            if (first == null || event.timestamp().isBefore(first)) {
                first = event.timestamp();
            }
            if (last == null || event.timestamp().isAfter(last)) {
                last = event.timestamp();
            }
        }

        Map<LifecycleState, Long> byState = new EnumMap<>(LifecycleState.class);
        for (ShipmentProjection projection : projections) {
            byState.merge(projection.currentState(), 1L, Long::sum);
        }

        return new AuditSummary(log.size(), projections.size(), report.status(),
            byType, byRole, byState, first, last, report.errorMessages());
    }

    public Optional<Instant> firstEvent() {
        return Optional.ofNullable(firstEventTime);
    }

    public Optional<Instant> lastEvent() {
        return Optional.ofNullable(lastEventTime);
    }

    private static <K extends Enum<K>> Map<K, Long> copy(Map<K, Long> source, Class<K> type) {
        Map<K, Long> target = new EnumMap<>(type);
        if (source != null) {
            target.putAll(source);
        }
        return target;
    }
}
