package com.ryuqq.ledger.core.projection;

import com.ryuqq.ledger.core.event.ShipmentEvent;
import com.ryuqq.ledger.core.model.ShipmentId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 이벤트 시퀀스를 Shipment 프로젝션으로 접는(fold) 순수 함수.
 *
 * <p><strong>Fold 규칙 (eventSeq 순서):</strong></p>
 * <pre>
 * currentState   := event.newState
 * currentPayload := currentPayload ∪ event.payload   (나중 키 우선)
 * eventCount     += 1
 * </pre>
 *
 * <p>외부 상태, 난수, 현재 시각에 의존하지 않으므로 같은 입력으로 두 번 계산하면
 * 항상 같은 프로젝션이 나옵니다.</p>
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public final class Projector {

    private static final Comparator<ShipmentEvent> BY_SEQUENCE = Comparator.comparingLong(ShipmentEvent::eventSeq);

    /**
     * 한 Shipment의 이벤트를 접어 프로젝션 생성.
     *
     * @param events 한 Shipment의 이벤트 (순서 무관, eventSeq로 정렬 후 적용)
     * @return 프로젝션, 이벤트가 없으면 empty
     * @throws IllegalArgumentException events가 null이거나 여러 Shipment의 이벤트가 섞인 경우
     */
    public Optional<ShipmentProjection> project(List<ShipmentEvent> events) {
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        List<ShipmentEvent> ordered = new ArrayList<>(events);
        ordered.sort(BY_SEQUENCE);

        ProjectionAccumulator accumulator = ProjectionAccumulator.empty();
        for (ShipmentEvent event : ordered) {
            accumulator = accumulator.fold(event);
        }
        return accumulator.projection();
    }

    /**
     * 전체 로그를 Shipment별로 나누어 프로젝션 생성.
     *
     * @param log 전체 이벤트 로그 (append 순서)
     * @return Shipment별 프로젝션 (로그 최초 등장 순서)
     */
    public Map<ShipmentId, ShipmentProjection> projectAll(List<ShipmentEvent> log) {
        if (log == null) {
            throw new IllegalArgumentException("log cannot be null");
        }
        Map<ShipmentId, List<ShipmentEvent>> grouped = new LinkedHashMap<>();
        for (ShipmentEvent event : log) {
            grouped.computeIfAbsent(event.shipmentId(), id -> new ArrayList<>()).add(event);
        }

        Map<ShipmentId, ShipmentProjection> projections = new LinkedHashMap<>();
        grouped.forEach((id, events) -> project(events).ifPresent(p -> projections.put(id, p)));
        return Collections.unmodifiableMap(projections);
    }
}
