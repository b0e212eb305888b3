package com.ryuqq.ledger.core.audit;

import com.ryuqq.ledger.core.event.ShipmentEvent;
import com.ryuqq.ledger.core.model.EventId;
import com.ryuqq.ledger.core.model.ShipmentId;
import com.ryuqq.ledger.core.spi.CorruptRecord;
import com.ryuqq.ledger.core.spi.EventStore;
import com.ryuqq.ledger.core.spi.LogReplay;
import com.ryuqq.ledger.core.statemachine.AuthorityMatrix;
import com.ryuqq.ledger.core.statemachine.LifecycleGraph;
import com.ryuqq.ledger.core.statemachine.LifecycleState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 전체 이벤트 로그 무결성 감사.
 *
 * <p>로그를 Shipment별로 나누어 append 순서대로 다시 검사합니다.
 * 위반을 발견해도 멈추지 않고 모두 수집하며, 예외를 던지지 않습니다.</p>
 *
 * <p><strong>Shipment별 검사 항목:</strong></p>
 * <ul>
 *   <li>eventSeq가 1부터 빈틈없이 증가 (빈 번호, 중복/역행 후 다음 기대값을 재동기화)</li>
 *   <li>eventId 전역 중복</li>
 *   <li>timestamp 비감소</li>
 *   <li>첫 이벤트는 (없음) -CREATED→ CREATED</li>
 *   <li>previousState == 직전 이벤트의 newState</li>
 *   <li>(previousState, eventType) → newState가 그래프 간선</li>
 *   <li>emittingRole이 previousState에서 해당 이벤트를 발생시킬 권한 보유</li>
 *   <li>LIFECYCLE_CLOSED 이후 이벤트 없음</li>
 * </ul>
 *
 * <p>EventStore가 보고한 해석 불가 레코드도 위반으로 포함합니다.</p>
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public final class AuditVerifier {

    private static final Logger log = LoggerFactory.getLogger(AuditVerifier.class);

    private final LifecycleGraph graph;
    private final AuthorityMatrix authority;

    public AuditVerifier(LifecycleGraph graph, AuthorityMatrix authority) {
        if (graph == null) {
            throw new IllegalArgumentException("graph cannot be null");
        }
        if (authority == null) {
            throw new IllegalArgumentException("authority cannot be null");
        }
        this.graph = graph;
        this.authority = authority;
    }

    public static AuditVerifier standard() {
        return new AuditVerifier(LifecycleGraph.standard(), AuthorityMatrix.standard());
    }

    /**
     * EventStore 전체 감사.
     *
     * <p>{@link EventStore#replayAll()}로 로그를 원본에서 다시 읽어 검증합니다.</p>
     *
     * @param store 대상 EventStore
     * @return 감사 결과
     */
    public AuditReport verify(EventStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        LogReplay replay = store.replayAll();
        return verify(replay.events(), replay.corruptRecords());
    }

    /**
     * 로그 감사.
     *
     * @param events 전체 이벤트 (append 순서)
     * @param corruptRecords 해석 불가 레코드
     * @return 감사 결과
     */
    public AuditReport verify(List<ShipmentEvent> events, List<CorruptRecord> corruptRecords) {
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        List<Violation> violations = new ArrayList<>();
        if (corruptRecords != null) {
            for (CorruptRecord record : corruptRecords) {
                violations.add(Violation.corrupt(record));
            }
        }

        Set<EventId> seenIds = new HashSet<>();
        Map<ShipmentId, List<ShipmentEvent>> byShipment = new LinkedHashMap<>();
        for (ShipmentEvent event : events) {
            if (!seenIds.add(event.eventId())) {
                violations.add(Violation.of(ViolationKind.DUPLICATE_EVENT_ID, event,
                    "Event id " + event.eventId().getValue() + " appears more than once"));
            }
            byShipment.computeIfAbsent(event.shipmentId(), id -> new ArrayList<>()).add(event);
        }

        byShipment.values().forEach(shipmentEvents -> verifyShipment(shipmentEvents, violations));

        AuditReport report = new AuditReport(events.size(), byShipment.size(), violations);
        if (report.isValid()) {
            log.debug("Audit passed: {} events across {} shipments", events.size(), byShipment.size());
        } else {
            log.warn("Audit found {} violations across {} shipments (first: {})",
                violations.size(), report.violatingShipments().size(), report.firstViolation().orElseThrow());
        }
        return report;
    }

    private void verifyShipment(List<ShipmentEvent> events, List<Violation> violations) {
        long expectedSeq = 1L;
        ShipmentEvent previous = null;

        for (ShipmentEvent event : events) {
            if (event.eventSeq() > expectedSeq) {
                violations.add(Violation.of(ViolationKind.SEQUENCE_GAP, event,
                    "Expected sequence " + expectedSeq + " but found " + event.eventSeq()));
            } else if (event.eventSeq() < expectedSeq) {
                violations.add(Violation.of(ViolationKind.DUPLICATE_SEQUENCE, event,
                    "Sequence " + event.eventSeq() + " repeats or goes backwards (expected " + expectedSeq + ")"));
            }
            expectedSeq = event.eventSeq() + 1;

            if (previous == null) {
                verifyInitial(event, violations);
            } else {
                verifyFollowing(previous, event, violations);
            }
            previous = event;
        }
    }

    private void verifyInitial(ShipmentEvent event, List<Violation> violations) {
        if (!event.isInitial() || !graph.isEdge(null, event.eventType(), event.newState())) {
            violations.add(Violation.of(ViolationKind.INVALID_INITIAL_EVENT, event, String.format(
                "First event must be %s -> %s but was %s: %s -> %s",
                LifecycleGraph.INITIAL_EVENT, LifecycleGraph.INITIAL_STATE,
                event.eventType(), describe(event.previousState()), event.newState()
            )));
            return;
        }
        verifyAuthority(event, violations);
    }

    private void verifyFollowing(ShipmentEvent previous, ShipmentEvent event, List<Violation> violations) {
        if (event.timestamp().isBefore(previous.timestamp())) {
            violations.add(Violation.of(ViolationKind.TIMESTAMP_REGRESSION, event,
                "Timestamp " + event.timestamp() + " precedes previous event at " + previous.timestamp()));
        }
        if (previous.newState().isTerminal()) {
            violations.add(Violation.of(ViolationKind.EVENT_AFTER_TERMINAL, event,
                event.eventType() + " recorded after " + previous.newState()));
        }
        if (event.previousState() != previous.newState()) {
            violations.add(Violation.of(ViolationKind.BROKEN_CHAIN, event, String.format(
                "previousState %s does not match preceding newState %s",
                describe(event.previousState()), previous.newState()
            )));
        }
        if (event.previousState() == null) {
            return;
        }
        if (!graph.isEdge(event.previousState(), event.eventType(), event.newState())) {
            violations.add(Violation.of(ViolationKind.INVALID_TRANSITION, event, String.format(
                "%s -%s-> %s is not a lifecycle edge",
                event.previousState(), event.eventType(), event.newState()
            )));
            return;
        }
        verifyAuthority(event, violations);
    }

    private void verifyAuthority(ShipmentEvent event, List<Violation> violations) {
        if (!authority.permitted(event.previousState(), event.emittingRole()).contains(event.eventType())) {
            violations.add(Violation.of(ViolationKind.UNAUTHORIZED_ROLE, event, String.format(
                "Role %s may not emit %s from %s",
                event.emittingRole(), event.eventType(), describe(event.previousState())
            )));
        }
    }

    private static String describe(LifecycleState state) {
        return state == null ? "(none)" : state.name();
    }
}
