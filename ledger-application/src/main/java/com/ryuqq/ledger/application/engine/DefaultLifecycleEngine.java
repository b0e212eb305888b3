package com.ryuqq.ledger.application.engine;

import com.ryuqq.ledger.core.audit.AuditReport;
import com.ryuqq.ledger.core.audit.AuditSummary;
import com.ryuqq.ledger.core.audit.AuditVerifier;
import com.ryuqq.ledger.core.event.EventDraft;
import com.ryuqq.ledger.core.event.ShipmentEvent;
import com.ryuqq.ledger.core.id.ShipmentIdGenerator;
import com.ryuqq.ledger.core.model.EventId;
import com.ryuqq.ledger.core.model.EventType;
import com.ryuqq.ledger.core.model.Payload;
import com.ryuqq.ledger.core.model.Role;
import com.ryuqq.ledger.core.model.ShipmentId;
import com.ryuqq.ledger.core.projection.Projector;
import com.ryuqq.ledger.core.projection.ShipmentProjection;
import com.ryuqq.ledger.core.spi.AppendResult;
import com.ryuqq.ledger.core.spi.EventStore;
import com.ryuqq.ledger.core.spi.LogReplay;
import com.ryuqq.ledger.core.statemachine.Accept;
import com.ryuqq.ledger.core.statemachine.AuthorityMatrix;
import com.ryuqq.ledger.core.statemachine.LifecycleGraph;
import com.ryuqq.ledger.core.statemachine.LifecycleState;
import com.ryuqq.ledger.core.statemachine.Reject;
import com.ryuqq.ledger.core.statemachine.RejectReason;
import com.ryuqq.ledger.core.statemachine.TransitionValidator;
import com.ryuqq.ledger.core.statemachine.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 기본 LifecycleEngine 구현체.
 *
 * <p><strong>전이 흐름:</strong></p>
 * <pre>
 * 1. eventId 중복 확인 → 이미 기록됨: Accepted(replayed=true)
 * 2. readFor(shipmentId) → Projector → 현재 상태 (없으면 SHIPMENT_NOT_FOUND)
 * 3. TransitionValidator.validate → Reject면 그대로 반환
 * 4. append(expectedLastSeq = projection.lastEventSeq)
 *    - Appended  → Accepted
 *    - Duplicate → Accepted(replayed=true)
 *    - Conflict  → Rejected(CONCURRENT_CONFLICT)
 * </pre>
 *
 * <p>검증과 append 사이에 다른 요청이 같은 Shipment에 기록하면 EventStore의 순번 검사에서
 * 충돌로 걸러지므로, 검증은 항상 실제로 기록되는 직전 상태를 기준으로 유효합니다.</p>
 *
 * <p>이벤트 timestamp는 {@code max(clock.instant(), 직전 이벤트 timestamp)}로 정하여
 * 시계가 뒤로 가더라도 Shipment 내 시간 순서가 유지됩니다.</p>
 *
 * <p>이 클래스는 상태를 갖지 않으며 스레드 안전합니다.</p>
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public final class DefaultLifecycleEngine implements LifecycleEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultLifecycleEngine.class);

    private static final Comparator<ShipmentProjection> NEWEST_FIRST =
        Comparator.comparing(ShipmentProjection::lastUpdated).reversed()
            .thenComparing(ShipmentProjection::shipmentId);

    private final EventStore eventStore;
    private final ShipmentIdGenerator idGenerator;
    private final TransitionValidator validator;
    private final Projector projector;
    private final AuditVerifier auditVerifier;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultLifecycleEngine(
        EventStore eventStore,
        ShipmentIdGenerator idGenerator,
        TransitionValidator validator,
        Projector projector,
        AuditVerifier auditVerifier,
        Clock clock
    ) {
        if (eventStore == null) {
            throw new IllegalArgumentException("eventStore cannot be null");
        }
        if (idGenerator == null) {
            throw new IllegalArgumentException("idGenerator cannot be null");
        }
        if (validator == null) {
            throw new IllegalArgumentException("validator cannot be null");
        }
        if (projector == null) {
            throw new IllegalArgumentException("projector cannot be null");
        }
        if (auditVerifier == null) {
            throw new IllegalArgumentException("auditVerifier cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.eventStore = eventStore;
        this.idGenerator = idGenerator;
        this.validator = validator;
        this.projector = projector;
        this.auditVerifier = auditVerifier;
        this.clock = clock;
    }

    /**
     * 표준 그래프/권한 테이블과 UTC 시스템 시계를 사용하는 생성자.
     */
    public DefaultLifecycleEngine(EventStore eventStore, ShipmentIdGenerator idGenerator) {
        this(eventStore, idGenerator, TransitionValidator.standard(), new Projector(),
            AuditVerifier.standard(), Clock.systemUTC());
    }

    @Override
    public ShipmentId createShipment(Payload initialPayload) {
        ShipmentId shipmentId = idGenerator.nextId();

        Verdict verdict = validator.validate(shipmentId, LifecycleGraph.INITIAL_EVENT, AuthorityMatrix.INITIAL_ROLE, null);
        if (!(verdict instanceof Accept accept)) {
            throw new IllegalStateException("Initial transition rejected: " + ((Reject) verdict).message());
        }

        EventDraft draft = new EventDraft(
            EventId.random(), shipmentId, LifecycleGraph.INITIAL_EVENT,
            null, accept.newState(), AuthorityMatrix.INITIAL_ROLE, clock.instant(),
            initialPayload, ShipmentEvent.CURRENT_SCHEMA_VERSION, 0L
        );

        AppendResult result = eventStore.append(draft);
        if (!result.isAppended()) {
            // a freshly issued id already has events: the counter log and event log disagree
            throw new IllegalStateException("Shipment " + shipmentId + " already exists in the event log: " + result);
        }
        log.info("Created shipment {}", shipmentId);
        return shipmentId;
    }

    @Override
    public TransitionResult transitionShipment(ShipmentId shipmentId, EventType eventType, Role role, Payload extraPayload) {
        return transitionShipment(shipmentId, eventType, role, extraPayload, EventId.random());
    }

    @Override
    public TransitionResult transitionShipment(ShipmentId shipmentId, EventType eventType, Role role,
                                               Payload extraPayload, EventId eventId) {
        if (shipmentId == null || eventType == null || role == null || eventId == null) {
            throw new IllegalArgumentException(
                "shipmentId, eventType, role and eventId are required (shipmentId: " + shipmentId
                    + ", eventType: " + eventType + ", role: " + role + ", eventId: " + eventId + ")"
            );
        }

        // 1. 재요청
        Optional<ShipmentEvent> existing = eventStore.findEvent(eventId);
        if (existing.isPresent()) {
            return replay(shipmentId, existing.get());
        }

        // 2. 현재 상태
        Optional<ShipmentProjection> current = projector.project(eventStore.readFor(shipmentId));
        if (current.isEmpty()) {
            return reject(RejectReason.SHIPMENT_NOT_FOUND, "Shipment " + shipmentId + " does not exist");
        }
        ShipmentProjection projection = current.get();

        // 3. 검증
        Verdict verdict = validator.validate(shipmentId, eventType, role, projection.currentState());
        if (verdict instanceof Reject rejected) {
            return reject(rejected.reason(), rejected.message());
        }
        LifecycleState newState = ((Accept) verdict).newState();

        // 4. append
        EventDraft draft = new EventDraft(
            eventId, shipmentId, eventType, projection.currentState(), newState, role,
            nextTimestamp(projection), extraPayload, ShipmentEvent.CURRENT_SCHEMA_VERSION,
            projection.lastEventSeq()
        );
        AppendResult result = eventStore.append(draft);

        if (result instanceof AppendResult.Appended appended) {
            log.info("{} {} -> {} by {} (#{})", shipmentId, projection.currentState(), newState, role,
                appended.eventSeq());
            return new TransitionResult.Accepted(appended.event(), projection.apply(appended.event()), false);
        }
        if (result instanceof AppendResult.Duplicate duplicate) {
            return replay(shipmentId, duplicate.existing());
        }
        AppendResult.Conflict conflict = (AppendResult.Conflict) result;
        return reject(RejectReason.CONCURRENT_CONFLICT, String.format(
            "Shipment %s changed concurrently: expected last sequence %d but was %d",
            shipmentId, conflict.expectedLastSeq(), conflict.actualLastSeq()
        ));
    }

    private TransitionResult replay(ShipmentId shipmentId, ShipmentEvent event) {
        if (!event.shipmentId().equals(shipmentId)) {
            throw new IllegalArgumentException(
                "Event id " + event.eventId().getValue() + " already belongs to " + event.shipmentId());
        }
        log.debug("Replayed event {} for {}", event.eventId().getValue(), shipmentId);
        ShipmentProjection projection = projector.project(eventStore.readFor(shipmentId)).orElseThrow();
        return new TransitionResult.Accepted(event, projection, true);
    }

    private TransitionResult reject(RejectReason reason, String message) {
        log.debug("Transition rejected ({}): {}", reason, message);
        return new TransitionResult.Rejected(reason, message);
    }

    private Instant nextTimestamp(ShipmentProjection projection) {
        Instant now = clock.instant();
        return now.isBefore(projection.lastUpdated()) ? projection.lastUpdated() : now;
    }

    @Override
    public Optional<ShipmentProjection> getShipment(ShipmentId shipmentId) {
        if (shipmentId == null) {
            throw new IllegalArgumentException("shipmentId cannot be null");
        }
        return projector.project(eventStore.readFor(shipmentId));
    }

    @Override
    public List<ShipmentProjection> getShipmentsByState(LifecycleState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        return projector.projectAll(eventStore.readAll()).values().stream()
            .filter(projection -> projection.currentState() == state)
            .sorted(NEWEST_FIRST)
            .toList();
    }

    @Override
    public List<ShipmentProjection> getAllShipments() {
        return new ArrayList<>(projector.projectAll(eventStore.readAll()).values());
    }

    @Override
    public List<ShipmentEvent> history(ShipmentId shipmentId) {
        if (shipmentId == null) {
            throw new IllegalArgumentException("shipmentId cannot be null");
        }
        return eventStore.readFor(shipmentId);
    }

    @Override
    public AuditReport verifyIntegrity() {
        return auditVerifier.verify(eventStore);
    }

    @Override
    public AuditSummary auditReport() {
        LogReplay replay = eventStore.replayAll();
        Map<ShipmentId, ShipmentProjection> projections = projector.projectAll(replay.events());
        AuditReport report = auditVerifier.verify(replay.events(), replay.corruptRecords());
        return AuditSummary.of(replay.events(), projections.values(), report);
    }
}
