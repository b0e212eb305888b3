package com.ryuqq.ledger.core.audit;

import com.ryuqq.ledger.core.model.ShipmentId;

import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 전체 로그 감사 결과.
 *
 * <p>첫 위반에서 멈추지 않고 모든 위반을 수집합니다. 위반이 하나도 없으면 유효합니다.</p>
 *
 * @param totalEvents 검사한 이벤트 수
 * @param totalShipments 검사한 Shipment 수
 * @param violations 발견 순서대로의 전체 위반 목록
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public record AuditReport(int totalEvents, int totalShipments, List<Violation> violations) {

    public AuditReport {
        if (totalEvents < 0 || totalShipments < 0) {
            throw new IllegalArgumentException("totals cannot be negative");
        }
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    /**
     * 처음 발견된 위반.
     *
     * @return 첫 위반, 유효하면 empty
     */
    public Optional<Violation> firstViolation() {
        return violations.isEmpty() ? Optional.empty() : Optional.of(violations.get(0));
    }

    /**
     * 위반 종류별 건수 (위반이 없는 종류는 포함하지 않음).
     *
     * @return 종류별 건수
     */
    public Map<ViolationKind, Long> countsByKind() {
        Map<ViolationKind, Long> counts = new EnumMap<>(ViolationKind.class);
        for (Violation violation : violations) {
            counts.merge(violation.kind(), 1L, Long::sum);
        }
        return counts;
    }

    /**
     * 위반이 발견된 Shipment (발견 순서).
     *
     * @return Shipment ID 집합
     */
    public Set<ShipmentId> violatingShipments() {
        Set<ShipmentId> ids = new LinkedHashSet<>();
        for (Violation violation : violations) {
            violation.shipment().ifPresent(ids::add);
        }
        return ids;
    }

    public List<String> errorMessages() {
        return violations.stream().map(Violation::toString).toList();
    }

    /**
     * 무결성 상태.
     *
     * @return 이벤트와 위반이 모두 없으면 EMPTY, 위반이 없으면 VALID, 그 외 CORRUPTED
     */
    public IntegrityStatus status() {
        if (!violations.isEmpty()) {
            return IntegrityStatus.CORRUPTED;
        }
        return totalEvents == 0 ? IntegrityStatus.EMPTY : IntegrityStatus.VALID;
    }
}
