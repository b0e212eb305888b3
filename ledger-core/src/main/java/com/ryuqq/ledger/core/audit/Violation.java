package com.ryuqq.ledger.core.audit;

import com.ryuqq.ledger.core.event.ShipmentEvent;
import com.ryuqq.ledger.core.model.ShipmentId;
import com.ryuqq.ledger.core.spi.CorruptRecord;

import java.util.Optional;

/**
 * 감사에서 발견된 위반 한 건.
 *
 * @param kind 위반 종류
 * @param shipmentId 대상 Shipment (해석 불가 레코드는 null)
 * @param eventSeq 문제 이벤트의 순번 (해석 불가 레코드는 0)
 * @param message 설명
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public record Violation(ViolationKind kind, ShipmentId shipmentId, long eventSeq, String message) {

    public Violation {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    static Violation of(ViolationKind kind, ShipmentEvent event, String message) {
        return new Violation(kind, event.shipmentId(), event.eventSeq(), message);
    }

    static Violation corrupt(CorruptRecord record) {
        return new Violation(ViolationKind.CORRUPT_RECORD, null, 0L,
            "Line " + record.lineNumber() + " could not be decoded: " + record.reason());
    }

    public Optional<ShipmentId> shipment() {
        return Optional.ofNullable(shipmentId);
    }

    @Override
    public String toString() {
        return kind + (shipmentId == null ? "" : " [" + shipmentId + "#" + eventSeq + "]") + ": " + message;
    }
}
