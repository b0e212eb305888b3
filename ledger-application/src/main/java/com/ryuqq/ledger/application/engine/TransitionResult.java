package com.ryuqq.ledger.application.engine;

import com.ryuqq.ledger.core.event.ShipmentEvent;
import com.ryuqq.ledger.core.projection.ShipmentProjection;
import com.ryuqq.ledger.core.statemachine.RejectReason;

/**
 * 상태 전이 요청 결과.
 *
 * <ul>
 *   <li>{@link Accepted}: 이벤트가 기록됨 (또는 같은 eventId로 이미 기록되어 있음)</li>
 *   <li>{@link Rejected}: 검증 또는 동시성 검사에서 거부됨, 로그 변경 없음</li>
 * </ul>
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public sealed interface TransitionResult permits TransitionResult.Accepted, TransitionResult.Rejected {

    default boolean isAccepted() {
        return this instanceof Accepted;
    }

    default boolean isRejected() {
        return this instanceof Rejected;
    }

    /**
     * 수락된 전이.
     *
     * @param event 기록된 이벤트
     * @param projection 이벤트가 반영된 프로젝션
     * @param replayed 같은 eventId의 재요청이라 새로 기록하지 않았으면 true
     */
    record Accepted(ShipmentEvent event, ShipmentProjection projection, boolean replayed) implements TransitionResult {

        public Accepted {
            if (event == null || projection == null) {
                throw new IllegalArgumentException("event and projection are required");
            }
        }
    }

    /**
     * 거부된 전이.
     *
     * @param reason 거부 사유
     * @param message 설명
     */
    record Rejected(RejectReason reason, String message) implements TransitionResult {

        public Rejected {
            if (reason == null) {
                throw new IllegalArgumentException("reason cannot be null");
            }
            message = message == null ? reason.name() : message;
        }
    }
}
