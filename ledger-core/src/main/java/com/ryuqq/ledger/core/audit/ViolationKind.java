package com.ryuqq.ledger.core.audit;

/**
 * 감사에서 발견되는 무결성 위반 종류.
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public enum ViolationKind {

    /**
     * eventSeq에 빈 번호가 있음.
     */
    SEQUENCE_GAP,

    /**
     * eventSeq가 반복되거나 역행함.
     */
    DUPLICATE_SEQUENCE,

    /**
     * 같은 eventId가 로그에 두 번 이상 기록됨.
     */
    DUPLICATE_EVENT_ID,

    /**
     * timestamp가 직전 이벤트보다 이름.
     */
    TIMESTAMP_REGRESSION,

    /**
     * 첫 이벤트가 최초 CREATED 전이가 아님.
     */
    INVALID_INITIAL_EVENT,

    /**
     * previousState가 직전 이벤트의 newState와 다름.
     */
    BROKEN_CHAIN,

    /**
     * (previousState, eventType) → newState가 그래프 간선이 아님.
     */
    INVALID_TRANSITION,

    /**
     * emittingRole이 previousState에서 해당 이벤트를 발생시킬 권한이 없음.
     */
    UNAUTHORIZED_ROLE,

    /**
     * 종료 상태 이후에 이벤트가 기록됨.
     */
    EVENT_AFTER_TERMINAL,

    /**
     * 로그 레코드를 해석할 수 없음.
     */
    CORRUPT_RECORD
}
