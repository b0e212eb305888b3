package com.ryuqq.ledger.core.audit;

/**
 * 감사 요약의 무결성 상태.
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public enum IntegrityStatus {
    EMPTY,
    VALID,
    CORRUPTED
}
