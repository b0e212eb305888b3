package com.ryuqq.ledger.core.statemachine;

/**
 * 전이 허용.
 *
 * @param newState 전이 후 상태
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public record Accept(LifecycleState newState) implements Verdict {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException newState가 null인 경우
     */
    public Accept {
        if (newState == null) {
            throw new IllegalArgumentException("newState cannot be null");
        }
    }
}
