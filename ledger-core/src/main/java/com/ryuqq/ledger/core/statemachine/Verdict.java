package com.ryuqq.ledger.core.statemachine;

/**
 * 전이 검증 결과.
 *
 * <p>Verdict는 두 가지 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Accept}: 전이 허용, 다음 상태 포함</li>
 *   <li>{@link Reject}: 전이 거부, 거부 사유 포함</li>
 * </ul>
 *
 * <p>검증 실패는 예외가 아니라 값으로 반환됩니다. 호출자는 거부 사유를
 * 사용자에게 그대로 노출할 수 있습니다.</p>
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public sealed interface Verdict permits Accept, Reject {

    /**
     * 전이가 허용되었는지 확인.
     *
     * @return 허용 여부
     */
    default boolean isAccepted() {
        return this instanceof Accept;
    }

    /**
     * 전이가 거부되었는지 확인.
     *
     * @return 거부 여부
     */
    default boolean isRejected() {
        return this instanceof Reject;
    }
}
