package com.ryuqq.ledger.core.statemachine;

/**
 * 전이 거부.
 *
 * <p>거부된 전이는 어떤 상태 변경도 남기지 않습니다.</p>
 *
 * @param reason 거부 사유 분류
 * @param message 사용자에게 보여줄 메시지
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public record Reject(
    RejectReason reason,
    String message
) implements Verdict {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException reason이 null이거나 message가 비어있는 경우
     */
    public Reject {
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * Reject 생성.
     *
     * @param reason 거부 사유
     * @param message 메시지
     * @return Reject 인스턴스
     */
    public static Reject of(RejectReason reason, String message) {
        return new Reject(reason, message);
    }
}
