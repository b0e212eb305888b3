package com.ryuqq.ledger.core.model;

import java.util.UUID;

/**
 * 이벤트 전역 고유 식별자.
 *
 * <p>EventId는 이벤트 로그 전체에서 유일하며, 재전송된 append 요청을
 * 식별하는 멱등성 키로 사용됩니다. 동일한 EventId로 다시 append하면
 * 기존 레코드를 그대로 반환합니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public final class EventId {

    private final String value;

    private EventId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("EventId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("EventId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("EventId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * EventId 생성.
     *
     * @param value EventId 값
     * @return EventId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static EventId of(String value) {
        return new EventId(value);
    }

    /**
     * 무작위 UUID 기반 EventId 생성.
     *
     * @return 새 EventId
     */
    public static EventId random() {
        return new EventId(UUID.randomUUID().toString());
    }

    /**
     * EventId 값 조회.
     *
     * @return EventId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EventId eventId = (EventId) o;
        return value.equals(eventId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "EventId{" + value + '}';
    }
}
