package com.ryuqq.ledger.core.model;

import java.util.regex.Pattern;

/**
 * Shipment 전역 고유 식별자.
 *
 * <p>ShipmentId는 카운터 로그에서 발급된 순번을 0으로 채운 10자리 숫자로 표현합니다.
 * 한 번 발급된 값은 절대 재사용되지 않습니다.</p>
 *
 * <p><strong>형식:</strong> {@code SHP-0000000001}</p>
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>정렬:</strong> 카운터 값 기준 (발급 순서와 동일), 같은 카운터를 다른 자릿수로 쓴 값은
 * 문자열 순서로 구분하여 {@link #equals(Object)}와 일관됩니다.</p>
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public final class ShipmentId implements Comparable<ShipmentId> {

    /**
     * 식별자 접두사.
     */
    public static final String PREFIX = "SHP-";

    private static final Pattern FORMAT = Pattern.compile("^SHP-\\d{10,18}$");

    private final String value;

    private ShipmentId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ShipmentId cannot be null or blank");
        }
        if (!FORMAT.matcher(value).matches()) {
            throw new IllegalArgumentException("ShipmentId must match SHP-XXXXXXXXXX, but was: " + value);
        }
        this.value = value;
    }

    /**
     * 문자열에서 ShipmentId 생성.
     *
     * @param value ShipmentId 값 (예: SHP-0000000042)
     * @return ShipmentId 인스턴스
     * @throws IllegalArgumentException 형식이 올바르지 않은 경우
     */
    public static ShipmentId of(String value) {
        return new ShipmentId(value);
    }

    /**
     * 카운터 값에서 ShipmentId 생성.
     *
     * @param counter 발급 카운터 (1 이상)
     * @return ShipmentId 인스턴스
     * @throws IllegalArgumentException counter가 1 미만인 경우
     */
    public static ShipmentId fromCounter(long counter) {
        if (counter < 1) {
            throw new IllegalArgumentException("counter must be positive, but was: " + counter);
        }
        return new ShipmentId(String.format("%s%010d", PREFIX, counter));
    }

    /**
     * 형식 검증 (예외 없이).
     *
     * @param value 검증할 문자열
     * @return 올바른 형식이면 true
     */
    public static boolean isValid(String value) {
        return value != null && FORMAT.matcher(value).matches();
    }

    /**
     * ShipmentId 값 조회.
     *
     * @return ShipmentId 값
     */
    public String getValue() {
        return value;
    }

    /**
     * 식별자에 포함된 카운터 값.
     *
     * @return 발급 카운터
     */
    public long counter() {
        return Long.parseLong(value.substring(PREFIX.length()));
    }

    @Override
    public int compareTo(ShipmentId other) {
        int byCounter = Long.compare(counter(), other.counter());
        return byCounter != 0 ? byCounter : value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ShipmentId that = (ShipmentId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
