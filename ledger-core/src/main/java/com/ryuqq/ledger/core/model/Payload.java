package com.ryuqq.ledger.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 이벤트에 첨부되는 읽기 전용 key/value 데이터.
 *
 * <p>Payload는 이벤트 로그에 기록된 후 절대 변경되지 않습니다.
 * 프로젝션은 이벤트 순서대로 Payload를 {@link #merge(Payload)}로 누적하며,
 * 같은 키가 충돌하면 나중 이벤트의 값이 우선합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Payload created = Payload.of(Map.of("source", "Mumbai", "weight_kg", 12.5));
 * Payload approved = Payload.of(Map.of("approved_by", "mgr-7"));
 *
 * Payload merged = created.merge(approved);
 * // {source=Mumbai, weight_kg=12.5, approved_by=mgr-7}
 * </pre>
 *
 * <p><strong>불변성:</strong> 중첩된 Map/List까지 읽기 전용 복사본으로 보관</p>
 * <p><strong>순서:</strong> 키 삽입 순서 유지 (프로젝션 결정성)</p>
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public final class Payload {

    private static final Payload EMPTY = new Payload(Collections.emptyMap());

    private final Map<String, Object> values;

    private Payload(Map<String, Object> values) {
        this.values = values;
    }

    /**
     * Payload 생성.
     *
     * @param values key/value 데이터 (null 허용 → 빈 Payload)
     * @return Payload 인스턴스
     * @throws IllegalArgumentException key가 null인 경우
     */
    public static Payload of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new Payload(freezeMap(values));
    }

    /**
     * 빈 Payload 생성.
     *
     * @return 빈 Payload 인스턴스
     */
    public static Payload empty() {
        return EMPTY;
    }

    /**
     * 두 Payload를 합친 새 Payload 반환.
     *
     * <p>기존 값은 변경되지 않으며, 충돌하는 키는 {@code later}의 값이 우선합니다.</p>
     *
     * @param later 나중에 적용할 Payload (null 허용)
     * @return 합쳐진 Payload
     */
    public Payload merge(Payload later) {
        if (later == null || later.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return later;
        }
        Map<String, Object> merged = new LinkedHashMap<>(values);
        merged.putAll(later.values);
        return new Payload(Collections.unmodifiableMap(merged));
    }

    /**
     * 값 조회.
     *
     * @param key 키
     * @return 값 (없으면 empty)
     */
    public Optional<Object> find(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /**
     * 키 존재 여부.
     *
     * @param key 키
     * @return 존재하면 true
     */
    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    /**
     * 읽기 전용 Map 뷰.
     *
     * @return 수정 불가능한 Map
     */
    public Map<String, Object> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    private static Map<String, Object> freezeMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("Payload keys cannot be null");
            }
            copy.put(entry.getKey().toString(), freeze(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freezeMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(freeze(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Payload payload = (Payload) o;
        return values.equals(payload.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Payload{" + values.size() + " keys}";
    }
}
