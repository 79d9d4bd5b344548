package com.ryuqq.watchdog.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 프로브 진단 정보 (불변, 삽입 순서 유지).
 *
 * <p>키는 {@link DetailKeys}를 따르고, 값은 {@link DetailValue}의 닫힌 타입 집합입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Details details = Details.builder()
 *     .put(DetailKeys.SERVER, "1.1.1.1:53")
 *     .put(DetailKeys.TIMEOUT_MS, 5000L)
 *     .put(DetailKeys.CIRCUIT_OPEN, false)
 *     .build();
 * }</pre>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
public final class Details {

    private static final Details EMPTY = new Details(new LinkedHashMap<>());

    private final Map<String, DetailValue> values;

    private Details(LinkedHashMap<String, DetailValue> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * 빈 Details.
     *
     * @return 빈 인스턴스
     */
    public static Details empty() {
        return EMPTY;
    }

    /**
     * Builder 생성.
     *
     * @return 새 Builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * 값 조회.
     *
     * @param key 키
     * @return 값 (없으면 empty)
     */
    public Optional<DetailValue> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /**
     * 문자열 값 조회.
     *
     * @param key 키
     * @return 값이 문자열이면 그 값, 아니면 empty
     */
    public Optional<String> getString(String key) {
        DetailValue value = values.get(key);
        return value instanceof DetailValue.Text ? Optional.of(((DetailValue.Text) value).value()) : Optional.empty();
    }

    /**
     * 정수 값 조회.
     *
     * @param key 키
     * @return 값이 정수이면 그 값, 아니면 empty
     */
    public Optional<Long> getLong(String key) {
        DetailValue value = values.get(key);
        return value instanceof DetailValue.Int ? Optional.of(((DetailValue.Int) value).value()) : Optional.empty();
    }

    /**
     * 불리언 값 조회.
     *
     * @param key 키
     * @return 값이 불리언이면 그 값, 아니면 empty
     */
    public Optional<Boolean> getBoolean(String key) {
        DetailValue value = values.get(key);
        return value instanceof DetailValue.Bool ? Optional.of(((DetailValue.Bool) value).value()) : Optional.empty();
    }

    /**
     * 키 존재 여부.
     *
     * @param key 키
     * @return 존재하면 true
     */
    public boolean contains(String key) {
        return values.containsKey(key);
    }

    /**
     * 항목 수.
     *
     * @return 항목 수
     */
    public int size() {
        return values.size();
    }

    /**
     * 읽기 전용 뷰.
     *
     * @return 키 → DetailValue
     */
    public Map<String, DetailValue> asMap() {
        return values;
    }

    /**
     * 원시 값 맵 (로깅/요약용).
     *
     * @return 키 → String/Long/Boolean/Double (삽입 순서 유지)
     */
    public Map<String, Object> toRawMap() {
        Map<String, Object> raw = new LinkedHashMap<>();
        values.forEach((key, value) -> raw.put(key, value.raw()));
        return raw;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((Details) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }

    /**
     * Details Builder.
     *
     * <p>thread-safe 하지 않습니다. 한 프로브 작업 안에서만 사용합니다.
     * 같은 키를 다시 넣으면 마지막 값이 남습니다 (재시도마다 status_code 갱신 등).</p>
     */
    public static final class Builder {

        private final LinkedHashMap<String, DetailValue> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String key, DetailValue value) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("key cannot be null or blank");
            }
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null (key: " + key + ")");
            }
            values.put(key, value);
            return this;
        }

        public Builder put(String key, String value) {
            return put(key, DetailValue.of(value == null ? "" : value));
        }

        public Builder put(String key, long value) {
            return put(key, DetailValue.of(value));
        }

        public Builder put(String key, boolean value) {
            return put(key, DetailValue.of(value));
        }

        public Builder put(String key, double value) {
            return put(key, DetailValue.of(value));
        }

        /**
         * 같은 키가 없을 때만 추가.
         */
        public Builder putIfAbsent(String key, String value) {
            if (!values.containsKey(key)) {
                put(key, value);
            }
            return this;
        }

        public Details build() {
            return new Details(new LinkedHashMap<>(values));
        }
    }
}
