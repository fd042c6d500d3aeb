package com.ryuqq.evolution.core.contract;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 변경 세부 정보 (키-값 묶음).
 *
 * <p>Change Descriptor의 {@code details}와 모호성 해소 데이터(resolution)를 모두 표현합니다.
 * 도메인 전문가 도구가 느슨한 형태로 값을 넘기므로, 타입별 접근자가 허용 가능한 표현을
 * 변환합니다.</p>
 *
 * <p><strong>허용 표현:</strong></p>
 * <ul>
 *   <li>문자열: {@link String}</li>
 *   <li>정수: {@link Number} (정수값) 또는 숫자 문자열 (예: "-1")</li>
 *   <li>불리언: {@link Boolean} 또는 "true"/"false" 문자열</li>
 *   <li>문자열 목록: 문자열로만 이루어진 {@link Collection}</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 시 복사되며 이후 변경 불가. null 값 허용 (키 존재, 값 없음).</p>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public final class Details {

    private static final Details EMPTY = new Details(Collections.emptyMap());

    private final Map<String, Object> values;

    private Details(Map<String, ?> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Details 생성.
     *
     * @param values 원본 맵 (복사됨)
     * @return Details 인스턴스
     * @throws IllegalArgumentException values가 null이거나 null 키를 포함하는 경우
     */
    public static Details of(Map<String, ?> values) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        // Map.of 계열은 containsKey(null)에서 NPE를 던지므로 복사본으로 확인
        Map<String, Object> copy = new LinkedHashMap<>(values);
        if (copy.containsKey(null)) {
            throw new IllegalArgumentException("detail keys cannot be null");
        }
        return new Details(copy);
    }

    /**
     * 빈 Details.
     *
     * @return 빈 Details 인스턴스
     */
    public static Details empty() {
        return EMPTY;
    }

    /**
     * 키 존재 여부.
     *
     * @param key 키
     * @return 키가 존재하면 true (값이 null이어도 true)
     */
    public boolean contains(String key) {
        return values.containsKey(key);
    }

    /**
     * 키가 존재하고 값이 null이 아닌지 확인.
     *
     * @param key 키
     * @return 값이 있으면 true
     */
    public boolean hasValue(String key) {
        return values.get(key) != null;
    }

    /**
     * 문자열 값 조회.
     *
     * @param key 키
     * @return 문자열 값, 없으면 null
     * @throws IllegalArgumentException 값이 문자열이 아닌 경우
     */
    public String getString(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof String text) {
            return text;
        }
        throw invalid(key, value, "text");
    }

    /**
     * 정수 값 조회.
     *
     * @param key 키
     * @return 정수 값, 없으면 null
     * @throws IllegalArgumentException 값이 정수로 해석되지 않는 경우
     */
    public Integer getInteger(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Integer number) {
            return number;
        }
        if (value instanceof Long || value instanceof Short || value instanceof Byte) {
            long longValue = ((Number) value).longValue();
            if (longValue < Integer.MIN_VALUE || longValue > Integer.MAX_VALUE) {
                throw invalid(key, value, "an integer");
            }
            return (int) longValue;
        }
        if (value instanceof Number number) {
            double doubleValue = number.doubleValue();
            if (doubleValue != Math.rint(doubleValue)
                    || doubleValue < Integer.MIN_VALUE || doubleValue > Integer.MAX_VALUE) {
                throw invalid(key, value, "an integer");
            }
            return (int) doubleValue;
        }
        if (value instanceof String text) {
            try {
                return Integer.valueOf(text.trim());
            } catch (NumberFormatException e) {
                throw invalid(key, value, "an integer");
            }
        }
        throw invalid(key, value, "an integer");
    }

    /**
     * 불리언 값 조회.
     *
     * @param key 키
     * @return 불리언 값, 없으면 null
     * @throws IllegalArgumentException 값이 불리언으로 해석되지 않는 경우
     */
    public Boolean getBoolean(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof String text) {
            String trimmed = text.trim();
            if ("true".equalsIgnoreCase(trimmed)) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(trimmed)) {
                return Boolean.FALSE;
            }
        }
        throw invalid(key, value, "a boolean");
    }

    /**
     * 문자열 목록 조회.
     *
     * @param key 키
     * @return 불변 문자열 목록, 없으면 null
     * @throws IllegalArgumentException 값이 문자열 컬렉션이 아닌 경우
     */
    public List<String> getStringList(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Collection<?> collection)) {
            throw invalid(key, value, "a list of names");
        }
        List<String> names = new ArrayList<>(collection.size());
        for (Object element : collection) {
            if (!(element instanceof String name)) {
                throw invalid(key, value, "a list of names");
            }
            names.add(name);
        }
        return Collections.unmodifiableList(names);
    }

    /**
     * 원본 값 조회.
     *
     * @param key 키
     * @return 값 (null 가능)
     */
    public Object get(String key) {
        return values.get(key);
    }

    /**
     * 읽기 전용 맵 뷰.
     *
     * @return 불변 맵 (삽입 순서 유지)
     */
    public Map<String, Object> asMap() {
        return values;
    }

    /**
     * 비어있는지 확인.
     *
     * @return 항목이 없으면 true
     */
    public boolean isEmpty() {
        return values.isEmpty();
    }

    private static IllegalArgumentException invalid(String key, Object value, String expected) {
        return new IllegalArgumentException(
            String.format("Invalid value for '%s': expected %s but was '%s'", key, expected, value)
        );
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Details details = (Details) o;
        return values.equals(details.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Details" + values;
    }
}
