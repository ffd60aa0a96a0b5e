package com.ryuqq.composer.core.model;

import java.util.regex.Pattern;

/**
 * Shared State 키.
 *
 * <p>한 번의 파이프라인 실행 안에서 모듈 간에 값을 전달할 때 사용하는 키입니다.
 * 하나의 키는 정확히 하나의 모듈만 생산(produce)할 수 있습니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~100자</li>
 *   <li>패턴: 영문자, 숫자, 언더스코어, 점, 콜론, 하이픈만 허용 (예: ontological_category)</li>
 * </ul>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public final class StateKey implements Comparable<StateKey> {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[A-Za-z0-9_.:-]+$");
    private static final int MAX_LENGTH = 100;

    private final String value;

    private StateKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("StateKey cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("StateKey length cannot exceed " + MAX_LENGTH + " characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(
                "StateKey must contain only letters, digits, '_', '.', ':' and '-' (current: " + value + ")");
        }
        this.value = value;
    }

    /**
     * 값이 StateKey 형식 규칙을 만족하는지 확인.
     *
     * @param value 검사할 값
     * @return 유효하면 true
     */
    public static boolean isValid(String value) {
        return value != null && !value.isBlank() && value.length() <= MAX_LENGTH
            && VALID_PATTERN.matcher(value).matches();
    }

    /**
     * StateKey 생성.
     *
     * @param value 키 값
     * @return StateKey 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static StateKey of(String value) {
        return new StateKey(value);
    }

    /**
     * StateKey 값 조회.
     *
     * @return 키 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(StateKey other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StateKey stateKey = (StateKey) o;
        return value.equals(stateKey.value);
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
