package com.ryuqq.composer.core.model;

import java.util.regex.Pattern;

/**
 * Content Module 식별자.
 *
 * <p>ModuleId는 파이프라인에 등록된 모듈을 유일하게 식별하며,
 * 의존성 선언과 실행 메타데이터의 키로 사용됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>ModuleId.of("expertise") - 전문가 역할 모듈</li>
 *   <li>ModuleId.of("ess_rules") - essentie 규칙 모듈</li>
 *   <li>ModuleId.of("definition_task") - 최종 작업 지시 모듈</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~100자</li>
 *   <li>패턴: 영문자, 숫자, 언더스코어, 점, 하이픈만 허용</li>
 * </ul>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public final class ModuleId implements Comparable<ModuleId> {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[A-Za-z0-9_.-]+$");
    private static final int MAX_LENGTH = 100;

    private final String value;

    private ModuleId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ModuleId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("ModuleId length cannot exceed " + MAX_LENGTH + " characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(
                "ModuleId must contain only letters, digits, '_', '.' and '-' (current: " + value + ")");
        }
        this.value = value;
    }

    /**
     * 값이 ModuleId 형식 규칙을 만족하는지 확인.
     *
     * @param value 검사할 값
     * @return 유효하면 true
     */
    public static boolean isValid(String value) {
        return value != null && !value.isBlank() && value.length() <= MAX_LENGTH
            && VALID_PATTERN.matcher(value).matches();
    }

    /**
     * ModuleId 생성.
     *
     * @param value ModuleId 값 (예: expertise, ess_rules)
     * @return ModuleId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ModuleId of(String value) {
        return new ModuleId(value);
    }

    /**
     * ModuleId 값 조회.
     *
     * @return ModuleId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(ModuleId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ModuleId moduleId = (ModuleId) o;
        return value.equals(moduleId.value);
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
