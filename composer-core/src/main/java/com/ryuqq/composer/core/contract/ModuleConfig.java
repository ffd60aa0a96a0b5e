package com.ryuqq.composer.core.contract;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 모듈별 설정.
 *
 * <p>파이프라인 정의의 모듈 항목 {@code config} 블록이나 등록 코드에서 전달되며,
 * 인스턴스 생성 직후 {@link ContentModule#initialize(ModuleConfig)}로 한 번 주입됩니다.</p>
 *
 * <p>값은 JSON에서 읽은 그대로 보관합니다 (문자열, 숫자, boolean, 목록, 중첩 객체).
 * 타입 조회는 값이 없으면 기본값을 반환하고, 값이 있는데 변환할 수 없으면 예외를 던집니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ModuleConfig config = ModuleConfig.of(Map.of("include_examples", false, "max_rules", 12));
 * boolean examples = config.getBoolean("include_examples", true);
 * int maxRules = config.getInt("max_rules", 20);
 * </pre>
 *
 * @param values 설정 값 (삽입 순서 유지, null 값 불가)
 *
 * @author Composer Team
 * @since 1.0.0
 */
public record ModuleConfig(Map<String, Object> values) {

    private static final ModuleConfig EMPTY = new ModuleConfig(Map.of());

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 키가 blank이거나 값이 null인 경우
     */
    public ModuleConfig {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (values != null) {
            values.forEach((key, value) -> {
                if (key == null || key.isBlank()) {
                    throw new IllegalArgumentException("config key cannot be null or blank");
                }
                if (value == null) {
                    throw new IllegalArgumentException("config value cannot be null (key: " + key + ")");
                }
                copy.put(key, value);
            });
        }
        values = Collections.unmodifiableMap(copy);
    }

    public static ModuleConfig empty() {
        return EMPTY;
    }

    public static ModuleConfig of(Map<String, Object> values) {
        return values == null || values.isEmpty() ? EMPTY : new ModuleConfig(values);
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public String getString(String key, String defaultValue) {
        Object value = values.get(key);
        return value == null ? defaultValue : value.toString();
    }

    /**
     * 정수 조회.
     *
     * @throws IllegalArgumentException 값이 정수로 변환되지 않는 경우
     */
    public int getInt(String key, int defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("config '" + key + "' is not an integer: " + value, e);
        }
    }

    /**
     * boolean 조회. 문자열은 "true"/"false"만 허용합니다 (대소문자 무시).
     *
     * @throws IllegalArgumentException 값이 boolean으로 변환되지 않는 경우
     */
    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String text = value.toString().trim();
        if ("true".equalsIgnoreCase(text)) {
            return true;
        }
        if ("false".equalsIgnoreCase(text)) {
            return false;
        }
        throw new IllegalArgumentException("config '" + key + "' is not a boolean: " + value);
    }

    /**
     * 중첩 설정 조회 (예: 복합 모듈의 하위 모듈 설정).
     *
     * @param key 하위 설정 키
     * @return 값이 객체면 그 설정, 없으면 빈 설정
     * @throws IllegalArgumentException 값이 객체가 아닌 경우
     */
    public ModuleConfig section(String key) {
        Object value = values.get(key);
        if (value == null) {
            return EMPTY;
        }
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("config '" + key + "' is not an object: " + value);
        }
        Map<?, ?> nested = (Map<?, ?>) value;
        Map<String, Object> converted = new LinkedHashMap<>();
        nested.forEach((nestedKey, nestedValue) -> converted.put(String.valueOf(nestedKey), nestedValue));
        return of(converted);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }
}
