package com.ryuqq.composer.core.contract;

import com.ryuqq.composer.core.model.StateKey;
import com.ryuqq.composer.core.status.ModuleStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 모듈 실행 출력.
 *
 * <p>content는 아티팩트의 한 조각이고, writes는 이 모듈이 생산한 Shared State 값입니다.
 * writes는 wave가 끝난 뒤 스케줄러가 producedKeys와 대조한 후 적용합니다.
 * metadata는 아티팩트에 포함되지 않는 진단 정보이며 실행 메타데이터에 모듈별로 모입니다.</p>
 *
 * @param content 아티팩트 조각 (빈 문자열 허용)
 * @param writes Shared State 쓰기
 * @param metadata 모듈 진단 정보 (예: 적용된 규칙 수)
 * @param status SUCCESS 또는 FAILURE
 * @param errorMessage 실패 메시지 (FAILURE일 때만 non-null)
 *
 * @author Composer Team
 * @since 1.0.0
 */
public record ModuleOutput(
    String content,
    Map<StateKey, Object> writes,
    Map<String, Object> metadata,
    ModuleStatus status,
    String errorMessage
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException status가 SUCCESS/FAILURE가 아니거나 FAILURE에 메시지가 없는 경우
     */
    public ModuleOutput {
        if (status != ModuleStatus.SUCCESS && status != ModuleStatus.FAILURE) {
            throw new IllegalArgumentException("status must be SUCCESS or FAILURE (current: " + status + ")");
        }
        if (status == ModuleStatus.FAILURE && (errorMessage == null || errorMessage.isBlank())) {
            throw new IllegalArgumentException("errorMessage cannot be null or blank for FAILURE");
        }
        content = content == null ? "" : content;
        writes = writes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(writes));
        metadata = copyMetadata(metadata);
    }

    /**
     * metadata 없는 출력.
     */
    public ModuleOutput(String content, Map<StateKey, Object> writes, ModuleStatus status, String errorMessage) {
        this(content, writes, Map.of(), status, errorMessage);
    }

    /**
     * 쓰기 없는 성공 출력.
     */
    public static ModuleOutput success(String content) {
        return new ModuleOutput(content, Map.of(), ModuleStatus.SUCCESS, null);
    }

    /**
     * 쓰기를 포함한 성공 출력.
     *
     * @param content 아티팩트 조각
     * @param writes 키 이름 → 값
     * @return ModuleOutput
     */
    public static ModuleOutput success(String content, Map<String, Object> writes) {
        Map<StateKey, Object> converted = new LinkedHashMap<>();
        writes.forEach((key, value) -> converted.put(StateKey.of(key), value));
        return new ModuleOutput(content, converted, ModuleStatus.SUCCESS, null);
    }

    /**
     * 실패 출력.
     */
    public static ModuleOutput failure(String errorMessage) {
        return new ModuleOutput("", Map.of(), ModuleStatus.FAILURE, errorMessage);
    }

    /**
     * metadata를 추가한 새 인스턴스 생성 (같은 키는 덮어씀).
     *
     * @param additions 추가할 항목 (null 값 불가)
     * @return 새 ModuleOutput
     */
    public ModuleOutput withMetadata(Map<String, Object> additions) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        if (additions != null) {
            merged.putAll(additions);
        }
        return new ModuleOutput(content, writes, merged, status, errorMessage);
    }

    public boolean isSuccess() {
        return status == ModuleStatus.SUCCESS;
    }

    /**
     * 내용이 비어 있는지 확인 (공백만 있는 경우 포함).
     */
    public boolean isEmpty() {
        return content.isBlank();
    }

    private static Map<String, Object> copyMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        metadata.forEach((key, value) -> {
            if (key == null || value == null) {
                throw new IllegalArgumentException("metadata cannot contain null keys or values (key: " + key + ")");
            }
            copy.put(key, value);
        });
        return Collections.unmodifiableMap(copy);
    }
}
