package com.ryuqq.composer.application.orchestrator;

import com.ryuqq.composer.core.model.ModuleId;
import com.ryuqq.composer.core.status.ErrorKind;
import com.ryuqq.composer.core.status.ModuleStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 모듈 하나의 실행 기록.
 *
 * @param moduleId 모듈 ID
 * @param priority 조립 우선순위
 * @param wave wave 인덱스 (0부터)
 * @param registrationOrder 레지스트리 등록 순서
 * @param status 실행 상태
 * @param errorKind 실패 원인 (SUCCESS/SKIPPED/NOT_RUN이면 null)
 * @param errorMessage 실패 메시지 또는 SKIPPED 사유 (없으면 null)
 * @param durationMs 실행 시간 (밀리초, 실행되지 않았으면 0)
 * @param content 출력 내용 (SUCCESS가 아니면 빈 문자열)
 * @param metadata 모듈이 반환한 진단 정보 (출력이 없었으면 빈 맵)
 *
 * @author Composer Team
 * @since 1.0.0
 */
public record ModuleExecution(
    ModuleId moduleId,
    int priority,
    int wave,
    int registrationOrder,
    ModuleStatus status,
    ErrorKind errorKind,
    String errorMessage,
    long durationMs,
    String content,
    Map<String, Object> metadata
) {

    public ModuleExecution {
        if (moduleId == null) {
            throw new IllegalArgumentException("moduleId cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (durationMs < 0) {
            throw new IllegalArgumentException("durationMs cannot be negative");
        }
        content = content == null ? "" : content;
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ModuleExecution success(ModuleId moduleId, int priority, int wave, int registrationOrder,
                                          long durationMs, String content) {
        return success(moduleId, priority, wave, registrationOrder, durationMs, content, Map.of());
    }

    public static ModuleExecution success(ModuleId moduleId, int priority, int wave, int registrationOrder,
                                          long durationMs, String content, Map<String, Object> metadata) {
        return new ModuleExecution(moduleId, priority, wave, registrationOrder,
            ModuleStatus.SUCCESS, null, null, durationMs, content, metadata);
    }

    public static ModuleExecution failed(ModuleId moduleId, int priority, int wave, int registrationOrder,
                                         ModuleStatus status, ErrorKind errorKind, String errorMessage,
                                         long durationMs) {
        return failed(moduleId, priority, wave, registrationOrder, status, errorKind, errorMessage, durationMs, Map.of());
    }

    /**
     * 모듈이 FAILURE 출력과 함께 metadata를 반환한 경우.
     */
    public static ModuleExecution failed(ModuleId moduleId, int priority, int wave, int registrationOrder,
                                         ModuleStatus status, ErrorKind errorKind, String errorMessage,
                                         long durationMs, Map<String, Object> metadata) {
        return new ModuleExecution(moduleId, priority, wave, registrationOrder,
            status, errorKind, errorMessage, durationMs, "", metadata);
    }

    public static ModuleExecution skipped(ModuleId moduleId, int priority, int wave, int registrationOrder,
                                          String reason) {
        return new ModuleExecution(moduleId, priority, wave, registrationOrder,
            ModuleStatus.SKIPPED, null, reason, 0, "", Map.of());
    }

    public static ModuleExecution notRun(ModuleId moduleId, int priority, int wave, int registrationOrder) {
        return new ModuleExecution(moduleId, priority, wave, registrationOrder,
            ModuleStatus.NOT_RUN, null, null, 0, "", Map.of());
    }

    public boolean isSuccess() {
        return status == ModuleStatus.SUCCESS;
    }
}
