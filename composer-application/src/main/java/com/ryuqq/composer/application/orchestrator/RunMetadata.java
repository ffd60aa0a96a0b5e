package com.ryuqq.composer.application.orchestrator;

import com.ryuqq.composer.core.model.ModuleId;
import com.ryuqq.composer.core.status.ModuleStatus;
import com.ryuqq.composer.core.status.RunStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 실행 메타데이터.
 *
 * @param runId 실행 ID
 * @param status 실행 상태
 * @param waveCount 계획된 wave 수
 * @param wavesCompleted 완료된 wave 수
 * @param totalDurationMs 전체 실행 시간 (밀리초)
 * @param modules 모듈별 실행 기록 (기록 순서)
 * @param contributingModules 아티팩트에 포함된 모듈 (조립 순서)
 * @param artifactLength 아티팩트 길이 (문자 수)
 * @param moduleMetadata 모듈별 진단 정보 (metadata를 반환한 모듈만, 기록 순서)
 *
 * @author Composer Team
 * @since 1.0.0
 */
public record RunMetadata(
    String runId,
    RunStatus status,
    int waveCount,
    int wavesCompleted,
    long totalDurationMs,
    List<ModuleExecution> modules,
    List<ModuleId> contributingModules,
    int artifactLength,
    Map<ModuleId, Map<String, Object>> moduleMetadata
) {

    public RunMetadata {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        modules = modules == null ? List.of() : List.copyOf(modules);
        contributingModules = contributingModules == null ? List.of() : List.copyOf(contributingModules);
        moduleMetadata = moduleMetadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(moduleMetadata));
    }

    /**
     * 모듈별 진단 정보를 실행 기록에서 모아 생성.
     */
    public RunMetadata(String runId, RunStatus status, int waveCount, int wavesCompleted, long totalDurationMs,
                       List<ModuleExecution> modules, List<ModuleId> contributingModules, int artifactLength) {
        this(runId, status, waveCount, wavesCompleted, totalDurationMs, modules, contributingModules,
            artifactLength, collectMetadata(modules));
    }

    /**
     * 모듈 실행 기록 조회.
     */
    public Optional<ModuleExecution> execution(String moduleId) {
        ModuleId id = ModuleId.of(moduleId);
        return modules.stream().filter(execution -> execution.moduleId().equals(id)).findFirst();
    }

    /**
     * 상태별 모듈 수.
     */
    public long countByStatus(ModuleStatus moduleStatus) {
        return modules.stream().filter(execution -> execution.status() == moduleStatus).count();
    }

    /**
     * 모듈 진단 정보 조회.
     *
     * @return metadata 또는 빈 맵
     */
    public Map<String, Object> metadataOf(String moduleId) {
        return moduleMetadata.getOrDefault(ModuleId.of(moduleId), Map.of());
    }

    private static Map<ModuleId, Map<String, Object>> collectMetadata(List<ModuleExecution> modules) {
        Map<ModuleId, Map<String, Object>> collected = new LinkedHashMap<>();
        if (modules != null) {
            for (ModuleExecution execution : modules) {
                if (!execution.metadata().isEmpty()) {
                    collected.put(execution.moduleId(), execution.metadata());
                }
            }
        }
        return collected;
    }
}
