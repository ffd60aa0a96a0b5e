package com.ryuqq.composer.adapter.runner.config;

import com.ryuqq.composer.adapter.runner.SchedulerConfig;
import com.ryuqq.composer.application.registry.ModuleFactory;
import com.ryuqq.composer.application.registry.ModuleRegistration;
import com.ryuqq.composer.application.registry.ModuleRegistry;
import com.ryuqq.composer.core.contract.ModuleConfig;
import com.ryuqq.composer.core.exception.PipelineConfigurationException;
import com.ryuqq.composer.core.model.ModuleDescriptor;
import com.ryuqq.composer.core.model.ModuleId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 정적 파이프라인 정의 (스케줄러 설정 + 모듈 기술자 목록 + 모듈별 설정).
 *
 * @param scheduler 스케줄러 설정
 * @param modules 모듈 기술자 (정의 파일 순서)
 * @param moduleConfigs 모듈 ID → 모듈 설정 (config 블록이 있는 모듈만)
 *
 * @author Composer Team
 * @since 1.0.0
 */
public record PipelineDefinition(
    SchedulerConfig scheduler,
    List<ModuleDescriptor> modules,
    Map<ModuleId, ModuleConfig> moduleConfigs
) {

    public PipelineDefinition {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        modules = modules == null ? List.of() : List.copyOf(modules);
        moduleConfigs = moduleConfigs == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(moduleConfigs));
    }

    public PipelineDefinition(SchedulerConfig scheduler, List<ModuleDescriptor> modules) {
        this(scheduler, modules, Map.of());
    }

    /**
     * 모듈 설정 조회.
     *
     * @param moduleId 모듈 ID
     * @return 설정 (config 블록이 없었으면 빈 설정)
     */
    public ModuleConfig configOf(String moduleId) {
        return moduleConfigs.getOrDefault(ModuleId.of(moduleId), ModuleConfig.empty());
    }

    /**
     * 정의된 모든 모듈을 레지스트리에 일괄 등록.
     *
     * <p>정의 순서가 등록 순서가 되며, 정의 안의 전방 참조가 허용됩니다.
     * 모듈별 config 블록은 등록에 함께 실려 인스턴스 생성 직후 initialize로 전달됩니다.</p>
     *
     * @param registry 대상 레지스트리
     * @param factories 모듈 ID → 팩토리
     * @throws PipelineConfigurationException 팩토리가 없는 모듈이 있는 경우
     */
    public void registerInto(ModuleRegistry registry, Map<String, ModuleFactory> factories) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (factories == null) {
            throw new IllegalArgumentException("factories cannot be null");
        }
        if (modules.isEmpty()) {
            return;
        }
        List<ModuleRegistration> batch = new ArrayList<>(modules.size());
        for (ModuleDescriptor descriptor : modules) {
            ModuleFactory factory = factories.get(descriptor.id().getValue());
            if (factory == null) {
                throw new PipelineConfigurationException("No factory supplied for module '" + descriptor.id() + "'");
            }
            ModuleConfig config = moduleConfigs.getOrDefault(descriptor.id(), ModuleConfig.empty());
            batch.add(ModuleRegistration.of(descriptor, factory, config));
        }
        registry.registerAll(batch);
    }
}
