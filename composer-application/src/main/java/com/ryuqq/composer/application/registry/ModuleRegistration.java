package com.ryuqq.composer.application.registry;

import com.ryuqq.composer.core.contract.ModuleConfig;
import com.ryuqq.composer.core.model.ModuleDescriptor;

/**
 * 기술자, 팩토리, 모듈 설정 묶음 (일괄 등록 단위).
 *
 * @param descriptor 모듈 기술자
 * @param factory 모듈 팩토리
 * @param config 인스턴스 생성 직후 전달할 모듈 설정 (없으면 빈 설정)
 *
 * @author Composer Team
 * @since 1.0.0
 */
public record ModuleRegistration(ModuleDescriptor descriptor, ModuleFactory factory, ModuleConfig config) {

    public ModuleRegistration {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null (module: " + descriptor.id() + ")");
        }
        config = config == null ? ModuleConfig.empty() : config;
    }

    public ModuleRegistration(ModuleDescriptor descriptor, ModuleFactory factory) {
        this(descriptor, factory, ModuleConfig.empty());
    }

    public static ModuleRegistration of(ModuleDescriptor descriptor, ModuleFactory factory) {
        return new ModuleRegistration(descriptor, factory);
    }

    public static ModuleRegistration of(ModuleDescriptor descriptor, ModuleFactory factory, ModuleConfig config) {
        return new ModuleRegistration(descriptor, factory, config);
    }
}
