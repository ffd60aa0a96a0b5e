package com.ryuqq.composer.core.exception;

import com.ryuqq.composer.core.model.ModuleId;

/**
 * 등록되지 않은 모듈에 대한 의존성.
 *
 * @author Composer Team
 * @since 1.0.0
 */
public class UnknownDependencyException extends PipelineConfigurationException {

    private final ModuleId module;
    private final ModuleId missingDependency;

    public UnknownDependencyException(ModuleId module, ModuleId missingDependency) {
        super("Module '" + module + "' depends on unknown module '" + missingDependency + "'");
        this.module = module;
        this.missingDependency = missingDependency;
    }

    public ModuleId module() {
        return module;
    }

    public ModuleId missingDependency() {
        return missingDependency;
    }
}
