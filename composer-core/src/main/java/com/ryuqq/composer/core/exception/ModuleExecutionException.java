package com.ryuqq.composer.core.exception;

import com.ryuqq.composer.core.model.ModuleId;

/**
 * 모듈 실행 중 오류.
 *
 * <p>실행 시점 오류는 해당 모듈에만 격리됩니다.</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public class ModuleExecutionException extends PipelineException {

    private final ModuleId moduleId;

    public ModuleExecutionException(ModuleId moduleId, String message) {
        super("Module '" + moduleId + "' failed: " + message);
        this.moduleId = moduleId;
    }

    public ModuleExecutionException(ModuleId moduleId, String message, Throwable cause) {
        super("Module '" + moduleId + "' failed: " + message, cause);
        this.moduleId = moduleId;
    }

    public ModuleId moduleId() {
        return moduleId;
    }
}
