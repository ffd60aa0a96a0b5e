package com.ryuqq.composer.core.exception;

import com.ryuqq.composer.core.model.ModuleId;

/**
 * 모듈 팩토리가 인스턴스 생성에 실패함.
 *
 * @author Composer Team
 * @since 1.0.0
 */
public class ModuleInstantiationException extends ModuleExecutionException {

    public ModuleInstantiationException(ModuleId moduleId, Throwable cause) {
        super(moduleId, "factory could not create instance", cause);
    }
}
