package com.ryuqq.composer.core.exception;

import com.ryuqq.composer.core.model.ModuleId;
import com.ryuqq.composer.core.model.StateKey;

/**
 * 모듈이 consumedKeys에 선언하지 않은 키를 읽으려고 함.
 *
 * @author Composer Team
 * @since 1.0.0
 */
public class UndeclaredKeyAccessException extends ModuleExecutionException {

    private final StateKey key;

    public UndeclaredKeyAccessException(ModuleId moduleId, StateKey key) {
        super(moduleId, "read of undeclared key '" + key + "'");
        this.key = key;
    }

    public StateKey key() {
        return key;
    }
}
