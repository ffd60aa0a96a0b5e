package com.ryuqq.composer.core.exception;

import com.ryuqq.composer.core.model.ModuleId;

/**
 * 모듈 타임아웃 초과.
 *
 * @author Composer Team
 * @since 1.0.0
 */
public class ModuleTimeoutException extends ModuleExecutionException {

    private final long timeoutMs;

    public ModuleTimeoutException(ModuleId moduleId, long timeoutMs) {
        super(moduleId, "timed out after " + timeoutMs + "ms");
        this.timeoutMs = timeoutMs;
    }

    public long timeoutMs() {
        return timeoutMs;
    }
}
