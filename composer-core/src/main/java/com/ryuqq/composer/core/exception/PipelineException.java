package com.ryuqq.composer.core.exception;

/**
 * 모듈 파이프라인 예외의 최상위 타입.
 *
 * <p>모든 파이프라인 예외는 unchecked 예외입니다.</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
