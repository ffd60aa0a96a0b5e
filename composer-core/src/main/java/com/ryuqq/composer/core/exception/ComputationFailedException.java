package com.ryuqq.composer.core.exception;

/**
 * 캐시 계산 실패.
 *
 * <p>계산을 시작한 호출자와, 같은 계산을 기다리던 모든 호출자에게 동일한 원인(cause)으로 전파됩니다.
 * 실패는 캐시되지 않으므로 이후 호출은 다시 계산을 시도합니다.</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public class ComputationFailedException extends PipelineException {

    private final String cacheKey;

    public ComputationFailedException(String cacheKey, Throwable cause) {
        super("Computation failed for cache key '" + cacheKey + "': " + cause.getMessage(), cause);
        this.cacheKey = cacheKey;
    }

    public String cacheKey() {
        return cacheKey;
    }
}
