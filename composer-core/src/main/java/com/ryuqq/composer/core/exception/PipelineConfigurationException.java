package com.ryuqq.composer.core.exception;

/**
 * 등록 시점 설정 오류.
 *
 * <p>이 계열의 예외는 치명적이며, 파이프라인 구성 자체를 거부합니다.
 * 부분적으로 유효한 그래프로 실행을 진행하지 않습니다.</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public class PipelineConfigurationException extends PipelineException {

    public PipelineConfigurationException(String message) {
        super(message);
    }

    public PipelineConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
