package com.ryuqq.composer.core.status;

/**
 * 모듈 실패 원인 분류.
 *
 * @author Composer Team
 * @since 1.0.0
 */
public enum ErrorKind {

    /**
     * 모듈이 예외를 던졌거나 실패 출력을 반환함.
     */
    MODULE_EXECUTION_ERROR,

    /**
     * 모듈 타임아웃 초과.
     */
    TIMEOUT,

    /**
     * producedKeys에 선언되지 않은 키에 쓰기를 시도함.
     */
    UNDECLARED_WRITE,

    /**
     * 실행 타임아웃으로 취소됨.
     */
    CANCELLED,

    /**
     * 모듈 팩토리가 인스턴스를 만들지 못함.
     */
    INSTANTIATION_ERROR
}
