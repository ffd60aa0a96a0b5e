package com.ryuqq.composer.core.status;

/**
 * 모듈 실행 결과 상태.
 *
 * <p><strong>상태 분류:</strong></p>
 * <pre>
 * 디스패치됨
 *    │
 *    ├─► SUCCESS   (출력이 조립에 사용됨)
 *    ├─► FAILURE   (예외, 실패 출력, 선언되지 않은 쓰기)
 *    ├─► TIMEOUT   (모듈 타임아웃 초과, 늦은 결과는 폐기)
 *    ├─► SKIPPED   (precondition 미충족, 실패 아님)
 *    └─► CANCELLED (실행 타임아웃 시점에 아직 실행 중)
 *
 * 디스패치 안 됨
 *    └─► NOT_RUN   (필수 모듈 실패 또는 실행 타임아웃 이후의 wave)
 * </pre>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public enum ModuleStatus {

    /**
     * 성공.
     */
    SUCCESS,

    /**
     * 실패.
     */
    FAILURE,

    /**
     * 모듈 타임아웃.
     */
    TIMEOUT,

    /**
     * 입력 조건 미충족으로 실행 생략.
     */
    SKIPPED,

    /**
     * 실행 중 파이프라인 실행이 취소됨.
     */
    CANCELLED,

    /**
     * 디스패치되지 않음.
     */
    NOT_RUN;

    /**
     * 필수 모듈이 이 상태로 끝났을 때 실행 전체를 실패로 볼지 여부.
     *
     * @return FAILURE 또는 TIMEOUT인 경우 true
     */
    public boolean isFailure() {
        return this == FAILURE || this == TIMEOUT;
    }
}
