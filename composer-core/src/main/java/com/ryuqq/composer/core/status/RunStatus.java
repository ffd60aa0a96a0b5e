package com.ryuqq.composer.core.status;

/**
 * 파이프라인 실행 전체 상태.
 *
 * <p>모든 실행은 이 중 하나의 상태를 반환합니다.
 * 호출자는 아티팩트를 사용하기 전에 반드시 상태를 확인해야 합니다.</p>
 *
 * <ul>
 *   <li>COMPLETE: 모든 wave 완료, 필수 모듈 실패 없음</li>
 *   <li>PARTIAL_FAILURE: 필수 모듈 실패로 이후 wave 중단</li>
 *   <li>CANCELLED: 실행 타임아웃 초과로 이후 wave 중단</li>
 *   <li>REJECTED: 요청 자체가 유효하지 않아 실행하지 않음</li>
 * </ul>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public enum RunStatus {

    COMPLETE,

    PARTIAL_FAILURE,

    CANCELLED,

    REJECTED;

    /**
     * 아티팩트를 그대로 신뢰할 수 있는지 확인.
     *
     * @return COMPLETE인 경우 true
     */
    public boolean isTrustworthy() {
        return this == COMPLETE;
    }
}
