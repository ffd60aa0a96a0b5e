package com.ryuqq.composer.core.statemachine;

/**
 * 캐시 항목의 계산 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * ABSENT
 *    │
 *    ▼ (미스, 키 락 보유)
 * PENDING
 *    │
 *    ├─► READY  (계산 성공)
 *    │
 *    └─► ABSENT (계산 실패, 캐시하지 않음)
 *
 * READY ─► ABSENT (TTL 만료, LRU 제거, invalidate)
 *
 * 금지된 전이:
 * - ABSENT → READY ❌ (계산 없이 값이 생길 수 없음)
 * - READY → PENDING ❌
 * - PENDING → PENDING ❌ (같은 키의 중복 계산)
 * </pre>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public enum CacheEntryState {

    /**
     * 값 없음.
     */
    ABSENT,

    /**
     * 계산 중 (키 락 보유).
     */
    PENDING,

    /**
     * 값 사용 가능.
     */
    READY
}
