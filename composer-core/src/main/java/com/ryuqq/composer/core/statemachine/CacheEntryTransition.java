package com.ryuqq.composer.core.statemachine;

/**
 * 캐시 항목 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>ABSENT → PENDING</li>
 *   <li>PENDING → READY</li>
 *   <li>PENDING → ABSENT</li>
 *   <li>READY → ABSENT</li>
 * </ul>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public final class CacheEntryTransition {

    private CacheEntryTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(CacheEntryState from, CacheEntryState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        boolean valid = switch (from) {
            case ABSENT -> to == CacheEntryState.PENDING;
            case PENDING -> to == CacheEntryState.READY || to == CacheEntryState.ABSENT;
            case READY -> to == CacheEntryState.ABSENT;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid cache entry transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static CacheEntryState transition(CacheEntryState current, CacheEntryState next) {
        validate(current, next);
        return next;
    }
}
