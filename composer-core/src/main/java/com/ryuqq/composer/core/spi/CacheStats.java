package com.ryuqq.composer.core.spi;

/**
 * 캐시 통계 스냅샷.
 *
 * @param hits 캐시 적중 횟수
 * @param misses 캐시 미스 횟수 (대기 후 다른 스레드의 결과를 받은 경우 포함)
 * @param computations 계산 함수 실행 횟수
 * @param failures 실패한 계산 횟수
 * @param evictions TTL 만료, LRU, invalidate로 제거된 항목 수
 * @param size 현재 READY 항목 수
 *
 * @author Composer Team
 * @since 1.0.0
 */
public record CacheStats(
    long hits,
    long misses,
    long computations,
    long failures,
    long evictions,
    int size
) {

    /**
     * 적중률 (0.0 ~ 1.0).
     *
     * @return 요청이 없으면 0.0
     */
    public double hitRate() {
        long requests = hits + misses;
        return requests == 0 ? 0.0 : (double) hits / requests;
    }
}
