package com.ryuqq.composer.core.spi;

import com.ryuqq.composer.core.exception.ComputationFailedException;
import com.ryuqq.composer.core.statemachine.CacheEntryState;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.Callable;

/**
 * 프로세스 전역 메모이제이션 캐시 SPI.
 *
 * <p><strong>핵심 계약 (at-most-once):</strong></p>
 * <ul>
 *   <li>같은 키에 대해 동시에 캐시 미스를 관찰한 호출자들 중 계산 함수는 최대 한 번만 실행됨</li>
 *   <li>나머지 호출자는 첫 계산이 끝날 때까지 블로킹된 후 같은 값(또는 같은 오류)을 받음</li>
 *   <li>실패한 계산은 캐시되지 않음: 이후 호출은 다시 계산을 시도함</li>
 * </ul>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>키별 락은 미스일 때만 획득 (전역 락 금지)</li>
 *   <li>락 획득 직후 캐시 재확인 (double-check)</li>
 *   <li>미스-계산-저장 전체 구간 동안 락 유지</li>
 *   <li>TTL 만료는 접근 시점에 지연 평가</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * List&lt;Rule&gt; rules = cache.getOrCompute(
 *     CacheKey.of("rules:ESS"),
 *     () -&gt; ruleSource.load("ESS"),
 *     CacheLayer.PROCESS_LIFETIME);
 * </pre>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public interface CacheLayer {

    /**
     * 만료되지 않는 TTL (프로세스 수명 동안 유지).
     */
    Duration PROCESS_LIFETIME = ChronoUnit.FOREVER.getDuration();

    /**
     * 캐시 조회 또는 계산.
     *
     * @param key 캐시 키
     * @param computeFn 계산 함수 (미스일 때만 호출)
     * @param ttl 유효 기간 (양수)
     * @param <T> 값 타입
     * @return 캐시된 값 또는 새로 계산된 값
     * @throws ComputationFailedException 계산 함수가 실패한 경우 (대기하던 호출자에게도 동일하게 전파)
     * @throws IllegalArgumentException 인자가 null이거나 ttl이 양수가 아닌 경우
     */
    <T> T getOrCompute(CacheKey key, Callable<T> computeFn, Duration ttl);

    /**
     * 문자열 키로 캐시 조회 또는 계산.
     */
    default <T> T getOrCompute(String key, Callable<T> computeFn, Duration ttl) {
        return getOrCompute(CacheKey.of(key), computeFn, ttl);
    }

    /**
     * 항목 무효화.
     *
     * @param key 캐시 키
     * @return 제거된 READY 항목이 있었으면 true
     */
    boolean invalidate(CacheKey key);

    /**
     * 모든 항목 제거.
     */
    void clear();

    /**
     * 항목의 현재 계산 상태.
     *
     * @param key 캐시 키
     * @return ABSENT, PENDING, READY
     */
    CacheEntryState state(CacheKey key);

    /**
     * 통계 스냅샷.
     *
     * @return CacheStats
     */
    CacheStats stats();
}
