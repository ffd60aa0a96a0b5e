package com.ryuqq.composer.adapter.runner;

/**
 * WaveScheduler 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>workerPoolSize: 모든 wave와 동시 실행이 공유하는 worker 스레드 수 (기본 4)</li>
 *   <li>runTimeoutMs: 실행 전체 타임아웃 (기본 0 = 제한 없음)</li>
 *   <li>moduleTimeoutMs: 모듈 기본 타임아웃, 기술자의 timeoutMs가 우선 (기본 0 = 제한 없음)</li>
 *   <li>includeFailurePlaceholders: 실패 모듈 자리표시를 아티팩트에 포함할지 여부 (기본 false)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>I/O 대기가 긴 모듈이 많으면 workerPoolSize 증가</li>
 *   <li>외부 호출이 있는 모듈은 moduleTimeoutMs를 설정해 wave 지연을 제한</li>
 * </ul>
 *
 * @author Composer Team
 * @since 1.0.0
 * @param workerPoolSize worker 스레드 수 (1 이상)
 * @param runTimeoutMs 실행 타임아웃 (밀리초, 0 이상)
 * @param moduleTimeoutMs 모듈 기본 타임아웃 (밀리초, 0 이상)
 * @param includeFailurePlaceholders 실패 자리표시 포함 여부
 */
public record SchedulerConfig(
    int workerPoolSize,
    long runTimeoutMs,
    long moduleTimeoutMs,
    boolean includeFailurePlaceholders
) {

    /**
     * 기본 worker 수.
     */
    public static final int DEFAULT_WORKER_POOL_SIZE = 4;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: workerPoolSize=4, runTimeoutMs=0, moduleTimeoutMs=0, includeFailurePlaceholders=false</p>
     */
    public SchedulerConfig() {
        this(DEFAULT_WORKER_POOL_SIZE, 0, 0, false);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SchedulerConfig {
        if (workerPoolSize <= 0) {
            throw new IllegalArgumentException(
                "workerPoolSize must be positive (current: " + workerPoolSize + ")"
            );
        }
        if (runTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "runTimeoutMs cannot be negative (current: " + runTimeoutMs + ")"
            );
        }
        if (moduleTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "moduleTimeoutMs cannot be negative (current: " + moduleTimeoutMs + ")"
            );
        }
    }

    /**
     * workerPoolSize만 변경한 새 인스턴스 생성.
     */
    public SchedulerConfig withWorkerPoolSize(int workerPoolSize) {
        return new SchedulerConfig(workerPoolSize, runTimeoutMs, moduleTimeoutMs, includeFailurePlaceholders);
    }

    /**
     * runTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public SchedulerConfig withRunTimeoutMs(long runTimeoutMs) {
        return new SchedulerConfig(workerPoolSize, runTimeoutMs, moduleTimeoutMs, includeFailurePlaceholders);
    }

    /**
     * moduleTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public SchedulerConfig withModuleTimeoutMs(long moduleTimeoutMs) {
        return new SchedulerConfig(workerPoolSize, runTimeoutMs, moduleTimeoutMs, includeFailurePlaceholders);
    }

    /**
     * includeFailurePlaceholders만 변경한 새 인스턴스 생성.
     */
    public SchedulerConfig withIncludeFailurePlaceholders(boolean includeFailurePlaceholders) {
        return new SchedulerConfig(workerPoolSize, runTimeoutMs, moduleTimeoutMs, includeFailurePlaceholders);
    }

    /**
     * 기술자 override를 반영한 모듈 타임아웃.
     *
     * @param descriptorTimeoutMs 기술자의 timeoutMs (0이면 기본값 사용)
     * @return 적용할 타임아웃 (0 = 제한 없음)
     */
    public long effectiveModuleTimeoutMs(long descriptorTimeoutMs) {
        return descriptorTimeoutMs > 0 ? descriptorTimeoutMs : moduleTimeoutMs;
    }
}
