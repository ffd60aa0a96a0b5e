package com.ryuqq.composer.application.orchestrator;

import com.ryuqq.composer.core.model.ModuleId;
import com.ryuqq.composer.core.model.StateKey;
import com.ryuqq.composer.core.state.SharedStateStore;
import com.ryuqq.composer.core.status.RunStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 파이프라인 실행 하나의 상태.
 *
 * <p>요청마다 새로 만들어지며 결과를 반환한 뒤 버려집니다.
 * 실행 기록과 Shared State는 스케줄러 스레드에서만 변경됩니다.</p>
 *
 * <p><strong>라이프사이클:</strong></p>
 * <pre>
 * new PipelineRun(...) → record(...)* / markWaveCompleted()* → complete(status) → 조립
 * </pre>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public final class PipelineRun {

    private final String runId;
    private final Map<String, Object> initialContext;
    private final SharedStateStore sharedState = new SharedStateStore();
    private final Map<ModuleId, ModuleExecution> executions = new LinkedHashMap<>();
    private final int waveCount;
    private final long startedAtNanos;

    private int wavesCompleted;
    private long finishedAtNanos;
    private RunStatus status;

    /**
     * 예약 키 없이 생성.
     *
     * @param runId 실행 ID
     * @param initialContext 초기 컨텍스트
     * @param waveCount 계획된 wave 수
     * @throws IllegalArgumentException runId가 null/blank이거나 waveCount가 음수인 경우
     */
    public PipelineRun(String runId, Map<String, Object> initialContext, int waveCount) {
        this(runId, initialContext, waveCount, Set.of());
    }

    /**
     * 생성자.
     *
     * <p>키 형식을 만족하는 초기 컨텍스트 항목은 Shared State에 미리 채워져 consumedKeys로 읽을 수 있습니다.
     * 단, reservedKeys에 있는 이름(등록된 모듈이 생산하는 키)은 채우지 않습니다.
     * 한 키의 생산자는 항상 하나입니다.</p>
     *
     * @param runId 실행 ID
     * @param initialContext 초기 컨텍스트
     * @param waveCount 계획된 wave 수
     * @param reservedKeys 모듈이 생산하는 키
     * @throws IllegalArgumentException runId가 null/blank이거나 waveCount가 음수인 경우
     */
    public PipelineRun(String runId, Map<String, Object> initialContext, int waveCount, Set<StateKey> reservedKeys) {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId cannot be null or blank");
        }
        if (waveCount < 0) {
            throw new IllegalArgumentException("waveCount cannot be negative");
        }
        if (reservedKeys == null) {
            throw new IllegalArgumentException("reservedKeys cannot be null");
        }
        this.runId = runId;
        this.initialContext = initialContext == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(initialContext));
        this.waveCount = waveCount;
        this.startedAtNanos = System.nanoTime();

        this.initialContext.forEach((name, value) -> {
            if (value != null && StateKey.isValid(name) && !reservedKeys.contains(StateKey.of(name))) {
                sharedState.set(StateKey.of(name), value);
            }
        });
    }

    /**
     * 모듈 실행 기록 추가.
     *
     * @param execution 실행 기록
     * @throws IllegalStateException 이미 기록된 모듈이거나 실행이 끝난 경우
     */
    public void record(ModuleExecution execution) {
        if (execution == null) {
            throw new IllegalArgumentException("execution cannot be null");
        }
        ensureOpen();
        if (executions.putIfAbsent(execution.moduleId(), execution) != null) {
            throw new IllegalStateException("Execution already recorded for module " + execution.moduleId());
        }
    }

    public void markWaveCompleted() {
        ensureOpen();
        wavesCompleted++;
    }

    /**
     * 실행 종료.
     *
     * @param finalStatus 최종 상태
     * @throws IllegalStateException 이미 종료된 경우
     */
    public void complete(RunStatus finalStatus) {
        if (finalStatus == null) {
            throw new IllegalArgumentException("finalStatus cannot be null");
        }
        ensureOpen();
        this.status = finalStatus;
        this.finishedAtNanos = System.nanoTime();
    }

    public boolean isCompleted() {
        return status != null;
    }

    public String runId() {
        return runId;
    }

    public Map<String, Object> initialContext() {
        return initialContext;
    }

    public SharedStateStore sharedState() {
        return sharedState;
    }

    /**
     * 기록 순서대로 실행 기록 조회.
     */
    public List<ModuleExecution> executions() {
        return List.copyOf(new ArrayList<>(executions.values()));
    }

    public Optional<ModuleExecution> execution(ModuleId moduleId) {
        return Optional.ofNullable(executions.get(moduleId));
    }

    public int waveCount() {
        return waveCount;
    }

    public int wavesCompleted() {
        return wavesCompleted;
    }

    /**
     * 최종 상태 조회.
     *
     * @return 상태 (종료 전이면 null)
     */
    public RunStatus status() {
        return status;
    }

    /**
     * 실행 시간 (종료 전이면 현재까지).
     */
    public long durationMs() {
        long end = status == null ? System.nanoTime() : finishedAtNanos;
        return (end - startedAtNanos) / 1_000_000;
    }

    private void ensureOpen() {
        if (status != null) {
            throw new IllegalStateException("Run " + runId + " is already completed with status " + status);
        }
    }
}
