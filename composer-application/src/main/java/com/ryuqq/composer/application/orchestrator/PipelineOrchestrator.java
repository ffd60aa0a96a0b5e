package com.ryuqq.composer.application.orchestrator;

import java.util.Map;
import java.util.Set;

/**
 * 파이프라인 실행 조정자 인터페이스.
 *
 * <p>선택된 모듈 집합을 wave 단위로 실행하고, 출력을 하나의 아티팩트로 조립하여 반환합니다.</p>
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * 1. 요청 검증 (모듈 ID, 종료 여부) → 유효하지 않으면 REJECTED
 * 2. 선택된 기술자로 wave 계획 계산 (메모이즈)
 * 3. wave 순차 실행, wave 내부는 worker pool에서 동시 실행
 * 4. wave barrier 이후 출력의 writes를 Shared State에 적용
 * 5. 출력 조립 → PipelineResult
 * </pre>
 *
 * <p><strong>예외 정책:</strong> 모듈 오류는 실행 결과의 상태로 표현되며,
 * 이 인터페이스의 메서드는 모듈 오류로 인해 예외를 던지지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * PipelineResult result = orchestrator.runPipeline(
 *     Set.of("context_awareness", "ess_rules", "definition_task"),
 *     Map.of("term", "vergunning"));
 *
 * if (result.getStatus().isTrustworthy()) {
 *     textGenerator.generate(result.getArtifact());
 * }
 * </pre>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public interface PipelineOrchestrator {

    /**
     * 선택된 모듈로 파이프라인 실행.
     *
     * @param moduleSet 실행할 모듈 ID 집합
     * @param initialContext 초기 컨텍스트 (예: term, context)
     * @return 실행 결과 (REJECTED 포함, null 반환 금지)
     */
    PipelineResult runPipeline(Set<String> moduleSet, Map<String, Object> initialContext);

    /**
     * 등록된 모든 모듈로 파이프라인 실행.
     *
     * @param initialContext 초기 컨텍스트
     * @return 실행 결과
     */
    PipelineResult runPipeline(Map<String, Object> initialContext);
}
