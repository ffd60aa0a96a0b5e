package com.ryuqq.composer.application.assembly;

import com.ryuqq.composer.application.orchestrator.ModuleExecution;
import com.ryuqq.composer.application.orchestrator.PipelineResult;
import com.ryuqq.composer.application.orchestrator.PipelineRun;
import com.ryuqq.composer.application.orchestrator.RunMetadata;
import com.ryuqq.composer.core.model.ModuleId;
import com.ryuqq.composer.core.status.ModuleStatus;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 모듈 출력을 하나의 아티팩트로 조립.
 *
 * <p><strong>조립 규칙:</strong></p>
 * <ul>
 *   <li>SUCCESS 모듈의 출력만 포함 (placeholder 옵션이 켜져 있으면 FAILURE/TIMEOUT도 자리표시)</li>
 *   <li>정렬: 우선순위 오름차순 → wave 인덱스 → 등록 순서</li>
 *   <li>구분자: 빈 줄 하나 ("\n\n")</li>
 *   <li>빈 출력은 구분자도 추가하지 않음</li>
 * </ul>
 *
 * <p>정렬 기준이 실행 타이밍에 의존하지 않으므로 같은 입력은 항상 같은 아티팩트를 만듭니다.</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public final class ContentAssembler {

    /**
     * 출력 사이 구분자.
     */
    public static final String SEPARATOR = "\n\n";

    static final Comparator<ModuleExecution> ASSEMBLY_ORDER = Comparator
        .comparingInt(ModuleExecution::priority)
        .thenComparingInt(ModuleExecution::wave)
        .thenComparingInt(ModuleExecution::registrationOrder);

    private final boolean includeFailurePlaceholders;

    /**
     * placeholder 없이 생성.
     */
    public ContentAssembler() {
        this(false);
    }

    /**
     * 생성자.
     *
     * @param includeFailurePlaceholders 실패 모듈 자리표시 포함 여부
     */
    public ContentAssembler(boolean includeFailurePlaceholders) {
        this.includeFailurePlaceholders = includeFailurePlaceholders;
    }

    /**
     * 아티팩트 조립.
     *
     * @param run 종료된 실행
     * @return PipelineResult
     * @throws IllegalArgumentException run이 null인 경우
     * @throws IllegalStateException run이 아직 종료되지 않은 경우
     */
    public PipelineResult assemble(PipelineRun run) {
        if (run == null) {
            throw new IllegalArgumentException("run cannot be null");
        }
        if (!run.isCompleted()) {
            throw new IllegalStateException("Run " + run.runId() + " is not completed yet");
        }

        List<ModuleExecution> ordered = new ArrayList<>(run.executions());
        ordered.sort(ASSEMBLY_ORDER);

        StringBuilder artifact = new StringBuilder();
        List<ModuleId> contributing = new ArrayList<>();
        for (ModuleExecution execution : ordered) {
            String piece = pieceOf(execution);
            if (piece == null || piece.isBlank()) {
                continue;
            }
            if (artifact.length() > 0) {
                artifact.append(SEPARATOR);
            }
            artifact.append(piece);
            if (execution.isSuccess()) {
                contributing.add(execution.moduleId());
            }
        }

        String text = artifact.toString();
        RunMetadata metadata = new RunMetadata(
            run.runId(),
            run.status(),
            run.waveCount(),
            run.wavesCompleted(),
            run.durationMs(),
            run.executions(),
            contributing,
            text.length()
        );
        return PipelineResult.of(text, metadata, run.sharedState().snapshot());
    }

    public boolean isIncludeFailurePlaceholders() {
        return includeFailurePlaceholders;
    }

    /**
     * 실패 모듈 자리표시 문자열.
     *
     * @param execution 실패한 실행 기록
     * @return "[module &lt;id&gt; unavailable: &lt;kind&gt;]"
     */
    static String placeholder(ModuleExecution execution) {
        Object kind = execution.errorKind() != null ? execution.errorKind() : execution.status();
        return "[module " + execution.moduleId() + " unavailable: " + kind + "]";
    }

    private String pieceOf(ModuleExecution execution) {
        if (execution.status() == ModuleStatus.SUCCESS) {
            return execution.content();
        }
        if (includeFailurePlaceholders && execution.status().isFailure()) {
            return placeholder(execution);
        }
        return null;
    }
}
