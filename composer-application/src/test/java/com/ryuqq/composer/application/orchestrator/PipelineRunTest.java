package com.ryuqq.composer.application.orchestrator;

import com.ryuqq.composer.core.model.ModuleId;
import com.ryuqq.composer.core.model.StateKey;
import com.ryuqq.composer.core.status.RunStatus;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PipelineRun 유닛 테스트.
 *
 * @author Composer Team
 * @since 1.0.0
 */
class PipelineRunTest {

    @Test
    void 유효한_이름의_초기_컨텍스트만_Shared_State에_시딩() {
        // given
        Map<String, Object> initialContext = new HashMap<>();
        initialContext.put("term", "verzekerde");
        initialContext.put("not a key", "ignored");
        initialContext.put("empty", null);

        // when
        PipelineRun run = new PipelineRun("run-1", initialContext, 1);

        // then
        assertThat(run.sharedState().snapshot()).containsOnlyKeys(StateKey.of("term"));
        assertThat(run.initialContext()).containsKey("not a key");
    }

    @Test
    void 모듈이_생산하는_키는_초기_컨텍스트로_시딩하지_않음() {
        // given
        Map<String, Object> initialContext = Map.of("term", "verzekerde", "context.domain", "pensioen");

        // when
        PipelineRun run = new PipelineRun("run-1", initialContext, 1, Set.of(StateKey.of("context.domain")));

        // then
        assertThat(run.sharedState().snapshot()).containsOnlyKeys(StateKey.of("term"));
        assertThat(run.initialContext()).containsEntry("context.domain", "pensioen");
    }

    @Test
    void 실행_기록은_기록_순서_유지() {
        // given
        PipelineRun run = new PipelineRun("run-1", null, 1);

        // when
        run.record(ModuleExecution.success(ModuleId.of("b"), 1, 0, 1, 1, "B"));
        run.record(ModuleExecution.success(ModuleId.of("a"), 1, 0, 0, 1, "A"));

        // then
        assertThat(run.executions()).extracting(ModuleExecution::moduleId)
            .containsExactly(ModuleId.of("b"), ModuleId.of("a"));
        assertThat(run.execution(ModuleId.of("a"))).isPresent();
        assertThat(run.execution(ModuleId.of("z"))).isEmpty();
    }

    @Test
    void 같은_모듈_중복_기록시_예외() {
        PipelineRun run = new PipelineRun("run-1", Map.of(), 1);
        run.record(ModuleExecution.notRun(ModuleId.of("a"), 1, 0, 0));

        assertThatThrownBy(() -> run.record(ModuleExecution.notRun(ModuleId.of("a"), 1, 0, 0)))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void 종료_후_변경시_예외() {
        // given
        PipelineRun run = new PipelineRun("run-1", Map.of(), 1);
        run.markWaveCompleted();
        run.complete(RunStatus.COMPLETE);

        // when & then
        assertThat(run.isCompleted()).isTrue();
        assertThat(run.status()).isEqualTo(RunStatus.COMPLETE);
        assertThat(run.wavesCompleted()).isEqualTo(1);
        assertThatThrownBy(() -> run.complete(RunStatus.CANCELLED)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(run::markWaveCompleted).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> run.record(ModuleExecution.notRun(ModuleId.of("a"), 1, 0, 0)))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void 잘못된_생성_인자_거부() {
        assertThatThrownBy(() -> new PipelineRun(" ", Map.of(), 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PipelineRun("run-1", Map.of(), -1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PipelineRun("run-1", Map.of(), 1, null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void 실행_시간은_음수가_아님() {
        PipelineRun run = new PipelineRun("run-1", Map.of(), 0);
        run.complete(RunStatus.COMPLETE);

        assertThat(run.durationMs()).isGreaterThanOrEqualTo(0);
    }
}
