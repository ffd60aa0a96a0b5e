package com.ryuqq.composer.application.orchestrator;

import com.ryuqq.composer.core.model.ModuleId;
import com.ryuqq.composer.core.model.StateKey;
import com.ryuqq.composer.core.status.ModuleStatus;
import com.ryuqq.composer.core.status.RunStatus;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PipelineResult 유닛 테스트.
 *
 * @author Composer Team
 * @since 1.0.0
 */
class PipelineResultTest {

    @Test
    void 거부_결과_생성() {
        // when
        PipelineResult result = PipelineResult.rejected("run-3", "unknown module 'ghost'");

        // then
        assertThat(result.getStatus()).isEqualTo(RunStatus.REJECTED);
        assertThat(result.getRejectionReasonOrNull()).isEqualTo("unknown module 'ghost'");
        assertThat(result.getArtifact()).isEmpty();
        assertThat(result.getMetadata().modules()).isEmpty();
        assertThat(result.getSharedStateSnapshot()).isEmpty();
    }

    @Test
    void of로_REJECTED_상태_생성_불가() {
        RunMetadata metadata = new RunMetadata("run-1", RunStatus.REJECTED, 0, 0, 0, List.of(), List.of(), 0);

        assertThatThrownBy(() -> PipelineResult.of("", metadata, Map.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void 정상_결과는_거부_사유가_없음() {
        // given
        ModuleExecution execution = ModuleExecution.success(ModuleId.of("a"), 1, 0, 0, 2, "A");
        RunMetadata metadata = new RunMetadata("run-1", RunStatus.COMPLETE, 1, 1, 2,
            List.of(execution), List.of(ModuleId.of("a")), 1);

        // when
        PipelineResult result = PipelineResult.of("A", metadata, Map.of(StateKey.of("k"), "v"));

        // then
        assertThat(result.getRejectionReasonOrNull()).isNull();
        assertThat(result.getStatus().isTrustworthy()).isTrue();
        assertThat(result.getMetadata().countByStatus(ModuleStatus.SUCCESS)).isEqualTo(1);
        assertThat(result.toString()).contains("run-1").contains("COMPLETE");
        assertThatThrownBy(() -> result.getSharedStateSnapshot().put(StateKey.of("x"), "y"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void 거부_사유는_필수() {
        assertThatThrownBy(() -> PipelineResult.rejected("run-1", " "))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
