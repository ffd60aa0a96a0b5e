package com.ryuqq.composer.core.exception;

import com.ryuqq.composer.core.model.ModuleId;

import java.util.List;

/**
 * 순환 의존성 감지.
 *
 * <p>{@link #cycle()}은 순환에 직접 참여하는 모듈만, {@link #unresolved()}는
 * in-degree가 0이 되지 못한 모든 모듈(순환 뒤에 매달린 모듈 포함)을 담습니다.
 * 두 목록 모두 ID 오름차순으로 정렬되어 결과가 결정적입니다.</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public class CyclicDependencyException extends PipelineConfigurationException {

    private final List<ModuleId> cycle;
    private final List<ModuleId> unresolved;

    public CyclicDependencyException(List<ModuleId> cycle, List<ModuleId> unresolved) {
        super("Cyclic dependency detected: cycle=" + cycle + ", unresolved=" + unresolved);
        this.cycle = List.copyOf(cycle);
        this.unresolved = List.copyOf(unresolved);
    }

    /**
     * 순환에 참여하는 모듈 ID (정렬됨).
     *
     * @return 순환 모듈 목록
     */
    public List<ModuleId> cycle() {
        return cycle;
    }

    /**
     * 해소되지 못한 모든 모듈 ID (정렬됨).
     *
     * @return 미해소 모듈 목록
     */
    public List<ModuleId> unresolved() {
        return unresolved;
    }
}
