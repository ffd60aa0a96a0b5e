package com.ryuqq.composer.core.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Content Module 기술자 (불변 record).
 *
 * <p>프로세스 시작 시 정적 설정으로부터 한 번 생성되며, 이후 변경되지 않습니다.
 * 의존성 그래프와 Shared State 키 소유권은 모두 이 기술자에 선언된 내용만을 기준으로 검증됩니다.</p>
 *
 * <p><strong>필드:</strong></p>
 * <ul>
 *   <li>id: 모듈 식별자 (유일)</li>
 *   <li>priority: 출력 순서 (낮을수록 아티팩트 앞쪽에 배치)</li>
 *   <li>dependencies: 먼저 실행되어야 하는 모듈 ID 집합</li>
 *   <li>producedKeys: 이 모듈만 쓸 수 있는 Shared State 키</li>
 *   <li>consumedKeys: 이 모듈이 읽는 Shared State 키</li>
 *   <li>required: 실패 시 실행 전체를 PARTIAL_FAILURE로 만드는지 여부</li>
 *   <li>timeoutMs: 모듈별 타임아웃 (0이면 스케줄러 기본값 사용)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ModuleDescriptor descriptor = ModuleDescriptor.of("ess_rules")
 *     .withPriority(30)
 *     .dependsOn("semantic_categorisation")
 *     .consumes("ontological_category")
 *     .withRequired(true);
 * </pre>
 *
 * @param id 모듈 식별자
 * @param priority 출력 우선순위 (낮을수록 먼저 출력)
 * @param dependencies 의존 모듈 ID 집합
 * @param producedKeys 생산 키 집합
 * @param consumedKeys 소비 키 집합
 * @param required 필수 모듈 여부
 * @param timeoutMs 모듈 타임아웃 (밀리초, 0 = 기본값)
 *
 * @author Composer Team
 * @since 1.0.0
 */
public record ModuleDescriptor(
    ModuleId id,
    int priority,
    Set<ModuleId> dependencies,
    Set<StateKey> producedKeys,
    Set<StateKey> consumedKeys,
    boolean required,
    long timeoutMs
) {

    /**
     * 기본 우선순위.
     */
    public static final int DEFAULT_PRIORITY = 50;

    /**
     * Compact Constructor.
     *
     * <p>집합 필드는 정렬된 불변 복사본으로 보관되어 equals/hashCode가 안정적으로 유지됩니다.</p>
     *
     * @throws IllegalArgumentException id가 null이거나 timeoutMs가 음수인 경우
     */
    public ModuleDescriptor {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs cannot be negative (current: " + timeoutMs + ")");
        }
        dependencies = sortedCopy(dependencies);
        producedKeys = sortedCopy(producedKeys);
        consumedKeys = sortedCopy(consumedKeys);
    }

    /**
     * 의존성과 키 선언이 없는 기술자 생성.
     *
     * @param id 모듈 ID 값
     * @return ModuleDescriptor (priority=50, optional, 기본 타임아웃)
     * @throws IllegalArgumentException id가 유효하지 않은 경우
     */
    public static ModuleDescriptor of(String id) {
        return new ModuleDescriptor(ModuleId.of(id), DEFAULT_PRIORITY, Set.of(), Set.of(), Set.of(), false, 0);
    }

    /**
     * priority만 변경한 새 인스턴스 생성.
     */
    public ModuleDescriptor withPriority(int priority) {
        return new ModuleDescriptor(id, priority, dependencies, producedKeys, consumedKeys, required, timeoutMs);
    }

    /**
     * 의존 모듈을 추가한 새 인스턴스 생성.
     */
    public ModuleDescriptor dependsOn(String... moduleIds) {
        return withDependencies(union(dependencies, moduleIds, ModuleId::of));
    }

    /**
     * dependencies만 변경한 새 인스턴스 생성.
     */
    public ModuleDescriptor withDependencies(Set<ModuleId> dependencies) {
        return new ModuleDescriptor(id, priority, dependencies, producedKeys, consumedKeys, required, timeoutMs);
    }

    /**
     * 생산 키를 추가한 새 인스턴스 생성.
     */
    public ModuleDescriptor produces(String... keys) {
        return new ModuleDescriptor(id, priority, dependencies, union(producedKeys, keys, StateKey::of),
            consumedKeys, required, timeoutMs);
    }

    /**
     * 소비 키를 추가한 새 인스턴스 생성.
     */
    public ModuleDescriptor consumes(String... keys) {
        return new ModuleDescriptor(id, priority, dependencies, producedKeys,
            union(consumedKeys, keys, StateKey::of), required, timeoutMs);
    }

    /**
     * required만 변경한 새 인스턴스 생성.
     */
    public ModuleDescriptor withRequired(boolean required) {
        return new ModuleDescriptor(id, priority, dependencies, producedKeys, consumedKeys, required, timeoutMs);
    }

    /**
     * timeoutMs만 변경한 새 인스턴스 생성.
     */
    public ModuleDescriptor withTimeoutMs(long timeoutMs) {
        return new ModuleDescriptor(id, priority, dependencies, producedKeys, consumedKeys, required, timeoutMs);
    }

    /**
     * 선택된 모듈 집합 밖의 의존성을 제거한 기술자 반환.
     *
     * <p>일부 모듈만 실행할 때, 선택되지 않은 모듈에 대한 의존성은 "건너뛴 생산자"로 취급됩니다.</p>
     *
     * @param selected 이번 실행에 선택된 모듈 ID 집합
     * @return 의존성이 선택 집합으로 제한된 기술자 (변경이 없으면 this)
     */
    public ModuleDescriptor restrictTo(Set<ModuleId> selected) {
        if (selected.containsAll(dependencies)) {
            return this;
        }
        SortedSet<ModuleId> kept = new TreeSet<>(dependencies);
        kept.retainAll(selected);
        return withDependencies(kept);
    }

    /**
     * 이 모듈이 주어진 키를 생산하는지 확인.
     *
     * @param key Shared State 키
     * @return 생산 키로 선언된 경우 true
     */
    public boolean producesKey(StateKey key) {
        return producedKeys.contains(key);
    }

    /**
     * 이 모듈이 주어진 키를 소비하는지 확인.
     *
     * @param key Shared State 키
     * @return 소비 키로 선언된 경우 true
     */
    public boolean consumesKey(StateKey key) {
        return consumedKeys.contains(key);
    }

    private static <T extends Comparable<T>> Set<T> sortedCopy(Collection<T> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptySortedSet();
        }
        for (T element : source) {
            if (element == null) {
                throw new IllegalArgumentException("descriptor sets cannot contain null elements");
            }
        }
        return Collections.unmodifiableSortedSet(new TreeSet<>(source));
    }

    private static <T extends Comparable<T>> Set<T> union(Set<T> current, String[] values, Function<String, T> factory) {
        SortedSet<T> merged = new TreeSet<>(current);
        Arrays.stream(values).map(factory).forEach(merged::add);
        return merged;
    }
}
