package com.ryuqq.composer.core.plan;

import com.ryuqq.composer.core.exception.CyclicDependencyException;
import com.ryuqq.composer.core.exception.UnknownDependencyException;
import com.ryuqq.composer.core.model.ModuleDescriptor;
import com.ryuqq.composer.core.model.ModuleId;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DependencyResolver 테스트.
 *
 * <p>wave 계산, 순환 감지, 계획 메모이제이션을 검증합니다.</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
class DependencyResolverTest {

    private final DependencyResolver resolver = new DependencyResolver();

    // ========== wave 계산 ==========

    @Test
    void resolve_LinearChain_OneModulePerWave() {
        // Given
        List<ModuleDescriptor> descriptors = List.of(
            ModuleDescriptor.of("E").dependsOn("D"),
            ModuleDescriptor.of("D").dependsOn("C"),
            ModuleDescriptor.of("C").dependsOn("B"),
            ModuleDescriptor.of("B").dependsOn("A"),
            ModuleDescriptor.of("A")
        );

        // When
        WavePlan plan = resolver.resolve(descriptors);

        // Then
        assertEquals(List.of(ids("A"), ids("B"), ids("C"), ids("D"), ids("E")), plan.waves());
        assertEquals(5, plan.waveCount());
    }

    @Test
    void resolve_Diamond_JoinsInSecondWave() {
        // Given
        List<ModuleDescriptor> descriptors = List.of(
            ModuleDescriptor.of("Z").dependsOn("X", "Y"),
            ModuleDescriptor.of("Y"),
            ModuleDescriptor.of("X")
        );

        // When
        WavePlan plan = resolver.resolve(descriptors);

        // Then
        assertEquals(List.of(ids("X", "Y"), ids("Z")), plan.waves());
        assertEquals(1, plan.waveOf(ModuleId.of("Z")));
    }

    @Test
    void resolve_NoDependencies_CollapsesToSingleWave() {
        // Given
        List<ModuleDescriptor> descriptors = List.of(
            ModuleDescriptor.of("context"),
            ModuleDescriptor.of("essentie"),
            ModuleDescriptor.of("structure"),
            ModuleDescriptor.of("rules")
        );

        // When
        WavePlan plan = resolver.resolve(descriptors);

        // Then
        assertEquals(1, plan.waveCount());
        assertEquals(4, plan.moduleCount());
    }

    @Test
    void resolve_WithinWave_OrdersByPriorityThenId() {
        // Given
        List<ModuleDescriptor> descriptors = List.of(
            ModuleDescriptor.of("b").withPriority(10),
            ModuleDescriptor.of("c").withPriority(90),
            ModuleDescriptor.of("a").withPriority(10)
        );

        // When
        WavePlan plan = resolver.resolve(descriptors);

        // Then
        assertEquals(List.of(ids("c", "a", "b")), plan.waves());
    }

    @Test
    void resolve_RandomGraphs_DependenciesAlwaysInEarlierWave() {
        Random random = new Random(42);
        for (int round = 0; round < 20; round++) {
            // Given: 각 모듈은 자신보다 앞선 모듈에만 의존 (DAG 보장)
            List<ModuleDescriptor> descriptors = new ArrayList<>();
            for (int i = 0; i < 12; i++) {
                ModuleDescriptor descriptor = ModuleDescriptor.of("m" + i).withPriority(random.nextInt(100));
                for (int j = 0; j < i; j++) {
                    if (random.nextInt(4) == 0) {
                        descriptor = descriptor.dependsOn("m" + j);
                    }
                }
                descriptors.add(descriptor);
            }

            // When
            WavePlan plan = resolver.resolve(descriptors);

            // Then
            assertEquals(descriptors.size(), plan.moduleCount());
            for (ModuleDescriptor descriptor : descriptors) {
                for (ModuleId dependency : descriptor.dependencies()) {
                    assertTrue(plan.waveOf(dependency) < plan.waveOf(descriptor.id()),
                        dependency + " must run before " + descriptor.id());
                }
            }
        }
    }

    @Test
    void resolve_EmptyInput_ReturnsEmptyPlan() {
        WavePlan plan = resolver.resolve(List.of());

        assertEquals(0, plan.waveCount());
    }

    // ========== 오류 ==========

    @Test
    void resolve_ThreeNodeCycle_ReportsCycleMembers() {
        // Given
        List<ModuleDescriptor> descriptors = List.of(
            ModuleDescriptor.of("A").dependsOn("B"),
            ModuleDescriptor.of("B").dependsOn("C"),
            ModuleDescriptor.of("C").dependsOn("A")
        );

        // When
        CyclicDependencyException exception = assertThrows(
            CyclicDependencyException.class,
            () -> resolver.resolve(descriptors)
        );

        // Then
        assertEquals(ids("A", "B", "C"), exception.cycle());
        assertEquals(ids("A", "B", "C"), exception.unresolved());
    }

    @Test
    void resolve_ModuleBehindCycle_UnresolvedButNotInCycle() {
        // Given
        List<ModuleDescriptor> descriptors = List.of(
            ModuleDescriptor.of("root"),
            ModuleDescriptor.of("A").dependsOn("B", "root"),
            ModuleDescriptor.of("B").dependsOn("C"),
            ModuleDescriptor.of("C").dependsOn("A"),
            ModuleDescriptor.of("D").dependsOn("A")
        );

        // When
        CyclicDependencyException exception = assertThrows(
            CyclicDependencyException.class,
            () -> resolver.resolve(descriptors)
        );

        // Then
        assertEquals(ids("A", "B", "C"), exception.cycle());
        assertEquals(ids("A", "B", "C", "D"), exception.unresolved());
    }

    @Test
    void resolve_SelfDependency_IsCycle() {
        CyclicDependencyException exception = assertThrows(
            CyclicDependencyException.class,
            () -> resolver.resolve(List.of(ModuleDescriptor.of("self").dependsOn("self")))
        );

        assertEquals(ids("self"), exception.cycle());
    }

    @Test
    void resolve_UnknownDependency_ThrowsException() {
        // When
        UnknownDependencyException exception = assertThrows(
            UnknownDependencyException.class,
            () -> resolver.resolve(List.of(ModuleDescriptor.of("structure").dependsOn("ghost")))
        );

        // Then
        assertEquals(ModuleId.of("structure"), exception.module());
        assertEquals(ModuleId.of("ghost"), exception.missingDependency());
    }

    @Test
    void resolve_DuplicateIds_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> resolver.resolve(List.of(ModuleDescriptor.of("a"), ModuleDescriptor.of("a").withPriority(1))));
    }

    // ========== 메모이제이션 ==========

    @Test
    void resolve_SameDescriptors_ReusesPlan() {
        // Given
        List<ModuleDescriptor> descriptors = List.of(
            ModuleDescriptor.of("X"),
            ModuleDescriptor.of("Z").dependsOn("X")
        );

        // When
        WavePlan first = resolver.resolve(descriptors);
        WavePlan second = resolver.resolve(List.of(descriptors.get(1), descriptors.get(0)));

        // Then
        assertSame(first, second);
        assertEquals(1, resolver.cachedPlanCount());
    }

    @Test
    void resolve_ChangedDescriptor_ComputesNewPlan() {
        // Given
        resolver.resolve(List.of(ModuleDescriptor.of("X"), ModuleDescriptor.of("Y")));

        // When
        WavePlan plan = resolver.resolve(List.of(ModuleDescriptor.of("X"), ModuleDescriptor.of("Y").dependsOn("X")));

        // Then
        assertEquals(2, plan.waveCount());
        assertEquals(2, resolver.cachedPlanCount());

        resolver.clearCache();
        assertEquals(0, resolver.cachedPlanCount());
    }

    @Test
    void resolve_ManyDistinctSubsets_MemoStaysBounded() {
        // Given
        DependencyResolver bounded = new DependencyResolver(3);

        // When
        for (int i = 0; i < 50; i++) {
            bounded.resolve(List.of(ModuleDescriptor.of("base"), ModuleDescriptor.of("m" + i).dependsOn("base")));
        }

        // Then
        assertEquals(3, bounded.cachedPlanCount());
    }

    @Test
    void resolve_BoundedMemo_EvictsLeastRecentlyUsed() {
        // Given
        DependencyResolver bounded = new DependencyResolver(2);
        List<ModuleDescriptor> first = List.of(ModuleDescriptor.of("a"));
        List<ModuleDescriptor> second = List.of(ModuleDescriptor.of("b"));
        WavePlan firstPlan = bounded.resolve(first);
        bounded.resolve(second);

        // When
        bounded.resolve(first);
        bounded.resolve(List.of(ModuleDescriptor.of("c")));

        // Then
        assertSame(firstPlan, bounded.resolve(first));
        assertEquals(2, bounded.cachedPlanCount());
    }

    @Test
    void resolve_ZeroMemoSize_NeverCaches() {
        // Given
        DependencyResolver uncached = new DependencyResolver(0);

        // When
        WavePlan plan = uncached.resolve(List.of(ModuleDescriptor.of("a")));

        // Then
        assertEquals(1, plan.waveCount());
        assertEquals(0, uncached.cachedPlanCount());
    }

    @Test
    void constructor_NegativeMemoSize_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new DependencyResolver(-1));
        assertEquals(DependencyResolver.DEFAULT_MAX_CACHED_PLANS, new DependencyResolver().getMaxCachedPlans());
    }

    private static List<ModuleId> ids(String... values) {
        List<ModuleId> ids = new ArrayList<>();
        for (String value : values) {
            ids.add(ModuleId.of(value));
        }
        return ids;
    }
}
