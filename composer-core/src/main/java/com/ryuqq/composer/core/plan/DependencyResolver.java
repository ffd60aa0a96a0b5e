package com.ryuqq.composer.core.plan;

import com.ryuqq.composer.core.exception.CyclicDependencyException;
import com.ryuqq.composer.core.exception.UnknownDependencyException;
import com.ryuqq.composer.core.model.ModuleDescriptor;
import com.ryuqq.composer.core.model.ModuleId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 모듈 기술자 집합을 wave 계획으로 위상 정렬.
 *
 * <p><strong>알고리즘 (Kahn):</strong></p>
 * <ol>
 *   <li>의존성 간선으로 모듈별 in-degree 계산</li>
 *   <li>in-degree 0인 모듈로 첫 wave 구성</li>
 *   <li>wave의 각 모듈에 대해 dependent의 in-degree 감소</li>
 *   <li>새로 0이 된 모듈로 다음 wave 구성, 반복</li>
 *   <li>0이 되지 못한 모듈이 남으면 {@link CyclicDependencyException}</li>
 * </ol>
 *
 * <p><strong>결정성:</strong> wave 내부는 우선순위 내림차순 → ID 오름차순으로 정렬합니다.</p>
 *
 * <p><strong>메모이제이션:</strong> 계획은 기술자 집합의 순수 함수이므로 같은 집합에 대해서는
 * 이전에 계산한 계획을 재사용합니다. 실패한 해석은 캐시하지 않습니다.
 * 호출자가 고르는 부분 집합마다 계획이 생기므로 보관 수는 {@code maxCachedPlans}로 제한하며,
 * 넘치면 가장 오래 사용하지 않은 계획부터 버립니다 (LRU).</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public final class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    static final Comparator<ModuleDescriptor> DISPATCH_ORDER =
        Comparator.comparingInt(ModuleDescriptor::priority).reversed()
            .thenComparing(ModuleDescriptor::id);

    public static final int DEFAULT_MAX_CACHED_PLANS = 64;

    private final int maxCachedPlans;

    // guarded by itself, access order
    private final LinkedHashMap<Set<ModuleDescriptor>, WavePlan> plans;

    /**
     * 기본 메모 크기({@value #DEFAULT_MAX_CACHED_PLANS})로 생성.
     */
    public DependencyResolver() {
        this(DEFAULT_MAX_CACHED_PLANS);
    }

    /**
     * 생성자.
     *
     * @param maxCachedPlans 보관할 최대 계획 수 (0이면 메모이즈하지 않음)
     * @throws IllegalArgumentException maxCachedPlans가 음수인 경우
     */
    public DependencyResolver(int maxCachedPlans) {
        if (maxCachedPlans < 0) {
            throw new IllegalArgumentException("maxCachedPlans cannot be negative (current: " + maxCachedPlans + ")");
        }
        this.maxCachedPlans = maxCachedPlans;
        this.plans = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Set<ModuleDescriptor>, WavePlan> eldest) {
                return size() > DependencyResolver.this.maxCachedPlans;
            }
        };
    }

    /**
     * wave 계획 계산.
     *
     * @param descriptors 전체 기술자 집합
     * @return wave 계획
     * @throws IllegalArgumentException descriptors가 null이거나 같은 ID가 중복된 경우
     * @throws UnknownDependencyException 집합에 없는 모듈에 의존하는 경우
     * @throws CyclicDependencyException 순환 의존성이 있는 경우
     */
    public WavePlan resolve(Collection<ModuleDescriptor> descriptors) {
        if (descriptors == null) {
            throw new IllegalArgumentException("descriptors cannot be null");
        }
        for (ModuleDescriptor descriptor : descriptors) {
            if (descriptor == null) {
                throw new IllegalArgumentException("descriptors cannot contain null");
            }
        }
        Set<ModuleDescriptor> key = Set.copyOf(descriptors);
        synchronized (plans) {
            WavePlan cached = plans.get(key);
            if (cached != null) {
                return cached;
            }
        }

        WavePlan plan = computePlan(descriptors);
        synchronized (plans) {
            WavePlan previous = plans.putIfAbsent(key, plan);
            return previous != null ? previous : plan;
        }
    }

    /**
     * 메모이즈된 계획 수.
     */
    public int cachedPlanCount() {
        synchronized (plans) {
            return plans.size();
        }
    }

    public int getMaxCachedPlans() {
        return maxCachedPlans;
    }

    /**
     * 메모이즈된 계획 제거.
     */
    public void clearCache() {
        synchronized (plans) {
            plans.clear();
        }
    }

    private WavePlan computePlan(Collection<ModuleDescriptor> descriptors) {
        Map<ModuleId, ModuleDescriptor> byId = new LinkedHashMap<>();
        for (ModuleDescriptor descriptor : descriptors) {
            if (descriptor == null) {
                throw new IllegalArgumentException("descriptors cannot contain null");
            }
            if (byId.put(descriptor.id(), descriptor) != null) {
                throw new IllegalArgumentException("Duplicate module id: " + descriptor.id());
            }
        }

        Map<ModuleId, Integer> inDegree = new HashMap<>();
        Map<ModuleId, List<ModuleId>> dependents = new HashMap<>();
        for (ModuleDescriptor descriptor : byId.values()) {
            for (ModuleId dependency : descriptor.dependencies()) {
                if (!byId.containsKey(dependency)) {
                    throw new UnknownDependencyException(descriptor.id(), dependency);
                }
                dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(descriptor.id());
            }
            inDegree.put(descriptor.id(), descriptor.dependencies().size());
        }

        List<List<ModuleId>> waves = new ArrayList<>();
        List<ModuleDescriptor> ready = new ArrayList<>();
        for (ModuleDescriptor descriptor : byId.values()) {
            if (inDegree.get(descriptor.id()) == 0) {
                ready.add(descriptor);
            }
        }

        int resolved = 0;
        while (!ready.isEmpty()) {
            ready.sort(DISPATCH_ORDER);
            List<ModuleId> wave = ready.stream().map(ModuleDescriptor::id).toList();
            waves.add(wave);
            resolved += wave.size();

            List<ModuleDescriptor> next = new ArrayList<>();
            for (ModuleId id : wave) {
                for (ModuleId dependent : dependents.getOrDefault(id, List.of())) {
                    int remaining = inDegree.merge(dependent, -1, Integer::sum);
                    if (remaining == 0) {
                        next.add(byId.get(dependent));
                    }
                }
            }
            ready = next;
        }

        if (resolved != byId.size()) {
            Set<ModuleId> unresolved = new TreeSet<>();
            inDegree.forEach((id, degree) -> {
                if (degree > 0) {
                    unresolved.add(id);
                }
            });
            List<ModuleId> cycle = new CycleFinder(byId, unresolved).members();
            log.warn("Dependency resolution failed: cycle={}, unresolved={}", cycle, unresolved);
            throw new CyclicDependencyException(cycle, new ArrayList<>(unresolved));
        }

        log.debug("Wave plan resolved: {} waves for {} modules", waves.size(), byId.size());
        return new WavePlan(waves);
    }

    /**
     * 미해소 부분 그래프에서 순환에 참여하는 노드 탐색 (Tarjan SCC).
     *
     * <p>크기 2 이상의 SCC와 자기 자신에 의존하는 노드만 순환 멤버입니다.
     * 순환 뒤에 매달려 있을 뿐인 노드는 제외됩니다.</p>
     */
    private static final class CycleFinder {

        private final Map<ModuleId, ModuleDescriptor> byId;
        private final Set<ModuleId> nodes;
        private final Map<ModuleId, Integer> index = new HashMap<>();
        private final Map<ModuleId, Integer> lowLink = new HashMap<>();
        private final Deque<ModuleId> stack = new ArrayDeque<>();
        private final Set<ModuleId> onStack = new HashSet<>();
        private final Set<ModuleId> members = new TreeSet<>();
        private int counter;

        CycleFinder(Map<ModuleId, ModuleDescriptor> byId, Set<ModuleId> nodes) {
            this.byId = byId;
            this.nodes = nodes;
        }

        List<ModuleId> members() {
            for (ModuleId node : nodes) {
                if (!index.containsKey(node)) {
                    connect(node);
                }
            }
            return new ArrayList<>(members);
        }

        private void connect(ModuleId node) {
            index.put(node, counter);
            lowLink.put(node, counter);
            counter++;
            stack.push(node);
            onStack.add(node);

            for (ModuleId next : byId.get(node).dependencies()) {
                if (!nodes.contains(next)) {
                    continue;
                }
                if (!index.containsKey(next)) {
                    connect(next);
                    lowLink.put(node, Math.min(lowLink.get(node), lowLink.get(next)));
                } else if (onStack.contains(next)) {
                    lowLink.put(node, Math.min(lowLink.get(node), index.get(next)));
                }
            }

            if (lowLink.get(node).equals(index.get(node))) {
                List<ModuleId> component = new ArrayList<>();
                ModuleId popped;
                do {
                    popped = stack.pop();
                    onStack.remove(popped);
                    component.add(popped);
                } while (!popped.equals(node));

                boolean selfLoop = byId.get(node).dependencies().contains(node);
                if (component.size() > 1 || selfLoop) {
                    members.addAll(component);
                }
            }
        }
    }
}
