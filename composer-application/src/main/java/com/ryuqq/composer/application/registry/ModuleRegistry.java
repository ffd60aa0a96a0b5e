package com.ryuqq.composer.application.registry;

import com.ryuqq.composer.core.contract.ContentModule;
import com.ryuqq.composer.core.contract.ModuleConfig;
import com.ryuqq.composer.core.exception.DuplicateKeyProducerException;
import com.ryuqq.composer.core.exception.MissingProducerDependencyException;
import com.ryuqq.composer.core.exception.ModuleInstantiationException;
import com.ryuqq.composer.core.exception.UnknownDependencyException;
import com.ryuqq.composer.core.model.ModuleDescriptor;
import com.ryuqq.composer.core.model.ModuleId;
import com.ryuqq.composer.core.model.StateKey;
import com.ryuqq.composer.core.plan.DependencyResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 모듈 기술자와 싱글톤 모듈 인스턴스 저장소.
 *
 * <p><strong>등록 시점 검증 (fail-fast):</strong></p>
 * <ul>
 *   <li>중복 모듈 ID → IllegalArgumentException</li>
 *   <li>같은 키를 두 모듈이 생산 → {@link DuplicateKeyProducerException}</li>
 *   <li>등록되지 않은 모듈에 의존 → {@link UnknownDependencyException}</li>
 *   <li>순환 의존성 → {@link com.ryuqq.composer.core.exception.CyclicDependencyException}</li>
 *   <li>소비 키의 생산자에 의존하지 않음 → {@link MissingProducerDependencyException}</li>
 * </ul>
 *
 * <p>검증에 실패하면 일괄 등록 전체가 거부되며, 레지스트리는 변경되지 않습니다.</p>
 *
 * <p><strong>인스턴스 관리:</strong> {@link #instance(ModuleId)}는 최초 호출 시 팩토리로 인스턴스를
 * 만들고 등록된 {@link ModuleConfig}로 {@link ContentModule#initialize(ModuleConfig)}를 호출한 뒤,
 * 이후 같은 인스턴스를 반환합니다. 동시 최초 접근에서도 생성과 초기화는 한 번만 일어납니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ModuleRegistry registry = new ModuleRegistry();
 * registry.register(ModuleDescriptor.of("expertise").withPriority(10), ExpertiseModule::new);
 * registry.registerAll(List.of(
 *     ModuleRegistration.of(ModuleDescriptor.of("categorisation").produces("category"), CategorisationModule::new),
 *     ModuleRegistration.of(ModuleDescriptor.of("ess_rules").dependsOn("categorisation").consumes("category"), EssRulesModule::new)
 * ));
 * </pre>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public final class ModuleRegistry {

    private static final Logger log = LoggerFactory.getLogger(ModuleRegistry.class);

    private final DependencyResolver resolver;

    // guarded by this
    private final Map<ModuleId, ModuleRegistration> registrations = new LinkedHashMap<>();
    private final Map<StateKey, ModuleId> producers = new HashMap<>();

    private final ConcurrentHashMap<ModuleId, ContentModule> instances = new ConcurrentHashMap<>();

    /**
     * 기본 DependencyResolver로 생성.
     */
    public ModuleRegistry() {
        this(new DependencyResolver());
    }

    /**
     * 생성자 (DependencyResolver 주입).
     *
     * @param resolver 순환 검증에 사용할 resolver
     * @throws IllegalArgumentException resolver가 null인 경우
     */
    public ModuleRegistry(DependencyResolver resolver) {
        if (resolver == null) {
            throw new IllegalArgumentException("resolver cannot be null");
        }
        this.resolver = resolver;
    }

    /**
     * 모듈 하나 등록.
     *
     * <p>의존 모듈은 이미 등록되어 있어야 합니다. 서로를 참조하는 모듈 묶음은
     * {@link #registerAll(List)}로 등록합니다.</p>
     *
     * @param descriptor 모듈 기술자
     * @param factory 모듈 팩토리
     */
    public void register(ModuleDescriptor descriptor, ModuleFactory factory) {
        registerAll(List.of(new ModuleRegistration(descriptor, factory)));
    }

    /**
     * 모듈 설정과 함께 하나 등록.
     *
     * @param descriptor 모듈 기술자
     * @param factory 모듈 팩토리
     * @param config 모듈 설정
     */
    public void register(ModuleDescriptor descriptor, ModuleFactory factory, ModuleConfig config) {
        registerAll(List.of(new ModuleRegistration(descriptor, factory, config)));
    }

    /**
     * 모듈 일괄 등록 (원자적).
     *
     * <p>묶음 안에서의 전방 참조를 허용하며, 기존 등록분과 합친 전체 그래프를 검증합니다.</p>
     *
     * @param batch 등록할 모듈 목록
     * @throws IllegalArgumentException batch가 null/빈 목록이거나 ID가 중복된 경우
     */
    public synchronized void registerAll(List<ModuleRegistration> batch) {
        if (batch == null || batch.isEmpty()) {
            throw new IllegalArgumentException("batch cannot be null or empty");
        }

        Map<ModuleId, ModuleDescriptor> merged = new LinkedHashMap<>();
        registrations.forEach((id, registration) -> merged.put(id, registration.descriptor()));
        Map<StateKey, ModuleId> mergedProducers = new HashMap<>(producers);

        for (ModuleRegistration registration : batch) {
            if (registration == null) {
                throw new IllegalArgumentException("batch cannot contain null registrations");
            }
            ModuleDescriptor descriptor = registration.descriptor();
            if (merged.putIfAbsent(descriptor.id(), descriptor) != null) {
                throw new IllegalArgumentException("Module '" + descriptor.id() + "' is already registered");
            }
            for (StateKey key : descriptor.producedKeys()) {
                ModuleId existing = mergedProducers.putIfAbsent(key, descriptor.id());
                if (existing != null) {
                    throw new DuplicateKeyProducerException(key, existing, descriptor.id());
                }
            }
        }

        for (ModuleRegistration registration : batch) {
            ModuleDescriptor descriptor = registration.descriptor();
            for (ModuleId dependency : descriptor.dependencies()) {
                if (!merged.containsKey(dependency) && !dependency.equals(descriptor.id())) {
                    throw new UnknownDependencyException(descriptor.id(), dependency);
                }
            }
        }

        resolver.resolve(merged.values());
        validateConsumers(merged, mergedProducers);

        for (ModuleRegistration registration : batch) {
            registrations.put(registration.descriptor().id(), registration);
        }
        producers.putAll(mergedProducers);

        log.info("Registered {} module(s), {} total", batch.size(), registrations.size());
    }

    /**
     * 싱글톤 모듈 인스턴스 조회 (지연 생성).
     *
     * @param id 모듈 ID
     * @return 모듈 인스턴스
     * @throws IllegalArgumentException 등록되지 않은 모듈인 경우
     * @throws ModuleInstantiationException 팩토리나 initialize가 실패하거나 팩토리가 null을 반환한 경우
     *         (다음 호출에서 재시도)
     */
    public ContentModule instance(ModuleId id) {
        ModuleRegistration registration = registration(id);
        return instances.computeIfAbsent(id, key -> create(key, registration));
    }

    /**
     * 등록된 모듈 설정 조회.
     *
     * @param id 모듈 ID
     * @return 모듈 설정 (없으면 빈 설정)
     * @throws IllegalArgumentException 등록되지 않은 모듈인 경우
     */
    public ModuleConfig config(ModuleId id) {
        return registration(id).config();
    }

    /**
     * 기술자 조회.
     *
     * @param id 모듈 ID
     * @return 기술자
     * @throws IllegalArgumentException 등록되지 않은 모듈인 경우
     */
    public ModuleDescriptor descriptor(ModuleId id) {
        return registration(id).descriptor();
    }

    /**
     * 등록 순서대로 모든 기술자 조회.
     */
    public synchronized List<ModuleDescriptor> descriptors() {
        List<ModuleDescriptor> result = new ArrayList<>(registrations.size());
        registrations.values().forEach(registration -> result.add(registration.descriptor()));
        return List.copyOf(result);
    }

    /**
     * 등록 순서 (0부터). 조립 단계의 마지막 정렬 기준으로 사용됩니다.
     *
     * @param id 모듈 ID
     * @return 등록 순서
     * @throws IllegalArgumentException 등록되지 않은 모듈인 경우
     */
    public synchronized int registrationOrder(ModuleId id) {
        int order = 0;
        for (ModuleId registered : registrations.keySet()) {
            if (registered.equals(id)) {
                return order;
            }
            order++;
        }
        throw new IllegalArgumentException("Module '" + id + "' is not registered");
    }

    /**
     * 우선순위 오름차순 (동률이면 ID 오름차순) 모듈 ID 목록.
     */
    public List<ModuleId> modulesByPriority() {
        return descriptors().stream()
            .sorted(Comparator.comparingInt(ModuleDescriptor::priority).thenComparing(ModuleDescriptor::id))
            .map(ModuleDescriptor::id)
            .toList();
    }

    public synchronized boolean contains(ModuleId id) {
        return registrations.containsKey(id);
    }

    public synchronized int size() {
        return registrations.size();
    }

    /**
     * 생산자 조회.
     *
     * @param key Shared State 키
     * @return 생산 모듈 ID 또는 null
     */
    public synchronized ModuleId producerOf(StateKey key) {
        return producers.get(key);
    }

    /**
     * 등록된 모듈이 생산하는 모든 키.
     *
     * @return 불변 키 집합
     */
    public synchronized Set<StateKey> producedKeys() {
        return Set.copyOf(producers.keySet());
    }

    private synchronized ModuleRegistration registration(ModuleId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        ModuleRegistration registration = registrations.get(id);
        if (registration == null) {
            throw new IllegalArgumentException("Module '" + id + "' is not registered");
        }
        return registration;
    }

    private ContentModule create(ModuleId id, ModuleRegistration registration) {
        ContentModule module;
        try {
            module = registration.factory().create();
        } catch (RuntimeException e) {
            log.error("Factory for module '{}' failed", id, e);
            throw new ModuleInstantiationException(id, e);
        }
        if (module == null) {
            throw new ModuleInstantiationException(id, new IllegalStateException("factory returned null"));
        }
        try {
            module.initialize(registration.config());
        } catch (RuntimeException e) {
            log.error("Initialization of module '{}' failed", id, e);
            throw new ModuleInstantiationException(id, e);
        }
        log.debug("Module '{}' instantiated: {} (config keys: {})",
            id, module.getClass().getName(), registration.config().values().keySet());
        return module;
    }

    private static void validateConsumers(Map<ModuleId, ModuleDescriptor> descriptors,
                                          Map<StateKey, ModuleId> producerIndex) {
        for (ModuleDescriptor consumer : descriptors.values()) {
            Set<ModuleId> ancestors = null;
            for (StateKey key : consumer.consumedKeys()) {
                ModuleId producer = producerIndex.get(key);
                if (producer == null || producer.equals(consumer.id())) {
                    continue;
                }
                if (ancestors == null) {
                    ancestors = ancestorsOf(consumer, descriptors);
                }
                if (!ancestors.contains(producer)) {
                    throw new MissingProducerDependencyException(consumer.id(), key, producer);
                }
            }
        }
    }

    private static Set<ModuleId> ancestorsOf(ModuleDescriptor start, Map<ModuleId, ModuleDescriptor> descriptors) {
        Set<ModuleId> visited = new HashSet<>();
        Deque<ModuleId> pending = new ArrayDeque<>(start.dependencies());
        while (!pending.isEmpty()) {
            ModuleId current = pending.pop();
            if (visited.add(current)) {
                ModuleDescriptor descriptor = descriptors.get(current);
                if (descriptor != null) {
                    pending.addAll(descriptor.dependencies());
                }
            }
        }
        return visited;
    }
}
