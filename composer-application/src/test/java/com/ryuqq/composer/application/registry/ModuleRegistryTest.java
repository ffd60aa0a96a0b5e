package com.ryuqq.composer.application.registry;

import com.ryuqq.composer.core.contract.ContentModule;
import com.ryuqq.composer.core.contract.ModuleConfig;
import com.ryuqq.composer.core.contract.ModuleContext;
import com.ryuqq.composer.core.contract.ModuleOutput;
import com.ryuqq.composer.core.exception.CyclicDependencyException;
import com.ryuqq.composer.core.exception.DuplicateKeyProducerException;
import com.ryuqq.composer.core.exception.MissingProducerDependencyException;
import com.ryuqq.composer.core.exception.ModuleInstantiationException;
import com.ryuqq.composer.core.exception.UnknownDependencyException;
import com.ryuqq.composer.core.model.ModuleDescriptor;
import com.ryuqq.composer.core.model.ModuleId;
import com.ryuqq.composer.core.model.StateKey;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ModuleRegistry 유닛 테스트.
 *
 * @author Composer Team
 * @since 1.0.0
 */
class ModuleRegistryTest {

    private static final ModuleFactory NOOP = () -> context -> ModuleOutput.success("");

    private final ModuleRegistry registry = new ModuleRegistry();
    private ExecutorService executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    // ========================================
    // 등록 검증
    // ========================================

    @Test
    void 등록_성공시_descriptor_조회_가능() {
        // given
        ModuleDescriptor context = ModuleDescriptor.of("context").produces("context.domain");

        // when
        registry.register(context, NOOP);

        // then
        assertThat(registry.contains(ModuleId.of("context"))).isTrue();
        assertThat(registry.descriptor(ModuleId.of("context"))).isEqualTo(context);
        assertThat(registry.producerOf(StateKey.of("context.domain"))).isEqualTo(ModuleId.of("context"));
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void 중복_ID_등록시_예외() {
        // given
        registry.register(ModuleDescriptor.of("context"), NOOP);

        // when & then
        assertThatThrownBy(() -> registry.register(ModuleDescriptor.of("context").withPriority(1), NOOP))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("already registered");
    }

    @Test
    void 같은_키를_두_모듈이_생산하면_예외() {
        // given
        registry.register(ModuleDescriptor.of("context").produces("term"), NOOP);

        // when & then
        assertThatThrownBy(() -> registry.register(ModuleDescriptor.of("essentie").produces("term"), NOOP))
            .isInstanceOfSatisfying(DuplicateKeyProducerException.class, e -> {
                assertThat(e.key()).isEqualTo(StateKey.of("term"));
                assertThat(e.existingProducer()).isEqualTo(ModuleId.of("context"));
                assertThat(e.rejectedProducer()).isEqualTo(ModuleId.of("essentie"));
            });
        assertThat(registry.contains(ModuleId.of("essentie"))).isFalse();
    }

    @Test
    void 등록되지_않은_의존성이면_예외() {
        assertThatThrownBy(() -> registry.register(ModuleDescriptor.of("structure").dependsOn("ghost"), NOOP))
            .isInstanceOf(UnknownDependencyException.class);
        assertThat(registry.size()).isZero();
    }

    @Test
    void 자기_자신_의존은_순환으로_거부() {
        assertThatThrownBy(() -> registry.register(ModuleDescriptor.of("self").dependsOn("self"), NOOP))
            .isInstanceOfSatisfying(CyclicDependencyException.class,
                e -> assertThat(e.cycle()).containsExactly(ModuleId.of("self")));
    }

    @Test
    void 일괄_등록은_전방_참조_허용() {
        // given
        List<ModuleRegistration> batch = List.of(
            ModuleRegistration.of(ModuleDescriptor.of("structure").dependsOn("context"), NOOP),
            ModuleRegistration.of(ModuleDescriptor.of("context"), NOOP)
        );

        // when
        registry.registerAll(batch);

        // then
        assertThat(registry.descriptors()).extracting(ModuleDescriptor::id)
            .containsExactly(ModuleId.of("structure"), ModuleId.of("context"));
        assertThat(registry.registrationOrder(ModuleId.of("context"))).isEqualTo(1);
    }

    @Test
    void 순환이_있는_일괄_등록은_아무것도_등록하지_않음() {
        // given
        registry.register(ModuleDescriptor.of("base"), NOOP);
        List<ModuleRegistration> batch = List.of(
            ModuleRegistration.of(ModuleDescriptor.of("A").dependsOn("B"), NOOP),
            ModuleRegistration.of(ModuleDescriptor.of("B").dependsOn("C"), NOOP),
            ModuleRegistration.of(ModuleDescriptor.of("C").dependsOn("A"), NOOP)
        );

        // when & then
        assertThatThrownBy(() -> registry.registerAll(batch))
            .isInstanceOfSatisfying(CyclicDependencyException.class,
                e -> assertThat(e.cycle()).containsExactly(ModuleId.of("A"), ModuleId.of("B"), ModuleId.of("C")));
        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.contains(ModuleId.of("A"))).isFalse();
    }

    @Test
    void 생산자에_의존하지_않고_키를_소비하면_예외() {
        // given
        registry.register(ModuleDescriptor.of("context").produces("context.domain"), NOOP);

        // when & then
        assertThatThrownBy(() -> registry.register(ModuleDescriptor.of("structure").consumes("context.domain"), NOOP))
            .isInstanceOfSatisfying(MissingProducerDependencyException.class, e -> {
                assertThat(e.consumer()).isEqualTo(ModuleId.of("structure"));
                assertThat(e.producer()).isEqualTo(ModuleId.of("context"));
            });
    }

    @Test
    void 생산자에_간접_의존해도_소비_가능() {
        // given
        registry.register(ModuleDescriptor.of("context").produces("context.domain"), NOOP);
        registry.register(ModuleDescriptor.of("essentie").dependsOn("context"), NOOP);

        // when
        registry.register(ModuleDescriptor.of("structure").dependsOn("essentie").consumes("context.domain"), NOOP);

        // then
        assertThat(registry.size()).isEqualTo(3);
    }

    @Test
    void 생산자가_없는_키_소비는_허용() {
        // 생산자가 없는 키는 초기 컨텍스트에서 올 수 있다
        registry.register(ModuleDescriptor.of("structure").consumes("term"), NOOP);

        assertThat(registry.contains(ModuleId.of("structure"))).isTrue();
    }

    @Test
    void 우선순위_순서_조회() {
        // given
        registry.register(ModuleDescriptor.of("c").withPriority(30), NOOP);
        registry.register(ModuleDescriptor.of("b").withPriority(10), NOOP);
        registry.register(ModuleDescriptor.of("a").withPriority(10), NOOP);

        // when & then
        assertThat(registry.modulesByPriority())
            .containsExactly(ModuleId.of("a"), ModuleId.of("b"), ModuleId.of("c"));
    }

    @Test
    void 생산_키_집합_조회() {
        // given
        registry.register(ModuleDescriptor.of("context").produces("context.domain"), NOOP);
        registry.register(ModuleDescriptor.of("essentie").dependsOn("context").produces("essence", "category"), NOOP);

        // when
        Set<StateKey> produced = registry.producedKeys();

        // then
        assertThat(produced).containsExactlyInAnyOrder(
            StateKey.of("context.domain"), StateKey.of("essence"), StateKey.of("category"));
    }

    @Test
    void 등록되지_않은_모듈_조회시_예외() {
        assertThatThrownBy(() -> registry.descriptor(ModuleId.of("missing")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.registrationOrder(ModuleId.of("missing")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ========================================
    // 인스턴스 생성
    // ========================================

    @Test
    void 인스턴스는_동시_요청에도_한_번만_생성() throws Exception {
        // given
        AtomicInteger created = new AtomicInteger();
        registry.register(ModuleDescriptor.of("context"), () -> {
            created.incrementAndGet();
            return context -> ModuleOutput.success("ctx");
        });
        executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);

        // when
        List<Future<ContentModule>> futures = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return registry.instance(ModuleId.of("context"));
            }));
        }
        start.countDown();

        // then
        ContentModule first = futures.get(0).get(5, TimeUnit.SECONDS);
        for (Future<ContentModule> future : futures) {
            assertThat(future.get(5, TimeUnit.SECONDS)).isSameAs(first);
        }
        assertThat(created.get()).isEqualTo(1);
    }

    @Test
    void 팩토리_실패시_예외_후_재시도_가능() {
        // given
        AtomicInteger attempts = new AtomicInteger();
        registry.register(ModuleDescriptor.of("flaky"), () -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("template missing");
            }
            return context -> ModuleOutput.success("ok");
        });

        // when & then
        assertThatThrownBy(() -> registry.instance(ModuleId.of("flaky")))
            .isInstanceOfSatisfying(ModuleInstantiationException.class, e -> {
                assertThat(e.moduleId()).isEqualTo(ModuleId.of("flaky"));
                assertThat(e.getCause()).hasMessage("template missing");
            });
        assertThat(registry.instance(ModuleId.of("flaky"))).isNotNull();
        assertThat(attempts.get()).isEqualTo(2);
    }

    @Test
    void 팩토리가_null을_반환하면_예외() {
        registry.register(ModuleDescriptor.of("empty"), () -> null);

        assertThatThrownBy(() -> registry.instance(ModuleId.of("empty")))
            .isInstanceOf(ModuleInstantiationException.class);
    }

    @Test
    void 인스턴스_생성_직후_등록된_config로_초기화() {
        // given
        ConfigRecordingModule module = new ConfigRecordingModule(false);
        ModuleConfig config = ModuleConfig.of(Map.of("max_rules", 12));
        registry.register(ModuleDescriptor.of("ess_rules"), () -> module, config);

        // when
        ContentModule first = registry.instance(ModuleId.of("ess_rules"));
        ContentModule second = registry.instance(ModuleId.of("ess_rules"));

        // then
        assertThat(first).isSameAs(second);
        assertThat(module.initializations).hasValue(1);
        assertThat(module.received.getInt("max_rules", 0)).isEqualTo(12);
        assertThat(registry.config(ModuleId.of("ess_rules"))).isEqualTo(config);
    }

    @Test
    void config_없이_등록하면_빈_config로_초기화() {
        // given
        ConfigRecordingModule module = new ConfigRecordingModule(false);
        registry.registerAll(List.of(ModuleRegistration.of(ModuleDescriptor.of("grammar"), () -> module)));

        // when
        registry.instance(ModuleId.of("grammar"));

        // then
        assertThat(module.received.isEmpty()).isTrue();
    }

    @Test
    void 초기화_실패시_예외_후_재시도_가능() {
        // given
        AtomicInteger created = new AtomicInteger();
        registry.register(ModuleDescriptor.of("broken"), () -> {
            created.incrementAndGet();
            return new ConfigRecordingModule(true);
        }, ModuleConfig.of(Map.of("template", "missing.txt")));

        // when & then
        assertThatThrownBy(() -> registry.instance(ModuleId.of("broken")))
            .isInstanceOfSatisfying(ModuleInstantiationException.class, e ->
                assertThat(e.getCause()).hasMessageContaining("missing.txt"));
        assertThatThrownBy(() -> registry.instance(ModuleId.of("broken")))
            .isInstanceOf(ModuleInstantiationException.class);
        assertThat(created.get()).isEqualTo(2);
    }

    /**
     * 전달받은 config를 기록하는 모듈.
     */
    private static final class ConfigRecordingModule implements ContentModule {

        private final boolean failOnInitialize;
        private final AtomicInteger initializations = new AtomicInteger();
        private volatile ModuleConfig received;

        private ConfigRecordingModule(boolean failOnInitialize) {
            this.failOnInitialize = failOnInitialize;
        }

        @Override
        public void initialize(ModuleConfig config) {
            initializations.incrementAndGet();
            if (failOnInitialize) {
                throw new IllegalStateException("cannot load " + config.getString("template", "?"));
            }
            this.received = config;
        }

        @Override
        public ModuleOutput execute(ModuleContext context) {
            return ModuleOutput.success("");
        }
    }
}
