package com.ryuqq.composer.adapter.runner;

import com.ryuqq.composer.adapter.inmemory.cache.InMemoryCacheLayer;
import com.ryuqq.composer.application.orchestrator.PipelineResult;
import com.ryuqq.composer.application.registry.ModuleRegistry;
import com.ryuqq.composer.application.rules.RuleConfigStore;
import com.ryuqq.composer.core.contract.ModuleOutput;
import com.ryuqq.composer.core.model.ModuleDescriptor;
import com.ryuqq.composer.core.model.Rule;
import com.ryuqq.composer.core.spi.CacheStats;
import com.ryuqq.composer.core.spi.RuleSource;
import com.ryuqq.composer.core.status.RunStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 같은 wave의 모듈들이 규칙 캐시를 공유하는지 검증하는 통합 테스트.
 *
 * <p>콜드 캐시에서 4개 모듈이 동시에 같은 카테고리를 요청하면
 * 로더는 한 번만 호출되고 모두 같은 값을 받아야 합니다.</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
class SharedRuleCacheTest {

    private WaveScheduler scheduler;

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.close();
        }
    }

    @Test
    void 동시_모듈의_콜드_키_요청은_로더를_한_번만_호출() {
        // given
        AtomicInteger loads = new AtomicInteger();
        RuleSource slowSource = category -> {
            loads.incrementAndGet();
            sleep(150);
            return List.of(
                new Rule("ESS-01", "Essentie", category, "hoog", "", "", List.of(), List.of()),
                new Rule("ESS-02", "Doel", category, "midden", "", "", List.of(), List.of()));
        };
        InMemoryCacheLayer cache = new InMemoryCacheLayer();
        RuleConfigStore store = new RuleConfigStore(cache, slowSource);
        List<List<Rule>> seen = new CopyOnWriteArrayList<>();

        ModuleRegistry registry = new ModuleRegistry();
        for (int i = 1; i <= 4; i++) {
            registry.register(ModuleDescriptor.of("validator" + i).withPriority(i), () -> context -> {
                List<Rule> rules = store.rules("ESS");
                seen.add(rules);
                return ModuleOutput.success(context.moduleId() + ":" + rules.size());
            });
        }
        scheduler = new WaveScheduler(registry, new SchedulerConfig().withWorkerPoolSize(4));

        // when
        PipelineResult result = scheduler.runPipeline(Map.of());

        // then
        assertThat(result.getStatus()).isEqualTo(RunStatus.COMPLETE);
        assertThat(result.getArtifact()).isEqualTo("validator1:2\n\nvalidator2:2\n\nvalidator3:2\n\nvalidator4:2");
        assertThat(loads.get()).isEqualTo(1);
        assertThat(seen).hasSize(4).allSatisfy(rules -> assertThat(rules).isSameAs(seen.get(0)));

        CacheStats stats = cache.stats();
        assertThat(stats.computations()).isEqualTo(1);
        assertThat(stats.hits() + stats.misses()).isEqualTo(4);
    }

    @Test
    void 두_번째_실행은_캐시에서_규칙을_읽음() {
        // given
        AtomicInteger loads = new AtomicInteger();
        RuleSource source = category -> {
            loads.incrementAndGet();
            return List.of(new Rule("VER-01", "Vorm", category, "laag", "", "", List.of(), List.of()));
        };
        RuleConfigStore store = new RuleConfigStore(new InMemoryCacheLayer(), source);
        ModuleRegistry registry = new ModuleRegistry();
        registry.register(ModuleDescriptor.of("form"),
            () -> context -> ModuleOutput.success(store.rule("VER-01").map(Rule::name).orElse("?")));
        scheduler = new WaveScheduler(registry, new SchedulerConfig());

        // when
        PipelineResult first = scheduler.runPipeline(Map.of());
        PipelineResult second = scheduler.runPipeline(Map.of());

        // then
        assertThat(first.getArtifact()).isEqualTo("Vorm");
        assertThat(second.getArtifact()).isEqualTo("Vorm");
        assertThat(loads.get()).isEqualTo(1);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
