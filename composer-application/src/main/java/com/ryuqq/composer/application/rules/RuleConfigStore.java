package com.ryuqq.composer.application.rules;

import com.ryuqq.composer.core.model.Rule;
import com.ryuqq.composer.core.spi.CacheKey;
import com.ryuqq.composer.core.spi.CacheLayer;
import com.ryuqq.composer.core.spi.RuleSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * 카테고리별 규칙 조회 (캐시 경유).
 *
 * <p>규칙 로드는 항상 {@link CacheLayer#getOrCompute(CacheKey, java.util.concurrent.Callable, java.time.Duration)}를
 * 통해서만 수행됩니다. 같은 카테고리를 동시에 요청하는 여러 모듈이 있어도
 * {@link RuleSource#load(String)}는 프로세스 수명 동안 한 번만 호출됩니다.</p>
 *
 * <p><strong>캐시 키:</strong> {@code rules:<category>}</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public final class RuleConfigStore {

    private static final Logger log = LoggerFactory.getLogger(RuleConfigStore.class);

    /**
     * 캐시 키 접두사.
     */
    public static final String KEY_PREFIX = "rules:";

    private final CacheLayer cache;
    private final RuleSource source;

    /**
     * 생성자.
     *
     * @param cache 캐시
     * @param source 규칙 원본
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public RuleConfigStore(CacheLayer cache, RuleSource source) {
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        this.cache = cache;
        this.source = source;
    }

    /**
     * 카테고리의 규칙 목록 조회.
     *
     * @param category 카테고리 (예: ESS)
     * @return 규칙 목록 (불변)
     * @throws IllegalArgumentException category가 null/blank인 경우
     * @throws com.ryuqq.composer.core.exception.ComputationFailedException 원본 로드가 실패한 경우
     */
    public List<Rule> rules(String category) {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("category cannot be null or blank");
        }
        return cache.getOrCompute(keyOf(category), () -> load(category), CacheLayer.PROCESS_LIFETIME);
    }

    /**
     * 규칙 하나 조회.
     *
     * @param ruleId 규칙 ID (예: ESS-01)
     * @return 규칙 또는 Optional.empty()
     */
    public Optional<Rule> rule(String ruleId) {
        if (ruleId == null || ruleId.isBlank()) {
            throw new IllegalArgumentException("ruleId cannot be null or blank");
        }
        return rules(Rule.categoryOf(ruleId)).stream()
            .filter(rule -> rule.id().equals(ruleId))
            .findFirst();
    }

    /**
     * 카테고리 캐시 무효화 (다음 조회에서 다시 로드).
     *
     * @param category 카테고리
     * @return 캐시된 항목이 있었으면 true
     */
    public boolean invalidate(String category) {
        return cache.invalidate(keyOf(category));
    }

    static CacheKey keyOf(String category) {
        return CacheKey.of(KEY_PREFIX + category);
    }

    private List<Rule> load(String category) {
        List<Rule> loaded = List.copyOf(source.load(category));
        log.info("Loaded {} rule(s) for category {}", loaded.size(), category);
        return loaded;
    }
}
