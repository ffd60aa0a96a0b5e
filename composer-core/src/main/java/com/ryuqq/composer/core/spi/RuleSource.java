package com.ryuqq.composer.core.spi;

import com.ryuqq.composer.core.model.Rule;

import java.util.List;

/**
 * 정적 규칙 레코드 공급자 SPI (읽기 전용).
 *
 * <p>로딩은 비용이 크므로 직접 호출하지 않고 캐시 계층을 통해서만 접근합니다.</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public interface RuleSource {

    /**
     * 카테고리의 규칙 로딩.
     *
     * @param category 규칙 카테고리 (예: ESS, CON, ARAI)
     * @return 규칙 목록 (ID 오름차순, 없으면 빈 목록)
     * @throws java.io.UncheckedIOException 규칙 파일을 읽지 못한 경우
     */
    List<Rule> load(String category);
}
