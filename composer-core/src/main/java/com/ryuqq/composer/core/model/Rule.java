package com.ryuqq.composer.core.model;

import java.util.List;

/**
 * 정적 규칙 레코드.
 *
 * @param id 규칙 ID (예: ESS-01)
 * @param name 규칙 이름
 * @param category 카테고리 (ID의 '-' 앞부분)
 * @param priority 규칙 중요도 (예: hoog, midden, laag)
 * @param explanation 설명
 * @param testQuestion 검증 질문
 * @param goodExamples 좋은 예
 * @param badExamples 나쁜 예
 *
 * @author Composer Team
 * @since 1.0.0
 */
public record Rule(
    String id,
    String name,
    String category,
    String priority,
    String explanation,
    String testQuestion,
    List<String> goodExamples,
    List<String> badExamples
) {

    public Rule {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("category cannot be null or blank");
        }
        name = name == null ? "" : name;
        priority = priority == null ? "midden" : priority;
        explanation = explanation == null ? "" : explanation;
        testQuestion = testQuestion == null ? "" : testQuestion;
        goodExamples = goodExamples == null ? List.of() : List.copyOf(goodExamples);
        badExamples = badExamples == null ? List.of() : List.copyOf(badExamples);
    }

    /**
     * 규칙 ID에서 카테고리 추출.
     *
     * @param ruleId 규칙 ID (예: ESS-01, ARAI-02SUB1)
     * @return '-' 앞부분 (없으면 ID 전체)
     */
    public static String categoryOf(String ruleId) {
        int dash = ruleId.indexOf('-');
        return dash < 0 ? ruleId : ruleId.substring(0, dash);
    }
}
