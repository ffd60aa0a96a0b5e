package com.ryuqq.composer.core.contract;

import com.ryuqq.composer.core.model.ModuleId;
import com.ryuqq.composer.core.model.StateKey;
import com.ryuqq.composer.core.status.ModuleStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 하위 모듈을 순서대로 실행해 하나의 조각으로 합치는 모듈.
 *
 * <p>관련된 조각(예: 문법 규칙과 예시)을 하나의 기술자로 묶을 때 사용합니다.
 * 레지스트리와 스케줄러에는 하나의 모듈로 보이며, 하위 모듈은 같은 컨텍스트를 공유합니다.</p>
 *
 * <p><strong>실행 규칙:</strong></p>
 * <ul>
 *   <li>precondition: 첫 번째로 조건을 만족하지 못한 하위 모듈의 사유 ("[id] 사유")</li>
 *   <li>execute: 하위 모듈을 추가 순서대로 실행, 비어 있지 않은 content를 빈 줄로 연결</li>
 *   <li>하위 모듈이 FAILURE를 반환하면 즉시 중단하고 FAILURE 반환 (metadata.failed_module)</li>
 *   <li>writes는 합쳐서 반환 (producedKeys 검증은 복합 모듈의 기술자 기준)</li>
 *   <li>initialize: 설정의 하위 모듈 ID 섹션을 각 하위 모듈에 전달</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ContentModule grammar = CompositeModule.of("grammar_rules", new GrammarRulesModule())
 *     .with("grammar_examples", new GrammarExamplesModule());
 * </pre>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public final class CompositeModule implements ContentModule {

    static final String SEPARATOR = "\n\n";

    private final Map<ModuleId, ContentModule> children;

    private CompositeModule(Map<ModuleId, ContentModule> children) {
        this.children = Collections.unmodifiableMap(children);
    }

    /**
     * 첫 하위 모듈로 생성.
     *
     * @param childId 하위 모듈 ID
     * @param child 하위 모듈
     * @return CompositeModule
     */
    public static CompositeModule of(String childId, ContentModule child) {
        return new CompositeModule(new LinkedHashMap<>()).with(childId, child);
    }

    /**
     * 하위 모듈을 추가한 새 인스턴스 생성.
     *
     * @param childId 하위 모듈 ID
     * @param child 하위 모듈
     * @return 새 CompositeModule
     * @throws IllegalArgumentException child가 null이거나 ID가 중복된 경우
     */
    public CompositeModule with(String childId, ContentModule child) {
        ModuleId id = ModuleId.of(childId);
        if (child == null) {
            throw new IllegalArgumentException("child cannot be null (id: " + childId + ")");
        }
        if (children.containsKey(id)) {
            throw new IllegalArgumentException("Sub-module '" + id + "' is already added");
        }
        Map<ModuleId, ContentModule> next = new LinkedHashMap<>(children);
        next.put(id, child);
        return new CompositeModule(next);
    }

    public List<ModuleId> childIds() {
        return List.copyOf(children.keySet());
    }

    @Override
    public void initialize(ModuleConfig config) {
        ModuleConfig effective = config == null ? ModuleConfig.empty() : config;
        children.forEach((id, child) -> child.initialize(effective.section(id.getValue())));
    }

    @Override
    public Optional<String> precondition(ModuleContext context) {
        for (Map.Entry<ModuleId, ContentModule> entry : children.entrySet()) {
            Optional<String> unmet = entry.getValue().precondition(context);
            if (unmet.isPresent()) {
                return Optional.of("[" + entry.getKey() + "] " + unmet.get());
            }
        }
        return Optional.empty();
    }

    @Override
    public ModuleOutput execute(ModuleContext context) {
        List<String> pieces = new ArrayList<>();
        Map<StateKey, Object> writes = new LinkedHashMap<>();
        Map<String, Object> childMetadata = new LinkedHashMap<>();

        for (Map.Entry<ModuleId, ContentModule> entry : children.entrySet()) {
            ModuleId id = entry.getKey();
            ModuleOutput output = entry.getValue().execute(context);
            if (output == null) {
                return ModuleOutput.failure("Sub-module " + id + " returned no output")
                    .withMetadata(Map.of("failed_module", id.getValue()));
            }
            if (!output.isSuccess()) {
                return ModuleOutput.failure("Sub-module " + id + " failed: " + output.errorMessage())
                    .withMetadata(Map.of("failed_module", id.getValue()));
            }
            writes.putAll(output.writes());
            if (!output.isEmpty()) {
                pieces.add(output.content());
                childMetadata.put(id.getValue(), output.metadata());
            }
        }

        List<String> ids = new ArrayList<>();
        children.keySet().forEach(id -> ids.add(id.getValue()));
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("sub_modules", List.copyOf(ids));
        metadata.put("sub_module_metadata", Collections.unmodifiableMap(childMetadata));
        return new ModuleOutput(String.join(SEPARATOR, pieces), writes, metadata, ModuleStatus.SUCCESS, null);
    }
}
