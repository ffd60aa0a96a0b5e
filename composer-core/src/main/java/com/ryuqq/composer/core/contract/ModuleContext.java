package com.ryuqq.composer.core.contract;

import com.ryuqq.composer.core.exception.UndeclaredKeyAccessException;
import com.ryuqq.composer.core.model.ModuleDescriptor;
import com.ryuqq.composer.core.model.ModuleId;
import com.ryuqq.composer.core.model.StateKey;
import com.ryuqq.composer.core.state.SharedStateStore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 모듈 실행 컨텍스트.
 *
 * <p>모듈 인스턴스는 여러 실행에서 재사용되므로 실행별 데이터를 필드에 보관하면 안 됩니다.
 * 실행별 데이터는 모두 이 컨텍스트를 통해 {@link ContentModule#execute(ModuleContext)}로 전달됩니다.</p>
 *
 * <p><strong>제공 데이터:</strong></p>
 * <ul>
 *   <li>runId: 실행 식별자</li>
 *   <li>inputs: 호출자가 전달한 초기 컨텍스트 (읽기 전용)</li>
 *   <li>Shared State 읽기: 기술자의 consumedKeys에 선언된 키만 허용</li>
 * </ul>
 *
 * <p>Shared State는 wave 디스패치 직전에 찍은 불변 스냅샷으로 보관합니다.
 * 타임아웃 이후에도 계속 실행되는 모듈이 있어도 스케줄러의 쓰기와 경합하지 않습니다.</p>
 *
 * <p>쓰기는 컨텍스트가 아닌 {@link ModuleOutput#writes()}로 반환합니다.</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public final class ModuleContext {

    private final String runId;
    private final ModuleDescriptor descriptor;
    private final Map<StateKey, Object> sharedState;
    private final Map<String, Object> inputs;

    /**
     * 현재 Shared State의 스냅샷으로 생성.
     *
     * @param runId 실행 ID
     * @param descriptor 실행 중인 모듈의 기술자
     * @param sharedState 실행의 Shared State (생성 시점의 값만 보임)
     * @param inputs 초기 컨텍스트
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ModuleContext(String runId, ModuleDescriptor descriptor, SharedStateStore sharedState,
                         Map<String, Object> inputs) {
        this(runId, descriptor, snapshotOf(sharedState), inputs);
    }

    /**
     * 생성자.
     *
     * @param runId 실행 ID
     * @param descriptor 실행 중인 모듈의 기술자
     * @param sharedState wave 시작 시점의 Shared State 스냅샷
     * @param inputs 초기 컨텍스트
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ModuleContext(String runId, ModuleDescriptor descriptor, Map<StateKey, Object> sharedState,
                         Map<String, Object> inputs) {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId cannot be null or blank");
        }
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        if (sharedState == null) {
            throw new IllegalArgumentException("sharedState cannot be null");
        }
        this.runId = runId;
        this.descriptor = descriptor;
        this.sharedState = Map.copyOf(sharedState);
        this.inputs = inputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
    }

    public String runId() {
        return runId;
    }

    public ModuleId moduleId() {
        return descriptor.id();
    }

    public ModuleDescriptor descriptor() {
        return descriptor;
    }

    /**
     * 초기 컨텍스트 값 조회.
     *
     * @param name 입력 이름 (예: term)
     * @return 값 또는 Optional.empty()
     */
    public Optional<Object> input(String name) {
        return Optional.ofNullable(inputs.get(name));
    }

    /**
     * 타입을 지정한 초기 컨텍스트 값 조회.
     */
    public <T> Optional<T> input(String name, Class<T> type) {
        return input(name).filter(type::isInstance).map(type::cast);
    }

    public Map<String, Object> inputs() {
        return inputs;
    }

    /**
     * Shared State 값 조회.
     *
     * @param key 키 (consumedKeys에 선언되어 있어야 함)
     * @return 값 또는 Optional.empty() (생산자가 실패했거나 건너뛰어진 경우)
     * @throws UndeclaredKeyAccessException consumedKeys에 없는 키인 경우
     */
    public Optional<Object> get(StateKey key) {
        if (!descriptor.consumesKey(key)) {
            throw new UndeclaredKeyAccessException(descriptor.id(), key);
        }
        return Optional.ofNullable(sharedState.get(key));
    }

    public Optional<Object> get(String key) {
        return get(StateKey.of(key));
    }

    /**
     * 타입을 지정한 Shared State 값 조회.
     *
     * @throws UndeclaredKeyAccessException consumedKeys에 없는 키인 경우
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        return get(StateKey.of(key)).filter(type::isInstance).map(type::cast);
    }

    private static Map<StateKey, Object> snapshotOf(SharedStateStore sharedState) {
        if (sharedState == null) {
            throw new IllegalArgumentException("sharedState cannot be null");
        }
        return sharedState.snapshot();
    }
}
