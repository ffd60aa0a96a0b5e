package com.ryuqq.composer.core.state;

import com.ryuqq.composer.core.model.StateKey;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 파이프라인 실행 단위의 Shared State.
 *
 * <p>하나의 PipelineRun이 독점적으로 소유하며, 실행 간에 공유되지 않습니다.</p>
 *
 * <p><strong>동기화가 필요 없는 이유:</strong></p>
 * <ul>
 *   <li>단일 생산자 규칙: 두 모듈이 같은 키에 쓰는 것은 등록 시점에 거부됨</li>
 *   <li>쓰기는 wave barrier 이후 스케줄러 스레드에서만 적용됨</li>
 *   <li>모듈은 이 저장소를 직접 읽지 않고 wave 디스패치 전에 찍은 {@link #snapshot()}을 읽음</li>
 * </ul>
 *
 * <p>{@link #set(StateKey, Object)}는 호출마다 생산자를 다시 검증하지 않습니다.
 * 생산자 검증은 레지스트리 불변식과 스케줄러의 출력 검증이 담당합니다.</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public final class SharedStateStore {

    private final Map<StateKey, Object> values = new LinkedHashMap<>();

    /**
     * 값 저장.
     *
     * @param key 키
     * @param value 값 (null 불가)
     * @throws IllegalArgumentException key 또는 value가 null인 경우
     */
    public void set(StateKey key, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null (key: " + key + ")");
        }
        values.put(key, value);
    }

    /**
     * 값 조회.
     *
     * <p>생산자가 optional이었고 실패했거나 건너뛰어진 경우 빈 값은 정상적인 결과입니다.</p>
     *
     * @param key 키
     * @return 값 또는 Optional.empty() (missing)
     */
    public Optional<Object> get(StateKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return Optional.ofNullable(values.get(key));
    }

    /**
     * 타입을 지정한 값 조회.
     *
     * @param key 키
     * @param type 기대 타입
     * @param <T> 기대 타입 파라미터
     * @return 값이 존재하고 타입이 호환되면 값, 아니면 Optional.empty()
     */
    public <T> Optional<T> get(StateKey key, Class<T> type) {
        return get(key).filter(type::isInstance).map(type::cast);
    }

    /**
     * 키 존재 여부.
     *
     * @param key 키
     * @return 값이 있으면 true
     */
    public boolean contains(StateKey key) {
        return values.containsKey(key);
    }

    /**
     * 현재 상태의 불변 스냅샷 (쓰기 순서 유지).
     *
     * @return 스냅샷
     */
    public Map<StateKey, Object> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public int size() {
        return values.size();
    }
}
