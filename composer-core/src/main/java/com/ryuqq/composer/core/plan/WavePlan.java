package com.ryuqq.composer.core.plan;

import com.ryuqq.composer.core.model.ModuleId;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Wave 실행 계획 (불변).
 *
 * <p>각 wave는 의존성이 모두 이전 wave에서 충족된 모듈 ID 목록입니다.
 * 같은 wave의 모듈은 동시에 실행해도 안전합니다.</p>
 *
 * <p>wave 내부 순서는 디스패치 순서이며, 우선순위 내림차순 → ID 오름차순입니다.</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public final class WavePlan {

    private final List<List<ModuleId>> waves;
    private final Map<ModuleId, Integer> waveIndex;

    /**
     * 생성자.
     *
     * @param waves wave 목록
     * @throws IllegalArgumentException waves가 null이거나 같은 ID가 두 번 나타나는 경우
     */
    public WavePlan(List<List<ModuleId>> waves) {
        if (waves == null) {
            throw new IllegalArgumentException("waves cannot be null");
        }
        List<List<ModuleId>> copy = new ArrayList<>(waves.size());
        Map<ModuleId, Integer> index = new HashMap<>();
        for (int i = 0; i < waves.size(); i++) {
            List<ModuleId> wave = List.copyOf(waves.get(i));
            for (ModuleId id : wave) {
                if (index.put(id, i) != null) {
                    throw new IllegalArgumentException("Module '" + id + "' appears in more than one wave");
                }
            }
            copy.add(wave);
        }
        this.waves = List.copyOf(copy);
        this.waveIndex = Map.copyOf(index);
    }

    public List<List<ModuleId>> waves() {
        return waves;
    }

    public int waveCount() {
        return waves.size();
    }

    public int moduleCount() {
        return waveIndex.size();
    }

    /**
     * 모듈이 속한 wave 인덱스 (0부터).
     *
     * @param id 모듈 ID
     * @return wave 인덱스
     * @throws IllegalArgumentException 계획에 없는 모듈인 경우
     */
    public int waveOf(ModuleId id) {
        Integer index = waveIndex.get(id);
        if (index == null) {
            throw new IllegalArgumentException("Module '" + id + "' is not part of this plan");
        }
        return index;
    }

    @Override
    public String toString() {
        return "WavePlan" + waves;
    }
}
