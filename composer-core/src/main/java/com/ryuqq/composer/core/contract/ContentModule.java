package com.ryuqq.composer.core.contract;

import java.util.Optional;

/**
 * Content Module 계약.
 *
 * <p>각 모듈은 최종 아티팩트의 한 조각을 만듭니다.</p>
 *
 * <p><strong>구현 규칙:</strong></p>
 * <ul>
 *   <li>Stateless: 같은 인스턴스가 동시/순차 실행에서 재사용되므로 실행별 가변 필드 금지</li>
 *   <li>consumedKeys에 없는 키를 읽지 않음, producedKeys에 없는 키를 쓰지 않음</li>
 *   <li>캐시나 외부 텍스트 생성 서비스를 호출할 수 있으며, 호출 스레드가 블로킹될 수 있음</li>
 *   <li>설정은 {@link #initialize(ModuleConfig)}에서 한 번 읽어 불변 필드로 보관</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ContentModule grammar = context -&gt; ModuleOutput.success("### Grammatica ...");
 * </pre>
 *
 * @author Composer Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ContentModule {

    /**
     * 모듈 실행.
     *
     * <p>예외를 던지면 스케줄러가 FAILURE로 기록하며, 형제 모듈에는 영향을 주지 않습니다.</p>
     *
     * @param context 실행 컨텍스트
     * @return 출력 (null 불가)
     */
    ModuleOutput execute(ModuleContext context);

    /**
     * 실행 전 입력 조건 확인.
     *
     * <p>사유를 반환하면 모듈은 SKIPPED로 기록되고 execute는 호출되지 않습니다.</p>
     *
     * @param context 실행 컨텍스트
     * @return 건너뛸 사유, 실행 가능하면 Optional.empty()
     */
    default Optional<String> precondition(ModuleContext context) {
        return Optional.empty();
    }

    /**
     * 모듈별 설정 주입.
     *
     * <p>레지스트리가 인스턴스를 만든 직후, 첫 실행 전에 한 번 호출합니다.
     * 예외를 던지면 인스턴스 생성 실패(INSTANTIATION_ERROR)로 처리되고 다음 실행에서 다시 시도합니다.</p>
     *
     * @param config 모듈 설정 (없으면 빈 설정)
     */
    default void initialize(ModuleConfig config) {
    }
}
