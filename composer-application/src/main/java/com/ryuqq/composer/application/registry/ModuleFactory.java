package com.ryuqq.composer.application.registry;

import com.ryuqq.composer.core.contract.ContentModule;

/**
 * 모듈 인스턴스 팩토리.
 *
 * <p>레지스트리는 모듈별로 최대 한 번만 이 팩토리를 성공적으로 호출하고
 * 만들어진 인스턴스를 싱글톤으로 재사용합니다.</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ModuleFactory {

    /**
     * 모듈 인스턴스 생성.
     *
     * @return 새 모듈 인스턴스 (null 불가)
     */
    ContentModule create();
}
