/**
 * 모듈 레지스트리.
 *
 * <p>모듈 기술자를 등록 시점에 검증하고, 모듈 인스턴스를 싱글톤으로 관리합니다.</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
package com.ryuqq.composer.application.registry;
