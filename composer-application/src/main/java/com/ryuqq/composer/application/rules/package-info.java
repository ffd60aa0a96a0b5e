/**
 * 캐시를 경유하는 규칙 조회.
 *
 * @author Composer Team
 * @since 1.0.0
 */
package com.ryuqq.composer.application.rules;
