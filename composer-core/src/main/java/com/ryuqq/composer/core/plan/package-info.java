/**
 * 의존성 해석과 wave 계획.
 *
 * @since 1.0.0
 * @author Composer Team
 */
package com.ryuqq.composer.core.plan;
