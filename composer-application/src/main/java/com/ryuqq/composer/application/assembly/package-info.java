/**
 * 모듈 출력 조립.
 *
 * @author Composer Team
 * @since 1.0.0
 */
package com.ryuqq.composer.application.assembly;
