/**
 * JSON 파이프라인 정의 로딩 (Jackson).
 *
 * @author Composer Team
 * @since 1.0.0
 */
package com.ryuqq.composer.adapter.runner.config;
