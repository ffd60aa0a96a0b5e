/**
 * Composer Application Layer - 파이프라인 실행 API.
 *
 * <p>모듈 집합을 실행하고 결과 아티팩트와 메타데이터를 반환하는 포트를 정의합니다.</p>
 *
 * <h2>핵심 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.composer.application.orchestrator.PipelineOrchestrator} - 실행 조정자</li>
 *   <li>{@link com.ryuqq.composer.application.orchestrator.PipelineRun} - 실행 하나의 상태</li>
 *   <li>{@link com.ryuqq.composer.application.orchestrator.PipelineResult} - 실행 결과</li>
 *   <li>{@link com.ryuqq.composer.application.orchestrator.RunMetadata} - 실행 메타데이터</li>
 * </ul>
 *
 * <p>구현체는 adapter-runner 모듈의 WaveScheduler입니다.</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
package com.ryuqq.composer.application.orchestrator;
