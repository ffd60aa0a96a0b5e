/**
 * Composer Runner Adapter - 파이프라인 실행 구현체.
 *
 * <h2>핵심 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.composer.adapter.runner.WaveScheduler} - wave 단위 동시 실행 스케줄러</li>
 *   <li>{@link com.ryuqq.composer.adapter.runner.SchedulerConfig} - worker 수와 타임아웃 설정</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>wave barrier:</strong> wave N+1은 wave N의 모든 모듈이 끝난 뒤 시작</li>
 *   <li><strong>단일 worker pool:</strong> wave와 동시 실행이 같은 고정 크기 pool을 공유</li>
 *   <li><strong>모듈 격리:</strong> 모듈 오류는 실행 기록으로 표현되며 예외로 전파되지 않음</li>
 * </ul>
 *
 * @author Composer Team
 * @since 1.0.0
 */
package com.ryuqq.composer.adapter.runner;
