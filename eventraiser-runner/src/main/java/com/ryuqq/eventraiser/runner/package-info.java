/**
 * Runner Layer - 이벤트 핸들러 데코레이터 및 실행 구현체.
 *
 * <p>이 패키지는 이미 구성된 핸들러 목록의 실행 방식을 결정하는 데코레이터와
 * 실행 연산을 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.eventraiser.runner.EventRaiser} - 데코레이터 및 raise/raiseAsync</li>
 *   <li>{@link com.ryuqq.eventraiser.runner.EventRaising} - 기본 설정 정적 진입점</li>
 *   <li>{@link com.ryuqq.eventraiser.runner.ResilientHandler} - 예외 격리</li>
 *   <li>{@link com.ryuqq.eventraiser.runner.ParallelHandler} - 병렬 실행 (fan-out / fan-in)</li>
 *   <li>{@link com.ryuqq.eventraiser.runner.AsyncHandler} - 백그라운드 실행</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * runner (EventRaiser, decorators)
 *   ↓ depends on
 * core/handler (EventHandler, HandlerChain)
 * core/adapter (HandlerAdapter)
 * core/outcome (HandlerOutcome)
 * </pre>
 *
 * <h2>데코레이터 조합 예시</h2>
 * <pre>
 * parallel(resilient(handlers))   // 병렬 실행, 개별 예외 억제
 * async(resilient(handlers))      // 백그라운드 실행, 모든 핸들러 시도
 * resilient(parallel(handlers))   // 병렬 실행, 집계 예외를 하나로 억제
 * </pre>
 *
 * @author EventRaiser Team
 * @since 1.0.0
 */
package com.ryuqq.eventraiser.runner;
