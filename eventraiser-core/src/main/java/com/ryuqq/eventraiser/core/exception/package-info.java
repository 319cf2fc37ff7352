/**
 * 이벤트 핸들러 예외 패키지.
 *
 * <h2>예외 분류</h2>
 * <ul>
 *   <li>{@link com.ryuqq.eventraiser.core.exception.SignatureMismatchException} - 어댑터에 호환되지 않는 함수 전달</li>
 *   <li>{@link com.ryuqq.eventraiser.core.exception.AggregateHandlerException} - Parallel 실행 후 수집된 예외</li>
 *   <li>{@link com.ryuqq.eventraiser.core.exception.HandlerInvocationException} - 리플렉션 바인딩 호출 실패</li>
 * </ul>
 *
 * <p>동기 raise에서 발생한 핸들러 예외는 감싸지 않고 그대로 전파됩니다.</p>
 *
 * @author EventRaiser Team
 * @since 1.0.0
 */
package com.ryuqq.eventraiser.core.exception;
