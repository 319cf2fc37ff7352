/**
 * 이벤트 핸들러 타입 패키지.
 *
 * <p>이 패키지는 EventRaiser Core의 기본 타입을 정의합니다.</p>
 *
 * <h2>핵심 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.eventraiser.core.handler.EventHandler} - Elementary 콜백 {@code (source, args) -> void}</li>
 *   <li>{@link com.ryuqq.eventraiser.core.handler.HandlerChain} - 순서 있는 불변 콜백 목록 (multicast)</li>
 *   <li>{@link com.ryuqq.eventraiser.core.handler.BoundMethodHandler} - receiver + 메서드 바인딩</li>
 *   <li>{@link com.ryuqq.eventraiser.core.handler.EventArgs} - 이벤트 데이터 기반 타입</li>
 *   <li>{@link com.ryuqq.eventraiser.core.handler.SimpleEventHandler} - EventArgs 고정 핸들러</li>
 *   <li>{@link com.ryuqq.eventraiser.core.handler.ExceptionHandler} - Resilient 데코레이터 예외 처리기</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>"콜백 없음" = null:</strong> 빈 목록이 아닌 별도 값이며, 결합의 항등원</li>
 *   <li><strong>불변성:</strong> 결합은 항상 새 체인을 생성하며 기존 체인을 변경하지 않음</li>
 *   <li><strong>순서 보존:</strong> 등록 순서 유지, 중복 허용</li>
 * </ul>
 *
 * @author EventRaiser Team
 * @since 1.0.0
 */
package com.ryuqq.eventraiser.core.handler;
