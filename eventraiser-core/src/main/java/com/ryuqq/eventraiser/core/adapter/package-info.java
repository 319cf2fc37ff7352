/**
 * 핸들러 어댑터 패키지.
 *
 * <p>구조적으로 호환되는 함수를 {@code EventHandler<T>}로 변환하고,
 * 상위 타입용 핸들러를 하위 타입용으로 변환(반공변)합니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.eventraiser.core.adapter.HandlerAdapter} - 변환 진입점</li>
 * </ul>
 *
 * @author EventRaiser Team
 * @since 1.0.0
 */
package com.ryuqq.eventraiser.core.adapter;
