package com.ryuqq.eventraiser.core.handler;

/**
 * 제네릭이 아닌 기본 이벤트 핸들러.
 *
 * <p>이벤트 데이터 타입을 {@link EventArgs}로 고정한 핸들러 형태입니다.
 * {@code HandlerAdapter.toGeneric(SimpleEventHandler)}로 {@code EventHandler<EventArgs>}로
 * 변환할 수 있습니다.</p>
 *
 * @author EventRaiser Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface SimpleEventHandler {

    /**
     * 이벤트 처리.
     *
     * @param source 이벤트를 발생시킨 객체
     * @param args 이벤트 데이터
     */
    void handle(Object source, EventArgs args);
}
