package com.ryuqq.eventraiser.core.handler;

/**
 * 이벤트 핸들러 (Elementary Callback).
 *
 * <p>{@code (source, args) -> void} 형태의 알림 콜백입니다.
 * 하나의 EventHandler는 단일 콜백이거나, {@link HandlerChain}으로 표현되는
 * 순서 있는 콜백 목록(multicast)일 수 있습니다.</p>
 *
 * <p><strong>"콜백 없음" 표현:</strong></p>
 * <ul>
 *   <li>등록된 콜백이 없는 상태는 {@code null}로 표현합니다.</li>
 *   <li>빈 {@link HandlerChain}은 존재하지 않습니다.</li>
 *   <li>모든 combinator는 {@code null}을 그대로 전파합니다.</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * EventHandler<EventArgs> onSaved = (source, args) -> log.info("saved by {}", source);
 * EventHandler<EventArgs> handlers = HandlerChain.combine(onSaved, auditHandler);
 * EventRaising.raise(handlers, this, EventArgs.EMPTY);
 * }</pre>
 *
 * @param <T> 핸들러가 받는 이벤트 데이터 타입
 * @author EventRaiser Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EventHandler<T> {

    /**
     * 이벤트 처리.
     *
     * @param source 이벤트를 발생시킨 객체
     * @param args 이벤트 데이터
     */
    void handle(Object source, T args);
}
