package com.ryuqq.eventraiser.core.outcome;

import com.ryuqq.eventraiser.core.handler.EventHandler;

/**
 * 개별 핸들러 실행 결과.
 *
 * <p>HandlerOutcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Delivered}: 예외 없이 실행 완료</li>
 *   <li>{@link Faulted}: 실행 중 예외 발생</li>
 * </ul>
 *
 * <p>Resilient/Parallel 데코레이터는 예외를 바로 던지는 대신 이 결과 채널을 통해
 * 핸들러별 실패를 억제하거나 수집합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * HandlerOutcome&lt;T&gt; outcome = HandlerOutcome.capture(handler, source, args);
 * if (outcome instanceof Faulted&lt;T&gt; faulted) {
 *     exceptionHandler.handle(faulted.handler(), (Exception) faulted.error());
 * }
 * </pre>
 *
 * @param <T> 이벤트 데이터 타입
 * @author EventRaiser Team
 * @since 1.0.0
 */
public sealed interface HandlerOutcome<T> permits Delivered, Faulted {

    /**
     * 실행한 핸들러.
     *
     * @return 원본 핸들러
     */
    EventHandler<T> handler();

    /**
     * 핸들러 실행 후 결과 캡처.
     *
     * <p>{@link Exception}만 캡처하며, {@link Error}는 그대로 전파됩니다.</p>
     *
     * @param handler 실행할 핸들러
     * @param source 이벤트 source
     * @param args 이벤트 데이터
     * @param <T> 이벤트 데이터 타입
     * @return Delivered 또는 Faulted
     */
    static <T> HandlerOutcome<T> capture(EventHandler<T> handler, Object source, T args) {
        try {
            handler.handle(source, args);
            return new Delivered<>(handler);
        } catch (Exception e) {
            return new Faulted<>(handler, e);
        }
    }

    /**
     * 실행 성공 여부 확인.
     *
     * @return 성공 여부
     */
    default boolean isDelivered() {
        return this instanceof Delivered;
    }

    /**
     * 실행 실패 여부 확인.
     *
     * @return 실패 여부
     */
    default boolean isFaulted() {
        return this instanceof Faulted;
    }
}
