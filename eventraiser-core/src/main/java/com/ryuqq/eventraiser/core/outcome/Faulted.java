package com.ryuqq.eventraiser.core.outcome;

import com.ryuqq.eventraiser.core.handler.EventHandler;

/**
 * 핸들러 실행 실패.
 *
 * <p>원본 핸들러와 발생한 예외를 함께 보관합니다.
 * Resilient 데코레이터는 이 정보를 ExceptionHandler로 전달하고,
 * Parallel 데코레이터는 모아서 AggregateHandlerException으로 던집니다.</p>
 *
 * @param handler 예외를 발생시킨 원본 핸들러
 * @param error 발생한 예외
 * @param <T> 이벤트 데이터 타입
 *
 * @author EventRaiser Team
 * @since 1.0.0
 */
public record Faulted<T>(EventHandler<T> handler, Throwable error) implements HandlerOutcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException handler 또는 error가 null인 경우
     */
    public Faulted {
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }
}
