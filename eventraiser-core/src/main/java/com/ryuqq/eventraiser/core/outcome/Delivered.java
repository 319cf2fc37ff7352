package com.ryuqq.eventraiser.core.outcome;

import com.ryuqq.eventraiser.core.handler.EventHandler;

/**
 * 핸들러 실행 성공.
 *
 * @param handler 실행한 핸들러
 * @param <T> 이벤트 데이터 타입
 *
 * @author EventRaiser Team
 * @since 1.0.0
 */
public record Delivered<T>(EventHandler<T> handler) implements HandlerOutcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException handler가 null인 경우
     */
    public Delivered {
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
    }
}
