package com.ryuqq.eventraiser.runner;

import com.ryuqq.eventraiser.core.handler.EventHandler;
import com.ryuqq.eventraiser.core.handler.ExceptionHandler;
import com.ryuqq.eventraiser.core.outcome.Faulted;
import com.ryuqq.eventraiser.core.outcome.HandlerOutcome;

/**
 * 예외 격리 핸들러 (Resilient 데코레이터의 항목).
 *
 * <p>하나의 elementary 핸들러를 감싸서, 실행 중 발생한 예외를 전파하는 대신
 * {@link ExceptionHandler}로 전달합니다. 이 핸들러들로 구성된 체인은
 * 앞선 핸들러의 실패와 무관하게 모든 핸들러를 순서대로 정확히 한 번씩 실행합니다.
 * 단, {@link Error}는 감싸지 않고 전파합니다.</p>
 *
 * @param <T> 이벤트 데이터 타입
 * @author EventRaiser Team
 * @since 1.0.0
 */
public final class ResilientHandler<T> implements EventHandler<T> {

    private final EventHandler<T> delegate;
    private final ExceptionHandler<T> exceptionHandler;

    /**
     * 생성자.
     *
     * @param delegate 감쌀 원본 핸들러
     * @param exceptionHandler 예외 처리기
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ResilientHandler(EventHandler<T> delegate, ExceptionHandler<T> exceptionHandler) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        if (exceptionHandler == null) {
            throw new IllegalArgumentException("exceptionHandler cannot be null");
        }
        this.delegate = delegate;
        this.exceptionHandler = exceptionHandler;
    }

    @Override
    public void handle(Object source, T args) {
        HandlerOutcome<T> outcome = HandlerOutcome.capture(delegate, source, args);
        if (outcome instanceof Faulted<T> faulted) {
            // capture()는 Exception만 캡처함
            exceptionHandler.handle(delegate, (Exception) faulted.error());
        }
    }

    /**
     * 원본 핸들러 조회.
     *
     * @return 감싸기 전의 핸들러
     */
    public EventHandler<T> getDelegate() {
        return delegate;
    }

    @Override
    public String toString() {
        return "ResilientHandler{" + delegate + '}';
    }
}
