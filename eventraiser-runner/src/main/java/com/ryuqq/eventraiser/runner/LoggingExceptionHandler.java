package com.ryuqq.eventraiser.runner;

import com.ryuqq.eventraiser.core.handler.EventHandler;
import com.ryuqq.eventraiser.core.handler.ExceptionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 예외를 WARN 로그로 남기는 ExceptionHandler.
 *
 * <p>{@link ExceptionHandler#ignore()} 대신 Resilient 데코레이터에 전달하면
 * 억제된 예외를 운영 로그에서 확인할 수 있습니다.</p>
 *
 * <pre>{@code
 * EventHandler<OrderArgs> safe = EventRaising.resilient(handlers, new LoggingExceptionHandler<>());
 * }</pre>
 *
 * @param <T> 이벤트 데이터 타입
 * @author EventRaiser Team
 * @since 1.0.0
 */
public final class LoggingExceptionHandler<T> implements ExceptionHandler<T> {

    private final Logger logger;

    /**
     * 생성자 (이 클래스의 Logger 사용).
     */
    public LoggingExceptionHandler() {
        this(LoggerFactory.getLogger(LoggingExceptionHandler.class));
    }

    /**
     * 생성자 (Logger 주입).
     *
     * @param logger 사용할 Logger
     * @throws IllegalArgumentException logger가 null인 경우
     */
    public LoggingExceptionHandler(Logger logger) {
        if (logger == null) {
            throw new IllegalArgumentException("logger cannot be null");
        }
        this.logger = logger;
    }

    @Override
    public void handle(EventHandler<T> handler, Exception error) {
        logger.warn("Event handler {} failed, continuing with remaining handlers", handler, error);
    }
}
