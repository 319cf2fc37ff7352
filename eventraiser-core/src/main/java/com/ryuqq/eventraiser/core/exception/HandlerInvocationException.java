package com.ryuqq.eventraiser.core.exception;

/**
 * 리플렉션으로 바인딩된 핸들러 호출 실패.
 *
 * <p>checked 예외나 접근 실패처럼 {@code EventHandler} 형태로 그대로 전파할 수 없는 오류를 감쌉니다.
 * unchecked 예외와 Error는 감싸지 않고 그대로 전파됩니다.</p>
 *
 * @author EventRaiser Team
 * @since 1.0.0
 */
public class HandlerInvocationException extends RuntimeException {

    public HandlerInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
