package com.ryuqq.eventraiser.core.handler;

/**
 * Resilient 데코레이터가 사용하는 예외 처리기.
 *
 * <p>개별 핸들러 실행 중 발생한 예외를 전파하는 대신 이 처리기로 전달합니다.
 * 전달되는 핸들러는 래핑되기 전의 원본 핸들러입니다.</p>
 *
 * @param <T> 이벤트 데이터 타입
 * @author EventRaiser Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ExceptionHandler<T> {

    /**
     * 예외 처리.
     *
     * @param handler 예외를 발생시킨 원본 핸들러
     * @param error 발생한 예외
     */
    void handle(EventHandler<T> handler, Exception error);

    /**
     * 예외를 무시하는 기본 처리기.
     *
     * @param <T> 이벤트 데이터 타입
     * @return NoOp ExceptionHandler
     */
    static <T> ExceptionHandler<T> ignore() {
        return (handler, error) -> {
            // NoOp
        };
    }
}
