package com.ryuqq.eventraiser.runner;

import com.ryuqq.eventraiser.core.handler.EventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * 비동기 실행 핸들러 (Async 데코레이터).
 *
 * <p>호출 시 원본 핸들러 목록의 실행을 Executor에 예약하고 즉시 반환합니다.
 * 작업이 끝나면 (성공/실패 무관) {@link Continuation}이 한 번 호출됩니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * handle(source, args)
 *   ↓ runAsync (즉시 반환)
 * delegate.handle(source, args)   // null이면 no-op
 *   ↓ whenComplete
 * continuation.onCompletion(failure 또는 null)
 * </pre>
 *
 * @param <T> 이벤트 데이터 타입
 * @author EventRaiser Team
 * @since 1.0.0
 */
public final class AsyncHandler<T> implements EventHandler<T> {

    private static final Logger log = LoggerFactory.getLogger(AsyncHandler.class);

    private final EventHandler<T> delegate;
    private final Executor executor;
    private final Continuation continuation;

    /**
     * 생성자.
     *
     * @param delegate 백그라운드에서 실행할 핸들러 (null 가능, 이 경우 no-op 작업)
     * @param executor 작업을 실행할 Executor
     * @param continuation 완료 continuation
     * @throws IllegalArgumentException executor 또는 continuation이 null인 경우
     */
    public AsyncHandler(EventHandler<T> delegate, Executor executor, Continuation continuation) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (continuation == null) {
            throw new IllegalArgumentException("continuation cannot be null");
        }
        this.delegate = delegate;
        this.executor = executor;
        this.continuation = continuation;
    }

    @Override
    public void handle(Object source, T args) {
        log.debug("Scheduling event handler {} in background", delegate);
        CompletableFuture.runAsync(() -> {
            if (delegate != null) {
                delegate.handle(source, args);
            }
        }, executor).whenComplete((ignored, failure) -> complete(unwrap(failure)));
    }

    private void complete(Throwable failure) {
        try {
            continuation.onCompletion(failure);
        } catch (RuntimeException e) {
            log.warn("Continuation {} failed for background event handler {}", continuation, delegate, e);
        }
    }

    private static Throwable unwrap(Throwable failure) {
        if (failure instanceof CompletionException && failure.getCause() != null) {
            return failure.getCause();
        }
        return failure;
    }

    /**
     * 원본 핸들러 조회.
     *
     * @return 원본 핸들러 (null 가능)
     */
    public EventHandler<T> getDelegate() {
        return delegate;
    }

    @Override
    public String toString() {
        return "AsyncHandler{" + delegate + '}';
    }
}
