package com.ryuqq.eventraiser.runner;

import com.ryuqq.eventraiser.core.adapter.HandlerAdapter;
import com.ryuqq.eventraiser.core.handler.EventArgs;
import com.ryuqq.eventraiser.core.handler.EventHandler;
import com.ryuqq.eventraiser.core.handler.ExceptionHandler;
import com.ryuqq.eventraiser.core.handler.HandlerChain;
import com.ryuqq.eventraiser.core.handler.SimpleEventHandler;

import java.lang.reflect.Method;
import java.util.concurrent.CompletableFuture;

/**
 * EventRaiser 정적 진입점.
 *
 * <p>어댑터, 결합, 데코레이터, 실행 연산을 한 곳에서 제공합니다.
 * 데코레이터와 실행 연산은 기본 설정({@link EventRaiserConfig#EventRaiserConfig()})의
 * {@link EventRaiser}에 위임합니다. 다른 Executor가 필요하면 {@link EventRaiser}를 직접 생성하세요.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * EventHandler<PropertyChangedArgs> handler = EventRaising.toHandlerOf(legacyListener, PropertyChangedArgs.class);
 * EventRaising.raise(EventRaising.resilient(handler), this, new PropertyChangedArgs("name"));
 * }</pre>
 *
 * @author EventRaiser Team
 * @since 1.0.0
 */
public final class EventRaising {

    private static final EventRaiser DEFAULT = new EventRaiser();

    private EventRaising() {
    }

    // ============================================================
    // Adapter
    // ============================================================

    /**
     * @see HandlerAdapter#adapt(Object, Class)
     */
    public static <T> EventHandler<T> toHandlerOf(Object handler, Class<T> argsType) {
        return HandlerAdapter.adapt(handler, argsType);
    }

    /**
     * @see HandlerAdapter#adaptContravariant(EventHandler, Class)
     */
    public static <S, T extends S> EventHandler<T> adaptContravariant(EventHandler<S> handler, Class<T> argsType) {
        return HandlerAdapter.adaptContravariant(handler, argsType);
    }

    /**
     * @see HandlerAdapter#toGeneric(SimpleEventHandler)
     */
    public static EventHandler<EventArgs> toGeneric(SimpleEventHandler handler) {
        return HandlerAdapter.toGeneric(handler);
    }

    /**
     * @see HandlerAdapter#fromMethod(Object, Method, Class)
     */
    public static <T> EventHandler<T> fromMethod(Object target, Method method, Class<T> argsType) {
        return HandlerAdapter.fromMethod(target, method, argsType);
    }

    // ============================================================
    // Combiner
    // ============================================================

    /**
     * @see HandlerChain#combine(EventHandler, EventHandler)
     */
    public static <T> EventHandler<T> combine(EventHandler<T> first, EventHandler<T> second) {
        return HandlerChain.combine(first, second);
    }

    /**
     * @see HandlerChain#combine(EventHandler[])
     */
    @SafeVarargs
    public static <T> EventHandler<T> combine(EventHandler<T>... handlers) {
        return HandlerChain.combine(handlers);
    }

    /**
     * @see HandlerChain#combine(Iterable)
     */
    public static <T> EventHandler<T> combine(Iterable<? extends EventHandler<T>> handlers) {
        return HandlerChain.combine(handlers);
    }

    // ============================================================
    // Decorators
    // ============================================================

    public static <T> EventHandler<T> resilient(EventHandler<T> handler) {
        return DEFAULT.resilient(handler);
    }

    public static <T> EventHandler<T> resilient(EventHandler<T> handler, ExceptionHandler<T> exceptionHandler) {
        return DEFAULT.resilient(handler, exceptionHandler);
    }

    public static <T> EventHandler<T> parallel(EventHandler<T> handler) {
        return DEFAULT.parallel(handler);
    }

    public static <T> EventHandler<T> async(EventHandler<T> handler) {
        return DEFAULT.async(handler);
    }

    public static <T> EventHandler<T> async(EventHandler<T> handler, Continuation continuation) {
        return DEFAULT.async(handler, continuation);
    }

    // ============================================================
    // Raise
    // ============================================================

    public static <T> void raise(EventHandler<T> handler, Object source, T args) {
        DEFAULT.raise(handler, source, args);
    }

    public static void raise(SimpleEventHandler handler, Object source, EventArgs args) {
        DEFAULT.raise(handler, source, args);
    }

    public static <T> CompletableFuture<Void> raiseAsync(EventHandler<T> handler, Object source, T args) {
        return DEFAULT.raiseAsync(handler, source, args);
    }
}
