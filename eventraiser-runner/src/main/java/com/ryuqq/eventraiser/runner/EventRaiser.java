package com.ryuqq.eventraiser.runner;

import com.ryuqq.eventraiser.core.handler.EventArgs;
import com.ryuqq.eventraiser.core.handler.EventHandler;
import com.ryuqq.eventraiser.core.handler.ExceptionHandler;
import com.ryuqq.eventraiser.core.handler.HandlerChain;
import com.ryuqq.eventraiser.core.handler.SimpleEventHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 이벤트 핸들러 데코레이터 및 실행기.
 *
 * <p>이미 구성된 핸들러 목록이 <em>어떻게</em> 실행될지를 결정합니다.
 * 언제 이벤트를 발생시킬지는 호출자가 결정합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>Resilient: 핸들러별 예외 격리</li>
 *   <li>Parallel: 핸들러별 병렬 실행 후 대기 (fan-out / fan-in)</li>
 *   <li>Async: 백그라운드 실행 후 즉시 반환</li>
 *   <li>raise: 호출 스레드에서 동기 실행</li>
 *   <li>raiseAsync: 백그라운드 실행 후 완료 핸들(CompletableFuture) 반환</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 모든 데코레이터는 입력을 변경하지 않고 새 핸들러를 반환합니다.
 * 인스턴스는 상태가 없으므로 thread-safe합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * EventRaiser raiser = new EventRaiser(new EventRaiserConfig().withExecutor(workerPool));
 *
 * EventHandler<OrderArgs> handlers = HandlerChain.combine(audit, notify, index);
 * EventHandler<OrderArgs> safeParallel = raiser.parallel(raiser.resilient(handlers));
 *
 * raiser.raise(safeParallel, this, new OrderArgs(orderId));
 * }</pre>
 *
 * @author EventRaiser Team
 * @since 1.0.0
 */
public final class EventRaiser {

    private final EventRaiserConfig config;

    /**
     * 생성자 (기본 설정).
     */
    public EventRaiser() {
        this(new EventRaiserConfig());
    }

    /**
     * 생성자 (설정 주입).
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public EventRaiser(EventRaiserConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    /**
     * 예외 격리 데코레이터 (예외 무시).
     *
     * <p>{@link Exception}만 격리합니다. {@link Error}는 그대로 전파되어 남은 핸들러가 실행되지 않습니다.</p>
     *
     * @param handler 핸들러 목록 (null 가능)
     * @param <T> 이벤트 데이터 타입
     * @return 예외를 격리하는 같은 길이의 핸들러 목록 (handler가 null이면 null)
     */
    public <T> EventHandler<T> resilient(EventHandler<T> handler) {
        return resilient(handler, ExceptionHandler.ignore());
    }

    /**
     * 예외 격리 데코레이터.
     *
     * <p>각 elementary 핸들러를 {@link ResilientHandler}로 감쌉니다. 결과 목록을 실행하면
     * 앞선 핸들러의 실패와 무관하게 모든 핸들러가 순서대로 한 번씩 실행되고,
     * 예외는 원본 핸들러와 함께 exceptionHandler로 전달됩니다.</p>
     *
     * <p>격리 대상은 {@link Exception}뿐입니다. {@link Error}({@code AssertionError},
     * {@code OutOfMemoryError} 등)는 exceptionHandler로 전달되지 않고 호출자에게 전파되며,
     * 목록의 나머지 핸들러는 실행되지 않습니다. 병렬 데코레이터는 이와 달리 Error도 수집합니다.</p>
     *
     * @param handler 핸들러 목록 (null 가능)
     * @param exceptionHandler 예외 처리기
     * @param <T> 이벤트 데이터 타입
     * @return 예외를 격리하는 같은 길이의 핸들러 목록 (handler가 null이면 null)
     * @throws IllegalArgumentException exceptionHandler가 null인 경우
     */
    public <T> EventHandler<T> resilient(EventHandler<T> handler, ExceptionHandler<T> exceptionHandler) {
        if (exceptionHandler == null) {
            throw new IllegalArgumentException("exceptionHandler cannot be null");
        }
        if (handler == null) {
            return null;
        }
        List<EventHandler<T>> entries = HandlerChain.invocationList(handler);
        List<EventHandler<T>> wrapped = new ArrayList<>(entries.size());
        for (EventHandler<T> entry : entries) {
            wrapped.add(new ResilientHandler<>(entry, exceptionHandler));
        }
        return HandlerChain.combine(wrapped);
    }

    /**
     * 병렬 실행 데코레이터.
     *
     * @param handler 핸들러 목록 (null 가능)
     * @param <T> 이벤트 데이터 타입
     * @return 모든 핸들러를 병렬 실행 후 대기하는 단일 핸들러 (handler가 null이면 null)
     * @see ParallelHandler
     */
    public <T> EventHandler<T> parallel(EventHandler<T> handler) {
        if (handler == null) {
            return null;
        }
        return new ParallelHandler<>(HandlerChain.invocationList(handler), config.executor());
    }

    /**
     * 비동기 실행 데코레이터 (기본 continuation).
     *
     * @param handler 핸들러 목록 (null 가능, 이 경우 no-op 작업 예약)
     * @param <T> 이벤트 데이터 타입
     * @return 백그라운드 실행을 예약하고 즉시 반환하는 핸들러
     * @see AsyncHandler
     */
    public <T> EventHandler<T> async(EventHandler<T> handler) {
        return async(handler, config.defaultContinuation());
    }

    /**
     * 비동기 실행 데코레이터.
     *
     * @param handler 핸들러 목록 (null 가능, 이 경우 no-op 작업 예약)
     * @param continuation 완료 continuation
     * @param <T> 이벤트 데이터 타입
     * @return 백그라운드 실행을 예약하고 즉시 반환하는 핸들러
     * @throws IllegalArgumentException continuation이 null인 경우
     */
    public <T> EventHandler<T> async(EventHandler<T> handler, Continuation continuation) {
        return new AsyncHandler<>(handler, config.executor(), continuation);
    }

    /**
     * 동기 실행.
     *
     * <p>호출 스레드에서 등록 순서대로 실행합니다. 첫 번째 예외에서 중단하고
     * 예외를 그대로 전파합니다 (Resilient로 감싼 경우 제외).</p>
     *
     * @param handler 핸들러 목록 (null이면 no-op)
     * @param source 이벤트 source
     * @param args 이벤트 데이터
     * @param <T> 이벤트 데이터 타입
     */
    public <T> void raise(EventHandler<T> handler, Object source, T args) {
        if (handler != null) {
            handler.handle(source, args);
        }
    }

    /**
     * 동기 실행 ({@link SimpleEventHandler}).
     *
     * @param handler 핸들러 (null이면 no-op)
     * @param source 이벤트 source
     * @param args 이벤트 데이터
     */
    public void raise(SimpleEventHandler handler, Object source, EventArgs args) {
        if (handler != null) {
            handler.handle(source, args);
        }
    }

    /**
     * 비동기 실행.
     *
     * <p>동기 raise를 Executor에 예약하고 완료 핸들을 반환합니다.
     * 기본 continuation을 붙이지 않으며 예외를 억제하지 않습니다.
     * 예외 처리는 반환된 핸들을 통해 호출자가 담당합니다.</p>
     *
     * @param handler 핸들러 목록 (null이면 no-op 작업)
     * @param source 이벤트 source
     * @param args 이벤트 데이터
     * @param <T> 이벤트 데이터 타입
     * @return 완료 핸들
     */
    public <T> CompletableFuture<Void> raiseAsync(EventHandler<T> handler, Object source, T args) {
        return CompletableFuture.runAsync(() -> raise(handler, source, args), config.executor());
    }

    /**
     * 설정 조회.
     *
     * @return 설정
     */
    public EventRaiserConfig getConfig() {
        return config;
    }
}
