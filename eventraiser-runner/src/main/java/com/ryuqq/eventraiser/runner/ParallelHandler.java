package com.ryuqq.eventraiser.runner;

import com.ryuqq.eventraiser.core.exception.AggregateHandlerException;
import com.ryuqq.eventraiser.core.handler.EventHandler;
import com.ryuqq.eventraiser.core.outcome.Faulted;
import com.ryuqq.eventraiser.core.outcome.HandlerOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * 병렬 실행 핸들러 (Parallel 데코레이터).
 *
 * <p>호출 시 각 elementary 핸들러를 독립된 작업으로 Executor에 제출하고,
 * 모든 작업이 끝날 때까지 호출 스레드를 블로킹합니다 (fan-out / fan-in).</p>
 *
 * <p><strong>실패 처리:</strong></p>
 * <ul>
 *   <li>예외를 격리하지 않음: 하나 이상 실패하면 {@link AggregateHandlerException}을 던짐</li>
 *   <li>fail-fast 아님: 모든 작업이 끝난 뒤 예외를 모아서 던짐</li>
 *   <li>개별 예외를 억제하려면 먼저 Resilient 데코레이터를 적용</li>
 * </ul>
 *
 * <p><strong>순서:</strong> 핸들러 간 실행 순서와 happens-before 관계는 보장하지 않습니다.</p>
 *
 * @param <T> 이벤트 데이터 타입
 * @author EventRaiser Team
 * @since 1.0.0
 */
public final class ParallelHandler<T> implements EventHandler<T> {

    private static final Logger log = LoggerFactory.getLogger(ParallelHandler.class);

    private final List<EventHandler<T>> handlers;
    private final Executor executor;

    /**
     * 생성자.
     *
     * @param handlers 병렬 실행할 elementary 핸들러 목록 (1개 이상)
     * @param executor 작업을 실행할 Executor
     * @throws IllegalArgumentException handlers가 null/비어있거나 executor가 null인 경우
     */
    public ParallelHandler(List<EventHandler<T>> handlers, Executor executor) {
        if (handlers == null || handlers.isEmpty()) {
            throw new IllegalArgumentException("handlers cannot be null or empty");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.handlers = Collections.unmodifiableList(new ArrayList<>(handlers));
        this.executor = executor;
    }

    @Override
    public void handle(Object source, T args) {
        log.debug("Dispatching {} event handlers in parallel", handlers.size());

        // 1. Fan-out: 핸들러별 독립 작업 제출
        List<CompletableFuture<HandlerOutcome<T>>> units = new ArrayList<>(handlers.size());
        for (EventHandler<T> handler : handlers) {
            units.add(CompletableFuture.supplyAsync(() -> HandlerOutcome.capture(handler, source, args), executor));
        }

        // 2. Fan-in: 모든 작업 완료 대기 후 실패 수집
        List<Throwable> faults = new ArrayList<>();
        for (int i = 0; i < units.size(); i++) {
            HandlerOutcome<T> outcome = await(units.get(i), handlers.get(i));
            if (outcome instanceof Faulted<T> faulted) {
                faults.add(faulted.error());
            }
        }

        if (!faults.isEmpty()) {
            throw new AggregateHandlerException(faults);
        }
    }

    /**
     * 작업 완료 대기.
     *
     * <p>capture()가 잡지 못한 Error로 작업이 실패한 경우에도 Faulted로 변환합니다.</p>
     */
    private HandlerOutcome<T> await(CompletableFuture<HandlerOutcome<T>> unit, EventHandler<T> handler) {
        try {
            return unit.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return new Faulted<>(handler, cause);
        }
    }

    /**
     * 병렬 실행 대상 핸들러 목록.
     *
     * @return 변경 불가능한 목록
     */
    public List<EventHandler<T>> getHandlers() {
        return handlers;
    }

    @Override
    public String toString() {
        return "ParallelHandler{size=" + handlers.size() + '}';
    }
}
