package com.ryuqq.eventraiser.core.handler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Multicast 이벤트 핸들러 (Callback List).
 *
 * <p>두 개 이상의 elementary 핸들러를 등록 순서대로 보관하는 불변 목록입니다.
 * 호출 시 모든 핸들러를 순서대로 실행하며, 첫 번째 예외에서 중단하고 예외를 그대로 전파합니다.</p>
 *
 * <p><strong>불변 조건:</strong></p>
 * <ul>
 *   <li>항상 2개 이상의 elementary 핸들러를 보관 (빈 체인 없음, "콜백 없음"은 {@code null})</li>
 *   <li>중첩된 HandlerChain 없음 (결합 시 평탄화)</li>
 *   <li>순서 보존, 중복 허용</li>
 *   <li>생성 후 변경 불가 (thread-safe)</li>
 * </ul>
 *
 * <p><strong>결합 규칙:</strong></p>
 * <pre>
 * combine(null, null) = null
 * combine(a, null)    = a
 * combine(null, b)    = b
 * combine(a, b)       = [a의 invocation list..., b의 invocation list...]
 * </pre>
 *
 * @param <T> 이벤트 데이터 타입
 * @author EventRaiser Team
 * @since 1.0.0
 */
public final class HandlerChain<T> implements EventHandler<T> {

    private final List<EventHandler<T>> handlers;

    private HandlerChain(List<EventHandler<T>> handlers) {
        if (handlers.size() < 2) {
            throw new IllegalArgumentException("HandlerChain requires at least 2 handlers (current: " + handlers.size() + ")");
        }
        this.handlers = Collections.unmodifiableList(new ArrayList<>(handlers));
    }

    /**
     * 두 핸들러 결합.
     *
     * @param first 앞쪽 핸들러 (null 가능)
     * @param second 뒤쪽 핸들러 (null 가능)
     * @param <T> 이벤트 데이터 타입
     * @return 결합된 핸들러 (둘 다 null이면 null)
     */
    public static <T> EventHandler<T> combine(EventHandler<T> first, EventHandler<T> second) {
        if (first == null) {
            return second;
        }
        if (second == null) {
            return first;
        }
        List<EventHandler<T>> combined = new ArrayList<>(invocationList(first));
        combined.addAll(invocationList(second));
        return new HandlerChain<>(combined);
    }

    /**
     * 여러 핸들러 결합 (가변 인자).
     *
     * @param handlers 결합할 핸들러들 (null 항목 허용)
     * @param <T> 이벤트 데이터 타입
     * @return 결합된 핸들러 (결합할 항목이 없으면 null)
     */
    @SafeVarargs
    public static <T> EventHandler<T> combine(EventHandler<T>... handlers) {
        if (handlers == null) {
            return null;
        }
        List<EventHandler<T>> sequence = new ArrayList<>(handlers.length);
        Collections.addAll(sequence, handlers);
        return combine(sequence);
    }

    /**
     * 핸들러 시퀀스 결합.
     *
     * <p>null 항목은 건너뛰고, 나머지 항목의 invocation list를 순회 순서대로 이어 붙입니다.</p>
     *
     * @param handlers 결합할 핸들러 시퀀스 (null 항목 허용)
     * @param <T> 이벤트 데이터 타입
     * @return 결합된 핸들러 (결합할 항목이 없으면 null, 항목이 하나면 그 항목)
     */
    public static <T> EventHandler<T> combine(Iterable<? extends EventHandler<T>> handlers) {
        if (handlers == null) {
            return null;
        }
        List<EventHandler<T>> entries = new ArrayList<>();
        for (EventHandler<T> handler : handlers) {
            entries.addAll(invocationList(handler));
        }
        if (entries.isEmpty()) {
            return null;
        }
        if (entries.size() == 1) {
            return entries.get(0);
        }
        return new HandlerChain<>(entries);
    }

    /**
     * Invocation list 조회.
     *
     * @param handler 핸들러 (null 가능)
     * @param <T> 이벤트 데이터 타입
     * @return null이면 빈 목록, HandlerChain이면 보관 중인 목록, 그 외에는 단일 항목 목록
     */
    public static <T> List<EventHandler<T>> invocationList(EventHandler<T> handler) {
        if (handler == null) {
            return List.of();
        }
        if (handler instanceof HandlerChain<T> chain) {
            return chain.handlers;
        }
        return List.of(handler);
    }

    /**
     * 보관 중인 elementary 핸들러 목록.
     *
     * @return 변경 불가능한 목록 (크기 2 이상)
     */
    public List<EventHandler<T>> getInvocationList() {
        return handlers;
    }

    @Override
    public void handle(Object source, T args) {
        for (EventHandler<T> handler : handlers) {
            handler.handle(source, args);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HandlerChain<?> that = (HandlerChain<?>) o;
        return handlers.equals(that.handlers);
    }

    @Override
    public int hashCode() {
        return handlers.hashCode();
    }

    @Override
    public String toString() {
        return "HandlerChain{size=" + handlers.size() + ", handlers=" + handlers + '}';
    }
}
