package com.ryuqq.eventraiser.runner;

import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * EventRaiser 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>executor: Parallel/Async/RaiseAsync 작업을 실행할 공유 Executor (기본 ForkJoinPool.commonPool())</li>
 *   <li>defaultContinuation: continuation 없이 async()를 호출할 때 사용할 continuation
 *       (기본 {@link Continuation#observeAndDiscard()})</li>
 * </ul>
 *
 * <p>Executor의 생명주기(shutdown)는 호출자가 관리합니다.</p>
 *
 * @author EventRaiser Team
 * @since 1.0.0
 * @param executor 공유 Executor (null 불가)
 * @param defaultContinuation 기본 continuation (null 불가)
 */
public record EventRaiserConfig(
    Executor executor,
    Continuation defaultContinuation
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: executor=ForkJoinPool.commonPool(), defaultContinuation=observeAndDiscard</p>
     */
    public EventRaiserConfig() {
        this(ForkJoinPool.commonPool(), Continuation.observeAndDiscard());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public EventRaiserConfig {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (defaultContinuation == null) {
            throw new IllegalArgumentException("defaultContinuation cannot be null");
        }
    }

    /**
     * executor만 변경한 새 인스턴스 생성.
     */
    public EventRaiserConfig withExecutor(Executor executor) {
        return new EventRaiserConfig(executor, defaultContinuation);
    }

    /**
     * defaultContinuation만 변경한 새 인스턴스 생성.
     */
    public EventRaiserConfig withDefaultContinuation(Continuation defaultContinuation) {
        return new EventRaiserConfig(executor, defaultContinuation);
    }
}
