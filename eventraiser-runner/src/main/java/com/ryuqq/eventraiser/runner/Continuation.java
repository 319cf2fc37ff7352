package com.ryuqq.eventraiser.runner;

/**
 * Async 데코레이터의 완료 continuation.
 *
 * <p>백그라운드 작업이 끝나면 (성공/실패 무관) 한 번 호출됩니다.</p>
 *
 * @author EventRaiser Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Continuation {

    /**
     * 백그라운드 작업 완료 처리.
     *
     * @param failure 발생한 예외 (성공 시 null)
     */
    void onCompletion(Throwable failure);

    /**
     * 예외를 observed 처리 후 버리는 기본 continuation.
     *
     * <p>백그라운드 예외가 처리되지 않은 채 사라지지 않도록 DEBUG 로그로만 남깁니다.</p>
     *
     * @return 기본 continuation
     */
    static Continuation observeAndDiscard() {
        return ObserveAndDiscardContinuation.INSTANCE;
    }
}
