package com.ryuqq.eventraiser.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 기본 continuation 구현.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>성공: 아무 동작 안 함</li>
 *   <li>실패: 예외를 DEBUG 로그로 남기고 버림 (전파하지 않음)</li>
 * </ul>
 *
 * @author EventRaiser Team
 * @since 1.0.0
 */
final class ObserveAndDiscardContinuation implements Continuation {

    static final ObserveAndDiscardContinuation INSTANCE = new ObserveAndDiscardContinuation();

    private static final Logger log = LoggerFactory.getLogger(ObserveAndDiscardContinuation.class);

    private ObserveAndDiscardContinuation() {
    }

    @Override
    public void onCompletion(Throwable failure) {
        if (failure != null) {
            log.debug("Discarding observed fault of background event handler", failure);
        }
    }

    @Override
    public String toString() {
        return "Continuation{observeAndDiscard}";
    }
}
