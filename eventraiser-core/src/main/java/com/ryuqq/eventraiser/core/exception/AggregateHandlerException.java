package com.ryuqq.eventraiser.core.exception;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 병렬 실행된 핸들러들의 예외 집합.
 *
 * <p>Parallel 데코레이터는 모든 핸들러 실행이 끝난 뒤, 하나 이상 실패한 경우 이 예외를 던집니다.
 * 개별 예외는 {@link #getFaults()}와 suppressed 예외로 모두 제공됩니다.</p>
 *
 * @author EventRaiser Team
 * @since 1.0.0
 */
public class AggregateHandlerException extends RuntimeException {

    private final List<Throwable> faults;

    /**
     * 생성자.
     *
     * @param faults 개별 핸들러 예외 목록 (1개 이상)
     * @throws IllegalArgumentException faults가 null이거나 비어있는 경우
     */
    public AggregateHandlerException(List<? extends Throwable> faults) {
        super(buildMessage(faults), firstOf(faults));
        this.faults = Collections.unmodifiableList(new ArrayList<>(faults));
        for (Throwable fault : this.faults) {
            addSuppressed(fault);
        }
    }

    private static String buildMessage(List<? extends Throwable> faults) {
        if (faults == null || faults.isEmpty()) {
            throw new IllegalArgumentException("faults cannot be null or empty");
        }
        return faults.size() + " of the event handlers failed";
    }

    private static Throwable firstOf(List<? extends Throwable> faults) {
        return faults.get(0);
    }

    /**
     * 개별 핸들러 예외 목록.
     *
     * @return 변경 불가능한 예외 목록 (핸들러 순서)
     */
    public List<Throwable> getFaults() {
        return faults;
    }
}
