package com.ryuqq.eventraiser.core.handler;

/**
 * 이벤트 데이터의 기반 타입.
 *
 * <p>구체적인 이벤트 데이터는 이 클래스를 상속합니다. 상위 타입을 받는 핸들러는
 * 하위 타입 이벤트에도 사용할 수 있으며, 이 관계는 어댑터가 검증합니다.</p>
 *
 * <p>추가 데이터가 없는 이벤트는 {@link #EMPTY}를 사용합니다.</p>
 *
 * @author EventRaiser Team
 * @since 1.0.0
 */
public class EventArgs {

    /**
     * 데이터가 없는 이벤트용 공유 인스턴스.
     */
    public static final EventArgs EMPTY = new EventArgs();

    protected EventArgs() {
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{}";
    }
}
